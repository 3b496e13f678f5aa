package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.tsv.DataLine;
import org.broadinstitute.lincer.utils.tsv.TableColumnCollection;
import org.broadinstitute.lincer.utils.tsv.TableWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the classification of the novel transcripts: their class codes and matched references against the full
 * reference ({@value #ALL_SUFFIX} columns) and against the known lncRNAs ({@value #LNC_SUFFIX} columns), and their class.
 */
public final class ClassificationTableWriter extends TableWriter<ClassificationRecord> {

    public static final String ALL_SUFFIX = "__all";
    public static final String LNC_SUFFIX = "__lnc";

    public static final String TRANSCRIPT_ID_COLUMN = "transcript_id";
    public static final String CLASS_CODE_ALL_COLUMN = TmapTableReader.CLASS_CODE_COLUMN + ALL_SUFFIX;
    public static final String REF_ID_ALL_COLUMN = TmapTableReader.REF_ID_COLUMN + ALL_SUFFIX;
    public static final String REF_GENE_ID_ALL_COLUMN = TmapTableReader.REF_GENE_ID_COLUMN + ALL_SUFFIX;
    public static final String CLASS_CODE_LNC_COLUMN = TmapTableReader.CLASS_CODE_COLUMN + LNC_SUFFIX;
    public static final String REF_ID_LNC_COLUMN = TmapTableReader.REF_ID_COLUMN + LNC_SUFFIX;
    public static final String REF_GENE_ID_LNC_COLUMN = TmapTableReader.REF_GENE_ID_COLUMN + LNC_SUFFIX;
    public static final String CLASSIFICATION_COLUMN = "classification";

    public static final TableColumnCollection COLUMNS = new TableColumnCollection(
            TRANSCRIPT_ID_COLUMN,
            CLASS_CODE_ALL_COLUMN, REF_ID_ALL_COLUMN, REF_GENE_ID_ALL_COLUMN,
            CLASS_CODE_LNC_COLUMN, REF_ID_LNC_COLUMN, REF_GENE_ID_LNC_COLUMN,
            CLASSIFICATION_COLUMN);

    public ClassificationTableWriter(final Path path) throws IOException {
        super(path, COLUMNS);
    }

    @Override
    protected void composeLine(final ClassificationRecord record, final DataLine dataLine) {
        final ComparisonRecord all = record.getAgainstReference();
        dataLine.set(TRANSCRIPT_ID_COLUMN, record.getTranscriptId())
                .set(CLASS_CODE_ALL_COLUMN, all.getClassCodeText())
                .set(REF_ID_ALL_COLUMN, TmapTableReader.formatRefId(all.getRefId()))
                .set(REF_GENE_ID_ALL_COLUMN, TmapTableReader.formatRefId(all.getRefGeneId()))
                .set(CLASSIFICATION_COLUMN, record.getTranscriptClass().getLabel());
        final ComparisonRecord lnc = record.getAgainstKnownLncRnas();
        if (lnc == null) {
            dataLine.set(CLASS_CODE_LNC_COLUMN, "").set(REF_ID_LNC_COLUMN, "").set(REF_GENE_ID_LNC_COLUMN, "");
        } else {
            dataLine.set(CLASS_CODE_LNC_COLUMN, lnc.getClassCodeText())
                    .set(REF_ID_LNC_COLUMN, TmapTableReader.formatRefId(lnc.getRefId()))
                    .set(REF_GENE_ID_LNC_COLUMN, TmapTableReader.formatRefId(lnc.getRefGeneId()));
        }
    }
}
