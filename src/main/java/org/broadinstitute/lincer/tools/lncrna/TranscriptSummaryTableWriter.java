package org.broadinstitute.lincer.tools.lncrna;

import org.broadinstitute.lincer.utils.tsv.DataLine;
import org.broadinstitute.lincer.utils.tsv.TableColumnCollection;
import org.broadinstitute.lincer.utils.tsv.TableWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the per-sample summary table: the statistics of every transcript with its class code and matched
 * reference ids, before any filtering.
 * Comparison columns are empty for transcripts without a comparison, and reference ids are
 * {@value TmapTableReader#ABSENT_VALUE} when the comparison has none.
 */
public final class TranscriptSummaryTableWriter extends TableWriter<TranscriptCandidate> {

    public static final String TRANSCRIPT_ID_COLUMN = "transcript_id";
    public static final String LENGTH_COLUMN = "length";
    public static final String EXONS_COLUMN = "exons";
    public static final String COVERAGE_COLUMN = "coverage";
    public static final String CLASS_CODE_COLUMN = "class_code";
    public static final String REF_ID_COLUMN = "ref_id";
    public static final String REF_GENE_ID_COLUMN = "ref_gene_id";

    public static final TableColumnCollection COLUMNS = new TableColumnCollection(
            TRANSCRIPT_ID_COLUMN, LENGTH_COLUMN, EXONS_COLUMN, COVERAGE_COLUMN, CLASS_CODE_COLUMN, REF_ID_COLUMN, REF_GENE_ID_COLUMN);

    public TranscriptSummaryTableWriter(final Path path) throws IOException {
        super(path, COLUMNS);
    }

    @Override
    protected void composeLine(final TranscriptCandidate candidate, final DataLine dataLine) {
        final TranscriptSummary summary = candidate.getSummary();
        dataLine.set(TRANSCRIPT_ID_COLUMN, candidate.getTranscriptId())
                .set(LENGTH_COLUMN, summary.getLength())
                .set(EXONS_COLUMN, summary.getExonCount())
                .set(COVERAGE_COLUMN, summary.getCoverage());
        final ComparisonRecord comparison = candidate.getComparison();
        if (comparison == null) {
            dataLine.set(CLASS_CODE_COLUMN, "").set(REF_ID_COLUMN, "").set(REF_GENE_ID_COLUMN, "");
        } else {
            dataLine.set(CLASS_CODE_COLUMN, comparison.getClassCodeText())
                    .set(REF_ID_COLUMN, TmapTableReader.formatRefId(comparison.getRefId()))
                    .set(REF_GENE_ID_COLUMN, TmapTableReader.formatRefId(comparison.getRefGeneId()));
        }
    }
}
