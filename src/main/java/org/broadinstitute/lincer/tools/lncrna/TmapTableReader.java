package org.broadinstitute.lincer.tools.lncrna;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.lincer.utils.tsv.DataLine;
import org.broadinstitute.lincer.utils.tsv.TableColumnCollection;
import org.broadinstitute.lincer.utils.tsv.TableReader;
import org.broadinstitute.lincer.utils.tsv.TableUtils;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the {@code .tmap} table written by the transcript comparator, which has one row per query transcript.
 * Only the query transcript id and the class code, reference transcript and reference gene columns are used;
 * {@value #ABSENT_VALUE} in the reference columns means there is no matched reference. A class code lincer does not
 * know is read as {@link ClassCode#UNKNOWN}, with a warning.
 */
public final class TmapTableReader extends TableReader<ComparisonRecord> {
    private static final Logger logger = LogManager.getLogger(TmapTableReader.class);

    public static final String QUERY_ID_COLUMN = "cuff_id";
    public static final String CLASS_CODE_COLUMN = "class_code";
    public static final String REF_ID_COLUMN = "ref_id";
    public static final String REF_GENE_ID_COLUMN = "ref_gene_id";

    public static final String ABSENT_VALUE = "-";

    public static final TableColumnCollection MANDATORY_COLUMNS =
            new TableColumnCollection(REF_GENE_ID_COLUMN, REF_ID_COLUMN, CLASS_CODE_COLUMN, QUERY_ID_COLUMN);

    public TmapTableReader(final Path path) throws IOException {
        super(path);
    }

    @Override
    protected void processColumns(final TableColumnCollection tableColumns) {
        TableUtils.checkMandatoryColumns(tableColumns, MANDATORY_COLUMNS, this::formatException);
    }

    @Override
    protected ComparisonRecord createRecord(final DataLine dataLine) {
        final String classCodeText = dataLine.get(CLASS_CODE_COLUMN).trim();
        final ClassCode classCode;
        try {
            classCode = ClassCode.fromComparatorCode(classCodeText);
        } catch (final IllegalArgumentException e) {
            throw formatException(e.getMessage());
        }
        if (classCode == ClassCode.UNKNOWN) {
            logger.warn(String.format("Unknown class code '%s' for %s in %s", classCodeText, dataLine.get(QUERY_ID_COLUMN), getSource()));
        }
        return new ComparisonRecord(dataLine.get(QUERY_ID_COLUMN), classCode, classCodeText,
                absentToNull(dataLine.get(REF_ID_COLUMN)), absentToNull(dataLine.get(REF_GENE_ID_COLUMN)));
    }

    private static String absentToNull(final String value) {
        return value.isEmpty() || ABSENT_VALUE.equals(value) ? null : value;
    }

    /**
     * @return {@code refId} as the comparator writes it, i.e. {@value #ABSENT_VALUE} for {@code null}
     */
    public static String formatRefId(final String refId) {
        return refId == null ? ABSENT_VALUE : refId;
    }
}
