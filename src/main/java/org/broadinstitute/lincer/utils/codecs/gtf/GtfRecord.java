package org.broadinstitute.lincer.utils.codecs.gtf;

import com.google.common.base.Splitter;
import htsjdk.samtools.util.Locatable;
import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.utils.Utils;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * One line of a GTF annotation file.
 * <p>
 * The first eight columns are kept as they appear in the file, so that they can be written back untouched.
 * The ninth column is parsed into {@link GtfAttributes}.
 * Coordinates are 1-based and inclusive.
 * </p>
 */
public final class GtfRecord implements Locatable {

    public static final char FIELD_DELIMITER = '\t';
    public static final String COMMENT_START = "#";
    public static final int NUM_COLUMNS = 9;

    public static final String GENE_ID = "gene_id";
    public static final String TRANSCRIPT_ID = "transcript_id";
    public static final String GENE_NAME = "gene_name";
    public static final String COVERAGE = "cov";

    private static final Splitter FIELD_SPLITTER = Splitter.on(FIELD_DELIMITER).limit(NUM_COLUMNS);

    private static final int CONTIG_COLUMN = 0;
    private static final int FEATURE_COLUMN = 2;
    private static final int START_COLUMN = 3;
    private static final int END_COLUMN = 4;
    private static final int STRAND_COLUMN = 6;
    private static final int ATTRIBUTE_COLUMN = 8;

    private final List<String> columns;
    private final GtfFeatureType featureType;
    private final int start;
    private final int end;
    private final GtfAttributes attributes;
    private final String line;
    private final Path source;
    private final long lineNumber;

    private GtfRecord(final List<String> columns, final GtfFeatureType featureType, final int start, final int end,
                      final GtfAttributes attributes, final String line, final Path source, final long lineNumber) {
        this.columns = columns;
        this.featureType = featureType;
        this.start = start;
        this.end = end;
        this.attributes = attributes;
        this.line = line;
        this.source = source;
        this.lineNumber = lineNumber;
    }

    /**
     * Decodes one GTF line, without its line terminator.
     *
     * @param line the text of the line; must not be a comment or blank line.
     * @param source file the line comes from, for error messages; may be {@code null}.
     * @param lineNumber 1-based line number in {@code source}, for error messages.
     * @throws UserException.MalformedFile if the line has fewer than nine columns, or non-integer or inverted coordinates.
     */
    public static GtfRecord decode(final String line, final Path source, final long lineNumber) {
        Utils.nonNull(line, "line");
        final List<String> columns = FIELD_SPLITTER.splitToList(line);
        if (columns.size() < NUM_COLUMNS) {
            throw malformed(source, lineNumber, String.format("expected %d tab separated columns but found %d", NUM_COLUMNS, columns.size()));
        }
        final int start = parseCoordinate(columns.get(START_COLUMN), "start", source, lineNumber);
        final int end = parseCoordinate(columns.get(END_COLUMN), "end", source, lineNumber);
        if (end < start) {
            throw malformed(source, lineNumber, String.format("end (%d) is before start (%d)", end, start));
        }
        final GtfAttributes attributes;
        try {
            attributes = GtfAttributes.parse(columns.get(ATTRIBUTE_COLUMN));
        } catch (final IllegalArgumentException e) {
            throw malformed(source, lineNumber, e.getMessage());
        }
        return new GtfRecord(Collections.unmodifiableList(columns),
                GtfFeatureType.fromFeatureName(columns.get(FEATURE_COLUMN)),
                start, end, attributes, line, source, lineNumber);
    }

    private static int parseCoordinate(final String value, final String name, final Path source, final long lineNumber) {
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw malformed(source, lineNumber, String.format("%s coordinate is not an integer: '%s'", name, value));
        }
    }

    private static UserException.MalformedFile malformed(final Path source, final long lineNumber, final String message) {
        return source == null
                ? new UserException.MalformedFile(String.format("line %d: %s", lineNumber, message))
                : new UserException.MalformedFile(source, lineNumber, message);
    }

    /**
     * @return {@code true} for lines that carry no record: empty lines and comments.
     */
    public static boolean isSkippable(final String line) {
        return line.trim().isEmpty() || line.startsWith(COMMENT_START);
    }

    @Override
    public String getContig() {
        return columns.get(CONTIG_COLUMN);
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    public GtfFeatureType getFeatureType() {
        return featureType;
    }

    public boolean isExon() {
        return featureType == GtfFeatureType.EXON;
    }

    public String getStrand() {
        return columns.get(STRAND_COLUMN);
    }

    /**
     * @return the first eight columns exactly as they appear in the line.
     */
    public List<String> getLeadingColumns() {
        return columns.subList(0, ATTRIBUTE_COLUMN);
    }

    public String getAttributeText() {
        return columns.get(ATTRIBUTE_COLUMN);
    }

    public GtfAttributes getAttributes() {
        return attributes;
    }

    /**
     * @return the value of {@code key}, or {@code null} if the line does not have it.
     */
    public String getAttribute(final String key) {
        return attributes.get(key);
    }

    /**
     * @return the value of {@code key}.
     * @throws UserException.MalformedFile if the line does not have it.
     */
    public String getRequiredAttribute(final String key) {
        final String value = attributes.get(key);
        if (value == null) {
            throw malformed(source, lineNumber, String.format("missing attribute '%s'", key));
        }
        return value;
    }

    public String getGeneId() {
        return getRequiredAttribute(GENE_ID);
    }

    public String getTranscriptId() {
        return getRequiredAttribute(TRANSCRIPT_ID);
    }

    /**
     * @return the {@value #COVERAGE} attribute of the line, as assemblers such as Cufflinks write on exons.
     * @throws UserException.MalformedFile if the attribute is missing or not a number.
     */
    public double getCoverage() {
        final String value = getRequiredAttribute(COVERAGE);
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException e) {
            throw malformed(source, lineNumber, String.format("attribute '%s' is not a number: '%s'", COVERAGE, value));
        }
    }

    /**
     * @return the line this record was decoded from, without line terminator.
     */
    public String getLine() {
        return line;
    }

    public Path getSource() {
        return source;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    @Override
    public String toString() {
        return line;
    }
}
