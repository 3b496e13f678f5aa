package org.broadinstitute.lincer.utils.tsv;

import com.opencsv.CSVReader;
import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.utils.Utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the records of a tab-separated table.
 * <p>
 * Blank lines and lines starting with {@link TableUtils#COMMENT_PREFIX} are skipped. The columns come from the first
 * other line, or from the constructor for a headerless table such as a sample sheet. Subclasses turn each row into a
 * record in {@link #createRecord(DataLine)} and may check the columns in {@link #processColumns}.
 * </p>
 *
 * @param <R> the record type
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    // for error messages, may be null
    private final String source;

    private final LineNumberReader lineReader;

    private final CSVReader csvReader;

    private TableColumnCollection columns;

    // a record read ahead by the iterator, or null at the end
    private R lookAhead;

    private boolean lookAheadPending = false;

    public TableReader(final Path path) throws IOException {
        this(path.toString(), Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    public TableReader(final Path path, final TableColumnCollection columns) throws IOException {
        this(path.toString(), Files.newBufferedReader(path, StandardCharsets.UTF_8), columns);
    }

    protected TableReader(final String source, final Reader reader) throws IOException {
        this(source, reader, null);
    }

    /**
     * @param columns the columns of a headerless table, or {@code null} to take them from the header line
     */
    protected TableReader(final String source, final Reader reader, final TableColumnCollection columns) throws IOException {
        Utils.nonNull(reader, "reader");
        this.source = source;
        this.lineReader = new LineNumberReader(reader);
        this.csvReader = new CSVReader(lineReader, TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
        this.columns = columns != null ? columns : readHeader();
        processColumns(this.columns);
    }

    private TableColumnCollection readHeader() throws IOException {
        final String[] header = nextDataRow();
        if (header == null) {
            throw formatException("premature end of table: header line not found");
        }
        return new TableColumnCollection(TableColumnCollection.checkNames(header, this::formatException));
    }

    private String[] nextDataRow() throws IOException {
        String[] row;
        do {
            row = csvReader.readNext();
        } while (row != null && isSkipped(row));
        return row;
    }

    private static boolean isSkipped(final String[] row) {
        return row.length == 0
                || row[0].startsWith(TableUtils.COMMENT_PREFIX)
                || (row.length == 1 && row[0].trim().isEmpty());
    }

    /**
     * @return an exception naming the source and the current line
     */
    protected final UserException.MalformedFile formatException(final String message) {
        return source == null
                ? new UserException.MalformedFile(String.format("line %d: %s", lineReader.getLineNumber(), message))
                : new UserException.MalformedFile(Path.of(source), lineReader.getLineNumber(), message);
    }

    /**
     * Called once with the columns, before any record is read.
     */
    protected void processColumns(final TableColumnCollection tableColumns) {}

    public TableColumnCollection columns() {
        return columns;
    }

    /**
     * @return the next record, or {@code null} at the end of the table
     */
    public final R readRecord() throws IOException {
        final R record = lookAheadPending ? lookAhead : fetchRecord();
        lookAheadPending = false;
        return record;
    }

    private R fetchRecord() throws IOException {
        String[] row;
        while ((row = nextDataRow()) != null) {
            if (row.length != columns.columnCount()) {
                throw formatException(String.format("mismatch between number of values in line (%d) and number of columns (%d)",
                        row.length, columns.columnCount()));
            }
            final R record = createRecord(new DataLine(row, columns, this::formatException));
            if (record != null) {
                return record;
            }
        }
        return null;
    }

    /**
     * @return the record of {@code dataLine}, or {@code null} to skip it
     */
    protected abstract R createRecord(DataLine dataLine);

    @Override
    public void close() throws IOException {
        csvReader.close();
    }

    @Override
    public Iterator<R> iterator() {
        return new Iterator<R>() {
            @Override
            public boolean hasNext() {
                if (!lookAheadPending) {
                    try {
                        lookAhead = fetchRecord();
                    } catch (final IOException e) {
                        throw new UncheckedIOException(e);
                    }
                    lookAheadPending = true;
                }
                return lookAhead != null;
            }

            @Override
            public R next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("no more records in " + source);
                }
                lookAheadPending = false;
                return lookAhead;
            }
        };
    }

    public Stream<R> stream() {
        return Utils.stream(this);
    }

    public List<R> toList() {
        return stream().collect(Collectors.toList());
    }

    /**
     * @return the name of the table in error messages, or {@code null}
     */
    public String getSource() {
        return source;
    }
}
