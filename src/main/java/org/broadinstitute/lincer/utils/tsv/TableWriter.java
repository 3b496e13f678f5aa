package org.broadinstitute.lincer.utils.tsv;

import com.opencsv.CSVWriter;
import org.broadinstitute.lincer.utils.Utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes records as a tab-separated table with a header line.
 * <p>
 * The header is written before the first record, or on {@link #close()} when there is none. A value is quoted only
 * if it holds a tab, a quote or a line break.
 * </p>
 *
 * @param <R> the record type
 */
public abstract class TableWriter<R> implements Closeable {

    private final CSVWriter writer;

    private final TableColumnCollection columns;

    private boolean headerWritten = false;

    public TableWriter(final Path path, final TableColumnCollection columns) throws IOException {
        this(Files.newBufferedWriter(Utils.nonNull(path, "path"), StandardCharsets.UTF_8), columns);
    }

    public TableWriter(final Writer writer, final TableColumnCollection columns) {
        this.columns = Utils.nonNull(columns, "columns");
        this.writer = new CSVWriter(Utils.nonNull(writer, "writer"),
                TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
    }

    public TableColumnCollection columns() {
        return columns;
    }

    /**
     * @throws IllegalStateException if {@link #composeLine} left a value unset
     */
    public void writeRecord(final R record) throws IOException {
        Utils.nonNull(record, "record");
        writeHeaderIfApplies();
        final DataLine line = new DataLine(columns, IllegalArgumentException::new);
        composeLine(record, line);
        writer.writeNext(line.unpack(), false);
    }

    public final void writeAllRecords(final Iterable<R> records) throws IOException {
        for (final R record : records) {
            writeRecord(record);
        }
    }

    @Override
    public final void close() throws IOException {
        writeHeaderIfApplies();
        writer.close();
    }

    public void writeHeaderIfApplies() {
        if (!headerWritten) {
            writer.writeNext(columns.names().toArray(new String[0]), false);
            headerWritten = true;
        }
    }

    /**
     * Sets every value of {@code dataLine} from {@code record}.
     */
    protected abstract void composeLine(R record, DataLine dataLine);
}
