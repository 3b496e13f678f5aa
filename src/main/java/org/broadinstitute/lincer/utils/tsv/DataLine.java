package org.broadinstitute.lincer.utils.tsv;

import org.broadinstitute.lincer.utils.Utils;

import java.util.function.Function;

/**
 * One row of a table, addressed by column name.
 * <p>
 * Readers get filled rows in {@link TableReader#createRecord(DataLine)}; writers fill empty rows in
 * {@link TableWriter#composeLine}.
 * </p>
 */
public final class DataLine {

    // shared with the reader, not copied
    private final String[] values;

    private final TableColumnCollection columns;

    // builds the exception for a value of the wrong type
    private final Function<String, RuntimeException> formatErrorFactory;

    DataLine(final String[] values, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this.values = Utils.nonNull(values, "values");
        this.columns = Utils.nonNull(columns, "columns");
        this.formatErrorFactory = Utils.nonNull(formatErrorFactory, "format error factory");
        Utils.validateArg(values.length == columns.columnCount(),
                () -> values.length + " values for " + columns.columnCount() + " columns");
    }

    /**
     * Creates a row with every value unset.
     */
    public DataLine(final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this(new String[Utils.nonNull(columns, "columns").columnCount()], columns, formatErrorFactory);
    }

    /**
     * @throws IllegalStateException if a value is still unset
     */
    String[] unpack() {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalStateException("no value was set for column " + columns.nameAt(i));
            }
        }
        return values;
    }

    /**
     * @throws IllegalArgumentException if there is no such column, or the value would turn the row into a comment
     */
    public DataLine set(final String name, final String value) {
        final int index = indexOf(name);
        if (index == 0 && value != null && value.startsWith(TableUtils.COMMENT_PREFIX)) {
            throw new IllegalArgumentException("the first value of a row cannot start with " + TableUtils.COMMENT_PREFIX + ": " + value);
        }
        values[index] = value;
        return this;
    }

    public DataLine set(final String name, final int value) {
        return set(name, Integer.toString(value));
    }

    public DataLine set(final String name, final long value) {
        return set(name, Long.toString(value));
    }

    public DataLine set(final String name, final double value) {
        return set(name, Double.toString(value));
    }

    /**
     * @throws IllegalArgumentException if there is no such column
     * @throws IllegalStateException if the value is unset
     */
    public String get(final String name) {
        final String value = values[indexOf(name)];
        if (value == null) {
            throw new IllegalStateException("no value was set for column " + name);
        }
        return value;
    }

    /**
     * @throws RuntimeException from the format error factory if the value is not an integer
     */
    public int getInt(final String name) {
        final String value = get(name);
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("column %s should hold an integer but holds '%s'", name, value));
        }
    }

    private int indexOf(final String name) {
        final int index = columns.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("no column named " + name);
        }
        return index;
    }
}
