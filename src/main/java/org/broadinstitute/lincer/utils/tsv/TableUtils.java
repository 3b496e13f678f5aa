package org.broadinstitute.lincer.utils.tsv;

import org.broadinstitute.lincer.utils.Utils;

import java.io.Writer;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Format constants and helpers of lincer's tab-separated tables.
 */
public final class TableUtils {

    public static final char COLUMN_SEPARATOR = '\t';

    public static final String COLUMN_SEPARATOR_STRING = String.valueOf(COLUMN_SEPARATOR);

    public static final String COMMENT_PREFIX = "#";

    public static final char QUOTE_CHARACTER = '"';

    public static final char ESCAPE_CHARACTER = '\\';

    private TableUtils() {}

    /**
     * @return a writer that fills each row with {@code composer}
     */
    public static <R> TableWriter<R> writer(final Writer writer, final TableColumnCollection columns,
                                            final BiConsumer<R, DataLine> composer) {
        Utils.nonNull(composer, "composer");
        return new TableWriter<R>(writer, columns) {
            @Override
            protected void composeLine(final R record, final DataLine dataLine) {
                composer.accept(record, dataLine);
            }
        };
    }

    /**
     * @throws RuntimeException from {@code formatExceptionFactory}, naming the missing columns, unless
     * {@code columns} holds all of {@code mandatoryColumns}
     */
    public static void checkMandatoryColumns(final TableColumnCollection columns, final TableColumnCollection mandatoryColumns,
                                             final Function<String, RuntimeException> formatExceptionFactory) {
        final List<String> missing = mandatoryColumns.names().stream()
                .filter(name -> columns.indexOf(name) < 0)
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw formatExceptionFactory.apply("Bad header in file. Not all mandatory columns are present. Missing: "
                    + String.join(", ", missing));
        }
    }
}
