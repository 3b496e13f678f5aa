package org.broadinstitute.lincer.utils.tsv;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.lincer.utils.Utils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Ordered, unique column names of a table.
 */
public final class TableColumnCollection {

    private final List<String> names;

    private final Map<String, Integer> indexByName;

    /**
     * @throws IllegalArgumentException on a null or duplicate name, or if the first name starts with the comment prefix
     */
    public TableColumnCollection(final String... names) {
        this.names = ImmutableList.copyOf(checkNames(Utils.nonNull(names, "names"), IllegalArgumentException::new));
        this.indexByName = new HashMap<>(names.length * 2);
        for (int i = 0; i < names.length; i++) {
            indexByName.put(names[i], i);
        }
    }

    public List<String> names() {
        return names;
    }

    public String nameAt(final int index) {
        return names.get(Utils.validIndex(index, names.size()));
    }

    /**
     * @return the position of the column, or -1 if there is none with that name
     */
    public int indexOf(final String name) {
        return indexByName.getOrDefault(Utils.nonNull(name, "column name"), -1);
    }

    public boolean containsAll(final String... names) {
        return containsAll(List.of(names));
    }

    public boolean containsAll(final Iterable<String> names) {
        for (final String name : names) {
            if (indexOf(name) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return whether these are exactly {@code names}, in that order
     */
    public boolean matchesExactly(final String... names) {
        return this.names.equals(List.of(names));
    }

    public int columnCount() {
        return names.size();
    }

    /**
     * Checks a header line.
     *
     * @return {@code columnNames}
     * @throws RuntimeException from {@code exceptionFactory} if the names are not valid column names
     */
    public static String[] checkNames(final String[] columnNames, final Function<String, RuntimeException> exceptionFactory) {
        if (columnNames.length == 0) {
            throw exceptionFactory.apply("a table needs at least one column");
        }
        if (Stream.of(columnNames).anyMatch(name -> name == null)) {
            throw exceptionFactory.apply("column names cannot be null");
        }
        if (Stream.of(columnNames).distinct().count() != columnNames.length) {
            throw exceptionFactory.apply("repeated column name in " + String.join(", ", columnNames));
        }
        if (columnNames[0].startsWith(TableUtils.COMMENT_PREFIX)) {
            throw exceptionFactory.apply("the first column name cannot start with " + TableUtils.COMMENT_PREFIX);
        }
        return columnNames;
    }

    @Override
    public String toString() {
        return String.join(TableUtils.COLUMN_SEPARATOR_STRING, names);
    }
}
