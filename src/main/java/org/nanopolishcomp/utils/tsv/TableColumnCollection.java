package org.nanopolishcomp.utils.tsv;

import org.nanopolishcomp.utils.Utils;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Represents a list of table columns.
 * <p>
 * Column names are unique, non-null and cannot start with the comment prefix.
 * </p>
 */
public final class TableColumnCollection {

    /**
     * Column names in order of appearance.
     */
    private final List<String> names;

    /**
     * Map from column name to its index.
     */
    private final Map<String, Integer> indexByName;

    /**
     * Creates a new table-column names collection.
     *
     * @param names the column names.
     * @throws IllegalArgumentException if {@code names} is not a valid column name list.
     */
    public TableColumnCollection(final Iterable<String> names) {
        this(StreamSupport.stream(Utils.nonNull(names, "the names cannot be null").spliterator(), false).toArray(String[]::new));
    }

    /**
     * Creates a new table-column names collection.
     * <p>
     * The new instance will have its own copy of the input name array.
     * </p>
     *
     * @param names the column names.
     * @throws IllegalArgumentException if {@code names} is not a valid column name array.
     */
    public TableColumnCollection(final String... names) {
        this.names = Collections.unmodifiableList(Arrays.asList(checkNames(names, IllegalArgumentException::new).clone()));
        this.indexByName = IntStream.range(0, names.length).boxed()
                .collect(Collectors.toMap(this.names::get, Function.identity()));
    }

    /**
     * Returns the column names ordered by column index.
     *
     * @return never {@code null}, a unmodifiable view to this collection column names.
     */
    public List<String> names() {
        return names;
    }

    /**
     * Returns the name of a column by its index.
     *
     * @throws IllegalArgumentException if {@code index} is not a valid column index.
     */
    public String nameAt(final int index) {
        Utils.validIndex(index, names.size());
        return names.get(index);
    }

    /**
     * Returns the index of a column by its name.
     *
     * @param name the query column name.
     * @return {@code -1} if there is not such a column, 0 or greater otherwise.
     */
    public int indexOf(final String name) {
        Utils.nonNull(name, "the column name cannot be null");
        return indexByName.getOrDefault(name, -1);
    }

    public boolean contains(final String name) {
        return indexByName.containsKey(Utils.nonNull(name, "cannot be null"));
    }

    public boolean containsAll(final String... names) {
        return Stream.of(Utils.nonNull(names, "names cannot be null")).allMatch(this::contains);
    }

    public boolean containsAll(final Iterable<String> names) {
        Utils.nonNull(names, "the input names cannot be null");
        for (final String name : names) {
            if (!contains(name)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether the columns match exactly the names given, in the same order.
     */
    public boolean matchesExactly(final String... names) {
        Utils.nonNull(names, "names cannot be null");
        return Arrays.asList(names).equals(this.names);
    }

    public int columnCount() {
        return names.size();
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof TableColumnCollection && ((TableColumnCollection) other).names.equals(names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return TableUtils.joinColumns(names);
    }

    /**
     * Checks that a column name array is valid.
     * <p>
     * Column names must be non-null, non-empty, unique and must not start with the comment prefix.
     * </p>
     *
     * @param columnNames the column names to check.
     * @param exceptionFactory the exception to throw if the names are invalid.
     * @return the same array as the input.
     */
    public static String[] checkNames(final String[] columnNames,
                                      final Function<String, RuntimeException> exceptionFactory) {
        Utils.nonNull(columnNames, "column names cannot be null");
        Utils.nonNull(exceptionFactory, "exception factory cannot be null");

        if (columnNames.length == 0) {
            throw exceptionFactory.apply("there must be at least one column");
        }
        final Set<String> namesSoFar = new HashSet<>(columnNames.length);
        for (int i = 0; i < columnNames.length; i++) {
            final String name = columnNames[i];
            if (name == null) {
                throw exceptionFactory.apply("the column name at position " + i + " is null");
            } else if (name.isEmpty()) {
                throw exceptionFactory.apply("the column name at position " + i + " is empty");
            } else if (i == 0 && name.startsWith(TableUtils.COMMENT_PREFIX)) {
                throw exceptionFactory.apply("the first column name cannot start with the comment prefix '" + TableUtils.COMMENT_PREFIX + "'");
            } else if (!namesSoFar.add(name)) {
                throw exceptionFactory.apply("repeated column name: " + name);
            }
        }
        return columnNames;
    }
}
