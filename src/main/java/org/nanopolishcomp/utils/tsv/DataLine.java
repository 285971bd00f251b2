package org.nanopolishcomp.utils.tsv;

import org.nanopolishcomp.utils.Utils;

import java.util.function.Function;

/**
 * Table data-line string array wrapper.
 * <p>
 * Gives typed access to the values of one line of a table, by column index or name. Conversion
 * failures are reported with the format error factory of the enclosing reader, so the resulting
 * exception carries the source and line number.
 * </p>
 */
public final class DataLine {

    /**
     * Holds the values for the data line in construction.
     */
    private final String[] values;

    /**
     * Next appending index used by {@link #append append} methods.
     */
    private int nextIndex = 0;

    /**
     * The enclosing table column collection.
     */
    private final TableColumnCollection columns;

    /**
     * Line number of this data-line in its source, or {@code -1} if unknown.
     */
    private final long lineNumber;

    /**
     * Reference to the format error exception factory.
     */
    private final Function<String, RuntimeException> formatErrorFactory;

    /**
     * Creates a new data-line instance.
     * <p>
     * The value array passed is not copied and will be used directly to store the data-line values.
     * </p>
     *
     * @param lineNumber         the line number of this line in the source, or {@code -1} if unknown.
     * @param values             the value array.
     * @param columns            the columns of the table that will enclose this data-line instance.
     * @param formatErrorFactory to be used when there is a column formatting error based on the requested data-type.
     * @throws IllegalArgumentException if {@code columns} or {@code formatErrorFactory} are {@code null}.
     */
    DataLine(final long lineNumber, final String[] values, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this.values = Utils.nonNull(values, "the value array cannot be null");
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
        this.formatErrorFactory = Utils.nonNull(formatErrorFactory, "the format error factory cannot be null");
        this.lineNumber = lineNumber;
        if (values.length != columns.columnCount()) {
            throw new IllegalArgumentException("mismatching value length and column count");
        }
    }

    /**
     * Creates a new empty data-line instance, to be filled in with the {@code set} and {@code append} methods.
     */
    public DataLine(final long lineNumber, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this(lineNumber, new String[Utils.nonNull(columns, "the columns cannot be null").columnCount()], columns, formatErrorFactory);
    }

    /**
     * Returns the column collection for this data-line instance.
     *
     * @return never {@code null}.
     */
    public TableColumnCollection columns() {
        return columns;
    }

    /**
     * Returns the line number of this data-line in its source.
     *
     * @return {@code -1} if unknown.
     */
    public long getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns a reference to the data-line values after making sure that they are all defined.
     *
     * @return never {@code null} and with no {@code null} elements.
     */
    String[] unpack() {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalStateException(String.format("some data line value remains undefined: e.g. column '%s' index %d", columns.nameAt(i), i));
            }
        }
        return values;
    }

    /**
     * Returns the string value in a column by its index.
     *
     * @param index the target column index.
     * @return any value, never {@code null}.
     * @throws IllegalArgumentException if {@code index} is not valid.
     * @throws IllegalStateException    if the value at that index has not been defined yet.
     */
    public String get(final int index) {
        Utils.validIndex(index, values.length);
        if (values[index] == null) {
            throw new IllegalStateException(String.format("requesting a value for column %s that has not been defined yet", columns.nameAt(index)));
        }
        return values[index];
    }

    /**
     * Returns the int value in a column by its index.
     *
     * @throws RuntimeException built by the format error factory if the value is not a valid int.
     */
    public int getInt(final int index) {
        try {
            return Integer.parseInt(get(index));
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected int value for column %s but found %s", columns.nameAt(index), get(index)));
        }
    }

    public long getLong(final int index) {
        try {
            return Long.parseLong(get(index));
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected long value for column %s but found %s", columns.nameAt(index), get(index)));
        }
    }

    public double getDouble(final int index) {
        try {
            return Double.parseDouble(get(index));
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected double value for column %s but found %s", columns.nameAt(index), get(index)));
        }
    }

    public String get(final String columnName) {
        return get(columnIndex(columnName));
    }

    private int columnIndex(final String columnName) {
        final int index = columns.indexOf(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("there is no such a column: " + columnName);
        }
        return index;
    }

    public int getInt(final String columnName) {
        return getInt(columnIndex(columnName));
    }

    public long getLong(final String columnName) {
        return getLong(columnIndex(columnName));
    }

    public double getDouble(final String columnName) {
        return getDouble(columnIndex(columnName));
    }

    /**
     * Sets the next string value in the data-line.
     *
     * @param value the new value.
     * @return reference to this data-line.
     * @throws IllegalStateException if there is no more columns to fill in.
     */
    public DataLine append(final String value) {
        if (nextIndex == values.length) {
            throw new IllegalStateException("gone beyond of the end of the data-line");
        }
        values[nextIndex++] = value;
        return this;
    }

    public DataLine append(final int value) {
        return append(Integer.toString(value));
    }

    public DataLine append(final long value) {
        return append(Long.toString(value));
    }

    /**
     * Builds the exception to throw for a semantically invalid value in this line.
     */
    public RuntimeException formatError(final String message) {
        return formatErrorFactory.apply(message);
    }
}
