package org.nanopolishcomp.tools.eventalign;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Raw-signal statistics that can be reported for every collapsed kmer.
 */
public enum StatField {
    MEAN("mean"),
    STD("std"),
    MEDIAN("median"),
    MAD("mad"),
    NUM_SIGNALS("num_signals");

    private final String columnName;

    StatField(final String columnName) {
        this.columnName = columnName;
    }

    /**
     * Name of this statistic on the command line and in the collapsed output header.
     */
    public String getColumnName() {
        return columnName;
    }

    /**
     * Looks up a statistic by its column name.
     *
     * @throws IllegalArgumentException if there is no statistic with that name.
     */
    public static StatField fromColumnName(final String name) {
        for (final StatField field : values()) {
            if (field.columnName.equals(name)) {
                return field;
            }
        }
        throw new IllegalArgumentException(String.format("unsupported statistic field '%s', expected one of: %s", name, String.join(", ", columnNames())));
    }

    public static List<String> columnNames() {
        return Arrays.stream(values()).map(StatField::getColumnName).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return columnName;
    }
}
