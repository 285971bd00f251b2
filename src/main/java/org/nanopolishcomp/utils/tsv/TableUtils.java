package org.nanopolishcomp.utils.tsv;

import org.apache.commons.lang3.StringUtils;
import org.nanopolishcomp.utils.Utils;

import java.io.Writer;
import java.util.function.BiConsumer;

/**
 * Common constants and utility methods to work with tab separated value files.
 */
public final class TableUtils {

    /**
     * Column separator {@value #COLUMN_SEPARATOR}.
     */
    public static final char COLUMN_SEPARATOR = '\t';

    /**
     * Column separator as an string.
     */
    public static final String COLUMN_SEPARATOR_STRING = String.valueOf(COLUMN_SEPARATOR);

    /**
     * Comment line prefix string {@value}.
     */
    public static final String COMMENT_PREFIX = "#";

    /**
     * Quote character {@value #QUOTE_CHARACTER}.
     */
    public static final char QUOTE_CHARACTER = '\"';

    /**
     * Escape character {@value #ESCAPE_CHARACTER}.
     */
    public static final char ESCAPE_CHARACTER = '\\';

    /**
     * Line terminator of every written table line.
     */
    public static final String LINE_SEPARATOR = "\n";

    private TableUtils() {
        throw new UnsupportedOperationException();
    }

    /**
     * Creates a new table writer given a record to data-line composer.
     */
    public static <R> TableWriter<R> writer(final Writer writer, final TableColumnCollection columns, final BiConsumer<R, DataLine> dataLineComposer) {
        return new DataLineComposerBasedTableWriter<>(writer, columns, dataLineComposer);
    }

    /**
     * Joins values with the column separator.
     */
    public static String joinColumns(final Iterable<String> values) {
        return StringUtils.join(values, COLUMN_SEPARATOR);
    }

    private static final class DataLineComposerBasedTableWriter<R> extends TableWriter<R> {
        private final BiConsumer<R, DataLine> dataLineComposer;

        private DataLineComposerBasedTableWriter(final Writer writer, final TableColumnCollection columns, final BiConsumer<R, DataLine> dataLineComposer) {
            super(writer, columns);
            this.dataLineComposer = Utils.nonNull(dataLineComposer, "the data-line composer cannot be null");
        }

        @Override
        protected void composeLine(R record, DataLine dataLine) {
            dataLineComposer.accept(record, dataLine);
        }
    }
}
