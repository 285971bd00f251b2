package org.nanopolishcomp.utils.tsv;

import com.opencsv.CSVWriter;
import org.nanopolishcomp.utils.Utils;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.Writer;

/**
 * Class to write tab separated value files.
 * <p>
 * Values are written verbatim, without quoting or escaping, one line per record terminated by
 * {@value TableUtils#LINE_SEPARATOR}. The header is written lazily, just before the first record, or on
 * {@link #close()} if no record was written.
 * </p>
 *
 * @param <R> the record type.
 */
public abstract class TableWriter<R> implements Closeable, Flushable {

    /**
     * Number of lines written so far.
     */
    private long lineNumber;

    private final CSVWriter writer;

    private final TableColumnCollection columns;

    private boolean headerWritten = false;

    /**
     * Creates a new table writer given the destination writer and columns.
     *
     * @param writer  the destination writer.
     * @param columns the table columns.
     * @throws IllegalArgumentException if either {@code writer} or {@code columns} are {@code null}.
     */
    public TableWriter(final Writer writer, final TableColumnCollection columns) {
        this.columns = Utils.nonNull(columns, "The columns cannot be null.");
        this.writer = new CSVWriter(Utils.nonNull(writer, "the input writer cannot be null"),
                TableUtils.COLUMN_SEPARATOR, CSVWriter.NO_QUOTE_CHARACTER, CSVWriter.NO_ESCAPE_CHARACTER, TableUtils.LINE_SEPARATOR);
    }

    /**
     * Writes a comment into the output.
     *
     * @param comment the comment text, which may contain column separators.
     * @throws IOException if any exception was thrown when writing into the output.
     */
    public final void writeComment(final String comment) throws IOException {
        Utils.nonNull(comment, "The comment cannot be null.");
        writer.writeNext(new String[]{TableUtils.COMMENT_PREFIX + comment}, false);
        lineNumber++;
    }

    /**
     * Writes a new record.
     *
     * @param record the record to output.
     * @throws IOException if one was thrown when writing to the output.
     * @throws IllegalArgumentException if {@code record} is {@code null}.
     */
    public void writeRecord(final R record) throws IOException {
        Utils.nonNull(record, "The record cannot be null.");
        writeHeaderIfApplies();
        final DataLine dataLine = new DataLine(lineNumber + 1, columns, IllegalArgumentException::new);
        composeLine(record, dataLine);
        writer.writeNext(dataLine.unpack(), false);
        lineNumber++;
    }

    /**
     * Writes the header if it has not been written already.
     */
    public void writeHeaderIfApplies() throws IOException {
        if (!headerWritten) {
            writer.writeNext(columns.names().toArray(new String[columns.columnCount()]), false);
            lineNumber++;
        }
        headerWritten = true;
    }

    @Override
    public void flush() throws IOException {
        writer.flush();
    }

    @Override
    public final void close() throws IOException {
        writeHeaderIfApplies();
        writer.close();
    }

    /**
     * Returns the number of lines written so far, header and comments included.
     */
    public long getLineNumber() {
        return lineNumber;
    }

    /**
     * Composes the data-line to write into the output to represent a record.
     *
     * @param record   the record to write.
     * @param dataLine the destination data-line object.
     */
    protected abstract void composeLine(final R record, final DataLine dataLine);
}
