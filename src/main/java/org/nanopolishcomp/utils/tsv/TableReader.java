package org.nanopolishcomp.utils.tsv;

import com.opencsv.CSVReader;
import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.utils.Utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reader class for tab separated value files.
 * <p>
 * Comment lines (starting with {@value TableUtils#COMMENT_PREFIX}) and blank lines are ignored, except that
 * comments are handed to {@link #processCommentLine(String, long)}. The first non-comment line is the header.
 * Lines identical to the header found later in the input are skipped, which makes it safe to read the
 * concatenation of several tables that share a header.
 * </p>
 * <p>
 * Sub-classes convert each {@link DataLine} into a record by implementing {@link #createRecord(DataLine)},
 * and may validate or index the columns by overriding {@link #processColumns(TableColumnCollection)}.
 * </p>
 *
 * @param <R> record type.
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    /**
     * Name of the source, used in error messages; may be {@code null}.
     */
    private final String source;

    /**
     * Reference to the underlying reader, used to keep track of line numbers.
     */
    private final LineNumberReader reader;

    /**
     * Column collection found in the header.
     */
    private TableColumnCollection columns;

    private final CSVReader csvReader;

    private boolean nextRecordFetched = false;

    private R nextRecord;

    /**
     * Creates a new table reader given the input source name and reader.
     * <p>
     * The header is read and processed before the constructor returns.
     * </p>
     *
     * @param sourceName name of the source (file, stream) used in error messages.
     * @param sourceReader the source reader.
     * @throws IOException if raised when reading the header.
     * @throws UserException.BadInput if there is no header or it is not valid.
     */
    protected TableReader(final String sourceName, final Reader sourceReader) throws IOException {
        Utils.nonNull(sourceReader, "the reader cannot be null");

        this.source = sourceName;
        this.reader = sourceReader instanceof LineNumberReader ? (LineNumberReader) sourceReader : new LineNumberReader(sourceReader);
        this.csvReader = new CSVReader(this.reader, TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
        findAndProcessHeaderLine();
    }

    private void findAndProcessHeaderLine() throws IOException {
        final String[] line = skipCommentLines();
        TableColumnCollection.checkNames(line, this::formatException);
        columns = new TableColumnCollection(line);
        processColumns(columns);
    }

    /**
     * Checks whether a line is a comment line.
     */
    protected boolean isCommentLine(final String[] line) {
        return line.length > 0 && line[0].startsWith(TableUtils.COMMENT_PREFIX);
    }

    private static boolean isBlankLine(final String[] line) {
        return line.length == 0 || (line.length == 1 && line[0].trim().isEmpty());
    }

    /**
     * Creates a format exception that includes the source name and the current line number.
     *
     * @param message the error message.
     * @return never {@code null}.
     */
    protected final UserException.BadInput formatException(final String message) {
        return formatException(reader.getLineNumber(), message);
    }

    private UserException.BadInput formatException(final long lineNumber, final String message) {
        final String explanation = message == null ? "" : ": " + message;
        if (source == null) {
            return new UserException.BadInput(String.format("format error at line %d" + explanation, lineNumber));
        } else {
            return new UserException.BadInput(String.format("format error in '%s' at line %d" + explanation, source, lineNumber));
        }
    }

    /**
     * Process the header columns.
     * <p>
     * Sub-classes may override it to verify that mandatory columns are present and to resolve column indices.
     * It is called exactly once, from the constructor.
     * </p>
     *
     * @param tableColumns the header columns.
     */
    protected void processColumns(@SuppressWarnings("unused") final TableColumnCollection tableColumns) {
        // nothing by default.
    }

    /**
     * Returns the column collection for this reader.
     *
     * @return never {@code null}.
     */
    public TableColumnCollection columns() {
        Utils.validate(columns != null, "columns are null");
        return columns;
    }

    /**
     * Reads the next record from the source.
     *
     * @return {@code null} if there are no more records.
     * @throws IOException if thrown when reading from the source.
     * @throws UserException.BadInput if there is some formatting error in the source.
     */
    public final R readRecord() throws IOException {
        if (!nextRecordFetched) {
            nextRecord = fetchNextRecord();
        }
        nextRecordFetched = false;
        return nextRecord;
    }

    private R fetchNextRecord() throws IOException {
        nextRecordFetched = true;
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (isCommentLine(line)) {
                processCommentLine(line, reader.getLineNumber());
            } else if (!isBlankLine(line) && !isHeaderLine(line)) {
                if (line.length != columns.columnCount()) {
                    throw formatException(String.format("mismatch between number of values in line (%d) and number of columns (%d)", line.length, columns.columnCount()));
                } else {
                    // data lines may be converted later on another thread, so they keep their own line number
                    final long lineNumber = reader.getLineNumber();
                    final R result = createRecord(new DataLine(lineNumber, line, columns, message -> formatException(lineNumber, message)));
                    if (result != null) {
                        return result;
                    }
                }
            }
        }
        return null;
    }

    private void processCommentLine(final String[] line, final long lineNumber) {
        processCommentLine(String.join(TableUtils.COLUMN_SEPARATOR_STRING, line).substring(TableUtils.COMMENT_PREFIX.length()), lineNumber);
    }

    /**
     * Called with the text of every comment line, without its prefix.
     * <p>
     * Comments before the header are processed from the constructor, before the subclass fields are
     * initialized and while {@link #columns()} is still undefined.
     * </p>
     *
     * @param commentText the comment text, with tab separated fields joined back together.
     * @param lineNumber the line number of the comment in the source.
     */
    protected void processCommentLine(final String commentText, final long lineNumber) {
        // nothing by default.
    }

    /**
     * Checks whether a line is a repetition of the header.
     */
    protected boolean isHeaderLine(final String[] line) {
        return columns.matchesExactly(line);
    }

    private String[] skipCommentLines() throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (isCommentLine(line)) {
                processCommentLine(line, reader.getLineNumber());
            } else if (!isBlankLine(line)) {
                return line;
            }
        }
        throw formatException("premature end of table: header line not found");
    }

    /**
     * Transforms a data-line into a record.
     *
     * @param dataLine the data-line to transform.
     * @return {@code null} to skip the line, otherwise the record.
     */
    protected abstract R createRecord(final DataLine dataLine);

    @Override
    public void close() throws IOException {
        csvReader.close();
    }

    @Override
    public Iterator<R> iterator() {
        return new Iterator<R>() {

            @Override
            public boolean hasNext() {
                if (!nextRecordFetched) {
                    try {
                        nextRecord = fetchNextRecord();
                    } catch (final IOException ex) {
                        throw new UserException.CouldNotReadInputFile(String.valueOf(source), ex.getMessage(), ex);
                    }
                }
                return nextRecord != null;
            }

            @Override
            public R next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("there is no more record in the input");
                }
                nextRecordFetched = false;
                return nextRecord;
            }
        };
    }

    @Override
    public Spliterator<R> spliterator() {
        return Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
    }

    public Stream<R> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<R> toList() {
        return stream().collect(Collectors.toList());
    }

    public String getSource() {
        return source;
    }

    /**
     * Returns the number of the last line read from the source.
     */
    public long getLineNumber() {
        return reader.getLineNumber();
    }
}
