package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.utils.Utils;
import org.nanopolishcomp.utils.io.IOUtils;
import org.nanopolishcomp.utils.tsv.DataLine;
import org.nanopolishcomp.utils.tsv.TableColumnCollection;
import org.nanopolishcomp.utils.tsv.TableReader;

import java.io.IOException;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the index of a collapsed data file and fetches read blocks by their byte offset.
 */
public final class CollapsedIndexReader extends TableReader<IndexRecord> {

    public CollapsedIndexReader(final String sourceName, final Reader sourceReader) throws IOException {
        super(sourceName, sourceReader);
    }

    /**
     * Opens an index file.
     *
     * @throws UserException.CouldNotReadInputFile if the file cannot be read.
     */
    public static CollapsedIndexReader open(final Path indexFile) {
        IOUtils.assertFileIsReadable(indexFile);
        try {
            return new CollapsedIndexReader(indexFile.toString(), IOUtils.makeReaderMaybeGzipped(indexFile));
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(indexFile, e);
        }
    }

    @Override
    protected void processColumns(final TableColumnCollection columns) {
        if (!columns.equals(IndexRecord.COLUMNS)) {
            throw formatException(String.format("unexpected index header '%s', expected '%s'", columns, IndexRecord.COLUMNS));
        }
    }

    @Override
    protected IndexRecord createRecord(final DataLine dataLine) {
        final ReadSummary summary = new ReadSummary(
                dataLine.get("read_id"),
                dataLine.get("ref_id"),
                dataLine.getLong("ref_start"),
                dataLine.getLong("ref_end"),
                dataLine.getInt("kmers"),
                dataLine.getDouble("dwell_time"),
                dataLine.getInt("NNNNN_kmers"),
                dataLine.getInt("mismatch_kmers"),
                dataLine.getLong("missing_kmers"));
        final long byteOffset = dataLine.getLong("byte_offset");
        final long byteLength = dataLine.getLong("byte_len");
        if (byteOffset < 0 || byteLength < 0) {
            throw dataLine.formatError("byte offsets and lengths cannot be negative");
        }
        return new IndexRecord(summary, byteOffset, byteLength);
    }

    /**
     * Reads the block of an indexed read from the data file.
     *
     * @return the block text, without its terminating newline.
     * @throws UserException.CouldNotReadInputFile if the data file cannot be read or is shorter than the index says.
     */
    public static String readBlock(final Path dataFile, final IndexRecord record) {
        Utils.nonNull(dataFile, "data file cannot be null");
        Utils.nonNull(record, "record cannot be null");
        Utils.validateArg(record.getByteLength() <= Integer.MAX_VALUE, "block too large");
        try (final SeekableByteChannel channel = Files.newByteChannel(dataFile)) {
            channel.position(record.getByteOffset());
            final ByteBuffer buffer = ByteBuffer.allocate((int) record.getByteLength());
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    throw new UserException.CouldNotReadInputFile(dataFile, String.format(
                            "the block of read %s ends past the end of the file", record.getReadId()));
                }
            }
            return new String(buffer.array(), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(dataFile, e);
        }
    }
}
