package org.nanopolishcomp.tools.eventalign;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.nanopolishcomp.engine.progressmeter.ProgressMeter;
import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.utils.Utils;
import org.nanopolishcomp.utils.io.IOUtils;
import org.nanopolishcomp.utils.tsv.DataLine;
import org.nanopolishcomp.utils.tsv.TableUtils;
import org.nanopolishcomp.utils.tsv.TableWriter;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.util.concurrent.BlockingQueue;

/**
 * Writer stage: appends collapsed reads to the data file and indexes them, in arrival order.
 * <p>
 * The stage stops after receiving one {@link CollapsedRead#END_OF_RESULTS} per worker. The data file ends
 * with a lone {@value TableUtils#COMMENT_PREFIX} line only if no stage reported a fault. The done signal is
 * raised on exit in every case.
 * </p>
 */
final class CollapsedReadWriter extends PipelineStage {
    private static final Logger logger = LogManager.getLogger(CollapsedReadWriter.class);

    static final byte[] END_OF_DATA = (TableUtils.COMMENT_PREFIX + TableUtils.LINE_SEPARATOR).getBytes(StandardCharsets.UTF_8);

    private final BlockingQueue<CollapsedRead> resultQueue;
    private final int workerCount;
    private final Path dataFile;
    private final Path indexFile;
    private final ProgressMeter<String> progressMeter;
    private final DecimalFormat decimalFormat = KmerCollapser.newDecimalFormat();

    private volatile long readsWritten = 0;
    private volatile long kmersWritten = 0;
    private volatile long startTimeMs = 0;
    private volatile long endTimeMs = 0;

    CollapsedReadWriter(final BlockingQueue<CollapsedRead> resultQueue, final int workerCount, final Path dataFile, final Path indexFile,
                        final ProgressMeter<String> progressMeter, final PipelineSignals signals) {
        super("writer", signals);
        Utils.validateArg(workerCount > 0, "there must be at least one worker");
        this.resultQueue = Utils.nonNull(resultQueue, "result queue cannot be null");
        this.workerCount = workerCount;
        this.dataFile = Utils.nonNull(dataFile, "data file cannot be null");
        this.indexFile = Utils.nonNull(indexFile, "index file cannot be null");
        this.progressMeter = Utils.nonNull(progressMeter, "progress meter cannot be null");
    }

    @Override
    protected void process() throws InterruptedException {
        startTimeMs = System.currentTimeMillis();
        progressMeter.start();
        try (final OutputStream data = openDataFile();
             final TableWriter<IndexRecord> index = openIndexFile()) {
            index.writeHeaderIfApplies();
            long offset = 0;
            int markersSeen = 0;
            while (markersSeen < workerCount) {
                final CollapsedRead read = resultQueue.take();
                if (read.isEndOfResults()) {
                    markersSeen++;
                    logger.debug("Received {} of {} end of results markers", markersSeen, workerCount);
                    continue;
                }
                if (signals.hasFault()) {
                    continue;
                }
                final byte[] block = read.getBlock().getBytes(StandardCharsets.UTF_8);
                data.write(block);
                index.writeRecord(new IndexRecord(read.getSummary(), offset, block.length - 1));
                offset += block.length;
                readsWritten++;
                kmersWritten += read.getSummary().getKmers();
                progressMeter.update(read.getSummary().getReadId());
            }
            if (!signals.hasFault()) {
                data.write(END_OF_DATA);
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(dataFile.toString(), "writing the collapsed reads failed", e);
        } finally {
            endTimeMs = System.currentTimeMillis();
            progressMeter.stop();
        }
        logger.info(String.format("total reads: %d [%.2f reads/s]", readsWritten, getReadsPerSecond()));
    }

    private OutputStream openDataFile() {
        try {
            return new BufferedOutputStream(Files.newOutputStream(dataFile));
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(dataFile.toString(), "it could not be opened", e);
        }
    }

    private TableWriter<IndexRecord> openIndexFile() {
        try {
            return TableUtils.writer(IOUtils.makeWriter(Files.newOutputStream(indexFile)), IndexRecord.COLUMNS, this::composeIndexLine);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(indexFile.toString(), "it could not be opened", e);
        }
    }

    private void composeIndexLine(final IndexRecord record, final DataLine dataLine) {
        final ReadSummary summary = record.getSummary();
        dataLine.append(summary.getRefId())
                .append(summary.getRefStart())
                .append(summary.getRefEnd())
                .append(summary.getReadId())
                .append(summary.getKmers())
                .append(decimalFormat.format(summary.getDwellTime()))
                .append(summary.getAmbiguousKmers())
                .append(summary.getMismatchKmers())
                .append(summary.getMissingKmers())
                .append(record.getByteOffset())
                .append(record.getByteLength());
    }

    @Override
    protected void onExit() {
        signals.signalDone();
    }

    long getReadsWritten() {
        return readsWritten;
    }

    long getKmersWritten() {
        return kmersWritten;
    }

    double getElapsedSeconds() {
        return Math.max(0L, endTimeMs - startTimeMs) / 1000.0;
    }

    double getReadsPerSecond() {
        final double seconds = getElapsedSeconds();
        return seconds > 0 ? readsWritten / seconds : 0.0;
    }
}
