package org.nanopolishcomp.tools.eventalign;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.nanopolishcomp.engine.progressmeter.ReadProgressMeter;
import org.nanopolishcomp.exceptions.NanopolishCompException;
import org.nanopolishcomp.utils.Utils;
import org.nanopolishcomp.utils.io.IOUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Streaming eventalign collapse: one reader, a pool of workers and one writer connected by bounded queues.
 * <p>
 * The reader queues read groups for the workers, which queue collapsed reads for the writer. Full queues block
 * their producer. Workers take groups in no particular order, so reads are written in the order they are
 * finished; the index file is the way to find a read in the data file.
 * </p>
 * <p>
 * {@link #run()} waits for the first of two signals. A fault from any stage shuts every stage down at once and
 * is rethrown unchanged; the output files are then incomplete and lack the end of data line. The writer's done
 * signal means every stage has finished its work.
 * </p>
 */
public final class EventalignCollapsePipeline {
    private static final Logger logger = LogManager.getLogger(EventalignCollapsePipeline.class);

    private static final long TEAR_DOWN_TIMEOUT_SECONDS = 30;

    private final CollapseConfiguration configuration;

    public EventalignCollapsePipeline(final CollapseConfiguration configuration) {
        this.configuration = Utils.nonNull(configuration, "configuration cannot be null");
    }

    /**
     * Runs the collapse to completion.
     *
     * @return the run totals.
     * @throws org.nanopolishcomp.exceptions.UserException for faults caused by the inputs or the output location.
     * @throws NanopolishCompException for any other fault.
     */
    public CollapseSummary run() {
        IOUtils.createDirectory(configuration.getOutputDirectory());

        final int workerCount = configuration.getWorkerCount();
        final BlockingQueue<ReadGroup> workQueue = new ArrayBlockingQueue<>(configuration.getQueueCapacity());
        final BlockingQueue<CollapsedRead> resultQueue = new ArrayBlockingQueue<>(configuration.getQueueCapacity());
        final PipelineSignals signals = new PipelineSignals();

        final List<PipelineStage> stages = new ArrayList<>(workerCount + 2);
        stages.add(new ReadGroupProducer(configuration.getInputs(), configuration.getMaxReads(), workQueue, workerCount, signals));
        for (int i = 0; i < workerCount; i++) {
            stages.add(new CollapseWorker(i, workQueue, resultQueue, configuration.getStatFields(), configuration.isWriteSamples(), signals));
        }
        final CollapsedReadWriter writer = new CollapsedReadWriter(resultQueue, workerCount,
                configuration.getDataFile(), configuration.getIndexFile(),
                new ReadProgressMeter(configuration.getSecondsBetweenProgressUpdates(), !configuration.isProgress()), signals);
        stages.add(writer);

        final ExecutorService executor = Executors.newFixedThreadPool(stages.size(),
                new ThreadFactoryBuilder().setNameFormat("eventalign-collapse-%d").setDaemon(true).build());
        logger.debug("Starting 1 reader, {} workers and 1 writer", workerCount);
        try {
            stages.forEach(executor::submit);
            awaitFirstSignal(signals);
            if (signals.hasFault()) {
                executor.shutdownNow();
                // let the writer close the output files before reporting
                if (!executor.awaitTermination(TEAR_DOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("Some collapse stages did not stop within {} seconds", TEAR_DOWN_TIMEOUT_SECONDS);
                }
                throw rethrow(signals.getFault().get());
            }
            executor.shutdown();
            while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.debug("Waiting for the collapse stages to exit");
            }
            // a stage may fail on exit after the writer is done
            if (signals.hasFault()) {
                throw rethrow(signals.getFault().get());
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new NanopolishCompException("interrupted while waiting for the collapse to finish", e);
        } finally {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }
        return new CollapseSummary(writer.getReadsWritten(), writer.getKmersWritten(), writer.getElapsedSeconds(),
                configuration.getDataFile(), configuration.getIndexFile());
    }

    private static void awaitFirstSignal(final PipelineSignals signals) throws InterruptedException {
        try {
            signals.firstSignal().get();
        } catch (final ExecutionException e) {
            throw new NanopolishCompException.ShouldNeverReachHereException("pipeline signals are never completed exceptionally", e);
        }
    }

    private static RuntimeException rethrow(final Throwable fault) {
        logger.error("Collapse aborted: {}", fault.getMessage());
        if (fault instanceof Error) {
            throw (Error) fault;
        } else if (fault instanceof RuntimeException) {
            return (RuntimeException) fault;
        } else {
            return new NanopolishCompException("collapse stage failed", fault);
        }
    }
}
