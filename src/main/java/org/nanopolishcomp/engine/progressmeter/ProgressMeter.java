package org.nanopolishcomp.engine.progressmeter;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.nanopolishcomp.utils.Utils;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically logs the number of records processed so far and the processing rate.
 * <p>
 * Output is produced by a daemon scheduler thread every {@code secondsBetweenUpdates} seconds between
 * {@link #start()} and {@link #stop()}, so callers only have to report each processed record through
 * {@link #update(Object)}. All public methods are thread safe.
 * </p>
 * <p>
 * A disabled meter accepts every call and does nothing.
 * </p>
 *
 * @param <T> type of the record used to describe the current position in the traversal.
 */
public abstract class ProgressMeter<T> {
    private static final Logger logger = LogManager.getLogger(ProgressMeter.class);

    /**
     * By default, we output a line to the logger after this many seconds have elapsed
     */
    public static final double DEFAULT_SECONDS_BETWEEN_UPDATES = 10.0;

    public static final long MILLISECONDS_PER_SECOND = 1000L;

    public static final String DEFAULT_RECORD_LABEL = "records";

    private final long millisecondsBetweenUpdates;

    private long numRecordsProcessed = 0L;

    private long startTimeMs = 0L;

    private long currentTimeMs = 0L;

    private T currentRecord = null;

    private long numLoggerUpdates = 0L;

    private boolean started;

    private boolean stopped;

    private final boolean disabled;

    private String recordLabel = DEFAULT_RECORD_LABEL;

    private final ScheduledExecutorService scheduler;

    /**
     * Create a progress meter with the given update interval
     *
     * @param secondsBetweenUpdates number of seconds between progress lines, must be &gt; 0.
     * @param disabled if true, the meter does nothing.
     */
    protected ProgressMeter( final double secondsBetweenUpdates, final boolean disabled ) {
        Utils.validateArg(secondsBetweenUpdates > 0, "secondsBetweenUpdates must be > 0.0");
        this.started = false;
        this.stopped = false;
        this.disabled = disabled;

        this.millisecondsBetweenUpdates = (long)(secondsBetweenUpdates*(double)MILLISECONDS_PER_SECOND);
        Utils.validate(millisecondsBetweenUpdates > 0, "millisecondsBetweenUpdates must be > 0");

        this.scheduler = disabled ? null : Executors.newScheduledThreadPool(1,
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("Progress Meter").build());
    }

    /**
     * Change the label used for records in the output, "records" by default.
     */
    public void setRecordLabel( final String label ) {
        Utils.nonNull(label);
        this.recordLabel = label;
    }

    /**
     * Start the progress meter and schedule the periodic output.
     *
     * @throws IllegalStateException if already started or stopped.
     */
    public synchronized void start() {
        if ( disabled ) {
            return;
        }

        Utils.validate( !started, "the progress meter has been started already");
        Utils.validate( !stopped, "the progress meter has been stopped already");
        started = true;
        printHeader();

        startTimeMs = getTime();
        currentTimeMs = startTimeMs;
        numRecordsProcessed = 0L;
        numLoggerUpdates = 0L;
        currentRecord = null;

        scheduler.scheduleAtFixedRate(this::printProgress, millisecondsBetweenUpdates, millisecondsBetweenUpdates, TimeUnit.MILLISECONDS);
    }

    private long getTime() {
        return System.currentTimeMillis();
    }

    /**
     * Signal to the progress meter that one more record has been processed.
     *
     * @param currentRecord the record just processed.
     */
    public synchronized void update( final T currentRecord ) {
        if ( disabled ) {
            return;
        }

        Utils.validate(started, "the progress meter has not been started yet");
        Utils.validate( !stopped, "the progress meter has been stopped already");
        ++numRecordsProcessed;
        this.currentRecord = currentRecord;
    }

    /**
     * Stop the progress meter and output the final totals.
     * <p>
     * A meter that was never started is left untouched, so this can be called from cleanup code.
     * </p>
     */
    public synchronized void stop() {
        if ( disabled || !started || stopped ) {
            return;
        }

        this.stopped = true;
        currentTimeMs = getTime();
        printProgress();
        scheduler.shutdown();
        logger.info(String.format("Traversal complete. Processed %d total %s in %.1f seconds.", numRecordsProcessed, recordLabel, elapsedTimeInSeconds()));
    }

    private void printHeader() {
        logger.info(String.format("%36s  %15s  %20s  %15s",
                                  "Current " + StringUtils.capitalize(recordLabel), "Elapsed Seconds",
                                  StringUtils.capitalize(recordLabel) + " Processed",
                                  StringUtils.capitalize(recordLabel) + "/Second"));
    }

    private synchronized void printProgress() {
        currentTimeMs = getTime();
        ++numLoggerUpdates;
        logger.info(String.format("%36s  %15.1f  %20d  %15.1f",
                                  formatRecord(currentRecord), elapsedTimeInSeconds(), numRecordsProcessed, processingRate()));
    }

    /**
     * Format the given record for the progress output.
     *
     * @param currentRecord last record processed, {@code null} before the first one.
     */
    protected abstract String formatRecord(final T currentRecord);

    @VisibleForTesting
    double elapsedTimeInSeconds() {
        return (currentTimeMs - startTimeMs) / (double)MILLISECONDS_PER_SECOND;
    }

    private double processingRate() {
        final double seconds = elapsedTimeInSeconds();
        return seconds > 0 ? numRecordsProcessed / seconds : 0.0;
    }

    @VisibleForTesting
    synchronized long numLoggerUpdates() {
        return numLoggerUpdates;
    }

    @VisibleForTesting
    synchronized long getNumRecordsProcessed(){
        return numRecordsProcessed;
    }

    public synchronized boolean started() {
        return started;
    }

    public synchronized boolean stopped() {
        return stopped;
    }

    public boolean isDisabled() {
        return disabled;
    }
}
