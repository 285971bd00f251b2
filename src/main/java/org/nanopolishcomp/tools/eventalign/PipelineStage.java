package org.nanopolishcomp.tools.eventalign;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.nanopolishcomp.exceptions.NanopolishCompException;
import org.nanopolishcomp.utils.Utils;

import java.util.concurrent.Callable;

/**
 * One stage of a collapse pipeline, run on its own thread.
 * <p>
 * A stage never throws: every failure is reported on the shared {@link PipelineSignals} and
 * {@link #onExit()} always runs, so that the stages downstream receive their termination markers.
 * Unchecked exceptions are reported as they are; checked ones are wrapped in a
 * {@link NanopolishCompException.StageFailure}.
 * </p>
 */
abstract class PipelineStage implements Callable<Void> {
    private static final Logger logger = LogManager.getLogger(PipelineStage.class);

    protected final String name;
    protected final PipelineSignals signals;

    protected PipelineStage(final String name, final PipelineSignals signals) {
        this.name = Utils.nonEmpty(name, "stage name");
        this.signals = Utils.nonNull(signals, "signals cannot be null");
    }

    @Override
    public final Void call() {
        logger.debug("{} started", name);
        try {
            process();
            logger.debug("{} finished", name);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            // interrupted by a tear down after a fault, unless this is the first fault
            if (signals.reportFault(new NanopolishCompException.StageFailure(name, e))) {
                logger.debug("{} interrupted before any fault was reported", name);
            } else {
                logger.debug("{} stopped by the pipeline tear down", name);
            }
        } catch (final RuntimeException | Error e) {
            reportFault(e);
        } catch (final Exception e) {
            reportFault(new NanopolishCompException.StageFailure(name, e));
        } finally {
            exit();
        }
        return null;
    }

    private void reportFault(final Throwable fault) {
        if (signals.reportFault(fault)) {
            logger.debug("{} failed: {}", name, fault.getMessage());
        } else {
            logger.debug("{} failed after another stage: {}", name, fault.getMessage());
        }
    }

    private void exit() {
        try {
            onExit();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("{} interrupted while exiting", name);
        } catch (final RuntimeException | Error e) {
            reportFault(e);
        }
    }

    /**
     * The work of the stage.
     */
    protected abstract void process() throws Exception;

    /**
     * Called once when the stage stops, whatever the reason.
     */
    protected abstract void onExit() throws InterruptedException;

    public String getName() {
        return name;
    }
}
