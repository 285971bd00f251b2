package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.utils.Utils;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fault and completion signals shared by the stages of a collapse pipeline.
 * <p>
 * The error signal keeps the first fault reported by any stage; later faults are ignored. The done signal
 * is raised once by the writer when it stops, whatever the reason. Both are one-shot.
 * </p>
 */
public final class PipelineSignals {

    private final AtomicReference<Throwable> firstFault = new AtomicReference<>();
    private final CompletableFuture<Throwable> error = new CompletableFuture<>();
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    /**
     * Reports a stage fault.
     *
     * @return {@code true} if this is the first fault of the run.
     */
    public boolean reportFault(final Throwable fault) {
        Utils.nonNull(fault, "fault cannot be null");
        if (firstFault.compareAndSet(null, fault)) {
            error.complete(fault);
            return true;
        }
        return false;
    }

    /**
     * Raises the completion signal.
     */
    public void signalDone() {
        done.complete(null);
    }

    public boolean hasFault() {
        return firstFault.get() != null;
    }

    public Optional<Throwable> getFault() {
        return Optional.ofNullable(firstFault.get());
    }

    public boolean isDone() {
        return done.isDone();
    }

    /**
     * Future completed with the first fault.
     */
    CompletableFuture<Throwable> errorSignal() {
        return error;
    }

    CompletableFuture<Void> doneSignal() {
        return done;
    }

    /**
     * Future completed as soon as either signal is raised.
     */
    CompletableFuture<Object> firstSignal() {
        return CompletableFuture.anyOf(error, done);
    }
}
