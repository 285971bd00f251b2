package org.nanopolishcomp.tools.eventalign;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.nanopolishcomp.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Worker stage: collapses read groups taken from the work queue until it finds an end of input marker.
 * <p>
 * On exit, successful or not, it forwards one {@link CollapsedRead#END_OF_RESULTS} to the writer.
 * </p>
 */
final class CollapseWorker extends PipelineStage {
    private static final Logger logger = LogManager.getLogger(CollapseWorker.class);

    private final BlockingQueue<ReadGroup> workQueue;
    private final BlockingQueue<CollapsedRead> resultQueue;
    private final List<StatField> statFields;
    private final boolean writeSamples;

    private KmerCollapser collapser;
    private long groupsCollapsed = 0;

    CollapseWorker(final int workerIndex, final BlockingQueue<ReadGroup> workQueue, final BlockingQueue<CollapsedRead> resultQueue,
                   final List<StatField> statFields, final boolean writeSamples, final PipelineSignals signals) {
        super("worker-" + workerIndex, signals);
        this.workQueue = Utils.nonNull(workQueue, "work queue cannot be null");
        this.resultQueue = Utils.nonNull(resultQueue, "result queue cannot be null");
        this.statFields = new ArrayList<>(Utils.nonNull(statFields, "stat fields cannot be null"));
        this.writeSamples = writeSamples;
    }

    @Override
    protected void process() throws InterruptedException {
        while (true) {
            final ReadGroup group = workQueue.take();
            if (group.isEndOfInput()) {
                logger.debug("{} reached the end of input after {} read groups", name, groupsCollapsed);
                return;
            }
            if (signals.hasFault()) {
                // keep draining so that the reader is never blocked on a full queue
                continue;
            }
            resultQueue.put(collapserFor(group).collapse(group));
            groupsCollapsed++;
        }
    }

    private KmerCollapser collapserFor(final ReadGroup group) {
        if (collapser == null) {
            collapser = new KmerCollapser(group.getColumns(), statFields, writeSamples);
        }
        return collapser;
    }

    @Override
    protected void onExit() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            return;
        }
        resultQueue.put(CollapsedRead.END_OF_RESULTS);
    }
}
