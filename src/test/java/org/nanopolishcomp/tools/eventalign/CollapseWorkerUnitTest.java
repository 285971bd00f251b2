package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import static org.nanopolishcomp.tools.eventalign.EventalignTestUtils.HEADER;
import static org.nanopolishcomp.tools.eventalign.EventalignTestUtils.event;
import static org.nanopolishcomp.tools.eventalign.EventalignTestUtils.readGroup;

public final class CollapseWorkerUnitTest extends BaseTest {

    private static ReadGroup group(final String read, final String eventLength) {
        return readGroup(HEADER + event("chr1", 1, "ACGTA", read, eventLength, "ACGTA", 0, 2, "80,81"));
    }

    private static List<CollapsedRead> runWorker(final BlockingQueue<ReadGroup> workQueue, final PipelineSignals signals) {
        final BlockingQueue<CollapsedRead> resultQueue = new ArrayBlockingQueue<>(100);
        new CollapseWorker(0, workQueue, resultQueue, Collections.singletonList(StatField.MEAN), false, signals).call();
        return new ArrayList<>(resultQueue);
    }

    private static BlockingQueue<ReadGroup> workQueue(final ReadGroup... groups) {
        final BlockingQueue<ReadGroup> workQueue = new ArrayBlockingQueue<>(100);
        workQueue.addAll(Arrays.asList(groups));
        workQueue.add(ReadGroup.END_OF_INPUT);
        return workQueue;
    }

    @Test
    public void testCollapsesUntilEndOfInput() {
        final PipelineSignals signals = new PipelineSignals();
        final List<CollapsedRead> results = runWorker(workQueue(group("r1", "0.1"), group("r2", "0.2")), signals);
        Assert.assertFalse(signals.hasFault());
        Assert.assertEquals(results.size(), 3);
        Assert.assertEquals(results.get(0).getSummary().getReadId(), "r1");
        Assert.assertEquals(results.get(1).getSummary().getReadId(), "r2");
        Assert.assertTrue(results.get(2).isEndOfResults());
        assertContains(results.get(1).getBlock(), "\tmean\n1\tACGTA\t1\t0.2\t0\t0\t0\t2\t80.5\n");
    }

    @Test
    public void testReportsMalformedGroupAndStillSendsMarker() {
        final PipelineSignals signals = new PipelineSignals();
        final List<CollapsedRead> results = runWorker(workQueue(group("r1", "zero"), group("r2", "0.2")), signals);
        Assert.assertTrue(signals.getFault().get() instanceof UserException.BadInput);
        Assert.assertEquals(results.size(), 1);
        Assert.assertTrue(results.get(0).isEndOfResults());
    }

    @Test
    public void testDrainsWithoutCollapsingAfterAFault() {
        final PipelineSignals signals = new PipelineSignals();
        signals.reportFault(new IllegalStateException("reader failed"));
        final BlockingQueue<ReadGroup> workQueue = workQueue(group("r1", "0.1"), group("r2", "0.2"));
        final List<CollapsedRead> results = runWorker(workQueue, signals);
        Assert.assertTrue(workQueue.isEmpty());
        Assert.assertEquals(results.size(), 1);
        Assert.assertTrue(results.get(0).isEndOfResults());
    }
}
