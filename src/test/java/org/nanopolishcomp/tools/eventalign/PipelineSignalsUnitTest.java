package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

public final class PipelineSignalsUnitTest extends BaseTest {

    @Test
    public void testFirstFaultWins() throws Exception {
        final PipelineSignals signals = new PipelineSignals();
        Assert.assertFalse(signals.hasFault());
        Assert.assertFalse(signals.getFault().isPresent());

        final IllegalStateException first = new IllegalStateException("first");
        Assert.assertTrue(signals.reportFault(first));
        Assert.assertFalse(signals.reportFault(new IllegalStateException("second")));

        Assert.assertTrue(signals.hasFault());
        Assert.assertSame(signals.getFault().get(), first);
        Assert.assertSame(signals.errorSignal().get(), first);
        Assert.assertSame(signals.firstSignal().get(1, TimeUnit.SECONDS), first);
        Assert.assertFalse(signals.isDone());
    }

    @Test
    public void testDoneSignal() throws Exception {
        final PipelineSignals signals = new PipelineSignals();
        Assert.assertFalse(signals.firstSignal().isDone());
        signals.signalDone();
        signals.signalDone();
        Assert.assertTrue(signals.isDone());
        Assert.assertNull(signals.firstSignal().get(1, TimeUnit.SECONDS));
        Assert.assertFalse(signals.hasFault());
    }

    @Test
    public void testConcurrentFaultsKeepOnlyOne() throws InterruptedException, ExecutionException, TimeoutException {
        final PipelineSignals signals = new PipelineSignals();
        final int threads = 8;
        final CountDownLatch start = new CountDownLatch(1);
        final AtomicInteger winners = new AtomicInteger();
        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int i = 0; i < threads; i++) {
                final int id = i;
                executor.submit(() -> {
                    start.await();
                    if (signals.reportFault(new RuntimeException("fault " + id))) {
                        winners.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
            Assert.assertNotNull(signals.errorSignal().get(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdown();
            Assert.assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
        Assert.assertEquals(winners.get(), 1);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullFault() {
        new PipelineSignals().reportFault(null);
    }
}
