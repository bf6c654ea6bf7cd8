package com.questrail.crossval.failfast;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Test handler that records divergence reports instead of halting.
 */
public final class RecordingDivergenceHandler implements DivergenceHandler {
    private final List<DivergenceReport> reports = new ArrayList<>();
    private final CountDownLatch first = new CountDownLatch(1);

    @Override
    public synchronized void onDivergence(DivergenceReport report) {
        reports.add(report);
        first.countDown();
    }

    public synchronized List<DivergenceReport> reports() {
        return new ArrayList<>(reports);
    }

    /**
     * Waits for the first report; the coordinator reports from whichever thread
     * completes the mismatch broadcast.
     */
    public boolean awaitReport(long timeout, TimeUnit unit) throws InterruptedException {
        return first.await(timeout, unit);
    }
}
