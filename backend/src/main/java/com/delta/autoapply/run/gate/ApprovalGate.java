package com.delta.autoapply.run.gate;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Single-use human approval signal of one run. Once signalled it stays signalled.
 */
public class ApprovalGate {
    private final String runId;
    private final CountDownLatch latch = new CountDownLatch(1);

    public ApprovalGate(String runId) {
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }

    public void signal() {
        latch.countDown();
    }

    public boolean isSignalled() {
        return latch.getCount() == 0;
    }

    /**
     * Blocks until signalled. There is no timeout; cancel the waiting thread to give up.
     */
    public void await() throws InterruptedException {
        latch.await();
    }

    /**
     * @return {@code true} if the gate was signalled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }
}
