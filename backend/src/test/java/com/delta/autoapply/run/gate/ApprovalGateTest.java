package com.delta.autoapply.run.gate;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class ApprovalGateTest {

    @Test
    void signalBeforeWaitReturnsImmediately() throws Exception {
        ApprovalGate gate = new ApprovalGate("run-1");
        gate.signal();
        gate.signal();
        gate.signal();

        assertThat(gate.isSignalled()).isTrue();
        assertThat(gate.await(Duration.ZERO)).isTrue();
        gate.await();
    }

    @Test
    void waitBeforeSignalSuspendsUntilSignalled() throws Exception {
        ApprovalGate gate = new ApprovalGate("run-1");
        CountDownLatch waiting = new CountDownLatch(1);
        AtomicBoolean released = new AtomicBoolean(false);
        Thread waiter = new Thread(() -> {
            waiting.countDown();
            try {
                gate.await();
                released.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        assertThat(waiting.await(5, TimeUnit.SECONDS)).isTrue();

        Thread.sleep(50);
        assertThat(released.get()).isFalse();

        gate.signal();
        waiter.join(5000);
        assertThat(released.get()).isTrue();
    }

    @Test
    void boundedWaitTimesOutWhenNeverSignalled() throws Exception {
        ApprovalGate gate = new ApprovalGate("run-1");
        assertThat(gate.await(Duration.ofMillis(20))).isFalse();
        assertThat(gate.isSignalled()).isFalse();
    }

    @Test
    void waitingThreadCanBeInterrupted() throws Exception {
        ApprovalGate gate = new ApprovalGate("run-1");
        AtomicBoolean interrupted = new AtomicBoolean(false);
        Thread waiter = new Thread(() -> {
            try {
                gate.await();
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        waiter.start();
        waiter.interrupt();
        waiter.join(5000);

        assertThat(interrupted.get()).isTrue();
    }
}
