package com.delta.autoapply.run.events;

import com.delta.autoapply.run.model.EventEnvelope;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One consumer's view of a run channel. {@link #next(Duration)} yields events in emission
 * order; the subscription is finished once the channel closed and everything was read, or
 * once the consumer closed it.
 */
public class RunEventSubscription implements AutoCloseable {
    // a closing channel is noticed within this delay by a waiting consumer
    private static final long CLOSE_CHECK_MILLIS = 200;

    private final RunEventChannel channel;
    private final BlockingQueue<EventEnvelope> queue;
    private volatile boolean channelClosed;
    private volatile boolean cancelled;

    RunEventSubscription(RunEventChannel channel, BlockingQueue<EventEnvelope> queue) {
        this.channel = channel;
        this.queue = queue;
    }

    public String runId() {
        return channel.runId();
    }

    public Optional<EventEnvelope> next(Duration timeout) throws InterruptedException {
        if (cancelled) {
            return Optional.empty();
        }
        EventEnvelope head = queue.poll();
        if (head != null || channelClosed) {
            return Optional.ofNullable(head);
        }
        long remaining = timeout == null ? 0 : Math.max(0, timeout.toMillis());
        while (remaining > 0) {
            long slice = Math.min(remaining, CLOSE_CHECK_MILLIS);
            EventEnvelope next = queue.poll(slice, TimeUnit.MILLISECONDS);
            if (next != null) {
                return Optional.of(next);
            }
            if (channelClosed || cancelled) {
                return Optional.ofNullable(queue.poll());
            }
            remaining -= slice;
        }
        return Optional.empty();
    }

    public boolean isFinished() {
        return cancelled || (channelClosed && queue.isEmpty());
    }

    @Override
    public void close() {
        cancelled = true;
        channel.unsubscribe(this);
    }

    void offer(EventEnvelope envelope) {
        queue.add(envelope);
    }

    void markClosed() {
        channelClosed = true;
    }
}
