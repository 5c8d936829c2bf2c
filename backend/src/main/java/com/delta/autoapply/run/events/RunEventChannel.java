package com.delta.autoapply.run.events;

import com.delta.autoapply.run.model.EventEnvelope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Ordered, unbounded event channel of a single run.
 *
 * <p>Events published while nobody is subscribed accumulate in a backlog that the next
 * subscriber receives first. Once subscribers exist, every event is copied to each of
 * them. Publishing never blocks.
 */
public class RunEventChannel {
    private final String runId;
    private final Deque<EventEnvelope> backlog = new ArrayDeque<>();
    private final List<RunEventSubscription> subscribers = new ArrayList<>();
    private boolean closed;

    public RunEventChannel(String runId) {
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }

    public synchronized void publish(EventEnvelope envelope) {
        if (envelope == null || closed) {
            return;
        }
        if (subscribers.isEmpty()) {
            backlog.addLast(envelope);
            return;
        }
        for (RunEventSubscription subscriber : subscribers) {
            subscriber.offer(envelope);
        }
    }

    public synchronized RunEventSubscription subscribe() {
        LinkedBlockingQueue<EventEnvelope> queue = new LinkedBlockingQueue<>(backlog);
        backlog.clear();
        RunEventSubscription subscription = new RunEventSubscription(this, queue);
        if (closed) {
            subscription.markClosed();
        } else {
            subscribers.add(subscription);
        }
        return subscription;
    }

    public synchronized int backlogSize() {
        return backlog.size();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Stops accepting events. Subscribers still drain what they already received.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (RunEventSubscription subscriber : subscribers) {
            subscriber.markClosed();
        }
        subscribers.clear();
    }

    synchronized void unsubscribe(RunEventSubscription subscription) {
        subscribers.remove(subscription);
    }
}
