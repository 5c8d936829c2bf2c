package com.delta.autoapply.run.events;

import com.delta.autoapply.run.model.EventEnvelope;
import com.delta.autoapply.run.service.RunNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Routes events to the channel of the run they belong to. Channels live from run start
 * until the run is released; nothing is shared between runs.
 */
@Component
public class RunEventBus {
    private static final Logger log = LoggerFactory.getLogger(RunEventBus.class);

    private final ConcurrentMap<String, RunEventChannel> channels = new ConcurrentHashMap<>();

    public RunEventChannel open(String runId) {
        return channels.computeIfAbsent(runId, RunEventChannel::new);
    }

    public void emit(String runId, EventEnvelope envelope) {
        RunEventChannel channel = channels.get(runId);
        if (channel == null) {
            log.warn("Dropping {} event for unknown run {}", envelope == null ? null : envelope.type(), runId);
            return;
        }
        channel.publish(envelope);
    }

    /**
     * @throws RunNotFoundException when the run was never started or was already released
     */
    public RunEventSubscription stream(String runId) {
        RunEventChannel channel = channels.get(runId);
        if (channel == null) {
            throw new RunNotFoundException(runId);
        }
        return channel.subscribe();
    }

    /**
     * Marks the run's stream complete. Subscribers and late observers can still drain it.
     */
    public void complete(String runId) {
        RunEventChannel channel = channels.get(runId);
        if (channel != null) {
            channel.close();
        }
    }

    public void release(String runId) {
        RunEventChannel channel = channels.remove(runId);
        if (channel != null) {
            channel.close();
        }
    }

    public boolean isOpen(String runId) {
        return channels.containsKey(runId);
    }
}
