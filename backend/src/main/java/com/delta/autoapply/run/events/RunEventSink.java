package com.delta.autoapply.run.events;

import com.delta.autoapply.run.model.EventEnvelope;

/**
 * Where a run's components publish progress.
 */
public interface RunEventSink {
    String runId();

    void emit(EventEnvelope envelope);
}
