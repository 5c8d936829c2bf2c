package com.delta.autoapply.run.model;

import java.time.Instant;

/**
 * Snapshot of one automation attempt. The pipeline replaces the snapshot on every
 * status transition; observers only ever see complete snapshots.
 */
public record RunSession(
    String runId,
    String applyUrl,
    RunStatus status,
    Instant createdAt,
    Instant updatedAt,
    Instant finishedAt
) {
    public static RunSession created(String runId, String applyUrl, Instant now) {
        return new RunSession(runId, applyUrl, RunStatus.CREATED, now, now, null);
    }

    public RunSession withStatus(RunStatus next, Instant at) {
        Instant finished = next.isTerminal() ? at : finishedAt;
        return new RunSession(runId, applyUrl, next, createdAt, at, finished);
    }
}
