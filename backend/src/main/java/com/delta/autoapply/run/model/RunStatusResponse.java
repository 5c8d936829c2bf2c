package com.delta.autoapply.run.model;

import java.time.Instant;

public record RunStatusResponse(
    String runId,
    String applyUrl,
    RunStatus status,
    Instant createdAt,
    Instant updatedAt,
    Instant finishedAt,
    boolean gateSignalled
) {}
