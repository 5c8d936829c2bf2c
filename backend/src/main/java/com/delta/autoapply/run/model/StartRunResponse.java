package com.delta.autoapply.run.model;

public record StartRunResponse(String runId, RunStatus status) {}
