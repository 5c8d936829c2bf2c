package com.delta.autoapply.run.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class RunNotFoundException extends RuntimeException {
    private final String runId;

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
