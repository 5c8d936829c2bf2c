package com.delta.autoapply.run.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunStatus {
    CREATED,
    AUTHENTICATING,
    FILLING,
    AWAITING_APPROVAL,
    FINALIZING,
    DONE,
    FAILED,
    /** Stopped before the browser phase; the human has to supply the structured resume. */
    HALTED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == HALTED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
