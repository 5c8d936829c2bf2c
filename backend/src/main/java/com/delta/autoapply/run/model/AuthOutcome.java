package com.delta.autoapply.run.model;

import java.util.List;

public record AuthOutcome(
    AuthPhase finalPhase,
    List<AuthPhase> transitions,
    String provider,
    boolean stateSaved
) {
    public AuthOutcome {
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    public boolean isReady() {
        return finalPhase == AuthPhase.READY;
    }

    public boolean entered(AuthPhase phase) {
        return transitions.contains(phase);
    }
}
