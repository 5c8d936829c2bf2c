package com.delta.autoapply.run.model;

public enum AuthPhase {
    INITIAL,
    LOGIN_WALL_DETECTED,
    GUEST_ATTEMPTED,
    AWAITING_MANUAL_AUTH,
    READY,
    /** Readiness never confirmed; the page is handed on as-is. */
    UNCONFIRMED
}
