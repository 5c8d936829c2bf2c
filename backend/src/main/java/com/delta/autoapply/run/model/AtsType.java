package com.delta.autoapply.run.model;

import java.util.Locale;

public enum AtsType {
    WORKDAY,
    GREENHOUSE,
    LEVER,
    ASHBY,
    TALEO,
    ICIMS,
    UNKNOWN;

    /**
     * Provider name shown to the human in authentication gate events.
     */
    public String providerName() {
        return this == UNKNOWN ? "generic" : name().toLowerCase(Locale.ROOT);
    }
}
