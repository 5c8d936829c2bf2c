package com.delta.autoapply.run.fill;

import com.delta.autoapply.run.ats.AtsDetector;

/**
 * Vendor-specific prefill strategies in resolution order. {@link #GENERIC} matches every
 * URL, so resolution always succeeds.
 */
public enum FormFillStrategy {
    GREENHOUSE("Greenhouse"),
    LEVER("Lever"),
    WORKDAY("Workday"),
    ASHBY("Ashby"),
    GENERIC("Generic");

    private final String displayName;

    FormFillStrategy(String displayName) {
        this.displayName = displayName;
    }

    public boolean matches(String url) {
        String host = AtsDetector.hostOf(url);
        String h = host == null ? "" : host;
        return switch (this) {
            case GREENHOUSE -> h.contains("greenhouse.io");
            case LEVER -> h.contains("lever.co");
            case WORKDAY -> h.contains("myworkdayjobs.com") || h.contains(".wd");
            case ASHBY -> h.contains("ashbyhq.com");
            case GENERIC -> true;
        };
    }

    public String displayName() {
        return displayName;
    }

    public String detectionMessage() {
        return this == GENERIC ? "Unknown ATS, using generic strategy" : "Detected " + displayName;
    }
}
