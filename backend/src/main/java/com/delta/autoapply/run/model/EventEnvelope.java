package com.delta.autoapply.run.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Progress event published on a run's channel. Absent fields are left out of the wire JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventEnvelope(
    String type,
    String level,
    String message,
    String url,
    Map<String, Object> payload
) {
    public static final String TYPE_LOG = "log";
    public static final String TYPE_STATUS = "status";
    public static final String TYPE_GATE = "gate";
    public static final String TYPE_AUTH_GATE = "auth_gate";
    public static final String TYPE_TAILORED = "tailored";
    public static final String TYPE_SCREENSHOT = "screenshot";
    public static final String TYPE_DONE = "done";

    public static EventEnvelope log(String level, String message) {
        return new EventEnvelope(TYPE_LOG, level, message, null, null);
    }

    public static EventEnvelope info(String message) {
        return log("info", message);
    }

    public static EventEnvelope warn(String message) {
        return log("warn", message);
    }

    public static EventEnvelope error(String message) {
        return log("error", message);
    }

    public static EventEnvelope status(RunStatus status) {
        return new EventEnvelope(TYPE_STATUS, null, status.wireValue(), null, null);
    }

    public static EventEnvelope gate(String prompt) {
        return new EventEnvelope(TYPE_GATE, null, prompt, null, null);
    }

    public static EventEnvelope authGate(String provider, String url, String instructions) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("provider", provider);
        return new EventEnvelope(TYPE_AUTH_GATE, null, instructions, url, payload);
    }

    public static EventEnvelope tailored(List<String> keywords) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("keywords", keywords == null ? List.of() : List.copyOf(keywords));
        return new EventEnvelope(TYPE_TAILORED, null, null, null, payload);
    }

    public static EventEnvelope screenshot(String url) {
        return new EventEnvelope(TYPE_SCREENSHOT, null, null, url, null);
    }

    public static EventEnvelope done(boolean ok) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ok", ok);
        return new EventEnvelope(TYPE_DONE, null, null, null, payload);
    }

    public boolean isType(String candidate) {
        return type != null && type.equals(candidate);
    }
}
