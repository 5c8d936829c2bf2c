package com.delta.autoapply.run.events;

import com.delta.autoapply.run.model.EventEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Server-sent-events framing: {@code data: <json>\n\n}, UTF-8.
 */
@Component
public class EventFrames {
    static final String KEEP_ALIVE = ": keep-alive\n\n";

    private final ObjectMapper objectMapper;

    public EventFrames(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toFrame(EventEnvelope envelope) {
        return "data: " + toJson(envelope) + "\n\n";
    }

    public byte[] toFrameBytes(EventEnvelope envelope) {
        return toFrame(envelope).getBytes(StandardCharsets.UTF_8);
    }

    public byte[] keepAliveBytes() {
        return KEEP_ALIVE.getBytes(StandardCharsets.UTF_8);
    }

    public String toJson(EventEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize event " + envelope.type(), e);
        }
    }
}
