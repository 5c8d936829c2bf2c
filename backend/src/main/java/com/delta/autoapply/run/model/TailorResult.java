package com.delta.autoapply.run.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.List;

public record TailorResult(
    JsonNode tailoredResume,
    String changesExplanation,
    double atsScore,
    List<String> keywordIntegration,
    List<String> improvementSuggestions,
    String rawOutput,
    boolean degraded
) {
    public TailorResult {
        keywordIntegration = keywordIntegration == null ? List.of() : List.copyOf(keywordIntegration);
        improvementSuggestions = improvementSuggestions == null ? List.of() : List.copyOf(improvementSuggestions);
        rawOutput = rawOutput == null ? "" : rawOutput;
    }

    public static TailorResult fallback(String reason) {
        return new TailorResult(
            JsonNodeFactory.instance.objectNode(),
            "Resume tailoring failed - " + reason,
            0.0,
            List.of(),
            List.of("Please try again with AI service available"),
            "",
            true
        );
    }
}
