package com.delta.autoapply.run.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record TailoredResume(List<String> keywords, JsonNode resume) {
    public TailoredResume {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
