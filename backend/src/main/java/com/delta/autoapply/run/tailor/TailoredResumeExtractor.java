package com.delta.autoapply.run.tailor;

import com.delta.autoapply.run.model.TailoredResume;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the structured resume out of free-form model output, which usually wraps it in a
 * fenced json block and surrounds it with prose.
 */
@Component
public class TailoredResumeExtractor {
    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public TailoredResumeExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<TailoredResume> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher fence = JSON_FENCE.matcher(text);
        String blob = fence.find() ? fence.group(1) : text;
        return findObject(blob, TailoredResumeExtractor::hasResumeKeys).map(this::toTailoredResume);
    }

    /**
     * First balanced top-level JSON object in the text that parses and satisfies the filter.
     */
    public Optional<ObjectNode> findObject(String text, Predicate<JsonNode> accept) {
        if (text == null) {
            return Optional.empty();
        }
        int from = text.indexOf('{');
        while (from >= 0) {
            int end = balancedEnd(text, from);
            if (end < 0) {
                return Optional.empty();
            }
            Optional<ObjectNode> parsed = parseObject(text.substring(from, end + 1));
            if (parsed.isPresent() && accept.test(parsed.get())) {
                return parsed;
            }
            from = text.indexOf('{', parsed.isPresent() ? end + 1 : from + 1);
        }
        return Optional.empty();
    }

    private Optional<ObjectNode> parseObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of((ObjectNode) node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private TailoredResume toTailoredResume(ObjectNode node) {
        JsonNode keywordsNode = node.has("keywords") ? node.get("keywords") : node.path("keyword_integration");
        List<String> keywords = new ArrayList<>();
        if (keywordsNode.isArray()) {
            keywordsNode.forEach(keyword -> {
                if (keyword.isTextual() && !keyword.asText().isBlank()) {
                    keywords.add(keyword.asText().trim());
                }
            });
        }
        JsonNode resume = node.has("resume") ? node.get("resume")
            : node.has("tailored_resume") ? node.get("tailored_resume")
            : node;
        return new TailoredResume(keywords, resume);
    }

    private static boolean hasResumeKeys(JsonNode node) {
        return node.has("resume") || node.has("keywords")
            || node.has("tailored_resume") || node.has("keyword_integration");
    }

    /**
     * Index of the brace closing the object opened at {@code start}, ignoring braces inside
     * string literals; -1 when the text ends first.
     */
    static int balancedEnd(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
