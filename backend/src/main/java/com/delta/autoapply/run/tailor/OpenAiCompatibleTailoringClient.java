package com.delta.autoapply.run.tailor;

import com.delta.autoapply.config.AutoApplyProperties;
import com.delta.autoapply.run.model.JobContext;
import com.delta.autoapply.run.model.TailorResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chat-completions client for any OpenAI compatible endpoint, hosted or local.
 */
public class OpenAiCompatibleTailoringClient implements ResumeTailoringClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleTailoringClient.class);

    private static final String SYSTEM_PROMPT =
        "You are an expert career advisor and resume specialist. Always provide valid JSON responses.";
    private static final double TEMPERATURE = 0.7;
    private static final int MAX_TOKENS = 4000;

    private final RestClient rest;
    private final AutoApplyProperties.Tailoring properties;
    private final ObjectMapper objectMapper;
    private final TailoredResumeExtractor extractor;

    public OpenAiCompatibleTailoringClient(
        AutoApplyProperties.Tailoring properties,
        RestClient.Builder builder,
        ObjectMapper objectMapper,
        TailoredResumeExtractor extractor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.extractor = extractor;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = properties.getTimeoutSeconds() * 1000;
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);

        RestClient.Builder configured = builder
            .baseUrl(properties.getBaseUrl())
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (hasApiKey()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey().trim());
        }
        this.rest = configured.build();
    }

    @Override
    public TailorResult tailor(JobContext job, String baseResume, Map<String, Object> constraints) {
        if (!hasApiKey() && !isLocalEndpoint(properties.getBaseUrl())) {
            log.warn("No API key configured for tailoring endpoint {}", properties.getBaseUrl());
            return TailorResult.fallback("no API key configured");
        }
        String content;
        try {
            content = callChatCompletion(buildPrompt(job, baseResume, constraints));
        } catch (RuntimeException e) {
            log.warn("Tailoring call to {} failed", properties.getBaseUrl(), e);
            return TailorResult.fallback("AI service unavailable");
        }
        if (content.isBlank()) {
            log.warn("Tailoring endpoint returned an empty completion");
            return TailorResult.fallback("AI service returned no content");
        }
        return toResult(content);
    }

    private String callChatCompletion(String prompt) {
        Map<String, Object> body = Map.of(
            "model", properties.getModel(),
            "messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
            ),
            "temperature", TEMPERATURE,
            "max_tokens", MAX_TOKENS
        );
        JsonNode response = rest.post()
            .uri("/chat/completions")
            .body(body)
            .retrieve()
            .body(JsonNode.class);
        if (response == null) {
            return "";
        }
        return response.path("choices").path(0).path("message").path("content").asText("").trim();
    }

    private TailorResult toResult(String content) {
        Optional<ObjectNode> parsed = extractor.findObject(content, node -> true);
        if (parsed.isEmpty()) {
            return new TailorResult(
                JsonNodeFactory.instance.objectNode(),
                "Model output was not JSON",
                0.0,
                List.of(),
                List.of(),
                content,
                false
            );
        }
        ObjectNode node = parsed.get();
        JsonNode resume = node.has("tailored_resume") ? node.get("tailored_resume") : node.path("resume");
        return new TailorResult(
            resume.isMissingNode() ? JsonNodeFactory.instance.objectNode() : resume,
            node.path("changes_explanation").asText(""),
            node.path("ats_score").asDouble(0.0),
            textList(node.path("keyword_integration")),
            textList(node.path("improvement_suggestions")),
            content,
            false
        );
    }

    String buildPrompt(JobContext job, String baseResume, Map<String, Object> constraints) {
        String constraintsBlock = "";
        if (constraints != null && !constraints.isEmpty()) {
            try {
                constraintsBlock = "USER CONSTRAINTS (MUST FOLLOW):\n"
                    + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(constraints) + "\n";
            } catch (JsonProcessingException e) {
                log.debug("Ignoring constraints that cannot be serialized: {}", e.getMessage());
            }
        }
        return """
            You are an expert resume writer and ATS optimization specialist. Tailor this resume
            for the job below while maintaining complete honesty.

            Job: %s at %s (%s)
            Job description:
            %s

            Current resume:
            %s

            %s
            Rules: never fabricate experience, skills or qualifications; only reframe existing
            experience; use the posting's keywords naturally; keep ATS-friendly section headers.

            Respond with a strict JSON object with keys: tailored_resume (object), keywords
            (string array), changes_explanation (string), ats_score (number 0-100),
            keyword_integration (string array), improvement_suggestions (string array).
            """.formatted(
            nullToEmpty(job == null ? null : job.title()),
            nullToEmpty(job == null ? null : job.company()),
            nullToEmpty(job == null ? null : job.url()),
            nullToEmpty(job == null ? null : job.description()),
            nullToEmpty(baseResume),
            constraintsBlock
        );
    }

    private boolean hasApiKey() {
        return properties.getApiKey() != null && !properties.getApiKey().isBlank();
    }

    static boolean isLocalEndpoint(String baseUrl) {
        if (baseUrl == null) {
            return false;
        }
        return baseUrl.startsWith("http://localhost")
            || baseUrl.startsWith("https://localhost")
            || baseUrl.startsWith("http://127.0.0.1")
            || baseUrl.contains("host.docker.internal");
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        }
        return values;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
