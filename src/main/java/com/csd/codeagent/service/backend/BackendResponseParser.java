package com.csd.codeagent.service.backend;

import com.csd.codeagent.model.AnalysisResult;
import com.csd.codeagent.model.Finding;
import com.csd.codeagent.model.FindingSummary;
import com.csd.codeagent.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a model's answer into an {@link AnalysisResult}. Answers that are not the
 * expected JSON give {@code success=false} with the raw text attached.
 */
@Slf4j
@Service
public class BackendResponseParser {

    static final int MAX_RAW_OUTPUT = 50_000;

    private final ObjectMapper objectMapper;

    public BackendResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AnalysisResult parse(String backendId, String content) {
        String cleaned = clean(content);
        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(cleaned));
        } catch (JsonProcessingException e) {
            log.warn("Unparseable answer from {}: {}", backendId, e.getOriginalMessage());
            return unparsed(backendId, cleaned, "Failed to parse AI response");
        }
        if (root == null || !root.isObject() || !root.has("findings")) {
            return unparsed(backendId, cleaned, "AI response did not contain findings");
        }

        List<Finding> findings = new ArrayList<>();
        for (JsonNode node : root.path("findings")) {
            String title = text(node, "title");
            if (title == null) continue;
            findings.add(Finding.builder()
                    .title(title)
                    .category(category(node))
                    .severity(Severity.fromValue(text(node, "severity")))
                    .line(line(node.get("line")))
                    .description(text(node, "description") != null ? text(node, "description") : title)
                    .suggestion(text(node, "suggestion"))
                    .build());
        }

        List<String> recommendations = new ArrayList<>();
        for (JsonNode node : root.path("recommendations")) {
            if (node.isTextual() && !node.asText().isBlank()) {
                recommendations.add(node.asText().trim());
            }
        }

        return AnalysisResult.builder()
                .backendId(backendId)
                .success(true)
                .findings(findings)
                .summary(FindingSummary.of(findings))
                .overallAssessment(text(root, "overallAssessment"))
                .recommendations(recommendations)
                .build();
    }

    /**
     * Text of the first choice of a chat-completions response body.
     */
    public String extractContent(String responseBody) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return "";
        }
        return choices.get(0).path("message").path("content").asText("");
    }

    private AnalysisResult unparsed(String backendId, String raw, String reason) {
        String truncated = raw.length() > MAX_RAW_OUTPUT ? raw.substring(0, MAX_RAW_OUTPUT) : raw;
        return AnalysisResult.builder()
                .backendId(backendId)
                .success(false)
                .findings(List.of())
                .summary(new FindingSummary())
                .overallAssessment(reason)
                .recommendations(List.of())
                .rawOutput(truncated)
                .build();
    }

    private static String clean(String content) {
        if (content == null) return "";
        String cleaned = content.replace("\0", "").trim();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            cleaned = firstNewline >= 0 ? cleaned.substring(firstNewline + 1) : "";
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
        }
        return cleaned.trim();
    }

    private static String extractJson(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return text;
    }

    private static String category(JsonNode node) {
        String value = text(node, "category");
        if (value == null) value = text(node, "type");
        return value == null ? "general" : value.toLowerCase(Locale.ROOT);
    }

    private static Integer line(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.canConvertToInt() && node.asInt() > 0) return node.asInt();
        if (node.isTextual()) {
            try {
                int value = Integer.parseInt(node.asText().trim());
                return value > 0 ? value : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }
}
