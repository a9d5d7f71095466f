package com.callreplay.infrastructure.ai.analysis;

import com.callreplay.domain.analysis.model.AnalysisResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Maps a model reply onto {@link AnalysisResult}. A field that is missing or
 * has the wrong JSON type falls back to its documented default.
 */
@Slf4j
@Component
public class AnalysisReplyMapper {

    public AnalysisResult toAnalysisResult(JsonNode reply) {
        return new AnalysisResult(
                text(reply, "intent", AnalysisResult.DEFAULT_INTENT),
                text(reply, "bot_response_summary", AnalysisResult.DEFAULT_BOT_RESPONSE_SUMMARY),
                bool(reply, "issue_detected", AnalysisResult.DEFAULT_ISSUE_DETECTED),
                text(reply, "issue_reason", AnalysisResult.DEFAULT_ISSUE_REASON),
                text(reply, "suggested_fix", AnalysisResult.DEFAULT_SUGGESTED_FIX),
                number(reply, "confidence_score", AnalysisResult.DEFAULT_CONFIDENCE_SCORE)
        );
    }

    private static String text(JsonNode reply, String field, String fallback) {
        JsonNode node = reply.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isValueNode()) {
            log.debug("Field '{}' is not a scalar, using default", field);
            return fallback;
        }
        return node.asText();
    }

    private static boolean bool(JsonNode reply, String field, boolean fallback) {
        JsonNode node = reply.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            String value = node.asText().trim().toLowerCase(Locale.ROOT);
            if (value.equals("true") || value.equals("false")) {
                return Boolean.parseBoolean(value);
            }
        }
        log.debug("Field '{}' is not a boolean, using default", field);
        return fallback;
    }

    private static double number(JsonNode reply, String field, double fallback) {
        JsonNode node = reply.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("Field '{}' is not numeric: {}", field, node.asText());
            }
        }
        return fallback;
    }
}
