package com.callreplay.domain.analysis.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Structured judgment of one call produced by the model.
 * confidenceScore is clamped to [0, 1].
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisResult(
        String intent,
        String botResponseSummary,
        boolean issueDetected,
        String issueReason,
        String suggestedFix,
        double confidenceScore
) {
    public static final String DEFAULT_INTENT = "Unknown";
    public static final String DEFAULT_BOT_RESPONSE_SUMMARY = "No summary";
    public static final boolean DEFAULT_ISSUE_DETECTED = false;
    public static final String DEFAULT_ISSUE_REASON = "No issues detected";
    public static final String DEFAULT_SUGGESTED_FIX = "No suggestions";
    public static final double DEFAULT_CONFIDENCE_SCORE = 0.5;

    public AnalysisResult {
        if (Double.isNaN(confidenceScore)) {
            confidenceScore = DEFAULT_CONFIDENCE_SCORE;
        }
        confidenceScore = Math.max(0.0, Math.min(1.0, confidenceScore));
    }
}
