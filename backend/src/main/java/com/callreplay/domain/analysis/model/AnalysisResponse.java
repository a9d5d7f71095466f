package com.callreplay.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-call outcome, also the unit persisted by the result store.
 * <p>
 * Which of {@code reason}, {@code analysis} and {@code error} is populated
 * follows from {@code status}; use the factory methods to build one.
 * {@code timestamp} is assigned by the store on append when absent.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisResponse(
        String callId,
        AnalysisStatus status,
        String reason,
        AnalysisResult analysis,
        String error,
        String timestamp
) {
    public static AnalysisResponse analyzed(String callId, AnalysisResult analysis) {
        return new AnalysisResponse(callId, AnalysisStatus.ANALYZED, null, analysis, null, null);
    }

    public static AnalysisResponse skipped(String callId, String reason) {
        return new AnalysisResponse(callId, AnalysisStatus.SKIPPED, reason, null, null, null);
    }

    public static AnalysisResponse error(String callId, String error) {
        return new AnalysisResponse(callId, AnalysisStatus.ERROR, null, null, error, null);
    }

    public AnalysisResponse withTimestamp(String timestamp) {
        return new AnalysisResponse(callId, status, reason, analysis, error, timestamp);
    }

    public boolean hasAnalysis() {
        return analysis != null;
    }

    public boolean hasIssue() {
        return status == AnalysisStatus.ANALYZED && analysis != null && analysis.issueDetected();
    }
}
