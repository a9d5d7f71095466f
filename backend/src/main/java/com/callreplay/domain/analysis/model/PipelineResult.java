package com.callreplay.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one batch pipeline run, persisted once and never mutated.
 * A run that failed during setup or persistence carries only
 * {@code pipelineId} and {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PipelineResult(
        String pipelineId,
        String timestamp,
        Integer inputCount,
        List<AnalysisResponse> analysisResults,
        Map<String, JsonNode> fixResults,
        JsonNode summary,
        AnalysisStatistics statistics,
        String error
) {
    public static PipelineResult completed(String pipelineId,
                                           String timestamp,
                                           int inputCount,
                                           List<AnalysisResponse> analysisResults,
                                           Map<String, JsonNode> fixResults,
                                           JsonNode summary) {
        return new PipelineResult(pipelineId, timestamp, inputCount,
                List.copyOf(analysisResults), Collections.unmodifiableMap(new LinkedHashMap<>(fixResults)), summary,
                AnalysisStatistics.forPipeline(analysisResults), null);
    }

    public static PipelineResult failed(String pipelineId, String error) {
        return new PipelineResult(pipelineId, null, null, null, null, null, null, error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
