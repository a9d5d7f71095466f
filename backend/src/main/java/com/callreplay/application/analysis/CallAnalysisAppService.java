package com.callreplay.application.analysis;

import com.callreplay.domain.analysis.model.AnalysisResponse;
import com.callreplay.domain.analysis.model.AnalysisResult;
import com.callreplay.domain.analysis.model.AnalysisStatistics;
import com.callreplay.domain.analysis.model.AnalysisStatus;
import com.callreplay.domain.analysis.model.CallTranscript;
import com.callreplay.domain.analysis.model.HistoryQuery;
import com.callreplay.domain.analysis.model.IngestAck;
import com.callreplay.domain.analysis.model.PipelineResult;
import com.callreplay.domain.analysis.model.PrefilterVerdict;
import com.callreplay.domain.analysis.model.StoreStats;
import com.callreplay.infrastructure.ai.LlmInvocationException;
import com.callreplay.infrastructure.ai.LlmInvoker;
import com.callreplay.infrastructure.ai.analysis.CallAnalyzer;
import com.callreplay.infrastructure.ai.pipeline.CallPipeline;
import com.callreplay.infrastructure.ai.prefilter.FailureDetector;
import com.callreplay.infrastructure.storage.AnalysisResultStore;
import com.callreplay.infrastructure.storage.Timestamps;
import com.callreplay.interfaces.api.dto.BatchAnalysisResponse;
import com.callreplay.interfaces.api.dto.SystemInfoResponse;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class CallAnalysisAppService {

    static final int MAX_HISTORY_LIMIT = 1000;

    private final CallAnalyzer callAnalyzer;
    private final CallPipeline callPipeline;
    private final AnalysisResultStore resultStore;
    private final FailureDetector failureDetector;
    private final LlmInvoker llmInvoker;

    public AnalysisResponse analyze(CallTranscript transcript) {
        log.info("Analyzing call: {}", transcript.callId());
        return callAnalyzer.analyze(transcript);
    }

    public BatchAnalysisResponse analyzeBatch(List<CallTranscript> transcripts) {
        List<AnalysisResponse> results = callPipeline.analyzeBatch(transcripts);
        AnalysisStatistics stats = AnalysisStatistics.forBatch(results);
        log.info("Batch analysis complete. analyzed={}, skipped={}, errors={}",
                stats.analyzed(), stats.skipped(), stats.errors());
        return new BatchAnalysisResponse(results, stats);
    }

    public PrefilterVerdict prefilter(CallTranscript transcript) {
        return callAnalyzer.prefilter(transcript);
    }

    public JsonNode generateFixes(AnalysisResult analysis) {
        return requireNoError(callAnalyzer.generateDetailedFixes(analysis), "Fix generation failed");
    }

    public JsonNode generateSummary(List<AnalysisResult> analyses) {
        if (analyses.isEmpty()) {
            throw new IllegalArgumentException("At least one analysis is required");
        }
        log.info("Generating summary for {} analyses", analyses.size());
        return requireNoError(callAnalyzer.generateSummary(analyses), "Summary generation failed");
    }

    public CompletableFuture<PipelineResult> runPipeline(List<CallTranscript> transcripts) {
        return callPipeline.execute(transcripts);
    }

    public IngestAck ingest(CallTranscript transcript, Map<String, Object> metadata) {
        return callPipeline.ingest(transcript, metadata);
    }

    /**
     * Validates the raw history filters and runs the store query.
     */
    public List<AnalysisResponse> history(String startDate,
                                          String endDate,
                                          String callId,
                                          String status,
                                          Integer limit) {
        if (limit != null && (limit < 1 || limit > MAX_HISTORY_LIMIT)) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        HistoryQuery query = new HistoryQuery(
                parseDate("start_date", startDate),
                parseDate("end_date", endDate),
                blankToNull(callId),
                status == null || status.isBlank() ? null : AnalysisStatus.from(status),
                limit);
        return resultStore.query(query);
    }

    public StoreStats historyStats() {
        return resultStore.stats();
    }

    public boolean clearHistory() {
        return resultStore.clear();
    }

    public boolean backupHistory(String backupPath) {
        return resultStore.backup(blankToNull(backupPath));
    }

    public SystemInfoResponse systemInfo() {
        return new SystemInfoResponse(
                llmInvoker.getModelName(),
                llmInvoker.getTemperature(),
                llmInvoker.getMaxRetries(),
                failureDetector.getFrustrationKeywordCount(),
                failureDetector.getConfusionPhraseCount(),
                failureDetector.getShortResponseThreshold());
    }

    private static JsonNode requireNoError(JsonNode result, String context) {
        if (result.has("error")) {
            throw new LlmInvocationException(context + ": " + result.get("error").asText());
        }
        return result;
    }

    private static Instant parseDate(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Timestamps.parse(value)
                .orElseThrow(() -> new IllegalArgumentException(name + " must be an ISO-8601 date-time: " + value));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
