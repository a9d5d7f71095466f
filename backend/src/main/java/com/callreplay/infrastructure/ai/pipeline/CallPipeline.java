package com.callreplay.infrastructure.ai.pipeline;

import com.callreplay.domain.analysis.model.AnalysisResponse;
import com.callreplay.domain.analysis.model.AnalysisResult;
import com.callreplay.domain.analysis.model.CallTranscript;
import com.callreplay.domain.analysis.model.IngestAck;
import com.callreplay.domain.analysis.model.PipelineResult;
import com.callreplay.infrastructure.ai.analysis.CallAnalyzer;
import com.callreplay.infrastructure.storage.PipelineArtifactStore;
import com.callreplay.infrastructure.storage.StorageException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Call analysis pipeline orchestrator.
 * <p>
 * Batch: analyze every transcript → fix suggestions for calls with issues →
 * one summary over all analyses → persist the run.
 * Ingestion: store the raw transcript and, when its metadata marks the call
 * as failed, hand the analysis to the worker pool without waiting for it.
 * </p>
 * Batch LLM calls run on the analysis executor, ingestion analyses on the
 * ingestion executor. Batch results keep the order in which transcripts
 * were submitted.
 */
@Slf4j
@Component
public class CallPipeline {

    static final String NO_ANALYSES_TO_SUMMARIZE = "No analysis results to summarize";

    private static final DateTimeFormatter PIPELINE_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final CallAnalyzer callAnalyzer;
    private final PipelineArtifactStore artifactStore;
    private final Executor executor;
    private final Executor ingestionExecutor;
    private final Clock clock;

    public CallPipeline(CallAnalyzer callAnalyzer,
                        PipelineArtifactStore artifactStore,
                        @Qualifier(AnalysisExecutorConfig.ANALYSIS_EXECUTOR) Executor executor,
                        @Qualifier(AnalysisExecutorConfig.INGESTION_EXECUTOR) Executor ingestionExecutor,
                        Clock clock) {
        this.callAnalyzer = callAnalyzer;
        this.artifactStore = artifactStore;
        this.executor = executor;
        this.ingestionExecutor = ingestionExecutor;
        this.clock = clock;
    }

    /**
     * Runs the full batch pipeline. The returned future always completes
     * normally; a failure while assembling or persisting the run yields a
     * result carrying only the pipeline id and the error.
     */
    public CompletableFuture<PipelineResult> execute(List<CallTranscript> transcripts) {
        String pipelineId = "pipeline_" + PIPELINE_ID_FORMAT.format(clock.instant().atZone(clock.getZone()));
        log.info("[Pipeline] {} starting for {} transcripts", pipelineId, transcripts.size());

        CompletableFuture<PipelineResult> run;
        try {
            run = analyzeAll(transcripts)
                    .thenCompose(analyses -> generateFixes(analyses)
                            .thenCompose(fixes -> summarize(analyses)
                                    .thenApply(summary -> complete(pipelineId, transcripts.size(),
                                            analyses, fixes, summary))));
        } catch (RuntimeException e) {
            run = CompletableFuture.failedFuture(e);
        }

        return run.exceptionally(e -> {
            Throwable cause = unwrap(e);
            log.error("[Pipeline] {} failed: {}", pipelineId, cause.getMessage(), cause);
            return PipelineResult.failed(pipelineId, messageOf(cause));
        });
    }

    /**
     * Analysis step only, blocking until every transcript has a response.
     */
    public List<AnalysisResponse> analyzeBatch(List<CallTranscript> transcripts) {
        log.info("Starting batch analysis of {} calls", transcripts.size());
        return analyzeAll(transcripts).join();
    }

    /**
     * Stores the raw transcript and, if {@code metadata.status} is "failed",
     * schedules a background analysis. The caller never sees the analysis
     * outcome; it is appended to the result store and failures are only logged.
     * When the ingestion pool is saturated no analysis is scheduled and the
     * transcript is acknowledged as stored only.
     */
    public IngestAck ingest(CallTranscript transcript, Map<String, Object> metadata) {
        CallTranscript received = metadata != null ? transcript.withMetadata(metadata) : transcript;
        try {
            storeTranscript(received);

            boolean shouldAnalyze = metadata != null && "failed".equals(metadata.get("status"));
            if (shouldAnalyze) {
                try {
                    submitBackgroundAnalysis(received);
                    return IngestAck.analyzing(received.callId());
                } catch (RejectedExecutionException e) {
                    log.warn("Ingestion pool saturated, not analyzing {}: {}", received.callId(), e.getMessage());
                }
            }
            return IngestAck.received(received.callId());
        } catch (RuntimeException e) {
            log.error("Error ingesting transcript {}: {}", received.callId(), e.getMessage());
            return IngestAck.failed(received.callId(), messageOf(e));
        }
    }

    CompletableFuture<Void> submitBackgroundAnalysis(CallTranscript transcript) {
        return CompletableFuture
                .runAsync(() -> {
                    AnalysisResponse response = callAnalyzer.analyze(transcript);
                    log.info("Background analysis completed for {}: {}",
                            transcript.callId(), response.status().getValue());
                }, ingestionExecutor)
                .exceptionally(e -> {
                    log.error("Background analysis failed for {}: {}",
                            transcript.callId(), unwrap(e).getMessage());
                    return null;
                });
    }

    private void storeTranscript(CallTranscript transcript) {
        try {
            artifactStore.saveTranscript(transcript);
        } catch (StorageException e) {
            log.error("Error storing transcript {}: {}", transcript.callId(), e.getMessage());
        }
    }

    private CompletableFuture<List<AnalysisResponse>> analyzeAll(List<CallTranscript> transcripts) {
        List<CompletableFuture<AnalysisResponse>> futures = transcripts.stream()
                .map(transcript -> CompletableFuture
                        .supplyAsync(() -> callAnalyzer.analyze(transcript), executor)
                        .exceptionally(e -> AnalysisResponse.error(transcript.callId(), messageOf(unwrap(e)))))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }

    private CompletableFuture<Map<String, JsonNode>> generateFixes(List<AnalysisResponse> analyses) {
        List<AnalysisResponse> withIssues = analyses.stream().filter(AnalysisResponse::hasIssue).toList();
        log.info("[Pipeline] Generating detailed fixes for {} problematic calls", withIssues.size());

        List<CompletableFuture<JsonNode>> futures = withIssues.stream()
                .map(response -> CompletableFuture
                        .supplyAsync(() -> callAnalyzer.generateDetailedFixes(response.analysis()), executor)
                        .exceptionally(e -> {
                            log.error("Error generating fixes for {}: {}", response.callId(), unwrap(e).getMessage());
                            return errorDocument(messageOf(unwrap(e)));
                        }))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<String, JsonNode> fixes = new LinkedHashMap<>();
                    for (int i = 0; i < withIssues.size(); i++) {
                        fixes.put(withIssues.get(i).callId(), futures.get(i).join());
                    }
                    return fixes;
                });
    }

    private CompletableFuture<JsonNode> summarize(List<AnalysisResponse> analyses) {
        List<AnalysisResult> results = analyses.stream()
                .filter(AnalysisResponse::hasAnalysis)
                .map(AnalysisResponse::analysis)
                .toList();

        if (results.isEmpty()) {
            return CompletableFuture.completedFuture(errorDocument(NO_ANALYSES_TO_SUMMARIZE));
        }

        log.info("[Pipeline] Generating summary over {} analyses", results.size());
        return CompletableFuture
                .supplyAsync(() -> callAnalyzer.generateSummary(results), executor)
                .exceptionally(e -> errorDocument(messageOf(unwrap(e))));
    }

    private PipelineResult complete(String pipelineId,
                                    int inputCount,
                                    List<AnalysisResponse> analyses,
                                    Map<String, JsonNode> fixes,
                                    JsonNode summary) {
        PipelineResult result = PipelineResult.completed(
                pipelineId,
                DateTimeFormatter.ISO_INSTANT.format(clock.instant()),
                inputCount,
                analyses,
                fixes,
                summary);

        artifactStore.savePipelineResult(result);
        log.info("[Pipeline] {} completed. Processed {} calls", pipelineId, inputCount);
        return result;
    }

    private static JsonNode errorDocument(String message) {
        return JsonNodeFactory.instance.objectNode().put("error", message);
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
