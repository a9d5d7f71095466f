package com.callreplay.infrastructure.ai.pipeline;

import com.callreplay.domain.analysis.model.AnalysisResponse;
import com.callreplay.domain.analysis.model.AnalysisResult;
import com.callreplay.domain.analysis.model.CallTranscript;
import com.callreplay.domain.analysis.model.IngestAck;
import com.callreplay.domain.analysis.model.PipelineResult;
import com.callreplay.infrastructure.ai.analysis.CallAnalyzer;
import com.callreplay.infrastructure.storage.PipelineArtifactStore;
import com.callreplay.infrastructure.storage.StorageException;
import com.callreplay.testutil.SyncExecutor;
import com.callreplay.testutil.Transcripts;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CallPipelineTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:30:00Z"), ZoneOffset.UTC);

    @Mock
    private CallAnalyzer callAnalyzer;

    @Mock
    private PipelineArtifactStore artifactStore;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private CallPipeline pipeline;

    @BeforeEach
    void setUp() {
        SyncExecutor syncExecutor = new SyncExecutor();
        pipeline = new CallPipeline(callAnalyzer, artifactStore, syncExecutor, syncExecutor, FIXED_CLOCK);
    }

    private static AnalysisResult result(String intent, boolean issue, double confidence) {
        return new AnalysisResult(intent, "summary", issue,
                issue ? "Bot missed the request" : "No issues detected", "Fix it", confidence);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Nested
    @DisplayName("Batch pipeline")
    class Execute {

        @Test
        @DisplayName("Analyze, fix issues, summarize and persist in one run")
        void fullRun() throws Exception {
            CallTranscript a = Transcripts.frustrated("call-a");
            CallTranscript b = Transcripts.clean("call-b");
            CallTranscript c = Transcripts.frustrated("call-c");
            AnalysisResult issue = result("Find a branch", true, 0.9);
            AnalysisResult fine = result("Book a table", false, 0.7);

            when(callAnalyzer.analyze(a)).thenReturn(AnalysisResponse.analyzed("call-a", issue));
            when(callAnalyzer.analyze(b)).thenReturn(AnalysisResponse.skipped("call-b", "No issues detected (confidence: 0.00)"));
            when(callAnalyzer.analyze(c)).thenReturn(AnalysisResponse.analyzed("call-c", fine));
            when(callAnalyzer.generateDetailedFixes(issue)).thenReturn(json("{\"priority\": \"high\"}"));
            when(callAnalyzer.generateSummary(List.of(issue, fine))).thenReturn(json("{\"trends\": \"branch questions\"}"));

            PipelineResult result = pipeline.execute(List.of(a, b, c)).join();

            assertThat(result.isFailed()).isFalse();
            assertThat(result.pipelineId()).isEqualTo("pipeline_20240315_103000");
            assertThat(result.timestamp()).isEqualTo("2024-03-15T10:30:00Z");
            assertThat(result.inputCount()).isEqualTo(3);
            assertThat(result.analysisResults()).extracting(AnalysisResponse::callId)
                    .containsExactly("call-a", "call-b", "call-c");
            assertThat(result.fixResults()).containsOnlyKeys("call-a");
            assertThat(result.fixResults().get("call-a").get("priority").asText()).isEqualTo("high");
            assertThat(result.summary().get("trends").asText()).isEqualTo("branch questions");
            assertThat(result.statistics().analyzed()).isEqualTo(2);
            assertThat(result.statistics().skipped()).isEqualTo(1);
            assertThat(result.statistics().issueRate()).isEqualTo(0.5);
            assertThat(result.statistics().processingEfficiency()).isEqualTo(1.0);
            verify(artifactStore).savePipelineResult(result);
        }

        @Test
        @DisplayName("Nothing analyzed: no fixes and a summary error document")
        void noAnalyses_summaryErrorDocument() {
            CallTranscript clean = Transcripts.clean("call-clean");
            when(callAnalyzer.analyze(clean)).thenReturn(AnalysisResponse.skipped("call-clean", "No issues detected (confidence: 0.00)"));

            PipelineResult result = pipeline.execute(List.of(clean)).join();

            assertThat(result.fixResults()).isEmpty();
            assertThat(result.summary().get("error").asText()).isEqualTo("No analysis results to summarize");
            verify(callAnalyzer, never()).generateSummary(any());
        }

        @Test
        @DisplayName("Failure while analyzing one call does not stop the batch")
        void analyzerThrows_errorResponseForThatCall() {
            CallTranscript broken = Transcripts.frustrated("call-broken");
            CallTranscript clean = Transcripts.clean("call-clean");
            when(callAnalyzer.analyze(broken)).thenThrow(new IllegalStateException("worker crashed"));
            when(callAnalyzer.analyze(clean)).thenReturn(AnalysisResponse.skipped("call-clean", "No issues detected (confidence: 0.00)"));

            PipelineResult result = pipeline.execute(List.of(broken, clean)).join();

            assertThat(result.analysisResults()).hasSize(2);
            assertThat(result.analysisResults().get(0).error()).isEqualTo("worker crashed");
            assertThat(result.statistics().errors()).isEqualTo(1);
        }

        @Test
        @DisplayName("Fix generation failure is recorded under the call id")
        void fixGenerationThrows_errorDocument() throws Exception {
            CallTranscript a = Transcripts.frustrated("call-a");
            AnalysisResult issue = result("Find a branch", true, 0.9);
            when(callAnalyzer.analyze(a)).thenReturn(AnalysisResponse.analyzed("call-a", issue));
            when(callAnalyzer.generateDetailedFixes(issue)).thenThrow(new IllegalStateException("boom"));
            when(callAnalyzer.generateSummary(List.of(issue))).thenReturn(json("{}"));

            PipelineResult result = pipeline.execute(List.of(a)).join();

            assertThat(result.fixResults().get("call-a").get("error").asText()).isEqualTo("boom");
        }

        @Test
        @DisplayName("Persistence failure yields a failed result instead of an exception")
        void persistenceFailure_failedResult() {
            CallTranscript clean = Transcripts.clean("call-clean");
            when(callAnalyzer.analyze(clean)).thenReturn(AnalysisResponse.skipped("call-clean", "No issues detected (confidence: 0.00)"));
            when(artifactStore.savePipelineResult(any())).thenThrow(new StorageException("disk full"));

            PipelineResult result = pipeline.execute(List.of(clean)).join();

            assertThat(result.isFailed()).isTrue();
            assertThat(result.pipelineId()).isEqualTo("pipeline_20240315_103000");
            assertThat(result.error()).isEqualTo("disk full");
            assertThat(result.analysisResults()).isNull();
        }

        @Test
        @DisplayName("Results keep input order when later calls finish first")
        void concurrentRun_keepsInputOrder() {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                CallPipeline concurrent = new CallPipeline(callAnalyzer, artifactStore, pool, pool, FIXED_CLOCK);
                List<CallTranscript> transcripts = new ArrayList<>();
                for (int i = 0; i < 6; i++) {
                    CallTranscript transcript = Transcripts.clean("call-" + i);
                    transcripts.add(transcript);
                    long delayMs = (6 - i) * 20L;
                    when(callAnalyzer.analyze(transcript)).thenAnswer(invocation -> {
                        Thread.sleep(delayMs);
                        return AnalysisResponse.skipped(transcript.callId(), "No issues detected (confidence: 0.00)");
                    });
                }

                List<AnalysisResponse> responses = concurrent.analyzeBatch(transcripts);

                assertThat(responses).extracting(AnalysisResponse::callId)
                        .containsExactly("call-0", "call-1", "call-2", "call-3", "call-4", "call-5");
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Ingestion")
    class Ingest {

        @Test
        @DisplayName("Call marked failed is stored and analyzed in the background")
        void failedStatus_analyzed() {
            CallTranscript transcript = Transcripts.frustrated("call-live");
            Map<String, Object> metadata = Map.of("status", "failed", "duration_seconds", 42);
            CallTranscript withMetadata = transcript.withMetadata(metadata);
            when(callAnalyzer.analyze(withMetadata)).thenReturn(AnalysisResponse.error("call-live", "timeout"));

            IngestAck ack = pipeline.ingest(transcript, metadata);

            assertThat(ack.status()).isEqualTo(IngestAck.RECEIVED_AND_ANALYZING);
            assertThat(ack.callId()).isEqualTo("call-live");
            verify(artifactStore).saveTranscript(withMetadata);
            verify(callAnalyzer).analyze(withMetadata);
        }

        @Test
        @DisplayName("Any other status is only stored")
        void otherStatus_storedOnly() {
            IngestAck ack = pipeline.ingest(Transcripts.clean("call-ok"), Map.of("status", "completed"));

            assertThat(ack.status()).isEqualTo(IngestAck.RECEIVED);
            assertThat(ack.message()).isEqualTo("Transcript stored for batch processing");
            verify(callAnalyzer, never()).analyze(any());
        }

        @Test
        @DisplayName("Missing metadata keeps the transcript unchanged")
        void noMetadata_storedAsIs() {
            CallTranscript transcript = Transcripts.clean("call-plain");

            IngestAck ack = pipeline.ingest(transcript, null);

            assertThat(ack.status()).isEqualTo(IngestAck.RECEIVED);
            verify(artifactStore).saveTranscript(transcript);
        }

        @Test
        @DisplayName("Transcript store failure is logged and ingestion still succeeds")
        void storeFailure_stillReceived() {
            when(artifactStore.saveTranscript(any())).thenThrow(new StorageException("read-only"));

            IngestAck ack = pipeline.ingest(Transcripts.clean("call-ro"), Map.of());

            assertThat(ack.status()).isEqualTo(IngestAck.RECEIVED);
            assertThat(ack.error()).isNull();
        }

        @Test
        @DisplayName("Acknowledgement returns before the background analysis runs")
        void backgroundAnalysis_detached() {
            List<Runnable> queued = new ArrayList<>();
            Executor deferredExecutor = queued::add;
            CallPipeline deferred = new CallPipeline(callAnalyzer, artifactStore, deferredExecutor, deferredExecutor, FIXED_CLOCK);
            Map<String, Object> metadata = Map.of("status", "failed");
            CallTranscript withMetadata = Transcripts.frustrated("call-bg").withMetadata(metadata);
            when(callAnalyzer.analyze(withMetadata)).thenReturn(AnalysisResponse.error("call-bg", "timeout"));

            IngestAck ack = deferred.ingest(Transcripts.frustrated("call-bg"), metadata);

            assertThat(ack.status()).isEqualTo(IngestAck.RECEIVED_AND_ANALYZING);
            verify(callAnalyzer, never()).analyze(any());

            queued.forEach(Runnable::run);
            verify(callAnalyzer).analyze(withMetadata);
        }

        @Test
        @DisplayName("Rejected background analysis is acknowledged as stored only")
        void rejectedSubmission_receivedOnly() {
            Executor rejecting = command -> {
                throw new RejectedExecutionException("ingestion pool full");
            };
            CallPipeline saturated = new CallPipeline(callAnalyzer, artifactStore, new SyncExecutor(), rejecting, FIXED_CLOCK);

            IngestAck ack = saturated.ingest(Transcripts.frustrated("call-full"), Map.of("status", "failed"));

            assertThat(ack.status()).isEqualTo(IngestAck.RECEIVED);
            assertThat(ack.error()).isNull();
            verify(callAnalyzer, never()).analyze(any());
        }

        @Test
        @DisplayName("Saturated ingestion pool never runs the analysis on the caller thread")
        void saturatedPool_callerNeverBlocks() throws Exception {
            AnalysisExecutorConfig config = new AnalysisExecutorConfig();
            ReflectionTestUtils.setField(config, "concurrency", 1);
            ReflectionTestUtils.setField(config, "ingestionQueueCapacity", 1);
            ThreadPoolTaskExecutor ingestionPool = config.ingestionExecutor();

            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(callAnalyzer.analyze(any())).thenAnswer(invocation -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return AnalysisResponse.error("call-slow", "timeout");
            });

            try {
                CallPipeline limited = new CallPipeline(callAnalyzer, artifactStore, new SyncExecutor(), ingestionPool, FIXED_CLOCK);
                Map<String, Object> failed = Map.of("status", "failed");

                assertThat(limited.ingest(Transcripts.frustrated("call-1"), failed).status())
                        .isEqualTo(IngestAck.RECEIVED_AND_ANALYZING);
                assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
                assertThat(limited.ingest(Transcripts.frustrated("call-2"), failed).status())
                        .isEqualTo(IngestAck.RECEIVED_AND_ANALYZING);

                IngestAck overflow = assertTimeoutPreemptively(Duration.ofSeconds(2),
                        () -> limited.ingest(Transcripts.frustrated("call-3"), failed));

                assertThat(overflow.status()).isEqualTo(IngestAck.RECEIVED);
                assertThat(release.getCount()).isEqualTo(1);
            } finally {
                release.countDown();
                ingestionPool.shutdown();
            }
        }

        @Test
        @DisplayName("Background analysis failure is contained")
        void backgroundFailure_contained() throws Exception {
            CallTranscript transcript = Transcripts.frustrated("call-crash");
            when(callAnalyzer.analyze(transcript)).thenThrow(new IllegalStateException("crash"));

            CompletableFuture<Void> task = pipeline.submitBackgroundAnalysis(transcript);

            assertThat(task.get(1, TimeUnit.SECONDS)).isNull();
            assertThat(task.isCompletedExceptionally()).isFalse();
        }
    }

    @Test
    @DisplayName("Stored pipeline result is the one returned")
    void savedResultMatchesReturned() {
        CallTranscript clean = Transcripts.clean("call-clean");
        when(callAnalyzer.analyze(clean)).thenReturn(AnalysisResponse.skipped("call-clean", "No issues detected (confidence: 0.00)"));

        PipelineResult returned = pipeline.execute(List.of(clean)).join();

        ArgumentCaptor<PipelineResult> saved = ArgumentCaptor.forClass(PipelineResult.class);
        verify(artifactStore).savePipelineResult(saved.capture());
        assertThat(saved.getValue()).isSameAs(returned);
    }
}
