package com.callreplay.infrastructure.ai.analysis;

import com.callreplay.domain.analysis.model.AnalysisResponse;
import com.callreplay.domain.analysis.model.AnalysisResult;
import com.callreplay.domain.analysis.model.AnalysisStatus;
import com.callreplay.infrastructure.ai.LlmInvocationException;
import com.callreplay.infrastructure.ai.LlmInvoker;
import com.callreplay.infrastructure.ai.PromptBuilder;
import com.callreplay.infrastructure.ai.prefilter.FailureDetector;
import com.callreplay.infrastructure.storage.AnalysisResultStore;
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

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CallAnalyzerTest {

    @Mock
    private LlmInvoker llmInvoker;

    @Mock
    private AnalysisResultStore resultStore;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private CallAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new CallAnalyzer(
                new FailureDetector(),
                new PromptBuilder(),
                llmInvoker,
                new AnalysisReplyMapper(),
                resultStore);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("Call passing the prefilter is skipped without an LLM call")
        void cleanCall_skipped() {
            AnalysisResponse response = analyzer.analyze(Transcripts.clean("call-001"));

            assertThat(response.status()).isEqualTo(AnalysisStatus.SKIPPED);
            assertThat(response.reason()).isEqualTo("No issues detected (confidence: 0.00)");
            assertThat(response.analysis()).isNull();
            verify(llmInvoker, never()).invoke(anyString());
            verify(resultStore).append(response);
        }

        @Test
        @DisplayName("Flagged call is sent to the model with the formatted dialog")
        void flaggedCall_analyzed() throws Exception {
            when(llmInvoker.invoke(contains("Turn 3 - User: that's not what i asked!")))
                    .thenReturn(json("""
                            {"intent": "Find the Bandra branch", "issue_detected": true,
                             "issue_reason": "Ignored the location", "confidence_score": 0.9}
                            """));

            AnalysisResponse response = analyzer.analyze(Transcripts.frustrated("call-002"));

            assertThat(response.status()).isEqualTo(AnalysisStatus.ANALYZED);
            assertThat(response.callId()).isEqualTo("call-002");
            assertThat(response.analysis().intent()).isEqualTo("Find the Bandra branch");
            assertThat(response.analysis().issueDetected()).isTrue();
            assertThat(response.analysis().suggestedFix()).isEqualTo("No suggestions");
            assertThat(response.hasIssue()).isTrue();
            verify(resultStore).append(response);
        }

        @Test
        @DisplayName("LLM failure becomes an error response that is still stored")
        void llmFailure_errorResponse() {
            when(llmInvoker.invoke(anyString()))
                    .thenThrow(new LlmInvocationException("LLM call failed after 3 attempts: timeout", 3));

            AnalysisResponse response = analyzer.analyze(Transcripts.frustrated("call-003"));

            assertThat(response.status()).isEqualTo(AnalysisStatus.ERROR);
            assertThat(response.error()).isEqualTo("LLM call failed after 3 attempts: timeout");

            ArgumentCaptor<AnalysisResponse> stored = ArgumentCaptor.forClass(AnalysisResponse.class);
            verify(resultStore).append(stored.capture());
            assertThat(stored.getValue().status()).isEqualTo(AnalysisStatus.ERROR);
        }

        @Test
        @DisplayName("Store failure does not change the returned response")
        void storeFailure_ignored() {
            when(resultStore.append(any())).thenReturn(false);

            AnalysisResponse response = analyzer.analyze(Transcripts.clean("call-004"));

            assertThat(response.status()).isEqualTo(AnalysisStatus.SKIPPED);
        }
    }

    @Nested
    @DisplayName("Follow-up generation")
    class FollowUps {

        private final AnalysisResult issue = new AnalysisResult(
                "Find the Bandra branch", "Listed branches", true,
                "Ignored the location", "Answer directly", 0.9);

        @Test
        @DisplayName("Fix suggestions are returned as the model produced them")
        void fixes_returned() throws Exception {
            when(llmInvoker.invoke(contains("Issue Reason: Ignored the location")))
                    .thenReturn(json("{\"priority\": \"high\"}"));

            JsonNode fixes = analyzer.generateDetailedFixes(issue);

            assertThat(fixes.get("priority").asText()).isEqualTo("high");
        }

        @Test
        @DisplayName("Fix generation failure becomes an error document")
        void fixes_errorDocument() {
            when(llmInvoker.invoke(anyString())).thenThrow(new LlmInvocationException("quota exceeded"));

            JsonNode fixes = analyzer.generateDetailedFixes(issue);

            assertThat(fixes.get("error").asText()).isEqualTo("quota exceeded");
        }

        @Test
        @DisplayName("Summary failure becomes an error document")
        void summary_errorDocument() {
            when(llmInvoker.invoke(contains("Call 1:"))).thenThrow(new LlmInvocationException("quota exceeded"));

            JsonNode summary = analyzer.generateSummary(List.of(issue));

            assertThat(summary.size()).isEqualTo(1);
            assertThat(summary.get("error").asText()).isEqualTo("quota exceeded");
        }
    }

    @Test
    @DisplayName("prefilter exposes the detector verdict")
    void prefilter_delegates() {
        assertThat(analyzer.prefilter(Transcripts.frustrated("call-005")).confidence()).isEqualTo(0.6);
    }
}
