package com.callreplay.infrastructure.ai.analysis;

import com.callreplay.domain.analysis.model.AnalysisResponse;
import com.callreplay.domain.analysis.model.AnalysisResult;
import com.callreplay.domain.analysis.model.CallTranscript;
import com.callreplay.domain.analysis.model.PrefilterVerdict;
import com.callreplay.infrastructure.ai.LlmInvoker;
import com.callreplay.infrastructure.ai.PromptBuilder;
import com.callreplay.infrastructure.ai.prefilter.FailureDetector;
import com.callreplay.infrastructure.storage.AnalysisResultStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Per-call unit of work: prefilter → prompt → LLM → typed result → store.
 * Also produces the follow-up fix suggestions and multi-call summaries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallAnalyzer {

    private final FailureDetector failureDetector;
    private final PromptBuilder promptBuilder;
    private final LlmInvoker llmInvoker;
    private final AnalysisReplyMapper replyMapper;
    private final AnalysisResultStore resultStore;

    /**
     * Analyzes one transcript and appends the outcome to the result store.
     * Never throws: any failure becomes an {@code error} response.
     */
    public AnalysisResponse analyze(CallTranscript transcript) {
        AnalysisResponse response = evaluate(transcript);
        resultStore.append(response);
        log.info("Analyzed call {}: {}", transcript.callId(), response.status().getValue());
        return response;
    }

    public PrefilterVerdict prefilter(CallTranscript transcript) {
        return failureDetector.evaluate(transcript);
    }

    public JsonNode generateDetailedFixes(AnalysisResult analysis) {
        try {
            return llmInvoker.invoke(promptBuilder.buildFixSuggestionPrompt(analysis));
        } catch (RuntimeException e) {
            log.error("Error generating detailed fixes: {}", messageOf(e));
            return errorDocument(messageOf(e));
        }
    }

    public JsonNode generateSummary(List<AnalysisResult> analyses) {
        try {
            return llmInvoker.invoke(promptBuilder.buildSummaryPrompt(analyses));
        } catch (RuntimeException e) {
            log.error("Error generating summary: {}", messageOf(e));
            return errorDocument(messageOf(e));
        }
    }

    private static JsonNode errorDocument(String message) {
        return JsonNodeFactory.instance.objectNode().put("error", message);
    }

    private AnalysisResponse evaluate(CallTranscript transcript) {
        try {
            PrefilterVerdict verdict = failureDetector.evaluate(transcript);
            if (!verdict.failed()) {
                return AnalysisResponse.skipped(transcript.callId(), String.format(Locale.ROOT,
                        "No issues detected (confidence: %.2f)", verdict.confidence()));
            }

            String prompt = promptBuilder.buildAnalysisPrompt(transcript.dialog());
            JsonNode reply = llmInvoker.invoke(prompt);
            return AnalysisResponse.analyzed(transcript.callId(), replyMapper.toAnalysisResult(reply));
        } catch (RuntimeException e) {
            log.error("Error analyzing transcript {}: {}", transcript.callId(), messageOf(e));
            return AnalysisResponse.error(transcript.callId(), messageOf(e));
        }
    }

    static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
