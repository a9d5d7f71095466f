package com.callreplay.infrastructure.ai;

import com.callreplay.domain.analysis.model.AnalysisResult;
import com.callreplay.domain.analysis.model.DialogueTurn;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Component
public class PromptBuilder {

    private static final String ANALYST_PROMPT = """
            You are an expert AI call quality analyst specializing in restaurant customer service calls.
            Your job is to analyze conversations between customers and AI bots to identify issues and suggest improvements.

            Key areas to focus on:
            1. Intent recognition accuracy
            2. Response relevance and helpfulness
            3. Conversation flow and naturalness
            4. Problem resolution effectiveness
            5. Customer satisfaction indicators

            Always respond in valid JSON format with the exact fields specified.""";

    private static final String ANALYSIS_FORMAT = """
            Please provide a detailed analysis in the following JSON format:

            {
                "intent": "Brief description of what the customer was trying to accomplish",
                "bot_response_summary": "Summary of how the bot responded throughout the conversation",
                "issue_detected": true/false,
                "issue_reason": "Detailed explanation of what went wrong (or 'No issues detected' if successful)",
                "suggested_fix": "Specific, actionable suggestions to improve the bot's performance",
                "confidence_score": 0.0-1.0,
                "severity": "low/medium/high",
                "categories": ["list", "of", "issue", "categories"],
                "key_moments": [
                    {
                        "turn": "turn number",
                        "speaker": "user/bot",
                        "issue": "description of what happened"
                    }
                ]
            }

            Focus on:
            - Did the bot understand the customer's intent correctly?
            - Were the responses relevant and helpful?
            - Did the conversation flow naturally?
            - Was the customer's problem resolved?
            - What specific improvements would make this better?

            Respond only with valid JSON.""";

    private static final String FIX_FORMAT = """
            Please provide detailed, actionable suggestions in JSON format:

            {
                "prompt_improvements": [
                    {
                        "issue": "description of the prompt problem",
                        "current_prompt": "what the current prompt likely says",
                        "suggested_prompt": "improved prompt text",
                        "rationale": "why this change would help"
                    }
                ],
                "logic_improvements": [
                    {
                        "issue": "description of the logic problem",
                        "current_behavior": "what the bot currently does",
                        "suggested_behavior": "what the bot should do",
                        "implementation": "how to implement this change"
                    }
                ],
                "training_suggestions": [
                    {
                        "scenario": "type of scenario to train on",
                        "examples": ["example", "conversations"],
                        "expected_outcome": "what should happen"
                    }
                ],
                "priority": "high/medium/low",
                "estimated_impact": "description of expected improvement"
            }""";

    private static final String SUMMARY_FORMAT = """
            Provide a summary in JSON format:

            {
                "common_issues": [
                    {
                        "issue": "description",
                        "frequency": "how often it occurs",
                        "impact": "severity level"
                    }
                ],
                "top_improvements": [
                    {
                        "improvement": "description",
                        "priority": "high/medium/low",
                        "expected_benefit": "what this would achieve"
                    }
                ],
                "overall_quality_score": 0.0-1.0,
                "trends": "description of patterns across calls",
                "recommendations": [
                    "specific action items"
                ]
            }""";

    public String buildAnalysisPrompt(List<DialogueTurn> dialog) {
        return ANALYST_PROMPT
                + "\n\nANALYZE THIS RESTAURANT CUSTOMER SERVICE CALL:\n\n"
                + formatConversation(dialog)
                + "\n\n" + ANALYSIS_FORMAT;
    }

    public String buildFixSuggestionPrompt(AnalysisResult analysis) {
        return ANALYST_PROMPT
                + "\n\nBASED ON THIS ANALYSIS, GENERATE SPECIFIC FIXES:\n\n"
                + formatAnalysisDetail(analysis)
                + "\n\n" + FIX_FORMAT;
    }

    public String buildSummaryPrompt(List<AnalysisResult> analyses) {
        String analysesText = IntStream.range(0, analyses.size())
                .mapToObj(i -> "Call " + (i + 1) + ":\n" + formatAnalysisBrief(analyses.get(i)))
                .collect(Collectors.joining("\n\n"));

        return ANALYST_PROMPT
                + "\n\nSUMMARIZE THESE CALL ANALYSES:\n\n"
                + analysesText
                + "\n\n" + SUMMARY_FORMAT;
    }

    String formatConversation(List<DialogueTurn> dialog) {
        return IntStream.range(0, dialog.size())
                .mapToObj(i -> {
                    DialogueTurn turn = dialog.get(i);
                    return "Turn " + (i + 1) + " - " + speakerLabel(turn) + ": " + turn.text().strip();
                })
                .collect(Collectors.joining("\n"));
    }

    private String speakerLabel(DialogueTurn turn) {
        String value = turn.speaker().getValue();
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private String formatAnalysisDetail(AnalysisResult analysis) {
        return "Intent: " + analysis.intent() + "\n"
                + "Bot Response Summary: " + analysis.botResponseSummary() + "\n"
                + "Issue Detected: " + analysis.issueDetected() + "\n"
                + "Issue Reason: " + analysis.issueReason() + "\n"
                + "Suggested Fix: " + analysis.suggestedFix() + "\n"
                + "Confidence: " + analysis.confidenceScore();
    }

    private String formatAnalysisBrief(AnalysisResult analysis) {
        return "Intent: " + analysis.intent() + "\n"
                + "Issue Detected: " + analysis.issueDetected() + "\n"
                + "Issue Reason: " + analysis.issueReason() + "\n"
                + "Confidence: " + analysis.confidenceScore();
    }
}
