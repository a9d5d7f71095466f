package com.callreplay.infrastructure.ai.prefilter;

import com.callreplay.domain.analysis.model.CallTranscript;
import com.callreplay.domain.analysis.model.DialogueTurn;
import com.callreplay.domain.analysis.model.PrefilterVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Heuristic prefilter deciding whether a call is worth sending to the model.
 * <p>
 * Five detectors run over the whole dialog and each adds a fixed weight when
 * it fires. The decision threshold is compared against the raw weight sum;
 * only the reported confidence is capped at 1.0.
 * </p>
 * Weights are kept in hundredths so sums compare exactly.
 */
@Slf4j
@Component
public class FailureDetector {

    static final int MIN_TURNS = 3;
    static final int EARLY_END_TURNS = 5;
    static final int SHORT_RESPONSE_LIMIT = 2;

    static final int SHORT_CALL_CONFIDENCE = 80;
    static final int FRUSTRATION_WEIGHT = 40;
    static final int REPETITION_WEIGHT = 30;
    static final int FLOW_WEIGHT = 20;
    static final int CONFUSION_WEIGHT = 30;
    static final int ABRUPT_ENDING_WEIGHT = 20;
    static final int FAILURE_THRESHOLD = 30;

    static final List<String> FRUSTRATION_KEYWORDS = List.of(
            "not helpful", "hello?", "what?", "you there?", "makes no sense",
            "that's not what i asked", "i don't understand", "wrong answer",
            "that doesn't help", "can you hear me", "are you listening",
            "this is ridiculous", "useless", "stupid", "idiot"
    );

    static final List<String> CONFUSION_PHRASES = List.of(
            "i don't understand", "could you repeat", "i'm not sure",
            "let me try to help", "i apologize", "i'm sorry"
    );

    private static final List<String> QUESTION_MARKERS = List.of("?", "help", "what", "how");

    @Value("${prefilter.short-response-threshold:10}")
    private int shortResponseThreshold = 10;

    private record Detection(boolean detected, List<String> reasons) {
        static Detection none() {
            return new Detection(false, List.of());
        }
    }

    public PrefilterVerdict evaluate(CallTranscript transcript) {
        List<DialogueTurn> dialog = transcript.dialog();

        if (dialog.size() < MIN_TURNS) {
            return new PrefilterVerdict(true, SHORT_CALL_CONFIDENCE / 100.0,
                    List.of("Call too short - likely incomplete"), dialog.size());
        }

        List<String> reasons = new ArrayList<>();
        int rawScore = 0;

        rawScore += apply(detectUserFrustration(dialog), FRUSTRATION_WEIGHT, reasons);
        rawScore += apply(detectBotRepetition(dialog), REPETITION_WEIGHT, reasons);
        rawScore += apply(detectFlowIssues(dialog), FLOW_WEIGHT, reasons);
        rawScore += apply(detectBotConfusion(dialog), CONFUSION_WEIGHT, reasons);
        rawScore += apply(detectAbruptEnding(dialog), ABRUPT_ENDING_WEIGHT, reasons);

        boolean failed = rawScore >= FAILURE_THRESHOLD;
        double confidence = Math.min(rawScore, 100) / 100.0;

        log.debug("[Prefilter] call={}, rawScore={}, failed={}, reasons={}",
                transcript.callId(), rawScore, failed, reasons);

        return new PrefilterVerdict(failed, confidence, reasons, dialog.size());
    }

    public int getShortResponseThreshold() {
        return shortResponseThreshold;
    }

    public int getFrustrationKeywordCount() {
        return FRUSTRATION_KEYWORDS.size();
    }

    public int getConfusionPhraseCount() {
        return CONFUSION_PHRASES.size();
    }

    private int apply(Detection detection, int weight, List<String> reasons) {
        if (!detection.detected()) {
            return 0;
        }
        reasons.addAll(detection.reasons());
        return weight;
    }

    private Detection detectUserFrustration(List<DialogueTurn> dialog) {
        List<String> reasons = new ArrayList<>();
        for (DialogueTurn turn : dialog) {
            if (!turn.isUser()) continue;
            firstMatch(turn.text(), FRUSTRATION_KEYWORDS)
                    .ifPresent(keyword -> reasons.add("User frustration detected: '" + keyword + "'"));
        }
        return new Detection(!reasons.isEmpty(), reasons);
    }

    private Detection detectBotRepetition(List<DialogueTurn> dialog) {
        Map<String, Integer> occurrences = new LinkedHashMap<>();
        for (DialogueTurn turn : dialog) {
            if (turn.isBot()) {
                occurrences.merge(turn.text().strip(), 1, Integer::sum);
            }
        }

        long repeated = occurrences.values().stream().filter(count -> count >= 2).count();
        if (repeated == 0) {
            return Detection.none();
        }
        return new Detection(true,
                List.of("Bot repeated responses: " + repeated + " unique responses repeated"));
    }

    private Detection detectFlowIssues(List<DialogueTurn> dialog) {
        long shortResponses = dialog.stream()
                .filter(DialogueTurn::isBot)
                .filter(turn -> turn.text().strip().length() < shortResponseThreshold)
                .count();

        if (shortResponses <= SHORT_RESPONSE_LIMIT) {
            return Detection.none();
        }
        return new Detection(true, List.of("Multiple very short bot responses: " + shortResponses));
    }

    private Detection detectBotConfusion(List<DialogueTurn> dialog) {
        List<String> reasons = new ArrayList<>();
        for (DialogueTurn turn : dialog) {
            if (!turn.isBot()) continue;
            firstMatch(turn.text(), CONFUSION_PHRASES)
                    .ifPresent(phrase -> reasons.add("Bot confusion detected: '" + phrase + "'"));
        }
        return new Detection(!reasons.isEmpty(), reasons);
    }

    private Detection detectAbruptEnding(List<DialogueTurn> dialog) {
        List<String> reasons = new ArrayList<>();

        if (dialog.size() < EARLY_END_TURNS) {
            reasons.add("Conversation ended very early");
        }

        DialogueTurn last = dialog.get(dialog.size() - 1);
        if (last.isUser()) {
            String lastText = last.text().toLowerCase(Locale.ROOT);
            if (QUESTION_MARKERS.stream().anyMatch(lastText::contains)) {
                reasons.add("Conversation ended with user question/request");
            }
        }

        return new Detection(!reasons.isEmpty(), reasons);
    }

    private static Optional<String> firstMatch(String text, List<String> candidates) {
        String lower = text.toLowerCase(Locale.ROOT);
        return candidates.stream().filter(lower::contains).findFirst();
    }
}
