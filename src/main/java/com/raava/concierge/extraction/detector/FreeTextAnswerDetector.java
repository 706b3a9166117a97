package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.ExpectationKind;
import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.FreeTextAnswer;
import com.raava.concierge.extraction.signal.Signal;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Takes the whole message as the answer when the stage asked one open question
 * (a model name, a colour, why the car is being sold).
 *
 * Runs first so that a lexicon match from a later detector for the same field wins.
 */
@Component
@Order(5)
public class FreeTextAnswerDetector implements SignalDetector {

    private static final int MAX_LENGTH = 200;

    private static final Pattern LEAD_IN = Pattern.compile(
            "^\\s*(?:it'?s|it is|its|the|a|an|because|reason is|the reason is|i'?m|i am)\\s+(?:an?\\s+|the\\s+)?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NOT_AN_ANSWER = Pattern.compile(
            "^\\s*(?:\\d+|yes|no|ok|okay|sure|hi|hello|hey|thanks|thank you|cancel|start over)\\s*[.!?]*\\s*$",
            Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<Signal> detect(String utterance, StageExpectation expectation) {
        if (utterance == null || utterance.isBlank() || expectation == null
                || expectation.getKind() != ExpectationKind.FREE_TEXT || expectation.getFreeTextField() == null) {
            return Optional.empty();
        }
        if (NOT_AN_ANSWER.matcher(utterance).matches()) {
            return Optional.empty();
        }
        String answer = LEAD_IN.matcher(utterance.trim()).replaceFirst("").trim();
        answer = answer.replaceAll("[.!]+$", "").trim();
        if (answer.isEmpty()) {
            return Optional.empty();
        }
        if (answer.length() > MAX_LENGTH) {
            answer = answer.substring(0, MAX_LENGTH);
        }
        return Optional.of(new FreeTextAnswer(expectation.getFreeTextField(), answer));
    }
}
