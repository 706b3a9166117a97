package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.Confirmation;
import com.raava.concierge.extraction.signal.Signal;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Detects a yes/no answer at the start of a message. Negatives are checked first so
 * "no, not yet" never reads as a yes.
 */
@Component
@Order(50)
public class ConfirmationDetector implements SignalDetector {

    private static final Pattern NEGATIVE = Pattern.compile(
            "^\\s*(no(?!\\.?\\s*\\d)|nope|nah|not yet|not now|cancel|don't|do not|hold off|wait|stop)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern POSITIVE = Pattern.compile(
            "^\\s*(yes|yeah|yep|yup|sure|ok|okay|confirm(?:ed)?|go ahead|approve(?:d)?|sounds good|looks good|perfect|please do|do it|absolutely|definitely|correct|that's right|list it)\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<Signal> detect(String utterance, StageExpectation expectation) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        if (NEGATIVE.matcher(utterance).find()) {
            return Optional.of(new Confirmation(false));
        }
        if (POSITIVE.matcher(utterance).find()) {
            return Optional.of(new Confirmation(true));
        }
        return Optional.empty();
    }
}
