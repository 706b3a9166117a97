package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.DateTimeSignal;
import com.raava.concierge.extraction.signal.Signal;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

/**
 * Detects an appointment date and/or time. Relative dates are resolved against the injected clock.
 */
@Component
@Order(40)
@RequiredArgsConstructor
public class DateTimeDetector implements SignalDetector {

    private final Clock clock;

    @Override
    public Optional<Signal> detect(String utterance, StageExpectation expectation) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        LocalDate date = DateTimeParser.parseDate(utterance, LocalDate.now(clock)).orElse(null);
        LocalTime time = DateTimeParser.parseTime(utterance).orElse(null);
        if (date == null && time == null) {
            return Optional.empty();
        }
        return Optional.of(new DateTimeSignal(date, time));
    }
}
