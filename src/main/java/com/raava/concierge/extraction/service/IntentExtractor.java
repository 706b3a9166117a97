package com.raava.concierge.extraction.service;

import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.detector.SignalDetector;
import com.raava.concierge.extraction.signal.Signal;
import com.raava.concierge.session.model.SessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns one user message into structured signals.
 *
 * Responsibilities:
 * - Run every detector on the message, each independently
 * - Let the session's current stage expectation decide how bare numbers and open answers read
 * - Return the union of everything found, in detector order
 *
 * Nothing found is an empty list, never an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentExtractor {

    private final List<SignalDetector> detectors;

    /**
     * Extracts all signals from {@code utterance}.
     *
     * @param utterance user message
     * @param session   current session; only its stage expectation is read
     * @return signals in detector order, possibly empty
     */
    public List<Signal> extract(String utterance, SessionState session) {
        StageExpectation expectation = session != null && session.getAwaiting() != null
                ? session.getAwaiting()
                : StageExpectation.nothing();

        List<Signal> signals = new ArrayList<>();
        for (SignalDetector detector : detectors) {
            try {
                Optional<Signal> signal = detector.detect(utterance, expectation);
                signal.ifPresent(signals::add);
            } catch (RuntimeException e) {
                log.warn("Detector failed, skipping - detector: {}, error: {}",
                        detector.getClass().getSimpleName(), e.getMessage());
            }
        }

        log.debug("Signals extracted - expectation: {}, signals: {}", expectation.getKind(), signals);
        return signals;
    }
}
