package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.Signal;

import java.util.Optional;

/**
 * One independent pattern family. Implementations are pure: they read only the message and
 * what the current stage is waiting for, and report "nothing found" as an empty result.
 */
public interface SignalDetector {

    Optional<Signal> detect(String utterance, StageExpectation expectation);
}
