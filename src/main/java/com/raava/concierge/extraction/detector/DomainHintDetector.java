package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.DomainHint;
import com.raava.concierge.extraction.signal.Signal;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(60)
public class DomainHintDetector implements SignalDetector {

    @Override
    public Optional<Signal> detect(String utterance, StageExpectation expectation) {
        return DomainLexicon.classify(utterance).<Signal>map(DomainHint::new);
    }
}
