package com.raava.concierge.routing.service;

import com.raava.concierge.completion.prompt.ConciergePrompts;
import com.raava.concierge.completion.service.TextCompletionClient;
import com.raava.concierge.exception.TextCompletionException;
import com.raava.concierge.extraction.detector.DomainLexicon;
import com.raava.concierge.routing.model.RoutingDecision;
import com.raava.concierge.routing.model.RoutingReason;
import com.raava.concierge.session.model.ActiveDomain;
import com.raava.concierge.session.model.ConversationTurn;
import com.raava.concierge.session.model.SessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Decides which funnel handles a message.
 *
 * Responsibilities:
 * - Keep the session in its open funnel until the funnel has created its record
 * - Classify new conversations by keyword (acquisition, then service, then consignment)
 * - Recognise bare greetings
 * - Fall back to the text-completion classifier, degrading to AMBIGUOUS when it fails
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DomainRouter {

    private final TextCompletionClient completionClient;

    public RoutingDecision route(String utterance, SessionState session, String correlationId) {
        if (session.hasOpenFunnel()) {
            return RoutingDecision.to(session.getActiveDomain(), RoutingReason.STICKY);
        }

        Optional<ActiveDomain> keywordDomain = DomainLexicon.classify(utterance);
        if (keywordDomain.isPresent()) {
            log.debug("Routed by keyword - correlationId: {}, domain: {}", correlationId, keywordDomain.get());
            return RoutingDecision.to(keywordDomain.get(), RoutingReason.KEYWORD);
        }

        if (DomainLexicon.isGreeting(utterance)) {
            return RoutingDecision.unrouted(RoutingReason.GREETING);
        }

        return classify(utterance, correlationId);
    }

    private RoutingDecision classify(String utterance, String correlationId) {
        String label;
        try {
            label = completionClient.complete(ConciergePrompts.DOMAIN_CLASSIFIER_PROMPT,
                    List.of(ConversationTurn.builder().userMessage(utterance).build()));
        } catch (TextCompletionException e) {
            log.warn("Domain classifier unavailable - correlationId: {}, error: {}", correlationId, e.getMessage());
            return RoutingDecision.unrouted(RoutingReason.AMBIGUOUS);
        }

        Optional<ActiveDomain> domain = DomainLexicon.parseLabel(label);
        log.info("Domain classifier answered - correlationId: {}, label: {}, domain: {}",
                correlationId, label, domain.orElse(null));
        return domain
                .map(value -> RoutingDecision.to(value, RoutingReason.CLASSIFIER))
                .orElseGet(() -> RoutingDecision.unrouted(RoutingReason.AMBIGUOUS));
    }
}
