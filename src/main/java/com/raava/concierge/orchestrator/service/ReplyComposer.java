package com.raava.concierge.orchestrator.service;

import com.raava.concierge.completion.prompt.ConciergePrompts;
import com.raava.concierge.completion.service.TextCompletionClient;
import com.raava.concierge.dialogue.model.MachineOutcome;
import com.raava.concierge.exception.TextCompletionException;
import com.raava.concierge.session.model.ActiveDomain;
import com.raava.concierge.session.model.ConversationTurn;
import com.raava.concierge.session.model.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Words the reply for a funnel turn.
 *
 * The funnel's deterministic prompt is the reply of record. When rephrasing is enabled the
 * text-completion service may restyle it; any failure or blank answer falls back to the
 * deterministic prompt unchanged.
 */
@Slf4j
@Service
public class ReplyComposer {

    private static final int CONTEXT_TURNS = 6;

    private final TextCompletionClient completionClient;
    private final boolean rephraseEnabled;

    public ReplyComposer(TextCompletionClient completionClient,
                         @Value("${raava.completion.rephrase-replies:false}") boolean rephraseEnabled) {
        this.completionClient = completionClient;
        this.rephraseEnabled = rephraseEnabled;
    }

    public String compose(ActiveDomain domain, MachineOutcome outcome, SessionState session,
                          String userMessage, String correlationId) {
        String draft = outcome.prompt();
        if (!rephraseEnabled) {
            return draft;
        }

        String systemContext = ConciergePrompts.replyPrompt(domain, outcome.stage(), outcome.missingFields(), draft);
        try {
            String reply = completionClient.complete(systemContext, recentTurns(session, userMessage));
            if (reply == null || reply.isBlank()) {
                log.warn("Blank reply from completion service, using stage prompt - correlationId: {}", correlationId);
                return draft;
            }
            return reply;
        } catch (TextCompletionException e) {
            log.warn("Reply rephrasing failed, using stage prompt - correlationId: {}, error: {}",
                    correlationId, e.getMessage());
            return draft;
        }
    }

    private static List<ConversationTurn> recentTurns(SessionState session, String userMessage) {
        List<ConversationTurn> history = session.getHistory();
        List<ConversationTurn> turns = new ArrayList<>(
                history.subList(Math.max(0, history.size() - CONTEXT_TURNS), history.size()));
        turns.add(ConversationTurn.builder().userMessage(userMessage).build());
        return turns;
    }
}
