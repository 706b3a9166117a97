package com.raava.concierge.orchestrator.service;

import com.raava.concierge.dialogue.machine.DomainMachine;
import com.raava.concierge.dialogue.model.MachineOutcome;
import com.raava.concierge.exception.PersistenceException;
import com.raava.concierge.extraction.service.IntentExtractor;
import com.raava.concierge.extraction.signal.Signal;
import com.raava.concierge.gateway.dto.ChatResponse;
import com.raava.concierge.gateway.model.RequestContext;
import com.raava.concierge.routing.model.RoutingDecision;
import com.raava.concierge.routing.model.RoutingReason;
import com.raava.concierge.routing.service.DomainRouter;
import com.raava.concierge.session.model.ActiveDomain;
import com.raava.concierge.session.model.ConversationTurn;
import com.raava.concierge.session.model.SessionState;
import com.raava.concierge.session.service.SessionStore;
import com.raava.concierge.transaction.model.TransactionResult;
import com.raava.concierge.transaction.service.TransactionManager;
import com.raava.concierge.util.SessionIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orchestrator service - owns one conversational turn from message to reply.
 *
 * Responsibilities:
 * - Serialise turns of the same session
 * - Route the message to a funnel (sticky while a funnel is open)
 * - Extract signals and advance the funnel's machine
 * - Create the business record when the funnel reaches READY, then clear the funnel
 * - Commit the session only when the turn succeeds
 *
 * Workflow steps:
 * LOAD_SESSION -> ROUTE -> (IF UNROUTED -> GREET_OR_CLARIFY -> SAVE -> END)
 * -> EXTRACT -> ADVANCE -> (IF READY -> CREATE_RECORD -> CLEAR) -> COMPOSE -> SAVE -> RESPOND
 */
@Slf4j
@Service
public class ConversationOrchestrator {

    static final String GREETING_REPLY = "Welcome to Raava. I can help you find and finance a luxury vehicle, "
            + "book a service for the car you own, or sell your car through our marketplaces. "
            + "What would you like to do today?";

    static final String CLARIFYING_REPLY = "I'd be glad to help. Are you looking to buy a vehicle, "
            + "book a service for your car, or sell your car?";

    static final String RETRY_REPLY = "Sorry, we couldn't complete that just now. Nothing has been lost, "
            + "so please send your last message again.";

    private final SessionStore sessionStore;
    private final DomainRouter domainRouter;
    private final IntentExtractor intentExtractor;
    private final TransactionManager transactionManager;
    private final ReplyComposer replyComposer;
    private final Clock clock;
    private final Map<ActiveDomain, DomainMachine<?>> machines = new EnumMap<>(ActiveDomain.class);

    public ConversationOrchestrator(SessionStore sessionStore,
                                    DomainRouter domainRouter,
                                    IntentExtractor intentExtractor,
                                    TransactionManager transactionManager,
                                    ReplyComposer replyComposer,
                                    Clock clock,
                                    List<DomainMachine<?>> machines) {
        this.sessionStore = sessionStore;
        this.domainRouter = domainRouter;
        this.intentExtractor = intentExtractor;
        this.transactionManager = transactionManager;
        this.replyComposer = replyComposer;
        this.clock = clock;
        for (DomainMachine<?> machine : machines) {
            this.machines.put(machine.domain(), machine);
        }
    }

    /**
     * Processes one user message for the session in {@code context}.
     *
     * @param context request context with session ID, correlation ID and message
     * @return reply with the funnel's stage after the turn
     */
    public ChatResponse orchestrate(RequestContext context) {
        return sessionStore.executeSerialized(context.getSessionId(), () -> runTurn(context));
    }

    private ChatResponse runTurn(RequestContext context) {
        String correlationId = context.getCorrelationId();
        String sessionId = context.getSessionId();
        String message = context.getMessageText();
        log.info("Starting turn - correlationId: {}, sessionId: {}", correlationId, SessionIdMasker.mask(sessionId));

        // Step 1: LOAD_SESSION - all changes go to a working copy until the turn commits
        SessionState session = sessionStore.workingCopy(sessionStore.fetchOrCreate(sessionId));

        // Step 2: ROUTE
        RoutingDecision decision = domainRouter.route(message, session, correlationId);
        log.info("Routing decision - correlationId: {}, domain: {}, reason: {}",
                correlationId, decision.domain(), decision.reason());
        if (!decision.isRouted()) {
            String reply = decision.reason() == RoutingReason.GREETING ? GREETING_REPLY : CLARIFYING_REPLY;
            return commit(session, message, reply, null, correlationId);
        }

        DomainMachine<?> machine = machines.get(decision.domain());
        if (session.getActiveDomain() != decision.domain() || !session.hasOpenFunnel()) {
            session.activate(decision.domain(), machine.initialSlots());
            log.info("Funnel started - correlationId: {}, domain: {}", correlationId, decision.domain());
        }

        // Step 3: EXTRACT
        List<Signal> signals = intentExtractor.extract(message, session);
        log.debug("Signals extracted - correlationId: {}, signals: {}", correlationId, signals);

        // Step 4: ADVANCE
        MachineOutcome outcome = machine.advance(session, signals);
        log.info("Funnel stage - correlationId: {}, domain: {}, stage: {}, missing: {}",
                correlationId, decision.domain(), outcome.stage(), outcome.missingFields());

        if (!outcome.ready()) {
            String reply = replyComposer.compose(decision.domain(), outcome, session, message, correlationId);
            return commit(session, message, reply, outcome, correlationId);
        }

        // Step 5: CREATE_RECORD
        TransactionResult result;
        try {
            result = transactionManager.create(session.getSlots(), sessionId, correlationId);
        } catch (PersistenceException e) {
            log.error("Record creation failed, turn discarded - correlationId: {}, sessionId: {}, error: {}",
                    correlationId, SessionIdMasker.mask(sessionId), e.getMessage());
            return ChatResponse.builder()
                    .answer(RETRY_REPLY)
                    .correlationId(correlationId)
                    .sessionId(sessionId)
                    .domain(decision.domain())
                    .stage(outcome.stage())
                    .missingFields(List.of())
                    .retryable(true)
                    .build();
        }
        return completeFunnel(session, message, outcome, result, correlationId);
    }

    private ChatResponse completeFunnel(SessionState session, String message, MachineOutcome outcome,
                                        TransactionResult result, String correlationId) {
        ActiveDomain domain = session.getActiveDomain();
        if (result instanceof TransactionResult.Incomplete) {
            List<String> missing = ((TransactionResult.Incomplete) result).missingFields();
            String reply = "Before I can finish, I still need your " + String.join(", ", missing).toLowerCase(Locale.ROOT) + ".";
            MachineOutcome incomplete = new MachineOutcome(outcome.stage(), missing, reply, false, outcome.enteredStages());
            return commit(session, message, reply, incomplete, correlationId);
        }

        String recordId;
        String reply;
        if (result instanceof TransactionResult.Created) {
            TransactionResult.Created created = (TransactionResult.Created) result;
            recordId = created.recordId();
            reply = created.warnings().isEmpty()
                    ? created.message()
                    : created.message() + "\n\n" + String.join("\n", created.warnings());
            session.getCompletedRecords().add(recordId);
        } else {
            TransactionResult.AlreadyCreated existing = (TransactionResult.AlreadyCreated) result;
            recordId = existing.recordId();
            reply = existing.message();
        }

        // Step 6: CLEAR - the next message starts a new funnel under the same session
        recordTurn(session, message, reply, outcome.stage());
        session.clearForReuse();
        sessionStore.save(session);
        log.info("Funnel completed - correlationId: {}, domain: {}, recordId: {}", correlationId, domain, recordId);

        return ChatResponse.builder()
                .answer(reply)
                .correlationId(correlationId)
                .sessionId(session.getSessionId())
                .domain(domain)
                .stage(outcome.stage())
                .missingFields(List.of())
                .recordId(recordId)
                .build();
    }

    private ChatResponse commit(SessionState session, String message, String reply,
                                MachineOutcome outcome, String correlationId) {
        recordTurn(session, message, reply, outcome != null ? outcome.stage() : null);
        sessionStore.save(session);
        log.debug("Turn committed - correlationId: {}, domain: {}", correlationId, session.getActiveDomain());

        return ChatResponse.builder()
                .answer(reply)
                .correlationId(correlationId)
                .sessionId(session.getSessionId())
                .domain(session.getActiveDomain())
                .stage(outcome != null ? outcome.stage() : null)
                .missingFields(outcome != null ? outcome.missingFields() : List.of())
                .build();
    }

    private void recordTurn(SessionState session, String message, String reply, String stage) {
        session.appendTurn(ConversationTurn.builder()
                .userMessage(message)
                .reply(reply)
                .domain(session.getActiveDomain())
                .stage(stage)
                .timestamp(clock.instant())
                .build(), sessionStore.getHistoryWindow());
    }
}
