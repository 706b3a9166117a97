package com.raava.concierge.gateway.service;

import com.raava.concierge.gateway.dto.ChatRequest;
import com.raava.concierge.gateway.dto.ChatResponse;
import com.raava.concierge.gateway.exception.MissingSessionIdException;
import com.raava.concierge.gateway.exception.RateLimitExceededException;
import com.raava.concierge.gateway.model.RequestContext;
import com.raava.concierge.orchestrator.service.ConversationOrchestrator;
import com.raava.concierge.session.service.SessionStore;
import com.raava.concierge.util.SessionIdMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Gateway service - handles all business logic for the gateway.
 *
 * Responsibilities:
 * - Extract and validate the session ID from the header (trusted source)
 * - Generate correlationId
 * - Enforce rate limiting
 * - Forward to the conversation orchestrator
 * - Reset a session's funnel on request
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private static final int MAX_SESSION_ID_LENGTH = 128;

    private final CorrelationIdService correlationIdService;
    private final RateLimiter rateLimiter;
    private final SessionStore sessionStore;
    private final ConversationOrchestrator conversationOrchestrator;
    private final Clock clock;

    /**
     * Processes a chat request through the gateway.
     *
     * @param request Chat request containing messageText
     * @param sessionIdHeader Session ID from HTTP header
     * @return Chat response with answer
     * @throws MissingSessionIdException if the session ID header is missing
     * @throws RateLimitExceededException if rate limit is exceeded
     */
    public ChatResponse processChatRequest(ChatRequest request, String sessionIdHeader) {
        String sessionId = extractAndValidateSessionId(sessionIdHeader);

        String correlationId = correlationIdService.generateCorrelationId();

        validateRateLimit(sessionId, correlationId);

        RequestContext context = RequestContext.builder()
                .sessionId(sessionId)
                .correlationId(correlationId)
                .messageText(request.getMessageText().trim())
                .receivedAt(clock.instant())
                .build();

        log.info("Chat request received - correlationId: {}, sessionId: {}, message length: {}",
                correlationId, SessionIdMasker.mask(sessionId), context.getMessageText().length());

        return conversationOrchestrator.orchestrate(context);
    }

    /**
     * Clears the session's funnel so the next message starts a new conversation.
     * History and completed record IDs are kept.
     *
     * @param sessionIdHeader Session ID from HTTP header
     */
    public void reset(String sessionIdHeader) {
        String sessionId = extractAndValidateSessionId(sessionIdHeader);
        String correlationId = correlationIdService.generateCorrelationId();

        log.info("Reset request - correlationId: {}, sessionId: {}", correlationId, SessionIdMasker.mask(sessionId));

        sessionStore.executeSerialized(sessionId, () -> sessionStore.clearForReuse(sessionId));
    }

    /**
     * Drops the session entirely.
     *
     * @param sessionIdHeader Session ID from HTTP header
     */
    public void endSession(String sessionIdHeader) {
        String sessionId = extractAndValidateSessionId(sessionIdHeader);
        String correlationId = correlationIdService.generateCorrelationId();

        log.info("End session request - correlationId: {}, sessionId: {}", correlationId, SessionIdMasker.mask(sessionId));

        sessionStore.executeSerialized(sessionId, () -> {
            sessionStore.invalidate(sessionId);
            return null;
        });
    }

    /**
     * @throws MissingSessionIdException if the session ID is missing, blank or too long
     */
    private String extractAndValidateSessionId(String sessionIdHeader) {
        if (sessionIdHeader == null || sessionIdHeader.isBlank()) {
            log.error("Missing sessionId header");
            throw new MissingSessionIdException("Session ID header is required");
        }
        String sessionId = sessionIdHeader.trim();
        if (sessionId.length() > MAX_SESSION_ID_LENGTH) {
            throw new MissingSessionIdException("Session ID header must not exceed " + MAX_SESSION_ID_LENGTH + " characters");
        }
        return sessionId;
    }

    private void validateRateLimit(String sessionId, String correlationId) {
        if (!rateLimiter.isAllowed(sessionId)) {
            log.warn("Rate limit exceeded for sessionId: {} (correlationId: {})",
                    SessionIdMasker.mask(sessionId), correlationId);
            throw new RateLimitExceededException("Rate limit exceeded. Please try again later.");
        }
    }
}
