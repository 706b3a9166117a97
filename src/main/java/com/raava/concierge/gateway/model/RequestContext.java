package com.raava.concierge.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request context passed through the system.
 * Contains the trusted session ID from the header and the correlation ID for tracking.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    /**
     * Session ID from the X-Session-ID header. Never taken from message content.
     */
    private String sessionId;

    /**
     * Correlation ID for request tracking and audit.
     */
    private String correlationId;

    /**
     * Message text from the user, trimmed.
     */
    private String messageText;

    /**
     * Timestamp when request was received at the gateway.
     */
    private Instant receivedAt;
}
