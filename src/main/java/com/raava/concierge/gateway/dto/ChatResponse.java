package com.raava.concierge.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.raava.concierge.session.model.ActiveDomain;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for chat messages.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatResponse {

    private String answer;
    private String correlationId;
    private String sessionId;

    /**
     * Funnel that handled the message; NONE for greetings and clarifying replies.
     */
    private ActiveDomain domain;

    private String stage;

    /**
     * Labels of the fields the current stage still needs.
     */
    private List<String> missingFields;

    /**
     * Set on the turn that created a business record.
     */
    private String recordId;

    /**
     * True when the turn failed on infrastructure and can be sent again unchanged.
     */
    private boolean retryable;
}
