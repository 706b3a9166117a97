package com.raava.concierge.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One user message and the reply it received.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationTurn {

    private String userMessage;

    /**
     * Reply sent back, null for the turn currently being answered.
     */
    private String reply;

    private ActiveDomain domain;

    private String stage;

    private Instant timestamp;
}
