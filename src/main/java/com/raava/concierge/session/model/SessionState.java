package com.raava.concierge.session.model;

import com.raava.concierge.dialogue.model.DomainSlots;
import com.raava.concierge.dialogue.model.StageExpectation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversation state for one session.
 *
 * At most one domain is active at a time and {@code slots} always belongs to it, so a
 * funnel can never read another funnel's fields. History survives a clear; the funnel does not.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionState {

    /**
     * Opaque ID supplied by the caller, stable for the conversation's lifetime.
     */
    private String sessionId;

    @Builder.Default
    private ActiveDomain activeDomain = ActiveDomain.NONE;

    /**
     * Slots of the active domain, null while no domain is active.
     */
    private DomainSlots slots;

    /**
     * What the current stage asked the user for. Drives stage-bound extraction
     * (option numbers, free-text answers).
     */
    @Builder.Default
    private StageExpectation awaiting = StageExpectation.nothing();

    private Instant createdAt;

    private Instant lastActiveAt;

    /**
     * Most recent turns, oldest first, bounded by the configured history window.
     */
    @Builder.Default
    private List<ConversationTurn> history = new ArrayList<>();

    /**
     * IDs of records created in this session.
     */
    @Builder.Default
    private List<String> completedRecords = new ArrayList<>();

    /**
     * Starts a new funnel for {@code domain}, discarding any slots of the previous one.
     */
    public void activate(ActiveDomain domain, DomainSlots initialSlots) {
        this.activeDomain = domain;
        this.slots = initialSlots;
        this.awaiting = StageExpectation.nothing();
    }

    /**
     * Resets the funnel so the next message starts fresh under the same session ID.
     * History and completed record IDs are kept.
     */
    public void clearForReuse() {
        this.activeDomain = ActiveDomain.NONE;
        this.slots = null;
        this.awaiting = StageExpectation.nothing();
    }

    public boolean hasOpenFunnel() {
        return activeDomain != ActiveDomain.NONE && slots != null && !slots.isRecordCreated();
    }

    public boolean isExpired(Instant now, Duration timeout) {
        return lastActiveAt != null && Duration.between(lastActiveAt, now).compareTo(timeout) > 0;
    }

    public void appendTurn(ConversationTurn turn, int window) {
        history.add(turn);
        while (history.size() > window) {
            history.remove(0);
        }
    }
}
