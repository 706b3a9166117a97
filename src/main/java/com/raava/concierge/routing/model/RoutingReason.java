package com.raava.concierge.routing.model;

/**
 * Why a message was sent to a funnel, or why it was not.
 */
public enum RoutingReason {
    /** The session already has an open funnel. */
    STICKY,
    KEYWORD,
    CLASSIFIER,
    GREETING,
    AMBIGUOUS
}
