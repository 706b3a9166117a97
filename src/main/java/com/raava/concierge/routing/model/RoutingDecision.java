package com.raava.concierge.routing.model;

import com.raava.concierge.session.model.ActiveDomain;

/**
 * @param domain funnel to handle the message, null for greetings and ambiguous messages
 * @param reason how the decision was reached
 */
public record RoutingDecision(ActiveDomain domain, RoutingReason reason) {

    public static RoutingDecision to(ActiveDomain domain, RoutingReason reason) {
        return new RoutingDecision(domain, reason);
    }

    public static RoutingDecision unrouted(RoutingReason reason) {
        return new RoutingDecision(null, reason);
    }

    public boolean isRouted() {
        return domain != null && domain != ActiveDomain.NONE;
    }
}
