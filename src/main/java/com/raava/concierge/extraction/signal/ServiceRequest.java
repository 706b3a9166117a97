package com.raava.concierge.extraction.signal;

import com.raava.concierge.dialogue.model.ServiceType;

/**
 * Kind of work requested for a vehicle, with the message that described it.
 */
public record ServiceRequest(ServiceType serviceType, String description) implements Signal {
}
