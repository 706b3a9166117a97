package com.raava.concierge.dialogue.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.raava.concierge.session.model.ActiveDomain;
import lombok.Data;

/**
 * Slots of one domain funnel. Each domain has its own subtype, so a field of one funnel
 * cannot be read while another funnel is active.
 *
 * {@code recordCreated} is the idempotency guard: once set, the funnel never creates a
 * second record.
 */
@Data
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "domain")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AcquisitionSlots.class, name = "ACQUISITION"),
        @JsonSubTypes.Type(value = ServiceSlots.class, name = "SERVICE"),
        @JsonSubTypes.Type(value = ConsignmentSlots.class, name = "CONSIGNMENT")
})
public abstract class DomainSlots {

    private boolean recordCreated;

    private String recordId;

    public abstract ActiveDomain domain();

    public abstract String stageName();

    public abstract boolean readyForRecord();
}
