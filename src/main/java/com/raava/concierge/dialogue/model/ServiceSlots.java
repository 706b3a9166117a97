package com.raava.concierge.dialogue.model;

import com.raava.concierge.inventory.model.ServiceProvider;
import com.raava.concierge.session.model.ActiveDomain;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ServiceSlots extends DomainSlots {

    private ServiceStage stage = ServiceStage.VEHICLE_DETAILS;

    private VehicleDetails vehicle = new VehicleDetails();

    private ServiceType serviceType;

    private String serviceDescription;

    private ContactDetails contact = new ContactDetails();

    /**
     * "make|postcode" the cached provider list was looked up for.
     */
    private String providerLookupKey;

    private List<ServiceProvider> availableProviders = new ArrayList<>();

    private ServiceProvider selectedProvider;

    private LocalDateTime appointmentDateTime;

    @Override
    public ActiveDomain domain() {
        return ActiveDomain.SERVICE;
    }

    @Override
    public String stageName() {
        return stage.name();
    }

    @Override
    public boolean readyForRecord() {
        return stage.isReady();
    }
}
