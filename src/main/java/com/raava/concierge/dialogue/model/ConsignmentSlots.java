package com.raava.concierge.dialogue.model;

import com.raava.concierge.inventory.model.Valuation;
import com.raava.concierge.session.model.ActiveDomain;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ConsignmentSlots extends DomainSlots {

    private ConsignmentStage stage = ConsignmentStage.VEHICLE_DETAILS;

    private VehicleDetails vehicle = new VehicleDetails();

    private String reasonForSale;

    private Valuation valuation;

    /**
     * Defaults to the private-sale valuation; the owner may name their own price.
     */
    private Double askingPrice;

    private ContactDetails contact = new ContactDetails();

    private boolean listingApproved;

    @Override
    public ActiveDomain domain() {
        return ActiveDomain.CONSIGNMENT;
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
