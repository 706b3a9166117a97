package com.raava.concierge.dialogue.model;

import com.raava.concierge.finance.model.FinanceQuote;
import com.raava.concierge.finance.model.FinanceType;
import com.raava.concierge.inventory.model.VehicleListing;
import com.raava.concierge.session.model.ActiveDomain;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AcquisitionSlots extends DomainSlots {

    private AcquisitionStage stage = AcquisitionStage.VEHICLE_SEARCH;

    private String make;

    private String model;

    /**
     * Upper price bound, stated directly or derived from a monthly budget.
     */
    private Double maxPrice;

    /**
     * "make|model|maxPrice" the cached search results were produced for.
     */
    private String searchKey;

    private List<VehicleListing> searchResults = new ArrayList<>();

    private VehicleListing selectedVehicle;

    /**
     * Null until the customer states a preference; treated as CASH at the readiness gate.
     */
    private FinanceType financeType;

    private FinanceQuote financeQuote;

    private ContactDetails contact = new ContactDetails();

    @Override
    public ActiveDomain domain() {
        return ActiveDomain.ACQUISITION;
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
