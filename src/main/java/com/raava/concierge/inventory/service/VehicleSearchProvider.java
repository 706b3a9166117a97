package com.raava.concierge.inventory.service;

import com.raava.concierge.inventory.model.SearchCriteria;
import com.raava.concierge.inventory.model.VehicleListing;

import java.util.List;

/**
 * Read-only source of vehicles for sale.
 */
public interface VehicleSearchProvider {

    /**
     * @return matching listings, de-duplicated and cheapest first; empty when nothing matches
     */
    List<VehicleListing> search(SearchCriteria criteria);
}
