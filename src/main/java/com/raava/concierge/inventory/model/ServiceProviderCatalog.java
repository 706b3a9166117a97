package com.raava.concierge.inventory.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of the provider reference file.
 */
@Data
@NoArgsConstructor
public class ServiceProviderCatalog {

    /**
     * Base price per service type name, before the provider's cost multiplier.
     */
    private Map<String, Integer> baseCosts = new HashMap<>();

    /**
     * Postcode area (e.g. "SW") to [latitude, longitude].
     */
    private Map<String, List<Double>> postcodeAreas = new HashMap<>();

    private List<ServiceProvider> providers = new ArrayList<>();
}
