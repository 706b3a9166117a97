package com.raava.concierge.inventory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A garage or dealership that can service a vehicle.
 * Distance and estimated cost are filled in per lookup.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ServiceProvider {

    private String name;

    /**
     * Makes the provider specialises in; empty for general providers.
     */
    @Builder.Default
    private List<String> makes = new ArrayList<>();

    /**
     * 1 = factory dealer, 2 = specialist independent, 3 = general.
     */
    private Integer tier;

    private String location;
    private Double latitude;
    private Double longitude;
    private Double rating;
    private Integer reviewCount;
    private String phone;
    private Double costMultiplier;

    @Builder.Default
    private List<String> specialties = new ArrayList<>();

    private Double distanceMiles;
    private Integer estimatedCost;
}
