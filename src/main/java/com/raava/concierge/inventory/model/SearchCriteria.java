package com.raava.concierge.inventory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filters for a vehicle search. Null fields do not filter.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchCriteria {

    private String make;
    private String model;
    private Integer minYear;
    private Double maxPrice;
}
