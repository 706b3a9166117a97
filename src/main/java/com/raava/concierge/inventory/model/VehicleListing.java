package com.raava.concierge.inventory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A vehicle offered for sale by a dealer or marketplace.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleListing {

    private String id;
    private String make;
    private String model;
    private Integer year;
    private Double price;
    private Integer mileage;
    private String color;
    private String fuelType;
    private String bodyType;
    private String location;
    private String source;
    private String sellerType;

    /**
     * "2022 Ferrari Roma"
     */
    public String title() {
        StringBuilder title = new StringBuilder();
        if (year != null) {
            title.append(year).append(' ');
        }
        title.append(make);
        if (model != null && !model.isBlank()) {
            title.append(' ').append(model);
        }
        return title.toString();
    }
}
