package com.raava.concierge.dialogue.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The customer's own vehicle (service and consignment funnels).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleDetails {

    private String make;
    private String model;
    private Integer year;
    private Integer mileage;
    private String color;

    /**
     * "2019 Ferrari F8"
     */
    public String describe() {
        StringBuilder description = new StringBuilder();
        if (year != null) {
            description.append(year).append(' ');
        }
        if (make != null) {
            description.append(make);
        }
        if (model != null) {
            description.append(' ').append(model);
        }
        return description.toString().trim();
    }
}
