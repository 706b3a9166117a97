package com.raava.concierge.extraction.signal;

/**
 * Vehicle attributes mentioned in a message. Absent attributes are null.
 */
public record VehicleFact(String make, String model, Integer year, Integer mileage, String color) implements Signal {
}
