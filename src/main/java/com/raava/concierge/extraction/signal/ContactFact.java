package com.raava.concierge.extraction.signal;

public record ContactFact(String name, String email, String phone, String postcode) implements Signal {
}
