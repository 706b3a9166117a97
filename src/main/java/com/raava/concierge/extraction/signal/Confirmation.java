package com.raava.concierge.extraction.signal;

public record Confirmation(boolean accepted) implements Signal {
}
