package com.raava.concierge.extraction.signal;

/**
 * A numbered option picked from a list, 1-based as the user typed it.
 */
public record OptionChoice(int index) implements Signal {
}
