package com.raava.concierge.extraction.signal;

/**
 * One structured fact extracted from a user message.
 * A message can yield any number of signals; none is the normal "nothing found" result.
 */
public interface Signal {
}
