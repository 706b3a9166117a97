package com.raava.concierge.extraction.signal;

import com.raava.concierge.dialogue.model.SlotField;

/**
 * The whole message taken as the answer to a free-text question asked by the current stage.
 */
public record FreeTextAnswer(SlotField field, String text) implements Signal {
}
