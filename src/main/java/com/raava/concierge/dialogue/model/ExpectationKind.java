package com.raava.concierge.dialogue.model;

public enum ExpectationKind {
    /** No stage-bound interpretation. */
    NOTHING,
    /** A numbered option from a list shown to the user. */
    OPTION_CHOICE,
    /** The whole message answers a single free-text question. */
    FREE_TEXT,
    /** A yes/no answer. */
    CONFIRMATION,
    /** One or more specific fields. */
    FIELDS
}
