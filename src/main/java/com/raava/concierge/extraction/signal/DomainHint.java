package com.raava.concierge.extraction.signal;

import com.raava.concierge.session.model.ActiveDomain;

public record DomainHint(ActiveDomain domain) implements Signal {
}
