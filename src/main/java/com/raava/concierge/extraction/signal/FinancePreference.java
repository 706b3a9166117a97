package com.raava.concierge.extraction.signal;

import com.raava.concierge.finance.model.FinanceType;

public record FinancePreference(FinanceType financeType) implements Signal {
}
