package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.FinancePreference;
import com.raava.concierge.extraction.signal.Signal;
import com.raava.concierge.finance.model.FinanceType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Detects how the customer wants to pay. A plain mention of finance means Hire Purchase.
 */
@Component
@Order(80)
public class FinancePreferenceDetector implements SignalDetector {

    private static final Map<FinanceType, Pattern> FINANCE_PATTERNS = new LinkedHashMap<>();

    static {
        FINANCE_PATTERNS.put(FinanceType.PCP, word("pcp|personal contract purchase|personal contract"));
        FINANCE_PATTERNS.put(FinanceType.LEASE, word("lease|leasing|contract hire|pch"));
        FINANCE_PATTERNS.put(FinanceType.BESPOKE, word("bespoke|balloon|tailored finance|custom finance"));
        FINANCE_PATTERNS.put(FinanceType.HP, word("hp|hire purchase|finance|financing|monthly payments"));
        FINANCE_PATTERNS.put(FinanceType.CASH, word("cash|pay in full|outright|full payment|bank transfer"));
    }

    @Override
    public Optional<Signal> detect(String utterance, StageExpectation expectation) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        for (Map.Entry<FinanceType, Pattern> entry : FINANCE_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(utterance).find()) {
                return Optional.of(new FinancePreference(entry.getKey()));
            }
        }
        return Optional.empty();
    }

    private static Pattern word(String alternatives) {
        return Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
