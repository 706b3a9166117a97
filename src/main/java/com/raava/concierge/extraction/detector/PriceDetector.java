package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.PriceFact;
import com.raava.concierge.extraction.signal.Signal;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects a sterling amount: "£250,000", "£250k", "250k pounds", "£1.2m", "£3,000 a month".
 * Bare numbers are never prices.
 */
@Component
@Order(90)
public class PriceDetector implements SignalDetector {

    private static final String AMOUNT = "(\\d{1,3}(?:,\\d{3})+|\\d+(?:\\.\\d+)?)\\s*(k|m|million|thousand)?";
    private static final Pattern POUND_SIGN = Pattern.compile("£\\s*" + AMOUNT + "\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern POUND_WORD = Pattern.compile(
            "(?<![\\d.,])" + AMOUNT + "\\s*(?:pounds|gbp|quid)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTHLY = Pattern.compile(
            "\\b(?:a|per|each|every)\\s+month\\b|\\bmonthly\\b|\\bpcm\\b|/\\s*(?:month|mo)\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<Signal> detect(String utterance, StageExpectation expectation) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = POUND_SIGN.matcher(utterance);
        if (!matcher.find()) {
            matcher = POUND_WORD.matcher(utterance);
            if (!matcher.find()) {
                return Optional.empty();
            }
        }
        double amount = Double.parseDouble(matcher.group(1).replace(",", "")) * multiplier(matcher.group(2));
        if (amount <= 0) {
            return Optional.empty();
        }
        return Optional.of(new PriceFact(amount, MONTHLY.matcher(utterance).find()));
    }

    private static double multiplier(String suffix) {
        if (suffix == null) {
            return 1;
        }
        return switch (suffix.toLowerCase(Locale.ROOT)) {
            case "k", "thousand" -> 1_000;
            case "m", "million" -> 1_000_000;
            default -> 1;
        };
    }
}
