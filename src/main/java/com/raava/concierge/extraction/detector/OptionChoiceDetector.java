package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.OptionChoice;
import com.raava.concierge.extraction.signal.Signal;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects a pick from a numbered list: "2", "#2", "option 2", "number 2", "2nd", "the second one".
 * Only active while the stage is offering options, and only for numbers that are on the list.
 */
@Component
@Order(10)
public class OptionChoiceDetector implements SignalDetector {

    private static final Pattern BARE = Pattern.compile("^\\s*#?(\\d{1,2})\\s*[.!)]?\\s*(?:please)?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LABELLED = Pattern.compile("\\b(?:option|number|no\\.?|choice)\\s*#?(\\d{1,2})\\b|#(\\d{1,2})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC_ORDINAL = Pattern.compile("\\b(\\d{1,2})(?:st|nd|rd|th)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD_ORDINAL = Pattern.compile("\\b(first|second|third|fourth|fifth|sixth|seventh|eighth|ninth|tenth|last)\\b", Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> ORDINALS = Map.of(
            "first", 1, "second", 2, "third", 3, "fourth", 4, "fifth", 5,
            "sixth", 6, "seventh", 7, "eighth", 8, "ninth", 9, "tenth", 10);

    @Override
    public Optional<Signal> detect(String utterance, StageExpectation expectation) {
        if (utterance == null || utterance.isBlank() || expectation == null || !expectation.awaitsChoice()) {
            return Optional.empty();
        }
        Integer index = findIndex(utterance, expectation.getOptionCount());
        if (index == null || index < 1 || index > expectation.getOptionCount()) {
            return Optional.empty();
        }
        return Optional.of(new OptionChoice(index));
    }

    private Integer findIndex(String utterance, int optionCount) {
        Matcher matcher = BARE.matcher(utterance);
        if (matcher.matches()) {
            return Integer.parseInt(matcher.group(1));
        }
        matcher = LABELLED.matcher(utterance);
        if (matcher.find()) {
            return Integer.parseInt(matcher.group(1) != null ? matcher.group(1) : matcher.group(2));
        }
        matcher = NUMERIC_ORDINAL.matcher(DateTimeParser.stripDates(utterance));
        if (matcher.find()) {
            return Integer.parseInt(matcher.group(1));
        }
        matcher = WORD_ORDINAL.matcher(utterance);
        if (matcher.find()) {
            String word = matcher.group(1).toLowerCase(Locale.ROOT);
            return word.equals("last") ? optionCount : ORDINALS.get(word);
        }
        return null;
    }
}
