package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.ContactFact;
import com.raava.concierge.extraction.signal.Signal;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects name, email, phone and UK postcode.
 *
 * A name is taken from an explicit introduction ("my name is ...") anywhere. Without one, the
 * leading words of the message count as a name only while the stage is asking for the name,
 * e.g. "John Smith, john@test.com, 07700900000".
 */
@Component
@Order(30)
public class ContactFactDetector implements SignalDetector {

    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE = Pattern.compile("(?<![\\w£])(?:\\+44\\s?|0)\\d{2,4}[\\s-]?\\d{3,4}[\\s-]?\\d{3,4}(?!\\d)|(?<![\\w£])\\+?\\d{10,15}(?!\\d)");
    private static final Pattern POSTCODE = Pattern.compile("\\b([A-Z]{1,2}\\d[A-Z\\d]?\\s?\\d[A-Z]{2})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXPLICIT_NAME = Pattern.compile(
            "(?:my name is|my name's|this is|call me|name:)\\s+([A-Za-z][A-Za-z'-]*(?:\\s+[A-Za-z][A-Za-z'-]*){0,3})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_WORDS = Pattern.compile("^\\s*([A-Za-z][A-Za-z'-]*(?:\\s+[A-Za-z][A-Za-z'-]*){0,3})\\s*(?:[,;.]|$)");

    private static final Set<String> NOT_A_NAME = Set.of(
            "yes", "no", "ok", "okay", "sure", "hi", "hello", "hey", "thanks", "thank", "please", "email", "phone",
            "my", "it", "its", "the", "and", "i", "im", "i'm", "is", "a", "an", "to", "for", "with", "name", "number",
            "tomorrow", "today", "next", "option", "confirm", "cancel");

    @Override
    public Optional<Signal> detect(String utterance, StageExpectation expectation) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        String email = find(EMAIL, utterance);
        String phone = normalisePhone(find(PHONE, utterance));
        String postcode = normalisePostcode(find(POSTCODE, utterance));
        String name = findName(utterance, expectation);

        if (name == null && email == null && phone == null && postcode == null) {
            return Optional.empty();
        }
        return Optional.of(new ContactFact(name, email, phone, postcode));
    }

    private String findName(String utterance, StageExpectation expectation) {
        Matcher explicit = EXPLICIT_NAME.matcher(utterance);
        if (explicit.find()) {
            String candidate = trimTrailingStopwords(explicit.group(1));
            return isPlausibleName(candidate) ? titleCase(candidate) : null;
        }
        if (expectation == null || !expectation.expects(SlotField.NAME) || expectation.awaitsChoice()) {
            return null;
        }

        String remainder = stripContactDetails(utterance, ",");
        Matcher leading = LEADING_WORDS.matcher(remainder);
        if (!leading.find()) {
            return null;
        }
        String candidate = leading.group(1).trim();
        return isPlausibleName(candidate) ? titleCase(candidate) : null;
    }

    private static boolean isPlausibleName(String candidate) {
        for (String word : candidate.split("\\s+")) {
            if (NOT_A_NAME.contains(word.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return VehicleLexicon.findMake(candidate).isEmpty()
                && VehicleLexicon.findModel(candidate).isEmpty()
                && VehicleLexicon.findColor(candidate).isEmpty();
    }

    private static String trimTrailingStopwords(String name) {
        String[] words = name.trim().split("\\s+");
        int end = words.length;
        while (end > 1 && NOT_A_NAME.contains(words[end - 1].toLowerCase(Locale.ROOT))) {
            end--;
        }
        return String.join(" ", Arrays.copyOf(words, end));
    }

    private static String find(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group().trim() : null;
    }

    /**
     * Replaces every email address, phone number and postcode in {@code text} with {@code replacement}.
     */
    static String stripContactDetails(String text, String replacement) {
        String stripped = EMAIL.matcher(text).replaceAll(replacement);
        stripped = PHONE.matcher(stripped).replaceAll(replacement);
        return POSTCODE.matcher(stripped).replaceAll(replacement);
    }

    private static String normalisePhone(String phone) {
        if (phone == null) {
            return null;
        }
        String digits = phone.replaceAll("[^\\d+]", "");
        int digitCount = digits.replace("+", "").length();
        return digitCount >= 10 && digitCount <= 15 ? digits : null;
    }

    private static String normalisePostcode(String postcode) {
        if (postcode == null) {
            return null;
        }
        String compact = postcode.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        return compact.substring(0, compact.length() - 3) + " " + compact.substring(compact.length() - 3);
    }

    private static String titleCase(String words) {
        StringBuilder result = new StringBuilder();
        for (String word : words.trim().split("\\s+")) {
            if (result.length() > 0) {
                result.append(' ');
            }
            result.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return result.toString();
    }
}
