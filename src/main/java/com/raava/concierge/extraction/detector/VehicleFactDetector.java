package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.Signal;
import com.raava.concierge.extraction.signal.VehicleFact;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects make, model, year, mileage and colour.
 *
 * Mileage needs a unit ("12k", "12,000 miles") unless the stage is asking for mileage and
 * is not offering numbered options; a bare 4-digit number in the year range is a year while
 * the year is still wanted. Numbers inside email addresses, phone numbers and postcodes are
 * never read as a year or mileage.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class VehicleFactDetector implements SignalDetector {

    private static final int EARLIEST_YEAR = 1950;
    private static final int MAX_MILEAGE = 1_000_000;

    private static final Pattern YEAR = Pattern.compile("(?<![\\d£.,])((?:19|20)\\d{2})(?![\\d,]|\\s*(?:k\\b|miles?\\b|mi\\b))");
    private static final Pattern MILEAGE_WITH_UNIT = Pattern.compile(
            "(?<![\\d£.,])(\\d{1,3}(?:,\\d{3})+|\\d+(?:\\.\\d+)?)\\s*(k)?\\s*(?:miles?|mi)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MILEAGE_THOUSANDS = Pattern.compile(
            "(?<![\\d£.,])(\\d+(?:\\.\\d+)?)\\s*k\\b(?!\\s*(?:pounds|gbp|quid|budget|a month|per month))", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_NUMBER = Pattern.compile("^\\s*(\\d{1,3}(?:,\\d{3})+|\\d+)\\s*$");

    private final Clock clock;

    @Override
    public Optional<Signal> detect(String utterance, StageExpectation expectation) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        String text = DateTimeParser.stripDates(utterance);

        String make = VehicleLexicon.findMake(text).orElse(null);
        String model = VehicleLexicon.findModel(text).orElse(null);
        String color = VehicleLexicon.findColor(text).orElse(null);

        String numbers = ContactFactDetector.stripContactDetails(text, " ");
        Integer mileage = findMileage(numbers);
        Integer year = findYear(numbers);

        if (mileage == null && isBareNumberForMileage(numbers, expectation)
                && (year == null || !expectation.expects(SlotField.YEAR))) {
            mileage = parseNumber(BARE_NUMBER.matcher(numbers));
            year = null;
        }

        if (make == null && model == null && year == null && mileage == null && color == null) {
            return Optional.empty();
        }
        return Optional.of(new VehicleFact(make, model, year, mileage, color));
    }

    private Integer findYear(String text) {
        int latest = Year.now(clock).getValue() + 1;
        Matcher matcher = YEAR.matcher(text);
        while (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            if (year >= EARLIEST_YEAR && year <= latest) {
                return year;
            }
        }
        return null;
    }

    private Integer findMileage(String text) {
        Matcher withUnit = MILEAGE_WITH_UNIT.matcher(text);
        if (withUnit.find()) {
            return toMiles(withUnit.group(1), withUnit.group(2) != null);
        }
        Matcher thousands = MILEAGE_THOUSANDS.matcher(text);
        if (thousands.find()) {
            return toMiles(thousands.group(1), true);
        }
        return null;
    }

    /**
     * A lone number is mileage only while mileage is wanted and no options are on offer.
     * While the year is also wanted, a plausible year stays a year.
     */
    private boolean isBareNumberForMileage(String text, StageExpectation expectation) {
        if (expectation == null || expectation.awaitsChoice() || !expectation.expects(SlotField.MILEAGE)) {
            return false;
        }
        return BARE_NUMBER.matcher(text).matches();
    }

    private static Integer parseNumber(Matcher matcher) {
        if (!matcher.matches()) {
            return null;
        }
        return toMiles(matcher.group(1), false);
    }

    /**
     * @return the mileage, or null above {@link #MAX_MILEAGE}
     */
    private static Integer toMiles(String number, boolean thousands) {
        double value = Double.parseDouble(number.replace(",", ""));
        if (thousands) {
            value *= 1000;
        }
        if (value > MAX_MILEAGE) {
            return null;
        }
        return (int) Math.round(value);
    }
}
