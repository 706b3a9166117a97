package com.raava.concierge.extraction.detector;

import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic parsing of appointment dates and times written in British English.
 *
 * Supported dates: ISO ("2026-01-22"), day-month ("22 Jan 2026", "22nd January"),
 * month-day ("January 22"), numeric UK ("22/01/2026"), and relative words ("today",
 * "tomorrow", "day after tomorrow", "next week", weekday names). A date without a year that
 * has already passed this year rolls over to next year.
 *
 * Supported times: "11:30", "11:30am", "2pm", "noon"/"midday".
 */
@Slf4j
public class DateTimeParser {

    private static final String MONTH =
            "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?";

    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
    private static final Pattern NUMERIC_DATE = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})/(\\d{4})\\b");
    private static final Pattern DAY_MONTH = Pattern.compile(
            "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?" + MONTH + "(?:,?\\s+(\\d{4}))?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b" + MONTH + "\\s+(\\d{1,2})(?:st|nd|rd|th)?(?:,?\\s+(\\d{4}))?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern RELATIVE_DAY = Pattern.compile(
            "\\b(day after tomorrow|today|tomorrow|next week)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WEEKDAY = Pattern.compile(
            "\\b(?:next\\s+)?(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern CLOCK_TIME = Pattern.compile("\\b(\\d{1,2}):(\\d{2})\\s*(am|pm)?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOUR_TIME = Pattern.compile("\\b(\\d{1,2})\\s*(am|pm)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NOON = Pattern.compile("\\b(noon|midday)\\b", Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11),
            Map.entry("dec", 12));

    private DateTimeParser() {}

    /**
     * Finds the first date in {@code text}.
     *
     * @param text  user message
     * @param today reference date for relative expressions
     * @return the date, or empty when none is present or it is not a real calendar date
     */
    public static Optional<LocalDate> parseDate(String text, LocalDate today) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            Matcher matcher = ISO_DATE.matcher(text);
            if (matcher.find()) {
                return Optional.of(LocalDate.of(
                        Integer.parseInt(matcher.group(1)),
                        Integer.parseInt(matcher.group(2)),
                        Integer.parseInt(matcher.group(3))));
            }
            matcher = NUMERIC_DATE.matcher(text);
            if (matcher.find()) {
                return Optional.of(LocalDate.of(
                        Integer.parseInt(matcher.group(3)),
                        Integer.parseInt(matcher.group(2)),
                        Integer.parseInt(matcher.group(1))));
            }
            matcher = DAY_MONTH.matcher(text);
            if (matcher.find()) {
                return Optional.of(withYear(today, month(matcher.group(2)), Integer.parseInt(matcher.group(1)), matcher.group(3)));
            }
            matcher = MONTH_DAY.matcher(text);
            if (matcher.find()) {
                return Optional.of(withYear(today, month(matcher.group(1)), Integer.parseInt(matcher.group(2)), matcher.group(3)));
            }
        } catch (DateTimeException e) {
            log.debug("Ignoring impossible date in message: {}", e.getMessage());
            return Optional.empty();
        }

        Matcher relative = RELATIVE_DAY.matcher(text);
        if (relative.find()) {
            return Optional.of(switch (relative.group(1).toLowerCase(Locale.ROOT)) {
                case "today" -> today;
                case "tomorrow" -> today.plusDays(1);
                case "day after tomorrow" -> today.plusDays(2);
                default -> today.plusWeeks(1);
            });
        }

        Matcher weekday = WEEKDAY.matcher(text);
        if (weekday.find()) {
            DayOfWeek target = DayOfWeek.valueOf(weekday.group(1).toUpperCase(Locale.ROOT));
            int daysAhead = target.getValue() - today.getDayOfWeek().getValue();
            if (daysAhead <= 0) {
                daysAhead += 7;
            }
            return Optional.of(today.plusDays(daysAhead));
        }
        return Optional.empty();
    }

    /**
     * Finds the first time of day in {@code text}.
     */
    public static Optional<LocalTime> parseTime(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = CLOCK_TIME.matcher(text);
        if (matcher.find()) {
            return toTime(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)), matcher.group(3));
        }
        matcher = HOUR_TIME.matcher(text);
        if (matcher.find()) {
            return toTime(Integer.parseInt(matcher.group(1)), 0, matcher.group(2));
        }
        if (NOON.matcher(text).find()) {
            return Optional.of(LocalTime.NOON);
        }
        return Optional.empty();
    }

    /**
     * Removes explicit calendar dates so their digits are not read as vehicle years or mileage.
     */
    public static String stripDates(String text) {
        if (text == null) {
            return "";
        }
        String stripped = ISO_DATE.matcher(text).replaceAll(" ");
        stripped = NUMERIC_DATE.matcher(stripped).replaceAll(" ");
        stripped = DAY_MONTH.matcher(stripped).replaceAll(" ");
        return MONTH_DAY.matcher(stripped).replaceAll(" ");
    }

    private static LocalDate withYear(LocalDate today, int month, int day, String year) {
        if (year != null) {
            return LocalDate.of(Integer.parseInt(year), month, day);
        }
        LocalDate candidate = LocalDate.of(today.getYear(), month, day);
        return candidate.isBefore(today) ? candidate.plusYears(1) : candidate;
    }

    private static int month(String token) {
        Integer month = MONTHS.get(token.toLowerCase(Locale.ROOT).substring(0, 3));
        if (month == null) {
            throw new DateTimeException("Unknown month: " + token);
        }
        return month;
    }

    private static Optional<LocalTime> toTime(int hour, int minute, String meridiem) {
        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                return Optional.empty();
            }
            boolean pm = meridiem.equalsIgnoreCase("pm");
            hour = hour % 12 + (pm ? 12 : 0);
        }
        if (hour > 23 || minute > 59) {
            return Optional.empty();
        }
        return Optional.of(LocalTime.of(hour, minute));
    }
}
