package com.raava.concierge.extraction.detector;

import com.raava.concierge.session.model.ActiveDomain;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keyword sets that identify which funnel a message belongs to.
 *
 * Priority is acquisition, then service, then consignment. A message that only names a
 * make counts as acquisition, since browsing a make is the most common opening.
 */
public class DomainLexicon {

    private static final List<String> ACQUISITION_KEYWORDS = List.of(
            "buy", "buying", "purchase", "looking for", "find me", "shopping for", "acquire",
            "finance", "financing", "hire purchase", "pcp", "lease", "leasing",
            "test drive", "viewing", "in stock", "available cars", "luxury car", "sports car", "supercar");

    private static final List<String> SERVICE_KEYWORDS = List.of(
            "service", "servicing", "maintenance", "repair", "check-up", "checkup", "inspection",
            "mot", "oil change", "brake", "brakes", "tyre", "tyres", "tire", "tires",
            "warranty", "diagnostic", "warning light", "garage");

    private static final List<String> CONSIGNMENT_KEYWORDS = List.of(
            "sell", "selling", "consign", "consignment", "valuation", "value my car", "what's my car worth",
            "list my", "listing", "market my car", "part exchange", "trade in", "trade-in");

    private static final Pattern ACQUISITION = keywords(ACQUISITION_KEYWORDS);
    private static final Pattern SERVICE = keywords(SERVICE_KEYWORDS);
    private static final Pattern CONSIGNMENT = keywords(CONSIGNMENT_KEYWORDS);

    private static final Pattern GREETING = Pattern.compile(
            "^\\s*(hi|hello|hey|hiya|good (morning|afternoon|evening)|greetings|howdy|yo)\\b[\\s!.,]*(there|raava)?[\\s!.,]*$",
            Pattern.CASE_INSENSITIVE);

    private DomainLexicon() {}

    /**
     * Keyword classification in priority order.
     *
     * @return the matching domain, or empty when no keyword and no make is present
     */
    public static Optional<ActiveDomain> classify(String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        if (ACQUISITION.matcher(utterance).find()) {
            return Optional.of(ActiveDomain.ACQUISITION);
        }
        if (SERVICE.matcher(utterance).find()) {
            return Optional.of(ActiveDomain.SERVICE);
        }
        if (CONSIGNMENT.matcher(utterance).find()) {
            return Optional.of(ActiveDomain.CONSIGNMENT);
        }
        if (VehicleLexicon.findMake(utterance).isPresent()) {
            return Optional.of(ActiveDomain.ACQUISITION);
        }
        return Optional.empty();
    }

    /**
     * True for a bare greeting with nothing else in it.
     */
    public static boolean isGreeting(String utterance) {
        return utterance != null && GREETING.matcher(utterance).matches();
    }

    /**
     * Parses a one-word domain label such as the classifier returns.
     */
    public static Optional<ActiveDomain> parseLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String word = label.trim().split("[\\s.,:;!]+")[0].toUpperCase(Locale.ROOT);
        return switch (word) {
            case "ACQUISITION", "BUY", "BUYING" -> Optional.of(ActiveDomain.ACQUISITION);
            case "SERVICE", "SERVICING" -> Optional.of(ActiveDomain.SERVICE);
            case "CONSIGNMENT", "SELL", "SELLING" -> Optional.of(ActiveDomain.CONSIGNMENT);
            default -> Optional.empty();
        };
    }

    private static Pattern keywords(List<String> keywords) {
        StringBuilder regex = new StringBuilder("\\b(");
        for (int i = 0; i < keywords.size(); i++) {
            if (i > 0) {
                regex.append('|');
            }
            regex.append(Pattern.quote(keywords.get(i)));
        }
        regex.append(")\\b");
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }
}
