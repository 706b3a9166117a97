package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.ServiceType;
import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.ServiceRequest;
import com.raava.concierge.extraction.signal.Signal;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Detects the kind of work wanted on a vehicle. Specific work wins over a generic
 * "service", which is read as an annual service.
 */
@Component
@Order(70)
public class ServiceRequestDetector implements SignalDetector {

    private static final Map<ServiceType, Pattern> SERVICE_PATTERNS = new LinkedHashMap<>();

    static {
        SERVICE_PATTERNS.put(ServiceType.MOT, word("mot"));
        SERVICE_PATTERNS.put(ServiceType.MAJOR_SERVICE, word("major service|full service"));
        SERVICE_PATTERNS.put(ServiceType.OIL_CHANGE, word("oil change|oil and filter|change the oil|oil service"));
        SERVICE_PATTERNS.put(ServiceType.BRAKES, word("brakes?|brake pads?|discs? and pads"));
        SERVICE_PATTERNS.put(ServiceType.TYRES, word("tyres?|tires?|puncture|wheel alignment"));
        SERVICE_PATTERNS.put(ServiceType.DIAGNOSTICS, word("diagnostics?|warning light|engine light|check engine|strange noise|fault code"));
        SERVICE_PATTERNS.put(ServiceType.REPAIR, word("repair|fix|broken|damage|bodywork|dent|scratch"));
        SERVICE_PATTERNS.put(ServiceType.UPGRADE, word("upgrade|remap|exhaust|wrap|ppf|ceramic coating"));
        SERVICE_PATTERNS.put(ServiceType.ANNUAL_SERVICE, word("annual service|yearly service|interim service|service|servicing|maintenance|check-?up|inspection"));
    }

    @Override
    public Optional<Signal> detect(String utterance, StageExpectation expectation) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        for (Map.Entry<ServiceType, Pattern> entry : SERVICE_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(utterance).find()) {
                return Optional.of(new ServiceRequest(entry.getKey(), utterance.trim()));
            }
        }
        return Optional.empty();
    }

    private static Pattern word(String alternatives) {
        return Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
