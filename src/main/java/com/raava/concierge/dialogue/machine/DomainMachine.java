package com.raava.concierge.dialogue.machine;

import com.raava.concierge.dialogue.model.ContactDetails;
import com.raava.concierge.dialogue.model.DomainSlots;
import com.raava.concierge.dialogue.model.MachineOutcome;
import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.dialogue.model.VehicleDetails;
import com.raava.concierge.extraction.signal.ContactFact;
import com.raava.concierge.extraction.signal.Signal;
import com.raava.concierge.extraction.signal.VehicleFact;
import com.raava.concierge.session.model.ActiveDomain;
import com.raava.concierge.session.model.SessionState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Slot-filling state machine for one domain funnel.
 *
 * Responsibilities:
 * - Merge the signals of a turn into the domain's slots
 * - Work out which fields the current stage still needs
 * - Advance through every stage whose fields are already present, running each stage's
 *   entry action on the way in (search, provider lookup, valuation, finance quote)
 * - Tell the extractor what the resulting stage is waiting for
 *
 * Stages only move forward. A filled slot changes only when a later message supplies the
 * same field again. READY needs nothing further; the record itself is created elsewhere.
 *
 * @param <S> slots type of the domain
 */
@Slf4j
public abstract class DomainMachine<S extends DomainSlots> {

    public abstract ActiveDomain domain();

    public abstract S initialSlots();

    protected abstract Class<S> slotsType();

    /**
     * Applies every signal this domain understands. Signals for other domains are ignored.
     */
    protected abstract void merge(S slots, List<Signal> signals);

    /**
     * Fields the current stage still needs, in the order they are asked for.
     */
    public abstract List<SlotField> missingFields(S slots);

    /**
     * Moves to the next stage and runs its entry action.
     */
    protected abstract void enterNextStage(S slots);

    /**
     * What the current stage is asking for, given the fields still missing.
     */
    protected abstract StageExpectation expectationFor(S slots, List<SlotField> missing);

    /**
     * Deterministic reply for the current stage.
     */
    protected abstract String promptFor(S slots, List<SlotField> missing);

    /**
     * Advances the session's funnel by one user turn.
     *
     * @param session session whose active domain is this machine's domain; its slots and
     *                expectation are updated in place
     * @param signals signals extracted from the user's message
     * @return the stage reached, what is still missing and the prompt for it
     */
    public MachineOutcome advance(SessionState session, List<Signal> signals) {
        S slots = slotsOf(session);
        String startStage = slots.stageName();

        merge(slots, signals);

        List<String> enteredStages = new ArrayList<>();
        List<SlotField> missing = missingFields(slots);
        while (missing.isEmpty() && !slots.readyForRecord()) {
            enterNextStage(slots);
            enteredStages.add(slots.stageName());
            missing = missingFields(slots);
        }

        session.setSlots(slots);
        session.setAwaiting(expectationFor(slots, missing));

        if (!enteredStages.isEmpty()) {
            log.info("Funnel advanced - domain: {}, from: {}, to: {}, entered: {}",
                    domain(), startStage, slots.stageName(), enteredStages);
        }

        return new MachineOutcome(
                slots.stageName(),
                labels(missing),
                promptFor(slots, missing),
                slots.readyForRecord(),
                enteredStages);
    }

    /**
     * Typed slots of the session, or fresh slots when the session holds none of this domain.
     */
    protected S slotsOf(SessionState session) {
        DomainSlots current = session.getSlots();
        if (slotsType().isInstance(current)) {
            return slotsType().cast(current);
        }
        return initialSlots();
    }

    /**
     * Free-text expectation when exactly one open-ended field is missing, otherwise the fields.
     */
    protected static StageExpectation fieldsOrFreeText(List<SlotField> missing, List<SlotField> freeTextFields) {
        if (missing.size() == 1 && freeTextFields.contains(missing.get(0))) {
            return StageExpectation.freeText(missing.get(0));
        }
        return StageExpectation.fields(missing);
    }

    protected static List<String> labels(List<SlotField> fields) {
        return fields.stream().map(SlotField::getLabel).collect(Collectors.toList());
    }

    protected static String joinLabels(List<SlotField> fields) {
        List<String> labels = labels(fields).stream().map(String::toLowerCase).collect(Collectors.toList());
        if (labels.size() <= 1) {
            return String.join("", labels);
        }
        return String.join(", ", labels.subList(0, labels.size() - 1)) + " and " + labels.get(labels.size() - 1);
    }

    /**
     * Copies every contact detail present in {@code fact}.
     */
    protected static void mergeContact(ContactDetails contact, ContactFact fact) {
        if (fact.name() != null) {
            contact.setName(fact.name());
        }
        if (fact.email() != null) {
            contact.setEmail(fact.email());
        }
        if (fact.phone() != null) {
            contact.setPhone(fact.phone());
        }
        if (fact.postcode() != null) {
            contact.setPostcode(fact.postcode());
        }
    }

    /**
     * Copies every vehicle attribute present in {@code fact}.
     */
    protected static void mergeVehicle(VehicleDetails vehicle, VehicleFact fact) {
        if (fact.make() != null) {
            vehicle.setMake(fact.make());
        }
        if (fact.model() != null) {
            vehicle.setModel(fact.model());
        }
        if (fact.year() != null) {
            vehicle.setYear(fact.year());
        }
        if (fact.mileage() != null) {
            vehicle.setMileage(fact.mileage());
        }
        if (fact.color() != null) {
            vehicle.setColor(fact.color());
        }
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
