package com.raava.concierge.dialogue.machine;

import com.raava.concierge.dialogue.model.ConsignmentSlots;
import com.raava.concierge.dialogue.model.ConsignmentStage;
import com.raava.concierge.dialogue.model.ContactDetails;
import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.dialogue.model.VehicleDetails;
import com.raava.concierge.extraction.signal.Confirmation;
import com.raava.concierge.extraction.signal.ContactFact;
import com.raava.concierge.extraction.signal.FreeTextAnswer;
import com.raava.concierge.extraction.signal.PriceFact;
import com.raava.concierge.extraction.signal.Signal;
import com.raava.concierge.extraction.signal.VehicleFact;
import com.raava.concierge.inventory.model.Valuation;
import com.raava.concierge.inventory.service.ValuationCalculator;
import com.raava.concierge.session.model.ActiveDomain;
import com.raava.concierge.util.MoneyFormatter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Consignment funnel: the car, why it is being sold, the owner, then a listing review.
 *
 * Entering OWNER_DETAILS values the car and proposes the private-sale figure as the asking
 * price unless the owner already named one. At LISTING_REVIEW a stated price replaces the
 * asking price and a "yes" approves the listing; a "no" keeps the review open.
 */
@Component
@RequiredArgsConstructor
public class ConsignmentMachine extends DomainMachine<ConsignmentSlots> {

    private static final List<SlotField> FREE_TEXT_FIELDS =
            List.of(SlotField.MODEL, SlotField.COLOR, SlotField.REASON_FOR_SALE);

    private final ValuationCalculator valuationCalculator;

    @Override
    public ActiveDomain domain() {
        return ActiveDomain.CONSIGNMENT;
    }

    @Override
    public ConsignmentSlots initialSlots() {
        return new ConsignmentSlots();
    }

    @Override
    protected Class<ConsignmentSlots> slotsType() {
        return ConsignmentSlots.class;
    }

    @Override
    protected void merge(ConsignmentSlots slots, List<Signal> signals) {
        Boolean approval = null;
        for (Signal signal : signals) {
            if (signal instanceof FreeTextAnswer) {
                mergeFreeText(slots, (FreeTextAnswer) signal);
            } else if (signal instanceof VehicleFact) {
                mergeVehicle(slots.getVehicle(), (VehicleFact) signal);
            } else if (signal instanceof ContactFact) {
                mergeContact(slots.getContact(), (ContactFact) signal);
            } else if (signal instanceof PriceFact) {
                PriceFact price = (PriceFact) signal;
                if (!price.monthly()) {
                    slots.setAskingPrice(price.amount());
                    slots.setListingApproved(false);
                }
            } else if (signal instanceof Confirmation) {
                approval = ((Confirmation) signal).accepted();
            }
        }

        // applied last so "yes, list it at £150k" approves the new price
        if (approval != null && slots.getStage() == ConsignmentStage.LISTING_REVIEW) {
            slots.setListingApproved(approval);
        }
    }

    private void mergeFreeText(ConsignmentSlots slots, FreeTextAnswer answer) {
        switch (answer.field()) {
            case MODEL -> slots.getVehicle().setModel(answer.text());
            case COLOR -> slots.getVehicle().setColor(answer.text());
            case REASON_FOR_SALE -> slots.setReasonForSale(answer.text());
            default -> {
            }
        }
    }

    @Override
    public List<SlotField> missingFields(ConsignmentSlots slots) {
        List<SlotField> missing = new ArrayList<>();
        switch (slots.getStage()) {
            case VEHICLE_DETAILS -> {
                VehicleDetails vehicle = slots.getVehicle();
                if (isBlank(vehicle.getMake())) {
                    missing.add(SlotField.MAKE);
                }
                if (isBlank(vehicle.getModel())) {
                    missing.add(SlotField.MODEL);
                }
                if (vehicle.getYear() == null) {
                    missing.add(SlotField.YEAR);
                }
                if (isBlank(vehicle.getColor())) {
                    missing.add(SlotField.COLOR);
                }
                if (vehicle.getMileage() == null) {
                    missing.add(SlotField.MILEAGE);
                }
            }
            case SALE_DETAILS -> {
                if (isBlank(slots.getReasonForSale())) {
                    missing.add(SlotField.REASON_FOR_SALE);
                }
            }
            case OWNER_DETAILS -> {
                ContactDetails contact = slots.getContact();
                if (isBlank(contact.getName())) {
                    missing.add(SlotField.NAME);
                }
                if (isBlank(contact.getEmail())) {
                    missing.add(SlotField.EMAIL);
                }
                if (isBlank(contact.getPhone())) {
                    missing.add(SlotField.PHONE);
                }
            }
            case LISTING_REVIEW -> {
                if (!slots.isListingApproved()) {
                    missing.add(SlotField.LISTING_APPROVAL);
                }
            }
            case READY -> {
            }
        }
        return missing;
    }

    @Override
    protected void enterNextStage(ConsignmentSlots slots) {
        ConsignmentStage next = slots.getStage().next();
        slots.setStage(next);
        if (next == ConsignmentStage.OWNER_DETAILS) {
            Valuation valuation = valuationCalculator.value(slots.getVehicle());
            slots.setValuation(valuation);
            if (slots.getAskingPrice() == null) {
                slots.setAskingPrice((double) valuation.privateSale());
            }
        }
    }

    @Override
    protected StageExpectation expectationFor(ConsignmentSlots slots, List<SlotField> missing) {
        if (slots.getStage() == ConsignmentStage.LISTING_REVIEW && !missing.isEmpty()) {
            return StageExpectation.confirmation(SlotField.LISTING_APPROVAL);
        }
        return fieldsOrFreeText(missing, FREE_TEXT_FIELDS);
    }

    @Override
    protected String promptFor(ConsignmentSlots slots, List<SlotField> missing) {
        return switch (slots.getStage()) {
            case VEHICLE_DETAILS -> "I'd be glad to help you sell. Please tell me the " + joinLabels(missing)
                    + " of your car.";
            case SALE_DETAILS -> "Thanks. What's your reason for selling your " + slots.getVehicle().describe() + "?";
            case OWNER_DETAILS -> valuationPrompt(slots) + " To prepare the listing, please share your "
                    + joinLabels(missing) + ".";
            case LISTING_REVIEW -> reviewPrompt(slots);
            case READY -> "Creating your listing for the " + slots.getVehicle().describe() + " at "
                    + MoneyFormatter.whole(slots.getAskingPrice()) + ".";
        };
    }

    private String valuationPrompt(ConsignmentSlots slots) {
        Valuation valuation = slots.getValuation();
        return "Estimated value of your " + slots.getVehicle().describe() + ": trade-in "
                + MoneyFormatter.whole(valuation.tradeIn()) + ", private sale "
                + MoneyFormatter.whole(valuation.privateSale()) + ", retail "
                + MoneyFormatter.whole(valuation.retail()) + ".";
    }

    private String reviewPrompt(ConsignmentSlots slots) {
        VehicleDetails vehicle = slots.getVehicle();
        return "Here is your listing:\n"
                + vehicle.describe() + " in " + vehicle.getColor() + ", "
                + String.format(Locale.UK, "%,d", vehicle.getMileage()) + " miles\n"
                + "Asking price: " + MoneyFormatter.whole(slots.getAskingPrice()) + "\n"
                + "Reason for sale: " + slots.getReasonForSale() + "\n"
                + "Shall I publish it? Reply yes to approve, or tell me a different asking price.";
    }
}
