package com.raava.concierge.dialogue.machine;

import com.raava.concierge.dialogue.model.AcquisitionSlots;
import com.raava.concierge.dialogue.model.AcquisitionStage;
import com.raava.concierge.dialogue.model.ContactDetails;
import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.detector.VehicleLexicon;
import com.raava.concierge.extraction.signal.ContactFact;
import com.raava.concierge.extraction.signal.FinancePreference;
import com.raava.concierge.extraction.signal.OptionChoice;
import com.raava.concierge.extraction.signal.PriceFact;
import com.raava.concierge.extraction.signal.Signal;
import com.raava.concierge.extraction.signal.VehicleFact;
import com.raava.concierge.finance.model.FinanceQuote;
import com.raava.concierge.finance.model.FinanceType;
import com.raava.concierge.finance.service.FinanceOfferService;
import com.raava.concierge.inventory.model.SearchCriteria;
import com.raava.concierge.inventory.model.VehicleListing;
import com.raava.concierge.inventory.service.VehicleSearchProvider;
import com.raava.concierge.session.model.ActiveDomain;
import com.raava.concierge.util.MoneyFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Acquisition funnel: find a car, pick one, leave contact details.
 *
 * VEHICLE_SEARCH needs a make. Entering VEHICLE_SELECTION runs the stock search; the results
 * are cached and only refreshed when the make, model or budget changes before a car is picked.
 * CUSTOMER_INFO needs name, email and phone. Entering READY settles the payment method
 * (cash unless finance was asked for) and quotes the chosen finance product.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AcquisitionMachine extends DomainMachine<AcquisitionSlots> {

    private final VehicleSearchProvider vehicleSearchProvider;
    private final FinanceOfferService financeOfferService;

    @Override
    public ActiveDomain domain() {
        return ActiveDomain.ACQUISITION;
    }

    @Override
    public AcquisitionSlots initialSlots() {
        return new AcquisitionSlots();
    }

    @Override
    protected Class<AcquisitionSlots> slotsType() {
        return AcquisitionSlots.class;
    }

    @Override
    protected void merge(AcquisitionSlots slots, List<Signal> signals) {
        for (Signal signal : signals) {
            if (signal instanceof VehicleFact) {
                mergeVehicleFact(slots, (VehicleFact) signal);
            } else if (signal instanceof OptionChoice) {
                selectOption(slots, ((OptionChoice) signal).index());
            } else if (signal instanceof ContactFact) {
                mergeContact(slots.getContact(), (ContactFact) signal);
            } else if (signal instanceof FinancePreference) {
                slots.setFinanceType(((FinancePreference) signal).financeType());
            } else if (signal instanceof PriceFact) {
                mergeBudget(slots, (PriceFact) signal);
            }
        }

        if (slots.getStage() == AcquisitionStage.VEHICLE_SELECTION
                && slots.getSelectedVehicle() == null
                && !searchKey(slots).equals(slots.getSearchKey())) {
            runSearch(slots);
        }
    }

    private void mergeVehicleFact(AcquisitionSlots slots, VehicleFact fact) {
        if (fact.make() != null) {
            slots.setMake(fact.make());
        }
        if (fact.model() != null) {
            if (slots.getStage() == AcquisitionStage.VEHICLE_SELECTION && slots.getSelectedVehicle() == null
                    && selectByModel(slots, fact.model())) {
                return;
            }
            slots.setModel(fact.model());
        }
    }

    private void selectOption(AcquisitionSlots slots, int index) {
        if (slots.getStage() != AcquisitionStage.VEHICLE_SELECTION) {
            return;
        }
        List<VehicleListing> results = slots.getSearchResults();
        if (index >= 1 && index <= results.size()) {
            slots.setSelectedVehicle(results.get(index - 1));
        }
    }

    /**
     * Picks the search result whose model matches, when exactly one does.
     */
    private boolean selectByModel(AcquisitionSlots slots, String model) {
        String wanted = model.toLowerCase(Locale.ROOT);
        List<VehicleListing> matches = slots.getSearchResults().stream()
                .filter(listing -> listing.getModel() != null && listing.getModel().toLowerCase(Locale.ROOT).contains(wanted))
                .collect(Collectors.toList());
        if (matches.size() == 1) {
            slots.setSelectedVehicle(matches.get(0));
            return true;
        }
        return false;
    }

    private void mergeBudget(AcquisitionSlots slots, PriceFact price) {
        if (slots.getSelectedVehicle() != null) {
            return;
        }
        double maxPrice = price.monthly()
                ? financeOfferService.maxAffordablePrice(price.amount(), 0)
                : price.amount();
        slots.setMaxPrice(maxPrice);
    }

    @Override
    public List<SlotField> missingFields(AcquisitionSlots slots) {
        List<SlotField> missing = new ArrayList<>();
        switch (slots.getStage()) {
            case VEHICLE_SEARCH -> {
                if (isBlank(slots.getMake())) {
                    missing.add(SlotField.MAKE);
                }
            }
            case VEHICLE_SELECTION -> {
                if (slots.getSelectedVehicle() == null) {
                    missing.add(SlotField.SELECTED_VEHICLE);
                }
            }
            case CUSTOMER_INFO -> {
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
            case READY -> {
            }
        }
        return missing;
    }

    @Override
    protected void enterNextStage(AcquisitionSlots slots) {
        AcquisitionStage next = slots.getStage().next();
        slots.setStage(next);
        switch (next) {
            case VEHICLE_SELECTION -> runSearch(slots);
            case READY -> settleFinance(slots);
            default -> {
            }
        }
    }

    private void runSearch(AcquisitionSlots slots) {
        SearchCriteria criteria = SearchCriteria.builder()
                .make(slots.getMake())
                .model(slots.getModel())
                .maxPrice(slots.getMaxPrice())
                .build();
        List<VehicleListing> results = vehicleSearchProvider.search(criteria);
        if (results.isEmpty() && slots.getModel() != null) {
            criteria.setModel(null);
            results = vehicleSearchProvider.search(criteria);
        }
        slots.setSearchResults(new ArrayList<>(results));
        slots.setSearchKey(searchKey(slots));
    }

    private void settleFinance(AcquisitionSlots slots) {
        if (slots.getFinanceType() == null) {
            slots.setFinanceType(FinanceType.CASH);
        }
        if (slots.getFinanceType().isFinanced() && slots.getSelectedVehicle().getPrice() != null) {
            FinanceQuote quote = financeOfferService.quote(slots.getFinanceType(), slots.getSelectedVehicle().getPrice());
            slots.setFinanceQuote(quote);
        }
    }

    private static String searchKey(AcquisitionSlots slots) {
        return Objects.toString(slots.getMake(), "") + "|" + Objects.toString(slots.getModel(), "") + "|"
                + Objects.toString(slots.getMaxPrice(), "");
    }

    @Override
    protected StageExpectation expectationFor(AcquisitionSlots slots, List<SlotField> missing) {
        if (slots.getStage() == AcquisitionStage.VEHICLE_SELECTION && missing.contains(SlotField.SELECTED_VEHICLE)) {
            return StageExpectation.choice(slots.getSearchResults().size(), SlotField.SELECTED_VEHICLE);
        }
        return StageExpectation.fields(missing);
    }

    @Override
    protected String promptFor(AcquisitionSlots slots, List<SlotField> missing) {
        return switch (slots.getStage()) {
            case VEHICLE_SEARCH -> "Which make are you interested in? We currently have "
                    + String.join(", ", VehicleLexicon.featuredMakes()) + " and more.";
            case VEHICLE_SELECTION -> selectionPrompt(slots);
            case CUSTOMER_INFO -> "Excellent choice: the " + slots.getSelectedVehicle().title() + " at "
                    + MoneyFormatter.whole(slots.getSelectedVehicle().getPrice()) + ". To reserve it, please share your "
                    + joinLabels(missing) + ".";
            case READY -> "Thank you, " + slots.getContact().getName() + ". I'm placing your order for the "
                    + slots.getSelectedVehicle().title() + " now.";
        };
    }

    private String selectionPrompt(AcquisitionSlots slots) {
        List<VehicleListing> results = slots.getSearchResults();
        if (results.isEmpty()) {
            return "We have no " + slots.getMake() + " in stock right now"
                    + (slots.getMaxPrice() != null ? " under " + MoneyFormatter.whole(slots.getMaxPrice()) : "")
                    + ". Would you like to try another make?";
        }
        StringBuilder prompt = new StringBuilder("Here is what we have");
        prompt.append(results.size() == 1 ? " (1 car)" : " (" + results.size() + " cars)").append(":\n");
        for (int i = 0; i < results.size(); i++) {
            VehicleListing listing = results.get(i);
            prompt.append(i + 1).append(". ").append(listing.title())
                    .append(" - ").append(MoneyFormatter.whole(listing.getPrice()))
                    .append(" | ").append(String.format(Locale.UK, "%,d", listing.getMileage() != null ? listing.getMileage() : 0))
                    .append(" miles | ").append(listing.getLocation()).append('\n');
        }
        prompt.append("Reply with the number of the car you'd like.");
        return prompt.toString();
    }
}
