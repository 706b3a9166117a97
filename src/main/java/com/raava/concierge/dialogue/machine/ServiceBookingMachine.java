package com.raava.concierge.dialogue.machine;

import com.raava.concierge.dialogue.model.ContactDetails;
import com.raava.concierge.dialogue.model.ServiceSlots;
import com.raava.concierge.dialogue.model.ServiceStage;
import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.dialogue.model.VehicleDetails;
import com.raava.concierge.extraction.signal.ContactFact;
import com.raava.concierge.extraction.signal.DateTimeSignal;
import com.raava.concierge.extraction.signal.FreeTextAnswer;
import com.raava.concierge.extraction.signal.OptionChoice;
import com.raava.concierge.extraction.signal.ServiceRequest;
import com.raava.concierge.extraction.signal.Signal;
import com.raava.concierge.extraction.signal.VehicleFact;
import com.raava.concierge.inventory.model.ServiceProvider;
import com.raava.concierge.inventory.service.ServiceProviderDirectory;
import com.raava.concierge.session.model.ActiveDomain;
import com.raava.concierge.util.MoneyFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Service booking funnel: the car, the work, the owner, a garage, a date.
 *
 * Entering PROVIDER_SELECTION looks up garages for the make near the customer's postcode.
 * Appointment times in the past are ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServiceBookingMachine extends DomainMachine<ServiceSlots> {

    public static final DateTimeFormatter APPOINTMENT_FORMAT =
            DateTimeFormatter.ofPattern("EEEE d MMMM yyyy 'at' HH:mm", Locale.UK);

    private static final List<SlotField> FREE_TEXT_FIELDS = List.of(SlotField.MODEL);

    private final ServiceProviderDirectory providerDirectory;
    private final Clock clock;

    @Override
    public ActiveDomain domain() {
        return ActiveDomain.SERVICE;
    }

    @Override
    public ServiceSlots initialSlots() {
        return new ServiceSlots();
    }

    @Override
    protected Class<ServiceSlots> slotsType() {
        return ServiceSlots.class;
    }

    @Override
    protected void merge(ServiceSlots slots, List<Signal> signals) {
        for (Signal signal : signals) {
            if (signal instanceof FreeTextAnswer) {
                FreeTextAnswer answer = (FreeTextAnswer) signal;
                if (answer.field() == SlotField.MODEL) {
                    slots.getVehicle().setModel(answer.text());
                }
            } else if (signal instanceof VehicleFact) {
                mergeVehicle(slots.getVehicle(), (VehicleFact) signal);
            } else if (signal instanceof ServiceRequest) {
                ServiceRequest request = (ServiceRequest) signal;
                slots.setServiceType(request.serviceType());
                slots.setServiceDescription(request.description());
            } else if (signal instanceof ContactFact) {
                mergeContact(slots.getContact(), (ContactFact) signal);
            } else if (signal instanceof OptionChoice) {
                selectProvider(slots, ((OptionChoice) signal).index());
            } else if (signal instanceof DateTimeSignal) {
                mergeAppointment(slots, (DateTimeSignal) signal);
            }
        }

        if (slots.getStage() == ServiceStage.PROVIDER_SELECTION && slots.getSelectedProvider() == null) {
            lookupProviders(slots);
        }
    }

    private void selectProvider(ServiceSlots slots, int index) {
        if (slots.getStage() != ServiceStage.PROVIDER_SELECTION) {
            return;
        }
        List<ServiceProvider> providers = slots.getAvailableProviders();
        if (index >= 1 && index <= providers.size()) {
            slots.setSelectedProvider(providers.get(index - 1));
        }
    }

    private void mergeAppointment(ServiceSlots slots, DateTimeSignal signal) {
        LocalDateTime resolved = signal.resolve(slots.getAppointmentDateTime());
        if (resolved == null) {
            return;
        }
        if (!resolved.isAfter(LocalDateTime.now(clock))) {
            log.debug("Ignoring appointment time in the past: {}", resolved);
            return;
        }
        slots.setAppointmentDateTime(resolved);
    }

    @Override
    public List<SlotField> missingFields(ServiceSlots slots) {
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
                if (vehicle.getMileage() == null) {
                    missing.add(SlotField.MILEAGE);
                }
            }
            case SERVICE_TYPE -> {
                if (slots.getServiceType() == null) {
                    missing.add(SlotField.SERVICE_TYPE);
                }
            }
            case CUSTOMER_DETAILS -> {
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
                if (isBlank(contact.getPostcode())) {
                    missing.add(SlotField.POSTCODE);
                }
            }
            case PROVIDER_SELECTION -> {
                if (slots.getSelectedProvider() == null) {
                    missing.add(SlotField.SELECTED_PROVIDER);
                }
            }
            case APPOINTMENT_DATE -> {
                if (slots.getAppointmentDateTime() == null) {
                    missing.add(SlotField.APPOINTMENT_DATE);
                }
            }
            case READY -> {
            }
        }
        return missing;
    }

    @Override
    protected void enterNextStage(ServiceSlots slots) {
        ServiceStage next = slots.getStage().next();
        slots.setStage(next);
        if (next == ServiceStage.PROVIDER_SELECTION) {
            lookupProviders(slots);
        }
    }

    private void lookupProviders(ServiceSlots slots) {
        String key = slots.getVehicle().getMake() + "|" + slots.getContact().getPostcode();
        if (key.equals(slots.getProviderLookupKey())) {
            return;
        }
        List<ServiceProvider> providers = providerDirectory.findProviders(
                slots.getVehicle().getMake(), slots.getContact().getPostcode(), slots.getServiceType());
        slots.setAvailableProviders(new ArrayList<>(providers));
        slots.setProviderLookupKey(key);
    }

    @Override
    protected StageExpectation expectationFor(ServiceSlots slots, List<SlotField> missing) {
        if (slots.getStage() == ServiceStage.PROVIDER_SELECTION && missing.contains(SlotField.SELECTED_PROVIDER)) {
            return StageExpectation.choice(slots.getAvailableProviders().size(), SlotField.SELECTED_PROVIDER);
        }
        return fieldsOrFreeText(missing, FREE_TEXT_FIELDS);
    }

    @Override
    protected String promptFor(ServiceSlots slots, List<SlotField> missing) {
        return switch (slots.getStage()) {
            case VEHICLE_DETAILS -> "Happy to arrange that. Please tell me your car's " + joinLabels(missing) + ".";
            case SERVICE_TYPE -> "What does your " + slots.getVehicle().describe()
                    + " need? For example an annual service, MOT, brakes, tyres or diagnostics.";
            case CUSTOMER_DETAILS -> "Thanks. To find garages near you, please share your " + joinLabels(missing) + ".";
            case PROVIDER_SELECTION -> providerPrompt(slots);
            case APPOINTMENT_DATE -> slots.getSelectedProvider().getName()
                    + " it is. What date and time would suit you?";
            case READY -> "Booking your " + slots.getServiceType().getDisplayName().toLowerCase(Locale.UK) + " with "
                    + slots.getSelectedProvider().getName() + " on "
                    + slots.getAppointmentDateTime().format(APPOINTMENT_FORMAT) + ".";
        };
    }

    private String providerPrompt(ServiceSlots slots) {
        List<ServiceProvider> providers = slots.getAvailableProviders();
        if (providers.isEmpty()) {
            return "I couldn't find a garage for your " + slots.getVehicle().describe()
                    + " near " + slots.getContact().getPostcode() + ". Could you give another postcode?";
        }
        StringBuilder prompt = new StringBuilder("These garages can look after your ")
                .append(slots.getVehicle().describe()).append(":\n");
        for (int i = 0; i < providers.size(); i++) {
            ServiceProvider provider = providers.get(i);
            prompt.append(i + 1).append(". ").append(provider.getName())
                    .append(" - ").append(provider.getLocation())
                    .append(" | ").append(provider.getRating()).append(" stars")
                    .append(" | ").append(provider.getDistanceMiles()).append(" miles");
            if (provider.getEstimatedCost() != null) {
                prompt.append(" | est. ").append(MoneyFormatter.whole(provider.getEstimatedCost()));
            }
            prompt.append('\n');
        }
        prompt.append("Reply with the number of the garage you'd like.");
        return prompt.toString();
    }
}
