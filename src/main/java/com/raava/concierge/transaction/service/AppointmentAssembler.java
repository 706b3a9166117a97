package com.raava.concierge.transaction.service;

import com.raava.concierge.dialogue.machine.ServiceBookingMachine;
import com.raava.concierge.dialogue.model.ContactDetails;
import com.raava.concierge.dialogue.model.ServiceSlots;
import com.raava.concierge.dialogue.model.ServiceType;
import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.VehicleDetails;
import com.raava.concierge.inventory.model.ServiceProvider;
import com.raava.concierge.transaction.model.RecordType;
import com.raava.concierge.util.MoneyFormatter;
import org.bson.Document;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds service appointments from the service booking funnel.
 */
@Component
public class AppointmentAssembler implements RecordAssembler<ServiceSlots> {

    private static final double DEFAULT_DURATION_HOURS = 2.0;

    private static final Map<ServiceType, Double> DURATION_HOURS = Map.of(
            ServiceType.ANNUAL_SERVICE, 2.0,
            ServiceType.MAJOR_SERVICE, 3.0,
            ServiceType.REPAIR, 2.5,
            ServiceType.UPGRADE, 4.0,
            ServiceType.DIAGNOSTICS, 1.0,
            ServiceType.MOT, 1.0,
            ServiceType.BRAKES, 2.0,
            ServiceType.TYRES, 1.0,
            ServiceType.OIL_CHANGE, 1.0);

    @Override
    public RecordType recordType() {
        return RecordType.APPOINTMENT;
    }

    @Override
    public Class<ServiceSlots> slotsType() {
        return ServiceSlots.class;
    }

    @Override
    public List<SlotField> missingFields(ServiceSlots slots) {
        List<SlotField> missing = new ArrayList<>();
        VehicleDetails vehicle = slots.getVehicle();
        if (RecordAssembler.isBlank(vehicle.getMake())) {
            missing.add(SlotField.MAKE);
        }
        if (RecordAssembler.isBlank(vehicle.getModel())) {
            missing.add(SlotField.MODEL);
        }
        if (vehicle.getYear() == null) {
            missing.add(SlotField.YEAR);
        }
        if (vehicle.getMileage() == null) {
            missing.add(SlotField.MILEAGE);
        }
        if (slots.getServiceType() == null) {
            missing.add(SlotField.SERVICE_TYPE);
        }
        ContactDetails contact = slots.getContact();
        if (RecordAssembler.isBlank(contact.getName())) {
            missing.add(SlotField.NAME);
        }
        if (RecordAssembler.isBlank(contact.getEmail())) {
            missing.add(SlotField.EMAIL);
        }
        if (RecordAssembler.isBlank(contact.getPhone())) {
            missing.add(SlotField.PHONE);
        }
        if (RecordAssembler.isBlank(contact.getPostcode())) {
            missing.add(SlotField.POSTCODE);
        }
        if (slots.getSelectedProvider() == null) {
            missing.add(SlotField.SELECTED_PROVIDER);
        }
        if (slots.getAppointmentDateTime() == null) {
            missing.add(SlotField.APPOINTMENT_DATE);
        }
        return missing;
    }

    @Override
    public Document body(ServiceSlots slots, Instant now) {
        ServiceProvider provider = slots.getSelectedProvider();
        LocalDateTime appointment = slots.getAppointmentDateTime();
        return new Document("vehicle", RecordAssembler.vehicleSection(slots.getVehicle()))
                .append("service", new Document("type", slots.getServiceType().name())
                        .append("description", slots.getServiceDescription())
                        .append("estimatedDurationHours", durationHours(slots.getServiceType())))
                .append("provider", new Document("name", provider.getName())
                        .append("location", provider.getLocation())
                        .append("phone", provider.getPhone())
                        .append("rating", provider.getRating())
                        .append("distanceMiles", provider.getDistanceMiles())
                        .append("estimatedCost", provider.getEstimatedCost()))
                .append("appointment", new Document("date", appointment.toLocalDate().toString())
                        .append("time", appointment.toLocalTime().toString())
                        .append("formatted", appointment.format(ServiceBookingMachine.APPOINTMENT_FORMAT)))
                .append("customer", RecordAssembler.contactSection(slots.getContact()));
    }

    @Override
    public String recipient(ServiceSlots slots) {
        return slots.getContact().getEmail();
    }

    @Override
    public String template() {
        return "appointment_confirmation";
    }

    @Override
    public Map<String, Object> notificationData(ServiceSlots slots, String recordId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("appointmentId", recordId);
        data.put("customerName", slots.getContact().getName());
        data.put("vehicle", slots.getVehicle().describe());
        data.put("service", slots.getServiceType().getDisplayName());
        data.put("provider", slots.getSelectedProvider().getName());
        data.put("appointment", slots.getAppointmentDateTime().format(ServiceBookingMachine.APPOINTMENT_FORMAT));
        return data;
    }

    @Override
    public String confirmation(ServiceSlots slots, String recordId) {
        ServiceProvider provider = slots.getSelectedProvider();
        StringBuilder message = new StringBuilder()
                .append("Your service appointment is booked.\n\n")
                .append("Appointment ID: ").append(recordId).append('\n')
                .append("Vehicle: ").append(slots.getVehicle().describe()).append('\n')
                .append("Service: ").append(slots.getServiceType().getDisplayName()).append('\n')
                .append("Provider: ").append(provider.getName());
        if (provider.getLocation() != null) {
            message.append(", ").append(provider.getLocation());
        }
        message.append('\n')
                .append("When: ").append(slots.getAppointmentDateTime().format(ServiceBookingMachine.APPOINTMENT_FORMAT)).append('\n');
        if (provider.getEstimatedCost() != null) {
            message.append("Estimated cost: ").append(MoneyFormatter.whole(provider.getEstimatedCost())).append('\n');
        }
        return message.append("\nNext steps:\n")
                .append("1. ").append(provider.getName()).append(" will call you the day before to confirm.\n")
                .append("2. Please arrive 10 minutes early.\n")
                .append("3. Bring your service book and any keys.")
                .toString();
    }

    static double durationHours(ServiceType serviceType) {
        return DURATION_HOURS.getOrDefault(serviceType, DEFAULT_DURATION_HOURS);
    }
}
