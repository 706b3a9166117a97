package com.raava.concierge.transaction.service;

import com.raava.concierge.dialogue.model.ConsignmentSlots;
import com.raava.concierge.dialogue.model.ContactDetails;
import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.VehicleDetails;
import com.raava.concierge.inventory.model.Valuation;
import com.raava.concierge.transaction.model.RecordType;
import com.raava.concierge.util.MoneyFormatter;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds marketplace listings from the consignment funnel.
 */
@Component
public class ListingAssembler implements RecordAssembler<ConsignmentSlots> {

    static final List<String> DEFAULT_MARKETPLACES = List.of("AutoTrader");

    private final int expiryDays;

    public ListingAssembler(@Value("${raava.listing.expiry-days:90}") int expiryDays) {
        this.expiryDays = expiryDays;
    }

    @Override
    public RecordType recordType() {
        return RecordType.LISTING;
    }

    @Override
    public Class<ConsignmentSlots> slotsType() {
        return ConsignmentSlots.class;
    }

    @Override
    public List<SlotField> missingFields(ConsignmentSlots slots) {
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
        if (RecordAssembler.isBlank(vehicle.getColor())) {
            missing.add(SlotField.COLOR);
        }
        if (vehicle.getMileage() == null) {
            missing.add(SlotField.MILEAGE);
        }
        if (RecordAssembler.isBlank(slots.getReasonForSale())) {
            missing.add(SlotField.REASON_FOR_SALE);
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
        if (slots.getAskingPrice() == null || slots.getAskingPrice() <= 0) {
            missing.add(SlotField.ASKING_PRICE);
        }
        if (!slots.isListingApproved()) {
            missing.add(SlotField.LISTING_APPROVAL);
        }
        return missing;
    }

    @Override
    public Document body(ConsignmentSlots slots, Instant now) {
        VehicleDetails vehicle = slots.getVehicle();
        Document pricing = new Document("askingPrice", slots.getAskingPrice())
                .append("negotiable", true);
        Valuation valuation = slots.getValuation();
        if (valuation != null) {
            pricing.append("valuation", new Document("tradeIn", valuation.tradeIn())
                    .append("privateSale", valuation.privateSale())
                    .append("retail", valuation.retail()));
        }
        return new Document("vehicle", RecordAssembler.vehicleSection(vehicle).append("color", vehicle.getColor()))
                .append("pricing", pricing)
                .append("owner", RecordAssembler.contactSection(slots.getContact()))
                .append("reasonForSale", slots.getReasonForSale())
                .append("title", vehicle.describe())
                .append("marketplaces", new ArrayList<>(DEFAULT_MARKETPLACES))
                .append("expiresAt", Date.from(now.plus(Duration.ofDays(expiryDays))));
    }

    @Override
    public String recipient(ConsignmentSlots slots) {
        return slots.getContact().getEmail();
    }

    @Override
    public String template() {
        return "listing_confirmation";
    }

    @Override
    public Map<String, Object> notificationData(ConsignmentSlots slots, String recordId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("listingId", recordId);
        data.put("ownerName", slots.getContact().getName());
        data.put("vehicle", slots.getVehicle().describe());
        data.put("askingPrice", slots.getAskingPrice());
        data.put("marketplaces", DEFAULT_MARKETPLACES);
        return data;
    }

    @Override
    public String confirmation(ConsignmentSlots slots, String recordId) {
        return new StringBuilder()
                .append("Your listing has been created.\n\n")
                .append("Listing ID: ").append(recordId).append('\n')
                .append("Vehicle: ").append(slots.getVehicle().describe())
                .append(" in ").append(slots.getVehicle().getColor()).append('\n')
                .append("Asking price: ").append(MoneyFormatter.whole(slots.getAskingPrice())).append(" (negotiable)\n")
                .append("Marketplaces: ").append(String.join(", ", DEFAULT_MARKETPLACES)).append('\n')
                .append("\nNext steps:\n")
                .append("1. Your listing goes live once our photographer has visited.\n")
                .append("2. It runs for ").append(expiryDays).append(" days.\n")
                .append("3. We will email you at ").append(slots.getContact().getEmail())
                .append(" whenever a buyer enquires.")
                .toString();
    }
}
