package com.raava.concierge.transaction.service;

import com.raava.concierge.dialogue.model.AcquisitionSlots;
import com.raava.concierge.dialogue.model.ContactDetails;
import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.finance.model.FinanceQuote;
import com.raava.concierge.finance.model.FinanceType;
import com.raava.concierge.inventory.model.VehicleListing;
import com.raava.concierge.transaction.model.RecordType;
import com.raava.concierge.util.MoneyFormatter;
import org.bson.Document;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds purchase orders from the acquisition funnel.
 */
@Component
public class OrderAssembler implements RecordAssembler<AcquisitionSlots> {

    static final String FINANCE_PROVIDER = "Raava Finance";

    @Override
    public RecordType recordType() {
        return RecordType.ORDER;
    }

    @Override
    public Class<AcquisitionSlots> slotsType() {
        return AcquisitionSlots.class;
    }

    @Override
    public List<SlotField> missingFields(AcquisitionSlots slots) {
        List<SlotField> missing = new ArrayList<>();
        if (slots.getSelectedVehicle() == null) {
            missing.add(SlotField.SELECTED_VEHICLE);
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
        return missing;
    }

    @Override
    public Document body(AcquisitionSlots slots, Instant now) {
        VehicleListing vehicle = slots.getSelectedVehicle();
        Document body = new Document("orderType", "purchase")
                .append("vehicle", new Document("vehicleId", vehicle.getId())
                        .append("make", vehicle.getMake())
                        .append("model", vehicle.getModel())
                        .append("year", vehicle.getYear())
                        .append("price", vehicle.getPrice())
                        .append("mileage", vehicle.getMileage())
                        .append("location", vehicle.getLocation())
                        .append("source", vehicle.getSource()))
                .append("customer", RecordAssembler.contactSection(slots.getContact()));

        FinanceQuote quote = financedQuote(slots);
        if (quote != null) {
            body.append("finance", new Document("type", financeType(slots).name())
                    .append("provider", FINANCE_PROVIDER)
                    .append("monthlyPayment", quote.monthlyPayment())
                    .append("deposit", quote.deposit())
                    .append("termMonths", quote.termMonths())
                    .append("annualRatePercent", quote.annualRatePercent())
                    .append("totalCost", quote.totalCost())
                    .append("finalPayment", quote.finalPayment())
                    .append("totalInterest", quote.totalInterest()));
        }
        return body.append("totalAmount", totalAmount(slots));
    }

    @Override
    public String recipient(AcquisitionSlots slots) {
        return slots.getContact().getEmail();
    }

    @Override
    public String template() {
        return "order_confirmation";
    }

    @Override
    public Map<String, Object> notificationData(AcquisitionSlots slots, String recordId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("orderId", recordId);
        data.put("customerName", slots.getContact().getName());
        data.put("vehicle", slots.getSelectedVehicle().title());
        data.put("paymentMethod", financeType(slots).getProductName());
        data.put("totalAmount", totalAmount(slots));
        return data;
    }

    @Override
    public String confirmation(AcquisitionSlots slots, String recordId) {
        VehicleListing vehicle = slots.getSelectedVehicle();
        StringBuilder message = new StringBuilder()
                .append("Your order is confirmed.\n\n")
                .append("Order ID: ").append(recordId).append('\n')
                .append("Vehicle: ").append(vehicle.title()).append('\n')
                .append("Price: ").append(MoneyFormatter.whole(listedPrice(vehicle))).append('\n');

        FinanceQuote quote = financedQuote(slots);
        if (quote != null) {
            message.append("Finance: ").append(quote.productName())
                    .append(", ").append(MoneyFormatter.exact(quote.monthlyPayment())).append(" per month for ")
                    .append(quote.termMonths()).append(" months after a ")
                    .append(MoneyFormatter.whole(quote.deposit())).append(" deposit\n");
            if (quote.hasFinalPayment()) {
                message.append("Final payment: ").append(MoneyFormatter.exact(quote.finalPayment())).append('\n');
            }
            message.append("Total payable: ").append(MoneyFormatter.exact(quote.totalCost())).append('\n');
        } else {
            message.append("Payment: Cash\n");
        }

        message.append("\nNext steps:\n")
                .append("1. Our team will contact you within 24 hours.\n");
        if (quote != null) {
            message.append("2. We will send your finance paperwork to ").append(slots.getContact().getEmail()).append('.');
        } else {
            message.append("2. A secure payment link will be sent to ").append(slots.getContact().getEmail()).append('.');
        }
        return message.toString();
    }

    private static FinanceType financeType(AcquisitionSlots slots) {
        return slots.getFinanceType() == null ? FinanceType.CASH : slots.getFinanceType();
    }

    private static FinanceQuote financedQuote(AcquisitionSlots slots) {
        return financeType(slots).isFinanced() ? slots.getFinanceQuote() : null;
    }

    private static double totalAmount(AcquisitionSlots slots) {
        FinanceQuote quote = financedQuote(slots);
        return quote != null ? quote.totalCost() : listedPrice(slots.getSelectedVehicle());
    }

    private static double listedPrice(VehicleListing vehicle) {
        return vehicle.getPrice() == null ? 0 : vehicle.getPrice();
    }
}
