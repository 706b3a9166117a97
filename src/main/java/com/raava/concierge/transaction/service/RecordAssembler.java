package com.raava.concierge.transaction.service;

import com.raava.concierge.dialogue.model.ContactDetails;
import com.raava.concierge.dialogue.model.DomainSlots;
import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.VehicleDetails;
import com.raava.concierge.transaction.model.RecordStatus;
import com.raava.concierge.transaction.model.RecordType;
import org.bson.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Turns the slots of a finished funnel into a stored record.
 *
 * The required-field check here is independent of the dialogue machine: a record is only
 * written when every field it needs is present, whatever stage the machine reports.
 *
 * @param <S> slots of the funnel this assembler handles
 */
public interface RecordAssembler<S extends DomainSlots> {

    RecordType recordType();

    Class<S> slotsType();

    /**
     * Every required field that is still empty, in display order.
     */
    List<SlotField> missingFields(S slots);

    /**
     * Domain sections of the record. Common fields (ID, status, session, timestamps, notes)
     * are added by {@link #assemble}.
     */
    Document body(S slots, Instant now);

    /**
     * Address the confirmation goes to.
     */
    String recipient(S slots);

    String template();

    Map<String, Object> notificationData(S slots, String recordId);

    /**
     * Confirmation text shown to the user, including next steps.
     */
    String confirmation(S slots, String recordId);

    default Document assemble(S slots, String recordId, String sessionId, Instant now) {
        Document record = new Document(recordType().getIdField(), recordId)
                .append("status", RecordStatus.PENDING.value());
        record.putAll(body(slots, now));
        return record
                .append("sessionId", sessionId)
                .append("createdAt", Date.from(now))
                .append("updatedAt", Date.from(now))
                .append("notes", new ArrayList<>());
    }

    static Document contactSection(ContactDetails contact) {
        return new Document("name", contact.getName())
                .append("email", contact.getEmail())
                .append("phone", contact.getPhone())
                .append("postcode", contact.getPostcode());
    }

    static Document vehicleSection(VehicleDetails vehicle) {
        return new Document("make", vehicle.getMake())
                .append("model", vehicle.getModel())
                .append("year", vehicle.getYear())
                .append("mileage", vehicle.getMileage());
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
