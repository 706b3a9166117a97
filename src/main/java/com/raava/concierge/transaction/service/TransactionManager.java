package com.raava.concierge.transaction.service;

import com.raava.concierge.dialogue.model.DomainSlots;
import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.exception.PersistenceException;
import com.raava.concierge.notification.NotificationGateway;
import com.raava.concierge.repository.RecordStore;
import com.raava.concierge.transaction.model.RecordType;
import com.raava.concierge.transaction.model.TransactionResult;
import com.raava.concierge.util.SessionIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Creates the business record a finished funnel asks for.
 *
 * Responsibilities:
 * - Refuse a second record for the same funnel (idempotency through {@code recordCreated})
 * - Re-validate every required field independently of the dialogue machine
 * - Generate the record ID and persist the record, never overwriting an existing one
 * - Send the confirmation notification without letting its failure undo the record
 * - Mark the slots and return the confirmation text
 *
 * A persistence failure is thrown before the slots are touched, so the caller can retry the
 * same turn.
 */
@Slf4j
@Service
public class TransactionManager {

    static final int MAX_ID_ATTEMPTS = 5;

    private final RecordStore recordStore;
    private final NotificationGateway notificationGateway;
    private final RecordIdGenerator idGenerator;
    private final Clock clock;
    private final Map<Class<?>, RecordAssembler<?>> assemblers = new HashMap<>();

    public TransactionManager(RecordStore recordStore,
                              NotificationGateway notificationGateway,
                              RecordIdGenerator idGenerator,
                              Clock clock,
                              List<RecordAssembler<?>> assemblers) {
        this.recordStore = recordStore;
        this.notificationGateway = notificationGateway;
        this.idGenerator = idGenerator;
        this.clock = clock;
        for (RecordAssembler<?> assembler : assemblers) {
            this.assemblers.put(assembler.slotsType(), assembler);
        }
    }

    /**
     * Creates the record for {@code slots}.
     *
     * @param slots         slots of a funnel at its readiness gate; updated on success
     * @param sessionId     session the record is created from
     * @param correlationId correlation ID for logging
     * @return created, already created, or incomplete
     * @throws PersistenceException if the record store rejects the write
     */
    public TransactionResult create(DomainSlots slots, String sessionId, String correlationId) {
        RecordAssembler<?> assembler = assemblers.get(slots.getClass());
        if (assembler == null) {
            throw new IllegalArgumentException("No record assembler for " + slots.getClass().getSimpleName());
        }
        return createWith(assembler, slots, sessionId, correlationId);
    }

    public RecordType recordTypeFor(DomainSlots slots) {
        RecordAssembler<?> assembler = assemblers.get(slots.getClass());
        return assembler == null ? null : assembler.recordType();
    }

    private <S extends DomainSlots> TransactionResult createWith(RecordAssembler<S> assembler, DomainSlots rawSlots,
                                                                 String sessionId, String correlationId) {
        S slots = assembler.slotsType().cast(rawSlots);
        RecordType type = assembler.recordType();

        if (slots.isRecordCreated()) {
            log.info("Record already created - correlationId: {}, sessionId: {}, type: {}, recordId: {}",
                    correlationId, SessionIdMasker.mask(sessionId), type, slots.getRecordId());
            return new TransactionResult.AlreadyCreated(slots.getRecordId(),
                    "This request has already been completed. Your reference is " + slots.getRecordId() + ".");
        }

        List<SlotField> missing = assembler.missingFields(slots);
        if (!missing.isEmpty()) {
            List<String> labels = missing.stream().map(SlotField::getLabel).toList();
            log.info("Record validation incomplete - correlationId: {}, sessionId: {}, type: {}, missing: {}",
                    correlationId, SessionIdMasker.mask(sessionId), type, labels);
            return new TransactionResult.Incomplete(labels);
        }

        String recordId = persist(assembler, slots, sessionId, correlationId);

        List<String> warnings = new ArrayList<>();
        notify(assembler, slots, recordId, correlationId).ifPresent(warnings::add);

        slots.setRecordCreated(true);
        slots.setRecordId(recordId);

        log.info("Record created - correlationId: {}, sessionId: {}, type: {}, recordId: {}, warnings: {}",
                correlationId, SessionIdMasker.mask(sessionId), type, recordId, warnings.size());
        return new TransactionResult.Created(recordId, assembler.confirmation(slots, recordId), warnings);
    }

    /**
     * Inserts the record under a fresh ID. A taken ID is never overwritten; a new one is
     * generated, up to {@link #MAX_ID_ATTEMPTS} times.
     *
     * @return the ID the record was stored under
     */
    private <S extends DomainSlots> String persist(RecordAssembler<S> assembler, S slots,
                                                   String sessionId, String correlationId) {
        RecordType type = assembler.recordType();
        Instant now = clock.instant();
        for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS; attempt++) {
            String recordId = idGenerator.nextId(type);
            Document record = assembler.assemble(slots, recordId, sessionId, now);
            if (insert(type, recordId, record, correlationId)) {
                return recordId;
            }
            log.warn("Record ID already taken - correlationId: {}, type: {}, recordId: {}, attempt: {}",
                    correlationId, type, recordId, attempt);
        }
        log.error("Record persistence failed - correlationId: {}, type: {}, error: no free ID after {} attempts",
                correlationId, type, MAX_ID_ATTEMPTS);
        throw new PersistenceException("Failed to store " + type.name().toLowerCase(Locale.ROOT)
                + ": no free record ID after " + MAX_ID_ATTEMPTS + " attempts");
    }

    private boolean insert(RecordType type, String recordId, Document record, String correlationId) {
        try {
            return recordStore.insert(type.getCollection(), recordId, record);
        } catch (PersistenceException e) {
            log.error("Record persistence failed - correlationId: {}, type: {}, recordId: {}, error: {}",
                    correlationId, type, recordId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Record persistence failed - correlationId: {}, type: {}, recordId: {}, error: {}",
                    correlationId, type, recordId, e.getMessage());
            throw new PersistenceException("Failed to store " + type.name().toLowerCase(Locale.ROOT) + " " + recordId, e);
        }
    }

    private <S extends DomainSlots> Optional<String> notify(RecordAssembler<S> assembler, S slots,
                                                                      String recordId, String correlationId) {
        String recipient = assembler.recipient(slots);
        boolean delivered;
        try {
            delivered = notificationGateway.notify(recipient, assembler.template(),
                    assembler.notificationData(slots, recordId));
        } catch (RuntimeException e) {
            log.warn("Notification error - correlationId: {}, recordId: {}, template: {}, error: {}",
                    correlationId, recordId, assembler.template(), e.getMessage());
            delivered = false;
        }
        if (delivered) {
            return Optional.empty();
        }
        log.warn("Notification not delivered - correlationId: {}, recordId: {}, template: {}",
                correlationId, recordId, assembler.template());
        return Optional.of("We could not send the confirmation email. Please keep your reference "
                + recordId + ".");
    }
}
