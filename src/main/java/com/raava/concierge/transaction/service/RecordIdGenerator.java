package com.raava.concierge.transaction.service;

import com.raava.concierge.transaction.model.RecordType;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Generates record IDs of the form {@code <PREFIX>-RA-<yyyy>-<5 uppercase alphanumerics>},
 * e.g. {@code SVC-RA-2026-7K2QD}.
 */
@Component
public class RecordIdGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int SUFFIX_LENGTH = 5;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public RecordIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextId(RecordType type) {
        StringBuilder id = new StringBuilder()
                .append(type.getIdPrefix())
                .append("-RA-")
                .append(LocalDate.now(clock).getYear())
                .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            id.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }
}
