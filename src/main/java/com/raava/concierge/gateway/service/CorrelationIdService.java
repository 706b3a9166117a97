package com.raava.concierge.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating correlation IDs for request tracking.
 */
@Service
public class CorrelationIdService {

    public String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
