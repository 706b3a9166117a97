package com.raava.concierge.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts notifications as JSON to a webhook (mail relay, CRM, automation flow).
 */
@Slf4j
public class WebhookNotificationGateway implements NotificationGateway {

    private final RestClient restClient;

    public WebhookNotificationGateway(String webhookUrl) {
        this(RestClient.builder()
                .baseUrl(webhookUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build());
    }

    WebhookNotificationGateway(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public boolean notify(String recipient, String template, Map<String, Object> data) {
        if (recipient == null || recipient.isBlank()) {
            log.warn("Notification skipped, no recipient - template: {}", template);
            return false;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recipient", recipient);
        payload.put("template", template);
        payload.put("data", data != null ? data : Map.of());
        payload.put("sentAt", Instant.now().toString());

        try {
            restClient.post()
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Notification delivered - template: {}, recipient: {}",
                    template, LoggingNotificationGateway.maskRecipient(recipient));
            return true;
        } catch (RestClientException e) {
            log.warn("Notification delivery failed - template: {}, error: {}", template, e.getMessage());
            return false;
        }
    }
}
