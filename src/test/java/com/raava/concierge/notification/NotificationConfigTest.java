package com.raava.concierge.notification;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotificationConfigTest {

    private final NotificationConfig config = new NotificationConfig();

    @Test
    void testNotificationGateway_LogsWithoutWebhook() {
        // When
        NotificationGateway gateway = config.notificationGateway(" ");

        // Then
        assertInstanceOf(LoggingNotificationGateway.class, gateway);
        assertTrue(gateway.notify("john@x.com", "order_confirmation", Map.of("orderId", "ORD-RA-2026-AB12C")));
    }

    @Test
    void testNotificationGateway_WebhookWhenConfigured() {
        assertInstanceOf(WebhookNotificationGateway.class, config.notificationGateway("https://hooks.example.com/raava"));
    }

    @Test
    void testMaskRecipient() {
        assertEquals("j****@x.com", LoggingNotificationGateway.maskRecipient("john@x.com"));
        assertEquals("****", LoggingNotificationGateway.maskRecipient("j@x.com"));
        assertEquals("none", LoggingNotificationGateway.maskRecipient(null));
    }
}
