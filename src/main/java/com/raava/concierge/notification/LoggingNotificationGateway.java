package com.raava.concierge.notification;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Writes notifications to the log instead of delivering them. Used when no webhook is configured.
 */
@Slf4j
public class LoggingNotificationGateway implements NotificationGateway {

    @Override
    public boolean notify(String recipient, String template, Map<String, Object> data) {
        log.info("Notification queued - template: {}, recipient: {}, fields: {}",
                template, maskRecipient(recipient), data != null ? data.keySet() : "none");
        return true;
    }

    static String maskRecipient(String recipient) {
        if (recipient == null || recipient.isBlank()) {
            return "none";
        }
        int at = recipient.indexOf('@');
        if (at <= 1) {
            return "****";
        }
        return recipient.charAt(0) + "****" + recipient.substring(at);
    }
}
