package com.raava.concierge.notification;

import java.util.Map;

/**
 * Sends confirmation messages (emails, SMS, CRM hooks) about created records.
 * Implementations never throw: a failed delivery is reported as {@code false}.
 */
public interface NotificationGateway {

    /**
     * @param recipient address of the customer or owner
     * @param template  message template name, e.g. "order_confirmation"
     * @param data      values for the template
     * @return true when the message was accepted for delivery
     */
    boolean notify(String recipient, String template, Map<String, Object> data);
}
