package com.raava.concierge.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the notification channel: a webhook when {@code raava.notification.webhook-url}
 * is set, the log otherwise.
 */
@Slf4j
@Configuration
public class NotificationConfig {

    @Bean
    public NotificationGateway notificationGateway(@Value("${raava.notification.webhook-url:}") String webhookUrl) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("No notification webhook configured, notifications will be logged");
            return new LoggingNotificationGateway();
        }
        log.info("Notifications will be posted to webhook");
        return new WebhookNotificationGateway(webhookUrl);
    }
}
