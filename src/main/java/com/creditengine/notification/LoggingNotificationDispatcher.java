package com.creditengine.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Notification dispatcher that writes notifications to the application log.
 *
 * In production, this would hand off to an e-mail or push gateway.
 */
@Component
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void send(NotificationKind kind, String recipient, Map<String, String> payload) {
        log.info("Notification {}: recipient={}, payload={}", kind, recipient, payload);
    }
}
