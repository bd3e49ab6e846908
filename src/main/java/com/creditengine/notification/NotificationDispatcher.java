package com.creditengine.notification;

import java.util.Map;

/**
 * Outbound channel for borrower notifications.
 *
 * Delivery is fire-and-forget for callers: a failure surfaces as
 * {@link com.creditengine.common.exception.NotificationException} and is logged, never retried here.
 */
public interface NotificationDispatcher {

    void send(NotificationKind kind, String recipient, Map<String, String> payload);
}
