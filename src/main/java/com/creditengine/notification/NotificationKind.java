package com.creditengine.notification;

public enum NotificationKind {
    CREDIT_ISSUED,
    PAYMENT_SETTLED,
    PAYMENT_OVERDUE
}
