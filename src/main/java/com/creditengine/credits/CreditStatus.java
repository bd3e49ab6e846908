package com.creditengine.credits;

public enum CreditStatus {
    ACTIVE,
    PAID_OFF,
    OVERDUE,
    CANCELLED
}
