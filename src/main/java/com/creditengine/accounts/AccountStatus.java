package com.creditengine.accounts;

/**
 * Lifecycle status of an account. Only ACTIVE accounts take part in money movements.
 */
public enum AccountStatus {
    ACTIVE,
    BLOCKED,
    CLOSED
}
