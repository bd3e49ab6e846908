package com.creditengine.ledger;

public enum TransactionStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED
}
