package com.creditengine.overdue;

public enum SettlementOutcome {
    SETTLED,
    MARKED_OVERDUE,
    SKIPPED
}
