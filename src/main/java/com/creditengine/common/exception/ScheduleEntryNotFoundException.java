package com.creditengine.common.exception;

/**
 * Thrown when a payment schedule entry is not found.
 */
public class ScheduleEntryNotFoundException extends CreditEngineException {

    public ScheduleEntryNotFoundException(String entryId) {
        super("Payment schedule entry not found: " + entryId);
    }
}
