package com.creditengine.common.exception;

/**
 * Thrown when an operation is called with malformed input
 * (non-positive amount, amount above a ceiling, term out of range, same-account transfer).
 */
public class ValidationException extends CreditEngineException {

    public ValidationException(String message) {
        super(message);
    }
}
