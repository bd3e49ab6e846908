package com.creditengine.common.exception;

/**
 * Thrown when a credit is not found.
 */
public class CreditNotFoundException extends CreditEngineException {

    public CreditNotFoundException(String creditId) {
        super("Credit not found: " + creditId);
    }
}
