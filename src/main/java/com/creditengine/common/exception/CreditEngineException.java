package com.creditengine.common.exception;

/**
 * Base exception for all credit engine exceptions.
 */
public class CreditEngineException extends RuntimeException {

    public CreditEngineException(String message) {
        super(message);
    }

    public CreditEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
