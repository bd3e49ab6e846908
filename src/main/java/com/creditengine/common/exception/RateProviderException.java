package com.creditengine.common.exception;

/**
 * Thrown when the key rate cannot be obtained from the rate provider.
 */
public class RateProviderException extends CreditEngineException {

    public RateProviderException(String message) {
        super(message);
    }

    public RateProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
