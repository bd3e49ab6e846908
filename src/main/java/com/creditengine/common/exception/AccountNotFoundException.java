package com.creditengine.common.exception;

/**
 * Thrown when an account is not found.
 */
public class AccountNotFoundException extends CreditEngineException {

    public AccountNotFoundException(String accountId) {
        super("Account not found: " + accountId);
    }
}
