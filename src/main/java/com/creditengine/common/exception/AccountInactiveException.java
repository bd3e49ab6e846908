package com.creditengine.common.exception;

/**
 * Thrown when a money movement targets an account that is blocked or closed.
 */
public class AccountInactiveException extends CreditEngineException {

    private final String accountId;

    public AccountInactiveException(String accountId, String status) {
        super(String.format("Account %s is not active (status: %s)", accountId, status));
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }
}
