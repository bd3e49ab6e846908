package com.creditengine.common.exception;

import com.creditengine.common.Money;

/**
 * Thrown when an account has insufficient funds for a debit.
 * This is a business outcome rather than a system fault.
 */
public class InsufficientFundsException extends CreditEngineException {

    public InsufficientFundsException(String accountId, Money required, Money available) {
        super(String.format("Insufficient funds in account %s. Required: %s %s, Available: %s %s",
            accountId,
            required.getAmount(), required.getCurrency(),
            available.getAmount(), available.getCurrency()));
    }
}
