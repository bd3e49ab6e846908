package com.creditengine.ledger;

/**
 * Types of ledger transactions.
 */
public enum TransactionType {
    /**
     * Funds added to an account from outside the bank.
     */
    DEPOSIT,

    /**
     * Funds taken out of an account to outside the bank.
     */
    WITHDRAW,

    /**
     * Funds moved between two accounts.
     */
    TRANSFER,

    /**
     * Credit principal paid out to the funding account.
     */
    CREDIT_DISBURSEMENT,

    /**
     * Scheduled credit payment (including any penalty) collected from the funding account.
     */
    CREDIT_PAYMENT
}
