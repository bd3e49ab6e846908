package com.creditengine.credits;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregate debt position of one borrower across collectible credits.
 */
@Value
public class CreditLoad {
    String ownerId;
    int activeCredits;
    BigDecimal totalRemainingDebt;
    BigDecimal totalMonthlyPayment;
    long overduePayments;
}
