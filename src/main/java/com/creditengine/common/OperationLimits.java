package com.creditengine.common;

import com.creditengine.common.exception.ValidationException;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Ceilings applied to money movements and credit requests.
 */
@Component
@Getter
public class OperationLimits {

    private final BigDecimal maxOperationAmount;
    private final BigDecimal maxCreditAmount;
    private final int maxTermMonths;

    public OperationLimits(
            @Value("${credit-engine.limits.max-operation-amount:1000000000}") BigDecimal maxOperationAmount,
            @Value("${credit-engine.limits.max-credit-amount:100000000}") BigDecimal maxCreditAmount,
            @Value("${credit-engine.limits.max-term-months:360}") int maxTermMonths) {
        this.maxOperationAmount = maxOperationAmount;
        this.maxCreditAmount = maxCreditAmount;
        this.maxTermMonths = maxTermMonths;
    }

    public static OperationLimits defaults() {
        return new OperationLimits(new BigDecimal("1000000000"), new BigDecimal("100000000"), 360);
    }

    public void validateOperationAmount(Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw new ValidationException("Amount must be positive");
        }
        if (amount.getAmount().compareTo(maxOperationAmount) > 0) {
            throw new ValidationException("Amount exceeds the allowed maximum of " + maxOperationAmount);
        }
    }

    public void validateCreditRequest(BigDecimal amount, int termMonths) {
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ValidationException("Credit amount must be positive");
        }
        if (amount.compareTo(maxCreditAmount) > 0) {
            throw new ValidationException("Credit amount exceeds the allowed maximum of " + maxCreditAmount);
        }
        if (termMonths <= 0 || termMonths > maxTermMonths) {
            throw new ValidationException(
                String.format("Credit term must be between 1 and %d months, got %d", maxTermMonths, termMonths));
        }
    }
}
