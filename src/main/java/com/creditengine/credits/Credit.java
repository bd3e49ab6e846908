package com.creditengine.credits;

import com.creditengine.common.Currency;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A disbursed credit.
 *
 * Remaining debt only ever decreases; the credit is PAID_OFF once it reaches zero.
 */
@Entity
@Table(name = "credits", indexes = {
    @Index(name = "idx_credits_owner_id", columnList = "owner_id")
})
@Data
@NoArgsConstructor
public class Credit {

    @Id
    private String creditId;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private String ownerId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    @Column(precision = 19, scale = 2, nullable = false, updatable = false)
    private BigDecimal principal;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Currency currency;

    /**
     * Annual rate in percent, key rate plus bank margin.
     */
    @Column(name = "interest_rate", precision = 9, scale = 4, nullable = false, updatable = false)
    private BigDecimal interestRate;

    @Column(name = "term_months", nullable = false, updatable = false)
    private int termMonths;

    @Column(name = "monthly_payment", precision = 19, scale = 2, nullable = false, updatable = false)
    private BigDecimal monthlyPayment;

    @Column(name = "remaining_debt", precision = 19, scale = 2, nullable = false)
    private BigDecimal remainingDebt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CreditStatus status;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Credit(String ownerId, String accountId, BigDecimal principal, Currency currency,
                  BigDecimal interestRate, int termMonths, BigDecimal monthlyPayment, LocalDate startDate) {
        this.creditId = UUID.randomUUID().toString();
        this.ownerId = ownerId;
        this.accountId = accountId;
        this.principal = principal;
        this.currency = currency;
        this.interestRate = interestRate;
        this.termMonths = termMonths;
        this.monthlyPayment = monthlyPayment;
        this.remainingDebt = principal;
        this.status = CreditStatus.ACTIVE;
        this.startDate = startDate;
        this.endDate = startDate.plusMonths(termMonths);
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    /**
     * Only ACTIVE and OVERDUE credits have payments left to collect.
     */
    public boolean isCollectible() {
        return status == CreditStatus.ACTIVE || status == CreditStatus.OVERDUE;
    }

    /**
     * Reduce the remaining debt by a settled principal portion, never below zero.
     */
    public void applyPrincipalPayment(BigDecimal principalPortion) {
        BigDecimal next = remainingDebt.subtract(principalPortion);
        this.remainingDebt = next.signum() < 0 ? BigDecimal.ZERO.setScale(2) : next;
        if (remainingDebt.signum() == 0) {
            this.status = CreditStatus.PAID_OFF;
        }
        this.updatedAt = Instant.now();
    }

    public void markOverdue() {
        if (status == CreditStatus.ACTIVE) {
            this.status = CreditStatus.OVERDUE;
            this.updatedAt = Instant.now();
        }
    }

    public void restoreActive() {
        if (status == CreditStatus.OVERDUE) {
            this.status = CreditStatus.ACTIVE;
            this.updatedAt = Instant.now();
        }
    }

    public BigDecimal getTotalCost() {
        return monthlyPayment.multiply(BigDecimal.valueOf(termMonths));
    }

    public BigDecimal getTotalInterest() {
        return getTotalCost().subtract(principal);
    }
}
