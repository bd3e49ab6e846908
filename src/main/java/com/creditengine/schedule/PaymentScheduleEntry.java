package com.creditengine.schedule;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One row of a credit's amortization schedule.
 *
 * Created in a single batch when the credit is disbursed and afterwards changed only by the
 * settlement path. Amounts are in the credit's currency with two decimal places.
 */
@Entity
@Table(name = "payment_schedules",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_payment_schedules_credit_number", columnNames = {"credit_id", "payment_number"}),
    indexes = {
        @Index(name = "idx_payment_schedules_credit_id", columnList = "credit_id"),
        @Index(name = "idx_payment_schedules_status_due", columnList = "status, due_date")
    })
@Data
@NoArgsConstructor
public class PaymentScheduleEntry {

    @Id
    private String entryId;

    @Column(name = "credit_id", nullable = false, updatable = false)
    private String creditId;

    @Column(name = "payment_number", nullable = false, updatable = false)
    private int paymentNumber;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    /**
     * Scheduled annuity payment, excluding penalties.
     */
    @Column(name = "payment_amount", precision = 19, scale = 2, nullable = false)
    private BigDecimal paymentAmount;

    @Column(name = "principal_amount", precision = 19, scale = 2, nullable = false)
    private BigDecimal principalAmount;

    @Column(name = "interest_amount", precision = 19, scale = 2, nullable = false)
    private BigDecimal interestAmount;

    @Column(name = "penalty_amount", precision = 19, scale = 2, nullable = false)
    private BigDecimal penaltyAmount;

    /**
     * Total collected for this entry, penalty included. Zero until paid.
     */
    @Column(name = "paid_amount", precision = 19, scale = 2, nullable = false)
    private BigDecimal paidAmount;

    /**
     * Outstanding principal once this payment is made.
     */
    @Column(name = "remaining_balance", precision = 19, scale = 2, nullable = false)
    private BigDecimal remainingBalance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentStatus status;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public PaymentScheduleEntry(String creditId, int paymentNumber, LocalDate dueDate,
                                BigDecimal paymentAmount, BigDecimal principalAmount,
                                BigDecimal interestAmount, BigDecimal remainingBalance) {
        this.entryId = UUID.randomUUID().toString();
        this.creditId = creditId;
        this.paymentNumber = paymentNumber;
        this.dueDate = dueDate;
        this.paymentAmount = paymentAmount;
        this.principalAmount = principalAmount;
        this.interestAmount = interestAmount;
        this.remainingBalance = remainingBalance;
        this.penaltyAmount = BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
        this.paidAmount = BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
        this.status = PaymentStatus.PENDING;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public boolean isPaid() {
        return status == PaymentStatus.PAID;
    }

    /**
     * PENDING or OVERDUE entries whose due date lies before the given day.
     */
    public boolean isCollectibleOn(LocalDate day) {
        return (status == PaymentStatus.PENDING || status == PaymentStatus.OVERDUE)
            && dueDate.isBefore(day);
    }

    public void markPaid(BigDecimal penalty, Instant paidAt) {
        if (isPaid()) {
            throw new IllegalStateException("Payment schedule entry already paid: " + entryId);
        }
        this.penaltyAmount = penaltyAmount.add(penalty);
        this.paidAmount = paymentAmount.add(penalty);
        this.status = PaymentStatus.PAID;
        this.paidAt = paidAt;
        this.updatedAt = Instant.now();
    }

    /**
     * Penalties add up linearly: each call adds the given amount to the accumulated penalty.
     */
    public void markOverdue(BigDecimal penalty) {
        if (isPaid()) {
            throw new IllegalStateException("Payment schedule entry already paid: " + entryId);
        }
        this.penaltyAmount = penaltyAmount.add(penalty);
        this.status = PaymentStatus.OVERDUE;
        this.updatedAt = Instant.now();
    }

    /**
     * Withdraw an unpaid entry from collection. Accrued penalties stay recorded.
     */
    public void cancel() {
        if (isPaid()) {
            throw new IllegalStateException("Payment schedule entry already paid: " + entryId);
        }
        this.status = PaymentStatus.CANCELLED;
        this.updatedAt = Instant.now();
    }

    public PaymentScheduleEntry copy() {
        PaymentScheduleEntry copy = new PaymentScheduleEntry();
        copy.setEntryId(entryId);
        copy.setCreditId(creditId);
        copy.setPaymentNumber(paymentNumber);
        copy.setDueDate(dueDate);
        copy.setPaymentAmount(paymentAmount);
        copy.setPrincipalAmount(principalAmount);
        copy.setInterestAmount(interestAmount);
        copy.setPenaltyAmount(penaltyAmount);
        copy.setPaidAmount(paidAmount);
        copy.setRemainingBalance(remainingBalance);
        copy.setStatus(status);
        copy.setPaidAt(paidAt);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
