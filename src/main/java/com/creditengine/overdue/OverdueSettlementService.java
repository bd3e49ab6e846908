package com.creditengine.overdue;

import com.creditengine.common.Money;
import com.creditengine.common.exception.CreditNotFoundException;
import com.creditengine.common.exception.InsufficientFundsException;
import com.creditengine.credits.Credit;
import com.creditengine.credits.CreditRepository;
import com.creditengine.credits.CreditStatus;
import com.creditengine.ledger.LedgerStore;
import com.creditengine.ledger.TransactionType;
import com.creditengine.schedule.PaymentScheduleEntry;
import com.creditengine.schedule.PaymentScheduleStore;
import com.creditengine.schedule.PaymentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Settles a single past-due schedule entry against its credit's funding account.
 *
 * Each call is its own transaction. The entry and the credit are locked for update so that a
 * concurrent sweep or manual trigger sees an entry that is already paid and skips it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OverdueSettlementService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PaymentScheduleStore scheduleStore;
    private final CreditRepository creditRepository;
    private final LedgerStore ledgerStore;

    /**
     * Collect payment plus penalty, or mark the entry overdue and accrue the penalty when the
     * account cannot cover it.
     *
     * @param penaltyRate penalty in percent of the scheduled payment amount
     */
    @Transactional
    public SettlementResult settle(String entryId, BigDecimal penaltyRate, Instant now) {
        PaymentScheduleEntry entry = scheduleStore.lockEntry(entryId);
        if (entry.getStatus() != PaymentStatus.PENDING && entry.getStatus() != PaymentStatus.OVERDUE) {
            log.debug("Entry {} skipped: status={}", entryId, entry.getStatus());
            return SettlementResult.skipped(entryId, entry.getCreditId(), "entry is " + entry.getStatus());
        }

        Credit credit = creditRepository.findByIdForUpdate(entry.getCreditId())
            .orElseThrow(() -> new CreditNotFoundException(entry.getCreditId()));
        if (!credit.isCollectible()) {
            entry.cancel();
            scheduleStore.save(entry);
            log.info("Entry {} cancelled: credit {} is {}", entryId, credit.getCreditId(), credit.getStatus());
            return SettlementResult.skipped(entryId, credit.getCreditId(), "credit is " + credit.getStatus());
        }

        BigDecimal penalty = penaltyFor(entry.getPaymentAmount(), penaltyRate);
        Money due = Money.of(entry.getPaymentAmount().add(penalty), credit.getCurrency());

        try {
            ledgerStore.withdraw(credit.getAccountId(), due, TransactionType.CREDIT_PAYMENT,
                String.format("Credit payment %d with penalty (credit %s)", entry.getPaymentNumber(), credit.getCreditId()));
        } catch (InsufficientFundsException e) {
            entry.markOverdue(penalty);
            scheduleStore.save(entry);
            credit.markOverdue();
            creditRepository.save(credit);

            log.warn("Payment {} of credit {} overdue: account={}, required={}, penalty={}, totalPenalty={}",
                entry.getPaymentNumber(), credit.getCreditId(), credit.getAccountId(),
                due.getAmount(), penalty, entry.getPenaltyAmount());
            return result(entry, credit, SettlementOutcome.MARKED_OVERDUE, BigDecimal.ZERO, penalty);
        }

        entry.markPaid(penalty, now);
        scheduleStore.save(entry);

        credit.applyPrincipalPayment(entry.getPrincipalAmount());
        if (credit.getStatus() == CreditStatus.PAID_OFF) {
            cancelOutstandingEntries(credit.getCreditId());
        } else if (credit.getStatus() == CreditStatus.OVERDUE
                && scheduleStore.countByCreditIdAndStatus(credit.getCreditId(), PaymentStatus.OVERDUE) == 0) {
            credit.restoreActive();
        }
        creditRepository.save(credit);

        log.info("Payment {} of credit {} settled: account={}, charged={}, penalty={}, remainingDebt={}, creditStatus={}",
            entry.getPaymentNumber(), credit.getCreditId(), credit.getAccountId(),
            due.getAmount(), penalty, credit.getRemainingDebt(), credit.getStatus());
        return result(entry, credit, SettlementOutcome.SETTLED, due.getAmount(), penalty);
    }

    private void cancelOutstandingEntries(String creditId) {
        for (PaymentScheduleEntry outstanding : scheduleStore.findByCreditId(creditId)) {
            if (outstanding.getStatus() == PaymentStatus.PENDING || outstanding.getStatus() == PaymentStatus.OVERDUE) {
                outstanding.cancel();
                scheduleStore.save(outstanding);
                log.info("Entry {} of paid off credit {} cancelled", outstanding.getEntryId(), creditId);
            }
        }
    }

    static BigDecimal penaltyFor(BigDecimal paymentAmount, BigDecimal penaltyRate) {
        return paymentAmount.multiply(penaltyRate).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }

    private SettlementResult result(PaymentScheduleEntry entry, Credit credit, SettlementOutcome outcome,
                                    BigDecimal charged, BigDecimal penalty) {
        return SettlementResult.builder()
            .entryId(entry.getEntryId())
            .creditId(credit.getCreditId())
            .ownerId(credit.getOwnerId())
            .paymentNumber(entry.getPaymentNumber())
            .dueDate(entry.getDueDate())
            .outcome(outcome)
            .charged(charged)
            .penalty(penalty)
            .totalPenalty(entry.getPenaltyAmount())
            .currency(credit.getCurrency().name())
            .build();
    }
}
