package com.creditengine.credits;

import com.creditengine.accounts.Account;
import com.creditengine.common.Money;
import com.creditengine.common.OperationLimits;
import com.creditengine.common.exception.AccountInactiveException;
import com.creditengine.common.exception.CreditNotFoundException;
import com.creditengine.ledger.LedgerStore;
import com.creditengine.ledger.TransactionType;
import com.creditengine.notification.NotificationDispatcher;
import com.creditengine.notification.NotificationKind;
import com.creditengine.rates.KeyRateProvider;
import com.creditengine.schedule.PaymentScheduleEntry;
import com.creditengine.schedule.PaymentScheduleStore;
import com.creditengine.schedule.PaymentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Issues credits and answers questions about them.
 *
 * Credit creation persists the credit, its schedule and the disbursement as separate units:
 * a schedule failure is logged and the already issued credit is still returned, while a failed
 * disbursement propagates to the caller.
 */
@Service
@Slf4j
public class CreditLifecycleManager {

    private final CreditRepository creditRepository;
    private final PaymentScheduleStore scheduleStore;
    private final LedgerStore ledgerStore;
    private final KeyRateProvider keyRateProvider;
    private final NotificationDispatcher notificationDispatcher;
    private final OperationLimits limits;
    private final Clock clock;
    private final BigDecimal fallbackRate;
    private final BigDecimal bankMargin;

    public CreditLifecycleManager(
            CreditRepository creditRepository,
            PaymentScheduleStore scheduleStore,
            LedgerStore ledgerStore,
            KeyRateProvider keyRateProvider,
            NotificationDispatcher notificationDispatcher,
            OperationLimits limits,
            Clock clock,
            @Value("${credit-engine.rates.fallback-rate:16.0}") BigDecimal fallbackRate,
            @Value("${credit-engine.rates.bank-margin:5.0}") BigDecimal bankMargin) {
        this.creditRepository = creditRepository;
        this.scheduleStore = scheduleStore;
        this.ledgerStore = ledgerStore;
        this.keyRateProvider = keyRateProvider;
        this.notificationDispatcher = notificationDispatcher;
        this.limits = limits;
        this.clock = clock;
        this.fallbackRate = fallbackRate;
        this.bankMargin = bankMargin;
    }

    /**
     * Issue a credit and disburse it to the funding account.
     *
     * @throws com.creditengine.common.exception.ValidationException if the amount or term is out of range
     * @throws com.creditengine.common.exception.AccountNotFoundException if the account does not exist
     * @throws AccountInactiveException if the account is blocked or closed
     */
    public Credit createCredit(String ownerId, String accountId, BigDecimal amount, int termMonths) {
        limits.validateCreditRequest(amount, termMonths);

        Account account = ledgerStore.getAccount(accountId);
        if (!account.isActive()) {
            log.warn("Cannot issue credit to inactive account {}: status={}", accountId, account.getStatus());
            throw new AccountInactiveException(accountId, account.getStatus().name());
        }

        BigDecimal baseRate = resolveBaseRate();
        BigDecimal creditRate = baseRate.add(bankMargin);
        BigDecimal principal = Money.of(amount, account.getCurrency()).getAmount();
        BigDecimal monthlyPayment = AmortizationCalculator.computeMonthlyPayment(principal, creditRate, termMonths);

        log.info("Credit rate calculated: account={}, baseRate={}, creditRate={}, monthlyPayment={}",
            accountId, baseRate, creditRate, monthlyPayment);

        LocalDate startDate = LocalDate.now(clock);
        Credit credit = creditRepository.save(new Credit(ownerId, accountId, principal, account.getCurrency(),
            creditRate, termMonths, monthlyPayment, startDate));

        try {
            generateSchedule(credit);
        } catch (RuntimeException e) {
            log.error("Failed to create payment schedule for credit {}", credit.getCreditId(), e);
        }

        Money balance = ledgerStore.deposit(accountId, Money.of(principal, credit.getCurrency()),
            TransactionType.CREDIT_DISBURSEMENT, "Credit disbursement (credit " + credit.getCreditId() + ")");

        log.info("Credit {} issued: owner={}, account={}, amount={} {}, rate={}, term={}, balance={}",
            credit.getCreditId(), ownerId, accountId, principal, credit.getCurrency(),
            creditRate, termMonths, balance.getAmount());

        notifyIssued(credit);
        return credit;
    }

    /**
     * Payment schedule of a credit, ordered by payment number.
     *
     * @throws CreditNotFoundException if the credit does not exist
     */
    @Transactional(readOnly = true)
    public List<PaymentScheduleEntry> getSchedule(String creditId) {
        if (!creditRepository.existsById(creditId)) {
            throw new CreditNotFoundException(creditId);
        }
        return scheduleStore.findByCreditId(creditId);
    }

    @Transactional(readOnly = true)
    public Credit getCredit(String creditId) {
        return creditRepository.findById(creditId)
            .orElseThrow(() -> new CreditNotFoundException(creditId));
    }

    @Transactional(readOnly = true)
    public List<Credit> getCreditsByOwner(String ownerId) {
        return creditRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    /**
     * Outstanding debt, monthly obligations and overdue payments of a borrower.
     */
    @Transactional(readOnly = true)
    public CreditLoad getCreditLoad(String ownerId) {
        List<Credit> collectible = creditRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
            .filter(Credit::isCollectible)
            .toList();

        BigDecimal remainingDebt = collectible.stream()
            .map(Credit::getRemainingDebt)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal monthlyPayments = collectible.stream()
            .map(Credit::getMonthlyPayment)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        long overdue = scheduleStore.countByCreditIdsAndStatus(
            collectible.stream().map(Credit::getCreditId).toList(), PaymentStatus.OVERDUE);

        return new CreditLoad(ownerId, collectible.size(), remainingDebt, monthlyPayments, overdue);
    }

    private BigDecimal resolveBaseRate() {
        try {
            BigDecimal rate = keyRateProvider.getAnnualRate();
            if (rate == null || rate.signum() < 0) {
                log.warn("Key rate provider returned an unusable rate {}, using fallback {}", rate, fallbackRate);
                return fallbackRate;
            }
            return rate;
        } catch (RuntimeException e) {
            log.warn("Failed to get key rate, using fallback {}: {}", fallbackRate, e.getMessage());
            return fallbackRate;
        }
    }

    private void generateSchedule(Credit credit) {
        List<PaymentScheduleEntry> entries = AmortizationCalculator.buildSchedule(
                credit.getPrincipal(), credit.getInterestRate(), credit.getTermMonths(), credit.getStartDate())
            .stream()
            .map(row -> new PaymentScheduleEntry(credit.getCreditId(), row.getPaymentNumber(), row.getDueDate(),
                row.getPaymentAmount(), row.getPrincipal(), row.getInterest(), row.getRemainingBalance()))
            .toList();

        scheduleStore.createBatch(entries);
        log.info("Payment schedule created for credit {}: {} payments", credit.getCreditId(), entries.size());
    }

    private void notifyIssued(Credit credit) {
        try {
            notificationDispatcher.send(NotificationKind.CREDIT_ISSUED, credit.getOwnerId(), Map.of(
                "creditId", credit.getCreditId(),
                "amount", credit.getPrincipal().toPlainString(),
                "currency", credit.getCurrency().name(),
                "interestRate", credit.getInterestRate().toPlainString(),
                "monthlyPayment", credit.getMonthlyPayment().toPlainString(),
                "termMonths", String.valueOf(credit.getTermMonths())));
        } catch (RuntimeException e) {
            log.error("Failed to send credit issued notification for credit {}", credit.getCreditId(), e);
        }
    }
}
