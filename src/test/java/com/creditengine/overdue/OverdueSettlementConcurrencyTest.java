package com.creditengine.overdue;

import com.creditengine.accounts.Account;
import com.creditengine.common.Currency;
import com.creditengine.common.Money;
import com.creditengine.common.exception.InsufficientFundsException;
import com.creditengine.credits.Credit;
import com.creditengine.credits.CreditLifecycleManager;
import com.creditengine.ledger.LedgerStore;
import com.creditengine.ledger.LedgerTransaction;
import com.creditengine.ledger.TransactionType;
import com.creditengine.schedule.PaymentScheduleEntry;
import com.creditengine.schedule.PaymentStatus;
import com.creditengine.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A user withdrawal racing the settlement of a schedule entry on the same account, on H2.
 */
@SpringBootTest
@ActiveProfiles("test")
class OverdueSettlementConcurrencyTest {

    private static final BigDecimal PENALTY_RATE = new BigDecimal("10.0");
    private static final BigDecimal PAYMENT_WITH_PENALTY = new BigDecimal("10242.52");
    private static final BigDecimal WITHDRAWAL = new BigDecimal("10000.00");
    private static final BigDecimal STARTING_BALANCE = new BigDecimal("15000.00");

    @Autowired
    private CreditLifecycleManager creditLifecycleManager;

    @Autowired
    private OverdueSettlementService settlementService;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private ApplicationContext context;

    private Account account;
    private Credit credit;

    @BeforeEach
    void setUp() {
        account = ledgerStore.openAccount("borrower-race", Currency.RUB);
        credit = creditLifecycleManager.createCredit("borrower-race", account.getAccountId(),
            new BigDecimal("100000"), 12);
        ledgerStore.withdraw(account.getAccountId(), Money.of("85000.00", Currency.RUB),
            TransactionType.WITHDRAW, "Car");
    }

    @AfterEach
    void tearDown() {
        TestDatabase.clear(context);
    }

    @RepeatedTest(5)
    void testWithdrawalRacingSettlement_OnlyOneIsFunded() throws Exception {
        String entryId = creditLifecycleManager.getSchedule(credit.getCreditId()).get(0).getEntryId();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Boolean> withdrawal = executor.submit(() -> {
                start.await();
                try {
                    ledgerStore.withdraw(account.getAccountId(), Money.of(WITHDRAWAL, Currency.RUB),
                        TransactionType.WITHDRAW, "Rent");
                    return true;
                } catch (InsufficientFundsException e) {
                    return false;
                }
            });
            Future<SettlementResult> settlement = executor.submit(() -> {
                start.await();
                return settlementService.settle(entryId, PENALTY_RATE, Instant.now());
            });
            start.countDown();

            boolean withdrawn = withdrawal.get(30, TimeUnit.SECONDS);
            SettlementResult result = settlement.get(30, TimeUnit.SECONDS);
            boolean settled = result.getOutcome() == SettlementOutcome.SETTLED;

            assertTrue(withdrawn ^ settled, "exactly one of the two debits fits the balance");

            BigDecimal expected = STARTING_BALANCE
                .subtract(withdrawn ? WITHDRAWAL : BigDecimal.ZERO)
                .subtract(settled ? PAYMENT_WITH_PENALTY : BigDecimal.ZERO);
            BigDecimal balance = ledgerStore.getAccount(account.getAccountId()).getBalance().getAmount();
            assertEquals(0, expected.compareTo(balance));
            assertTrue(balance.signum() >= 0);

            PaymentScheduleEntry entry = creditLifecycleManager.getSchedule(credit.getCreditId()).get(0);
            assertEquals(settled ? PaymentStatus.PAID : PaymentStatus.OVERDUE, entry.getStatus());

            List<LedgerTransaction> history = ledgerStore.getAccountHistory(account.getAccountId());
            assertEquals(settled ? 1 : 0, history.stream()
                .filter(transaction -> transaction.getType() == TransactionType.CREDIT_PAYMENT).count());
        } finally {
            executor.shutdownNow();
        }
    }
}
