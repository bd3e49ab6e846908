package com.creditengine.credits;

import com.creditengine.accounts.Account;
import com.creditengine.common.Currency;
import com.creditengine.common.exception.CreditNotFoundException;
import com.creditengine.common.exception.ValidationException;
import com.creditengine.ledger.LedgerStore;
import com.creditengine.ledger.TransactionType;
import com.creditengine.schedule.PaymentScheduleEntry;
import com.creditengine.schedule.PaymentScheduleEntryRepository;
import com.creditengine.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for credit issuance against H2 with the fixed key rate provider.
 */
@SpringBootTest
@ActiveProfiles("test")
class CreditLifecycleIntegrationTest {

    @Autowired
    private CreditLifecycleManager creditLifecycleManager;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private CreditRepository creditRepository;

    @Autowired
    private PaymentScheduleEntryRepository scheduleRepository;

    @Autowired
    private ApplicationContext context;

    private Account account;

    @BeforeEach
    void setUp() {
        account = ledgerStore.openAccount("borrower-1", Currency.RUB);
    }

    @AfterEach
    void tearDown() {
        TestDatabase.clear(context);
    }

    @Test
    void testCreateCredit_PersistsCreditScheduleAndDisbursement() {
        Credit credit = creditLifecycleManager.createCredit(
            "borrower-1", account.getAccountId(), new BigDecimal("100000"), 12);

        Credit stored = creditLifecycleManager.getCredit(credit.getCreditId());
        assertEquals(CreditStatus.ACTIVE, stored.getStatus());
        assertEquals(0, new BigDecimal("21.0").compareTo(stored.getInterestRate()));
        assertEquals(0, new BigDecimal("9311.38").compareTo(stored.getMonthlyPayment()));

        List<PaymentScheduleEntry> schedule = creditLifecycleManager.getSchedule(credit.getCreditId());
        assertEquals(12, schedule.size());
        assertEquals(1, schedule.get(0).getPaymentNumber());
        assertEquals(12, schedule.get(11).getPaymentNumber());
        assertEquals(0, schedule.get(11).getRemainingBalance().signum());

        assertEquals(0, new BigDecimal("100000.00").compareTo(
            ledgerStore.getAccount(account.getAccountId()).getBalance().getAmount()));
        assertEquals(TransactionType.CREDIT_DISBURSEMENT,
            ledgerStore.getAccountHistory(account.getAccountId()).get(0).getType());

        assertEquals(1, creditLifecycleManager.getCreditsByOwner("borrower-1").size());
    }

    @Test
    void testCreateCredit_ValidationFailurePersistsNothing() {
        long creditsBefore = creditRepository.count();
        long entriesBefore = scheduleRepository.count();

        assertThrows(ValidationException.class, () ->
            creditLifecycleManager.createCredit("borrower-1", account.getAccountId(), BigDecimal.ZERO, 12));
        assertThrows(ValidationException.class, () ->
            creditLifecycleManager.createCredit("borrower-1", account.getAccountId(), new BigDecimal("1000"), 0));

        assertEquals(creditsBefore, creditRepository.count());
        assertEquals(entriesBefore, scheduleRepository.count());
        assertEquals(0, ledgerStore.getAccount(account.getAccountId()).getBalance().getAmount().signum());
    }

    @Test
    void testGetSchedule_UnknownCredit() {
        assertThrows(CreditNotFoundException.class, () -> creditLifecycleManager.getSchedule("missing"));
    }

    @Test
    void testGetCreditLoad() {
        creditLifecycleManager.createCredit("borrower-1", account.getAccountId(), new BigDecimal("1000"), 12);
        creditLifecycleManager.createCredit("borrower-1", account.getAccountId(), new BigDecimal("2000"), 24);

        CreditLoad load = creditLifecycleManager.getCreditLoad("borrower-1");

        assertEquals(2, load.getActiveCredits());
        assertEquals(0, new BigDecimal("3000.00").compareTo(load.getTotalRemainingDebt()));
        assertEquals(0, load.getOverduePayments());
    }
}
