package com.creditengine.credits;

import com.creditengine.accounts.Account;
import com.creditengine.accounts.AccountStatus;
import com.creditengine.common.Currency;
import com.creditengine.common.OperationLimits;
import com.creditengine.common.exception.AccountInactiveException;
import com.creditengine.common.exception.AccountNotFoundException;
import com.creditengine.common.exception.CreditNotFoundException;
import com.creditengine.common.exception.NotificationException;
import com.creditengine.common.exception.RateProviderException;
import com.creditengine.common.exception.ValidationException;
import com.creditengine.ledger.LedgerTransaction;
import com.creditengine.ledger.TransactionType;
import com.creditengine.ledger.memory.InMemoryLedgerStore;
import com.creditengine.notification.NotificationDispatcher;
import com.creditengine.notification.NotificationKind;
import com.creditengine.rates.KeyRateProvider;
import com.creditengine.schedule.PaymentScheduleEntry;
import com.creditengine.schedule.PaymentScheduleStore;
import com.creditengine.schedule.PaymentStatus;
import com.creditengine.schedule.memory.InMemoryPaymentScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CreditLifecycleManager.
 *
 * Uses the in-memory ledger and schedule stores; the credit repository, key rate provider and
 * notification dispatcher are mocked.
 */
@ExtendWith(MockitoExtension.class)
class CreditLifecycleManagerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T09:00:00Z"), ZoneOffset.UTC);
    private static final BigDecimal FALLBACK_RATE = new BigDecimal("16.0");
    private static final BigDecimal BANK_MARGIN = new BigDecimal("5.0");

    @Mock
    private CreditRepository creditRepository;

    @Mock
    private KeyRateProvider keyRateProvider;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    private InMemoryLedgerStore ledgerStore;
    private InMemoryPaymentScheduleStore scheduleStore;
    private CreditLifecycleManager manager;
    private Account account;

    @BeforeEach
    void setUp() {
        ledgerStore = new InMemoryLedgerStore();
        scheduleStore = new InMemoryPaymentScheduleStore();
        manager = managerWith(scheduleStore);
        account = ledgerStore.openAccount("user-1", Currency.RUB);
    }

    private CreditLifecycleManager managerWith(PaymentScheduleStore store) {
        return new CreditLifecycleManager(creditRepository, store, ledgerStore, keyRateProvider,
            notificationDispatcher, OperationLimits.defaults(), CLOCK, FALLBACK_RATE, BANK_MARGIN);
    }

    private void stubSave() {
        when(creditRepository.save(any(Credit.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void testCreateCredit_Success() {
        stubSave();
        when(keyRateProvider.getAnnualRate()).thenReturn(new BigDecimal("16.0"));

        Credit credit = manager.createCredit("user-1", account.getAccountId(), new BigDecimal("100000"), 12);

        assertEquals(CreditStatus.ACTIVE, credit.getStatus());
        assertEquals(0, new BigDecimal("21.0").compareTo(credit.getInterestRate()));
        assertEquals(new BigDecimal("9311.38"), credit.getMonthlyPayment());
        assertEquals(0, new BigDecimal("100000").compareTo(credit.getRemainingDebt()));
        assertEquals(LocalDate.of(2024, 1, 15), credit.getStartDate());
        assertEquals(LocalDate.of(2025, 1, 15), credit.getEndDate());

        List<PaymentScheduleEntry> schedule = scheduleStore.findByCreditId(credit.getCreditId());
        assertEquals(12, schedule.size());
        assertEquals(LocalDate.of(2024, 2, 15), schedule.get(0).getDueDate());
        assertTrue(schedule.stream().allMatch(e -> e.getStatus() == PaymentStatus.PENDING));
        BigDecimal principalSum = schedule.stream()
            .map(PaymentScheduleEntry::getPrincipalAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, new BigDecimal("100000").compareTo(principalSum));

        assertEquals(new BigDecimal("100000.00"), ledgerStore.getAccount(account.getAccountId()).getBalance().getAmount());
        LedgerTransaction disbursement = ledgerStore.getAccountHistory(account.getAccountId()).get(0);
        assertEquals(TransactionType.CREDIT_DISBURSEMENT, disbursement.getType());
        assertNull(disbursement.getFromAccountId());

        verify(notificationDispatcher).send(eq(NotificationKind.CREDIT_ISSUED), eq("user-1"), anyMap());
    }

    @Test
    void testCreateCredit_RateProviderFailureUsesFallback() {
        stubSave();
        when(keyRateProvider.getAnnualRate()).thenThrow(new RateProviderException("timeout"));

        Credit credit = manager.createCredit("user-1", account.getAccountId(), new BigDecimal("50000"), 6);

        assertEquals(0, new BigDecimal("21.0").compareTo(credit.getInterestRate()));
        assertEquals(6, scheduleStore.findByCreditId(credit.getCreditId()).size());
    }

    @Test
    void testCreateCredit_NegativeRateUsesFallback() {
        stubSave();
        when(keyRateProvider.getAnnualRate()).thenReturn(new BigDecimal("-1"));

        Credit credit = manager.createCredit("user-1", account.getAccountId(), new BigDecimal("50000"), 6);

        assertEquals(0, new BigDecimal("21.0").compareTo(credit.getInterestRate()));
    }

    @Test
    void testCreateCredit_InvalidInputPersistsNothing() {
        String accountId = account.getAccountId();

        assertThrows(ValidationException.class, () -> manager.createCredit("user-1", accountId, BigDecimal.ZERO, 12));
        assertThrows(ValidationException.class, () -> manager.createCredit("user-1", accountId, new BigDecimal("1000"), 0));
        assertThrows(ValidationException.class, () -> manager.createCredit("user-1", accountId, new BigDecimal("1000"), 361));
        assertThrows(ValidationException.class, () ->
            manager.createCredit("user-1", accountId, new BigDecimal("100000000.01"), 12));

        verify(creditRepository, never()).save(any());
        verifyNoInteractions(keyRateProvider);
        assertEquals(0, ledgerStore.getAccount(accountId).getBalance().getAmount().signum());
        assertTrue(ledgerStore.getAccountHistory(accountId).isEmpty());
    }

    @Test
    void testCreateCredit_InactiveAccount() {
        ledgerStore.changeStatus(account.getAccountId(), AccountStatus.BLOCKED);

        assertThrows(AccountInactiveException.class, () ->
            manager.createCredit("user-1", account.getAccountId(), new BigDecimal("1000"), 12));
        verify(creditRepository, never()).save(any());
    }

    @Test
    void testCreateCredit_UnknownAccount() {
        assertThrows(AccountNotFoundException.class, () ->
            manager.createCredit("user-1", "missing", new BigDecimal("1000"), 12));
        verify(creditRepository, never()).save(any());
    }

    @Test
    void testCreateCredit_ScheduleFailureStillReturnsDisbursedCredit() {
        stubSave();
        when(keyRateProvider.getAnnualRate()).thenReturn(new BigDecimal("16.0"));
        PaymentScheduleStore failingStore = mock(PaymentScheduleStore.class);
        when(failingStore.createBatch(any())).thenThrow(new IllegalStateException("schedule table unavailable"));

        Credit credit = managerWith(failingStore)
            .createCredit("user-1", account.getAccountId(), new BigDecimal("1000"), 12);

        assertNotNull(credit);
        assertEquals(CreditStatus.ACTIVE, credit.getStatus());
        assertEquals(new BigDecimal("1000.00"), ledgerStore.getAccount(account.getAccountId()).getBalance().getAmount());
    }

    @Test
    void testCreateCredit_NotificationFailureIgnored() {
        stubSave();
        when(keyRateProvider.getAnnualRate()).thenReturn(new BigDecimal("16.0"));
        doThrow(new NotificationException("smtp down", new RuntimeException()))
            .when(notificationDispatcher).send(any(), any(), anyMap());

        Credit credit = manager.createCredit("user-1", account.getAccountId(), new BigDecimal("1000"), 12);

        assertEquals(CreditStatus.ACTIVE, credit.getStatus());
    }

    @Test
    void testGetSchedule_UnknownCredit() {
        when(creditRepository.existsById("missing")).thenReturn(false);

        assertThrows(CreditNotFoundException.class, () -> manager.getSchedule("missing"));
    }

    @Test
    void testGetCreditLoad() {
        Credit active = new Credit("user-1", account.getAccountId(), new BigDecimal("1000.00"), Currency.RUB,
            new BigDecimal("21"), 12, new BigDecimal("93.11"), LocalDate.of(2024, 1, 15));
        Credit overdue = new Credit("user-1", account.getAccountId(), new BigDecimal("500.00"), Currency.RUB,
            new BigDecimal("21"), 6, new BigDecimal("88.00"), LocalDate.of(2024, 1, 15));
        overdue.markOverdue();
        Credit paidOff = new Credit("user-1", account.getAccountId(), new BigDecimal("10.00"), Currency.RUB,
            new BigDecimal("21"), 1, new BigDecimal("10.18"), LocalDate.of(2023, 1, 15));
        paidOff.applyPrincipalPayment(new BigDecimal("10.00"));
        when(creditRepository.findByOwnerIdOrderByCreatedAtDesc("user-1")).thenReturn(List.of(active, overdue, paidOff));

        PaymentScheduleEntry late = new PaymentScheduleEntry(overdue.getCreditId(), 1, LocalDate.of(2024, 2, 15),
            new BigDecimal("88.00"), new BigDecimal("79.25"), new BigDecimal("8.75"), new BigDecimal("420.75"));
        late.markOverdue(new BigDecimal("8.80"));
        scheduleStore.createBatch(List.of(late));

        CreditLoad load = manager.getCreditLoad("user-1");

        assertEquals(2, load.getActiveCredits());
        assertEquals(0, new BigDecimal("1500.00").compareTo(load.getTotalRemainingDebt()));
        assertEquals(0, new BigDecimal("181.11").compareTo(load.getTotalMonthlyPayment()));
        assertEquals(1, load.getOverduePayments());
    }
}
