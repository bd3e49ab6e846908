package com.creditengine.ledger;

import com.creditengine.accounts.Account;
import com.creditengine.accounts.AccountRepository;
import com.creditengine.accounts.AccountStatus;
import com.creditengine.common.Currency;
import com.creditengine.common.Money;
import com.creditengine.common.OperationLimits;
import com.creditengine.common.exception.AccountInactiveException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JpaLedgerStore around the audit trail and locking calls.
 */
@ExtendWith(MockitoExtension.class)
class JpaLedgerStoreJournalFailureTest {

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private LedgerJournal journal;

    private JpaLedgerStore ledgerStore;
    private Account account;

    @BeforeEach
    void setUp() {
        ledgerStore = new JpaLedgerStore(accountRepository, journal, OperationLimits.defaults());
        account = new Account("owner-1", "40817810000000000001", Currency.RUB);
    }

    @Test
    void testDeposit_JournalFailureDoesNotUndoBalance() {
        when(accountRepository.findByIdForUpdate(account.getAccountId())).thenReturn(Optional.of(account));
        when(journal.record(any(), any(), any(), any(), any()))
            .thenThrow(new DataAccessResourceFailureException("ledger table unavailable"));

        Money balance = ledgerStore.deposit(account.getAccountId(), Money.of("200.00", Currency.RUB),
            TransactionType.DEPOSIT, "Top up");

        assertEquals(new BigDecimal("200.00"), balance.getAmount());
        verify(accountRepository).save(account);
    }

    @Test
    void testWithdraw_JournalWrittenOnlyAfterCommit() {
        account.credit(Money.of("50.00", Currency.RUB));
        when(accountRepository.findByIdForUpdate(account.getAccountId())).thenReturn(Optional.of(account));
        TransactionSynchronizationManager.initSynchronization();
        try {
            ledgerStore.withdraw(account.getAccountId(), Money.of("20.00", Currency.RUB),
                TransactionType.CREDIT_PAYMENT, "Payment 1");
            verifyNoInteractions(journal);

            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
            verify(journal).record(eq(account.getAccountId()), isNull(), eq(Money.of("20.00", Currency.RUB)),
                eq(TransactionType.CREDIT_PAYMENT), eq("Payment 1"));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void testWithdraw_RolledBackMovementLeavesNoJournalEntry() {
        account.credit(Money.of("50.00", Currency.RUB));
        when(accountRepository.findByIdForUpdate(account.getAccountId())).thenReturn(Optional.of(account));
        TransactionSynchronizationManager.initSynchronization();
        try {
            ledgerStore.withdraw(account.getAccountId(), Money.of("20.00", Currency.RUB),
                TransactionType.CREDIT_PAYMENT, "Payment 1");

            TransactionSynchronizationManager.getSynchronizations().forEach(sync ->
                sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));
            verifyNoInteractions(journal);
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void testWithdraw_RecordsCreditPaymentType() {
        account.credit(Money.of("50.00", Currency.RUB));
        when(accountRepository.findByIdForUpdate(account.getAccountId())).thenReturn(Optional.of(account));

        ledgerStore.withdraw(account.getAccountId(), Money.of("20.00", Currency.RUB),
            TransactionType.CREDIT_PAYMENT, "Payment 1");

        verify(journal).record(eq(account.getAccountId()), isNull(), eq(Money.of("20.00", Currency.RUB)),
            eq(TransactionType.CREDIT_PAYMENT), eq("Payment 1"));
    }

    @Test
    void testTransfer_LocksInAscendingIdOrder() {
        Account low = new Account("owner-1", "40817810000000000002", Currency.RUB);
        Account high = new Account("owner-2", "40817810000000000003", Currency.RUB);
        low.setAccountId("aaa");
        high.setAccountId("zzz");
        high.credit(Money.of("100.00", Currency.RUB));
        when(accountRepository.findByIdForUpdate("aaa")).thenReturn(Optional.of(low));
        when(accountRepository.findByIdForUpdate("zzz")).thenReturn(Optional.of(high));

        ledgerStore.transfer("zzz", "aaa", Money.of("40.00", Currency.RUB), "Refund");

        InOrder order = inOrder(accountRepository);
        order.verify(accountRepository).findByIdForUpdate("aaa");
        order.verify(accountRepository).findByIdForUpdate("zzz");
        assertEquals(new BigDecimal("40.00"), low.getBalance().getAmount());
        assertEquals(new BigDecimal("60.00"), high.getBalance().getAmount());
    }

    @Test
    void testWithdraw_BlockedAccountNotSaved() {
        account.changeStatus(AccountStatus.BLOCKED);
        when(accountRepository.findByIdForUpdate(account.getAccountId())).thenReturn(Optional.of(account));

        assertThrows(AccountInactiveException.class, () -> ledgerStore.withdraw(account.getAccountId(),
            Money.of("1.00", Currency.RUB), TransactionType.WITHDRAW, "blocked"));
        verify(accountRepository, never()).save(any());
        verifyNoInteractions(journal);
    }
}
