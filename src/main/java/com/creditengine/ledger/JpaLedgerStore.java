package com.creditengine.ledger;

import com.creditengine.accounts.Account;
import com.creditengine.accounts.AccountNumbers;
import com.creditengine.accounts.AccountRepository;
import com.creditengine.accounts.AccountStatus;
import com.creditengine.common.Currency;
import com.creditengine.common.Money;
import com.creditengine.common.OperationLimits;
import com.creditengine.common.exception.AccountInactiveException;
import com.creditengine.common.exception.AccountNotFoundException;
import com.creditengine.common.exception.InsufficientFundsException;
import com.creditengine.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

/**
 * Database-backed ledger store.
 *
 * Money movements lock the account rows with {@code SELECT ... FOR UPDATE} for the duration of the
 * read-modify-write. When called from an outer transaction (overdue settlement) the locks are held
 * until that transaction commits.
 *
 * Insufficient funds is a business outcome: it does not mark a surrounding transaction for rollback.
 *
 * Ledger transactions are appended once the balance change has committed. A rolled back movement
 * leaves no audit row behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaLedgerStore implements LedgerStore {

    private final AccountRepository accountRepository;
    private final LedgerJournal journal;
    private final OperationLimits limits;

    @Override
    @Transactional
    public Account openAccount(String ownerId, Currency currency) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner ID is required");
        }
        String accountNumber = AccountNumbers.generate();
        while (accountRepository.existsByAccountNumber(accountNumber)) {
            accountNumber = AccountNumbers.generate();
        }

        Account account = new Account(ownerId, accountNumber, currency);
        accountRepository.save(account);

        log.info("Opened account {} ({}) for owner {} in {}",
            account.getAccountId(), accountNumber, ownerId, currency);
        return account;
    }

    @Override
    @Transactional(readOnly = true)
    public Account getAccount(String accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> getAccountsByOwner(String ownerId) {
        return accountRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId);
    }

    @Override
    @Transactional
    public Account changeStatus(String accountId, AccountStatus status) {
        Account account = lockAccount(accountId);
        if (account.getStatus() == AccountStatus.CLOSED && status != AccountStatus.CLOSED) {
            throw new ValidationException("Closed account cannot be reopened: " + accountId);
        }
        AccountStatus previous = account.getStatus();
        account.changeStatus(status);
        accountRepository.save(account);

        log.info("Account {} status changed {} -> {}", accountId, previous, status);
        return account;
    }

    @Override
    @Transactional(noRollbackFor = InsufficientFundsException.class)
    public Money deposit(String accountId, Money amount, TransactionType type, String description) {
        limits.validateOperationAmount(amount);

        Account account = lockActiveAccount(accountId);
        account.credit(amount);
        accountRepository.save(account);

        recordTransaction(null, accountId, amount, type, description);

        log.info("Deposited {} {} to account {} ({}), balance={}",
            amount.getAmount(), amount.getCurrency(), accountId, type, account.getBalance().getAmount());
        return account.getBalance();
    }

    @Override
    @Transactional(noRollbackFor = InsufficientFundsException.class)
    public Money withdraw(String accountId, Money amount, TransactionType type, String description) {
        limits.validateOperationAmount(amount);

        Account account = lockActiveAccount(accountId);
        try {
            account.debit(amount);
        } catch (InsufficientFundsException e) {
            log.warn("Withdrawal of {} {} from account {} rejected: balance={}",
                amount.getAmount(), amount.getCurrency(), accountId, account.getBalance().getAmount());
            throw e;
        }
        accountRepository.save(account);

        recordTransaction(accountId, null, amount, type, description);

        log.info("Withdrew {} {} from account {} ({}), balance={}",
            amount.getAmount(), amount.getCurrency(), accountId, type, account.getBalance().getAmount());
        return account.getBalance();
    }

    @Override
    @Transactional(noRollbackFor = InsufficientFundsException.class)
    public void transfer(String fromAccountId, String toAccountId, Money amount, String description) {
        limits.validateOperationAmount(amount);
        if (fromAccountId.equals(toAccountId)) {
            throw new ValidationException("Cannot transfer to the same account: " + fromAccountId);
        }

        // Fixed lock order prevents deadlock between transfers on the same pair in opposite directions
        boolean fromFirst = fromAccountId.compareTo(toAccountId) < 0;
        Account first = lockAccount(fromFirst ? fromAccountId : toAccountId);
        Account second = lockAccount(fromFirst ? toAccountId : fromAccountId);
        Account from = fromFirst ? first : second;
        Account to = fromFirst ? second : first;

        requireActive(from);
        requireActive(to);

        try {
            from.debit(amount);
        } catch (InsufficientFundsException e) {
            log.warn("Transfer of {} {} from {} to {} rejected: balance={}",
                amount.getAmount(), amount.getCurrency(), fromAccountId, toAccountId,
                from.getBalance().getAmount());
            throw e;
        }
        to.credit(amount);
        accountRepository.save(from);
        accountRepository.save(to);

        recordTransaction(fromAccountId, toAccountId, amount, TransactionType.TRANSFER, description);

        log.info("Transferred {} {} from {} to {}",
            amount.getAmount(), amount.getCurrency(), fromAccountId, toAccountId);
    }

    @Override
    public List<LedgerTransaction> getAccountHistory(String accountId) {
        return journal.history(accountId);
    }

    private Account lockAccount(String accountId) {
        return accountRepository.findByIdForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    private Account lockActiveAccount(String accountId) {
        Account account = lockAccount(accountId);
        requireActive(account);
        return account;
    }

    private void requireActive(Account account) {
        if (!account.isActive()) {
            log.warn("Account {} is not active: {}", account.getAccountId(), account.getStatus());
            throw new AccountInactiveException(account.getAccountId(), account.getStatus().name());
        }
    }

    private void recordTransaction(String fromAccountId, String toAccountId, Money amount,
                                   TransactionType type, String description) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            appendToJournal(fromAccountId, toAccountId, amount, type, description);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                appendToJournal(fromAccountId, toAccountId, amount, type, description);
            }
        });
    }

    private void appendToJournal(String fromAccountId, String toAccountId, Money amount,
                                 TransactionType type, String description) {
        try {
            journal.record(fromAccountId, toAccountId, amount, type, description);
        } catch (RuntimeException e) {
            // Balance stays applied; the transaction row is only the audit trail
            log.error("Failed to record {} transaction: from={}, to={}, amount={} {}",
                type, fromAccountId, toAccountId, amount.getAmount(), amount.getCurrency(), e);
        }
    }
}
