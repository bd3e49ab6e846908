package com.creditengine.ledger.memory;

import com.creditengine.accounts.Account;
import com.creditengine.accounts.AccountNumbers;
import com.creditengine.accounts.AccountStatus;
import com.creditengine.common.Currency;
import com.creditengine.common.Money;
import com.creditengine.common.OperationLimits;
import com.creditengine.common.exception.AccountInactiveException;
import com.creditengine.common.exception.AccountNotFoundException;
import com.creditengine.common.exception.ValidationException;
import com.creditengine.ledger.LedgerStore;
import com.creditengine.ledger.LedgerTransaction;
import com.creditengine.ledger.TransactionType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory ledger store for tests and local experiments.
 *
 * Each account has its own {@link ReentrantLock} standing in for the database row lock.
 * Transfers acquire both locks in ascending account id order. Accounts handed out are
 * snapshots; the stored instances are only touched under their lock.
 *
 * NOT FOR PRODUCTION: state is lost on restart.
 */
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<String, Account> accounts = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final List<LedgerTransaction> transactions = new CopyOnWriteArrayList<>();
    private final OperationLimits limits;

    // Simulates audit-trail outages
    private volatile boolean journalAvailable = true;

    public InMemoryLedgerStore() {
        this(OperationLimits.defaults());
    }

    public InMemoryLedgerStore(OperationLimits limits) {
        this.limits = limits;
    }

    public void setJournalAvailable(boolean journalAvailable) {
        this.journalAvailable = journalAvailable;
    }

    @Override
    public Account openAccount(String ownerId, Currency currency) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner ID is required");
        }
        Account account = new Account(ownerId, AccountNumbers.generate(), currency);
        accounts.put(account.getAccountId(), account);
        locks.put(account.getAccountId(), new ReentrantLock());
        log.debug("In-memory account {} opened for owner {}", account.getAccountId(), ownerId);
        return account.snapshot();
    }

    @Override
    public Account getAccount(String accountId) {
        ReentrantLock lock = lockFor(accountId);
        lock.lock();
        try {
            return find(accountId).snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Account> getAccountsByOwner(String ownerId) {
        return accounts.values().stream()
            .filter(account -> account.getOwnerId().equals(ownerId))
            .map(account -> getAccount(account.getAccountId()))
            .sorted(Comparator.comparing(Account::getCreatedAt))
            .toList();
    }

    @Override
    public Account changeStatus(String accountId, AccountStatus status) {
        ReentrantLock lock = lockFor(accountId);
        lock.lock();
        try {
            Account account = find(accountId);
            if (account.getStatus() == AccountStatus.CLOSED && status != AccountStatus.CLOSED) {
                throw new ValidationException("Closed account cannot be reopened: " + accountId);
            }
            account.changeStatus(status);
            return account.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Money deposit(String accountId, Money amount, TransactionType type, String description) {
        limits.validateOperationAmount(amount);
        ReentrantLock lock = lockFor(accountId);
        lock.lock();
        try {
            Account account = findActive(accountId);
            account.credit(amount);
            record(null, accountId, amount, type, description);
            return account.getBalance();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Money withdraw(String accountId, Money amount, TransactionType type, String description) {
        limits.validateOperationAmount(amount);
        ReentrantLock lock = lockFor(accountId);
        lock.lock();
        try {
            Account account = findActive(accountId);
            account.debit(amount);
            record(accountId, null, amount, type, description);
            return account.getBalance();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void transfer(String fromAccountId, String toAccountId, Money amount, String description) {
        limits.validateOperationAmount(amount);
        if (fromAccountId.equals(toAccountId)) {
            throw new ValidationException("Cannot transfer to the same account: " + fromAccountId);
        }

        boolean fromFirst = fromAccountId.compareTo(toAccountId) < 0;
        ReentrantLock firstLock = lockFor(fromFirst ? fromAccountId : toAccountId);
        ReentrantLock secondLock = lockFor(fromFirst ? toAccountId : fromAccountId);

        firstLock.lock();
        try {
            secondLock.lock();
            try {
                Account from = findActive(fromAccountId);
                Account to = findActive(toAccountId);
                from.debit(amount);
                to.credit(amount);
                record(fromAccountId, toAccountId, amount, TransactionType.TRANSFER, description);
            } finally {
                secondLock.unlock();
            }
        } finally {
            firstLock.unlock();
        }
    }

    @Override
    public List<LedgerTransaction> getAccountHistory(String accountId) {
        List<LedgerTransaction> history = transactions.stream()
            .filter(transaction -> transaction.involves(accountId))
            .collect(Collectors.toCollection(ArrayList::new));
        Collections.reverse(history);
        return history;
    }

    private ReentrantLock lockFor(String accountId) {
        ReentrantLock lock = locks.get(accountId);
        if (lock == null) {
            throw new AccountNotFoundException(accountId);
        }
        return lock;
    }

    private Account find(String accountId) {
        Account account = accounts.get(accountId);
        if (account == null) {
            throw new AccountNotFoundException(accountId);
        }
        return account;
    }

    private Account findActive(String accountId) {
        Account account = find(accountId);
        if (!account.isActive()) {
            throw new AccountInactiveException(accountId, account.getStatus().name());
        }
        return account;
    }

    private void record(String fromAccountId, String toAccountId, Money amount,
                        TransactionType type, String description) {
        if (!journalAvailable) {
            log.error("Failed to record {} transaction: journal unavailable (from={}, to={}, amount={})",
                type, fromAccountId, toAccountId, amount.getAmount());
            return;
        }
        transactions.add(new LedgerTransaction(fromAccountId, toAccountId, amount, type, description));
    }
}
