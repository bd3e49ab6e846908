package com.creditengine.ledger;

import com.creditengine.accounts.Account;
import com.creditengine.accounts.AccountStatus;
import com.creditengine.common.Currency;
import com.creditengine.common.Money;

import java.util.List;

/**
 * Owner of account balances and the only component allowed to change them.
 *
 * Every balance mutation runs under an exclusive lock on the affected account(s) and, once applied,
 * appends exactly one {@link LedgerTransaction}. A failure to append the transaction is logged and
 * does not undo the balance change.
 *
 * Common preconditions for {@code deposit}, {@code withdraw} and {@code transfer}:
 * <ul>
 *   <li>the amount is positive and does not exceed the configured ceiling
 *       ({@link com.creditengine.common.exception.ValidationException});</li>
 *   <li>the account exists ({@link com.creditengine.common.exception.AccountNotFoundException})
 *       and is ACTIVE ({@link com.creditengine.common.exception.AccountInactiveException}).</li>
 * </ul>
 */
public interface LedgerStore {

    Account openAccount(String ownerId, Currency currency);

    Account getAccount(String accountId);

    List<Account> getAccountsByOwner(String ownerId);

    /**
     * Block, unblock or close an account. A closed account cannot be reopened.
     */
    Account changeStatus(String accountId, AccountStatus status);

    /**
     * Credit the account.
     *
     * @return the balance after the deposit
     */
    Money deposit(String accountId, Money amount, TransactionType type, String description);

    /**
     * Debit the account.
     *
     * @return the balance after the withdrawal
     * @throws com.creditengine.common.exception.InsufficientFundsException if the balance is lower
     *         than the amount; nothing is changed
     */
    Money withdraw(String accountId, Money amount, TransactionType type, String description);

    /**
     * Move funds between two distinct accounts. Both sides apply together or neither does.
     * Row locks are taken in ascending account id order.
     *
     * @throws com.creditengine.common.exception.ValidationException if both ids are the same
     * @throws com.creditengine.common.exception.InsufficientFundsException if the source balance is too low
     */
    void transfer(String fromAccountId, String toAccountId, Money amount, String description);

    /**
     * Transactions touching the account, newest first.
     */
    List<LedgerTransaction> getAccountHistory(String accountId);
}
