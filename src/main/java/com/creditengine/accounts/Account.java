package com.creditengine.accounts;

import com.creditengine.common.Currency;
import com.creditengine.common.Money;
import com.creditengine.common.exception.InsufficientFundsException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A customer account holding a non-negative balance in a single currency.
 *
 * The balance is the source of truth for funds; ledger transactions are the audit trail.
 * Balance changes must happen while the row is locked by the ledger store.
 */
@Entity
@Table(name = "accounts", indexes = {
    @Index(name = "idx_accounts_owner_id", columnList = "owner_id")
})
@Data
@NoArgsConstructor
public class Account {

    @Id
    private String accountId;

    @Column(name = "account_number", unique = true, nullable = false)
    private String accountNumber;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "balance_amount", precision = 19, scale = 2)),
        @AttributeOverride(name = "currency", column = @Column(name = "balance_currency"))
    })
    private Money balance;

    @Enumerated(EnumType.STRING)
    private AccountStatus status;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Account(String ownerId, String accountNumber, Currency currency) {
        this.accountId = UUID.randomUUID().toString();
        this.ownerId = ownerId;
        this.accountNumber = accountNumber;
        this.balance = Money.zero(currency);
        this.status = AccountStatus.ACTIVE;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public Currency getCurrency() {
        return balance.getCurrency();
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }

    public void credit(Money amount) {
        this.balance = this.balance.add(amount);
        this.updatedAt = Instant.now();
    }

    /**
     * @throws InsufficientFundsException if the balance is lower than the amount; the balance is left untouched
     */
    public void debit(Money amount) {
        if (balance.isLessThan(amount)) {
            throw new InsufficientFundsException(accountId, amount, balance);
        }
        this.balance = this.balance.subtract(amount);
        this.updatedAt = Instant.now();
    }

    public void changeStatus(AccountStatus newStatus) {
        this.status = newStatus;
        this.updatedAt = Instant.now();
    }

    public Account snapshot() {
        Account copy = new Account();
        copy.setAccountId(accountId);
        copy.setAccountNumber(accountNumber);
        copy.setOwnerId(ownerId);
        copy.setBalance(Money.of(balance.getAmount(), balance.getCurrency()));
        copy.setStatus(status);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
