package com.creditengine.ledger;

import com.creditengine.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of a single balance-affecting operation.
 *
 * The source account is empty for money coming from outside the bank (deposits, disbursements);
 * the destination account is empty for money leaving the bank (withdrawals, credit payments).
 * Rows are append-only and never updated.
 */
@Entity
@Table(name = "ledger_transactions", indexes = {
    @Index(name = "idx_ledger_from_account", columnList = "from_account_id"),
    @Index(name = "idx_ledger_to_account", columnList = "to_account_id"),
    @Index(name = "idx_ledger_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class LedgerTransaction {

    @Id
    private String transactionId;

    @Column(name = "from_account_id", updatable = false)
    private String fromAccountId;

    @Column(name = "to_account_id", updatable = false)
    private String toAccountId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount",
            column = @Column(name = "amount", precision = 19, scale = 2, updatable = false)),
        @AttributeOverride(name = "currency", column = @Column(name = "currency", updatable = false))
    })
    private Money amount;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private TransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private TransactionStatus status;

    @Column(updatable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerTransaction(String fromAccountId, String toAccountId, Money amount,
                             TransactionType type, String description) {
        this.transactionId = UUID.randomUUID().toString();
        this.fromAccountId = fromAccountId;
        this.toAccountId = toAccountId;
        this.amount = amount;
        this.type = type;
        this.status = TransactionStatus.COMPLETED;
        this.description = description;
        this.createdAt = Instant.now();
    }

    public boolean involves(String accountId) {
        return accountId.equals(fromAccountId) || accountId.equals(toAccountId);
    }
}
