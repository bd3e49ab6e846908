package com.creditengine.ledger;

import com.creditengine.common.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Appends ledger transactions.
 *
 * Writes run in their own transaction. They are issued after the balance update has committed,
 * when the caller's transaction can no longer take part.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerJournal {

    private final LedgerTransactionRepository transactionRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public LedgerTransaction record(String fromAccountId, String toAccountId, Money amount,
                                    TransactionType type, String description) {
        LedgerTransaction transaction = new LedgerTransaction(
            fromAccountId, toAccountId, amount, type, description);
        transactionRepository.save(transaction);

        log.debug("Recorded {}: txn={}, from={}, to={}, amount={} {}",
            type, transaction.getTransactionId(), fromAccountId, toAccountId,
            amount.getAmount(), amount.getCurrency());

        return transaction;
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> history(String accountId) {
        return transactionRepository.findAccountHistory(accountId);
    }
}
