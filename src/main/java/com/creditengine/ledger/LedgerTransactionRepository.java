package com.creditengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ledger transactions.
 */
@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, String> {

    @Query("SELECT t FROM LedgerTransaction t " +
           "WHERE t.fromAccountId = :accountId OR t.toAccountId = :accountId " +
           "ORDER BY t.createdAt DESC")
    List<LedgerTransaction> findAccountHistory(@Param("accountId") String accountId);
}
