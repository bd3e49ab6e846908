package com.creditengine.credits;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for credits.
 */
@Repository
public interface CreditRepository extends JpaRepository<Credit, String> {

    List<Credit> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Credit c WHERE c.creditId = :creditId")
    Optional<Credit> findByIdForUpdate(@Param("creditId") String creditId);
}
