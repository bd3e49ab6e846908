package com.creditengine.schedule;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for payment schedule entries.
 */
@Repository
public interface PaymentScheduleEntryRepository extends JpaRepository<PaymentScheduleEntry, String> {

    List<PaymentScheduleEntry> findByCreditIdOrderByPaymentNumberAsc(String creditId);

    List<PaymentScheduleEntry> findByDueDateBeforeAndStatusInOrderByDueDateAscPaymentNumberAsc(
        LocalDate day, Collection<PaymentStatus> statuses);

    long countByCreditIdAndStatus(String creditId, PaymentStatus status);

    long countByCreditIdInAndStatus(Collection<String> creditIds, PaymentStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM PaymentScheduleEntry e WHERE e.entryId = :entryId")
    Optional<PaymentScheduleEntry> findByIdForUpdate(@Param("entryId") String entryId);
}
