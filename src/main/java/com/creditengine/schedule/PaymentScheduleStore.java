package com.creditengine.schedule;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Persistence for credit payment schedules.
 */
public interface PaymentScheduleStore {

    /**
     * Persist all entries of a schedule together. Payment numbers must be unique per credit.
     */
    List<PaymentScheduleEntry> createBatch(List<PaymentScheduleEntry> entries);

    /**
     * @throws com.creditengine.common.exception.ScheduleEntryNotFoundException if absent
     */
    PaymentScheduleEntry getEntry(String entryId);

    /**
     * Same as {@link #getEntry(String)} but holds an exclusive lock on the row until the
     * surrounding transaction ends.
     */
    PaymentScheduleEntry lockEntry(String entryId);

    /**
     * Entries of one credit ordered by payment number ascending.
     */
    List<PaymentScheduleEntry> findByCreditId(String creditId);

    /**
     * PENDING and OVERDUE entries with a due date strictly before {@code day},
     * oldest due date first.
     */
    List<PaymentScheduleEntry> findDueEntries(LocalDate day);

    long countByCreditIdAndStatus(String creditId, PaymentStatus status);

    long countByCreditIdsAndStatus(Collection<String> creditIds, PaymentStatus status);

    PaymentScheduleEntry save(PaymentScheduleEntry entry);
}
