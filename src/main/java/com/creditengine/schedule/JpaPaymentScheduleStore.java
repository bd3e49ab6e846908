package com.creditengine.schedule;

import com.creditengine.common.exception.ScheduleEntryNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;

/**
 * Database-backed payment schedule store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaPaymentScheduleStore implements PaymentScheduleStore {

    private static final EnumSet<PaymentStatus> COLLECTIBLE =
        EnumSet.of(PaymentStatus.PENDING, PaymentStatus.OVERDUE);

    private final PaymentScheduleEntryRepository repository;

    @Override
    @Transactional
    public List<PaymentScheduleEntry> createBatch(List<PaymentScheduleEntry> entries) {
        List<PaymentScheduleEntry> saved = repository.saveAll(entries);
        repository.flush();
        log.debug("Stored {} payment schedule entries", saved.size());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public PaymentScheduleEntry getEntry(String entryId) {
        return repository.findById(entryId)
            .orElseThrow(() -> new ScheduleEntryNotFoundException(entryId));
    }

    @Override
    @Transactional
    public PaymentScheduleEntry lockEntry(String entryId) {
        return repository.findByIdForUpdate(entryId)
            .orElseThrow(() -> new ScheduleEntryNotFoundException(entryId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<PaymentScheduleEntry> findByCreditId(String creditId) {
        return repository.findByCreditIdOrderByPaymentNumberAsc(creditId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PaymentScheduleEntry> findDueEntries(LocalDate day) {
        return repository.findByDueDateBeforeAndStatusInOrderByDueDateAscPaymentNumberAsc(day, COLLECTIBLE);
    }

    @Override
    @Transactional(readOnly = true)
    public long countByCreditIdAndStatus(String creditId, PaymentStatus status) {
        return repository.countByCreditIdAndStatus(creditId, status);
    }

    @Override
    @Transactional(readOnly = true)
    public long countByCreditIdsAndStatus(Collection<String> creditIds, PaymentStatus status) {
        if (creditIds.isEmpty()) {
            return 0;
        }
        return repository.countByCreditIdInAndStatus(creditIds, status);
    }

    @Override
    @Transactional
    public PaymentScheduleEntry save(PaymentScheduleEntry entry) {
        return repository.save(entry);
    }
}
