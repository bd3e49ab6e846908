package com.creditengine.schedule.memory;

import com.creditengine.common.exception.ScheduleEntryNotFoundException;
import com.creditengine.schedule.PaymentScheduleEntry;
import com.creditengine.schedule.PaymentScheduleStore;
import com.creditengine.schedule.PaymentStatus;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory payment schedule store for tests.
 *
 * Entries are copied on the way in and out, so callers must {@link #save} their changes.
 */
public class InMemoryPaymentScheduleStore implements PaymentScheduleStore {

    private final Map<String, PaymentScheduleEntry> entries = new ConcurrentHashMap<>();

    @Override
    public synchronized List<PaymentScheduleEntry> createBatch(List<PaymentScheduleEntry> batch) {
        for (PaymentScheduleEntry entry : batch) {
            boolean duplicate = entries.values().stream().anyMatch(existing ->
                existing.getCreditId().equals(entry.getCreditId())
                    && existing.getPaymentNumber() == entry.getPaymentNumber());
            if (duplicate) {
                throw new IllegalStateException(String.format(
                    "Payment %d already scheduled for credit %s", entry.getPaymentNumber(), entry.getCreditId()));
            }
        }
        batch.forEach(entry -> entries.put(entry.getEntryId(), entry.copy()));
        return batch.stream().map(PaymentScheduleEntry::copy).toList();
    }

    @Override
    public PaymentScheduleEntry getEntry(String entryId) {
        PaymentScheduleEntry entry = entries.get(entryId);
        if (entry == null) {
            throw new ScheduleEntryNotFoundException(entryId);
        }
        return entry.copy();
    }

    @Override
    public PaymentScheduleEntry lockEntry(String entryId) {
        return getEntry(entryId);
    }

    @Override
    public List<PaymentScheduleEntry> findByCreditId(String creditId) {
        return entries.values().stream()
            .filter(entry -> entry.getCreditId().equals(creditId))
            .sorted(Comparator.comparingInt(PaymentScheduleEntry::getPaymentNumber))
            .map(PaymentScheduleEntry::copy)
            .toList();
    }

    @Override
    public List<PaymentScheduleEntry> findDueEntries(LocalDate day) {
        return entries.values().stream()
            .filter(entry -> entry.isCollectibleOn(day))
            .sorted(Comparator.comparing(PaymentScheduleEntry::getDueDate)
                .thenComparingInt(PaymentScheduleEntry::getPaymentNumber))
            .map(PaymentScheduleEntry::copy)
            .toList();
    }

    @Override
    public long countByCreditIdAndStatus(String creditId, PaymentStatus status) {
        return entries.values().stream()
            .filter(entry -> entry.getCreditId().equals(creditId) && entry.getStatus() == status)
            .count();
    }

    @Override
    public long countByCreditIdsAndStatus(Collection<String> creditIds, PaymentStatus status) {
        return entries.values().stream()
            .filter(entry -> creditIds.contains(entry.getCreditId()) && entry.getStatus() == status)
            .count();
    }

    @Override
    public PaymentScheduleEntry save(PaymentScheduleEntry entry) {
        entries.put(entry.getEntryId(), entry.copy());
        return entry;
    }
}
