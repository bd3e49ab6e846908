package com.creditengine.overdue;

import com.creditengine.notification.NotificationDispatcher;
import com.creditengine.notification.NotificationKind;
import com.creditengine.schedule.PaymentScheduleEntry;
import com.creditengine.schedule.PaymentScheduleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic sweep over past-due payment schedule entries.
 *
 * {@link #start()} runs a sweep right away and then every configured interval on the injected
 * {@link TaskScheduler}. Entries are settled one by one, each in its own transaction; a failing
 * entry is counted and the sweep moves on. Sweeps never overlap: a manual {@link #runSweep()}
 * waits for a scheduled one to finish and vice versa.
 */
@Component
@Slf4j
public class OverduePaymentProcessor implements SmartLifecycle {

    private final OverdueSettlementService settlementService;
    private final PaymentScheduleStore scheduleStore;
    private final NotificationDispatcher notificationDispatcher;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration interval;
    private final BigDecimal penaltyRate;
    private final boolean autoStartup;

    private final ReentrantLock sweepLock = new ReentrantLock();
    private final Object lifecycleMonitor = new Object();
    private volatile ProcessorState state = ProcessorState.IDLE;
    private ScheduledFuture<?> scheduledSweep;

    public OverduePaymentProcessor(
            OverdueSettlementService settlementService,
            PaymentScheduleStore scheduleStore,
            NotificationDispatcher notificationDispatcher,
            TaskScheduler taskScheduler,
            Clock clock,
            @Value("${credit-engine.overdue.interval:PT12H}") Duration interval,
            @Value("${credit-engine.overdue.penalty-rate:10.0}") BigDecimal penaltyRate,
            @Value("${credit-engine.overdue.enabled:true}") boolean autoStartup) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive: " + interval);
        }
        if (penaltyRate.signum() < 0) {
            throw new IllegalArgumentException("Penalty rate must not be negative: " + penaltyRate);
        }
        this.settlementService = settlementService;
        this.scheduleStore = scheduleStore;
        this.notificationDispatcher = notificationDispatcher;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.interval = interval;
        this.penaltyRate = penaltyRate;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (state == ProcessorState.RUNNING) {
                return;
            }
            scheduledSweep = taskScheduler.scheduleAtFixedRate(this::scheduledRun, clock.instant(), interval);
            state = ProcessorState.RUNNING;
            log.info("Overdue payment processor started: interval={}, penaltyRate={}%", interval, penaltyRate);
        }
    }

    /**
     * Cancel future sweeps. Safe to call repeatedly; does not interrupt a sweep in progress.
     */
    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (state == ProcessorState.STOPPED) {
                return;
            }
            if (scheduledSweep != null) {
                scheduledSweep.cancel(false);
                scheduledSweep = null;
            }
            state = ProcessorState.STOPPED;
            log.info("Overdue payment processor stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return state == ProcessorState.RUNNING;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    public ProcessorState getState() {
        return state;
    }

    public SweepSummary runSweep() {
        return runSweep(clock.instant());
    }

    /**
     * One full pass over entries due before the day of {@code now} in the clock's zone.
     */
    public SweepSummary runSweep(Instant now) {
        sweepLock.lock();
        try {
            return sweep(now);
        } finally {
            sweepLock.unlock();
        }
    }

    private void scheduledRun() {
        try {
            runSweep();
        } catch (RuntimeException e) {
            log.error("Overdue payment sweep aborted", e);
        }
    }

    private SweepSummary sweep(Instant now) {
        LocalDate today = LocalDate.ofInstant(now, clock.getZone());
        List<PaymentScheduleEntry> due = scheduleStore.findDueEntries(today);
        log.info("Overdue payment sweep started: dueBefore={}, entries={}", today, due.size());

        int settled = 0;
        int markedOverdue = 0;
        int skipped = 0;
        int failed = 0;

        for (PaymentScheduleEntry entry : due) {
            SettlementResult result;
            try {
                result = settlementService.settle(entry.getEntryId(), penaltyRate, now);
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to process payment {} of credit {} (entry {})",
                    entry.getPaymentNumber(), entry.getCreditId(), entry.getEntryId(), e);
                continue;
            }

            switch (result.getOutcome()) {
                case SETTLED -> settled++;
                case MARKED_OVERDUE -> markedOverdue++;
                case SKIPPED -> skipped++;
            }
            if (result.getOutcome() != SettlementOutcome.SKIPPED) {
                notifyOwner(result);
            }
        }

        int processed = settled + markedOverdue + skipped;
        log.info("Overdue payment sweep completed: processed={}, failed={}, total={} (settled={}, overdue={}, skipped={})",
            processed, failed, due.size(), settled, markedOverdue, skipped);
        return new SweepSummary(now, due.size(), processed, settled, markedOverdue, skipped, failed);
    }

    private void notifyOwner(SettlementResult result) {
        NotificationKind kind = result.getOutcome() == SettlementOutcome.SETTLED
            ? NotificationKind.PAYMENT_SETTLED
            : NotificationKind.PAYMENT_OVERDUE;

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("creditId", result.getCreditId());
        payload.put("paymentNumber", String.valueOf(result.getPaymentNumber()));
        payload.put("dueDate", String.valueOf(result.getDueDate()));
        payload.put("charged", result.getCharged().toPlainString());
        payload.put("penalty", result.getPenalty().toPlainString());
        payload.put("totalPenalty", result.getTotalPenalty().toPlainString());
        payload.put("currency", result.getCurrency());

        try {
            notificationDispatcher.send(kind, result.getOwnerId(), payload);
        } catch (RuntimeException e) {
            log.error("Failed to send {} notification for credit {}", kind, result.getCreditId(), e);
        }
    }
}
