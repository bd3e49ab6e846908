package com.creditengine.overdue;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * What happened to one schedule entry during a sweep.
 */
@Value
@Builder
public class SettlementResult {
    String entryId;
    String creditId;
    String ownerId;
    int paymentNumber;
    LocalDate dueDate;
    SettlementOutcome outcome;
    /** Amount debited from the funding account; zero unless settled. */
    BigDecimal charged;
    /** Penalty accrued by this sweep. */
    BigDecimal penalty;
    /** Penalty accumulated on the entry so far. */
    BigDecimal totalPenalty;
    String currency;
    String reason;

    public static SettlementResult skipped(String entryId, String creditId, String reason) {
        return SettlementResult.builder()
            .entryId(entryId)
            .creditId(creditId)
            .outcome(SettlementOutcome.SKIPPED)
            .charged(BigDecimal.ZERO)
            .penalty(BigDecimal.ZERO)
            .reason(reason)
            .build();
    }
}
