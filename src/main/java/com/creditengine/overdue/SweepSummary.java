package com.creditengine.overdue;

import lombok.Value;

import java.time.Instant;

/**
 * Aggregate counts of one sweep. {@code processed} counts every entry handled without
 * an error, whatever its outcome.
 */
@Value
public class SweepSummary {
    Instant startedAt;
    int total;
    int processed;
    int settled;
    int markedOverdue;
    int skipped;
    int failed;
}
