package io.jobvisor.internal;

import io.jobvisor.utils.IntervalParser;

import java.time.Instant;

/**
 * Clock side of the scheduler: keeps each record's next due time and decides when it fires.
 */
final class TriggerEvaluator {

    /**
     * Compute the first due time at or after {@code now}. Occurrences before {@code now} are not replayed.
     */
    void arm(JobRecord record, Instant now) {
        record.nextDueTime(IntervalParser.nextOccurrence(record.spec(), now, true));
    }

    /**
     * Fire at most once per call. The next due time moves strictly past {@code now}, so several
     * occurrences missed by a stalled loop collapse into one run.
     */
    boolean fireIfDue(JobRecord record, Instant now) {
        Instant due = record.nextDueTime();
        if (due == null || now.isBefore(due)) {
            return false;
        }
        record.nextDueTime(IntervalParser.nextOccurrence(record.spec(), now, false));
        return true;
    }
}
