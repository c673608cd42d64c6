package io.seatwatch.api.event;

import io.seatwatch.api.pool.FailureReason;

import java.time.Instant;

/**
 * Observation of a ledger mutation. Kept only for the retention window.
 *
 * @param borrowId      null for failures
 * @param failureReason null unless {@code kind == FAILURE}
 */
public record LedgerEvent(
        EventKind kind,
        String poolName,
        String holder,
        String borrowId,
        Instant timestamp,
        boolean overage,
        FailureReason failureReason
) {

    public static LedgerEvent borrow(String poolName, String holder, String borrowId, Instant at, boolean overage) {
        return new LedgerEvent(EventKind.BORROW, poolName, holder, borrowId, at, overage, null);
    }

    public static LedgerEvent returned(String poolName, String holder, String borrowId, Instant at, boolean overage) {
        return new LedgerEvent(EventKind.RETURN, poolName, holder, borrowId, at, overage, null);
    }

    public static LedgerEvent failure(String poolName, String holder, Instant at, FailureReason reason) {
        return new LedgerEvent(EventKind.FAILURE, poolName, holder, null, at,
                reason == FailureReason.MAX_OVERAGE, reason);
    }

    /**
     * Copy with a different timestamp.
     */
    public LedgerEvent at(Instant newTimestamp) {
        return new LedgerEvent(kind, poolName, holder, borrowId, newTimestamp, overage, failureReason);
    }
}
