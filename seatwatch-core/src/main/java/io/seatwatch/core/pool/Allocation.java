package io.seatwatch.core.pool;

import io.seatwatch.api.pool.FailureReason;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of one capacity check, decided inside the pool's critical section.
 *
 * @param reason null when granted
 * @param charge overage cost accrued by this allocation, zero if none
 */
public record Allocation(boolean granted, boolean overage, FailureReason reason, BigDecimal charge, Instant at) {

    public static Allocation granted(boolean overage, BigDecimal charge, Instant at) {
        return new Allocation(true, overage, null, charge, at);
    }

    public static Allocation refused(FailureReason reason, Instant at) {
        return new Allocation(false, false, reason, BigDecimal.ZERO, at);
    }
}
