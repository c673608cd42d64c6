package io.seatwatch.api.pool;

import java.time.Instant;

/**
 * Outcome of a successful borrow.
 */
public record BorrowResult(
        String borrowId,
        String poolName,
        String holder,
        Instant borrowedAt,
        boolean overage
) {}
