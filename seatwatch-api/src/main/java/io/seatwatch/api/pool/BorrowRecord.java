package io.seatwatch.api.pool;

import java.time.Instant;

/**
 * A checkout, either outstanding ({@code returnedAt == null}) or historical.
 */
public record BorrowRecord(
        String id,
        String poolName,
        String holder,
        Instant borrowedAt,
        Instant returnedAt,
        boolean overage
) {

    public boolean outstanding() {
        return returnedAt == null;
    }

    public BorrowRecord returned(Instant at) {
        return new BorrowRecord(id, poolName, holder, borrowedAt, at, overage);
    }
}
