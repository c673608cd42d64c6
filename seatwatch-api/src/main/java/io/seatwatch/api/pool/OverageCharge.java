package io.seatwatch.api.pool;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One unit of overage cost accrued by an overage borrow. Never reversed.
 */
public record OverageCharge(
        String id,
        String poolName,
        String borrowId,
        String holder,
        Instant chargedAt,
        BigDecimal amount
) {}
