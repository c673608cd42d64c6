package io.seatwatch.api.pool;

import java.math.BigDecimal;

/**
 * Point-in-time view of one pool's counters.
 * Read in a single short critical section, so the fields are mutually consistent.
 */
public record PoolStatus(
        String tool,
        int total,
        int borrowed,
        int available,
        int commit,
        int maxOverage,
        int overage,
        boolean inCommit,
        BigDecimal commitPrice,
        BigDecimal overagePricePerLicense,
        BigDecimal currentOverageCost,
        BigDecimal totalCost,
        long overageBorrows,
        boolean active
) {}
