package io.seatwatch.api.metrics;

import io.seatwatch.api.pool.FailureReason;
import io.seatwatch.api.pool.PoolStatus;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Abstraction for operational metrics of the ledger and the streaming side.
 * Default implementation uses Micrometer.
 */
public interface LedgerMetrics {

    /**
     * Register per-pool gauges. The supplier is read on every scrape.
     */
    void bindPool(String poolName, Supplier<PoolStatus> status);

    void recordBorrow(String poolName, boolean overage, Duration duration);

    void recordFailure(String poolName, FailureReason reason, Duration duration);

    void recordReturn(String poolName);

    void recordBufferAppendFailure();

    void recordSessionDropped(String cause);

    void recordSkippedTicks(long skipped);

    void recordActiveSessions(int count);

    /**
     * Metrics sink that discards everything.
     */
    static LedgerMetrics noop() {
        return NoopLedgerMetrics.INSTANCE;
    }
}
