package io.seatwatch.api.metrics;

import io.seatwatch.api.pool.FailureReason;
import io.seatwatch.api.pool.PoolStatus;

import java.time.Duration;
import java.util.function.Supplier;

final class NoopLedgerMetrics implements LedgerMetrics {

    static final NoopLedgerMetrics INSTANCE = new NoopLedgerMetrics();

    private NoopLedgerMetrics() {}

    @Override public void bindPool(String poolName, Supplier<PoolStatus> status) {}
    @Override public void recordBorrow(String poolName, boolean overage, Duration duration) {}
    @Override public void recordFailure(String poolName, FailureReason reason, Duration duration) {}
    @Override public void recordReturn(String poolName) {}
    @Override public void recordBufferAppendFailure() {}
    @Override public void recordSessionDropped(String cause) {}
    @Override public void recordSkippedTicks(long skipped) {}
    @Override public void recordActiveSessions(int count) {}
}
