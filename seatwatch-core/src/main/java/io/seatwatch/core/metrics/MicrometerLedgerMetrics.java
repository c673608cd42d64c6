package io.seatwatch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.seatwatch.api.metrics.LedgerMetrics;
import io.seatwatch.api.pool.FailureReason;
import io.seatwatch.api.pool.PoolStatus;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Default ledger metrics using Micrometer.
 * Counts borrow attempts, outcomes and returns per pool, times borrows, and exposes
 * per-pool seat gauges plus streaming health.
 */
public class MicrometerLedgerMetrics implements LedgerMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> borrowTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> successCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> overageCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> returnCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> droppedSessionCounters = new ConcurrentHashMap<>();
    private final Counter bufferFailures;
    private final Counter skippedTicks;
    private final AtomicInteger activeSessions = new AtomicInteger();

    public MicrometerLedgerMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerLedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.bufferFailures = Counter.builder("seatwatch.buffer.append.failures").register(registry);
        this.skippedTicks = Counter.builder("seatwatch.snapshot.skipped.ticks").register(registry);
        Gauge.builder("seatwatch.sessions.active", activeSessions, AtomicInteger::get).register(registry);
    }

    @Override
    public void bindPool(String poolName, Supplier<PoolStatus> status) {
        Gauge.builder("seatwatch.seats.total", status, s -> s.get().total())
                .tag("pool", poolName).strongReference(true).register(registry);
        Gauge.builder("seatwatch.seats.borrowed", status, s -> s.get().borrowed())
                .tag("pool", poolName).strongReference(true).register(registry);
        Gauge.builder("seatwatch.seats.overage", status, s -> s.get().overage())
                .tag("pool", poolName).strongReference(true).register(registry);
        Gauge.builder("seatwatch.seats.commit", status, s -> s.get().commit())
                .tag("pool", poolName).strongReference(true).register(registry);
    }

    @Override
    public void recordBorrow(String poolName, boolean overage, Duration duration) {
        getTimer(poolName).record(duration);
        getSuccessCounter(poolName).increment();
        if (overage) {
            overageCounters.computeIfAbsent(poolName, name ->
                    Counter.builder("seatwatch.borrow.overage")
                            .tag("pool", name)
                            .register(registry)).increment();
        }
    }

    @Override
    public void recordFailure(String poolName, FailureReason reason, Duration duration) {
        String pool = poolName == null ? "unknown" : poolName;
        String tagReason = reason.name().toLowerCase();
        getTimer(pool).record(duration);
        failureCounters.computeIfAbsent(pool + '|' + tagReason, key ->
                Counter.builder("seatwatch.borrow.failure")
                        .tag("pool", pool)
                        .tag("reason", tagReason)
                        .register(registry)).increment();
    }

    @Override
    public void recordReturn(String poolName) {
        returnCounters.computeIfAbsent(poolName, name ->
                Counter.builder("seatwatch.return")
                        .tag("pool", name)
                        .register(registry)).increment();
    }

    @Override
    public void recordBufferAppendFailure() {
        bufferFailures.increment();
    }

    @Override
    public void recordSessionDropped(String cause) {
        droppedSessionCounters.computeIfAbsent(cause, c ->
                Counter.builder("seatwatch.sessions.dropped")
                        .tag("cause", c)
                        .register(registry)).increment();
    }

    @Override
    public void recordSkippedTicks(long skipped) {
        skippedTicks.increment(skipped);
    }

    @Override
    public void recordActiveSessions(int count) {
        activeSessions.set(count);
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Timer getTimer(String poolName) {
        return borrowTimers.computeIfAbsent(poolName, name ->
                Timer.builder("seatwatch.borrow.duration")
                        .tag("pool", name)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry));
    }

    private Counter getSuccessCounter(String poolName) {
        return successCounters.computeIfAbsent(poolName, name ->
                Counter.builder("seatwatch.borrow.success")
                        .tag("pool", name)
                        .register(registry));
    }
}
