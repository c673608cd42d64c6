package io.seatwatch.api.environment;

import io.seatwatch.api.pool.PoolDefinition;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Configuration of a ledger environment.
 * Controls seed pools, event retention, the snapshot cadence and session buffering.
 */
public final class LedgerConfig {

    private final List<PoolDefinition> pools = new ArrayList<>();
    private Duration retention = Duration.ofHours(6);
    private int maxEventsPerCategory = 10_000;
    private int maxHoldersPerBucket = 50;
    private Duration publishInterval = Duration.ofSeconds(1);
    private Duration rateWindow = Duration.ofSeconds(60);
    private Duration recentEventsLookback = Duration.ofSeconds(60);
    private int recentEventsLimit = 100;
    private int sessionQueueCapacity = 4;
    private Clock clock = Clock.systemUTC();

    private LedgerConfig() {}

    public static LedgerConfig create() {
        return new LedgerConfig();
    }

    public LedgerConfig pool(PoolDefinition definition) {
        pools.add(definition.validate());
        return this;
    }

    public LedgerConfig pools(List<PoolDefinition> definitions) {
        definitions.forEach(this::pool);
        return this;
    }

    /**
     * How long buffered events and minute buckets are kept.
     */
    public LedgerConfig retention(Duration retention) {
        if (retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("Retention must be positive");
        }
        this.retention = retention;
        return this;
    }

    /**
     * Hard element cap per event category, applied regardless of age.
     */
    public LedgerConfig maxEventsPerCategory(int maxEventsPerCategory) {
        if (maxEventsPerCategory <= 0) {
            throw new IllegalArgumentException("Max events per category must be positive");
        }
        this.maxEventsPerCategory = maxEventsPerCategory;
        return this;
    }

    public LedgerConfig maxHoldersPerBucket(int maxHoldersPerBucket) {
        if (maxHoldersPerBucket <= 0) {
            throw new IllegalArgumentException("Max holders per bucket must be positive");
        }
        this.maxHoldersPerBucket = maxHoldersPerBucket;
        return this;
    }

    public LedgerConfig publishInterval(Duration publishInterval) {
        if (publishInterval.isZero() || publishInterval.isNegative()) {
            throw new IllegalArgumentException("Publish interval must be positive");
        }
        this.publishInterval = publishInterval;
        return this;
    }

    public LedgerConfig rateWindow(Duration rateWindow) {
        if (rateWindow.isZero() || rateWindow.isNegative()) {
            throw new IllegalArgumentException("Rate window must be positive");
        }
        this.rateWindow = rateWindow;
        return this;
    }

    public LedgerConfig recentEventsLookback(Duration recentEventsLookback) {
        this.recentEventsLookback = recentEventsLookback;
        return this;
    }

    public LedgerConfig recentEventsLimit(int recentEventsLimit) {
        if (recentEventsLimit < 0) {
            throw new IllegalArgumentException("Recent events limit must not be negative");
        }
        this.recentEventsLimit = recentEventsLimit;
        return this;
    }

    /**
     * Outbound queue size per streaming session. A session whose queue is full
     * when a snapshot is broadcast is dropped.
     */
    public LedgerConfig sessionQueueCapacity(int sessionQueueCapacity) {
        if (sessionQueueCapacity <= 0) {
            throw new IllegalArgumentException("Session queue capacity must be positive");
        }
        this.sessionQueueCapacity = sessionQueueCapacity;
        return this;
    }

    public LedgerConfig clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public List<PoolDefinition> pools() { return Collections.unmodifiableList(pools); }
    public Duration retention() { return retention; }
    public int maxEventsPerCategory() { return maxEventsPerCategory; }
    public int maxHoldersPerBucket() { return maxHoldersPerBucket; }
    public Duration publishInterval() { return publishInterval; }
    public Duration rateWindow() { return rateWindow; }
    public Duration recentEventsLookback() { return recentEventsLookback; }
    public int recentEventsLimit() { return recentEventsLimit; }
    public int sessionQueueCapacity() { return sessionQueueCapacity; }
    public Clock clock() { return clock; }
}
