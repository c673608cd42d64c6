package io.seatwatch.core.stream;

import io.seatwatch.api.environment.LedgerConfig;
import io.seatwatch.api.event.EventBuffer;
import io.seatwatch.api.event.EventKind;
import io.seatwatch.api.event.LedgerEvent;
import io.seatwatch.api.event.MinuteBucket;
import io.seatwatch.api.metrics.LedgerMetrics;
import io.seatwatch.api.metrics.RateSummary;
import io.seatwatch.api.pool.PoolLedger;
import io.seatwatch.api.pool.PoolStatus;
import io.seatwatch.api.stream.PublisherState;
import io.seatwatch.api.stream.Snapshot;
import io.seatwatch.api.stream.SnapshotMessage;
import io.seatwatch.core.metrics.RateAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Composes a snapshot of ledger and buffer state on a fixed tick and fans it out.
 * <p>
 * A cycle goes {@code IDLE -> COMPOSING -> BROADCASTING -> IDLE}; only one runs at a time.
 * The next tick is scheduled relative to the tick grid, so a cycle that overruns skips the
 * ticks it missed instead of queueing them. Broadcasting only offers to session queues and
 * never waits on an observer.
 */
public class SnapshotPublisher {

    private static final Logger log = LoggerFactory.getLogger(SnapshotPublisher.class);

    private final LedgerConfig config;
    private final PoolLedger ledger;
    private final EventBuffer eventBuffer;
    private final RateAggregator rateAggregator;
    private final SessionManager sessionManager;
    private final LedgerMetrics metrics;
    private final SnapshotCodec codec;
    private final Clock clock;

    private final AtomicReference<PublisherState> state = new AtomicReference<>(PublisherState.IDLE);
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private final AtomicReference<Snapshot> latest = new AtomicReference<>();
    private ScheduledExecutorService scheduler;

    public SnapshotPublisher(LedgerConfig config, PoolLedger ledger, EventBuffer eventBuffer,
                             RateAggregator rateAggregator, SessionManager sessionManager,
                             LedgerMetrics metrics, SnapshotCodec codec) {
        this.config = config;
        this.ledger = ledger;
        this.eventBuffer = eventBuffer;
        this.rateAggregator = rateAggregator;
        this.sessionManager = sessionManager;
        this.metrics = metrics;
        this.codec = codec;
        this.clock = config.clock();
    }

    /**
     * Start publishing every {@link LedgerConfig#publishInterval()}.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "seatwatch-snapshot-publisher");
            t.setDaemon(true);
            return t;
        });
        state.compareAndSet(PublisherState.STOPPED, PublisherState.IDLE);
        scheduler.schedule(this::tick, config.publishInterval().toNanos(), TimeUnit.NANOSECONDS);
        log.info("Snapshot publishing started with interval: {}ms", config.publishInterval().toMillis());
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        state.set(PublisherState.STOPPED);
        log.info("Snapshot publishing stopped after {} snapshots, {} skipped ticks",
                sequence.get(), skippedTicks.get());
    }

    /**
     * Run one full cycle on the calling thread.
     *
     * @return the published snapshot, empty if another cycle is in progress or the publisher is stopped
     */
    public Optional<Snapshot> publishOnce() {
        if (!state.compareAndSet(PublisherState.IDLE, PublisherState.COMPOSING)) {
            return Optional.empty();
        }
        try {
            Snapshot snapshot = compose();
            state.set(PublisherState.BROADCASTING);
            broadcast(snapshot);
            return Optional.of(snapshot);
        } finally {
            state.compareAndSet(PublisherState.COMPOSING, PublisherState.IDLE);
            state.compareAndSet(PublisherState.BROADCASTING, PublisherState.IDLE);
        }
    }

    /**
     * Read every pool, one at a time, plus rates, recent borrows and the buffered series.
     */
    public Snapshot compose() {
        Instant now = clock.instant();
        List<PoolStatus> tools = ledger.statusAll();
        RateSummary rates = rateAggregator.summary(config.rateWindow());

        List<LedgerEvent> borrows = eventBuffer.recent(EventKind.BORROW, now.minus(config.recentEventsLookback()));
        int limit = config.recentEventsLimit();
        if (borrows.size() > limit) {
            borrows = borrows.subList(borrows.size() - limit, borrows.size());
        }

        Map<String, List<MinuteBucket>> toolMetrics = new LinkedHashMap<>();
        for (PoolStatus tool : tools) {
            toolMetrics.put(tool.tool(), eventBuffer.seriesFor(tool.tool()));
        }

        Snapshot snapshot = new Snapshot(
                sequence.incrementAndGet(),
                now,
                tools,
                rates,
                new Snapshot.RecentEvents(List.copyOf(borrows)),
                Collections.unmodifiableMap(toolMetrics),
                eventBuffer.stats()
        );
        latest.set(snapshot);
        return snapshot;
    }

    /**
     * Serialize once and offer to every session.
     */
    public void broadcast(Snapshot snapshot) {
        SnapshotMessage message = new SnapshotMessage(snapshot.sequence(), codec.encode(snapshot));
        sessionManager.broadcast(message);
    }

    public PublisherState state() {
        return state.get();
    }

    public Optional<Snapshot> latest() {
        return Optional.ofNullable(latest.get());
    }

    public long skippedTicks() {
        return skippedTicks.get();
    }

    private void tick() {
        long started = System.nanoTime();
        try {
            publishOnce();
        } catch (Exception e) {
            log.error("Error publishing snapshot", e);
        }

        long interval = config.publishInterval().toNanos();
        long elapsed = System.nanoTime() - started;
        long missed = elapsed / interval;
        if (missed > 0) {
            skippedTicks.addAndGet(missed);
            metrics.recordSkippedTicks(missed);
            log.debug("Snapshot cycle took {}ms, skipping {} ticks", elapsed / 1_000_000, missed);
        }
        scheduleNext(interval - (elapsed % interval));
    }

    private synchronized void scheduleNext(long delayNanos) {
        if (scheduler == null || scheduler.isShutdown()) {
            return;
        }
        try {
            scheduler.schedule(this::tick, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Publisher stopped while scheduling the next tick");
        }
    }
}
