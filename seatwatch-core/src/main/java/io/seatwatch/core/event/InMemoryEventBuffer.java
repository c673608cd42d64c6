package io.seatwatch.core.event;

import io.seatwatch.api.environment.LedgerConfig;
import io.seatwatch.api.event.BufferStats;
import io.seatwatch.api.event.EventBuffer;
import io.seatwatch.api.event.EventKind;
import io.seatwatch.api.event.LedgerEvent;
import io.seatwatch.api.event.MinuteBucket;
import io.seatwatch.api.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event buffer kept entirely in memory.
 * <p>
 * Each category and each pool series has its own lock, independent of the ledger's locks.
 * Entries are held oldest to newest in non-decreasing timestamp order: an event stamped
 * earlier than the newest entry already held is stored with that newest timestamp, so
 * retention pruning is always a prefix trim.
 */
public class InMemoryEventBuffer implements EventBuffer {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBuffer.class);

    private final Clock clock;
    private final Duration retention;
    private final int maxEventsPerCategory;
    private final int maxHoldersPerBucket;
    private final LedgerMetrics metrics;
    private final Map<EventKind, CategoryLog> categories = new EnumMap<>(EventKind.class);
    private final Map<String, PoolSeries> series = new ConcurrentHashMap<>();
    private final AtomicLong droppedEvents = new AtomicLong();

    public InMemoryEventBuffer(LedgerConfig config) {
        this(config, LedgerMetrics.noop());
    }

    public InMemoryEventBuffer(LedgerConfig config, LedgerMetrics metrics) {
        this.clock = config.clock();
        this.retention = config.retention();
        this.maxEventsPerCategory = config.maxEventsPerCategory();
        this.maxHoldersPerBucket = config.maxHoldersPerBucket();
        this.metrics = metrics;
        for (EventKind kind : EventKind.values()) {
            categories.put(kind, new CategoryLog());
        }
    }

    @Override
    public void record(LedgerEvent event) {
        try {
            Objects.requireNonNull(event, "event");
            Objects.requireNonNull(event.kind(), "event kind");
            Objects.requireNonNull(event.timestamp(), "event timestamp");

            Instant cutoff = cutoff();
            LedgerEvent stored = categories.get(event.kind()).append(event, cutoff);
            if (stored.kind() == EventKind.BORROW) {
                series.computeIfAbsent(stored.poolName(), PoolSeries::new).add(stored, cutoff);
            }
        } catch (RuntimeException e) {
            metrics.recordBufferAppendFailure();
            log.warn("Failed to buffer ledger event {}", event, e);
        }
    }

    @Override
    public List<LedgerEvent> recent(EventKind kind, Instant since) {
        return categories.get(kind).since(since, cutoff());
    }

    @Override
    public List<MinuteBucket> seriesFor(String poolName) {
        PoolSeries poolSeries = series.get(poolName);
        if (poolSeries == null) {
            return List.of();
        }
        return poolSeries.buckets(cutoff());
    }

    @Override
    public BufferStats stats() {
        Instant cutoff = cutoff();
        int borrows = categories.get(EventKind.BORROW).size(cutoff);
        int returns = categories.get(EventKind.RETURN).size(cutoff);
        int failures = categories.get(EventKind.FAILURE).size(cutoff);
        return new BufferStats(borrows + returns + failures, borrows, returns, failures,
                series.size(), droppedEvents.get());
    }

    private Instant cutoff() {
        return clock.instant().minus(retention);
    }

    /**
     * Events of one category, oldest first.
     */
    private final class CategoryLog {

        private final Deque<LedgerEvent> events = new ArrayDeque<>();
        private final ReentrantLock lock = new ReentrantLock();

        LedgerEvent append(LedgerEvent event, Instant cutoff) {
            lock.lock();
            try {
                LedgerEvent stored = event;
                LedgerEvent newest = events.peekLast();
                if (newest != null && event.timestamp().isBefore(newest.timestamp())) {
                    stored = event.at(newest.timestamp());
                }
                events.addLast(stored);
                while (events.size() > maxEventsPerCategory) {
                    events.pollFirst();
                    droppedEvents.incrementAndGet();
                }
                prune(cutoff);
                return stored;
            } finally {
                lock.unlock();
            }
        }

        List<LedgerEvent> since(Instant since, Instant cutoff) {
            lock.lock();
            try {
                prune(cutoff);
                List<LedgerEvent> result = new ArrayList<>();
                Iterator<LedgerEvent> newestFirst = events.descendingIterator();
                while (newestFirst.hasNext()) {
                    LedgerEvent event = newestFirst.next();
                    if (event.timestamp().isBefore(since)) {
                        break;
                    }
                    result.add(event);
                }
                Collections.reverse(result);
                return result;
            } finally {
                lock.unlock();
            }
        }

        int size(Instant cutoff) {
            lock.lock();
            try {
                prune(cutoff);
                return events.size();
            } finally {
                lock.unlock();
            }
        }

        private void prune(Instant cutoff) {
            while (!events.isEmpty() && events.peekFirst().timestamp().isBefore(cutoff)) {
                events.pollFirst();
            }
        }
    }

    /**
     * Minute buckets of one pool, oldest first.
     */
    private final class PoolSeries {

        private final String poolName;
        private final Deque<Bucket> buckets = new ArrayDeque<>();
        private final ReentrantLock lock = new ReentrantLock();

        PoolSeries(String poolName) {
            this.poolName = poolName;
        }

        void add(LedgerEvent event, Instant cutoff) {
            Instant minute = event.timestamp().truncatedTo(ChronoUnit.MINUTES);
            lock.lock();
            try {
                Bucket bucket = buckets.peekLast();
                if (bucket == null || bucket.minute.isBefore(minute)) {
                    bucket = new Bucket(minute);
                    buckets.addLast(bucket);
                } else if (bucket.minute.isAfter(minute)) {
                    bucket = olderBucket(minute);
                }
                bucket.count++;
                if (event.overage()) {
                    bucket.overageCount++;
                }
                if (event.holder() != null && bucket.holders.size() < maxHoldersPerBucket) {
                    bucket.holders.add(event.holder());
                }
                prune(cutoff);
            } finally {
                lock.unlock();
            }
        }

        List<MinuteBucket> buckets(Instant cutoff) {
            lock.lock();
            try {
                prune(cutoff);
                return buckets.stream()
                        .map(b -> new MinuteBucket(poolName, b.minute, b.count, b.overageCount, List.copyOf(b.holders)))
                        .toList();
            } finally {
                lock.unlock();
            }
        }

        // Two concurrent borrows may reach the series in the opposite order across a minute boundary.
        private Bucket olderBucket(Instant minute) {
            for (Iterator<Bucket> it = buckets.descendingIterator(); it.hasNext(); ) {
                Bucket candidate = it.next();
                if (candidate.minute.equals(minute)) {
                    return candidate;
                }
                if (candidate.minute.isBefore(minute)) {
                    break;
                }
            }
            return buckets.peekLast();
        }

        private void prune(Instant cutoff) {
            while (!buckets.isEmpty() && buckets.peekFirst().minute.isBefore(cutoff)) {
                buckets.pollFirst();
            }
        }
    }

    private static final class Bucket {
        private final Instant minute;
        private final Set<String> holders = new LinkedHashSet<>();
        private int count;
        private int overageCount;

        Bucket(Instant minute) {
            this.minute = minute;
        }
    }
}
