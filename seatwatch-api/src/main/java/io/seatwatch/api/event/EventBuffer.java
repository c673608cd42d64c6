package io.seatwatch.api.event;

import java.time.Instant;
import java.util.List;

/**
 * Bounded-duration, per-category event logs plus a per-pool minute series.
 * <p>
 * Entries older than the retention window, or beyond the per-category element cap,
 * are dropped from the oldest end.
 */
public interface EventBuffer {

    /**
     * Append an event and prune expired entries. Never throws: observability must not
     * fail the ledger operation it accompanies.
     */
    void record(LedgerEvent event);

    /**
     * @return events of the category with {@code timestamp >= since}, oldest first
     */
    List<LedgerEvent> recent(EventKind kind, Instant since);

    /**
     * @return minute buckets of the pool within the retention window, oldest first
     */
    List<MinuteBucket> seriesFor(String poolName);

    BufferStats stats();
}
