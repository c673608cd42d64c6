package io.seatwatch.api.stream;

import io.seatwatch.api.event.BufferStats;
import io.seatwatch.api.event.LedgerEvent;
import io.seatwatch.api.event.MinuteBucket;
import io.seatwatch.api.metrics.RateSummary;
import io.seatwatch.api.pool.PoolStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full view of all pools plus derived rates, pushed to observers once per tick.
 * <p>
 * Pools are read one at a time, so a snapshot is not a single cross-pool consistency point.
 * Clients must treat every snapshot as complete state, never as a delta.
 */
public record Snapshot(
        long sequence,
        Instant generatedAt,
        List<PoolStatus> tools,
        RateSummary rates,
        RecentEvents recentEvents,
        Map<String, List<MinuteBucket>> toolMetrics,
        BufferStats bufferStats
) {

    public record RecentEvents(List<LedgerEvent> borrows) {}
}
