package io.seatwatch.core.metrics;

import io.seatwatch.api.event.EventBuffer;
import io.seatwatch.api.event.EventKind;
import io.seatwatch.api.event.LedgerEvent;
import io.seatwatch.api.metrics.RateSummary;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Derives per-minute rates and the overage share from the event buffer on demand.
 * Holds no state of its own.
 */
public class RateAggregator {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final EventBuffer eventBuffer;
    private final Clock clock;

    public RateAggregator(EventBuffer eventBuffer, Clock clock) {
        this.eventBuffer = eventBuffer;
        this.clock = clock;
    }

    public double ratePerMinute(EventKind kind) {
        return ratePerMinute(kind, DEFAULT_WINDOW);
    }

    /**
     * @return events of the kind in the trailing window, scaled to one minute
     */
    public double ratePerMinute(EventKind kind, Duration window) {
        requirePositive(window);
        int count = eventBuffer.recent(kind, windowStart(window)).size();
        return count / minutes(window);
    }

    public double overagePercent() {
        return overagePercent(DEFAULT_WINDOW);
    }

    /**
     * @return share of overage borrows among all borrows in the window, 0 when there were none
     */
    public double overagePercent(Duration window) {
        requirePositive(window);
        List<LedgerEvent> borrows = eventBuffer.recent(EventKind.BORROW, windowStart(window));
        if (borrows.isEmpty()) {
            return 0.0;
        }
        long overage = borrows.stream().filter(LedgerEvent::overage).count();
        return overage * 100.0 / borrows.size();
    }

    public RateSummary summary(Duration window) {
        return new RateSummary(
                ratePerMinute(EventKind.BORROW, window),
                ratePerMinute(EventKind.RETURN, window),
                ratePerMinute(EventKind.FAILURE, window),
                overagePercent(window)
        );
    }

    private Instant windowStart(Duration window) {
        return clock.instant().minus(window);
    }

    private static double minutes(Duration window) {
        return window.toMillis() / 60_000.0;
    }

    private static void requirePositive(Duration window) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Window must be positive");
        }
    }
}
