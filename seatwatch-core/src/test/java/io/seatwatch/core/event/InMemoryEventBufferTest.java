package io.seatwatch.core.event;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.seatwatch.api.environment.LedgerConfig;
import io.seatwatch.api.event.BufferStats;
import io.seatwatch.api.event.EventKind;
import io.seatwatch.api.event.LedgerEvent;
import io.seatwatch.api.event.MinuteBucket;
import io.seatwatch.api.pool.FailureReason;
import io.seatwatch.core.MutableClock;
import io.seatwatch.core.metrics.MicrometerLedgerMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEventBufferTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryEventBuffer buffer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        buffer = new InMemoryEventBuffer(LedgerConfig.create().clock(clock).retention(Duration.ofHours(1)));
    }

    // --- record / recent ---

    @Test
    void shouldReturnRecentEventsOldestFirst() {
        buffer.record(borrow("modeler", "alice", START));
        buffer.record(borrow("modeler", "bob", START.plusSeconds(10)));
        buffer.record(borrow("compiler", "carol", START.plusSeconds(20)));
        clock.set(START.plusSeconds(30));

        List<LedgerEvent> recent = buffer.recent(EventKind.BORROW, START.plusSeconds(5));

        assertThat(recent).extracting(LedgerEvent::holder).containsExactly("bob", "carol");
    }

    @Test
    void shouldKeepCategoriesSeparate() {
        buffer.record(borrow("modeler", "alice", START));
        buffer.record(LedgerEvent.returned("modeler", "alice", "b-1", START, false));
        buffer.record(LedgerEvent.failure("modeler", "bob", START, FailureReason.EXHAUSTED));

        assertThat(buffer.recent(EventKind.BORROW, START)).hasSize(1);
        assertThat(buffer.recent(EventKind.RETURN, START)).hasSize(1);
        assertThat(buffer.recent(EventKind.FAILURE, START)).singleElement()
                .satisfies(e -> assertThat(e.failureReason()).isEqualTo(FailureReason.EXHAUSTED));
    }

    @Test
    void shouldClampLateTimestampsToTheNewestEntry() {
        buffer.record(borrow("modeler", "alice", START.plusSeconds(10)));
        buffer.record(borrow("modeler", "bob", START.plusSeconds(5)));
        clock.set(START.plusSeconds(20));

        List<LedgerEvent> recent = buffer.recent(EventKind.BORROW, START);

        assertThat(recent).extracting(LedgerEvent::holder).containsExactly("alice", "bob");
        assertThat(recent).extracting(LedgerEvent::timestamp)
                .containsExactly(START.plusSeconds(10), START.plusSeconds(10));
    }

    // --- retention ---

    @Test
    void shouldPruneEventsOlderThanRetention() {
        buffer.record(borrow("modeler", "alice", START));
        buffer.record(borrow("modeler", "bob", START.plus(Duration.ofMinutes(50))));

        clock.set(START.plus(Duration.ofMinutes(70)));

        assertThat(buffer.recent(EventKind.BORROW, Instant.EPOCH)).extracting(LedgerEvent::holder)
                .containsExactly("bob");
        assertThat(buffer.stats().borrowEvents()).isEqualTo(1);

        clock.set(START.plus(Duration.ofMinutes(115)));
        assertThat(buffer.stats().totalEvents()).isZero();
    }

    @Test
    void shouldCapEventsPerCategoryAndCountDrops() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        var capped = new InMemoryEventBuffer(LedgerConfig.create().clock(clock).maxEventsPerCategory(3),
                new MicrometerLedgerMetrics(registry));

        for (int i = 0; i < 5; i++) {
            capped.record(borrow("modeler", "user-" + i, START));
        }
        capped.record(LedgerEvent.returned("modeler", "user-0", "b-0", START, false));

        assertThat(capped.recent(EventKind.BORROW, START)).extracting(LedgerEvent::holder)
                .containsExactly("user-2", "user-3", "user-4");
        BufferStats stats = capped.stats();
        assertThat(stats.borrowEvents()).isEqualTo(3);
        assertThat(stats.returnEvents()).isEqualTo(1);
        assertThat(stats.totalEvents()).isEqualTo(4);
        assertThat(stats.droppedEvents()).isEqualTo(2);
    }

    @Test
    void shouldSwallowInvalidEventsAndCountThem() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        var counted = new InMemoryEventBuffer(LedgerConfig.create().clock(clock), new MicrometerLedgerMetrics(registry));

        counted.record(null);
        counted.record(new LedgerEvent(EventKind.BORROW, "modeler", "alice", "b-1", null, false, null));

        assertThat(counted.stats().totalEvents()).isZero();
        assertThat(registry.find("seatwatch.buffer.append.failures").counter().count()).isEqualTo(2.0);
    }

    // --- minute series ---

    @Test
    void shouldAggregateBorrowsIntoMinuteBuckets() {
        buffer.record(borrow("modeler", "alice", START.plusSeconds(5)));
        buffer.record(LedgerEvent.borrow("modeler", "bob", "b-2", START.plusSeconds(30), true));
        buffer.record(borrow("modeler", "alice", START.plusSeconds(50)));
        buffer.record(borrow("modeler", "carol", START.plusSeconds(65)));
        buffer.record(borrow("compiler", "dave", START.plusSeconds(70)));
        clock.set(START.plusSeconds(90));

        List<MinuteBucket> series = buffer.seriesFor("modeler");

        assertThat(series).hasSize(2);
        MinuteBucket first = series.get(0);
        assertThat(first.timestamp()).isEqualTo(START);
        assertThat(first.count()).isEqualTo(3);
        assertThat(first.overageCount()).isEqualTo(1);
        assertThat(first.users()).containsExactly("alice", "bob");
        assertThat(series.get(1).timestamp()).isEqualTo(START.plusSeconds(60));
        assertThat(series.get(1).users()).containsExactly("carol");

        assertThat(buffer.seriesFor("compiler")).hasSize(1);
        assertThat(buffer.seriesFor("unknown")).isEmpty();
        assertThat(buffer.stats().trackedPools()).isEqualTo(2);
    }

    @Test
    void shouldCapHoldersPerBucket() {
        var small = new InMemoryEventBuffer(LedgerConfig.create().clock(clock).maxHoldersPerBucket(2));
        for (int i = 0; i < 5; i++) {
            small.record(borrow("modeler", "user-" + i, START));
        }

        MinuteBucket bucket = small.seriesFor("modeler").get(0);
        assertThat(bucket.count()).isEqualTo(5);
        assertThat(bucket.users()).containsExactly("user-0", "user-1");
    }

    @Test
    void shouldPruneOldBuckets() {
        buffer.record(borrow("modeler", "alice", START));
        buffer.record(borrow("modeler", "bob", START.plus(Duration.ofMinutes(45))));

        clock.set(START.plus(Duration.ofMinutes(75)));

        assertThat(buffer.seriesFor("modeler")).singleElement()
                .satisfies(b -> assertThat(b.users()).containsExactly("bob"));
    }

    // --- Helpers ---

    private static LedgerEvent borrow(String pool, String holder, Instant at) {
        return LedgerEvent.borrow(pool, holder, "b-" + holder, at, false);
    }
}
