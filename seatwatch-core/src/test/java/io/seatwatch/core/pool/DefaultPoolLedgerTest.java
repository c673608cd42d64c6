package io.seatwatch.core.pool;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.seatwatch.api.environment.LedgerConfig;
import io.seatwatch.api.event.BufferStats;
import io.seatwatch.api.event.EventBuffer;
import io.seatwatch.api.event.EventKind;
import io.seatwatch.api.event.LedgerEvent;
import io.seatwatch.api.event.MinuteBucket;
import io.seatwatch.api.pool.BorrowRecord;
import io.seatwatch.api.pool.BorrowResult;
import io.seatwatch.api.pool.CapacityExceededException;
import io.seatwatch.api.pool.FailureReason;
import io.seatwatch.api.pool.OverageCharge;
import io.seatwatch.api.pool.PoolConfigurationException;
import io.seatwatch.api.pool.PoolDefinition;
import io.seatwatch.api.pool.PoolStatus;
import io.seatwatch.api.pool.UnknownBorrowException;
import io.seatwatch.api.pool.UnknownPoolException;
import io.seatwatch.api.store.BorrowRepository;
import io.seatwatch.core.MutableClock;
import io.seatwatch.core.event.InMemoryEventBuffer;
import io.seatwatch.core.metrics.MicrometerLedgerMetrics;
import io.seatwatch.core.store.InMemoryBorrowRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class DefaultPoolLedgerTest {

    private MutableClock clock;
    private LedgerConfig config;
    private InMemoryEventBuffer buffer;
    private InMemoryBorrowRepository repository;
    private SimpleMeterRegistry registry;
    private MicrometerLedgerMetrics metrics;
    private DefaultPoolLedger ledger;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        config = LedgerConfig.create().clock(clock);
        buffer = new InMemoryEventBuffer(config);
        repository = new InMemoryBorrowRepository();
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerLedgerMetrics(registry);
        ledger = newLedger(buffer, repository);
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        registry.close();
    }

    // --- borrow ---

    @Test
    void shouldGrantCommitThenOverageAndRefuseWhenExhausted() {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(20).commitQuantity(5)
                .commitFee(new BigDecimal("5000")).overageUnitPrice(new BigDecimal("500")));

        List<BorrowResult> results = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            results.add(ledger.borrow("modeler", "user-" + i));
        }

        assertThat(results).filteredOn(BorrowResult::overage).hasSize(15);
        assertThat(results.subList(0, 5)).noneMatch(BorrowResult::overage);

        assertThatThrownBy(() -> ledger.borrow("modeler", "late"))
                .isInstanceOf(CapacityExceededException.class)
                .satisfies(e -> assertThat(((CapacityExceededException) e).reason()).isEqualTo(FailureReason.EXHAUSTED));

        PoolStatus status = ledger.status("modeler");
        assertThat(status.borrowed()).isEqualTo(20);
        assertThat(status.available()).isZero();
        assertThat(status.overage()).isEqualTo(15);
        assertThat(status.currentOverageCost()).isEqualByComparingTo("7500");
        assertThat(status.totalCost()).isEqualByComparingTo("12500");

        BufferStats stats = buffer.stats();
        assertThat(stats.borrowEvents()).isEqualTo(20);
        assertThat(stats.failureEvents()).isEqualTo(1);
    }

    @Test
    void shouldRefuseBeyondMaxOverage() {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(10).commitQuantity(2).maxOverage(3));

        for (int i = 0; i < 5; i++) {
            ledger.borrow("modeler", "user-" + i);
        }

        assertThatThrownBy(() -> ledger.borrow("modeler", "late"))
                .isInstanceOf(CapacityExceededException.class)
                .satisfies(e -> assertThat(((CapacityExceededException) e).reason()).isEqualTo(FailureReason.MAX_OVERAGE));
        assertThat(ledger.status("modeler").borrowed()).isEqualTo(5);

        List<LedgerEvent> failures = buffer.recent(EventKind.FAILURE, Instant.EPOCH);
        assertThat(failures).singleElement()
                .satisfies(e -> {
                    assertThat(e.failureReason()).isEqualTo(FailureReason.MAX_OVERAGE);
                    assertThat(e.overage()).isTrue();
                    assertThat(e.holder()).isEqualTo("late");
                });
    }

    @Test
    void shouldGrantExactlyOneOfTwoRacingBorrowsForTheLastSeat() throws Exception {
        for (int round = 0; round < 50; round++) {
            String pool = "single-" + round;
            ledger.provision(PoolDefinition.named(pool).totalCapacity(1).commitQuantity(1));
            CyclicBarrier barrier = new CyclicBarrier(2);
            AtomicInteger granted = new AtomicInteger();
            AtomicInteger refused = new AtomicInteger();

            List<CompletableFuture<Void>> racers = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                String holder = "racer-" + i;
                racers.add(CompletableFuture.runAsync(() -> {
                    try {
                        barrier.await(5, TimeUnit.SECONDS);
                        ledger.borrow(pool, holder);
                        granted.incrementAndGet();
                    } catch (CapacityExceededException e) {
                        refused.incrementAndGet();
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                }, executor));
            }
            CompletableFuture.allOf(racers.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

            assertThat(granted.get()).isEqualTo(1);
            assertThat(refused.get()).isEqualTo(1);
            assertThat(ledger.status(pool).borrowed()).isEqualTo(1);
        }
    }

    @Test
    void shouldRejectUnknownPoolAndRecordFailure() {
        assertThatThrownBy(() -> ledger.borrow("missing", "alice"))
                .isInstanceOf(UnknownPoolException.class);

        assertThat(buffer.recent(EventKind.FAILURE, Instant.EPOCH)).singleElement()
                .satisfies(e -> assertThat(e.failureReason()).isEqualTo(FailureReason.UNKNOWN_POOL));
        assertThat(registry.find("seatwatch.borrow.failure").tag("reason", "unknown_pool").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldRejectBlankHolder() {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(1).commitQuantity(1));

        assertThatThrownBy(() -> ledger.borrow("modeler", " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ledger.status("modeler").borrowed()).isZero();
    }

    // --- return ---

    @Test
    void shouldRestoreCountsAfterReturnButKeepAccruedCost() {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(3).commitQuantity(1)
                .overageUnitPrice(new BigDecimal("40")));
        BorrowResult first = ledger.borrow("modeler", "alice");
        BorrowResult second = ledger.borrow("modeler", "bob");
        assertThat(second.overage()).isTrue();

        clock.advance(Duration.ofMinutes(5));
        BorrowRecord returned = ledger.returnBorrow(second.borrowId());
        ledger.returnBorrow(first.borrowId());

        assertThat(returned.returnedAt()).isEqualTo(clock.instant());
        assertThat(returned.overage()).isTrue();

        PoolStatus status = ledger.status("modeler");
        assertThat(status.borrowed()).isZero();
        assertThat(status.overage()).isZero();
        assertThat(status.currentOverageCost()).isEqualByComparingTo("40");
        assertThat(status.overageBorrows()).isEqualTo(1);
        assertThat(buffer.stats().returnEvents()).isEqualTo(2);
        assertThat(repository.findBorrow(first.borrowId())).get()
                .satisfies(r -> assertThat(r.outstanding()).isFalse());
    }

    @Test
    void shouldRejectSecondReturnOfTheSameBorrow() {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(2).commitQuantity(2));
        BorrowResult kept = ledger.borrow("modeler", "alice");
        BorrowResult borrow = ledger.borrow("modeler", "bob");

        ledger.returnBorrow(borrow.borrowId());

        assertThatThrownBy(() -> ledger.returnBorrow(borrow.borrowId()))
                .isInstanceOf(UnknownBorrowException.class);
        assertThatThrownBy(() -> ledger.returnBorrow("never-issued"))
                .isInstanceOf(UnknownBorrowException.class);
        assertThat(ledger.status("modeler").borrowed()).isEqualTo(1);
        assertThat(ledger.outstanding(Optional.empty())).extracting(BorrowRecord::id)
                .containsExactly(kept.borrowId());
    }

    @Test
    void shouldReturnConcurrentlyOnlyOnce() throws Exception {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(5).commitQuantity(5));
        ledger.borrow("modeler", "alice");
        BorrowResult borrow = ledger.borrow("modeler", "bob");
        AtomicInteger succeeded = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(8);

        for (int i = 0; i < 8; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    ledger.returnBorrow(borrow.borrowId());
                    succeeded.incrementAndGet();
                } catch (UnknownBorrowException e) {
                    // expected for all but one
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();

        assertThat(succeeded.get()).isEqualTo(1);
        assertThat(ledger.status("modeler").borrowed()).isEqualTo(1);
    }

    // --- concurrency ---

    @Test
    void shouldKeepCountsConsistentUnderConcurrentBorrowsAndReturns() throws Exception {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(6).commitQuantity(2));
        ledger.provision(PoolDefinition.named("compiler").totalCapacity(3).commitQuantity(3));
        CountDownLatch done = new CountDownLatch(8);

        for (int t = 0; t < 8; t++) {
            String holder = "worker-" + t;
            executor.submit(() -> {
                try {
                    List<String> held = new ArrayList<>();
                    for (int i = 0; i < 200; i++) {
                        String pool = i % 2 == 0 ? "modeler" : "compiler";
                        try {
                            held.add(ledger.borrow(pool, holder).borrowId());
                        } catch (CapacityExceededException e) {
                            // pool full, keep going
                        }
                        if (!held.isEmpty() && ThreadLocalRandom.current().nextBoolean()) {
                            ledger.returnBorrow(held.remove(0));
                        }
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();

        int outstandingTotal = ledger.outstanding(Optional.empty()).size();
        int borrowedTotal = ledger.statusAll().stream().mapToInt(PoolStatus::borrowed).sum();
        assertThat(borrowedTotal).isEqualTo(outstandingTotal);
        for (PoolStatus status : ledger.statusAll()) {
            assertThat(status.borrowed()).isBetween(0, status.total());
            assertThat(status.available()).isEqualTo(status.total() - status.borrowed());
        }

        BufferStats stats = buffer.stats();
        assertThat(stats.borrowEvents() - stats.returnEvents()).isEqualTo(borrowedTotal);
    }

    @Test
    void shouldNotBlockOtherPoolsWhileOneIsJournaling() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        EventBuffer blocking = new DelegatingBuffer(buffer) {
            @Override
            public void record(LedgerEvent event) {
                if ("slow".equals(event.poolName())) {
                    entered.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                super.record(event);
            }
        };
        DefaultPoolLedger blockingLedger = newLedger(blocking, repository);
        blockingLedger.provision(PoolDefinition.named("slow").totalCapacity(5).commitQuantity(5));
        blockingLedger.provision(PoolDefinition.named("fast").totalCapacity(5).commitQuantity(5));

        CompletableFuture<BorrowResult> slowBorrow =
                CompletableFuture.supplyAsync(() -> blockingLedger.borrow("slow", "alice"), executor);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<BorrowResult> fastBorrow =
                CompletableFuture.supplyAsync(() -> blockingLedger.borrow("fast", "bob"), executor);
        assertThat(fastBorrow.get(2, TimeUnit.SECONDS).poolName()).isEqualTo("fast");

        CompletableFuture<PoolStatus> slowStatus =
                CompletableFuture.supplyAsync(() -> blockingLedger.status("slow"), executor);
        assertThat(slowStatus.get(2, TimeUnit.SECONDS).borrowed()).isEqualTo(1);
        assertThat(slowBorrow).isNotDone();

        release.countDown();
        assertThat(slowBorrow.get(5, TimeUnit.SECONDS).poolName()).isEqualTo("slow");
    }

    @Test
    void shouldServeStatusOfSamePoolWhileBorrowersWaitForJournal() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        EventBuffer blocking = new DelegatingBuffer(buffer) {
            @Override
            public void record(LedgerEvent event) {
                if ("alice".equals(event.holder())) {
                    entered.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                super.record(event);
            }
        };
        DefaultPoolLedger blockingLedger = newLedger(blocking, repository);
        blockingLedger.provision(PoolDefinition.named("shared").totalCapacity(5).commitQuantity(5));

        CompletableFuture<BorrowResult> first =
                CompletableFuture.supplyAsync(() -> blockingLedger.borrow("shared", "alice"), executor);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<BorrowResult> second =
                CompletableFuture.supplyAsync(() -> blockingLedger.borrow("shared", "bob"), executor);

        // status must answer even though bob's event is queued behind alice's append
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertThat(
                CompletableFuture.supplyAsync(() -> blockingLedger.status("shared"), executor)
                        .get(1, TimeUnit.SECONDS).borrowed()).isEqualTo(2));
        assertThat(first).isNotDone();
        assertThat(second).isNotDone();

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).holder()).isEqualTo("alice");
        assertThat(second.get(5, TimeUnit.SECONDS).holder()).isEqualTo("bob");
        assertThat(buffer.recent(EventKind.BORROW, Instant.EPOCH)).extracting(LedgerEvent::holder)
                .containsExactly("alice", "bob");
    }

    // --- failure isolation ---

    @Test
    void shouldCompleteBorrowWhenEventBufferFails() {
        EventBuffer failing = new DelegatingBuffer(buffer) {
            @Override
            public void record(LedgerEvent event) {
                throw new IllegalStateException("buffer down");
            }
        };
        DefaultPoolLedger isolated = newLedger(failing, repository);
        isolated.provision(PoolDefinition.named("modeler").totalCapacity(2).commitQuantity(2));

        BorrowResult result = isolated.borrow("modeler", "alice");
        isolated.returnBorrow(result.borrowId());

        assertThat(isolated.status("modeler").borrowed()).isZero();
        assertThat(registry.find("seatwatch.buffer.append.failures").counter().count()).isEqualTo(2.0);
    }

    @Test
    void shouldCompleteBorrowWhenRepositoryFails() {
        BorrowRepository broken = new InMemoryBorrowRepository() {
            @Override
            public void saveBorrow(BorrowRecord record) {
                throw new IllegalStateException("disk full");
            }
        };
        DefaultPoolLedger isolated = newLedger(buffer, broken);
        isolated.provision(PoolDefinition.named("modeler").totalCapacity(2).commitQuantity(2));

        BorrowResult result = isolated.borrow("modeler", "alice");

        assertThat(result.borrowId()).isNotBlank();
        assertThat(isolated.status("modeler").borrowed()).isEqualTo(1);
    }

    // --- administration ---

    @Test
    void shouldRefuseReconfigurationBelowBorrowedCount() {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(5).commitQuantity(2));
        for (int i = 0; i < 4; i++) {
            ledger.borrow("modeler", "user-" + i);
        }

        assertThatThrownBy(() -> ledger.reconfigure(PoolDefinition.named("modeler").totalCapacity(3).commitQuantity(1)))
                .isInstanceOf(PoolConfigurationException.class);

        PoolStatus grown = ledger.reconfigure(PoolDefinition.named("modeler").totalCapacity(8).commitQuantity(4)
                .commitFee(new BigDecimal("900")));
        assertThat(grown.total()).isEqualTo(8);
        assertThat(grown.commit()).isEqualTo(4);
        assertThat(grown.borrowed()).isEqualTo(4);
        assertThat(grown.inCommit()).isTrue();
        assertThat(grown.commitPrice()).isEqualByComparingTo("900");
    }

    @Test
    void shouldRefuseBorrowsOnDeactivatedPoolButAcceptReturns() {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(5).commitQuantity(2));
        BorrowResult borrow = ledger.borrow("modeler", "alice");

        PoolStatus deactivated = ledger.deactivate("modeler");
        assertThat(deactivated.active()).isFalse();

        assertThatThrownBy(() -> ledger.borrow("modeler", "bob"))
                .isInstanceOf(CapacityExceededException.class)
                .satisfies(e -> assertThat(((CapacityExceededException) e).reason()).isEqualTo(FailureReason.INACTIVE));

        ledger.returnBorrow(borrow.borrowId());
        assertThat(ledger.status("modeler").borrowed()).isZero();
    }

    @Test
    void shouldRecordOverageChargesPerPool() {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(4).commitQuantity(1)
                .overageUnitPrice(new BigDecimal("25")));
        ledger.provision(PoolDefinition.named("compiler").totalCapacity(4).commitQuantity(1)
                .overageUnitPrice(new BigDecimal("70")));
        ledger.provision(PoolDefinition.named("free").totalCapacity(4).commitQuantity(1));

        for (int i = 0; i < 3; i++) {
            ledger.borrow("modeler", "alice");
            clock.advance(Duration.ofSeconds(1));
        }
        ledger.borrow("compiler", "bob");
        BorrowResult overage = ledger.borrow("compiler", "bob");
        ledger.borrow("free", "carol");
        ledger.borrow("free", "carol");
        ledger.returnBorrow(overage.borrowId());

        List<OverageCharge> modeler = ledger.overageCharges(Optional.of("modeler"));
        assertThat(modeler).hasSize(2).allSatisfy(c -> assertThat(c.amount()).isEqualByComparingTo("25"));
        assertThat(modeler.get(0).chargedAt()).isAfter(modeler.get(1).chargedAt());

        assertThat(ledger.overageCharges(Optional.of("compiler"))).singleElement()
                .satisfies(c -> assertThat(c.borrowId()).isEqualTo(overage.borrowId()));
        assertThat(ledger.overageCharges(Optional.of("free"))).isEmpty();
        assertThat(ledger.overageCharges(Optional.empty())).hasSize(3);
    }

    @Test
    void shouldListOutstandingBorrowsByHolder() {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(5).commitQuantity(5));
        ledger.borrow("modeler", "alice");
        clock.advance(Duration.ofSeconds(1));
        BorrowResult latest = ledger.borrow("modeler", "alice");
        ledger.borrow("modeler", "bob");

        assertThat(ledger.outstanding(Optional.of("alice"))).hasSize(2)
                .first().extracting(BorrowRecord::id).isEqualTo(latest.borrowId());
        assertThat(ledger.outstanding(Optional.of("nobody"))).isEmpty();
        assertThat(ledger.outstanding(Optional.empty())).hasSize(3);
    }

    @Test
    void shouldExposeSeatGaugesForProvisionedPools() {
        ledger.provision(PoolDefinition.named("modeler").totalCapacity(5).commitQuantity(2));
        ledger.borrow("modeler", "alice");

        assertThat(registry.find("seatwatch.seats.borrowed").tag("pool", "modeler").gauge().value()).isEqualTo(1.0);
        assertThat(registry.find("seatwatch.seats.total").tag("pool", "modeler").gauge().value()).isEqualTo(5.0);
    }

    // --- Helpers ---

    private DefaultPoolLedger newLedger(EventBuffer eventBuffer, BorrowRepository borrowRepository) {
        return new DefaultPoolLedger(new PoolManager(), eventBuffer, borrowRepository, metrics, clock);
    }

    private static class DelegatingBuffer implements EventBuffer {

        private final EventBuffer delegate;

        DelegatingBuffer(EventBuffer delegate) {
            this.delegate = delegate;
        }

        @Override
        public void record(LedgerEvent event) {
            delegate.record(event);
        }

        @Override
        public List<LedgerEvent> recent(EventKind kind, Instant since) {
            return delegate.recent(kind, since);
        }

        @Override
        public List<MinuteBucket> seriesFor(String poolName) {
            return delegate.seriesFor(poolName);
        }

        @Override
        public BufferStats stats() {
            return delegate.stats();
        }
    }
}
