package io.seatwatch.core.pool;

import io.seatwatch.api.event.EventBuffer;
import io.seatwatch.api.event.LedgerEvent;
import io.seatwatch.api.metrics.LedgerMetrics;
import io.seatwatch.api.pool.BorrowRecord;
import io.seatwatch.api.pool.BorrowResult;
import io.seatwatch.api.pool.CapacityExceededException;
import io.seatwatch.api.pool.FailureReason;
import io.seatwatch.api.pool.OverageCharge;
import io.seatwatch.api.pool.PoolDefinition;
import io.seatwatch.api.pool.PoolLedger;
import io.seatwatch.api.pool.PoolStatus;
import io.seatwatch.api.pool.UnknownBorrowException;
import io.seatwatch.api.pool.UnknownPoolException;
import io.seatwatch.api.store.BorrowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default ledger: per-pool locking over a {@link PoolManager} registry.
 * <p>
 * Outstanding borrows live in a concurrent map owned by this ledger. Removing an id
 * from that map is what makes a return valid, so a second return of the same id can
 * never decrement a pool twice. Events go to the buffer in commit order per pool;
 * repository writes happen after every lock is released.
 */
public class DefaultPoolLedger implements PoolLedger {

    private static final Logger log = LoggerFactory.getLogger(DefaultPoolLedger.class);

    private final PoolManager poolManager;
    private final EventBuffer eventBuffer;
    private final BorrowRepository repository;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final Map<String, BorrowRecord> outstanding = new ConcurrentHashMap<>();

    public DefaultPoolLedger(PoolManager poolManager, EventBuffer eventBuffer, BorrowRepository repository,
                             LedgerMetrics metrics, Clock clock) {
        this.poolManager = poolManager;
        this.eventBuffer = eventBuffer;
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public BorrowResult borrow(String poolName, String holder) {
        if (holder == null || holder.isBlank()) {
            throw new IllegalArgumentException("Holder must not be blank");
        }
        long started = System.nanoTime();

        Optional<PoolState> found = poolManager.find(poolName);
        if (found.isEmpty()) {
            recordEvent(LedgerEvent.failure(poolName, holder, clock.instant(), FailureReason.UNKNOWN_POOL));
            metrics.recordFailure(poolName, FailureReason.UNKNOWN_POOL, elapsedSince(started));
            log.warn("borrow failed pool={} holder={} reason=unknown_pool", poolName, holder);
            throw new UnknownPoolException(poolName);
        }

        PoolState pool = found.get();
        String borrowId = UUID.randomUUID().toString();
        Allocation allocation = pool.allocate(clock, a -> recordEvent(a.granted()
                ? LedgerEvent.borrow(poolName, holder, borrowId, a.at(), a.overage())
                : LedgerEvent.failure(poolName, holder, a.at(), a.reason())));

        if (!allocation.granted()) {
            metrics.recordFailure(poolName, allocation.reason(), elapsedSince(started));
            log.warn("borrow failed pool={} holder={} reason={}", poolName, holder,
                    allocation.reason().name().toLowerCase());
            throw new CapacityExceededException(poolName, allocation.reason());
        }

        BorrowRecord record = new BorrowRecord(borrowId, poolName, holder, allocation.at(), null, allocation.overage());
        outstanding.put(borrowId, record);
        metrics.recordBorrow(poolName, allocation.overage(), elapsedSince(started));
        persist(record, allocation);

        log.debug("borrow success pool={} holder={} id={}{}", poolName, holder, borrowId,
                allocation.overage() ? " (overage)" : "");
        return new BorrowResult(borrowId, poolName, holder, allocation.at(), allocation.overage());
    }

    @Override
    public BorrowRecord returnBorrow(String borrowId) {
        BorrowRecord record = borrowId == null ? null : outstanding.remove(borrowId);
        if (record == null) {
            log.warn("return failed id={} not_found=1", borrowId);
            throw new UnknownBorrowException(borrowId);
        }

        PoolState pool = poolManager.pool(record.poolName());
        Instant returnedAt = pool.release(clock, at -> recordEvent(
                LedgerEvent.returned(record.poolName(), record.holder(), record.id(), at, record.overage())));

        BorrowRecord returned = record.returned(returnedAt);
        metrics.recordReturn(record.poolName());
        try {
            repository.saveReturn(returned);
        } catch (RuntimeException e) {
            log.error("Failed to persist return of borrow {}", borrowId, e);
        }
        log.debug("return success id={} pool={}", borrowId, record.poolName());
        return returned;
    }

    @Override
    public PoolStatus status(String poolName) {
        return poolManager.pool(poolName).status();
    }

    @Override
    public List<PoolStatus> statusAll() {
        return poolManager.allPools().stream()
                .map(PoolState::status)
                .toList();
    }

    @Override
    public List<String> poolNames() {
        return poolManager.names();
    }

    @Override
    public PoolStatus provision(PoolDefinition definition) {
        PoolState pool = poolManager.register(definition);
        metrics.bindPool(pool.name(), pool::status);
        return pool.status();
    }

    @Override
    public PoolStatus reconfigure(PoolDefinition definition) {
        PoolStatus status = poolManager.pool(definition.name()).reconfigure(definition);
        log.info("budget updated pool={} total={} commit={} max_overage={} commit_fee={} overage_price={}",
                status.tool(), status.total(), status.commit(), status.maxOverage(),
                status.commitPrice(), status.overagePricePerLicense());
        return status;
    }

    @Override
    public PoolStatus deactivate(String poolName) {
        PoolStatus status = poolManager.pool(poolName).deactivate();
        log.info("Pool '{}' deactivated with {} seats still borrowed", poolName, status.borrowed());
        return status;
    }

    @Override
    public List<BorrowRecord> outstanding(Optional<String> holder) {
        return outstanding.values().stream()
                .filter(r -> holder.map(h -> h.equals(r.holder())).orElse(true))
                .sorted(Comparator.comparing(BorrowRecord::borrowedAt).reversed())
                .toList();
    }

    @Override
    public List<OverageCharge> overageCharges(Optional<String> poolName) {
        return repository.findCharges(poolName.orElse(null));
    }

    private void persist(BorrowRecord record, Allocation allocation) {
        try {
            repository.saveBorrow(record);
            if (allocation.overage() && allocation.charge().signum() > 0) {
                repository.saveCharge(new OverageCharge(UUID.randomUUID().toString(), record.poolName(),
                        record.id(), record.holder(), allocation.at(), allocation.charge()));
            }
        } catch (RuntimeException e) {
            log.error("Failed to persist borrow {} of pool {}", record.id(), record.poolName(), e);
        }
    }

    private void recordEvent(LedgerEvent event) {
        try {
            eventBuffer.record(event);
        } catch (RuntimeException e) {
            metrics.recordBufferAppendFailure();
            log.warn("Event buffer rejected {} event for pool {}", event.kind(), event.poolName(), e);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
