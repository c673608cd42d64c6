package io.seatwatch.core.pool;

import io.seatwatch.api.pool.FailureReason;
import io.seatwatch.api.pool.PoolConfigurationException;
import io.seatwatch.api.pool.PoolDefinition;
import io.seatwatch.api.pool.PoolStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Counters of a single seat pool.
 * <p>
 * Every read and write happens under the pool's own {@code lock}, which covers only
 * the capacity check and the arithmetic. Each mutation also draws a commit ticket under
 * that lock. Observers are notified after {@code lock} is released, one ticket at a time,
 * so notifications leave in commit order. A slow observer delays later notifications of
 * the same pool but never the counters: status reads and capacity checks go on meanwhile.
 */
public class PoolState {

    private static final Logger log = LoggerFactory.getLogger(PoolState.class);

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock journal = new ReentrantLock();
    private final Condition journalTurn = journal.newCondition();

    private int totalCapacity;
    private int commitQuantity;
    private int maxOverage;
    private BigDecimal commitFee;
    private BigDecimal overageUnitPrice;

    private int borrowed;
    private BigDecimal accruedOverageCost = BigDecimal.ZERO;
    private long overageBorrows;
    private boolean active = true;
    private long nextTicket;

    // guarded by journal
    private long journaledTickets;

    public PoolState(PoolDefinition definition) {
        definition.validate();
        this.name = definition.name();
        applyDefinition(definition);
        log.info("Created pool '{}' with {} seats ({} committed, {} overage)",
                name, totalCapacity, commitQuantity, maxOverage);
    }

    public String name() {
        return name;
    }

    /**
     * Try to take one seat. The journal callback sees the decision in commit order.
     */
    public Allocation allocate(Clock clock, Consumer<Allocation> journalCallback) {
        return mutate(() -> {
            Instant at = clock.instant();
            if (!active) {
                return Allocation.refused(FailureReason.INACTIVE, at);
            }
            if (borrowed >= totalCapacity) {
                return Allocation.refused(FailureReason.EXHAUSTED, at);
            }
            boolean overage = borrowed >= commitQuantity;
            if (overage && borrowed - commitQuantity >= maxOverage) {
                return Allocation.refused(FailureReason.MAX_OVERAGE, at);
            }
            borrowed++;
            BigDecimal charge = BigDecimal.ZERO;
            if (overage) {
                overageBorrows++;
                charge = overageUnitPrice;
                accruedOverageCost = accruedOverageCost.add(charge);
            }
            return Allocation.granted(overage, charge, at);
        }, journalCallback);
    }

    /**
     * Give one seat back. Accrued overage cost stays untouched.
     *
     * @return the instant the release was committed
     */
    public Instant release(Clock clock, Consumer<Instant> journalCallback) {
        return mutate(() -> {
            if (borrowed == 0) {
                // Outstanding borrows are tracked by the ledger, so this means a bookkeeping bug.
                log.error("Release on pool '{}' with no borrowed seats", name);
            } else {
                borrowed--;
            }
            return clock.instant();
        }, journalCallback);
    }

    public PoolStatus reconfigure(PoolDefinition definition) {
        definition.validate();
        lock.lock();
        try {
            if (definition.totalCapacity() < borrowed) {
                throw new PoolConfigurationException("Total capacity " + definition.totalCapacity()
                        + " of pool " + name + " cannot be reduced below " + borrowed + " borrowed seats");
            }
            applyDefinition(definition);
            return statusLocked();
        } finally {
            lock.unlock();
        }
    }

    public PoolStatus deactivate() {
        lock.lock();
        try {
            active = false;
            return statusLocked();
        } finally {
            lock.unlock();
        }
    }

    public PoolStatus status() {
        lock.lock();
        try {
            return statusLocked();
        } finally {
            lock.unlock();
        }
    }

    private <T> T mutate(Supplier<T> mutation, Consumer<T> journalCallback) {
        T outcome;
        long ticket;
        lock.lock();
        try {
            outcome = mutation.get();
            ticket = nextTicket++;
        } finally {
            lock.unlock();
        }
        awaitJournalTurn(ticket);
        try {
            journalCallback.accept(outcome);
        } finally {
            endJournalTurn();
        }
        return outcome;
    }

    private void awaitJournalTurn(long ticket) {
        journal.lock();
        try {
            while (journaledTickets != ticket) {
                journalTurn.awaitUninterruptibly();
            }
        } finally {
            journal.unlock();
        }
    }

    private void endJournalTurn() {
        journal.lock();
        try {
            journaledTickets++;
            journalTurn.signalAll();
        } finally {
            journal.unlock();
        }
    }

    private void applyDefinition(PoolDefinition definition) {
        this.totalCapacity = definition.totalCapacity();
        this.commitQuantity = definition.commitQuantity();
        this.maxOverage = definition.maxOverage();
        this.commitFee = definition.commitFee();
        this.overageUnitPrice = definition.overageUnitPrice();
    }

    private PoolStatus statusLocked() {
        int overage = Math.max(0, borrowed - commitQuantity);
        return new PoolStatus(
                name,
                totalCapacity,
                borrowed,
                Math.max(0, totalCapacity - borrowed),
                commitQuantity,
                maxOverage,
                overage,
                borrowed <= commitQuantity,
                commitFee,
                overageUnitPrice,
                accruedOverageCost,
                commitFee.add(accruedOverageCost),
                overageBorrows,
                active
        );
    }
}
