package io.seatwatch.api.pool;

import java.util.List;
import java.util.Optional;

/**
 * Authoritative in-memory state of every seat pool.
 * <p>
 * Every mutation of a pool is committed under that pool's own lock, so unrelated
 * pools never serialize each other. Each successful or refused borrow and each
 * return is also reported to the event buffer, best-effort.
 */
public interface PoolLedger {

    /**
     * Allocate one seat.
     *
     * @param poolName name of the pool
     * @param holder   free-form identity of the borrower
     * @return the new borrow, flagged as overage if the pool was at or above its commit quantity
     * @throws CapacityExceededException if no seat can be handed out
     * @throws UnknownPoolException      if the pool does not exist
     */
    BorrowResult borrow(String poolName, String holder);

    /**
     * Return an outstanding borrow. Accrued overage cost is never reversed.
     *
     * @param borrowId id from {@link BorrowResult#borrowId()}
     * @return the returned record, with {@code returnedAt} set
     * @throws UnknownBorrowException if the id is not outstanding
     */
    BorrowRecord returnBorrow(String borrowId);

    /**
     * @throws UnknownPoolException if the pool does not exist
     */
    PoolStatus status(String poolName);

    /**
     * @return status of every pool, ordered by name
     */
    List<PoolStatus> statusAll();

    /**
     * @return pool names, ordered
     */
    List<String> poolNames();

    /**
     * Create a new pool.
     *
     * @throws PoolConfigurationException if a pool with the same name exists
     */
    PoolStatus provision(PoolDefinition definition);

    /**
     * Replace the capacity and price settings of an existing pool.
     * Borrow count and accrued cost are kept.
     *
     * @throws PoolConfigurationException if the new capacity is below the current borrow count
     * @throws UnknownPoolException       if the pool does not exist
     */
    PoolStatus reconfigure(PoolDefinition definition);

    /**
     * Soft-deactivate a pool: new borrows are refused, returns still succeed.
     */
    PoolStatus deactivate(String poolName);

    /**
     * @param holder optional holder filter
     * @return outstanding borrows, newest first
     */
    List<BorrowRecord> outstanding(Optional<String> holder);

    /**
     * @param poolName optional pool filter
     * @return overage charges, newest first
     */
    List<OverageCharge> overageCharges(Optional<String> poolName);
}
