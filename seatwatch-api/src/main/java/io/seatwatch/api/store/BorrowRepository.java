package io.seatwatch.api.store;

import io.seatwatch.api.pool.BorrowRecord;
import io.seatwatch.api.pool.OverageCharge;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for historical borrows and overage charges.
 * The ledger writes through this interface outside of its critical sections;
 * it never reads pool state back from it.
 */
public interface BorrowRepository {

    void saveBorrow(BorrowRecord record);

    /**
     * Replace the stored record with its returned form.
     */
    void saveReturn(BorrowRecord record);

    void saveCharge(OverageCharge charge);

    Optional<BorrowRecord> findBorrow(String borrowId);

    /**
     * @param poolName null for all pools
     * @return charges, newest first
     */
    List<OverageCharge> findCharges(String poolName);
}
