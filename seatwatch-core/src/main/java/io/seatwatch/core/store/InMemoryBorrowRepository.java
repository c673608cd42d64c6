package io.seatwatch.core.store;

import io.seatwatch.api.pool.BorrowRecord;
import io.seatwatch.api.pool.OverageCharge;
import io.seatwatch.api.store.BorrowRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Repository kept in process memory. Used by the default server and by tests.
 */
public class InMemoryBorrowRepository implements BorrowRepository {

    private final Map<String, BorrowRecord> borrows = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<OverageCharge> charges = new ConcurrentLinkedQueue<>();

    @Override
    public void saveBorrow(BorrowRecord record) {
        // a fast return may already have stored the returned form
        borrows.putIfAbsent(record.id(), record);
    }

    @Override
    public void saveReturn(BorrowRecord record) {
        borrows.put(record.id(), record);
    }

    @Override
    public void saveCharge(OverageCharge charge) {
        charges.add(charge);
    }

    @Override
    public Optional<BorrowRecord> findBorrow(String borrowId) {
        return Optional.ofNullable(borrows.get(borrowId));
    }

    @Override
    public List<OverageCharge> findCharges(String poolName) {
        return charges.stream()
                .filter(c -> poolName == null || poolName.equals(c.poolName()))
                .sorted(Comparator.comparing(OverageCharge::chargedAt).reversed())
                .toList();
    }
}
