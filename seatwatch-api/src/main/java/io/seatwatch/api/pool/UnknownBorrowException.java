package io.seatwatch.api.pool;

/**
 * Return of an id that is not outstanding: already returned or never issued.
 */
public class UnknownBorrowException extends LedgerException {

    private final String borrowId;

    public UnknownBorrowException(String borrowId) {
        super("Borrow record not found: " + borrowId);
        this.borrowId = borrowId;
    }

    public String borrowId() {
        return borrowId;
    }
}
