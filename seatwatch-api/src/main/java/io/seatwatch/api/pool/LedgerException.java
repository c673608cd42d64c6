package io.seatwatch.api.pool;

/**
 * Base type for errors returned synchronously by the pool ledger.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }
}
