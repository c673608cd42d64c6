package io.seatwatch.api.pool;

/**
 * The pool cannot hand out another seat right now.
 * This is the expected "unavailable" signal: callers may retry later.
 */
public class CapacityExceededException extends LedgerException {

    private final String poolName;
    private final FailureReason reason;

    public CapacityExceededException(String poolName, FailureReason reason) {
        super("No seats available for " + poolName + " (" + reason.name().toLowerCase() + ")");
        this.poolName = poolName;
        this.reason = reason;
    }

    public String poolName() {
        return poolName;
    }

    public FailureReason reason() {
        return reason;
    }
}
