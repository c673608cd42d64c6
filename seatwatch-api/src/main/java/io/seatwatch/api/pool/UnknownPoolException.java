package io.seatwatch.api.pool;

public class UnknownPoolException extends LedgerException {

    private final String poolName;

    public UnknownPoolException(String poolName) {
        super("Pool not found: " + poolName);
        this.poolName = poolName;
    }

    public String poolName() {
        return poolName;
    }
}
