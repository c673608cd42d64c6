package io.seatwatch.api.pool;

/**
 * Rejected provisioning or reconfiguration request.
 */
public class PoolConfigurationException extends LedgerException {

    public PoolConfigurationException(String message) {
        super(message);
    }
}
