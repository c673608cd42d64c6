package io.seatwatch.core.pool;

import io.seatwatch.api.pool.PoolConfigurationException;
import io.seatwatch.api.pool.PoolDefinition;
import io.seatwatch.api.pool.UnknownPoolException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of pool states, one per pool name.
 * Owned by exactly one ledger; pools are added but never removed.
 */
public class PoolManager {

    private final Map<String, PoolState> pools = new ConcurrentHashMap<>();

    /**
     * Create a pool.
     *
     * @throws PoolConfigurationException if the name is taken
     */
    public PoolState register(PoolDefinition definition) {
        PoolState candidate = new PoolState(definition);
        PoolState existing = pools.putIfAbsent(definition.name(), candidate);
        if (existing != null) {
            throw new PoolConfigurationException("Pool already exists: " + definition.name());
        }
        return candidate;
    }

    /**
     * Get the state of a specific pool.
     */
    public PoolState pool(String poolName) {
        return find(poolName).orElseThrow(() -> new UnknownPoolException(poolName));
    }

    public Optional<PoolState> find(String poolName) {
        if (poolName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pools.get(poolName));
    }

    /**
     * @return all pools ordered by name
     */
    public List<PoolState> allPools() {
        return pools.values().stream()
                .sorted(Comparator.comparing(PoolState::name))
                .toList();
    }

    public List<String> names() {
        return pools.keySet().stream().sorted().toList();
    }

    public int size() {
        return pools.size();
    }
}
