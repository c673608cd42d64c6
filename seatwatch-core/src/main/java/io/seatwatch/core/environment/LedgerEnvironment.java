package io.seatwatch.core.environment;

import io.seatwatch.api.environment.LedgerConfig;
import io.seatwatch.api.event.EventBuffer;
import io.seatwatch.api.metrics.LedgerMetrics;
import io.seatwatch.api.pool.PoolDefinition;
import io.seatwatch.api.pool.PoolLedger;
import io.seatwatch.api.store.BorrowRepository;
import io.seatwatch.api.stream.StreamingSession;
import io.seatwatch.core.event.InMemoryEventBuffer;
import io.seatwatch.core.metrics.MicrometerLedgerMetrics;
import io.seatwatch.core.metrics.RateAggregator;
import io.seatwatch.core.pool.DefaultPoolLedger;
import io.seatwatch.core.pool.PoolManager;
import io.seatwatch.core.store.InMemoryBorrowRepository;
import io.seatwatch.core.stream.SessionManager;
import io.seatwatch.core.stream.SnapshotCodec;
import io.seatwatch.core.stream.SnapshotPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the ledger, event buffer, aggregator, publisher and session manager from one
 * {@link LedgerConfig}. Each environment owns its own pool registry; there are no singletons.
 * <p>
 * Usage:
 * <pre>{@code
 * var config = LedgerConfig.create()
 *     .pool(PoolDefinition.named("Greenhills - Multi 8.2").totalCapacity(20).commitQuantity(5)
 *         .overageUnitPrice(new BigDecimal("800")))
 *     .publishInterval(Duration.ofSeconds(1));
 *
 * var env = new LedgerEnvironment(config);
 * env.start();
 *
 * BorrowResult borrow = env.ledger().borrow("Greenhills - Multi 8.2", "alice");
 * env.ledger().returnBorrow(borrow.borrowId());
 * }</pre>
 */
public class LedgerEnvironment {

    private static final Logger log = LoggerFactory.getLogger(LedgerEnvironment.class);

    private final LedgerConfig config;
    private final LedgerMetrics metrics;
    private final EventBuffer eventBuffer;
    private final PoolLedger ledger;
    private final RateAggregator rateAggregator;
    private final SessionManager sessionManager;
    private final SnapshotPublisher publisher;

    public LedgerEnvironment(LedgerConfig config) {
        this(config, new MicrometerLedgerMetrics(), new InMemoryBorrowRepository());
    }

    public LedgerEnvironment(LedgerConfig config, LedgerMetrics metrics, BorrowRepository repository) {
        this.config = config;
        this.metrics = metrics;
        this.eventBuffer = new InMemoryEventBuffer(config, metrics);
        this.ledger = new DefaultPoolLedger(new PoolManager(), eventBuffer, repository, metrics, config.clock());
        this.rateAggregator = new RateAggregator(eventBuffer, config.clock());
        this.sessionManager = new SessionManager(config.sessionQueueCapacity(), config.clock(), metrics);
        this.publisher = new SnapshotPublisher(config, ledger, eventBuffer, rateAggregator,
                sessionManager, metrics, new SnapshotCodec());

        for (PoolDefinition pool : config.pools()) {
            ledger.provision(pool);
        }
        log.info("Ledger environment created with {} pools", config.pools().size());
    }

    public void start() {
        publisher.start();
    }

    /**
     * Register a new streaming session; see {@link SessionManager#open}.
     */
    public StreamingSession subscribe() {
        return sessionManager.subscribe();
    }

    public void shutdown() {
        publisher.stop();
        sessionManager.shutdown();
        log.info("Ledger environment shut down");
    }

    public LedgerConfig config() { return config; }
    public LedgerMetrics metrics() { return metrics; }
    public EventBuffer eventBuffer() { return eventBuffer; }
    public PoolLedger ledger() { return ledger; }
    public RateAggregator rateAggregator() { return rateAggregator; }
    public SessionManager sessionManager() { return sessionManager; }
    public SnapshotPublisher publisher() { return publisher; }
}
