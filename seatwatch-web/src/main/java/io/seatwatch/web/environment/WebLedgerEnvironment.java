package io.seatwatch.web.environment;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.seatwatch.api.environment.LedgerConfig;
import io.seatwatch.api.metrics.LedgerMetrics;
import io.seatwatch.api.store.BorrowRepository;
import io.seatwatch.core.environment.LedgerEnvironment;
import io.seatwatch.core.metrics.MicrometerLedgerMetrics;
import io.seatwatch.core.store.InMemoryBorrowRepository;
import io.seatwatch.web.server.SeatwatchWebServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ledger environment that also serves the REST API and the snapshot stream.
 * <p>
 * The web environment belongs to the web module and adds:
 * - Embedded Tomcat for the license endpoints
 * - SSE endpoint streaming every published snapshot
 * - Prometheus scrape endpoint, when the metrics are backed by a {@link PrometheusMeterRegistry}
 */
public class WebLedgerEnvironment extends LedgerEnvironment {

    private static final Logger log = LoggerFactory.getLogger(WebLedgerEnvironment.class);

    private final int port;
    private final PrometheusMeterRegistry scrapeRegistry;
    private SeatwatchWebServer webServer;

    public WebLedgerEnvironment(LedgerConfig config, int port) {
        this(config, new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), port);
    }

    public WebLedgerEnvironment(LedgerConfig config, PrometheusMeterRegistry registry, int port) {
        this(config, new MicrometerLedgerMetrics(registry), new InMemoryBorrowRepository(), port);
    }

    public WebLedgerEnvironment(LedgerConfig config, LedgerMetrics metrics, BorrowRepository repository, int port) {
        super(config, metrics, repository);
        this.port = port;
        this.scrapeRegistry = prometheusRegistryOf(metrics);
    }

    /**
     * Start the web server. Snapshots are only streamed once {@link #start()} runs the publisher.
     */
    public synchronized void startServer() {
        if (webServer != null) {
            return;
        }
        webServer = new SeatwatchWebServer(this, scrapeRegistry, port);
        webServer.start();
        log.info("Seatwatch API available at http://localhost:{}", port());
    }

    @Override
    public void shutdown() {
        super.shutdown();
        synchronized (this) {
            if (webServer != null) {
                webServer.stop();
                webServer = null;
            }
        }
        log.info("Web environment shut down");
    }

    /**
     * @return the registry served at {@code /metrics}, or null when the metrics are not Prometheus-backed
     */
    public PrometheusMeterRegistry scrapeRegistry() {
        return scrapeRegistry;
    }

    /**
     * @return the bound port once the server runs, otherwise the configured one
     */
    public synchronized int port() {
        return webServer == null ? port : webServer.port();
    }

    private static PrometheusMeterRegistry prometheusRegistryOf(LedgerMetrics metrics) {
        if (metrics instanceof MicrometerLedgerMetrics) {
            MeterRegistry registry = ((MicrometerLedgerMetrics) metrics).registry();
            if (registry instanceof PrometheusMeterRegistry) {
                return (PrometheusMeterRegistry) registry;
            }
        }
        return null;
    }
}
