package io.seatwatch.web;

import io.seatwatch.api.environment.LedgerConfig;
import io.seatwatch.api.pool.PoolDefinition;
import io.seatwatch.core.config.PoolSeedLoader;
import io.seatwatch.web.environment.WebLedgerEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Starts the license server with its seed pools.
 * <p>
 * Run with:
 * <pre>{@code
 * mvn compile exec:java -pl seatwatch-web \
 *   -Dexec.mainClass="io.seatwatch.web.SeatwatchServer" \
 *   -Dseatwatch.port=8080 -Dseatwatch.seed=/etc/seatwatch/pools.json
 * }</pre>
 * Then connect to http://localhost:8080/realtime/stream for live snapshots.
 */
public class SeatwatchServer {

    private static final Logger log = LoggerFactory.getLogger(SeatwatchServer.class);

    static final String DEFAULT_SEED = "seed-pools.json";

    public static void main(String[] args) {
        int port = Integer.getInteger("seatwatch.port", 8080);
        List<PoolDefinition> pools = loadSeed(System.getProperty("seatwatch.seed"));

        var environment = new WebLedgerEnvironment(LedgerConfig.create().pools(pools), port);
        environment.startServer();
        environment.start();

        Runtime.getRuntime().addShutdownHook(new Thread(environment::shutdown, "seatwatch-shutdown"));
        log.info("Seatwatch serving {} pools", pools.size());
    }

    static List<PoolDefinition> loadSeed(String seedFile) {
        PoolSeedLoader loader = new PoolSeedLoader();
        if (seedFile != null && !seedFile.isBlank()) {
            log.info("Loading seed pools from {}", seedFile);
            return loader.fromFile(Path.of(seedFile));
        }
        return loader.fromClasspath(DEFAULT_SEED);
    }
}
