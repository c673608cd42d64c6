package io.seatwatch.web.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.seatwatch.api.stream.ConnectionStatus;
import io.seatwatch.api.stream.ReconnectPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Follows the server's snapshot stream and keeps the latest snapshot.
 * <p>
 * Every snapshot is a full state, so the latest one simply replaces the previous one.
 * When the stream breaks the client reconnects with exponential backoff from its
 * {@link ReconnectPolicy}; after the last allowed attempt it reports
 * {@link ConnectionStatus#DISCONNECTED} and stops.
 * <p>
 * Usage:
 * <pre>{@code
 * var client = new SnapshotStreamClient(URI.create("http://localhost:8080/realtime/stream"));
 * client.onSnapshot(snapshot -> render(snapshot.get("tools")));
 * client.start();
 * }</pre>
 */
public class SnapshotStreamClient {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStreamClient.class);

    private final URI streamUri;
    private final ReconnectPolicy reconnectPolicy;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final List<Consumer<JsonNode>> snapshotListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<ConnectionStatus>> statusListeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<ConnectionStatus> status = new AtomicReference<>(ConnectionStatus.DISCONNECTED);
    private final AtomicReference<JsonNode> latest = new AtomicReference<>();
    private final AtomicReference<Stream<String>> openStream = new AtomicReference<>();
    private final AtomicInteger attempts = new AtomicInteger();

    private volatile boolean running;
    private Thread readerThread;

    public SnapshotStreamClient(URI streamUri) {
        this(streamUri, ReconnectPolicy.create());
    }

    public SnapshotStreamClient(URI streamUri, ReconnectPolicy reconnectPolicy) {
        this(streamUri, reconnectPolicy, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build());
    }

    public SnapshotStreamClient(URI streamUri, ReconnectPolicy reconnectPolicy, HttpClient httpClient) {
        this.streamUri = streamUri;
        this.reconnectPolicy = reconnectPolicy;
        this.httpClient = httpClient;
    }

    public SnapshotStreamClient onSnapshot(Consumer<JsonNode> listener) {
        snapshotListeners.add(listener);
        return this;
    }

    public SnapshotStreamClient onStatus(Consumer<ConnectionStatus> listener) {
        statusListeners.add(listener);
        return this;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        attempts.set(0);
        readerThread = new Thread(this::run, "seatwatch-stream-client");
        readerThread.setDaemon(true);
        readerThread.start();
    }

    public synchronized void stop() {
        running = false;
        closeOpenStream();
        if (readerThread != null) {
            readerThread.interrupt();
            readerThread = null;
        }
        setStatus(ConnectionStatus.DISCONNECTED);
    }

    public ConnectionStatus status() {
        return status.get();
    }

    public Optional<JsonNode> latest() {
        return Optional.ofNullable(latest.get());
    }

    /**
     * @return failed connection attempts since the last successful connect
     */
    public int attempts() {
        return attempts.get();
    }

    private void run() {
        setStatus(ConnectionStatus.CONNECTING);
        while (running) {
            try {
                stream();
                log.info("Snapshot stream from {} ended", streamUri);
            } catch (IOException | UncheckedIOException e) {
                log.debug("Snapshot stream from {} failed: {}", streamUri, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (!running) {
                return;
            }

            int attempt = attempts.incrementAndGet();
            if (!reconnectPolicy.shouldRetry(attempt)) {
                log.warn("Giving up on {} after {} reconnect attempts", streamUri, attempt - 1);
                running = false;
                setStatus(ConnectionStatus.DISCONNECTED);
                return;
            }
            Duration delay = reconnectPolicy.delayFor(attempt);
            setStatus(ConnectionStatus.RECONNECTING);
            log.info("Reconnecting to {} in {}ms (attempt {}/{})", streamUri, delay.toMillis(),
                    attempt, reconnectPolicy.maxAttempts());
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void stream() throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(streamUri)
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() != 200) {
            response.body().close();
            throw new IOException("Unexpected status " + response.statusCode() + " from " + streamUri);
        }

        attempts.set(0);
        setStatus(ConnectionStatus.CONNECTED);
        log.info("Connected to snapshot stream {}", streamUri);

        StringBuilder data = new StringBuilder();
        try (Stream<String> lines = response.body()) {
            openStream.set(lines);
            lines.forEach(line -> onLine(line, data));
        } finally {
            openStream.set(null);
        }
    }

    private void onLine(String line, StringBuilder data) {
        if (line.isEmpty()) {
            if (data.length() > 0) {
                dispatch(data.toString());
                data.setLength(0);
            }
        } else if (line.startsWith("data:")) {
            if (data.length() > 0) {
                data.append('\n');
            }
            data.append(line.substring(line.startsWith("data: ") ? 6 : 5));
        }
        // comments, ids and other fields carry nothing the client needs
    }

    private void dispatch(String payload) {
        JsonNode snapshot;
        try {
            snapshot = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed snapshot: {}", e.getOriginalMessage());
            return;
        }
        latest.set(snapshot);
        for (Consumer<JsonNode> listener : snapshotListeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                log.error("Snapshot listener failed", e);
            }
        }
    }

    private void setStatus(ConnectionStatus next) {
        ConnectionStatus previous = status.getAndSet(next);
        if (previous == next) {
            return;
        }
        for (Consumer<ConnectionStatus> listener : statusListeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException e) {
                log.error("Status listener failed", e);
            }
        }
    }

    private void closeOpenStream() {
        Stream<String> lines = openStream.getAndSet(null);
        if (lines != null) {
            lines.close();
        }
    }
}
