package io.seatwatch.core.stream;

import io.seatwatch.api.metrics.LedgerMetrics;
import io.seatwatch.api.stream.SessionState;
import io.seatwatch.api.stream.SnapshotMessage;
import io.seatwatch.api.stream.SnapshotWriter;
import io.seatwatch.api.stream.StreamingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks connected observers and fans snapshots out to them.
 * <p>
 * Every open session has its own delivery loop draining its bounded queue, so a slow
 * observer only ever fills its own queue. When the queue is full at broadcast time, or a
 * write fails, the session is closed and removed; nothing else is affected. Reconnecting
 * is up to the client, which gets the latest full snapshot as soon as it is open again.
 * <p>
 * A session that is subscribed but never opened is pruned by the first broadcast after
 * its connect timeout. Callers that give up on a session earlier should {@link #unsubscribe} it.
 */
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(250);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private final int queueCapacity;
    private final Duration connectTimeout;
    private final Clock clock;
    private final LedgerMetrics metrics;
    private final Map<String, BufferedSession> sessions = new ConcurrentHashMap<>();
    private final AtomicReference<SnapshotMessage> latest = new AtomicReference<>();
    private final ExecutorService deliveryExecutor;

    public SessionManager(int queueCapacity, Clock clock, LedgerMetrics metrics) {
        this(queueCapacity, DEFAULT_CONNECT_TIMEOUT, clock, metrics);
    }

    public SessionManager(int queueCapacity, Duration connectTimeout, Clock clock, LedgerMetrics metrics) {
        this.queueCapacity = queueCapacity;
        this.connectTimeout = connectTimeout;
        this.clock = clock;
        this.metrics = metrics;
        AtomicInteger threadCount = new AtomicInteger();
        this.deliveryExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "seatwatch-session-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register a new session. It receives nothing until {@link #open} attaches a writer.
     */
    public StreamingSession subscribe() {
        BufferedSession session = new BufferedSession(UUID.randomUUID().toString(), queueCapacity, clock.instant());
        sessions.put(session.id(), session);
        log.debug("Session {} registered", session.id());
        return session;
    }

    /**
     * Start delivering to the session. The latest snapshot, if any, is queued first.
     *
     * @throws IllegalStateException if the session is unknown or not connecting
     */
    public void open(StreamingSession session, SnapshotWriter writer) {
        BufferedSession buffered = sessions.get(session.id());
        if (buffered == null || !buffered.markOpen()) {
            throw new IllegalStateException("Session " + session.id() + " cannot be opened in state " + session.state());
        }
        SnapshotMessage current = latest.get();
        if (current != null) {
            buffered.offer(current);
        }
        try {
            deliveryExecutor.execute(() -> deliver(buffered, writer));
        } catch (RejectedExecutionException e) {
            remove(buffered, "shutdown");
            throw new IllegalStateException("Session manager is shut down", e);
        }
        metrics.recordActiveSessions(activeCount());
        log.info("Session {} open, {} active", buffered.id(), activeCount());
    }

    /**
     * Offer the message to every open session without blocking.
     * Sessions that cannot take it are dropped, as are sessions never opened within the connect timeout.
     */
    public void broadcast(SnapshotMessage message) {
        latest.set(message);
        Instant openDeadline = clock.instant().minus(connectTimeout);
        for (BufferedSession session : sessions.values()) {
            if (session.state() == SessionState.CLOSED) {
                remove(session, "closed");
            } else if (session.state() == SessionState.CONNECTING && session.connectedAt().isBefore(openDeadline)) {
                log.warn("Dropping session {}: not opened within {}s", session.id(), connectTimeout.toSeconds());
                remove(session, "never_opened");
            } else if (session.isOpen() && !session.offer(message)) {
                log.warn("Dropping session {}: outbound queue full at snapshot {}", session.id(), message.sequence());
                remove(session, "queue_full");
            }
        }
    }

    public void unsubscribe(StreamingSession session) {
        BufferedSession buffered = sessions.get(session.id());
        if (buffered != null) {
            remove(buffered, "unsubscribed");
        } else {
            session.close();
        }
    }

    public Collection<StreamingSession> sessions() {
        return List.copyOf(sessions.values());
    }

    /**
     * @return sessions currently open for delivery; subscribed but unopened sessions are not counted
     */
    public int activeCount() {
        int open = 0;
        for (BufferedSession session : sessions.values()) {
            if (session.isOpen()) {
                open++;
            }
        }
        return open;
    }

    public SnapshotMessage latest() {
        return latest.get();
    }

    public void shutdown() {
        sessions.values().forEach(s -> remove(s, "shutdown"));
        deliveryExecutor.shutdownNow();
        try {
            if (!deliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Session delivery threads did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Session manager shut down");
    }

    private void deliver(BufferedSession session, SnapshotWriter writer) {
        try {
            while (session.isOpen()) {
                SnapshotMessage message = session.poll(POLL_TIMEOUT);
                if (message != null && session.isOpen()) {
                    writer.write(message);
                    session.delivered(message);
                }
            }
        } catch (IOException e) {
            log.debug("Session {} write failed: {}", session.id(), e.getMessage());
            remove(session, "write_failure");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            remove(session, "interrupted");
        } catch (RuntimeException e) {
            log.error("Session {} delivery loop failed", session.id(), e);
            remove(session, "write_failure");
        } finally {
            writer.closed();
        }
    }

    private void remove(BufferedSession session, String cause) {
        session.close();
        if (sessions.remove(session.id(), session)) {
            if (!"unsubscribed".equals(cause) && !"shutdown".equals(cause)) {
                metrics.recordSessionDropped(cause);
            }
            metrics.recordActiveSessions(activeCount());
            log.info("Session {} closed ({}), {} active", session.id(), cause, activeCount());
        }
    }
}
