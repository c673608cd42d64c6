package io.seatwatch.core.stream;

import io.seatwatch.api.stream.SessionState;
import io.seatwatch.api.stream.SnapshotMessage;
import io.seatwatch.api.stream.StreamingSession;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Session backed by a bounded outbound queue.
 * The publisher offers into the queue; the session's own delivery loop drains it.
 * Messages at or below the last queued sequence are ignored, so an observer never
 * sees ticks out of order.
 */
public class BufferedSession implements StreamingSession {

    private final String id;
    private final Instant connectedAt;
    private final BlockingQueue<SnapshotMessage> queue;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private long lastQueuedSequence = -1;
    private volatile long lastDeliveredSequence = -1;

    public BufferedSession(String id, int queueCapacity, Instant connectedAt) {
        this.id = id;
        this.connectedAt = connectedAt;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public SessionState state() {
        return state.get();
    }

    @Override
    public Instant connectedAt() {
        return connectedAt;
    }

    @Override
    public synchronized boolean offer(SnapshotMessage message) {
        if (state.get() == SessionState.CLOSED) {
            return false;
        }
        if (message.sequence() <= lastQueuedSequence) {
            return true;
        }
        if (!queue.offer(message)) {
            return false;
        }
        lastQueuedSequence = message.sequence();
        return true;
    }

    @Override
    public long lastDeliveredSequence() {
        return lastDeliveredSequence;
    }

    @Override
    public void close() {
        state.set(SessionState.CLOSED);
        queue.clear();
    }

    boolean markOpen() {
        return state.compareAndSet(SessionState.CONNECTING, SessionState.OPEN);
    }

    boolean isOpen() {
        return state.get() == SessionState.OPEN;
    }

    /**
     * @return the next message, or null if none arrived within the timeout
     */
    SnapshotMessage poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    void delivered(SnapshotMessage message) {
        lastDeliveredSequence = message.sequence();
    }

    int queued() {
        return queue.size();
    }
}
