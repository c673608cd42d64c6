package io.seatwatch.api.stream;

import java.time.Instant;

/**
 * One observer's live connection receiving snapshots.
 */
public interface StreamingSession {

    String id();

    SessionState state();

    Instant connectedAt();

    /**
     * Queue a message for delivery without blocking.
     *
     * @return false if the session is closed or its outbound queue is full
     */
    boolean offer(SnapshotMessage message);

    /**
     * @return sequence of the last message written to the observer, -1 if none
     */
    long lastDeliveredSequence();

    /**
     * Close the session. Idempotent.
     */
    void close();
}
