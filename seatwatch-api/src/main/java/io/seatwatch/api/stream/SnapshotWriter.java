package io.seatwatch.api.stream;

import java.io.IOException;

/**
 * Pushes serialized snapshots onward to one observer, e.g. over a long-lived HTTP response.
 */
@FunctionalInterface
public interface SnapshotWriter {

    /**
     * @throws IOException if the observer is gone; the session is then closed
     */
    void write(SnapshotMessage message) throws IOException;

    /**
     * Called once when delivery to this observer has ended, for whatever reason.
     */
    default void closed() {}
}
