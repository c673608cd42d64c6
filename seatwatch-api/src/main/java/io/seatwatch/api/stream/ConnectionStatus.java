package io.seatwatch.api.stream;

/**
 * Client-side view of a snapshot stream connection.
 */
public enum ConnectionStatus {
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    DISCONNECTED
}
