package io.seatwatch.api.stream;

/**
 * Phase of the snapshot publishing cycle.
 */
public enum PublisherState {
    IDLE,
    COMPOSING,
    BROADCASTING,
    STOPPED
}
