package io.seatwatch.api.event;

/**
 * Category of a ledger event. Each category has its own buffer.
 */
public enum EventKind {
    BORROW,
    RETURN,
    FAILURE
}
