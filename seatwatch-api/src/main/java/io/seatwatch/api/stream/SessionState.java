package io.seatwatch.api.stream;

public enum SessionState {
    CONNECTING,
    OPEN,
    CLOSED
}
