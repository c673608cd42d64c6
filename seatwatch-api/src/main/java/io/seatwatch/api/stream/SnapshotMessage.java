package io.seatwatch.api.stream;

/**
 * A snapshot serialized once for all sessions.
 *
 * @param sequence tick number of the snapshot; non-decreasing per session
 * @param payload  JSON document
 */
public record SnapshotMessage(long sequence, String payload) {}
