package io.seatwatch.api.event;

/**
 * Sizes of the event buffers at a point in time.
 */
public record BufferStats(
        int totalEvents,
        int borrowEvents,
        int returnEvents,
        int failureEvents,
        int trackedPools,
        long droppedEvents
) {}
