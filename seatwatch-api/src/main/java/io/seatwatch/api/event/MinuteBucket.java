package io.seatwatch.api.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Borrow activity of one pool during one minute.
 *
 * @param timestamp start of the minute
 * @param users     distinct holders seen in the minute (capped)
 */
public record MinuteBucket(
        @JsonIgnore String poolName,
        Instant timestamp,
        int count,
        int overageCount,
        List<String> users
) {}
