package io.seatwatch.api.metrics;

/**
 * Event rates over a trailing window.
 */
public record RateSummary(
        double borrowPerMin,
        double returnPerMin,
        double failurePerMin,
        double overagePercent
) {

    public static RateSummary empty() {
        return new RateSummary(0.0, 0.0, 0.0, 0.0);
    }
}
