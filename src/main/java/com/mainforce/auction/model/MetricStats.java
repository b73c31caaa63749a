package com.mainforce.auction.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Min/max/avg of one metric over the returned candidates, plus a count of values on the
 * interesting side of a threshold (for example volume ratio below 1).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class MetricStats {
    public final double min;
    public final double max;
    public final double avg;
    public final int thresholdCount;

    public static MetricStats empty() {
        return new MetricStats(0.0, 0.0, 0.0, 0);
    }
}
