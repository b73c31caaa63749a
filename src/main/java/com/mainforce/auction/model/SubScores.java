package com.mainforce.auction.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Per-metric scores, each in [0,1].
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SubScores {
    public final double volumeRatio;
    public final double turnoverRate;
    public final double gapPercent;
    public final double amount;

    public static SubScores zero() {
        return new SubScores(0.0, 0.0, 0.0, 0.0);
    }
}
