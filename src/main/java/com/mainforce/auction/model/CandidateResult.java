package com.mainforce.auction.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A scored stock. {@code rank} stays 0 until the ranker assigns the final order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CandidateResult {
    public final AuctionSnapshot snapshot;
    public final SubScores subScores;
    public final double baseHeatScore;
    public final double heatScore;
    public final double themeHotness;
    public final double themeEnhanceFactor;
    public final boolean likelyLimitUp;
    public final double likelyLimitUpProb;
    public final int rank;

    public String code() {
        return snapshot == null ? "" : snapshot.code;
    }

    public double gapPercent() {
        return snapshot == null ? 0.0 : snapshot.effectiveGapPercent();
    }
}
