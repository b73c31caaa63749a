package com.mainforce.auction.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RankSummary {
    public final int count;
    public final double avgHeat;
    public final double totalAmount;
    public final int limitUpCandidates;
    public final MarketRegime marketRegime;
    public final double themeAlphaInput;
    public final double themeAlphaEffective;
    public final int statsDays;
    public final int requestedWindowDays;

    public static RankSummary empty(MarketRegime regime, double alphaInput, double alphaEffective,
                                    int statsDays, int requestedWindowDays) {
        return new RankSummary(0, 0.0, 0.0, 0, regime, alphaInput, alphaEffective, statsDays, requestedWindowDays);
    }
}
