package com.mainforce.auction.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class MarketRegimeState {
    public final MarketRegime regime;
    public final int requestedDays;
    public final int coveredDays;
    public final LocalDate windowStart;
    public final LocalDate windowEnd;
    public final double meanBreadth;
    public final double breadthVolatility;
    public final double meanAbsGapPercent;
    public final double meanHeatDispersion;
    public final double meanLimitUpRate;

    public boolean sufficientHistory() {
        return requestedDays > 0 && coveredDays >= requestedDays;
    }

    public static MarketRegimeState neutral(int requestedDays, int coveredDays) {
        return MarketRegimeState.builder()
                .regime(MarketRegime.NEUTRAL)
                .requestedDays(Math.max(0, requestedDays))
                .coveredDays(Math.max(0, coveredDays))
                .meanBreadth(0.5)
                .build();
    }
}
