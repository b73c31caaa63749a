package com.mainforce.auction.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Historical aggregate for one past trade date: market breadth plus how each heat-score decile
 * actually closed.
 */
public final class PeriodStat {
    public final LocalDate tradeDate;
    public final int advancers;
    public final int decliners;
    public final int totalStocks;
    public final int limitUpCount;
    public final double avgGapPercent;
    public final double heatDispersion;
    public final List<DecileOutcome> deciles;

    public PeriodStat(
            LocalDate tradeDate,
            int advancers,
            int decliners,
            int totalStocks,
            int limitUpCount,
            double avgGapPercent,
            double heatDispersion,
            List<DecileOutcome> deciles
    ) {
        this.tradeDate = tradeDate;
        this.advancers = Math.max(0, advancers);
        this.decliners = Math.max(0, decliners);
        this.totalStocks = Math.max(0, totalStocks);
        this.limitUpCount = Math.max(0, limitUpCount);
        this.avgGapPercent = Double.isFinite(avgGapPercent) ? avgGapPercent : 0.0;
        this.heatDispersion = Double.isFinite(heatDispersion) ? Math.max(0.0, heatDispersion) : 0.0;
        this.deciles = deciles == null ? List.of() : List.copyOf(deciles);
    }

    /**
     * Share of advancers among stocks that moved; 0.5 when nothing moved.
     */
    public double breadth() {
        int moved = advancers + decliners;
        if (moved <= 0) {
            return 0.5;
        }
        return advancers / (double) moved;
    }

    public double limitUpRate() {
        if (totalStocks <= 0) {
            return 0.0;
        }
        return limitUpCount / (double) totalStocks;
    }
}
