package com.mainforce.auction.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One stock's call-auction state for one trade date. Metric fields are nullable: a missing
 * value is scored as 0 rather than rejected.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class AuctionSnapshot {
    public final String code;
    public final String name;
    public final String industry;
    public final String theme;
    public final Double price;
    public final Double preClose;
    public final Double gapPercent;
    public final Double vol;
    public final Double amount;
    public final Double turnoverRate;
    public final Double volumeRatio;
    public final Double floatShare;
    public final boolean auctionLimitUp;
    public final Double pe;
    public final Double peTtm;
    public final Double auctionVolumeRatio;

    /**
     * Gap percent derived from price and previous close when both are usable, otherwise the
     * stored value.
     */
    public double effectiveGapPercent() {
        if (price != null && preClose != null
                && Double.isFinite(price) && Double.isFinite(preClose)
                && price > 0.0 && preClose > 0.0) {
            return (price - preClose) / preClose * 100.0;
        }
        if (gapPercent != null && Double.isFinite(gapPercent)) {
            return gapPercent;
        }
        return 0.0;
    }

    public double amountOrZero() {
        return amount != null && Double.isFinite(amount) ? amount : 0.0;
    }
}
