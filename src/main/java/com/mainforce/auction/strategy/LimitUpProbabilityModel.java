package com.mainforce.auction.strategy;

import com.mainforce.auction.config.Config;

/**
 * Bounded logistic mapping from heat score and auction gap to a limit-up probability. Monotone
 * non-decreasing in both inputs.
 */
public final class LimitUpProbabilityModel {
    private final double heatMid;
    private final double heatSlope;
    private final double gapMid;
    private final double gapSlope;
    private final double gapCeilingPct;
    private final double threshold;

    public LimitUpProbabilityModel() {
        this(null);
    }

    public LimitUpProbabilityModel(Config config) {
        this.heatMid = read(config, "probability.heat_mid", 60.0);
        this.heatSlope = Math.max(0.0, read(config, "probability.heat_slope", 1.2));
        this.gapMid = read(config, "probability.gap_mid", 5.0);
        this.gapSlope = Math.max(0.0, read(config, "probability.gap_slope", 0.35));
        double ceiling = read(config, "normalize.gap.ceiling_pct", 10.0);
        this.gapCeilingPct = ceiling > 0.0 ? ceiling : 10.0;
        double t = read(config, "probability.threshold", 0.5);
        this.threshold = t > 0.0 && t < 1.0 ? t : 0.5;
    }

    public double probability(double heatScore, double gapPercent, boolean auctionLimitUp) {
        if (auctionLimitUp) {
            return 1.0;
        }
        double heat = Double.isFinite(heatScore) ? Math.max(0.0, Math.min(100.0, heatScore)) : 0.0;
        double gap = Double.isFinite(gapPercent) ? Math.max(0.0, Math.min(gapCeilingPct, gapPercent)) : 0.0;
        double z = heatSlope * (heat - heatMid) / 10.0 + gapSlope * (gap - gapMid);
        return 1.0 / (1.0 + Math.exp(-z));
    }

    /**
     * Auction-limit-up stocks already sit at the limit; they count as candidates only while the
     * caller includes them.
     */
    public boolean isLikelyLimitUp(double probability, boolean auctionLimitUp, boolean includeAuctionLimitUp) {
        if (auctionLimitUp) {
            return includeAuctionLimitUp;
        }
        return probability > threshold;
    }

    public double threshold() {
        return threshold;
    }

    private static double read(Config config, String key, double fallback) {
        if (config == null) {
            return fallback;
        }
        double v = config.getDouble(key, fallback);
        return Double.isFinite(v) ? v : fallback;
    }
}
