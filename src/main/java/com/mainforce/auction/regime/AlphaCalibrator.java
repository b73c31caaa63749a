package com.mainforce.auction.regime;

import com.mainforce.auction.config.Config;
import com.mainforce.auction.model.AlphaCalibration;
import com.mainforce.auction.model.CalibrationStatus;
import com.mainforce.auction.model.DecileOutcome;
import com.mainforce.auction.model.MarketRegime;
import com.mainforce.auction.model.MarketRegimeState;
import com.mainforce.auction.model.PeriodStat;
import com.mainforce.auction.model.ScoringParameters;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Scales the requested theme α by how well heat deciles predicted limit-up closes over the
 * rolling window, damped in volatile regimes. Never exceeds the requested value.
 */
public final class AlphaCalibrator {
    private final double strongLift;
    private final double liftWeight;
    private final double correlationWeight;
    private final int minDeciles;
    private final double calmFactor;
    private final double activeFactor;
    private final double volatileFactor;

    public AlphaCalibrator() {
        this(null);
    }

    public AlphaCalibrator(Config config) {
        this.strongLift = Math.max(1.0 + 1e-9, read(config, "calibration.strong_lift", 2.0));
        this.liftWeight = read(config, "calibration.lift_weight", 0.6);
        this.correlationWeight = read(config, "calibration.correlation_weight", 0.4);
        this.minDeciles = config == null ? 3 : Math.max(2, config.getInt("calibration.min_deciles", 3));
        this.calmFactor = read(config, "calibration.factor.calm", 1.0);
        this.activeFactor = read(config, "calibration.factor.active", 1.0);
        this.volatileFactor = read(config, "calibration.factor.volatile", 0.5);
    }

    public AlphaCalibration calibrate(
            double requested,
            boolean dynamicAlpha,
            MarketRegimeState regime,
            List<PeriodStat> window
    ) {
        if (!dynamicAlpha) {
            return AlphaCalibration.passThrough(requested, requested, CalibrationStatus.DISABLED);
        }
        if (regime == null || regime.regime == MarketRegime.NEUTRAL) {
            return AlphaCalibration.passThrough(requested, requested, CalibrationStatus.INSUFFICIENT_HISTORY);
        }

        // decile -> {candidates, hits}
        TreeMap<Integer, long[]> pooled = new TreeMap<>();
        long totalCandidates = 0;
        long totalHits = 0;
        for (PeriodStat stat : window == null ? List.<PeriodStat>of() : window) {
            for (DecileOutcome outcome : stat.deciles) {
                if (outcome == null || outcome.candidates <= 0 || outcome.decile < 1 || outcome.decile > 10) {
                    continue;
                }
                int hits = Math.min(Math.max(0, outcome.limitUpHits), outcome.candidates);
                long[] acc = pooled.computeIfAbsent(outcome.decile, k -> new long[2]);
                acc[0] += outcome.candidates;
                acc[1] += hits;
                totalCandidates += outcome.candidates;
                totalHits += hits;
            }
        }

        double lift = 0.0;
        double correlation = 0.0;
        double strength = 0.0;
        if (totalCandidates > 0 && totalHits > 0) {
            double overallRate = totalHits / (double) totalCandidates;
            long[] top = pooled.get(pooled.lastKey());
            double topRate = top[1] / (double) top[0];
            lift = topRate / overallRate;
            correlation = decileCorrelation(pooled);
            double liftScore = clamp((lift - 1.0) / (strongLift - 1.0), 0.0, 1.0);
            strength = clamp(liftWeight * liftScore + correlationWeight * Math.max(0.0, correlation), 0.0, 1.0);
        }

        double factor = regimeFactor(regime.regime);
        double ceiling = Math.min(requested, ScoringParameters.MAX_THEME_ALPHA);
        double effective = clamp(requested * strength * factor, 0.0, Math.max(0.0, ceiling));

        return AlphaCalibration.builder()
                .input(requested)
                .effective(effective)
                .lift(lift)
                .correlation(correlation)
                .strength(strength)
                .regimeFactor(factor)
                .status(CalibrationStatus.CALIBRATED)
                .build();
    }

    double regimeFactor(MarketRegime regime) {
        switch (regime) {
            case VOLATILE:
                return volatileFactor;
            case ACTIVE:
                return activeFactor;
            case CALM:
                return calmFactor;
            default:
                return 1.0;
        }
    }

    /**
     * Pearson correlation of decile index against decile hit rate; 0 below {@code minDeciles}
     * populated deciles or with zero variance on either side.
     */
    double decileCorrelation(Map<Integer, long[]> pooled) {
        int n = pooled.size();
        if (n < minDeciles) {
            return 0.0;
        }
        double sumX = 0.0;
        double sumY = 0.0;
        for (Map.Entry<Integer, long[]> e : pooled.entrySet()) {
            sumX += e.getKey();
            sumY += e.getValue()[1] / (double) e.getValue()[0];
        }
        double meanX = sumX / n;
        double meanY = sumY / n;
        double cov = 0.0;
        double varX = 0.0;
        double varY = 0.0;
        for (Map.Entry<Integer, long[]> e : pooled.entrySet()) {
            double dx = e.getKey() - meanX;
            double dy = e.getValue()[1] / (double) e.getValue()[0] - meanY;
            cov += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX <= 0.0 || varY <= 0.0) {
            return 0.0;
        }
        return clamp(cov / Math.sqrt(varX * varY), -1.0, 1.0);
    }

    private static double clamp(double v, double min, double max) {
        if (Double.isNaN(v)) {
            return min;
        }
        return Math.max(min, Math.min(max, v));
    }

    private static double read(Config config, String key, double fallback) {
        return config == null ? fallback : config.getDouble(key, fallback);
    }
}
