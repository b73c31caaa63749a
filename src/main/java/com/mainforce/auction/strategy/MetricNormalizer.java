package com.mainforce.auction.strategy;

import com.mainforce.auction.config.Config;
import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.SubScores;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Maps raw auction metrics to [0,1]. Long-tailed metrics (volume ratio, turnover, amount) are
 * log-squashed against a per-batch cap, gap is scaled linearly against a fixed ceiling.
 */
public final class MetricNormalizer {
    private final double capPercentile;
    private final double volumeRatioCapFloor;
    private final double turnoverCapFloor;
    private final double amountCapFloor;
    private final double amountUnit;
    private final double gapCeilingPct;

    public MetricNormalizer() {
        this(null);
    }

    public MetricNormalizer(Config config) {
        this.capPercentile = clamp(readDouble(config, "normalize.cap_percentile", 0.95), 0.0, 1.0);
        this.volumeRatioCapFloor = positive(readDouble(config, "normalize.volume_ratio.cap_floor", 5.0), 5.0);
        this.turnoverCapFloor = positive(readDouble(config, "normalize.turnover.cap_floor", 15.0), 15.0);
        this.amountCapFloor = positive(readDouble(config, "normalize.amount.cap_floor", 500.0), 500.0);
        this.amountUnit = positive(readDouble(config, "normalize.amount.unit", 1_000_000.0), 1_000_000.0);
        this.gapCeilingPct = positive(readDouble(config, "normalize.gap.ceiling_pct", 10.0), 10.0);
    }

    public NormalizationCaps computeCaps(List<AuctionSnapshot> population) {
        List<AuctionSnapshot> safe = population == null ? List.of() : population;
        double vr = Math.max(volumeRatioCapFloor, percentile(safe, s -> s.volumeRatio));
        double turnover = Math.max(turnoverCapFloor, percentile(safe, s -> s.turnoverRate));
        double amount = Math.max(amountCapFloor, percentile(safe, s -> scaledAmount(s.amount)));
        return new NormalizationCaps(vr, turnover, amount);
    }

    public SubScores normalize(AuctionSnapshot snapshot, NormalizationCaps caps) {
        if (snapshot == null || caps == null) {
            return SubScores.zero();
        }
        return new SubScores(
                logSquash(snapshot.volumeRatio, caps.volumeRatioCap),
                logSquash(snapshot.turnoverRate, caps.turnoverCap),
                gapScore(snapshot.effectiveGapPercent()),
                logSquash(scaledAmount(snapshot.amount), caps.amountCap)
        );
    }

    public double gapCeilingPct() {
        return gapCeilingPct;
    }

    double gapScore(double gapPercent) {
        if (!Double.isFinite(gapPercent) || gapPercent <= 0.0) {
            return 0.0;
        }
        return clamp(gapPercent / gapCeilingPct, 0.0, 1.0);
    }

    static double logSquash(Double raw, double cap) {
        if (raw == null || !Double.isFinite(raw) || raw <= 0.0) {
            return 0.0;
        }
        if (!Double.isFinite(cap) || cap <= 0.0) {
            return 0.0;
        }
        return clamp(Math.log1p(raw) / Math.log1p(cap), 0.0, 1.0);
    }

    private Double scaledAmount(Double amount) {
        if (amount == null || !Double.isFinite(amount)) {
            return null;
        }
        return amount / amountUnit;
    }

    // Nearest-rank percentile over usable (finite, non-negative) values; 0 when none.
    private double percentile(List<AuctionSnapshot> population, Function<AuctionSnapshot, Double> metric) {
        List<Double> values = new ArrayList<>(population.size());
        for (AuctionSnapshot s : population) {
            if (s == null) {
                continue;
            }
            Double v = metric.apply(s);
            if (v != null && Double.isFinite(v) && v >= 0.0) {
                values.add(v);
            }
        }
        if (values.isEmpty()) {
            return 0.0;
        }
        Collections.sort(values);
        int idx = (int) Math.ceil(capPercentile * values.size()) - 1;
        idx = Math.max(0, Math.min(values.size() - 1, idx));
        return values.get(idx);
    }

    private static double readDouble(Config config, String key, double fallback) {
        return config == null ? fallback : config.getDouble(key, fallback);
    }

    private static double positive(double value, double fallback) {
        return Double.isFinite(value) && value > 0.0 ? value : fallback;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
