package com.mainforce.auction.strategy;

import com.mainforce.auction.config.Config;
import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.CandidateResult;
import com.mainforce.auction.model.ScoreWeights;
import com.mainforce.auction.model.SubScores;

/**
 * Heat score = 100 x weighted sub-scores, multiplied by the theme enhancement
 * {@code 1 + alpha * (hotness - 1)} and clamped back to [0,100].
 */
public final class CompositeScorer {
    private final MetricNormalizer normalizer;
    private final LimitUpProbabilityModel probabilityModel;

    public CompositeScorer(Config config) {
        this(new MetricNormalizer(config), new LimitUpProbabilityModel(config));
    }

    public CompositeScorer(MetricNormalizer normalizer, LimitUpProbabilityModel probabilityModel) {
        this.normalizer = normalizer;
        this.probabilityModel = probabilityModel;
    }

    public MetricNormalizer normalizer() {
        return normalizer;
    }

    public CandidateResult score(
            AuctionSnapshot snapshot,
            NormalizationCaps caps,
            ScoreWeights weights,
            double themeHotness,
            double themeAlphaEffective,
            boolean includeAuctionLimitUp
    ) {
        SubScores sub = normalizer.normalize(snapshot, caps);
        double base = clamp(100.0 * weights.weigh(sub), 0.0, 100.0);
        double factor = themeEnhanceFactor(themeHotness, themeAlphaEffective);
        double heat = round2(clamp(base * factor, 0.0, 100.0));
        double gap = snapshot.effectiveGapPercent();
        double prob = probabilityModel.probability(heat, gap, snapshot.auctionLimitUp);
        boolean likely = probabilityModel.isLikelyLimitUp(prob, snapshot.auctionLimitUp, includeAuctionLimitUp);

        return CandidateResult.builder()
                .snapshot(snapshot)
                .subScores(sub)
                .baseHeatScore(round2(base))
                .heatScore(heat)
                .themeHotness(sanitizeHotness(themeHotness))
                .themeEnhanceFactor(round4(factor))
                .likelyLimitUp(likely)
                .likelyLimitUpProb(round4(prob))
                .rank(0)
                .build();
    }

    static double themeEnhanceFactor(double hotness, double alpha) {
        double h = sanitizeHotness(hotness);
        double a = Double.isFinite(alpha) ? Math.max(0.0, alpha) : 0.0;
        return 1.0 + a * (h - 1.0);
    }

    private static double sanitizeHotness(double hotness) {
        return Double.isFinite(hotness) && hotness > 1.0 ? hotness : 1.0;
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

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
