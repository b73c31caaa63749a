package com.mainforce.auction.strategy;

import com.mainforce.auction.config.Config;
import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.CandidateResult;
import com.mainforce.auction.model.ScoreWeights;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompositeScorerTest {

    private static final NormalizationCaps CAPS = new NormalizationCaps(5.0, 15.0, 500.0);

    private final CompositeScorer scorer = new CompositeScorer(Config.defaults(Path.of(".")));

    @Test
    void score_shouldBoostHotThemeByAlpha() {
        AuctionSnapshot a = strong("600001");

        CandidateResult plain = scorer.score(a, CAPS, ScoreWeights.defaults(), 1.0, 0.25, false);
        CandidateResult boosted = scorer.score(a, CAPS, ScoreWeights.defaults(), 1.4, 0.25, false);

        assertEquals(1.0, plain.themeEnhanceFactor, 1e-12);
        assertEquals(1.1, boosted.themeEnhanceFactor, 1e-9);
        assertEquals(plain.baseHeatScore, boosted.baseHeatScore, 1e-9);
        assertTrue(boosted.heatScore > plain.heatScore);
        assertEquals(Math.round(boosted.baseHeatScore * 1.1 * 100.0) / 100.0, boosted.heatScore, 0.02);
    }

    @Test
    void score_shouldClampHeatToHundred() {
        AuctionSnapshot maxed = AuctionSnapshot.builder()
                .code("600002").price(11.0).preClose(10.0)
                .volumeRatio(99.0).turnoverRate(99.0).amount(9.9e11)
                .build();

        CandidateResult r = scorer.score(maxed, CAPS, ScoreWeights.defaults(), 3.0, 0.5, true);

        assertEquals(100.0, r.baseHeatScore, 1e-9);
        assertEquals(100.0, r.heatScore, 1e-9);
        assertEquals(2.0, r.themeEnhanceFactor, 1e-9);
    }

    @Test
    void score_shouldMatchReferenceCandidate() {
        CandidateResult r = scorer.score(strong("600003"), CAPS, ScoreWeights.defaults(), 1.4, 0.25, false);

        assertEquals(73.38, r.baseHeatScore, 0.05);
        assertEquals(80.72, r.heatScore, 0.05);
        assertTrue(r.likelyLimitUp);
        assertTrue(r.likelyLimitUpProb > 0.8 && r.likelyLimitUpProb < 0.9);
        assertEquals(0, r.rank);
    }

    @Test
    void score_shouldFlagAuctionLimitUpOnlyWhenIncluded() {
        AuctionSnapshot c = AuctionSnapshot.builder()
                .code("600004").price(11.0).preClose(10.0).auctionLimitUp(true)
                .volumeRatio(3.0).turnoverRate(5.0).amount(1.5e8)
                .build();

        CandidateResult included = scorer.score(c, CAPS, ScoreWeights.defaults(), 1.0, 0.25, true);
        CandidateResult excluded = scorer.score(c, CAPS, ScoreWeights.defaults(), 1.0, 0.25, false);

        assertEquals(1.0, included.likelyLimitUpProb, 1e-12);
        assertTrue(included.likelyLimitUp);
        assertFalse(excluded.likelyLimitUp);
    }

    @Test
    void themeEnhanceFactor_shouldNeverDropBelowOne() {
        assertEquals(1.0, CompositeScorer.themeEnhanceFactor(0.5, 0.5), 1e-12);
        assertEquals(1.0, CompositeScorer.themeEnhanceFactor(2.0, 0.0), 1e-12);
        assertEquals(1.0, CompositeScorer.themeEnhanceFactor(Double.NaN, 0.3), 1e-12);
        assertEquals(1.5, CompositeScorer.themeEnhanceFactor(2.0, 0.5), 1e-12);
    }

    private static AuctionSnapshot strong(String code) {
        return AuctionSnapshot.builder()
                .code(code)
                .price(10.3)
                .preClose(10.0)
                .volumeRatio(5.0)
                .turnoverRate(8.0)
                .amount(2.0e8)
                .theme("chip")
                .build();
    }
}
