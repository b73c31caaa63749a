package com.mainforce.auction.engine;

import com.mainforce.auction.config.Config;
import com.mainforce.auction.data.PeriodStatRepository;
import com.mainforce.auction.data.SnapshotRepository;
import com.mainforce.auction.data.ThemeProfileSource;
import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.CalibrationStatus;
import com.mainforce.auction.model.CandidateResult;
import com.mainforce.auction.model.DataSource;
import com.mainforce.auction.model.DecileOutcome;
import com.mainforce.auction.model.MarketRegime;
import com.mainforce.auction.model.PeriodStat;
import com.mainforce.auction.model.RankRequest;
import com.mainforce.auction.model.RankedResultSet;
import com.mainforce.auction.model.SkipReason;
import com.mainforce.auction.model.SnapshotBatch;
import com.mainforce.auction.output.ResultJsonWriter;
import com.mainforce.auction.strategy.CandidateFilter;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuctionHeatEngineTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 28);
    private static final Map<String, Double> CHIP_HOT = Map.of("chip", 1.4);

    private final AuctionHeatEngine engine = new AuctionHeatEngine(Config.defaults(Path.of(".")));

    @Test
    void rank_shouldPutBoostedAndLimitCandidatesAheadOfFlatStock() {
        RankRequest request = RankRequest.of(DAY, 20, false, 0.25, false, "candidate_first", true, 20);

        RankedResultSet result = engine.rank(request, scenarioBatch(), CHIP_HOT, List.of());

        assertEquals(DataSource.AUCTION_SNAPSHOT, result.dataSource);
        assertEquals(List.of("600003", "600001", "600002"), codes(result.items));
        assertEquals(3, result.summary.count);
        assertTrue(result.summary.limitUpCandidates >= 1);
        assertEquals(2, result.summary.limitUpCandidates);
        assertEquals(MarketRegime.NEUTRAL, result.summary.marketRegime);
        assertEquals(0, result.summary.statsDays);
        assertEquals(20, result.summary.requestedWindowDays);
        assertEquals(0.25, result.summary.themeAlphaEffective, 1e-12);
        assertEquals(CalibrationStatus.INSUFFICIENT_HISTORY, result.diagnostics.calibration.status);

        CandidateResult a = result.items.get(1);
        assertEquals(1.4, a.themeHotness, 1e-12);
        assertEquals(1.1, a.themeEnhanceFactor, 1e-9);
        assertTrue(a.likelyLimitUp);
        CandidateResult b = result.items.get(2);
        assertFalse(b.likelyLimitUp);
        assertTrue(b.heatScore < a.heatScore);
    }

    @Test
    void rank_shouldReturnZeroedSummaryForEmptyBatch() {
        RankRequest request = new RankRequest(DAY, 20, null);

        RankedResultSet notCollected = engine.rank(request, SnapshotBatch.notCollected(DAY), Map.of(), List.of());
        RankedResultSet collectedEmpty = engine.rank(request, new SnapshotBatch(DAY, true, List.of()), Map.of(), List.of());

        assertEquals(DataSource.NONE, notCollected.dataSource);
        assertTrue(notCollected.isEmpty());
        assertEquals(0, notCollected.summary.count);
        assertEquals(0.0, notCollected.summary.avgHeat, 1e-12);
        assertEquals(0.0, notCollected.summary.totalAmount, 1e-12);
        assertEquals(0, notCollected.summary.limitUpCandidates);
        assertEquals(DataSource.AUCTION_SNAPSHOT, collectedEmpty.dataSource);
        assertTrue(collectedEmpty.isEmpty());
    }

    @Test
    void rank_shouldBeIdempotentForSameInput() {
        RankRequest request = RankRequest.of(DAY, 30, false, 0.25, false, "candidate_first", true, 20);
        SnapshotBatch batch = randomBatch(60, 7L);
        ResultJsonWriter writer = new ResultJsonWriter();

        String first = writer.toJson(engine.rank(request, batch, CHIP_HOT, history(20)));
        String second = writer.toJson(engine.rank(request, batch, CHIP_HOT, history(20)));

        assertEquals(first, second);
    }

    @Test
    void rank_shouldKeepHeatBoundedAndRanksContiguous() {
        RankRequest request = RankRequest.of(DAY, 200, false, 0.5, false, "heat_desc", false, 20);

        RankedResultSet result = engine.rank(request, randomBatch(120, 11L), Map.of("chip", 3.0, "ai", 2.0), List.of());

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < result.items.size(); i++) {
            CandidateResult c = result.items.get(i);
            assertEquals(i + 1, c.rank);
            assertTrue(c.heatScore >= 0.0 && c.heatScore <= 100.0);
            assertTrue(c.themeEnhanceFactor >= 1.0);
            assertTrue(c.likelyLimitUpProb >= 0.0 && c.likelyLimitUpProb <= 1.0);
            assertTrue(seen.add(c.code()));
            if (i > 0) {
                assertTrue(result.items.get(i - 1).heatScore >= c.heatScore);
            }
        }
    }

    @Test
    void rank_candidateFirstShouldGroupLikelyAheadOfRest() {
        RankRequest request = RankRequest.of(DAY, 200, false, 0.25, false, "candidate_first", false, 20);

        RankedResultSet result = engine.rank(request, randomBatch(120, 23L), CHIP_HOT, List.of());

        for (int i = 1; i < result.items.size(); i++) {
            CandidateResult prev = result.items.get(i - 1);
            CandidateResult cur = result.items.get(i);
            boolean ordered = (prev.likelyLimitUp && !cur.likelyLimitUp)
                    || (prev.likelyLimitUp == cur.likelyLimitUp && prev.heatScore >= cur.heatScore);
            assertTrue(ordered, "rank " + i + " out of order");
        }
    }

    @Test
    void rank_heatShouldNotDecreaseWhenVolumeRatioRises() {
        RankRequest request = RankRequest.of(DAY, 200, false, 0.25, false, "heat_desc", false, 20);
        SnapshotBatch base = randomBatch(40, 5L);

        double prev = -1.0;
        for (double vr = 0.0; vr <= 30.0; vr += 0.5) {
            List<AuctionSnapshot> rows = new ArrayList<>(base.snapshots);
            AuctionSnapshot probe = rows.get(0).toBuilder().volumeRatio(vr).build();
            rows.set(0, probe);
            RankedResultSet result = engine.rank(request, new SnapshotBatch(DAY, true, rows), CHIP_HOT, List.of());
            double heat = heatOf(result, probe.code);
            assertTrue(heat >= prev, "heat dropped at volumeRatio=" + vr);
            prev = heat;
        }
    }

    @Test
    void rank_shouldSkipMalformedRowsAndCountThem() {
        List<AuctionSnapshot> rows = new ArrayList<>(scenarioBatch().snapshots);
        rows.add(AuctionSnapshot.builder().code(" ").price(10.0).preClose(10.0).build());
        rows.add(AuctionSnapshot.builder().code("600010").price(null).preClose(10.0).build());
        rows.add(AuctionSnapshot.builder().code("600011").price(10.0).preClose(0.0).build());
        rows.add(AuctionSnapshot.builder().code("600012").price(Double.NaN).preClose(10.0).build());
        RankRequest request = RankRequest.of(DAY, 20, false, 0.25, false, "candidate_first", true, 20);

        RankedResultSet result = engine.rank(request, new SnapshotBatch(DAY, true, rows), CHIP_HOT, List.of());

        assertEquals(3, result.items.size());
        assertEquals(7, result.diagnostics.inputRows);
        assertEquals(3, result.diagnostics.scoredRows);
        assertEquals(1, result.diagnostics.skipped(SkipReason.MISSING_CODE));
        assertEquals(2, result.diagnostics.skipped(SkipReason.MISSING_PRICE));
        assertEquals(1, result.diagnostics.skipped(SkipReason.MISSING_PRE_CLOSE));
        assertEquals(4, result.diagnostics.skippedTotal());
    }

    @Test
    void rank_shouldExcludeAuctionLimitUpByDefault() {
        RankRequest request = new RankRequest(DAY, 20, null);

        RankedResultSet result = engine.rank(request, scenarioBatch(), CHIP_HOT, List.of());

        assertEquals(List.of("600001", "600002"), codes(result.items));
        assertEquals(1, result.diagnostics.filtered(CandidateFilter.RULE_AUCTION_LIMIT_UP));
        assertEquals(1, result.summary.limitUpCandidates);
    }

    @Test
    void rank_shouldComputeSummaryOverTruncatedList() {
        RankRequest request = RankRequest.of(DAY, 1, false, 0.25, false, "candidate_first", true, 20);

        RankedResultSet result = engine.rank(request, scenarioBatch(), CHIP_HOT, List.of());

        assertEquals(1, result.summary.count);
        assertEquals(2, result.diagnostics.truncatedCount);
        assertEquals(1.5e8, result.summary.totalAmount, 1e-3);
        assertEquals(Math.round(result.items.get(0).heatScore * 10.0) / 10.0, result.summary.avgHeat, 1e-9);
    }

    @Test
    void rank_shouldCalibrateAlphaWithFullHistory() {
        RankRequest request = RankRequest.of(DAY, 20, false, 0.25, false, "candidate_first", true, 20);

        RankedResultSet result = engine.rank(request, scenarioBatch(), CHIP_HOT, history(20));

        assertEquals(MarketRegime.CALM, result.summary.marketRegime);
        assertEquals(20, result.summary.statsDays);
        assertEquals(CalibrationStatus.CALIBRATED, result.diagnostics.calibration.status);
        assertTrue(result.summary.themeAlphaEffective > 0.0);
        assertTrue(result.summary.themeAlphaEffective < result.summary.themeAlphaInput);
    }

    @Test
    void rank_shouldReportPeDiagnosticsAndApplyPeFilter() {
        List<AuctionSnapshot> rows = List.of(
                pe("600021", 12.0, 11.0),
                pe("600022", -5.0, null),
                pe("600023", null, null),
                pe("600024", 0.0, 500.0)
        );
        RankRequest request = RankRequest.of(DAY, 20, true, 0.25, true, "heat_desc", false, 20);

        RankedResultSet result = engine.rank(request, new SnapshotBatch(DAY, true, rows), Map.of(), List.of());

        assertEquals(List.of("600021"), codes(result.items));
        assertEquals(3, result.diagnostics.filtered(CandidateFilter.RULE_PE_OUT_OF_RANGE));
        assertTrue(result.diagnostics.pe.enabled);
        assertEquals(1, result.diagnostics.pe.negCount);
        assertEquals(1, result.diagnostics.pe.zeroCount);
        assertEquals(1, result.diagnostics.pe.aboveMaxCount);
        assertEquals(2, result.diagnostics.pe.inRangeCount);
        assertEquals(1, result.diagnostics.pe.missingCount);
    }

    @Test
    void rank_withRepositoriesShouldSkipLookupsWhenNothingCollected() {
        AtomicInteger themeCalls = new AtomicInteger();
        AtomicInteger statCalls = new AtomicInteger();
        ThemeProfileSource themes = date -> {
            themeCalls.incrementAndGet();
            return CHIP_HOT;
        };
        PeriodStatRepository stats = (date, days) -> {
            statCalls.incrementAndGet();
            return history(days);
        };
        AuctionHeatEngine repoEngine = new AuctionHeatEngine(Config.defaults(Path.of(".")), repository(null), themes, stats);

        RankedResultSet empty = repoEngine.rank(new RankRequest(DAY, 10, null));

        assertEquals(DataSource.NONE, empty.dataSource);
        assertEquals(0, themeCalls.get());
        assertEquals(0, statCalls.get());

        AuctionHeatEngine loaded = new AuctionHeatEngine(Config.defaults(Path.of(".")), repository(scenarioBatch()), themes, stats);
        RankedResultSet result = loaded.rank(RankRequest.of(DAY, 10, false, 0.25, false, "candidate_first", true, 20));

        assertEquals(3, result.summary.count);
        assertEquals(1, themeCalls.get());
        assertEquals(1, statCalls.get());
        assertEquals(MarketRegime.CALM, result.summary.marketRegime);
    }

    @Test
    void rank_withoutRepositoryShouldFail() {
        assertThrows(IllegalStateException.class, () -> engine.rank(new RankRequest(DAY, 10, null)));
    }

    private static SnapshotRepository repository(SnapshotBatch batch) {
        return new SnapshotRepository() {
            @Override
            public SnapshotBatch findBatch(LocalDate tradeDate) {
                return batch == null ? SnapshotBatch.notCollected(tradeDate) : batch;
            }

            @Override
            public Optional<LocalDate> latestTradeDate() {
                return batch == null ? Optional.empty() : Optional.of(batch.tradeDate);
            }
        };
    }

    private static SnapshotBatch scenarioBatch() {
        AuctionSnapshot a = AuctionSnapshot.builder()
                .code("600001").name("芯片龙头").theme("chip")
                .price(10.3).preClose(10.0)
                .volumeRatio(5.0).turnoverRate(8.0).amount(2.0e8)
                .build();
        AuctionSnapshot b = AuctionSnapshot.builder()
                .code("600002").name("银行蓝筹").theme("bank")
                .price(9.9).preClose(10.0)
                .volumeRatio(0.8).turnoverRate(1.0).amount(2.0e7)
                .build();
        AuctionSnapshot c = AuctionSnapshot.builder()
                .code("600003").name("一字涨停").theme("robot")
                .price(11.0).preClose(10.0).auctionLimitUp(true)
                .volumeRatio(3.0).turnoverRate(5.0).amount(1.5e8)
                .build();
        return new SnapshotBatch(DAY, true, List.of(a, b, c));
    }

    private static SnapshotBatch randomBatch(int n, long seed) {
        Random random = new Random(seed);
        String[] themes = {"chip", "ai", "bank", "robot", ""};
        List<AuctionSnapshot> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double preClose = 5.0 + random.nextInt(50);
            double gap = -3.0 + random.nextDouble() * 13.0;
            rows.add(AuctionSnapshot.builder()
                    .code(String.format("6%05d", i))
                    .name("样本" + i)
                    .theme(themes[i % themes.length])
                    .price(Math.round(preClose * (1.0 + gap / 100.0) * 100.0) / 100.0)
                    .preClose(preClose)
                    .volumeRatio(random.nextDouble() * 12.0)
                    .turnoverRate(random.nextDouble() * 25.0)
                    .amount(random.nextDouble() * 8.0e8)
                    .build());
        }
        return new SnapshotBatch(DAY, true, rows);
    }

    private static List<PeriodStat> history(int days) {
        List<PeriodStat> out = new ArrayList<>();
        for (int day = 1; day <= days; day++) {
            List<DecileOutcome> deciles = new ArrayList<>();
            for (int d = 1; d <= 10; d++) {
                deciles.add(new DecileOutcome(d, 100, d));
            }
            out.add(new PeriodStat(DAY.minusDays(day), 100, 100, 4000, 10, 0.2, 10.0, deciles));
        }
        return out;
    }

    private static AuctionSnapshot pe(String code, Double pe, Double peTtm) {
        return AuctionSnapshot.builder()
                .code(code).name("样本" + code)
                .price(10.2).preClose(10.0)
                .volumeRatio(1.0).turnoverRate(1.0).amount(1.0e7)
                .pe(pe).peTtm(peTtm)
                .build();
    }

    private static double heatOf(RankedResultSet result, String code) {
        for (CandidateResult c : result.items) {
            if (c.code().equals(code)) {
                return c.heatScore;
            }
        }
        throw new AssertionError("missing " + code);
    }

    private static List<String> codes(List<CandidateResult> items) {
        List<String> out = new ArrayList<>();
        for (CandidateResult c : items) {
            assertNotNull(c.code());
            out.add(c.code());
        }
        return out;
    }
}
