package com.mainforce.auction.engine;

import com.mainforce.auction.config.Config;
import com.mainforce.auction.data.PeriodStatRepository;
import com.mainforce.auction.data.SnapshotRepository;
import com.mainforce.auction.data.ThemeProfileSource;
import com.mainforce.auction.model.AlphaCalibration;
import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.CandidateResult;
import com.mainforce.auction.model.DataSource;
import com.mainforce.auction.model.MarketRegimeState;
import com.mainforce.auction.model.PeriodStat;
import com.mainforce.auction.model.RankDiagnostics;
import com.mainforce.auction.model.RankRequest;
import com.mainforce.auction.model.RankSummary;
import com.mainforce.auction.model.RankedResultSet;
import com.mainforce.auction.model.ScoringParameters;
import com.mainforce.auction.model.SkipReason;
import com.mainforce.auction.model.SnapshotBatch;
import com.mainforce.auction.model.ThemeProfile;
import com.mainforce.auction.regime.AlphaCalibrator;
import com.mainforce.auction.regime.MarketRegimeClassifier;
import com.mainforce.auction.strategy.CandidateFilter;
import com.mainforce.auction.strategy.CandidateRanker;
import com.mainforce.auction.strategy.CompositeScorer;
import com.mainforce.auction.strategy.NormalizationCaps;
import com.mainforce.auction.strategy.SnapshotValidator;
import com.mainforce.auction.strategy.ThemeProfileResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scores one trade date's call-auction snapshots and returns the ranked candidate list.
 *
 * <p>Stateless after construction. The repository-backed {@link #rank(RankRequest)} only loads
 * inputs; all scoring happens in {@link #rank(RankRequest, SnapshotBatch, Map, List)}, which
 * is safe to call concurrently.
 */
public final class AuctionHeatEngine {
    private static final Logger log = LogManager.getLogger(AuctionHeatEngine.class);

    private final SnapshotRepository snapshots;
    private final ThemeProfileSource themes;
    private final PeriodStatRepository periodStats;

    private final SnapshotValidator validator;
    private final CompositeScorer scorer;
    private final ThemeProfileResolver themeResolver;
    private final MarketRegimeClassifier regimeClassifier;
    private final AlphaCalibrator alphaCalibrator;
    private final CandidateFilter filter;
    private final CandidateRanker ranker;

    public AuctionHeatEngine(Config config) {
        this(config, null, null, null);
    }

    public AuctionHeatEngine(
            Config config,
            SnapshotRepository snapshots,
            ThemeProfileSource themes,
            PeriodStatRepository periodStats
    ) {
        this.snapshots = snapshots;
        this.themes = themes;
        this.periodStats = periodStats;
        this.validator = new SnapshotValidator();
        this.scorer = new CompositeScorer(config);
        this.themeResolver = new ThemeProfileResolver(config);
        this.regimeClassifier = new MarketRegimeClassifier(config);
        this.alphaCalibrator = new AlphaCalibrator(config);
        this.filter = new CandidateFilter(config);
        this.ranker = new CandidateRanker(filter);
    }

    public RankedResultSet rank(RankRequest request) {
        if (snapshots == null) {
            throw new IllegalStateException("no snapshot repository configured");
        }
        SnapshotBatch batch = snapshots.findBatch(request.tradeDate);
        if (batch == null) {
            batch = SnapshotBatch.notCollected(request.tradeDate);
        }
        Map<String, Double> hotness = Map.of();
        List<PeriodStat> stats = List.of();
        if (!batch.snapshots.isEmpty()) {
            if (themes != null) {
                hotness = themes.getThemeHotness(request.tradeDate);
            }
            if (periodStats != null) {
                stats = periodStats.getPeriodStats(request.tradeDate, request.parameters.rollingWindowDays);
            }
        }
        return rank(request, batch, hotness, stats);
    }

    public RankedResultSet rank(
            RankRequest request,
            SnapshotBatch batch,
            Map<String, Double> themeHotness,
            List<PeriodStat> history
    ) {
        ScoringParameters params = request.parameters;
        List<AuctionSnapshot> rows = batch == null ? List.of() : batch.snapshots;

        MarketRegimeState regime = regimeClassifier.classify(request.tradeDate, history, params.rollingWindowDays);
        List<PeriodStat> window = regimeClassifier.window(request.tradeDate, history, params.rollingWindowDays);
        AlphaCalibration alpha = alphaCalibrator.calibrate(params.themeAlpha, params.dynamicAlpha, regime, window);

        Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);
        List<AuctionSnapshot> valid = new ArrayList<>(rows.size());
        for (AuctionSnapshot row : rows) {
            SkipReason reason = validator.check(row);
            if (reason != null) {
                skipped.merge(reason, 1, Integer::sum);
                log.warn("skip snapshot date={} code={} reason={}", request.tradeDate, row == null ? null : row.code, reason.label());
                continue;
            }
            valid.add(row);
        }

        NormalizationCaps caps = scorer.normalizer().computeCaps(valid);
        ThemeProfile profile = themeResolver.profile(request.tradeDate, themeHotness);
        boolean includeAuctionLimitUp = !params.excludeAuctionLimitUp;
        List<CandidateResult> scored = new ArrayList<>(valid.size());
        for (AuctionSnapshot row : valid) {
            double hotness = themeResolver.hotnessOf(row, profile);
            scored.add(scorer.score(row, caps, params.weights, hotness, alpha.effective, includeAuctionLimitUp));
        }

        CandidateRanker.Outcome outcome = ranker.rank(scored, params, request.limit);
        RankSummary summary = summarize(outcome.items, regime, alpha, params.rollingWindowDays);
        RankDiagnostics diagnostics = new RankDiagnostics(
                rows.size(),
                scored.size(),
                skipped,
                outcome.duplicateCount,
                outcome.filteredByRule,
                outcome.truncatedCount,
                ResultDiagnostics.metricStats(outcome.items, s -> ResultDiagnostics.orZero(s.volumeRatio), v -> v < 1.0),
                ResultDiagnostics.metricStats(outcome.items, s -> ResultDiagnostics.orZero(s.auctionVolumeRatio), v -> v >= 1.0),
                ResultDiagnostics.peDiagnostics(scored, params.peFilterEnabled, filter.peMax()),
                alpha,
                regime
        );

        log.info("rank date={} source={} rows={} scored={} returned={} regime={} alpha={}->{}",
                request.tradeDate,
                batch == null ? "none" : batch.dataSource().label(),
                rows.size(),
                scored.size(),
                outcome.items.size(),
                regime.regime.label(),
                alpha.input,
                alpha.effective);

        return new RankedResultSet(
                request.tradeDate,
                batch == null ? DataSource.NONE : batch.dataSource(),
                outcome.items,
                summary,
                diagnostics
        );
    }

    static RankSummary summarize(
            List<CandidateResult> items,
            MarketRegimeState regime,
            AlphaCalibration alpha,
            int requestedWindowDays
    ) {
        if (items.isEmpty()) {
            return RankSummary.empty(regime.regime, alpha.input, alpha.effective, regime.coveredDays, requestedWindowDays);
        }
        double heatSum = 0.0;
        double amount = 0.0;
        int likely = 0;
        for (CandidateResult c : items) {
            heatSum += c.heatScore;
            amount += c.snapshot.amountOrZero();
            if (c.likelyLimitUp) {
                likely++;
            }
        }
        double avgHeat = Math.round(heatSum / items.size() * 10.0) / 10.0;
        return RankSummary.builder()
                .count(items.size())
                .avgHeat(avgHeat)
                .totalAmount(amount)
                .limitUpCandidates(likely)
                .marketRegime(regime.regime)
                .themeAlphaInput(alpha.input)
                .themeAlphaEffective(alpha.effective)
                .statsDays(regime.coveredDays)
                .requestedWindowDays(requestedWindowDays)
                .build();
    }
}
