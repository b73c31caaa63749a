package com.mainforce.auction.regime;

import com.mainforce.auction.config.Config;
import com.mainforce.auction.model.MarketRegime;
import com.mainforce.auction.model.MarketRegimeState;
import com.mainforce.auction.model.PeriodStat;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Labels the rolling window before a trade date as calm, active or volatile. A window that does
 * not cover the requested number of days is neutral.
 */
public final class MarketRegimeClassifier {
    private final double volatileBreadthStd;
    private final double volatileAbsGapPct;
    private final double volatileHeatDispersion;
    private final double activeLimitUpRate;
    private final double activeBreadth;

    public MarketRegimeClassifier() {
        this(null);
    }

    public MarketRegimeClassifier(Config config) {
        this.volatileBreadthStd = read(config, "regime.volatile.breadth_std", 0.12);
        this.volatileAbsGapPct = read(config, "regime.volatile.abs_gap_pct", 1.5);
        this.volatileHeatDispersion = read(config, "regime.volatile.heat_dispersion", 20.0);
        this.activeLimitUpRate = read(config, "regime.active.limit_up_rate", 0.015);
        this.activeBreadth = read(config, "regime.active.breadth", 0.55);
    }

    /**
     * Stats strictly before {@code tradeDate}, one per date, the most recent {@code windowDays},
     * oldest first.
     */
    public List<PeriodStat> window(LocalDate tradeDate, List<PeriodStat> stats, int windowDays) {
        if (stats == null || stats.isEmpty() || windowDays <= 0) {
            return List.of();
        }
        Map<LocalDate, PeriodStat> byDate = new LinkedHashMap<>();
        for (PeriodStat stat : stats) {
            if (stat == null || stat.tradeDate == null) {
                continue;
            }
            if (tradeDate != null && !stat.tradeDate.isBefore(tradeDate)) {
                continue;
            }
            byDate.putIfAbsent(stat.tradeDate, stat);
        }
        List<PeriodStat> sorted = new ArrayList<>(byDate.values());
        sorted.sort(Comparator.comparing((PeriodStat s) -> s.tradeDate));
        int from = Math.max(0, sorted.size() - windowDays);
        return List.copyOf(sorted.subList(from, sorted.size()));
    }

    public MarketRegimeState classify(LocalDate tradeDate, List<PeriodStat> stats, int windowDays) {
        List<PeriodStat> window = window(tradeDate, stats, windowDays);
        if (window.size() < windowDays || window.isEmpty()) {
            return MarketRegimeState.neutral(windowDays, window.size());
        }

        int n = window.size();
        double breadthSum = 0.0;
        double absGapSum = 0.0;
        double dispersionSum = 0.0;
        double limitUpRateSum = 0.0;
        for (PeriodStat stat : window) {
            breadthSum += stat.breadth();
            absGapSum += Math.abs(stat.avgGapPercent);
            dispersionSum += stat.heatDispersion;
            limitUpRateSum += stat.limitUpRate();
        }
        double meanBreadth = breadthSum / n;
        double variance = 0.0;
        for (PeriodStat stat : window) {
            double d = stat.breadth() - meanBreadth;
            variance += d * d;
        }
        double breadthStd = Math.sqrt(variance / n);
        double meanAbsGap = absGapSum / n;
        double meanDispersion = dispersionSum / n;
        double meanLimitUpRate = limitUpRateSum / n;

        MarketRegime regime;
        if (breadthStd >= volatileBreadthStd
                || meanAbsGap >= volatileAbsGapPct
                || meanDispersion >= volatileHeatDispersion) {
            regime = MarketRegime.VOLATILE;
        } else if (meanLimitUpRate >= activeLimitUpRate || meanBreadth >= activeBreadth) {
            regime = MarketRegime.ACTIVE;
        } else {
            regime = MarketRegime.CALM;
        }

        return MarketRegimeState.builder()
                .regime(regime)
                .requestedDays(windowDays)
                .coveredDays(n)
                .windowStart(window.get(0).tradeDate)
                .windowEnd(window.get(n - 1).tradeDate)
                .meanBreadth(meanBreadth)
                .breadthVolatility(breadthStd)
                .meanAbsGapPercent(meanAbsGap)
                .meanHeatDispersion(meanDispersion)
                .meanLimitUpRate(meanLimitUpRate)
                .build();
    }

    private static double read(Config config, String key, double fallback) {
        return config == null ? fallback : config.getDouble(key, fallback);
    }
}
