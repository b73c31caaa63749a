package com.mainforce.auction.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bookkeeping of one rank call: what was skipped, deduplicated or filtered and why, plus
 * metric distributions and the α calibration evidence.
 */
public final class RankDiagnostics {
    public final int inputRows;
    public final int scoredRows;
    public final Map<SkipReason, Integer> skippedByReason;
    public final int duplicateCount;
    public final Map<String, Integer> filteredByRule;
    public final int truncatedCount;
    public final MetricStats volumeRatio;
    public final MetricStats auctionVolumeRatio;
    public final PeDiagnostics pe;
    public final AlphaCalibration calibration;
    public final MarketRegimeState regimeState;

    public RankDiagnostics(
            int inputRows,
            int scoredRows,
            Map<SkipReason, Integer> skippedByReason,
            int duplicateCount,
            Map<String, Integer> filteredByRule,
            int truncatedCount,
            MetricStats volumeRatio,
            MetricStats auctionVolumeRatio,
            PeDiagnostics pe,
            AlphaCalibration calibration,
            MarketRegimeState regimeState
    ) {
        this.inputRows = Math.max(0, inputRows);
        this.scoredRows = Math.max(0, scoredRows);
        this.skippedByReason = copySkipped(skippedByReason);
        this.duplicateCount = Math.max(0, duplicateCount);
        this.filteredByRule = filteredByRule == null ? Map.of() : copyRules(filteredByRule);
        this.truncatedCount = Math.max(0, truncatedCount);
        this.volumeRatio = volumeRatio == null ? MetricStats.empty() : volumeRatio;
        this.auctionVolumeRatio = auctionVolumeRatio == null ? MetricStats.empty() : auctionVolumeRatio;
        this.pe = pe;
        this.calibration = calibration;
        this.regimeState = regimeState;
    }

    public int skippedTotal() {
        int total = 0;
        for (int n : skippedByReason.values()) {
            total += n;
        }
        return total;
    }

    public int skipped(SkipReason reason) {
        if (reason == null) {
            return 0;
        }
        return skippedByReason.getOrDefault(reason, 0);
    }

    public int filtered(String rule) {
        if (rule == null) {
            return 0;
        }
        return filteredByRule.getOrDefault(rule, 0);
    }

    private static Map<SkipReason, Integer> copySkipped(Map<SkipReason, Integer> in) {
        Map<SkipReason, Integer> out = new EnumMap<>(SkipReason.class);
        for (SkipReason reason : SkipReason.values()) {
            out.put(reason, 0);
        }
        if (in != null) {
            for (Map.Entry<SkipReason, Integer> e : in.entrySet()) {
                if (e.getKey() == null) {
                    continue;
                }
                out.put(e.getKey(), e.getValue() == null ? 0 : Math.max(0, e.getValue()));
            }
        }
        return Map.copyOf(out);
    }

    // Insertion order is kept so the JSON rendering is stable.
    private static Map<String, Integer> copyRules(Map<String, Integer> in) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : in.entrySet()) {
            String key = e.getKey() == null ? "" : e.getKey().trim();
            if (key.isEmpty()) {
                continue;
            }
            out.put(key, e.getValue() == null ? 0 : Math.max(0, e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }
}
