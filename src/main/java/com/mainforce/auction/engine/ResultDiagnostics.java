package com.mainforce.auction.engine;

import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.CandidateResult;
import com.mainforce.auction.model.MetricStats;
import com.mainforce.auction.model.PeDiagnostics;

import java.util.List;
import java.util.function.DoublePredicate;
import java.util.function.ToDoubleFunction;

/**
 * Aggregates reported next to the ranked list.
 */
final class ResultDiagnostics {

    private ResultDiagnostics() {
    }

    static MetricStats metricStats(
            List<CandidateResult> items,
            ToDoubleFunction<AuctionSnapshot> metric,
            DoublePredicate counted
    ) {
        if (items == null || items.isEmpty()) {
            return MetricStats.empty();
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        int count = 0;
        for (CandidateResult item : items) {
            double v = metric.applyAsDouble(item.snapshot);
            min = Math.min(min, v);
            max = Math.max(max, v);
            sum += v;
            if (counted.test(v)) {
                count++;
            }
        }
        double avg = Math.round(sum / items.size() * 100.0) / 100.0;
        return new MetricStats(min, max, avg, count);
    }

    /**
     * Counts pe and pe_ttm values separately; {@code missingCount} counts rows where both are
     * missing.
     */
    static PeDiagnostics peDiagnostics(List<CandidateResult> scored, boolean enabled, double peMax) {
        int neg = 0;
        int zero = 0;
        int above = 0;
        int inRange = 0;
        int missing = 0;
        for (CandidateResult c : scored) {
            Double pe = c.snapshot.pe;
            Double peTtm = c.snapshot.peTtm;
            boolean peMissing = isMissing(pe);
            boolean ttmMissing = isMissing(peTtm);
            if (peMissing && ttmMissing) {
                missing++;
            }
            for (Double v : new Double[]{peMissing ? null : pe, ttmMissing ? null : peTtm}) {
                if (v == null) {
                    continue;
                }
                if (v < 0.0) {
                    neg++;
                } else if (v == 0.0) {
                    zero++;
                } else if (v > peMax) {
                    above++;
                } else {
                    inRange++;
                }
            }
        }
        return new PeDiagnostics(neg, zero, above, inRange, missing, enabled);
    }

    static double orZero(Double v) {
        return v != null && Double.isFinite(v) ? v : 0.0;
    }

    private static boolean isMissing(Double v) {
        return v == null || v.isNaN();
    }
}
