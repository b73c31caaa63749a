package com.mainforce.auction.output;

import com.mainforce.auction.model.AlphaCalibration;
import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.CandidateResult;
import com.mainforce.auction.model.MarketRegimeState;
import com.mainforce.auction.model.MetricStats;
import com.mainforce.auction.model.PeDiagnostics;
import com.mainforce.auction.model.RankDiagnostics;
import com.mainforce.auction.model.RankSummary;
import com.mainforce.auction.model.RankedResultSet;
import com.mainforce.auction.model.SkipReason;
import com.mainforce.auction.model.SubScores;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Renders a {@link RankedResultSet} as camelCase JSON.
 */
public final class ResultJsonWriter {

    public String toJson(RankedResultSet result) {
        return toJsonObject(result).toString();
    }

    public String toPrettyJson(RankedResultSet result) {
        return toJsonObject(result).toString(2);
    }

    public Path write(RankedResultSet result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toPrettyJson(result), StandardCharsets.UTF_8);
        return target;
    }

    public JSONObject toJsonObject(RankedResultSet result) {
        JSONObject root = new JSONObject();
        root.put("tradeDate", result.tradeDate == null ? JSONObject.NULL : result.tradeDate.toString());
        root.put("dataSource", result.dataSource.label());
        JSONArray items = new JSONArray();
        for (CandidateResult item : result.items) {
            items.put(item(item));
        }
        root.put("items", items);
        root.put("summary", result.summary == null ? new JSONObject() : summary(result.summary));
        root.put("diagnostics", result.diagnostics == null ? new JSONObject() : diagnostics(result.diagnostics));
        return root;
    }

    private JSONObject item(CandidateResult c) {
        AuctionSnapshot s = c.snapshot;
        JSONObject out = new JSONObject();
        out.put("rank", c.rank);
        out.put("code", s.code);
        out.put("name", nullable(s.name));
        out.put("industry", nullable(s.industry));
        out.put("theme", nullable(s.theme));
        out.put("price", nullable(s.price));
        out.put("preClose", nullable(s.preClose));
        out.put("gapPercent", round(c.gapPercent(), 2));
        out.put("vol", nullable(s.vol));
        out.put("amount", nullable(s.amount));
        out.put("turnoverRate", nullable(s.turnoverRate));
        out.put("volumeRatio", nullable(s.volumeRatio));
        out.put("auctionVolumeRatio", nullable(s.auctionVolumeRatio));
        out.put("floatShare", nullable(s.floatShare));
        out.put("pe", nullable(s.pe));
        out.put("peTtm", nullable(s.peTtm));
        out.put("auctionLimitUp", s.auctionLimitUp);
        out.put("baseHeatScore", c.baseHeatScore);
        out.put("heatScore", c.heatScore);
        out.put("themeHotness", c.themeHotness);
        out.put("themeEnhanceFactor", c.themeEnhanceFactor);
        out.put("likelyLimitUp", c.likelyLimitUp);
        out.put("likelyLimitUpProb", c.likelyLimitUpProb);
        out.put("subScores", subScores(c.subScores));
        return out;
    }

    private JSONObject subScores(SubScores sub) {
        JSONObject out = new JSONObject();
        if (sub == null) {
            return out;
        }
        out.put("volumeRatio", round(sub.volumeRatio, 4));
        out.put("turnoverRate", round(sub.turnoverRate, 4));
        out.put("gapPercent", round(sub.gapPercent, 4));
        out.put("amount", round(sub.amount, 4));
        return out;
    }

    private JSONObject summary(RankSummary s) {
        JSONObject out = new JSONObject();
        out.put("count", s.count);
        out.put("avgHeat", s.avgHeat);
        out.put("totalAmount", s.totalAmount);
        out.put("limitUpCandidates", s.limitUpCandidates);
        out.put("marketRegime", s.marketRegime == null ? JSONObject.NULL : s.marketRegime.label());
        out.put("themeAlphaInput", s.themeAlphaInput);
        out.put("themeAlphaEffective", round(s.themeAlphaEffective, 4));
        out.put("statsDays", s.statsDays);
        out.put("requestedWindowDays", s.requestedWindowDays);
        return out;
    }

    private JSONObject diagnostics(RankDiagnostics d) {
        JSONObject out = new JSONObject();
        out.put("inputRows", d.inputRows);
        out.put("scoredRows", d.scoredRows);
        JSONObject skipped = new JSONObject();
        for (SkipReason reason : SkipReason.values()) {
            skipped.put(reason.label(), d.skipped(reason));
        }
        out.put("skippedByReason", skipped);
        out.put("duplicateCount", d.duplicateCount);
        JSONObject filtered = new JSONObject();
        for (Map.Entry<String, Integer> e : d.filteredByRule.entrySet()) {
            filtered.put(e.getKey(), e.getValue());
        }
        out.put("filteredByRule", filtered);
        out.put("truncatedCount", d.truncatedCount);
        out.put("volumeRatio", metric(d.volumeRatio, "below1Count"));
        out.put("auctionVolumeRatio", metric(d.auctionVolumeRatio, "above1Count"));
        if (d.pe != null) {
            out.put("pe", pe(d.pe));
        }
        if (d.calibration != null) {
            out.put("alphaCalibration", calibration(d.calibration));
        }
        if (d.regimeState != null) {
            out.put("regime", regime(d.regimeState));
        }
        return out;
    }

    private JSONObject metric(MetricStats m, String countKey) {
        JSONObject out = new JSONObject();
        out.put("min", m.min);
        out.put("max", m.max);
        out.put("avg", m.avg);
        out.put(countKey, m.thresholdCount);
        return out;
    }

    private JSONObject pe(PeDiagnostics pe) {
        JSONObject out = new JSONObject();
        out.put("negCount", pe.negCount);
        out.put("zeroCount", pe.zeroCount);
        out.put("aboveMaxCount", pe.aboveMaxCount);
        out.put("inRangeCount", pe.inRangeCount);
        out.put("missingCount", pe.missingCount);
        out.put("enabled", pe.enabled);
        return out;
    }

    private JSONObject calibration(AlphaCalibration a) {
        JSONObject out = new JSONObject();
        out.put("status", a.status == null ? JSONObject.NULL : a.status.label());
        out.put("input", a.input);
        out.put("effective", round(a.effective, 4));
        out.put("lift", round(a.lift, 4));
        out.put("correlation", round(a.correlation, 4));
        out.put("strength", round(a.strength, 4));
        out.put("regimeFactor", a.regimeFactor);
        return out;
    }

    private JSONObject regime(MarketRegimeState r) {
        JSONObject out = new JSONObject();
        out.put("regime", r.regime.label());
        out.put("requestedDays", r.requestedDays);
        out.put("coveredDays", r.coveredDays);
        out.put("windowStart", r.windowStart == null ? JSONObject.NULL : r.windowStart.toString());
        out.put("windowEnd", r.windowEnd == null ? JSONObject.NULL : r.windowEnd.toString());
        out.put("meanBreadth", round(r.meanBreadth, 4));
        out.put("breadthVolatility", round(r.breadthVolatility, 4));
        out.put("meanAbsGapPercent", round(r.meanAbsGapPercent, 4));
        out.put("meanHeatDispersion", round(r.meanHeatDispersion, 4));
        out.put("meanLimitUpRate", round(r.meanLimitUpRate, 4));
        return out;
    }

    private static Object nullable(Object value) {
        if (value == null) {
            return JSONObject.NULL;
        }
        if (value instanceof Double d && !Double.isFinite(d)) {
            return JSONObject.NULL;
        }
        return value;
    }

    private static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        double factor = Math.pow(10, scale);
        return Math.round(value * factor) / factor;
    }
}
