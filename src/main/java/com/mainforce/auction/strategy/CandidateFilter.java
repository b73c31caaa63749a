package com.mainforce.auction.strategy;

import com.mainforce.auction.config.Config;
import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.CandidateResult;
import com.mainforce.auction.model.FilterDecision;
import com.mainforce.auction.model.ScoringParameters;

import java.util.ArrayList;
import java.util.List;

/**
 * Exclusion rules applied after scoring. Each rule is switched by {@link ScoringParameters};
 * thresholds come from {@link Config}.
 */
public final class CandidateFilter {
    public static final String RULE_ST_NAME = "st_name";
    public static final String RULE_AUCTION_LIMIT_UP = "auction_limit_up";
    public static final String RULE_PE_OUT_OF_RANGE = "pe_out_of_range";
    public static final String RULE_LOW_GAP = "gap_not_low";

    private static final List<String> RULE_NAMES = List.of(
            RULE_ST_NAME,
            RULE_AUCTION_LIMIT_UP,
            RULE_PE_OUT_OF_RANGE,
            RULE_LOW_GAP
    );

    private final List<String> stPrefixes;
    private final double lowGapMaxPct;
    private final double peMax;

    public CandidateFilter() {
        this(null);
    }

    public CandidateFilter(Config config) {
        this.stPrefixes = LimitPriceRule.stPrefixes(config);
        this.lowGapMaxPct = config == null ? 5.0 : config.getDouble("filter.low_gap.max_pct", 5.0);
        this.peMax = config == null ? 300.0 : config.getDouble("filter.pe.max", 300.0);
    }

    public FilterDecision evaluate(CandidateResult candidate, ScoringParameters params) {
        List<String> reasons = new ArrayList<>();
        AuctionSnapshot s = candidate.snapshot;
        if (params.excludeSt && isSpecialTreatment(s.name)) {
            reasons.add(RULE_ST_NAME);
        }
        if (params.excludeAuctionLimitUp && s.auctionLimitUp) {
            reasons.add(RULE_AUCTION_LIMIT_UP);
        }
        if (params.peFilterEnabled && !peInRange(s.pe, s.peTtm)) {
            reasons.add(RULE_PE_OUT_OF_RANGE);
        }
        if (params.lowGapOnly && !(candidate.gapPercent() < lowGapMaxPct)) {
            reasons.add(RULE_LOW_GAP);
        }
        return new FilterDecision(reasons.isEmpty(), reasons);
    }

    public boolean isSpecialTreatment(String name) {
        return LimitPriceRule.isSpecialTreatment(name, stPrefixes);
    }

    public List<String> stPrefixes() {
        return stPrefixes;
    }

    /**
     * Both values missing fails; any present value must lie in (0, peMax].
     */
    public boolean peInRange(Double pe, Double peTtm) {
        boolean peMissing = isMissing(pe);
        boolean ttmMissing = isMissing(peTtm);
        if (peMissing && ttmMissing) {
            return false;
        }
        if (!peMissing && !inRange(pe)) {
            return false;
        }
        return ttmMissing || inRange(peTtm);
    }

    public double peMax() {
        return peMax;
    }

    public static List<String> ruleNames() {
        return RULE_NAMES;
    }

    private boolean inRange(double value) {
        return value > 0.0 && value <= peMax;
    }

    private static boolean isMissing(Double value) {
        return value == null || value.isNaN();
    }
}
