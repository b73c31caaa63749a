package com.mainforce.auction.strategy;

import com.mainforce.auction.model.CandidateResult;
import com.mainforce.auction.model.FilterDecision;
import com.mainforce.auction.model.ScoringParameters;
import com.mainforce.auction.model.SortMode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dedupe, filter, sort, truncate and rank. Ranks are recomputed from the post-filter order, so
 * they are not comparable across different filter settings.
 */
public final class CandidateRanker {
    private static final Comparator<CandidateResult> BY_HEAT_DESC =
            Comparator.comparingDouble((CandidateResult c) -> c.heatScore).reversed()
                    .thenComparing(CandidateResult::code);
    private static final Comparator<CandidateResult> CANDIDATE_FIRST =
            Comparator.comparing((CandidateResult c) -> !c.likelyLimitUp)
                    .thenComparing(BY_HEAT_DESC);

    private final CandidateFilter filter;

    public CandidateRanker(CandidateFilter filter) {
        this.filter = filter;
    }

    public Outcome rank(List<CandidateResult> scored, ScoringParameters params, int limit) {
        List<CandidateResult> unique = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        for (CandidateResult c : scored == null ? List.<CandidateResult>of() : scored) {
            if (c == null) {
                continue;
            }
            if (!seen.add(c.code())) {
                duplicates++;
                continue;
            }
            unique.add(c);
        }

        Map<String, Integer> filtered = new LinkedHashMap<>();
        for (String rule : CandidateFilter.ruleNames()) {
            filtered.put(rule, 0);
        }
        List<CandidateResult> kept = new ArrayList<>(unique.size());
        for (CandidateResult c : unique) {
            FilterDecision decision = filter.evaluate(c, params);
            if (decision.passed) {
                kept.add(c);
                continue;
            }
            for (String reason : decision.reasons) {
                filtered.merge(reason, 1, Integer::sum);
            }
        }

        kept.sort(comparator(params.sortMode));
        int cut = Math.max(0, Math.min(limit, kept.size()));
        List<CandidateResult> ranked = new ArrayList<>(cut);
        for (int i = 0; i < cut; i++) {
            ranked.add(kept.get(i).toBuilder().rank(i + 1).build());
        }
        return new Outcome(ranked, duplicates, filtered, kept.size() - cut);
    }

    static Comparator<CandidateResult> comparator(SortMode mode) {
        return mode == SortMode.HEAT_DESC ? BY_HEAT_DESC : CANDIDATE_FIRST;
    }

    public static final class Outcome {
        public final List<CandidateResult> items;
        public final int duplicateCount;
        public final Map<String, Integer> filteredByRule;
        public final int truncatedCount;

        Outcome(List<CandidateResult> items, int duplicateCount, Map<String, Integer> filteredByRule, int truncatedCount) {
            this.items = List.copyOf(items);
            this.duplicateCount = duplicateCount;
            this.filteredByRule = filteredByRule;
            this.truncatedCount = truncatedCount;
        }
    }
}
