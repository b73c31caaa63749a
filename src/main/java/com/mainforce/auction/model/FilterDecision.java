package com.mainforce.auction.model;

import java.util.Collections;
import java.util.List;

/**
 * Whether one candidate survived the exclusion rules, and which rules removed it.
 */
public final class FilterDecision {
    public final boolean passed;
    public final List<String> reasons;

    public FilterDecision(boolean passed, List<String> reasons) {
        this.passed = passed;
        this.reasons = reasons == null ? List.of() : Collections.unmodifiableList(reasons);
    }
}
