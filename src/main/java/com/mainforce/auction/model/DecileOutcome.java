package com.mainforce.auction.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Realized outcome of one heat-score decile on one past trade date. Decile 10 holds the hottest
 * stocks.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class DecileOutcome {
    public final int decile;
    public final int candidates;
    public final int limitUpHits;
}
