package com.mainforce.auction.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * PE distribution of the scored population, counted over both pe and pe_ttm values.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PeDiagnostics {
    public final int negCount;
    public final int zeroCount;
    public final int aboveMaxCount;
    public final int inRangeCount;
    public final int missingCount;
    public final boolean enabled;
}
