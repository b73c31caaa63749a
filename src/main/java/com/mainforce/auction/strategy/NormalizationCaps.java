package com.mainforce.auction.strategy;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Log-squash caps of one batch. Computed once per trade date so every stock is scored on the
 * same scale.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class NormalizationCaps {
    public final double volumeRatioCap;
    public final double turnoverCap;
    public final double amountCap;
}
