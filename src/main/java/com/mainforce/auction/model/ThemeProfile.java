package com.mainforce.auction.model;

import java.time.LocalDate;
import java.util.Map;

/**
 * Theme name to hotness factor for one trade date. Keys are already normalized (trimmed, lower
 * case) and every factor is at least 1.0.
 */
public final class ThemeProfile {
    public final LocalDate tradeDate;
    public final Map<String, Double> hotness;

    public ThemeProfile(LocalDate tradeDate, Map<String, Double> hotness) {
        this.tradeDate = tradeDate;
        this.hotness = hotness == null ? Map.of() : Map.copyOf(hotness);
    }

    public static ThemeProfile empty(LocalDate tradeDate) {
        return new ThemeProfile(tradeDate, Map.of());
    }

    public int size() {
        return hotness.size();
    }
}
