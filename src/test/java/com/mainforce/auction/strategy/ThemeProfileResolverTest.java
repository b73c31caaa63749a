package com.mainforce.auction.strategy;

import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.ThemeProfile;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ThemeProfileResolverTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 3);

    private final ThemeProfileResolver resolver = new ThemeProfileResolver();

    @Test
    void profile_shouldNormalizeKeysAndFloorFactorsAtOne() {
        Map<String, Double> raw = new HashMap<>();
        raw.put(" Chip ", 1.4);
        raw.put("bank", 0.7);
        raw.put("robot", Double.NaN);
        raw.put("ai", 9.0);
        raw.put("  ", 2.0);

        ThemeProfile profile = resolver.profile(DAY, raw);

        assertEquals(4, profile.size());
        assertEquals(1.4, profile.hotness.get("chip"), 1e-12);
        assertEquals(1.0, profile.hotness.get("bank"), 1e-12);
        assertEquals(1.0, profile.hotness.get("robot"), 1e-12);
        assertEquals(3.0, profile.hotness.get("ai"), 1e-12);
    }

    @Test
    void hotnessOf_shouldPickHottestThemeAndFallBackToIndustry() {
        ThemeProfile profile = resolver.profile(DAY, Map.of("chip", 1.4, "ai", 1.8, "semiconductor", 1.2));

        assertEquals(1.8, resolver.hotnessOf(snap("chip,AI", null), profile), 1e-12);
        assertEquals(1.2, resolver.hotnessOf(snap(" ", "Semiconductor"), profile), 1e-12);
        assertEquals(1.0, resolver.hotnessOf(snap("unknown", null), profile), 1e-12);
        assertEquals(1.0, resolver.hotnessOf(snap("chip", null), ThemeProfile.empty(DAY)), 1e-12);
    }

    private static AuctionSnapshot snap(String theme, String industry) {
        return AuctionSnapshot.builder().code("600000").theme(theme).industry(industry).build();
    }
}
