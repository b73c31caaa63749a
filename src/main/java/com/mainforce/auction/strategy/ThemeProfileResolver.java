package com.mainforce.auction.strategy;

import com.mainforce.auction.config.Config;
import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.ThemeProfile;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves a stock's theme hotness for the day. Unknown themes, and factors below 1.0, resolve to
 * 1.0 so the boost can never dampen a score.
 */
public final class ThemeProfileResolver {
    private static final String LABEL_SEPARATORS = "[,;、/|]";

    private final double maxHotness;

    public ThemeProfileResolver() {
        this(null);
    }

    public ThemeProfileResolver(Config config) {
        double configured = config == null ? 3.0 : config.getDouble("theme.hotness.max", 3.0);
        this.maxHotness = Double.isFinite(configured) && configured >= 1.0 ? configured : 3.0;
    }

    public ThemeProfile profile(LocalDate tradeDate, Map<String, Double> rawHotness) {
        if (rawHotness == null || rawHotness.isEmpty()) {
            return ThemeProfile.empty(tradeDate);
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : rawHotness.entrySet()) {
            String key = normalizeKey(e.getKey());
            if (key.isEmpty()) {
                continue;
            }
            double value = sanitize(e.getValue());
            out.merge(key, value, Math::max);
        }
        return new ThemeProfile(tradeDate, out);
    }

    /**
     * Hotness of the snapshot's theme label; a label may list several themes, the hottest wins.
     * Falls back to the industry label when the theme is blank.
     */
    public double hotnessOf(AuctionSnapshot snapshot, ThemeProfile profile) {
        if (snapshot == null || profile == null || profile.hotness.isEmpty()) {
            return 1.0;
        }
        String label = isBlank(snapshot.theme) ? snapshot.industry : snapshot.theme;
        if (isBlank(label)) {
            return 1.0;
        }
        double best = 1.0;
        for (String token : label.split(LABEL_SEPARATORS)) {
            String key = normalizeKey(token);
            if (key.isEmpty()) {
                continue;
            }
            Double hot = profile.hotness.get(key);
            if (hot != null && hot > best) {
                best = hot;
            }
        }
        return best;
    }

    private double sanitize(Double raw) {
        if (raw == null || !Double.isFinite(raw) || raw < 1.0) {
            return 1.0;
        }
        return Math.min(raw, maxHotness);
    }

    static String normalizeKey(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
