package com.mainforce.auction.strategy;

import com.mainforce.auction.config.Config;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Daily price-limit percentage by board: main board 10%, ChiNext/STAR 20%, Beijing exchange 30%,
 * ST names on the main board 5%.
 */
public final class LimitPriceRule {
    public static final List<String> DEFAULT_ST_PREFIXES = List.of("ST", "*ST", "S*ST", "SST");

    private LimitPriceRule() {
    }

    /**
     * ST name prefixes from {@code filter.st.prefixes}, upper-cased; the defaults when unset.
     */
    public static List<String> stPrefixes(Config config) {
        List<String> prefixes = config == null ? List.of() : config.getList("filter.st.prefixes");
        if (prefixes.isEmpty()) {
            return DEFAULT_ST_PREFIXES;
        }
        List<String> upper = new ArrayList<>(prefixes.size());
        for (String p : prefixes) {
            upper.add(p.toUpperCase(Locale.ROOT));
        }
        return List.copyOf(upper);
    }

    public static boolean isSpecialTreatment(String name, List<String> stPrefixes) {
        if (name == null || stPrefixes == null) {
            return false;
        }
        String compact = name.replace(" ", "").toUpperCase(Locale.ROOT);
        for (String prefix : stPrefixes) {
            if (compact.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public static double limitPercent(String code, String name) {
        return limitPercent(code, name, DEFAULT_ST_PREFIXES);
    }

    public static double limitPercent(String code, String name, List<String> stPrefixes) {
        String digits = digitsOf(code);
        if (digits.startsWith("300") || digits.startsWith("301")
                || digits.startsWith("688") || digits.startsWith("689")) {
            return 20.0;
        }
        if (digits.startsWith("920") || digits.startsWith("8") || digits.startsWith("4")) {
            return 30.0;
        }
        if (isSpecialTreatment(name, stPrefixes)) {
            return 5.0;
        }
        return 10.0;
    }

    public static double limitUpPrice(String code, String name, double preClose) {
        return limitUpPrice(code, name, preClose, DEFAULT_ST_PREFIXES);
    }

    /**
     * Limit-up price rounded half-up to the cent in decimal, the way the exchange quotes it.
     */
    public static double limitUpPrice(String code, String name, double preClose, List<String> stPrefixes) {
        BigDecimal factor = BigDecimal.ONE.add(BigDecimal.valueOf(limitPercent(code, name, stPrefixes)).movePointLeft(2));
        return BigDecimal.valueOf(preClose)
                .multiply(factor)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public static boolean isLimitUp(String code, String name, Double price, Double preClose) {
        return isLimitUp(code, name, price, preClose, DEFAULT_ST_PREFIXES);
    }

    public static boolean isLimitUp(String code, String name, Double price, Double preClose, List<String> stPrefixes) {
        if (price == null || preClose == null || !Double.isFinite(price) || !Double.isFinite(preClose)
                || price <= 0.0 || preClose <= 0.0) {
            return false;
        }
        return price >= limitUpPrice(code, name, preClose, stPrefixes) - 1e-9;
    }

    static String digitsOf(String code) {
        if (code == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(code.length());
        for (char c : code.toCharArray()) {
            if (c >= '0' && c <= '9') {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
