package com.mainforce.auction.model;

import java.util.Locale;

/**
 * Candidate ordering. {@code candidate_first} groups likely limit-up stocks ahead of the rest.
 */
public enum SortMode {
    CANDIDATE_FIRST("candidate_first"),
    HEAT_DESC("heat_desc");

    private final String label;

    SortMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Unlike the lenient label lookups elsewhere, an unknown sort mode is a caller mistake and is
     * rejected.
     */
    public static SortMode fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return CANDIDATE_FIRST;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (SortMode mode : values()) {
            if (mode.label.equals(target)) {
                return mode;
            }
        }
        throw new InvalidParameterException("sortMode", raw, "candidate_first|heat_desc");
    }
}
