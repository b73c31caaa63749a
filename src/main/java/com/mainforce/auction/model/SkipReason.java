package com.mainforce.auction.model;

/**
 * Why a snapshot row was left out of scoring.
 */
public enum SkipReason {
    MISSING_CODE("missing_code"),
    MISSING_PRICE("missing_price"),
    MISSING_PRE_CLOSE("missing_pre_close");

    private final String label;

    SkipReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
