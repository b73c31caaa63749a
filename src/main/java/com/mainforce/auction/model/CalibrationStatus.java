package com.mainforce.auction.model;

public enum CalibrationStatus {
    DISABLED("disabled"),
    INSUFFICIENT_HISTORY("insufficient_history"),
    CALIBRATED("calibrated");

    private final String label;

    CalibrationStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
