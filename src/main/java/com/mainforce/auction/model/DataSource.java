package com.mainforce.auction.model;

public enum DataSource {
    AUCTION_SNAPSHOT("auction_snapshot"),
    NONE("none");

    private final String label;

    DataSource(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
