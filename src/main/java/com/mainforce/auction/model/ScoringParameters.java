package com.mainforce.auction.model;

/**
 * Immutable per-call tunables of the ranking engine. Every value is validated in
 * {@link Builder#build()}; out-of-range input is rejected, never clamped.
 */
public final class ScoringParameters {
    public static final double MAX_THEME_ALPHA = 0.5;
    public static final int MAX_ROLLING_WINDOW_DAYS = 250;
    public static final int DEFAULT_ROLLING_WINDOW_DAYS = 20;

    public final ScoreWeights weights;
    public final double themeAlpha;
    public final boolean dynamicAlpha;
    public final boolean peFilterEnabled;
    public final boolean excludeAuctionLimitUp;
    public final boolean excludeSt;
    public final boolean lowGapOnly;
    public final int rollingWindowDays;
    public final SortMode sortMode;

    private ScoringParameters(Builder b) {
        this.weights = b.weights;
        this.themeAlpha = b.themeAlpha;
        this.dynamicAlpha = b.dynamicAlpha;
        this.peFilterEnabled = b.peFilterEnabled;
        this.excludeAuctionLimitUp = b.excludeAuctionLimitUp;
        this.excludeSt = b.excludeSt;
        this.lowGapOnly = b.lowGapOnly;
        this.rollingWindowDays = b.rollingWindowDays;
        this.sortMode = b.sortMode;
    }

    public static ScoringParameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .weights(weights)
                .themeAlpha(themeAlpha)
                .dynamicAlpha(dynamicAlpha)
                .peFilterEnabled(peFilterEnabled)
                .excludeAuctionLimitUp(excludeAuctionLimitUp)
                .excludeSt(excludeSt)
                .lowGapOnly(lowGapOnly)
                .rollingWindowDays(rollingWindowDays)
                .sortMode(sortMode);
    }

    public static final class Builder {
        private ScoreWeights weights = ScoreWeights.defaults();
        private double themeAlpha = 0.25;
        private boolean dynamicAlpha = true;
        private boolean peFilterEnabled = false;
        private boolean excludeAuctionLimitUp = true;
        private boolean excludeSt = true;
        private boolean lowGapOnly = false;
        private int rollingWindowDays = DEFAULT_ROLLING_WINDOW_DAYS;
        private SortMode sortMode = SortMode.CANDIDATE_FIRST;

        private Builder() {
        }

        public Builder weights(ScoreWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder themeAlpha(double themeAlpha) {
            this.themeAlpha = themeAlpha;
            return this;
        }

        public Builder dynamicAlpha(boolean dynamicAlpha) {
            this.dynamicAlpha = dynamicAlpha;
            return this;
        }

        public Builder peFilterEnabled(boolean peFilterEnabled) {
            this.peFilterEnabled = peFilterEnabled;
            return this;
        }

        public Builder excludeAuctionLimitUp(boolean excludeAuctionLimitUp) {
            this.excludeAuctionLimitUp = excludeAuctionLimitUp;
            return this;
        }

        public Builder excludeSt(boolean excludeSt) {
            this.excludeSt = excludeSt;
            return this;
        }

        public Builder lowGapOnly(boolean lowGapOnly) {
            this.lowGapOnly = lowGapOnly;
            return this;
        }

        public Builder rollingWindowDays(int rollingWindowDays) {
            this.rollingWindowDays = rollingWindowDays;
            return this;
        }

        public Builder sortMode(SortMode sortMode) {
            this.sortMode = sortMode;
            return this;
        }

        public Builder sortMode(String label) {
            this.sortMode = SortMode.fromLabel(label);
            return this;
        }

        public ScoringParameters build() {
            if (weights == null) {
                throw new InvalidParameterException("weights", null, "non-null weight vector");
            }
            if (!Double.isFinite(themeAlpha) || themeAlpha < 0.0 || themeAlpha > MAX_THEME_ALPHA) {
                throw new InvalidParameterException("themeAlpha", themeAlpha, "[0, " + MAX_THEME_ALPHA + "]");
            }
            if (rollingWindowDays < 1 || rollingWindowDays > MAX_ROLLING_WINDOW_DAYS) {
                throw new InvalidParameterException("rollingWindowDays", rollingWindowDays, "[1, " + MAX_ROLLING_WINDOW_DAYS + "]");
            }
            if (sortMode == null) {
                throw new InvalidParameterException("sortMode", null, "candidate_first|heat_desc");
            }
            return new ScoringParameters(this);
        }
    }
}
