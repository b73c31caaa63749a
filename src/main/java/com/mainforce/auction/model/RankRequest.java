package com.mainforce.auction.model;

import java.time.LocalDate;

/**
 * One call of the ranking engine: which trade date, how many candidates to return and how to
 * score them.
 */
public final class RankRequest {
    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 200;

    public final LocalDate tradeDate;
    public final int limit;
    public final ScoringParameters parameters;

    public RankRequest(LocalDate tradeDate, int limit, ScoringParameters parameters) {
        if (tradeDate == null) {
            throw new InvalidParameterException("tradeDate", null, "YYYY-MM-DD");
        }
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new InvalidParameterException("limit", limit, "[" + MIN_LIMIT + ", " + MAX_LIMIT + "]");
        }
        this.tradeDate = tradeDate;
        this.limit = limit;
        this.parameters = parameters == null ? ScoringParameters.defaults() : parameters;
    }

    /**
     * The caller-facing signature in explicit form.
     */
    public static RankRequest of(
            LocalDate tradeDate,
            int limit,
            boolean excludeAuctionLimitUp,
            double themeAlphaRequested,
            boolean peFilterEnabled,
            String sortMode,
            boolean dynamicAlpha,
            int rollingWindowDays
    ) {
        ScoringParameters parameters = ScoringParameters.builder()
                .excludeAuctionLimitUp(excludeAuctionLimitUp)
                .themeAlpha(themeAlphaRequested)
                .peFilterEnabled(peFilterEnabled)
                .sortMode(sortMode)
                .dynamicAlpha(dynamicAlpha)
                .rollingWindowDays(rollingWindowDays)
                .build();
        return new RankRequest(tradeDate, limit, parameters);
    }
}
