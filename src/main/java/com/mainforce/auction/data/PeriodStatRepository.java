package com.mainforce.auction.data;

import com.mainforce.auction.model.PeriodStat;

import java.time.LocalDate;
import java.util.List;

public interface PeriodStatRepository {
    /**
     * Up to {@code windowDays} stats strictly before {@code tradeDate}. Fewer entries are
     * returned near the start of history.
     */
    List<PeriodStat> getPeriodStats(LocalDate tradeDate, int windowDays);
}
