package com.mainforce.auction.data;

import java.time.LocalDate;
import java.util.Map;

public interface ThemeProfileSource {
    /**
     * Raw theme name to hotness factor; empty when nothing is known for the date.
     */
    Map<String, Double> getThemeHotness(LocalDate tradeDate);
}
