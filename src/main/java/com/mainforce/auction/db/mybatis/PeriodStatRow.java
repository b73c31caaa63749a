package com.mainforce.auction.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PeriodStatRow {
    private LocalDate tradeDate;
    private Integer advancers;
    private Integer decliners;
    private Integer totalStocks;
    private Integer limitUpCount;
    private Double avgGapPercent;
    private Double heatDispersion;
}
