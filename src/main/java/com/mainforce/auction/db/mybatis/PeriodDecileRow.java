package com.mainforce.auction.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PeriodDecileRow {
    private LocalDate tradeDate;
    private Integer decile;
    private Integer candidates;
    private Integer limitUpHits;
}
