package com.mainforce.auction.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuctionSnapshotRow {
    private LocalDate tradeDate;
    private String code;
    private String name;
    private String industry;
    private String theme;
    private Double price;
    private Double preClose;
    private Double gapPercent;
    private Double vol;
    private Double amount;
    private Double turnoverRate;
    private Double volumeRatio;
    private Double floatShare;
    private Double pe;
    private Double peTtm;
    private Boolean auctionLimitUp;
}
