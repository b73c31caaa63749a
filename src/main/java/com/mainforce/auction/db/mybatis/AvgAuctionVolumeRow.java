package com.mainforce.auction.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AvgAuctionVolumeRow {
    private String code;
    private Double avgVol;
}
