package com.mainforce.auction.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface AuctionSnapshotMapper {
    @Select("SELECT trade_date, code, name, industry, theme, price, pre_close, gap_percent, vol, amount, " +
            "turnover_rate, volume_ratio, float_share, pe, pe_ttm, auction_limit_up " +
            "FROM auction_snapshot WHERE trade_date=#{tradeDate} ORDER BY code ASC")
    List<AuctionSnapshotRow> selectByTradeDate(@Param("tradeDate") LocalDate tradeDate);

    @Select("SELECT COUNT(*) FROM auction_collection_log WHERE trade_date=#{tradeDate}")
    int countCollectionLog(@Param("tradeDate") LocalDate tradeDate);

    @Select("SELECT MAX(trade_date) FROM auction_snapshot")
    LocalDate selectLatestTradeDate();

    @Select("SELECT code, AVG(vol) AS avg_vol FROM auction_snapshot " +
            "WHERE vol > 0 AND trade_date IN (" +
            "SELECT DISTINCT trade_date FROM auction_snapshot WHERE trade_date < #{tradeDate} " +
            "ORDER BY trade_date DESC LIMIT #{days}" +
            ") GROUP BY code")
    List<AvgAuctionVolumeRow> selectAvgAuctionVolumes(@Param("tradeDate") LocalDate tradeDate, @Param("days") int days);
}
