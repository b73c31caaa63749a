package com.mainforce.auction.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface PeriodStatMapper {
    @Select("SELECT trade_date, advancers, decliners, total_stocks, limit_up_count, avg_gap_percent, heat_dispersion " +
            "FROM auction_period_stats WHERE trade_date < #{tradeDate} ORDER BY trade_date DESC LIMIT #{limit}")
    List<PeriodStatRow> selectRecentBefore(@Param("tradeDate") LocalDate tradeDate, @Param("limit") int limit);

    @Select({
            "<script>",
            "SELECT trade_date, decile, candidates, limit_up_hits FROM auction_period_decile WHERE trade_date IN ",
            "<foreach collection='dates' item='d' open='(' separator=',' close=')'>",
            "#{d}",
            "</foreach>",
            "ORDER BY trade_date ASC, decile ASC",
            "</script>"
    })
    List<PeriodDecileRow> selectDeciles(@Param("dates") List<LocalDate> dates);
}
