package com.mainforce.auction.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface ThemeHotnessMapper {
    @Select("SELECT theme, hotness FROM theme_hotness WHERE trade_date=#{tradeDate} ORDER BY theme ASC")
    List<ThemeHotnessRow> selectByTradeDate(@Param("tradeDate") LocalDate tradeDate);
}
