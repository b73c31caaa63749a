package com.mainforce.auction.db;

import com.mainforce.auction.data.ThemeProfileSource;
import com.mainforce.auction.db.mybatis.MyBatisSupport;
import com.mainforce.auction.db.mybatis.ThemeHotnessMapper;
import com.mainforce.auction.db.mybatis.ThemeHotnessRow;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

public final class ThemeHotnessDao implements ThemeProfileSource {
    private final Database database;

    public ThemeHotnessDao(Database database) {
        this.database = database;
    }

    @Override
    public Map<String, Double> getThemeHotness(LocalDate tradeDate) {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            Map<String, Double> out = new LinkedHashMap<>();
            for (ThemeHotnessRow row : session.getMapper(ThemeHotnessMapper.class).selectByTradeDate(tradeDate)) {
                if (row == null || row.getTheme() == null || row.getHotness() == null) {
                    continue;
                }
                out.put(row.getTheme(), row.getHotness());
            }
            return out;
        } catch (SQLException e) {
            throw new IllegalStateException("load theme_hotness failed: trade_date=" + tradeDate, e);
        }
    }
}
