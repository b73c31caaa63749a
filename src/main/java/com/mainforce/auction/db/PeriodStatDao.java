package com.mainforce.auction.db;

import com.mainforce.auction.data.PeriodStatRepository;
import com.mainforce.auction.db.mybatis.MyBatisSupport;
import com.mainforce.auction.db.mybatis.PeriodDecileRow;
import com.mainforce.auction.db.mybatis.PeriodStatMapper;
import com.mainforce.auction.db.mybatis.PeriodStatRow;
import com.mainforce.auction.model.DecileOutcome;
import com.mainforce.auction.model.PeriodStat;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class PeriodStatDao implements PeriodStatRepository {
    private final Database database;

    public PeriodStatDao(Database database) {
        this.database = database;
    }

    @Override
    public List<PeriodStat> getPeriodStats(LocalDate tradeDate, int windowDays) {
        if (windowDays <= 0) {
            return List.of();
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            PeriodStatMapper mapper = session.getMapper(PeriodStatMapper.class);
            List<PeriodStatRow> rows = mapper.selectRecentBefore(tradeDate, windowDays);
            if (rows.isEmpty()) {
                return List.of();
            }
            List<LocalDate> dates = new ArrayList<>(rows.size());
            for (PeriodStatRow row : rows) {
                dates.add(row.getTradeDate());
            }
            Map<LocalDate, List<DecileOutcome>> deciles = new HashMap<>();
            for (PeriodDecileRow d : mapper.selectDeciles(dates)) {
                deciles.computeIfAbsent(d.getTradeDate(), k -> new ArrayList<>())
                        .add(new DecileOutcome(intOf(d.getDecile()), intOf(d.getCandidates()), intOf(d.getLimitUpHits())));
            }
            return toStats(rows, deciles);
        } catch (SQLException e) {
            throw new IllegalStateException("load auction_period_stats failed: trade_date=" + tradeDate
                    + ", window_days=" + windowDays, e);
        }
    }

    /**
     * Oldest first.
     */
    static List<PeriodStat> toStats(List<PeriodStatRow> rows, Map<LocalDate, List<DecileOutcome>> deciles) {
        List<PeriodStat> out = new ArrayList<>(rows.size());
        for (int i = rows.size() - 1; i >= 0; i--) {
            PeriodStatRow row = rows.get(i);
            out.add(new PeriodStat(
                    row.getTradeDate(),
                    intOf(row.getAdvancers()),
                    intOf(row.getDecliners()),
                    intOf(row.getTotalStocks()),
                    intOf(row.getLimitUpCount()),
                    row.getAvgGapPercent() == null ? 0.0 : row.getAvgGapPercent(),
                    row.getHeatDispersion() == null ? 0.0 : row.getHeatDispersion(),
                    deciles.getOrDefault(row.getTradeDate(), List.of())
            ));
        }
        return out;
    }

    private static int intOf(Integer value) {
        return value == null ? 0 : value;
    }
}
