package com.mainforce.auction.db;

import com.mainforce.auction.data.SnapshotRepository;
import com.mainforce.auction.db.mybatis.AuctionSnapshotMapper;
import com.mainforce.auction.db.mybatis.AuctionSnapshotRow;
import com.mainforce.auction.db.mybatis.AvgAuctionVolumeRow;
import com.mainforce.auction.db.mybatis.MyBatisSupport;
import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.SnapshotBatch;
import com.mainforce.auction.strategy.LimitPriceRule;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class AuctionSnapshotDao implements SnapshotRepository {
    private static final Logger log = LogManager.getLogger(AuctionSnapshotDao.class);

    private final Database database;
    private final int avgVolumeDays;
    private final List<String> stPrefixes;

    public AuctionSnapshotDao(Database database, int avgVolumeDays, List<String> stPrefixes) {
        this.database = database;
        this.avgVolumeDays = Math.max(1, avgVolumeDays);
        this.stPrefixes = stPrefixes == null ? LimitPriceRule.DEFAULT_ST_PREFIXES : List.copyOf(stPrefixes);
    }

    @Override
    public SnapshotBatch findBatch(LocalDate tradeDate) {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            AuctionSnapshotMapper mapper = session.getMapper(AuctionSnapshotMapper.class);
            List<AuctionSnapshotRow> rows = mapper.selectByTradeDate(tradeDate);
            boolean logged = mapper.countCollectionLog(tradeDate) > 0;
            if (rows.isEmpty()) {
                log.info("no auction snapshots for {} (collected={})", tradeDate, logged);
                return new SnapshotBatch(tradeDate, logged, List.of());
            }

            Map<String, Double> avgVolumes = new HashMap<>();
            for (AvgAuctionVolumeRow avg : mapper.selectAvgAuctionVolumes(tradeDate, avgVolumeDays)) {
                if (avg != null && avg.getCode() != null) {
                    avgVolumes.put(avg.getCode(), avg.getAvgVol());
                }
            }
            List<AuctionSnapshot> out = new ArrayList<>(rows.size());
            for (AuctionSnapshotRow row : rows) {
                out.add(toSnapshot(row, avgVolumes.get(row.getCode()), stPrefixes));
            }
            return new SnapshotBatch(tradeDate, true, out);
        } catch (SQLException e) {
            throw new IllegalStateException("load auction_snapshot failed: trade_date=" + tradeDate, e);
        }
    }

    @Override
    public Optional<LocalDate> latestTradeDate() {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(AuctionSnapshotMapper.class).selectLatestTradeDate());
        } catch (SQLException e) {
            throw new IllegalStateException("load latest auction trade_date failed", e);
        }
    }

    /**
     * Stored gap and limit-up flags win; missing ones are derived from price and previous close.
     */
    static AuctionSnapshot toSnapshot(AuctionSnapshotRow row, Double avgAuctionVolume, List<String> stPrefixes) {
        Double gap = row.getGapPercent();
        if (gap == null && usable(row.getPrice()) && usable(row.getPreClose())) {
            gap = (row.getPrice() - row.getPreClose()) / row.getPreClose() * 100.0;
        }
        boolean limitUp = row.getAuctionLimitUp() != null
                ? row.getAuctionLimitUp()
                : LimitPriceRule.isLimitUp(row.getCode(), row.getName(), row.getPrice(), row.getPreClose(), stPrefixes);
        double auctionVolumeRatio = 0.0;
        if (usable(avgAuctionVolume) && row.getVol() != null && Double.isFinite(row.getVol())) {
            auctionVolumeRatio = row.getVol() / avgAuctionVolume;
        }

        return AuctionSnapshot.builder()
                .code(row.getCode() == null ? null : row.getCode().trim())
                .name(row.getName())
                .industry(row.getIndustry())
                .theme(row.getTheme())
                .price(row.getPrice())
                .preClose(row.getPreClose())
                .gapPercent(gap)
                .vol(row.getVol())
                .amount(row.getAmount())
                .turnoverRate(row.getTurnoverRate())
                .volumeRatio(row.getVolumeRatio())
                .floatShare(row.getFloatShare())
                .auctionLimitUp(limitUp)
                .pe(row.getPe())
                .peTtm(row.getPeTtm())
                .auctionVolumeRatio(auctionVolumeRatio)
                .build();
    }

    private static boolean usable(Double value) {
        return value != null && Double.isFinite(value) && value > 0.0;
    }
}
