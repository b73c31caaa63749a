package com.mainforce.auction.db;

import com.mainforce.auction.db.mybatis.PeriodStatRow;
import com.mainforce.auction.model.DecileOutcome;
import com.mainforce.auction.model.PeriodStat;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PeriodStatDaoTest {

    @Test
    void toStats_shouldReturnOldestFirstWithDeciles() {
        LocalDate d1 = LocalDate.of(2024, 6, 26);
        LocalDate d2 = LocalDate.of(2024, 6, 27);
        List<PeriodStatRow> newestFirst = List.of(
                new PeriodStatRow(d2, 3000, 1500, 5000, 60, 0.4, 12.0),
                new PeriodStatRow(d1, null, null, null, null, null, null)
        );
        Map<LocalDate, List<DecileOutcome>> deciles = Map.of(d2, List.of(new DecileOutcome(10, 500, 40)));

        List<PeriodStat> stats = PeriodStatDao.toStats(newestFirst, deciles);

        assertEquals(2, stats.size());
        assertEquals(d1, stats.get(0).tradeDate);
        assertEquals(0, stats.get(0).totalStocks);
        assertTrue(stats.get(0).deciles.isEmpty());
        assertEquals(d2, stats.get(1).tradeDate);
        assertEquals(1, stats.get(1).deciles.size());
        assertEquals(3000.0 / 4500.0, stats.get(1).breadth(), 1e-12);
    }
}
