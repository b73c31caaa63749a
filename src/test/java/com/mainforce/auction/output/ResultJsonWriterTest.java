package com.mainforce.auction.output;

import com.mainforce.auction.config.Config;
import com.mainforce.auction.engine.AuctionHeatEngine;
import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.RankRequest;
import com.mainforce.auction.model.RankedResultSet;
import com.mainforce.auction.model.SnapshotBatch;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultJsonWriterTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 28);

    private final AuctionHeatEngine engine = new AuctionHeatEngine(Config.defaults(Path.of(".")));
    private final ResultJsonWriter writer = new ResultJsonWriter();

    @Test
    void toJsonObject_shouldUseCamelCaseContract() {
        RankedResultSet result = engine.rank(new RankRequest(DAY, 10, null), batch(), Map.of("chip", 1.4), List.of());

        JSONObject root = writer.toJsonObject(result);

        assertEquals("2024-06-28", root.getString("tradeDate"));
        assertEquals("auction_snapshot", root.getString("dataSource"));
        JSONArray items = root.getJSONArray("items");
        assertEquals(1, items.length());
        JSONObject item = items.getJSONObject(0);
        assertEquals(1, item.getInt("rank"));
        assertEquals("600001", item.getString("code"));
        assertTrue(item.has("heatScore"));
        assertTrue(item.has("baseHeatScore"));
        assertTrue(item.has("themeEnhanceFactor"));
        assertTrue(item.has("likelyLimitUpProb"));
        assertTrue(item.isNull("pe"));
        assertTrue(item.getJSONObject("subScores").has("volumeRatio"));

        JSONObject summary = root.getJSONObject("summary");
        assertEquals(1, summary.getInt("count"));
        assertEquals("neutral", summary.getString("marketRegime"));
        assertEquals(0, summary.getInt("statsDays"));

        JSONObject diagnostics = root.getJSONObject("diagnostics");
        assertEquals(0, diagnostics.getJSONObject("skippedByReason").getInt("missing_price"));
        assertTrue(diagnostics.getJSONObject("volumeRatio").has("below1Count"));
        assertTrue(diagnostics.getJSONObject("auctionVolumeRatio").has("above1Count"));
        assertEquals("insufficient_history", diagnostics.getJSONObject("alphaCalibration").getString("status"));
    }

    @Test
    void toJson_shouldRenderEmptyResult() {
        RankedResultSet result = engine.rank(new RankRequest(DAY, 10, null), SnapshotBatch.notCollected(DAY), Map.of(), List.of());

        JSONObject root = new JSONObject(writer.toJson(result));

        assertEquals("none", root.getString("dataSource"));
        assertEquals(0, root.getJSONArray("items").length());
        assertEquals(0, root.getJSONObject("summary").getInt("count"));
    }

    @Test
    void write_shouldCreateParentDirectories(@TempDir Path tmp) throws Exception {
        RankedResultSet result = engine.rank(new RankRequest(DAY, 10, null), batch(), Map.of(), List.of());

        Path target = writer.write(result, tmp.resolve("out/rank.json"));

        String text = Files.readString(target, StandardCharsets.UTF_8);
        assertEquals("600001", new JSONObject(text).getJSONArray("items").getJSONObject(0).getString("code"));
    }

    private static SnapshotBatch batch() {
        return new SnapshotBatch(DAY, true, List.of(AuctionSnapshot.builder()
                .code("600001").name("芯片龙头").theme("chip")
                .price(10.3).preClose(10.0)
                .volumeRatio(5.0).turnoverRate(8.0).amount(2.0e8)
                .build()));
    }
}
