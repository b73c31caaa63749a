package com.mainforce.auction.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL schema migration runner.
 */
public final class MigrationRunner {
    private static final Logger log = LogManager.getLogger(MigrationRunner.class);
    private static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                log.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            if (currentVersion != TARGET_VERSION) {
                log.info("schema {} migrated from version {} to {}", schema, currentVersion, TARGET_VERSION);
            }
        }
    }

    List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS auction_snapshot (" +
                "trade_date DATE NOT NULL," +
                "code TEXT NOT NULL," +
                "name TEXT NULL," +
                "industry TEXT NULL," +
                "theme TEXT NULL," +
                "price NUMERIC NULL," +
                "pre_close NUMERIC NULL," +
                "gap_percent NUMERIC NULL," +
                "vol NUMERIC NULL," +
                "amount NUMERIC NULL," +
                "turnover_rate NUMERIC NULL," +
                "volume_ratio NUMERIC NULL," +
                "float_share NUMERIC NULL," +
                "pe NUMERIC NULL," +
                "pe_ttm NUMERIC NULL," +
                "auction_limit_up BOOLEAN NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "PRIMARY KEY (trade_date, code)" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_auction_snapshot_code_date ON auction_snapshot(code, trade_date)");

        sqls.add("CREATE TABLE IF NOT EXISTS auction_collection_log (" +
                "trade_date DATE PRIMARY KEY," +
                "source TEXT NOT NULL," +
                "row_count INTEGER NOT NULL DEFAULT 0," +
                "collected_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS theme_hotness (" +
                "trade_date DATE NOT NULL," +
                "theme TEXT NOT NULL," +
                "hotness NUMERIC NOT NULL," +
                "PRIMARY KEY (trade_date, theme)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS auction_period_stats (" +
                "trade_date DATE PRIMARY KEY," +
                "advancers INTEGER NOT NULL DEFAULT 0," +
                "decliners INTEGER NOT NULL DEFAULT 0," +
                "total_stocks INTEGER NOT NULL DEFAULT 0," +
                "limit_up_count INTEGER NOT NULL DEFAULT 0," +
                "avg_gap_percent NUMERIC NOT NULL DEFAULT 0," +
                "heat_dispersion NUMERIC NOT NULL DEFAULT 0" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS auction_period_decile (" +
                "trade_date DATE NOT NULL," +
                "decile INTEGER NOT NULL CHECK (decile BETWEEN 1 AND 10)," +
                "candidates INTEGER NOT NULL DEFAULT 0," +
                "limit_up_hits INTEGER NOT NULL DEFAULT 0," +
                "PRIMARY KEY (trade_date, decile)" +
                ")");

        return sqls;
    }

    private int readSchemaVersion(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'")) {
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String value = rs.getString(1);
                    if (value != null && !value.trim().isEmpty()) {
                        return Integer.parseInt(value.trim());
                    }
                }
            }
        } catch (SQLException | NumberFormatException e) {
            log.warn("schema_version unreadable, assuming 0: {}", e.getMessage());
            return 0;
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    static String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
