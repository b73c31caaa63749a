package com.mainforce.app;

import com.mainforce.app.properties.DbProperties;
import com.mainforce.auction.config.Config;
import com.mainforce.auction.db.AuctionSnapshotDao;
import com.mainforce.auction.db.Database;
import com.mainforce.auction.db.MigrationRunner;
import com.mainforce.auction.db.PeriodStatDao;
import com.mainforce.auction.db.ThemeHotnessDao;
import com.mainforce.auction.engine.AuctionHeatEngine;
import com.mainforce.auction.strategy.LimitPriceRule;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({DbProperties.class})
public class MainForceBootstrapConfig {
    @Bean
    public Config mainForceConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = new Database(
                readDbUrl(dbProperties),
                readDbUser(dbProperties),
                readDbPass(dbProperties),
                readDbSchema(dbProperties)
        );
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    @Lazy
    public AuctionSnapshotDao auctionSnapshotDao(Config config, Database database) {
        return new AuctionSnapshotDao(
                database,
                config.getInt("snapshot.avg_auction_volume_days", 5),
                LimitPriceRule.stPrefixes(config)
        );
    }

    @Bean
    @Lazy
    public ThemeHotnessDao themeHotnessDao(Database database) {
        return new ThemeHotnessDao(database);
    }

    @Bean
    @Lazy
    public PeriodStatDao periodStatDao(Database database) {
        return new PeriodStatDao(database);
    }

    @Bean
    @Lazy
    public AuctionHeatEngine auctionHeatEngine(
            Config config,
            AuctionSnapshotDao auctionSnapshotDao,
            ThemeHotnessDao themeHotnessDao,
            PeriodStatDao periodStatDao
    ) {
        return new AuctionHeatEngine(config, auctionSnapshotDao, themeHotnessDao, periodStatDao);
    }

    private String readDbUrl(DbProperties dbProperties) {
        return MainForceApplication.firstNonBlank(
                System.getenv("MAINFORCE_DB_URL"),
                dbProperties == null ? null : dbProperties.getUrl(),
                "jdbc:postgresql://localhost:5432/mainforce"
        );
    }

    private String readDbUser(DbProperties dbProperties) {
        return MainForceApplication.firstNonBlank(
                System.getenv("MAINFORCE_DB_USER"),
                dbProperties == null ? null : dbProperties.getUser(),
                "mainforce"
        );
    }

    private String readDbPass(DbProperties dbProperties) {
        return MainForceApplication.firstNonBlank(
                System.getenv("MAINFORCE_DB_PASS"),
                dbProperties == null ? null : dbProperties.getPass(),
                "mainforce"
        );
    }

    private String readDbSchema(DbProperties dbProperties) {
        return MainForceApplication.firstNonBlank(
                dbProperties == null ? null : dbProperties.getSchema(),
                "mainforce"
        );
    }
}
