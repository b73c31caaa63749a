package com.mainforce.app;

import com.mainforce.auction.config.Config;
import com.mainforce.auction.db.AuctionSnapshotDao;
import com.mainforce.auction.db.Database;
import com.mainforce.auction.db.MigrationRunner;
import com.mainforce.auction.db.PeriodStatDao;
import com.mainforce.auction.db.ThemeHotnessDao;
import com.mainforce.auction.engine.AuctionHeatEngine;
import com.mainforce.auction.model.InvalidParameterException;
import com.mainforce.auction.model.RankRequest;
import com.mainforce.auction.model.RankedResultSet;
import com.mainforce.auction.model.ScoreWeights;
import com.mainforce.auction.model.ScoringParameters;
import com.mainforce.auction.output.ResultJsonWriter;
import com.mainforce.auction.strategy.LimitPriceRule;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

public final class MainForceApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new MainForceApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("mainforce", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("mainforce", options);
            return 0;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);

        LocalDate tradeDate;
        int limit;
        ScoringParameters parameters;
        try {
            tradeDate = parseDate(cmd.getOptionValue("date"));
            limit = parseLimit(cmd.getOptionValue("limit"), config.getInt("rank.limit.default", 20));
            parameters = parseParameters(cmd, config);
        } catch (InvalidParameterException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        try {
            installLogRoutingIfNeeded(config);
            Database database = new Database(
                    readDbUrl(config),
                    readDbUser(config),
                    readDbPass(config),
                    config.getString("db.schema", "mainforce")
            );
            System.out.println("DB url=" + database.maskedJdbcUrl() + ", schema=" + database.schema());
            new MigrationRunner().run(database);

            AuctionSnapshotDao snapshotDao = new AuctionSnapshotDao(
                    database,
                    config.getInt("snapshot.avg_auction_volume_days", 5),
                    LimitPriceRule.stPrefixes(config)
            );
            AuctionHeatEngine engine = new AuctionHeatEngine(
                    config,
                    snapshotDao,
                    new ThemeHotnessDao(database),
                    new PeriodStatDao(database)
            );

            if (tradeDate == null) {
                Optional<LocalDate> latest = snapshotDao.latestTradeDate();
                tradeDate = latest.orElse(LocalDate.now(ZoneId.of(config.getString("app.zone", "Asia/Shanghai"))));
                System.out.println("trade date not given, using " + tradeDate);
            }

            RankedResultSet result = engine.rank(new RankRequest(tradeDate, limit, parameters));
            ResultJsonWriter writer = new ResultJsonWriter();
            String outputRaw = cmd.getOptionValue("output");
            if (outputRaw != null && !outputRaw.trim().isEmpty()) {
                Path target = writer.write(result, workingDir.resolve(outputRaw.trim()).normalize());
                System.out.println("Result written: " + target + " (count=" + result.summary.count + ")");
            } else {
                System.out.println(writer.toPrettyJson(result));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("date").hasArg().argName("yyyy-MM-dd").desc("trade date; defaults to the latest collected date").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("number of candidates to return, 1..200").build());
        options.addOption(Option.builder().longOpt("theme-alpha").hasArg().argName("alpha").desc("requested theme boost strength, 0..0.5").build());
        options.addOption(Option.builder().longOpt("include-auction-limit-up").desc("keep stocks already at limit-up in the auction").build());
        options.addOption(Option.builder().longOpt("pe-filter").desc("drop stocks whose PE is missing or outside (0, 300]").build());
        options.addOption(Option.builder().longOpt("sort").hasArg().argName("mode").desc("candidate_first or heat_desc").build());
        options.addOption(Option.builder().longOpt("dynamic-alpha").hasArg().argName("true|false").desc("calibrate alpha from recent history (default true)").build());
        options.addOption(Option.builder().longOpt("window").hasArg().argName("days").desc("rolling history window, 1..250").build());
        options.addOption(Option.builder().longOpt("low-gap-only").desc("keep only candidates gapping up less than 5%").build());
        options.addOption(Option.builder().longOpt("include-st").desc("keep ST names").build());
        options.addOption(Option.builder().longOpt("output").hasArg().argName("file").desc("write JSON to a file instead of stdout").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    ScoringParameters parseParameters(CommandLine cmd, Config config) {
        ScoreWeights weights = new ScoreWeights(
                config.getDouble("score.weight_volume_ratio"),
                config.getDouble("score.weight_turnover"),
                config.getDouble("score.weight_gap"),
                config.getDouble("score.weight_amount")
        );
        ScoringParameters.Builder builder = ScoringParameters.builder()
                .weights(weights)
                .themeAlpha(parseDouble("themeAlpha", cmd.getOptionValue("theme-alpha"), config.getDouble("theme.alpha.default", 0.25)))
                .excludeAuctionLimitUp(!cmd.hasOption("include-auction-limit-up"))
                .peFilterEnabled(cmd.hasOption("pe-filter"))
                .dynamicAlpha(parseBoolean("dynamicAlpha", cmd.getOptionValue("dynamic-alpha"), true))
                .lowGapOnly(cmd.hasOption("low-gap-only"))
                .excludeSt(!cmd.hasOption("include-st"))
                .rollingWindowDays(parseInt("rollingWindowDays", cmd.getOptionValue("window"),
                        config.getInt("regime.window_days", ScoringParameters.DEFAULT_ROLLING_WINDOW_DAYS)))
                .sortMode(firstNonBlank(cmd.getOptionValue("sort"), config.getString("rank.sort_mode", "candidate_first")));
        return builder.build();
    }

    static LocalDate parseDate(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidParameterException("tradeDate", raw, "yyyy-MM-dd");
        }
    }

    static int parseLimit(String raw, int fallback) {
        int limit = parseInt("limit", raw, fallback);
        if (limit < RankRequest.MIN_LIMIT || limit > RankRequest.MAX_LIMIT) {
            throw new InvalidParameterException("limit", limit, "[" + RankRequest.MIN_LIMIT + ", " + RankRequest.MAX_LIMIT + "]");
        }
        return limit;
    }

    private static int parseInt(String name, String raw, int fallback) {
        if (raw == null || raw.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(name, raw, "integer");
        }
    }

    private static double parseDouble(String name, String raw, double fallback) {
        if (raw == null || raw.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(name, raw, "number");
        }
    }

    private static boolean parseBoolean(String name, String raw, boolean fallback) {
        if (raw == null || raw.trim().isEmpty()) {
            return fallback;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("true") || value.equals("1") || value.equals("yes")) {
            return true;
        }
        if (value.equals("false") || value.equals("0") || value.equals("no")) {
            return false;
        }
        throw new InvalidParameterException(name, raw, "true|false");
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (MainForceApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("mainforce.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(MainForceApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private String readDbUrl(Config config) {
        return firstNonBlank(System.getenv("MAINFORCE_DB_URL"), config.getString("db.url"));
    }

    private String readDbUser(Config config) {
        return firstNonBlank(System.getenv("MAINFORCE_DB_USER"), config.getString("db.user"));
    }

    private String readDbPass(Config config) {
        return firstNonBlank(System.getenv("MAINFORCE_DB_PASS"), config.getString("db.pass"));
    }

    static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
