package com.trendradar.app;

import com.trendradar.config.Config;
import com.trendradar.config.WeightConfig;
import com.trendradar.config.WeightConfigValidator;
import com.trendradar.exception.ConfigException;
import com.trendradar.exception.ValidationException;
import com.trendradar.io.FetchResultReader;
import com.trendradar.io.RankedOutputWriter;
import com.trendradar.model.PlatformBatch;
import com.trendradar.normalize.TitleNormalizer;
import com.trendradar.runner.AggregationOutcome;
import com.trendradar.runner.TrendAggregator;
import com.trendradar.window.JsonFileWindowStore;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Command-line entry: reads one run's fetch results, aggregates them against the window state
 * and writes the ranked list as JSON.
 */
public final class TrendRadarApplication {
    private static final Logger LOG = LogManager.getLogger(TrendRadarApplication.class);
    private static final List<String> LOGGED_CONFIG_KEYS = List.of(
            "app.zone",
            "state.path",
            "weight.rank",
            "weight.frequency",
            "weight.keyword",
            "window.days",
            "rank.top_n",
            "rank.max_considered",
            "dedup.similarity_threshold"
    );

    private final Path workingDir;
    private final PrintStream stdout;

    public TrendRadarApplication() {
        this(Path.of(".").toAbsolutePath().normalize(), utf8Stdout());
    }

    TrendRadarApplication(Path workingDir, PrintStream stdout) {
        this.workingDir = workingDir;
        this.stdout = stdout;
    }

    public static void main(String[] args) {
        int exit = new TrendRadarApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("trendradar", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("trendradar", options);
            return 0;
        }
        if (!cmd.hasOption("input")) {
            new HelpFormatter().printHelp("trendradar", options);
            System.err.println("ERROR: --input is required.");
            return 2;
        }

        try {
            Config config = Config.load(workingDir);
            return runOnce(cmd, config);
        } catch (ValidationException | ConfigException e) {
            LOG.error("configuration rejected: {}", e.getMessage());
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            LOG.error("run failed", e);
            System.err.println("FATAL: " + e.getMessage());
            return 1;
        }
    }

    int runOnce(CommandLine cmd, Config config) throws Exception {
        logConfigSnapshot(config);
        WeightConfig weights = WeightConfig.fromConfig(config);
        WeightConfigValidator validator = new WeightConfigValidator();
        validator.validate(weights);
        List<String> declaredPlatforms = config.getList("platforms");
        if (!declaredPlatforms.isEmpty()) {
            validator.validatePlatforms(declaredPlatforms);
        }

        ZoneId zone = ZoneId.of(config.getString("app.zone", "Asia/Shanghai"));
        LocalDate today = resolveDate(cmd.getOptionValue("date"), zone);
        Path statePath = cmd.hasOption("state")
                ? workingDir.resolve(cmd.getOptionValue("state")).normalize()
                : config.getPath("state.path");
        Path inputPath = workingDir.resolve(cmd.getOptionValue("input")).normalize();

        LOG.info("trendradar run date={} zone={} input={} state={} weights(rank={}, frequency={}, keyword={}) window_days={} top_n={}",
                today, zone, inputPath, statePath,
                weights.rankWeight, weights.frequencyWeight, weights.keywordWeight,
                weights.windowDays, weights.topN);

        List<PlatformBatch> batches = new FetchResultReader(Instant.now()).read(inputPath);
        TrendAggregator aggregator = new TrendAggregator(weights, TitleNormalizer.fromConfig(config), zone);
        AggregationOutcome outcome = aggregator.aggregate(batches, today, new JsonFileWindowStore(statePath));

        RankedOutputWriter writer = new RankedOutputWriter();
        if (cmd.hasOption("output")) {
            Path outputPath = workingDir.resolve(cmd.getOptionValue("output")).normalize();
            writer.write(outcome, today, outputPath);
            LOG.info("ranked output written to {} rows={}", outputPath, outcome.rankedItems.size());
        } else {
            stdout.println(writer.toJson(outcome, today).toString(2));
            stdout.flush();
        }
        LOG.info("run summary\n{}", outcome.telemetrySummary);
        return 0;
    }

    private void logConfigSnapshot(Config config) {
        for (String key : LOGGED_CONFIG_KEYS) {
            Config.ResolvedValue resolved = config.resolve(key);
            LOG.info("config {}={} source={}", resolved.key, resolved.value, resolved.source);
        }
    }

    private LocalDate resolveDate(String raw, ZoneId zone) {
        if (raw == null || raw.trim().isEmpty()) {
            return LocalDate.now(zone);
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigException("--date must be yyyy-MM-dd, got '" + raw + "'", e);
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("i").longOpt("input").hasArg().argName("file")
                .desc("Fetch result JSON with per-platform lists").build());
        options.addOption(Option.builder("d").longOpt("date").hasArg().argName("yyyy-MM-dd")
                .desc("Run date (default: today in app.zone)").build());
        options.addOption(Option.builder("s").longOpt("state").hasArg().argName("file")
                .desc("Window state file (default: state.path)").build());
        options.addOption(Option.builder("o").longOpt("output").hasArg().argName("file")
                .desc("Write ranked JSON here instead of stdout").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }

    static PrintStream utf8Stdout() {
        return new PrintStream(System.out, true, StandardCharsets.UTF_8);
    }
}
