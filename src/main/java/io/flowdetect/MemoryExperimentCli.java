package io.flowdetect;

import io.flowdetect.circuit.Circuit;
import io.flowdetect.compile.Detector;
import io.flowdetect.compile.DetectorComputation;
import io.flowdetect.compile.MemoryExperiment;
import io.flowdetect.config.EngineConfig;
import io.flowdetect.database.DatabaseMode;
import io.flowdetect.database.DetectorDatabase;
import io.flowdetect.database.DetectorDatabaseStore;
import io.flowdetect.exceptions.FlowDetectException;
import io.flowdetect.match.DetectorMatcher;
import io.flowdetect.report.DetectorReport;
import io.flowdetect.report.JsonDetectorReporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point computing the detectors of a CSS surface-code memory experiment.
 */
@Command(
        name = "flow-detect-memory",
        mixinStandardHelpOptions = true,
        version = "flow-detect 1.0.0",
        description = "Computes the detectors of a CSS memory experiment over the alternating square template.",
        footer = {
                "",
                "Examples:",
                "  flow-detect-memory -k 2",
                "  flow-detect-memory -k 3 --rounds 1 --format json --output detectors.json",
                "  flow-detect-memory -k 4 --database detectors-db.json",
                "  flow-detect-memory -k 4 --database detectors-db.json --strict"
        }
)
public class MemoryExperimentCli implements Callable<Integer> {

    @Option(
            names = {"-k"},
            description = "Template scaling parameter; the code distance is 2k+1",
            defaultValue = "2"
    )
    private int k;

    @Option(
            names = {"--rounds"},
            description = "Number of rounds: 1 (initialisation only) or 2 (initialisation then memory)",
            defaultValue = "2"
    )
    private int rounds;

    @Option(
            names = {"--radius"},
            description = "Initial situation radius (defaults to the configured value)"
    )
    private Integer radius;

    @Option(
            names = {"--max-radius"},
            description = "Maximum situation radius (defaults to the configured value)"
    )
    private Integer maxRadius;

    @Option(
            names = {"--database"},
            description = "JSON detector database, loaded if it exists and saved after the computation"
    )
    private Path databaseFile;

    @Option(
            names = {"--strict"},
            description = "Only read detectors from the database; a missing situation is an error"
    )
    private boolean strict;

    @Option(
            names = {"--format"},
            description = "Output format: stim (default), json",
            defaultValue = "stim"
    )
    private OutputFormat format;

    @Option(
            names = {"-o", "--output"},
            description = "Output file (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file"
    )
    private Path configFile;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    public enum OutputFormat {
        stim,
        json
    }

    @Override
    public Integer call() {
        Instant startTime = Instant.now();

        try {
            if (k < 0) {
                System.err.println("Error: Invalid value for -k: " + k);
                return 1;
            }
            if (rounds < 1 || rounds > 2) {
                System.err.println("Error: Invalid value for --rounds: " + rounds);
                System.err.println("Valid values: 1, 2");
                return 1;
            }

            EngineConfig config = loadConfig();
            int effectiveRadius = radius != null ? radius : config.getSubtemplateRadius();
            int effectiveMaxRadius = maxRadius != null ? maxRadius : Math.max(config.getMaxSubtemplateRadius(),
                    effectiveRadius + 1);
            if (effectiveRadius < 0 || effectiveMaxRadius <= effectiveRadius) {
                System.err.println("Error: Invalid radius range: --radius " + effectiveRadius
                        + " --max-radius " + effectiveMaxRadius);
                return 1;
            }

            DatabaseMode mode = strict ? DatabaseMode.STRICT : config.getDatabaseMode();
            if (mode == DatabaseMode.STRICT && (databaseFile == null || !Files.exists(databaseFile))) {
                System.err.println("Error: --strict needs an existing --database file");
                return 1;
            }
            DetectorDatabaseStore store = new DetectorDatabaseStore();
            DetectorDatabase database = loadDatabase(store, mode);

            DetectorComputation computation = new DetectorComputation(
                    new DetectorMatcher(config.isLoopSanityCheck()), database, mode, config.getParallelism());
            MemoryExperiment experiment = MemoryExperiment.css(k, rounds);

            log("Computing detectors for k=" + k + ", " + rounds + " round(s), radius "
                    + effectiveRadius + ".." + effectiveMaxRadius + ", database mode " + mode);
            List<List<Detector>> detectors = experiment.detectorsByRound(computation, effectiveRadius,
                    effectiveMaxRadius);
            for (int round = 0; round < detectors.size(); round++) {
                log("  Round " + round + ": " + detectors.get(round).size() + " detectors");
            }

            if (database != null && databaseFile != null && mode == DatabaseMode.COMPUTE) {
                store.save(database, databaseFile);
                log("Saved " + database.size() + " situations to: " + databaseFile);
            }

            switch (format) {
                case stim -> writeText(experiment.toCircuit(detectors) + "\n");
                case json -> writeJson(new DetectorReport(k, effectiveRadius, effectiveMaxRadius, startTime,
                        Duration.between(startTime, Instant.now()).toMillis(),
                        databaseFile != null ? databaseFile.toString() : null, detectors));
            }
            return 0;

        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (FlowDetectException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 2;
        }
    }

    private EngineConfig loadConfig() throws IOException {
        if (configFile != null) {
            log("Loading configuration from: " + configFile);
            return EngineConfig.load(configFile);
        }
        return EngineConfig.loadDefault();
    }

    private DetectorDatabase loadDatabase(DetectorDatabaseStore store, DatabaseMode mode) throws IOException {
        if (mode == DatabaseMode.DISABLED) {
            return null;
        }
        if (databaseFile != null && Files.exists(databaseFile)) {
            DetectorDatabase database = store.load(databaseFile);
            log("Loaded " + database.size() + " situations from: " + databaseFile
                    + (database.isFrozen() ? " (frozen)" : ""));
            return database;
        }
        return new DetectorDatabase();
    }

    private void writeText(String text) throws IOException {
        if (outputFile != null) {
            Files.writeString(outputFile, text, StandardCharsets.UTF_8);
            log("Circuit written to: " + outputFile);
        } else {
            System.out.print(text);
            System.out.flush();
        }
    }

    private void writeJson(DetectorReport report) throws IOException {
        JsonDetectorReporter reporter = new JsonDetectorReporter();
        if (outputFile != null) {
            reporter.write(report, outputFile);
            log("Report written to: " + outputFile);
        } else {
            PrintWriter writer = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            reporter.write(report, writer);
            writer.println();
            writer.flush();
        }
    }

    private void log(String message) {
        if (verbose) {
            System.err.println(message);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MemoryExperimentCli()).execute(args);
        System.exit(exitCode);
    }
}
