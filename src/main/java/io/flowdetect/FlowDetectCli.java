package io.flowdetect;

import io.flowdetect.circuit.Circuit;
import io.flowdetect.config.EngineConfig;
import io.flowdetect.construction.DetectorAnnotator;
import io.flowdetect.exceptions.FlowDetectException;
import io.flowdetect.exceptions.MalformedInstructionException;
import io.flowdetect.match.DetectorMatcher;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point annotating a stim circuit with its detectors.
 */
@Command(
        name = "flow-detect",
        mixinStandardHelpOptions = true,
        version = "flow-detect 1.0.0",
        description = "Adds DETECTOR annotations to a stim circuit by tracking its stabilizer flows.",
        footer = {
                "",
                "Examples:",
                "  flow-detect memory.stim",
                "  flow-detect memory.stim --output memory-with-detectors.stim",
                "  flow-detect memory.stim --config flow-detect.yaml --no-loop-check"
        }
)
public class FlowDetectCli implements Callable<Integer> {

    @Parameters(
            index = "0",
            description = "Path to the stim circuit to annotate"
    )
    private Path circuitFile;

    @Option(
            names = {"-o", "--output"},
            description = "Output file for the annotated circuit (defaults to stdout)"
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

    @Option(
            names = {"--no-loop-check"},
            description = "Skip the cross-check of detectors found at REPEAT block boundaries"
    )
    private boolean noLoopCheck;

    @Override
    public Integer call() {
        try {
            if (!Files.isRegularFile(circuitFile)) {
                System.err.println("Error: Circuit file does not exist: " + circuitFile);
                return 1;
            }
            EngineConfig config = loadConfig();
            boolean loopCheck = config.isLoopSanityCheck() && !noLoopCheck;

            log("Reading circuit from: " + circuitFile);
            Circuit circuit = Circuit.parse(Files.readString(circuitFile, StandardCharsets.UTF_8));
            log("  " + circuit.items().size() + " top-level items, " + circuit.numMeasurements() + " measurements");

            log("Annotating detectors" + (loopCheck ? "" : " (loop check disabled)") + "...");
            DetectorAnnotator annotator = new DetectorAnnotator(new DetectorMatcher(loopCheck));
            Circuit annotated = annotator.annotateDetectorsAutomatically(circuit);

            String text = annotated + "\n";
            if (outputFile != null) {
                Files.writeString(outputFile, text, StandardCharsets.UTF_8);
                log("Annotated circuit written to: " + outputFile);
            } else {
                System.out.print(text);
                System.out.flush();
            }
            return 0;

        } catch (IOException | MalformedInstructionException e) {
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

    private void log(String message) {
        if (verbose) {
            System.err.println(message);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FlowDetectCli()).execute(args);
        System.exit(exitCode);
    }
}
