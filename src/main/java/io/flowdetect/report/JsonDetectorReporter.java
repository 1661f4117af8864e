package io.flowdetect.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.flowdetect.compile.Detector;
import io.flowdetect.compile.Measurement;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Writes the detectors of a templated experiment as JSON.
 */
public class JsonDetectorReporter {

    private final ObjectMapper mapper;

    public JsonDetectorReporter() {
        this(true);
    }

    public JsonDetectorReporter(boolean prettyPrint) {
        this.mapper = createMapper(prettyPrint);
    }

    private ObjectMapper createMapper(boolean prettyPrint) {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Callers own the writer, which may wrap stdout.
        m.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    public void write(DetectorReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
    }

    public void write(DetectorReport report, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            write(report, writer);
        }
    }

    JsonReport toJsonReport(DetectorReport report) {
        List<List<Detector>> byRound = report.detectorsByRound();
        return new JsonReport(
                new JsonReport.Metadata(
                        report.k(),
                        byRound.size(),
                        report.radius(),
                        report.maxRadius(),
                        report.generatedAt(),
                        report.durationMs(),
                        report.database()
                ),
                report.totalDetectors(),
                IntStream.range(0, byRound.size())
                        .mapToObj(round -> new JsonReport.JsonRound(round, byRound.get(round).size(),
                                byRound.get(round).stream().map(this::toJsonDetector).toList()))
                        .toList()
        );
    }

    private JsonReport.JsonDetector toJsonDetector(Detector detector) {
        return new JsonReport.JsonDetector(
                detector.coordinates().values(),
                detector.measurements().stream().map(this::toJsonMeasurement).toList()
        );
    }

    private JsonReport.JsonMeasurement toJsonMeasurement(Measurement measurement) {
        return new JsonReport.JsonMeasurement(measurement.qubit().x(), measurement.qubit().y(), measurement.offset());
    }

    /**
     * JSON structure of the report.
     */
    public record JsonReport(
            Metadata metadata,
            int totalDetectors,
            List<JsonRound> rounds
    ) {
        public record Metadata(
                int k,
                int rounds,
                int radius,
                int maxRadius,
                Instant generatedAt,
                long durationMs,
                String database
        ) {}

        public record JsonRound(
                int round,
                int detectorCount,
                List<JsonDetector> detectors
        ) {}

        public record JsonDetector(
                List<Double> coordinates,
                List<JsonMeasurement> measurements
        ) {}

        public record JsonMeasurement(int x, int y, int offset) {}
    }
}
