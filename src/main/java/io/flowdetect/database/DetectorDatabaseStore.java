package io.flowdetect.database;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.flowdetect.circuit.GridQubit;
import io.flowdetect.compile.Detector;
import io.flowdetect.compile.Measurement;
import io.flowdetect.compile.StimCoordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Saves and loads a {@link DetectorDatabase} as JSON.
 */
public class DetectorDatabaseStore {

    public static final int FORMAT_VERSION = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(DetectorDatabaseStore.class);

    private final ObjectMapper mapper;
    private final Clock clock;

    public DetectorDatabaseStore() {
        this(Clock.systemUTC());
    }

    public DetectorDatabaseStore(Clock clock) {
        this.clock = clock;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        m.enable(SerializationFeature.INDENT_OUTPUT);
        return m;
    }

    public void save(DetectorDatabase database, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            save(database, out);
        }
    }

    public void save(DetectorDatabase database, OutputStream out) throws IOException {
        List<StoredDatabase.Entry> entries = new ArrayList<>();
        database.entries().entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.comparing(DetectorDatabaseKey::reliableHash)))
                .forEach(e -> entries.add(new StoredDatabase.Entry(
                        e.getKey().reliableHash(),
                        e.getKey().layers(),
                        e.getValue().stream().map(DetectorDatabaseStore::toStored).toList())));
        mapper.writeValue(out, new StoredDatabase(FORMAT_VERSION, Instant.now(clock), database.isFrozen(), entries));
    }

    /**
     * Reads a database file. A file written by a newer format version is still read, with a warning.
     *
     * @throws IOException if the file cannot be read or does not describe a valid database
     */
    public DetectorDatabase load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    public DetectorDatabase load(InputStream in, String source) throws IOException {
        StoredDatabase stored = mapper.readValue(in, StoredDatabase.class);
        if (stored == null || stored.entries() == null) {
            throw new IOException("Empty or invalid detector database file: " + source);
        }
        if (stored.formatVersion() > FORMAT_VERSION) {
            LOGGER.warn("Detector database {} has format version {}, newer than the supported version {}",
                    source, stored.formatVersion(), FORMAT_VERSION);
        }
        DetectorDatabase database = new DetectorDatabase();
        try {
            for (StoredDatabase.Entry entry : stored.entries()) {
                if (entry == null || entry.timesteps() == null || entry.detectors() == null) {
                    throw new IOException("Invalid detector database file " + source
                            + ": every entry needs timesteps and detectors");
                }
                DetectorDatabaseKey key = DetectorDatabaseKey.of(entry.timesteps());
                if (entry.hash() != null && !entry.hash().equals(key.reliableHash())) {
                    throw new IOException("Corrupted detector database file " + source + ": entry " + entry.hash()
                            + " does not match its content");
                }
                List<Detector> detectors = new ArrayList<>(entry.detectors().size());
                for (StoredDatabase.StoredDetector d : entry.detectors()) {
                    detectors.add(fromStored(d, source));
                }
                database.add(key, detectors);
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid detector database file " + source + ": " + e.getMessage(), e);
        }
        if (stored.frozen()) {
            database.freeze();
        }
        LOGGER.debug("Loaded {} situations from {} (saved at {})", database.size(), source, stored.savedAt());
        return database;
    }

    private static StoredDatabase.StoredDetector toStored(Detector detector) {
        return new StoredDatabase.StoredDetector(
                detector.coordinates().values(),
                detector.measurements().stream()
                        .map(m -> new StoredDatabase.StoredMeasurement(m.qubit().x(), m.qubit().y(), m.offset()))
                        .toList());
    }

    private static Detector fromStored(StoredDatabase.StoredDetector stored, String source) throws IOException {
        if (stored == null || stored.measurements() == null || stored.coordinates() == null
                || stored.measurements().contains(null)) {
            throw new IOException("Invalid detector database file " + source
                    + ": every detector needs coordinates and measurements");
        }
        List<Measurement> measurements = new ArrayList<>(stored.measurements().size());
        for (StoredDatabase.StoredMeasurement m : stored.measurements()) {
            measurements.add(new Measurement(new GridQubit(m.x(), m.y()), m.offset()));
        }
        return Detector.of(measurements, new StimCoordinates(stored.coordinates()));
    }

    /**
     * JSON structure of a database file.
     */
    public record StoredDatabase(
            int formatVersion,
            Instant savedAt,
            boolean frozen,
            List<Entry> entries
    ) {
        public record Entry(
                String hash,
                List<DetectorDatabaseKey.Layer> timesteps,
                List<StoredDetector> detectors
        ) {}

        public record StoredDetector(
                List<Double> coordinates,
                List<StoredMeasurement> measurements
        ) {}

        public record StoredMeasurement(int x, int y, int offset) {}
    }
}
