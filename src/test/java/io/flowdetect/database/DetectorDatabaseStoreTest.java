package io.flowdetect.database;

import io.flowdetect.circuit.GridQubit;
import io.flowdetect.compile.Detector;
import io.flowdetect.compile.Measurement;
import io.flowdetect.compile.StimCoordinates;
import io.flowdetect.plaquette.CssPlaquettes;
import io.flowdetect.plaquette.Plaquettes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorDatabaseStoreTest {

    private static final Plaquettes MEMORY = CssPlaquettes.forAlternatingTemplate(null);
    private static final DetectorDatabaseKey KEY = DetectorDatabaseKey.of(
            List.of(new int[][]{{0, 1}, {2, 1}}, new int[][]{{1, 1}, {2, 0}}), List.of(MEMORY, MEMORY));
    private static final Detector DETECTOR = Detector.of(
            List.of(new Measurement(new GridQubit(2, 2), -2), new Measurement(new GridQubit(2, 2), -1)),
            StimCoordinates.of(2, 2, 0));

    private final DetectorDatabaseStore store =
            new DetectorDatabaseStore(Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void saveThenLoad_keepsEntriesAndFrozenFlag(@TempDir Path dir) throws IOException {
        DetectorDatabase database = new DetectorDatabase();
        database.add(KEY, List.of(DETECTOR));
        database.freeze();
        Path file = dir.resolve("nested/detectors.json");

        store.save(database, file);
        DetectorDatabase loaded = store.load(file);

        assertThat(loaded.size()).isEqualTo(1);
        assertThat(loaded.isFrozen()).isTrue();
        assertThat(loaded.get(KEY)).hasValueSatisfying(detectors -> {
            assertThat(detectors).containsExactly(DETECTOR);
            assertThat(detectors.iterator().next().coordinates()).isEqualTo(StimCoordinates.of(2, 2, 0));
        });
    }

    @Test
    void save_writesHashAndTimestamp() throws IOException {
        DetectorDatabase database = new DetectorDatabase();
        database.add(KEY, List.of(DETECTOR));

        String json = saveToString(database);

        assertThat(json).contains(KEY.reliableHash())
                .contains("2024-05-01T10:00:00Z")
                .contains("\"formatVersion\" : " + DetectorDatabaseStore.FORMAT_VERSION);
    }

    @Test
    void load_rejectsTamperedEntries() throws IOException {
        DetectorDatabase database = new DetectorDatabase();
        database.add(KEY, List.of(DETECTOR));
        String json = saveToString(database).replace(KEY.reliableHash(), "0".repeat(64));

        assertThatThrownBy(() -> load(json))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Corrupted");
    }

    @Test
    void load_readsNewerFormatVersions() throws IOException {
        DetectorDatabase database = new DetectorDatabase();
        database.add(KEY, List.of(DETECTOR));
        String json = saveToString(database).replaceFirst("\"formatVersion\"\\s*:\\s*\\d+", "\"formatVersion\" : 99");

        assertThat(load(json).get(KEY)).isPresent();
    }

    @Test
    void load_rejectsEmptyAndInvalidFiles() {
        assertThatThrownBy(() -> load("null"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Empty or invalid");
        assertThatThrownBy(() -> load("{\"formatVersion\": 1, \"entries\": [{\"timesteps\": []}]}"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid detector database");
    }

    @Test
    void load_rejectsEntriesWithMissingFields() throws IOException {
        DetectorDatabase database = new DetectorDatabase();
        database.add(KEY, List.of(DETECTOR));
        String json = saveToString(database);

        assertThatThrownBy(() -> load("{\"formatVersion\": 1, \"entries\": [{\"hash\": \"abc\"}]}"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("every entry needs timesteps and detectors");
        assertThatThrownBy(() -> load(json.replaceFirst("\"measurements\"\\s*:", "\"ignored\" :")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("every detector needs coordinates and measurements");
    }

    private String saveToString(DetectorDatabase database) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        store.save(database, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    private DetectorDatabase load(String json) throws IOException {
        return store.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "test");
    }
}
