package io.flowdetect.database;

import io.flowdetect.plaquette.Basis;
import io.flowdetect.plaquette.CssPlaquettes;
import io.flowdetect.plaquette.Plaquettes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorDatabaseKeyTest {

    private static final Plaquettes MEMORY = CssPlaquettes.forAlternatingTemplate(null);

    @Test
    void of_ignoresIndexNumbering() {
        DetectorDatabaseKey original = DetectorDatabaseKey.of(List.<int[][]>of(new int[][]{{0, 1}, {1, 2}}), List.of(MEMORY));
        DetectorDatabaseKey shifted = DetectorDatabaseKey.of(List.<int[][]>of(new int[][]{{0, 11}, {11, 12}}),
                List.of(MEMORY.mapIndices(i -> i + 10)));
        DetectorDatabaseKey swapped = DetectorDatabaseKey.of(List.<int[][]>of(new int[][]{{0, 2}, {2, 1}}),
                List.of(MEMORY.mapIndices(i -> 3 - i)));

        assertThat(shifted).isEqualTo(original).hasSameHashCodeAs(original);
        assertThat(swapped).isEqualTo(original);
        assertThat(swapped.reliableHash()).isEqualTo(original.reliableHash());
    }

    @Test
    void of_numbersPlaquettesInOrderOfAppearance() {
        DetectorDatabaseKey key = DetectorDatabaseKey.of(List.<int[][]>of(new int[][]{{0, 2}, {2, 1}}), List.of(MEMORY));

        DetectorDatabaseKey.Layer layer = key.layers().get(0);
        assertThat(layer.indices()).containsExactly(List.of(0, 1), List.of(1, 2));
        assertThat(layer.plaquettes()).containsExactly(
                DetectorDatabaseKey.sha256Hex(MEMORY.fingerprint(2)),
                DetectorDatabaseKey.sha256Hex(MEMORY.fingerprint(1)));
    }

    @Test
    void of_distinguishesPlaquetteContent() {
        DetectorDatabaseKey memory = DetectorDatabaseKey.of(List.<int[][]>of(new int[][]{{1}}), List.of(MEMORY));
        DetectorDatabaseKey initialisation = DetectorDatabaseKey.of(List.<int[][]>of(new int[][]{{1}}),
                List.of(CssPlaquettes.forAlternatingTemplate(Basis.Z)));
        DetectorDatabaseKey twoRounds = DetectorDatabaseKey.of(List.of(new int[][]{{1}}, new int[][]{{1}}),
                List.of(MEMORY, MEMORY));

        assertThat(initialisation).isNotEqualTo(memory);
        assertThat(initialisation.reliableHash()).isNotEqualTo(memory.reliableHash());
        assertThat(twoRounds).isNotEqualTo(memory);
    }

    @Test
    void reliableHash_isStableHex() {
        DetectorDatabaseKey key = DetectorDatabaseKey.of(List.<int[][]>of(new int[][]{{1, 2}}), List.of(MEMORY));

        assertThat(key.reliableHash()).hasSize(64).matches("[0-9a-f]+");
        assertThat(key.reliableHash()).isEqualTo(
                DetectorDatabaseKey.of(List.<int[][]>of(new int[][]{{1, 2}}), List.of(MEMORY)).reliableHash());
        assertThat(key.toString()).contains(key.reliableHash().substring(0, 12));
    }

    @Test
    void of_rejectsInvalidShapes() {
        assertThatThrownBy(() -> DetectorDatabaseKey.of(List.<int[][]>of(new int[][]{{1}}), List.of(MEMORY, MEMORY)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("equal number");
        assertThatThrownBy(() -> DetectorDatabaseKey.of(
                List.of(new int[][]{{1}}, new int[][]{{1}}, new int[][]{{1}}), List.of(MEMORY, MEMORY, MEMORY)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1 or 2");
    }
}
