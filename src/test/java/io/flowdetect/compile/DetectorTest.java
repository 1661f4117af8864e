package io.flowdetect.compile;

import io.flowdetect.circuit.Circuit;
import io.flowdetect.circuit.GridQubit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorTest {

    private static final GridQubit A = new GridQubit(0, 0);
    private static final GridQubit B = new GridQubit(2, 0);

    @Test
    void measurement_rejectsNonNegativeOffsets() {
        assertThatThrownBy(() -> new Measurement(A, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
        assertThatThrownBy(() -> new Measurement(null, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void detector_needsMeasurements() {
        assertThatThrownBy(() -> new Detector(new TreeSet<>(), StimCoordinates.of(0, 0, 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("without any measurement");
    }

    @Test
    void equals_ignoresCoordinates() {
        Detector first = Detector.of(List.of(new Measurement(A, -1)), StimCoordinates.of(0, 0, 0));
        Detector second = Detector.of(List.of(new Measurement(A, -1)), StimCoordinates.of(5, 5, 1));

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    }

    @Test
    void offsetSpatiallyBy_movesMeasurementsAndCoordinates() {
        Detector detector = Detector.of(List.of(new Measurement(A, -1), new Measurement(A, -2)),
                StimCoordinates.of(0, 0, 0));

        Detector moved = detector.offsetSpatiallyBy(2, 0);

        assertThat(moved.measurements()).containsExactly(new Measurement(B, -2), new Measurement(B, -1));
        assertThat(moved.coordinates()).isEqualTo(StimCoordinates.of(2, 0, 0));
    }

    @Test
    void toInstruction_resolvesRecordsInIncreasingOrder() {
        MeasurementRecordsMap records = MeasurementRecordsMap.fromCircuit(
                Circuit.parse("M 0 1\nTICK\nM 0 1"), Map.of(0, A, 1, B));
        Detector detector = Detector.of(List.of(new Measurement(B, -1), new Measurement(B, -2)),
                StimCoordinates.of(2, 0.5, 1));

        assertThat(detector.toInstruction(records).toString()).isEqualTo("DETECTOR(2, 0.5, 1) rec[-3] rec[-1]");
    }

    @Test
    void stimCoordinates_equalWithinTolerance() {
        assertThat(StimCoordinates.of(1, 2, 3)).isEqualTo(StimCoordinates.of(1 + 1e-12, 2, 3));
        assertThat(StimCoordinates.of(1, 2, 3)).isNotEqualTo(StimCoordinates.of(1.1, 2, 3));
        assertThatThrownBy(() -> new StimCoordinates(List.of(1.0, 2.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
