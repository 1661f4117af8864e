package io.flowdetect.flow;

import io.flowdetect.exceptions.IncompatibleBoundaryMergeException;
import io.flowdetect.pauli.PauliString;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnticommutingFlowMergerTest {

    private static final List<PauliString> Z_MEASUREMENTS = List.of(PauliString.parse("Z"), PauliString.parse("_Z"));
    private static final List<RelativeMeasurementLocation> BOTH = List.of(
            new RelativeMeasurementLocation(-2, 0), new RelativeMeasurementLocation(-1, 1));

    private static BoundaryStabilizer forward(String dense, int resetQubit) {
        return new BoundaryStabilizer(PauliString.parse(dense), Z_MEASUREMENTS, BOTH, Set.of(resetQubit), true);
    }

    @Test
    void mergeInPlace_replacesAnticommutingFlowsByTheirProduct() {
        List<BoundaryStabilizer> flows = new ArrayList<>(List.of(forward("XX", 0), forward("Z", 2), forward("XY", 1)));

        AnticommutingFlowMerger.mergeInPlace(flows);

        assertThat(flows).hasSize(2);
        assertThat(flows.get(0).beforeCollapse()).isEqualTo(PauliString.parse("Z"));
        BoundaryStabilizer merged = flows.get(1);
        assertThat(merged.beforeCollapse()).isEqualTo(PauliString.parse("_Z"));
        assertThat(merged.hasAnticommutingOperations()).isFalse();
        assertThat(merged.resetQubits()).containsExactly(0, 1);
        assertThat(merged.measurements()).containsExactly(new RelativeMeasurementLocation(-1, 1));
    }

    @Test
    void mergeInPlace_leavesFlowsWithoutCommutingProduct() {
        List<BoundaryStabilizer> flows = new ArrayList<>(List.of(forward("X", 0), forward("_X", 1)));

        AnticommutingFlowMerger.mergeInPlace(flows);

        assertThat(flows).hasSize(2);
        assertThat(flows).allMatch(BoundaryStabilizer::hasAnticommutingOperations);
    }

    @Test
    void mergeInPlace_rejectsFlowsOnDifferentBoundaries() {
        BoundaryStabilizer other = new BoundaryStabilizer(PauliString.parse("X"), List.of(PauliString.parse("Z")),
                List.of(new RelativeMeasurementLocation(-1, 0)), Set.of(0), true);
        List<BoundaryStabilizer> flows = new ArrayList<>(List.of(forward("XX", 0), other));

        assertThatThrownBy(() -> AnticommutingFlowMerger.mergeInPlace(flows))
                .isInstanceOf(IncompatibleBoundaryMergeException.class);
    }

    @Test
    void merge_rejectsDifferentDirections() {
        BoundaryStabilizer backward = new BoundaryStabilizer(PauliString.parse("X"), Z_MEASUREMENTS, BOTH,
                Set.of(0), false);

        assertThatThrownBy(() -> forward("X", 0).merge(backward))
                .isInstanceOf(IncompatibleBoundaryMergeException.class)
                .hasMessageContaining("forward");
    }
}
