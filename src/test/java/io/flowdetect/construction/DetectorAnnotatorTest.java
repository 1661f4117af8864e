package io.flowdetect.construction;

import io.flowdetect.circuit.Circuit;
import io.flowdetect.exceptions.MalformedInstructionException;
import io.flowdetect.fragment.FragmentSplitter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorAnnotatorTest {

    private final DetectorAnnotator annotator = new DetectorAnnotator();

    @Test
    void annotateDetectorsAutomatically_singleRound() {
        Circuit annotated = annotator.annotateDetectorsAutomatically(
                Circuit.parse("QUBIT_COORDS(1, 2) 0\nR 0\nTICK\nM 0"));

        assertThat(annotated.toString()).isEqualTo("""
                QUBIT_COORDS(1, 2) 0
                R 0
                TICK
                M 0
                DETECTOR(1, 2, 0) rec[-1]""");
    }

    @Test
    void annotateDetectorsAutomatically_twoRoundsShiftTime() {
        Circuit annotated = annotator.annotateDetectorsAutomatically(
                Circuit.parse("QUBIT_COORDS(1, 2) 0\nR 0\nTICK\nM 0\nTICK\nR 0\nTICK\nM 0"));

        assertThat(annotated.toString()).isEqualTo("""
                QUBIT_COORDS(1, 2) 0
                R 0
                TICK
                M 0
                DETECTOR(1, 2, 0) rec[-1]
                TICK
                R 0
                TICK
                M 0
                SHIFT_COORDS(0, 0, 1)
                DETECTOR(1, 2, 0) rec[-2] rec[-1]""");
    }

    @Test
    void annotateDetectorsAutomatically_insertsLoopDetectorsBeforeLastTickOfBody() {
        Circuit annotated = annotator.annotateDetectorsAutomatically(Circuit.parse("""
                QUBIT_COORDS(1, 2) 0
                R 0
                TICK
                M 0
                TICK
                REPEAT 3 {
                    R 0
                    TICK
                    M 0
                    TICK
                }
                """));

        assertThat(annotated.toString()).isEqualTo("""
                QUBIT_COORDS(1, 2) 0
                R 0
                TICK
                M 0
                DETECTOR(1, 2, 0) rec[-1]
                TICK
                REPEAT 3 {
                    R 0
                    TICK
                    M 0
                    SHIFT_COORDS(0, 0, 1)
                    DETECTOR(1, 2, 0) rec[-2] rec[-1]
                    TICK
                }""");
    }

    @Test
    void annotateDetectorsAutomatically_rejectsInvalidCircuit() {
        assertThatThrownBy(() -> annotator.annotateDetectorsAutomatically(Circuit.parse("R 0\nTICK\nMR 0")))
                .isInstanceOf(MalformedInstructionException.class);
    }

    @Test
    void compileFragmentsToCircuit_rebuildsOriginalCircuit() {
        Circuit circuit = Circuit.parse("R 0 1\nTICK\nCX 0 1\nTICK\nM 0 1\nTICK\nREPEAT 2 {\n    R 0\n    TICK\n    M 0\n    TICK\n}");

        assertThat(DetectorAnnotator.compileFragmentsToCircuit(FragmentSplitter.split(circuit))).isEqualTo(circuit);
    }
}
