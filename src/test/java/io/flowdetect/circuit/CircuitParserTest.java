package io.flowdetect.circuit;

import io.flowdetect.exceptions.MalformedInstructionException;
import io.flowdetect.pauli.Pauli;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitParserTest {

    @Test
    void parse_readsInstructionsArgumentsAndTargets() {
        Circuit circuit = CircuitParser.parse("""
                # a comment
                QUBIT_COORDS(0.5, 2) 0
                X_ERROR(0.01) 0 1
                DETECTOR(1, 2, 0) rec[-1] rec[-3]
                MPP X0*Z1
                M !2
                """);

        assertThat(circuit.items()).hasSize(5);
        Instruction coords = (Instruction) circuit.items().get(0);
        assertThat(coords.name()).isEqualTo("QUBIT_COORDS");
        assertThat(coords.args()).containsExactly(0.5, 2.0);
        assertThat(coords.targets()).containsExactly(Target.qubit(0));

        Instruction detector = (Instruction) circuit.items().get(2);
        assertThat(detector.targets()).containsExactly(Target.record(-1), Target.record(-3));

        Instruction mpp = (Instruction) circuit.items().get(3);
        assertThat(mpp.targets()).containsExactly(Target.pauli(Pauli.X, 0), Target.combiner(), Target.pauli(Pauli.Z, 1));

        Instruction m = (Instruction) circuit.items().get(4);
        assertThat(m.targets()).containsExactly(Target.invertedQubit(2));
    }

    @Test
    void parse_nestsRepeatBlocks() {
        Circuit circuit = CircuitParser.parse("R 0\nREPEAT 3 {\n  H 0\n  REPEAT 2 {\n    M 0\n  }\n}\n");

        assertThat(circuit.items()).hasSize(2);
        RepeatBlock outer = (RepeatBlock) circuit.items().get(1);
        assertThat(outer.repetitions()).isEqualTo(3);
        assertThat(outer.body().items().get(1)).isInstanceOf(RepeatBlock.class);
        assertThat(circuit.numMeasurements()).isEqualTo(6);
    }

    @Test
    void toString_printsNumbersLikeStim() {
        String text = "QUBIT_COORDS(0, 1.5) 3\nDETECTOR(1, 0, 0) rec[-1]\nMPP X0*Z1\nREPEAT 2 {\n    M 0\n}";

        assertThat(CircuitParser.parse(text).toString()).isEqualTo(text);
    }

    @Test
    void parse_rejectsUnknownInstruction() {
        assertThatThrownBy(() -> CircuitParser.parse("H 0\nT 0"))
                .isInstanceOf(MalformedInstructionException.class)
                .hasMessageContaining("Line 2")
                .hasMessageContaining("'T'");
    }

    @Test
    void parse_rejectsUnbalancedBraces() {
        assertThatThrownBy(() -> CircuitParser.parse("REPEAT 2 {\nM 0\n"))
                .isInstanceOf(MalformedInstructionException.class);
        assertThatThrownBy(() -> CircuitParser.parse("M 0\n}"))
                .isInstanceOf(MalformedInstructionException.class);
    }

    @Test
    void parse_rejectsNonPositiveRepetitions() {
        assertThatThrownBy(() -> CircuitParser.parse("REPEAT 0 {\nM 0\n}"))
                .isInstanceOf(MalformedInstructionException.class);
    }

    @Test
    void numMeasurements_countsMpadAndProducts() {
        Circuit circuit = CircuitParser.parse("MPAD 0 1\nMPP X0*X1 Z2\nMXX 0 1 2 3\nR 0\nM 0 1");

        assertThat(circuit.numMeasurements()).isEqualTo(2 + 2 + 2 + 2);
        assertThat(List.of(circuit.items().get(3).numMeasurements())).containsExactly(0);
    }
}
