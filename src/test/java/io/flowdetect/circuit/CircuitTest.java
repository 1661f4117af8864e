package io.flowdetect.circuit;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitTest {

    @Test
    void moments_keepTickAsLastInstruction() {
        Circuit circuit = Circuit.parse("R 0\nTICK\nH 0\nTICK\nM 0");

        List<TimeSlice> moments = circuit.moments();

        assertThat(moments).hasSize(3);
        Moment first = (Moment) moments.get(0);
        assertThat(first.instructions()).extracting(Instruction::name).containsExactly("R", "TICK");
        assertThat(((Moment) moments.get(2)).hasOnlyMeasurement()).isTrue();
    }

    @Test
    void moments_isolateRepeatBlocks() {
        Circuit circuit = Circuit.parse("R 0\nREPEAT 2 {\nM 0\nTICK\n}\nM 0");

        List<TimeSlice> moments = circuit.moments();

        assertThat(moments).hasSize(3);
        assertThat(moments.get(1)).isInstanceOf(RepeatBlock.class);
    }

    @Test
    void finalQubitCoordinates_appliesPreviousShifts() {
        Circuit circuit = Circuit.parse("""
                QUBIT_COORDS(0, 0) 0
                SHIFT_COORDS(1, 2)
                QUBIT_COORDS(0, 0) 1
                REPEAT 2 {
                    SHIFT_COORDS(0, 1)
                }
                QUBIT_COORDS(3, 3) 0
                """);

        Map<Integer, List<Double>> coords = circuit.finalQubitCoordinates();

        assertThat(coords).containsEntry(0, List.of(4.0, 7.0));
        assertThat(coords).containsEntry(1, List.of(1.0, 2.0));
    }

    @Test
    void concat_withEmptyReturnsSameCircuit() {
        Circuit circuit = Circuit.parse("H 0");

        assertThat(circuit.concat(Circuit.empty())).isSameAs(circuit);
        assertThat(Circuit.empty().concat(circuit)).isSameAs(circuit);
    }

    @Test
    void repeat_wrapsInRepeatBlock() {
        Circuit repeated = Circuit.parse("M 0").repeat(4);

        assertThat(repeated.numMeasurements()).isEqualTo(4);
        assertThat(repeated.toString()).isEqualTo("REPEAT 4 {\n    M 0\n}");
    }

    @Test
    void mapQubits_renamesQubitTargetsOnly() {
        Instruction detector = new Instruction("DETECTOR", List.of(Target.record(-1)), List.of());
        Instruction cx = Instruction.of("CX", 0, 1);

        assertThat(cx.mapQubits(q -> q + 10)).isEqualTo(Instruction.of("CX", 10, 11));
        assertThat(detector.mapQubits(q -> q + 10)).isEqualTo(detector);
    }

    @Test
    void collapsingOperations_keepRecordOrder() {
        Moment moment = new Moment(List.of(Instruction.of("M", 3, 1), Instruction.of("MX", 0)));

        assertThat(moment.collapsingOperations()).extracting(Object::toString)
                .containsExactly("Z3", "Z1", "X0");
    }
}
