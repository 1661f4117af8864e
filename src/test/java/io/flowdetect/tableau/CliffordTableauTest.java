package io.flowdetect.tableau;

import io.flowdetect.circuit.Circuit;
import io.flowdetect.exceptions.MalformedInstructionException;
import io.flowdetect.pauli.PauliString;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliffordTableauTest {

    @Test
    void forward_propagatesThroughCnot() {
        CliffordTableau tableau = CliffordTableau.of(Circuit.parse("CX 0 1"));

        assertThat(tableau.forward(PauliString.parse("X_"))).isEqualTo(PauliString.parse("XX"));
        assertThat(tableau.forward(PauliString.parse("_Z"))).isEqualTo(PauliString.parse("ZZ"));
        assertThat(tableau.forward(PauliString.parse("Z_"))).isEqualTo(PauliString.parse("Z_"));
    }

    @Test
    void forward_hadamardSwapsXAndZ() {
        CliffordTableau tableau = CliffordTableau.of(Circuit.parse("H 0"));

        assertThat(tableau.forward(PauliString.parse("X"))).isEqualTo(PauliString.parse("Z"));
        assertThat(tableau.forward(PauliString.parse("Y"))).isEqualTo(PauliString.parse("Y"));
    }

    @Test
    void backward_undoesForward() {
        Circuit circuit = Circuit.parse("H 0\nCX 0 1\nS 1\nCZ 1 2\nSWAP 0 2");
        CliffordTableau tableau = CliffordTableau.of(circuit);

        for (String dense : new String[]{"X__", "_Z_", "XYZ", "ZZX", "_YY"}) {
            PauliString p = PauliString.parse(dense);
            assertThat(tableau.backward(tableau.forward(p))).isEqualTo(p);
        }
    }

    @Test
    void of_ignoresCollapsingAndAnnotations() {
        CliffordTableau tableau = CliffordTableau.of(Circuit.parse("R 0\nTICK\nH 0\nM 0\nDETECTOR rec[-1]"));

        assertThat(tableau.forward(PauliString.parse("Z"))).isEqualTo(PauliString.parse("X"));
    }

    @Test
    void forward_leavesQubitsOutsideTheTableauUntouched() {
        CliffordTableau tableau = CliffordTableau.identity(1);

        assertThat(tableau.forward(PauliString.parse("_X"))).isEqualTo(PauliString.parse("_X"));
    }

    @Test
    void of_rejectsRepeatBlocks() {
        assertThatThrownBy(() -> CliffordTableau.of(Circuit.parse("REPEAT 2 {\nH 0\n}")))
                .isInstanceOf(MalformedInstructionException.class);
    }
}
