package io.flowdetect.pauli;

import io.flowdetect.exceptions.UnresolvableAntiCommutationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PauliStringTest {

    @Test
    void times_ignoresPhaseAndDropsIdentities() {
        PauliString a = PauliString.parse("XZ_");
        PauliString b = PauliString.parse("YZX");

        assertThat(a.times(b)).isEqualTo(PauliString.of(Map.of(0, Pauli.Z, 2, Pauli.X)));
        assertThat(a.times(a).isIdentity()).isTrue();
    }

    @Test
    void anticommutes_countsOverlappingDifferentTerms() {
        assertThat(PauliString.parse("X").anticommutes(PauliString.parse("Z"))).isTrue();
        assertThat(PauliString.parse("XX").anticommutes(PauliString.parse("ZZ"))).isFalse();
        assertThat(PauliString.parse("X_").anticommutes(PauliString.parse("_Z"))).isFalse();
        assertThat(PauliString.parse("XY").commutes(PauliString.parse("XY"))).isTrue();
    }

    @Test
    void parse_acceptsUnderscoreAndIdentityCharacters() {
        assertThat(PauliString.parse("_XIZ")).isEqualTo(PauliString.parse("IX_Z"));
        assertThat(PauliString.parse("_XIZ").qubits()).containsExactly(1, 3);
        assertThat(PauliString.parse("___")).isEqualTo(PauliString.identity());
    }

    @Test
    void toString_rendersStimStyle() {
        assertThat(PauliString.parse("X__Z")).hasToString("X0*Z3");
        assertThat(PauliString.identity()).hasToString("");
    }

    @Test
    void qubit_requiresWeightOne() {
        assertThat(PauliString.single(4, Pauli.Y).qubit()).isEqualTo(4);
        assertThatThrownBy(() -> PauliString.parse("XX").qubit())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void collapseBy_multipliesCommutingOperators() {
        PauliString zz = PauliString.parse("ZZ");
        PauliString collapsed = zz.collapseBy(List.of(PauliString.parse("Z_")));

        assertThat(collapsed).isEqualTo(PauliString.parse("_Z"));
    }

    @Test
    void collapseBy_ignoresOperatorsOnOtherQubits() {
        PauliString zz = PauliString.parse("ZZ");
        PauliString collapsed = zz.collapseBy(List.of(
                PauliString.parse("Z"), PauliString.parse("_Z"), PauliString.parse("__Z"), PauliString.parse("___X")));

        assertThat(collapsed.isIdentity()).isTrue();
    }

    @Test
    void collapseBy_rejectsAnticommutingOperator() {
        assertThatThrownBy(() -> PauliString.parse("X").collapseBy(List.of(PauliString.parse("Z"))))
                .isInstanceOf(UnresolvableAntiCommutationException.class);
    }

    @Test
    void contains_andIntersects() {
        PauliString big = PauliString.parse("XZY");

        assertThat(big.contains(PauliString.parse("_Z"))).isTrue();
        assertThat(big.contains(PauliString.parse("_X"))).isFalse();
        assertThat(big.intersects(PauliString.parse("___X"))).isFalse();
        assertThat(big.intersects(PauliString.parse("__X"))).isTrue();
    }

    @Test
    void product_ofNothingIsIdentity() {
        assertThat(PauliString.product(List.of())).isEqualTo(PauliString.identity());
        assertThat(PauliString.product(List.of(PauliString.parse("X"), PauliString.parse("Z"))))
                .isEqualTo(PauliString.parse("Y"));
    }
}
