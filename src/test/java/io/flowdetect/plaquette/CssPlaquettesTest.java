package io.flowdetect.plaquette;

import io.flowdetect.circuit.GridQubit;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CssPlaquettesTest {

    @Test
    void make_zBasisWithDataInitialization() {
        Plaquette plaquette = CssPlaquettes.make(Basis.Z, Basis.Z, null);

        assertThat(plaquette.name()).isEqualTo("CSS_basis(Z)_VERTICAL_datainit(Z)");
        assertThat(plaquette.circuit().toCircuit(false).toString()).isEqualTo("""
                RZ 0
                RZ 1 2 3 4
                TICK
                CX 1 0
                TICK
                CX 2 0
                TICK
                CX 3 0
                TICK
                CX 4 0
                TICK
                MZ 0""");
    }

    @Test
    void make_xBasisUsesPerpendicularHookOrder() {
        Plaquette plaquette = CssPlaquettes.make(Basis.X, null, Basis.X);

        assertThat(plaquette.name()).isEqualTo("CSS_basis(X)_VERTICAL_datameas(X)");
        assertThat(plaquette.circuit().toCircuit(false).toString()).isEqualTo("""
                RX 0
                TICK
                CX 0 1
                TICK
                CX 0 3
                TICK
                CX 0 2
                TICK
                CX 0 4
                TICK
                MX 0
                MX 1 2 3 4""");
        assertThat(plaquette.circuit().numMeasurements()).isEqualTo(5);
    }

    @Test
    void make_placesSyndromeQubitAtOrigin() {
        Plaquette plaquette = CssPlaquettes.memory(Basis.Z);

        assertThat(plaquette.circuit().qubitMap()).containsEntry(0, new GridQubit(0, 0))
                .containsEntry(1, new GridQubit(-1, -1))
                .containsEntry(4, new GridQubit(1, 1));
        assertThat(plaquette.mergeableInstructions()).isEqualTo(CssPlaquettes.MERGEABLE_INSTRUCTIONS);
    }

    @Test
    void forAlternatingTemplate_registersBothBases() {
        Plaquettes plaquettes = CssPlaquettes.forAlternatingTemplate(null);

        assertThat(plaquettes.indices()).containsExactly(CssPlaquettes.Z_INDEX, CssPlaquettes.X_INDEX);
        assertThat(plaquettes.get(CssPlaquettes.Z_INDEX).name()).isEqualTo("CSS_basis(Z)_VERTICAL");
        assertThat(plaquettes.get(CssPlaquettes.X_INDEX).name()).isEqualTo("CSS_basis(X)_VERTICAL");
    }
}
