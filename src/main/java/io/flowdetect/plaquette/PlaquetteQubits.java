package io.flowdetect.plaquette;

import io.flowdetect.circuit.GridQubit;

import java.util.ArrayList;
import java.util.List;

/**
 * Qubits of a plaquette in its local coordinate system, the plaquette origin being (0, 0).
 */
public record PlaquetteQubits(List<GridQubit> dataQubits, List<GridQubit> syndromeQubits) {

    public PlaquetteQubits {
        dataQubits = List.copyOf(dataQubits);
        syndromeQubits = List.copyOf(syndromeQubits);
    }

    /**
     * Four data qubits on the corners and one syndrome qubit in the middle.
     */
    public static PlaquetteQubits square() {
        return new PlaquetteQubits(
                List.of(new GridQubit(-1, -1), new GridQubit(1, -1), new GridQubit(-1, 1), new GridQubit(1, 1)),
                List.of(new GridQubit(0, 0)));
    }

    public List<GridQubit> all() {
        List<GridQubit> all = new ArrayList<>(dataQubits);
        all.addAll(syndromeQubits);
        return all;
    }
}
