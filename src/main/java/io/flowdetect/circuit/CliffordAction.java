package io.flowdetect.circuit;

import io.flowdetect.pauli.Pauli;

/**
 * Sign-free conjugation action of a one- or two-qubit Clifford gate.
 * <p>
 * Local Paulis are bit masks: for one qubit bit 0 is X and bit 1 is Z; for two
 * qubits bits 0-1 encode the first target and bits 2-3 the second. The action
 * is linear over GF(2), so it is fully described by the images of the
 * generators {@code X, Z} (one qubit) or {@code XI, ZI, IX, IZ} (two qubits).
 */
public record CliffordAction(int arity, int[] generatorImages) {

    public CliffordAction {
        if (arity != 1 && arity != 2) {
            throw new IllegalArgumentException("Only 1- and 2-qubit Clifford gates are supported, got arity " + arity);
        }
        if (generatorImages == null || generatorImages.length != 2 * arity) {
            throw new IllegalArgumentException("Expected " + 2 * arity + " generator images");
        }
        generatorImages = generatorImages.clone();
    }

    /**
     * Single-qubit action from the images of X and Z, each a one-letter Pauli.
     */
    public static CliffordAction single(String imageOfX, String imageOfZ) {
        return new CliffordAction(1, new int[]{encode(imageOfX), encode(imageOfZ)});
    }

    /**
     * Two-qubit action from the images of XI, ZI, IX and IZ, each a two-letter Pauli.
     */
    public static CliffordAction pair(String imageOfXI, String imageOfZI, String imageOfIX, String imageOfIZ) {
        return new CliffordAction(2, new int[]{
                encode(imageOfXI), encode(imageOfZI), encode(imageOfIX), encode(imageOfIZ)});
    }

    private static int encode(String paulis) {
        int mask = 0;
        for (int i = 0; i < paulis.length(); i++) {
            mask |= Pauli.fromChar(paulis.charAt(i)).bits() << (2 * i);
        }
        return mask;
    }

    @Override
    public int[] generatorImages() {
        return generatorImages.clone();
    }

    /**
     * Image of a local Pauli mask under conjugation by the gate.
     */
    public int apply(int mask) {
        int result = 0;
        for (int bit = 0; bit < generatorImages.length; bit++) {
            if ((mask & (1 << bit)) != 0) {
                result ^= generatorImages[bit];
            }
        }
        return result;
    }

    public boolean isIdentity() {
        for (int bit = 0; bit < generatorImages.length; bit++) {
            if (generatorImages[bit] != 1 << bit) {
                return false;
            }
        }
        return true;
    }
}
