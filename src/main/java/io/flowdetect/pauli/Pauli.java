package io.flowdetect.pauli;

/**
 * Single-qubit Pauli operator, encoded by its X and Z bits.
 * Phases are not tracked.
 */
public enum Pauli {
    I(false, false),
    X(true, false),
    Y(true, true),
    Z(false, true);

    private final boolean x;
    private final boolean z;

    Pauli(boolean x, boolean z) {
        this.x = x;
        this.z = z;
    }

    public boolean hasX() {
        return x;
    }

    public boolean hasZ() {
        return z;
    }

    /**
     * Two-bit encoding: bit 0 is the X component, bit 1 the Z component.
     */
    public int bits() {
        return (x ? 1 : 0) | (z ? 2 : 0);
    }

    public static Pauli fromBits(int bits) {
        return switch (bits & 3) {
            case 0 -> I;
            case 1 -> X;
            case 2 -> Z;
            default -> Y;
        };
    }

    public static Pauli fromBits(boolean x, boolean z) {
        return fromBits((x ? 1 : 0) | (z ? 2 : 0));
    }

    /**
     * Product up to a global phase.
     */
    public Pauli times(Pauli other) {
        return fromBits(bits() ^ other.bits());
    }

    /**
     * Two non-identity Paulis anticommute iff they differ.
     */
    public boolean anticommutesWith(Pauli other) {
        return this != I && other != I && this != other;
    }

    /**
     * Parses one of {@code I X Y Z}, with {@code _} accepted as identity.
     */
    public static Pauli fromChar(char c) {
        return switch (Character.toUpperCase(c)) {
            case 'I', '_' -> I;
            case 'X' -> X;
            case 'Y' -> Y;
            case 'Z' -> Z;
            default -> throw new IllegalArgumentException("Invalid Pauli literal '" + c + "'");
        };
    }
}
