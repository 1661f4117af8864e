package io.flowdetect.circuit;

import io.flowdetect.pauli.Pauli;

import java.util.function.IntUnaryOperator;

/**
 * A single instruction target, in stim syntax: {@code 5}, {@code !5},
 * {@code rec[-2]}, {@code X3} or the {@code *} combiner.
 */
public record Target(Kind kind, int value, Pauli pauli, boolean inverted) {

    public enum Kind {
        QUBIT,
        MEASUREMENT_RECORD,
        PAULI,
        COMBINER
    }

    public Target {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind == Kind.MEASUREMENT_RECORD && value >= 0) {
            throw new IllegalArgumentException("Measurement record targets must be negative, got rec[" + value + "]");
        }
        if ((kind == Kind.QUBIT || kind == Kind.PAULI) && value < 0) {
            throw new IllegalArgumentException("Qubit targets must be non-negative, got " + value);
        }
        if (kind == Kind.PAULI && (pauli == null || pauli == Pauli.I)) {
            throw new IllegalArgumentException("Pauli targets need X, Y or Z");
        }
    }

    public static Target qubit(int qubit) {
        return new Target(Kind.QUBIT, qubit, null, false);
    }

    public static Target invertedQubit(int qubit) {
        return new Target(Kind.QUBIT, qubit, null, true);
    }

    public static Target record(int offset) {
        return new Target(Kind.MEASUREMENT_RECORD, offset, null, false);
    }

    public static Target pauli(Pauli pauli, int qubit) {
        return new Target(Kind.PAULI, qubit, pauli, false);
    }

    public static Target combiner() {
        return new Target(Kind.COMBINER, 0, null, false);
    }

    public boolean isQubit() {
        return kind == Kind.QUBIT;
    }

    /**
     * True for targets naming a qubit, either directly or through a Pauli target.
     */
    public boolean touchesQubit() {
        return kind == Kind.QUBIT || kind == Kind.PAULI;
    }

    /**
     * Same target with its qubit renamed; records and combiners are returned unchanged.
     */
    public Target mapQubit(IntUnaryOperator mapping) {
        if (!touchesQubit()) {
            return this;
        }
        return new Target(kind, mapping.applyAsInt(value), pauli, inverted);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case QUBIT -> (inverted ? "!" : "") + value;
            case MEASUREMENT_RECORD -> "rec[" + value + "]";
            case PAULI -> (inverted ? "!" : "") + pauli.name() + value;
            case COMBINER -> "*";
        };
    }
}
