package io.flowdetect.compile;

import io.flowdetect.circuit.Displacement;
import io.flowdetect.circuit.GridQubit;

import java.util.Comparator;

/**
 * A measurement identified by its qubit and its rank among the measurements of that qubit,
 * counted backward: -1 is the last measurement of the qubit.
 */
public record Measurement(GridQubit qubit, int offset) implements Comparable<Measurement> {

    private static final Comparator<Measurement> ORDER =
            Comparator.comparing(Measurement::qubit).thenComparingInt(Measurement::offset);

    public Measurement {
        if (qubit == null) {
            throw new IllegalArgumentException("qubit cannot be null");
        }
        if (offset >= 0) {
            throw new IllegalArgumentException("Measurement offsets must be negative, got " + offset);
        }
    }

    public Measurement offsetSpatiallyBy(int x, int y) {
        return new Measurement(qubit.plus(new Displacement(x, y)), offset);
    }

    @Override
    public int compareTo(Measurement other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "M(" + qubit.x() + "," + qubit.y() + "," + offset + ")";
    }
}
