package io.flowdetect.flow;

import java.util.Comparator;

/**
 * Measurement identified by its qubit and its offset in the measurement record,
 * counted backward from a reference point (usually the end of a fragment).
 *
 * @param offset strictly negative offset, -1 being the last measurement
 * @param qubit  measured qubit
 */
public record RelativeMeasurementLocation(int offset, int qubit) implements Comparable<RelativeMeasurementLocation> {

    private static final Comparator<RelativeMeasurementLocation> ORDER =
            Comparator.comparingInt(RelativeMeasurementLocation::offset)
                    .thenComparingInt(RelativeMeasurementLocation::qubit);

    public RelativeMeasurementLocation {
        if (offset >= 0) {
            throw new IllegalArgumentException("Measurement offsets must be strictly negative, got " + offset);
        }
        if (qubit < 0) {
            throw new IllegalArgumentException("Qubit indices must be non-negative, got " + qubit);
        }
    }

    public RelativeMeasurementLocation offsetBy(int delta) {
        return new RelativeMeasurementLocation(offset + delta, qubit);
    }

    @Override
    public int compareTo(RelativeMeasurementLocation other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "M" + qubit + "[" + offset + "]";
    }
}
