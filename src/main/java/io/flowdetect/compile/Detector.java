package io.flowdetect.compile;

import io.flowdetect.circuit.Instruction;
import io.flowdetect.circuit.Target;

import java.util.*;

/**
 * A detector over qubit-relative measurements. Identity is the set of measurements;
 * coordinates are only carried along for emission.
 */
public record Detector(SortedSet<Measurement> measurements, StimCoordinates coordinates) {

    public Detector {
        if (measurements == null || measurements.isEmpty()) {
            throw new IllegalArgumentException("Trying to create a detector without any measurement.");
        }
        if (coordinates == null) {
            throw new IllegalArgumentException("coordinates cannot be null");
        }
        measurements = Collections.unmodifiableSortedSet(new TreeSet<>(measurements));
    }

    public static Detector of(Collection<Measurement> measurements, StimCoordinates coordinates) {
        return new Detector(new TreeSet<>(measurements), coordinates);
    }

    public Detector offsetSpatiallyBy(int x, int y) {
        SortedSet<Measurement> shifted = new TreeSet<>();
        for (Measurement measurement : measurements) {
            shifted.add(measurement.offsetSpatiallyBy(x, y));
        }
        return new Detector(shifted, coordinates.offsetSpatiallyBy(x, y));
    }

    /**
     * The {@code DETECTOR} instruction, valid right after the circuit {@code records} was built from.
     * Records are listed in increasing offset order.
     */
    public Instruction toInstruction(MeasurementRecordsMap records) {
        List<Integer> offsets = new ArrayList<>(measurements.size());
        for (Measurement measurement : measurements) {
            offsets.add(records.recordOf(measurement));
        }
        Collections.sort(offsets);
        List<Target> targets = offsets.stream().map(Target::record).toList();
        return new Instruction("DETECTOR", targets, coordinates.values());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Detector that)) return false;
        return measurements.equals(that.measurements);
    }

    @Override
    public int hashCode() {
        return measurements.hashCode();
    }

    @Override
    public String toString() {
        return "D" + coordinates + measurements;
    }
}
