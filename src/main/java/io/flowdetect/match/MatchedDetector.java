package io.flowdetect.match;

import io.flowdetect.circuit.Instruction;
import io.flowdetect.circuit.Target;
import io.flowdetect.flow.RelativeMeasurementLocation;

import java.util.*;

/**
 * A detector found by matching flows, with measurement offsets relative to the point
 * where it will be inserted in the circuit.
 * <p>
 * Two detectors are equal when they have the same measurements and numerically close
 * coordinates. The hash only depends on the measurements.
 */
public record MatchedDetector(List<Double> coordinates, SortedSet<RelativeMeasurementLocation> measurements) {

    private static final double TOLERANCE = 1e-8;

    public MatchedDetector {
        if (measurements == null || measurements.isEmpty()) {
            throw new IllegalArgumentException("A detector needs at least one measurement");
        }
        coordinates = List.copyOf(coordinates);
        measurements = Collections.unmodifiableSortedSet(new TreeSet<>(measurements));
    }

    public static MatchedDetector of(List<Double> coordinates, Collection<RelativeMeasurementLocation> measurements) {
        return new MatchedDetector(coordinates, new TreeSet<>(measurements));
    }

    public MatchedDetector withTimeCoordinate(double time) {
        List<Double> extended = new ArrayList<>(coordinates);
        extended.add(time);
        return new MatchedDetector(extended, measurements);
    }

    /**
     * The {@code DETECTOR} annotation, with records in increasing offset order.
     */
    public Instruction toInstruction() {
        List<Target> targets = new ArrayList<>(measurements.size());
        for (RelativeMeasurementLocation m : measurements) {
            targets.add(Target.record(m.offset()));
        }
        return new Instruction("DETECTOR", targets, coordinates);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchedDetector that)) return false;
        if (!measurements.equals(that.measurements) || coordinates.size() != that.coordinates.size()) {
            return false;
        }
        for (int i = 0; i < coordinates.size(); i++) {
            if (Math.abs(coordinates.get(i) - that.coordinates.get(i)) > TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return measurements.hashCode();
    }
}
