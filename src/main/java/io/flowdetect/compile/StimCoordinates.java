package io.flowdetect.compile;

import io.flowdetect.circuit.Instruction;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Coordinates attached to a {@code DETECTOR}: two spatial values, a time value and
 * optionally more. Values closer than {@value #TOLERANCE} are equal.
 */
public record StimCoordinates(List<Double> values) implements Comparable<StimCoordinates> {

    private static final double TOLERANCE = 1e-10;
    private static final int MIN_SIZE = 3;
    private static final int MAX_SIZE = 16;

    public StimCoordinates {
        if (values == null || values.size() < MIN_SIZE || values.size() > MAX_SIZE) {
            throw new IllegalArgumentException("Expected between " + MIN_SIZE + " and " + MAX_SIZE
                    + " coordinates, got " + values);
        }
        values = List.copyOf(values);
    }

    public static StimCoordinates of(double x, double y, double t) {
        return new StimCoordinates(List.of(x, y, t));
    }

    public double x() {
        return values.get(0);
    }

    public double y() {
        return values.get(1);
    }

    public double t() {
        return values.get(2);
    }

    public StimCoordinates offsetSpatiallyBy(double dx, double dy) {
        List<Double> shifted = new ArrayList<>(values);
        shifted.set(0, x() + dx);
        shifted.set(1, y() + dy);
        return new StimCoordinates(shifted);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StimCoordinates that) || values.size() != that.values.size()) return false;
        for (int i = 0; i < values.size(); i++) {
            if (Math.abs(values.get(i) - that.values.get(i)) >= TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return values.size();
    }

    @Override
    public int compareTo(StimCoordinates other) {
        for (int i = 0; i < Math.min(values.size(), other.values.size()); i++) {
            int cmp = Double.compare(values.get(i), other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }

    @Override
    public String toString() {
        return values.stream().map(Instruction::formatNumber).collect(Collectors.joining(",", "(", ")"));
    }
}
