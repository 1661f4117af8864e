package io.flowdetect.circuit;

/**
 * A 2D integer offset between grid positions.
 */
public record Displacement(int x, int y) {

    public Displacement scaledBy(int factor) {
        return new Displacement(x * factor, y * factor);
    }
}
