package io.flowdetect.compile;

import io.flowdetect.plaquette.Plaquettes;

import java.util.Arrays;

/**
 * One time step of a situation: a square window of plaquette indices and the plaquettes
 * those indices refer to.
 */
public record TimestepLayout(int[][] subtemplate, Plaquettes plaquettes) {

    public TimestepLayout {
        if (subtemplate == null || plaquettes == null) {
            throw new IllegalArgumentException("subtemplate and plaquettes cannot be null");
        }
        int side = subtemplate.length;
        if (side % 2 == 0 || Arrays.stream(subtemplate).anyMatch(row -> row.length != side)) {
            throw new IllegalArgumentException("Sub-templates must be squares with an odd side length");
        }
        subtemplate = deepCopy(subtemplate);
    }

    private static int[][] deepCopy(int[][] array) {
        int[][] copy = new int[array.length][];
        for (int i = 0; i < array.length; i++) {
            copy[i] = array[i].clone();
        }
        return copy;
    }

    /**
     * A copy of the plaquette indices, row by row.
     */
    @Override
    public int[][] subtemplate() {
        return deepCopy(subtemplate);
    }

    public int radius() {
        return subtemplate.length / 2;
    }

    public int centralIndex() {
        return subtemplate[radius()][radius()];
    }

    public boolean isEmpty() {
        return Arrays.stream(subtemplate).flatMapToInt(Arrays::stream).allMatch(i -> i == 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimestepLayout that)) return false;
        return Arrays.deepEquals(subtemplate, that.subtemplate) && plaquettes.equals(that.plaquettes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(subtemplate) + plaquettes.hashCode();
    }

    @Override
    public String toString() {
        return "TimestepLayout" + Arrays.deepToString(subtemplate) + " " + plaquettes;
    }
}
