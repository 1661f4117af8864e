package io.flowdetect.template;

import java.util.Arrays;

/**
 * A square window of odd side around one template cell, with one layer per time step.
 * Cells outside the template hold 0.
 */
public final class SubTemplate {

    private final int[][][] layers;

    SubTemplate(int[][][] layers) {
        if (layers.length == 0) {
            throw new IllegalArgumentException("A sub-template needs at least one layer");
        }
        int side = layers[0].length;
        if (side % 2 == 0) {
            throw new IllegalArgumentException("Sub-template sides must be odd, got " + side);
        }
        for (int[][] layer : layers) {
            if (layer.length != side || Arrays.stream(layer).anyMatch(row -> row.length != side)) {
                throw new IllegalArgumentException("Sub-template layers must all be " + side + "x" + side + " squares");
            }
        }
        this.layers = layers;
    }

    public static SubTemplate of(int[][]... layers) {
        int[][][] copy = new int[layers.length][][];
        for (int t = 0; t < layers.length; t++) {
            copy[t] = deepCopy(layers[t]);
        }
        return new SubTemplate(copy);
    }

    public int timesteps() {
        return layers.length;
    }

    public int radius() {
        return layers[0].length / 2;
    }

    public int side() {
        return layers[0].length;
    }

    /**
     * Copy of the layer of time step {@code t}.
     */
    public int[][] layer(int t) {
        return deepCopy(layers[t]);
    }

    public int get(int t, int row, int column) {
        return layers[t][row][column];
    }

    public int center(int t) {
        return layers[t][radius()][radius()];
    }

    public boolean isEmpty(int t) {
        return Arrays.stream(layers[t]).flatMapToInt(Arrays::stream).allMatch(i -> i == 0);
    }

    private static int[][] deepCopy(int[][] array) {
        int[][] copy = new int[array.length][];
        for (int i = 0; i < array.length; i++) {
            copy[i] = array[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubTemplate that)) return false;
        return Arrays.deepEquals(layers, that.layers);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(layers);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(layers);
    }
}
