package io.flowdetect.template;

import io.flowdetect.circuit.Displacement;

/**
 * A {@code (2k+1) x (2k+1)} checkerboard: index 1 where {@code row + column} is even,
 * index 2 elsewhere.
 */
public final class AlternatingSquareTemplate implements Template {

    private static final Displacement INCREMENTS = new Displacement(2, 2);

    @Override
    public int[][] instantiate(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("Scale k must be non-negative, got " + k);
        }
        int size = 2 * k + 1;
        int[][] result = new int[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                result[i][j] = (i + j) % 2 == 0 ? 1 : 2;
            }
        }
        return result;
    }

    @Override
    public Displacement increments() {
        return INCREMENTS;
    }

    @Override
    public int expectedPlaquettesNumber() {
        return 2;
    }
}
