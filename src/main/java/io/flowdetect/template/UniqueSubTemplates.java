package io.flowdetect.template;

import java.util.*;

/**
 * The distinct sub-templates of a given radius found in a stack of template instantiations.
 * <p>
 * {@link #subtemplateIndices()} has the shape of the instantiations and tells, for every cell,
 * which entry of {@link #subtemplates()} is centred on it; 0 marks skipped cells.
 */
public final class UniqueSubTemplates {

    private final int[][] subtemplateIndices;
    private final SortedMap<Integer, SubTemplate> subtemplates;

    private UniqueSubTemplates(int[][] subtemplateIndices, SortedMap<Integer, SubTemplate> subtemplates) {
        this.subtemplateIndices = subtemplateIndices;
        this.subtemplates = Collections.unmodifiableSortedMap(subtemplates);
    }

    /**
     * Groups the cells of {@code instantiations} by the content of the window of side
     * {@code 2 * radius + 1} centred on them, across every layer.
     *
     * @param instantiations      one instantiation per time step, all of the same shape
     * @param avoidZeroPlaquettes skip cells that hold 0 in every layer
     */
    public static UniqueSubTemplates spatiallyDistinct(List<int[][]> instantiations, int radius,
                                                       boolean avoidZeroPlaquettes) {
        if (instantiations.isEmpty()) {
            throw new IllegalArgumentException("Need at least one instantiation");
        }
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non-negative, got " + radius);
        }
        int rows = instantiations.get(0).length;
        int columns = rows == 0 ? 0 : instantiations.get(0)[0].length;
        for (int[][] instantiation : instantiations) {
            if (instantiation.length != rows || Arrays.stream(instantiation).anyMatch(r -> r.length != columns)) {
                throw new IllegalArgumentException("All the instantiations should have the same shape");
            }
        }

        int side = 2 * radius + 1;
        int[][] indices = new int[rows][columns];
        Map<SubTemplate, Integer> seen = new LinkedHashMap<>();
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                if (avoidZeroPlaquettes && allZeroAt(instantiations, i, j)) {
                    continue;
                }
                int[][][] layers = new int[instantiations.size()][side][side];
                for (int t = 0; t < instantiations.size(); t++) {
                    int[][] instantiation = instantiations.get(t);
                    for (int di = 0; di < side; di++) {
                        for (int dj = 0; dj < side; dj++) {
                            int r = i + di - radius;
                            int c = j + dj - radius;
                            if (r >= 0 && r < rows && c >= 0 && c < columns) {
                                layers[t][di][dj] = instantiation[r][c];
                            }
                        }
                    }
                }
                indices[i][j] = seen.computeIfAbsent(new SubTemplate(layers), s -> seen.size() + 1);
            }
        }
        SortedMap<Integer, SubTemplate> byIndex = new TreeMap<>();
        seen.forEach((subtemplate, index) -> byIndex.put(index, subtemplate));
        return new UniqueSubTemplates(indices, byIndex);
    }

    private static boolean allZeroAt(List<int[][]> instantiations, int row, int column) {
        for (int[][] instantiation : instantiations) {
            if (instantiation[row][column] != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Copy of the per-cell sub-template indices, as {@code [row][column]}.
     */
    public int[][] subtemplateIndices() {
        int[][] copy = new int[subtemplateIndices.length][];
        for (int i = 0; i < subtemplateIndices.length; i++) {
            copy[i] = subtemplateIndices[i].clone();
        }
        return copy;
    }

    public int subtemplateIndexAt(int row, int column) {
        return subtemplateIndices[row][column];
    }

    public SortedMap<Integer, SubTemplate> subtemplates() {
        return subtemplates;
    }

    public int rows() {
        return subtemplateIndices.length;
    }

    public int columns() {
        return subtemplateIndices.length == 0 ? 0 : subtemplateIndices[0].length;
    }
}
