package io.flowdetect.template;

import io.flowdetect.circuit.Displacement;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers over several templates describing consecutive time steps.
 */
public final class Templates {

    private Templates() {
    }

    /**
     * Instantiates every template in the frame of the last one: cells the last template
     * covers and another template does not are filled with 0, cells outside the last
     * template are dropped.
     */
    public static List<int[][]> superimposedInstantiations(List<? extends Template> templates, int k) {
        if (templates.isEmpty()) {
            throw new IllegalArgumentException("Need at least one template");
        }
        Template last = templates.get(templates.size() - 1);
        Displacement frameOrigin = last.instantiationOrigin(k);
        int[][] frame = last.instantiate(k);
        int rows = frame.length;
        int columns = rows == 0 ? 0 : frame[0].length;

        List<int[][]> result = new ArrayList<>(templates.size());
        for (Template template : templates) {
            Displacement origin = template.instantiationOrigin(k);
            int[][] instantiation = template.instantiate(k);
            int[][] aligned = new int[rows][columns];
            for (int i = 0; i < rows; i++) {
                int sourceRow = i + frameOrigin.y() - origin.y();
                if (sourceRow < 0 || sourceRow >= instantiation.length) {
                    continue;
                }
                for (int j = 0; j < columns; j++) {
                    int sourceColumn = j + frameOrigin.x() - origin.x();
                    if (sourceColumn >= 0 && sourceColumn < instantiation[sourceRow].length) {
                        aligned[i][j] = instantiation[sourceRow][sourceColumn];
                    }
                }
            }
            result.add(aligned);
        }
        return result;
    }
}
