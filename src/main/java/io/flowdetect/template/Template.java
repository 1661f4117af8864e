package io.flowdetect.template;

import io.flowdetect.circuit.Displacement;

/**
 * A scalable 2D arrangement of plaquette indices.
 */
public interface Template {

    /**
     * Plaquette indices of the template at scale {@code k}, as {@code [row][column]}.
     * Index 0 means "no plaquette".
     */
    int[][] instantiate(int k);

    /**
     * Offset between the origins of two neighbouring plaquettes.
     */
    Displacement increments();

    /**
     * Number of distinct non-zero plaquette indices used by the template.
     */
    int expectedPlaquettesNumber();

    /**
     * Position, in plaquette units, of the top-left cell of {@link #instantiate(int)}.
     */
    default Displacement instantiationOrigin(int k) {
        return new Displacement(0, 0);
    }
}
