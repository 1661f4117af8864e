package io.flowdetect.circuit;

import java.util.Comparator;

/**
 * A qubit placed on the 2D grid. Ordered by {@code x} first, then {@code y}, which is the
 * order used to assign circuit indices.
 */
public record GridQubit(int x, int y) implements Comparable<GridQubit> {

    private static final Comparator<GridQubit> ORDER =
            Comparator.comparingInt(GridQubit::x).thenComparingInt(GridQubit::y);

    public GridQubit plus(Displacement displacement) {
        return new GridQubit(x + displacement.x(), y + displacement.y());
    }

    public Instruction toQubitCoordsInstruction(int index) {
        return Instruction.qubitCoords(index, x, y);
    }

    @Override
    public int compareTo(GridQubit other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "Q[" + x + ", " + y + "]";
    }
}
