package io.flowdetect.circuit;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Immutable sequence of instructions and {@code REPEAT} blocks.
 */
public final class Circuit {

    private static final Circuit EMPTY = new Circuit(List.of());

    private final List<CircuitItem> items;

    private Circuit(List<CircuitItem> items) {
        this.items = List.copyOf(items);
    }

    public static Circuit empty() {
        return EMPTY;
    }

    public static Circuit of(List<? extends CircuitItem> items) {
        return items.isEmpty() ? EMPTY : new Circuit(new ArrayList<>(items));
    }

    public static Circuit of(CircuitItem... items) {
        return of(Arrays.asList(items));
    }

    /**
     * Parses the stim text format.
     *
     * @see CircuitParser
     */
    public static Circuit parse(String text) {
        return CircuitParser.parse(text);
    }

    public List<CircuitItem> items() {
        return items;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int numMeasurements() {
        int total = 0;
        for (CircuitItem item : items) {
            total = Math.addExact(total, item.numMeasurements());
        }
        return total;
    }

    public Circuit concat(Circuit other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<CircuitItem> joined = new ArrayList<>(items);
        joined.addAll(other.items);
        return new Circuit(joined);
    }

    /**
     * Wraps this circuit in a {@code REPEAT} block.
     */
    public Circuit repeat(int repetitions) {
        return of(new RepeatBlock(repetitions, this));
    }

    /**
     * Splits the top level of the circuit into time slices.
     * <p>
     * A moment ends with its {@code TICK}, which is kept as its last instruction.
     * A {@code REPEAT} block is always a slice on its own, and closes the moment
     * being accumulated before it.
     */
    public List<TimeSlice> moments() {
        List<TimeSlice> slices = new ArrayList<>();
        List<Instruction> current = new ArrayList<>();
        for (CircuitItem item : items) {
            if (item instanceof RepeatBlock block) {
                if (!current.isEmpty()) {
                    slices.add(new Moment(current));
                    current = new ArrayList<>();
                }
                slices.add(block);
            } else if (item instanceof Instruction instruction) {
                current.add(instruction);
                if (instruction.isTick()) {
                    slices.add(new Moment(current));
                    current = new ArrayList<>();
                }
            }
        }
        if (!current.isEmpty()) {
            slices.add(new Moment(current));
        }
        return slices;
    }

    /**
     * Coordinates of every qubit declared by {@code QUBIT_COORDS}, with the
     * {@code SHIFT_COORDS} accumulated so far applied, as stim resolves them.
     * A later declaration of the same qubit wins.
     */
    public Map<Integer, List<Double>> finalQubitCoordinates() {
        Map<Integer, List<Double>> result = new TreeMap<>();
        collectCoordinates(this, new ArrayList<>(), result);
        return result;
    }

    private static void collectCoordinates(Circuit circuit, List<Double> shift, Map<Integer, List<Double>> result) {
        for (CircuitItem item : circuit.items) {
            if (item instanceof RepeatBlock block) {
                for (int r = 0; r < block.repetitions(); r++) {
                    collectCoordinates(block.body(), shift, result);
                }
            } else if (item instanceof Instruction instruction) {
                if ("SHIFT_COORDS".equals(instruction.name())) {
                    List<Double> args = instruction.args();
                    for (int i = 0; i < args.size(); i++) {
                        if (i < shift.size()) {
                            shift.set(i, shift.get(i) + args.get(i));
                        } else {
                            shift.add(args.get(i));
                        }
                    }
                } else if ("QUBIT_COORDS".equals(instruction.name())) {
                    List<Double> coords = new ArrayList<>(instruction.args());
                    for (int i = 0; i < coords.size() && i < shift.size(); i++) {
                        coords.set(i, coords.get(i) + shift.get(i));
                    }
                    for (Integer q : instruction.qubits()) {
                        result.put(q, List.copyOf(coords));
                    }
                }
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Circuit that)) return false;
        return items.equals(that.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    /**
     * Renders the circuit in stim text format, one instruction per line.
     */
    @Override
    public String toString() {
        return items.stream().map(Object::toString).collect(Collectors.joining("\n"));
    }
}
