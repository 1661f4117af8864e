package io.flowdetect.plaquette;

import io.flowdetect.circuit.*;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * Moments pinned to integer time slots, over qubits placed on the grid.
 * <p>
 * Slots left empty between two scheduled moments become empty moments when the circuit
 * is emitted. Moments never contain {@code TICK} instructions; ticks are added on output.
 */
public final class ScheduledCircuit {

    private final List<Moment> moments;
    private final List<Integer> schedule;
    private final SortedMap<Integer, GridQubit> qubitMap;

    public ScheduledCircuit(List<Moment> moments, List<Integer> schedule, Map<Integer, GridQubit> qubitMap) {
        if (moments.size() != schedule.size()) {
            throw new IllegalArgumentException("Got " + moments.size() + " moments but " + schedule.size()
                    + " schedule entries");
        }
        for (int i = 0; i < schedule.size(); i++) {
            if (schedule.get(i) < 0 || (i > 0 && schedule.get(i) <= schedule.get(i - 1))) {
                throw new IllegalArgumentException("Schedule must be non-negative and strictly increasing, got "
                        + schedule);
            }
        }
        for (Moment moment : moments) {
            for (Instruction instruction : moment.instructions()) {
                if (instruction.isTick()) {
                    throw new IllegalArgumentException("Scheduled moments cannot contain TICK instructions");
                }
                for (int q : instruction.qubits()) {
                    if (!qubitMap.containsKey(q)) {
                        throw new IllegalArgumentException("Qubit " + q + " used in " + instruction
                                + " has no position in the qubit map");
                    }
                }
            }
        }
        this.moments = List.copyOf(moments);
        this.schedule = List.copyOf(schedule);
        this.qubitMap = Collections.unmodifiableSortedMap(new TreeMap<>(qubitMap));
    }

    /**
     * Schedules the moments in consecutive slots starting at 0.
     */
    public static ScheduledCircuit consecutive(List<Moment> moments, Map<Integer, GridQubit> qubitMap) {
        List<Integer> schedule = new ArrayList<>(moments.size());
        for (int i = 0; i < moments.size(); i++) {
            schedule.add(i);
        }
        return new ScheduledCircuit(moments, schedule, qubitMap);
    }

    public static ScheduledCircuit empty() {
        return new ScheduledCircuit(List.of(), List.of(), Map.of());
    }

    public List<Moment> moments() {
        return moments;
    }

    public List<Integer> schedule() {
        return schedule;
    }

    public SortedMap<Integer, GridQubit> qubitMap() {
        return qubitMap;
    }

    public Set<GridQubit> qubits() {
        return new TreeSet<>(qubitMap.values());
    }

    public boolean isEmpty() {
        return moments.isEmpty();
    }

    /**
     * Moves every qubit with {@code mapping}; indices are kept.
     */
    public ScheduledCircuit mapToQubits(UnaryOperator<GridQubit> mapping) {
        Map<Integer, GridQubit> mapped = new TreeMap<>();
        qubitMap.forEach((index, qubit) -> mapped.put(index, mapping.apply(qubit)));
        return new ScheduledCircuit(moments, schedule, mapped);
    }

    /**
     * Renames the qubit indices so that each qubit gets the index it has in {@code globalIndices}.
     *
     * @throws IllegalArgumentException if a qubit of this circuit is absent from {@code globalIndices}
     */
    public ScheduledCircuit relabel(Map<GridQubit, Integer> globalIndices) {
        Map<Integer, Integer> localToGlobal = new HashMap<>();
        Map<Integer, GridQubit> relabelled = new TreeMap<>();
        qubitMap.forEach((index, qubit) -> {
            Integer global = globalIndices.get(qubit);
            if (global == null) {
                throw new IllegalArgumentException("No global index for qubit " + qubit);
            }
            localToGlobal.put(index, global);
            relabelled.put(global, qubit);
        });
        List<Moment> mapped = new ArrayList<>(moments.size());
        for (Moment moment : moments) {
            List<Instruction> instructions = new ArrayList<>(moment.instructions().size());
            for (Instruction instruction : moment.instructions()) {
                instructions.add(instruction.mapQubits(localToGlobal::get));
            }
            mapped.add(new Moment(instructions));
        }
        return new ScheduledCircuit(mapped, schedule, relabelled);
    }

    public int numMeasurements() {
        return moments.stream().mapToInt(Moment::numMeasurements).sum();
    }

    /**
     * {@code QUBIT_COORDS} declarations of every qubit, by increasing index.
     */
    public Circuit qubitCoordsPreamble() {
        List<CircuitItem> items = new ArrayList<>(qubitMap.size());
        qubitMap.forEach((index, qubit) -> items.add(qubit.toQubitCoordsInstruction(index)));
        return Circuit.of(items);
    }

    /**
     * The flat circuit: moments separated by {@code TICK}, one extra {@code TICK} per empty
     * slot, and no {@code TICK} after the last moment.
     */
    public Circuit toCircuit(boolean includeQubitCoords) {
        if (moments.isEmpty()) {
            return Circuit.empty();
        }
        List<CircuitItem> items = new ArrayList<>();
        if (includeQubitCoords) {
            items.addAll(qubitCoordsPreamble().items());
        }
        int current = 0;
        int last = schedule.get(schedule.size() - 1);
        for (int i = 0; i < moments.size(); i++) {
            for (; current < schedule.get(i); current++) {
                items.add(Instruction.tick());
            }
            items.addAll(moments.get(i).instructions());
            if (current != last) {
                items.add(Instruction.tick());
                current++;
            }
        }
        return Circuit.of(items);
    }

    /**
     * Position-independent description of the circuit: qubits are named by their position
     * instead of their index, so two circuits doing the same thing on the same qubits have
     * the same fingerprint whatever their numbering.
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < moments.size(); i++) {
            sb.append('@').append(schedule.get(i)).append('{');
            for (Instruction instruction : moments.get(i).instructions()) {
                sb.append(instruction.name()).append(instruction.args());
                for (Target target : instruction.targets()) {
                    sb.append(' ');
                    if (target.touchesQubit()) {
                        GridQubit qubit = qubitMap.get(target.value());
                        sb.append(target.inverted() ? "!" : "")
                                .append(target.pauli() == null ? "" : target.pauli().name())
                                .append('(').append(qubit.x()).append(',').append(qubit.y()).append(')');
                    } else {
                        sb.append(target);
                    }
                }
                sb.append(';');
            }
            sb.append('}');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduledCircuit that)) return false;
        return moments.equals(that.moments) && schedule.equals(that.schedule) && qubitMap.equals(that.qubitMap);
    }

    @Override
    public int hashCode() {
        return Objects.hash(moments, schedule, qubitMap);
    }

    @Override
    public String toString() {
        return toCircuit(true).toString();
    }
}
