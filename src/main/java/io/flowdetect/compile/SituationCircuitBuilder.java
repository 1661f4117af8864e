package io.flowdetect.compile;

import io.flowdetect.circuit.*;
import io.flowdetect.plaquette.Plaquette;
import io.flowdetect.plaquette.Plaquettes;
import io.flowdetect.plaquette.ScheduledCircuit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Generates the circuit of an array of plaquettes.
 * <p>
 * The plaquette at {@code [row][column]} is moved by {@code (column * increments.x, row * increments.y)}.
 * Moments sharing a time slot are merged, and identical mergeable collapsing operations applied
 * by neighbouring plaquettes to a shared qubit are only kept once.
 */
public final class SituationCircuitBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(SituationCircuitBuilder.class);

    private SituationCircuitBuilder() {
    }

    /**
     * @throws IllegalArgumentException if an index of {@code plaquetteArray} has no plaquette
     */
    public static ScheduledCircuit generateCircuit(int[][] plaquetteArray, Plaquettes plaquettes,
                                                   Displacement increments) {
        List<ScheduledCircuit> placed = new ArrayList<>();
        Set<String> mergeable = new HashSet<>();
        for (int row = 0; row < plaquetteArray.length; row++) {
            for (int column = 0; column < plaquetteArray[row].length; column++) {
                int index = plaquetteArray[row][column];
                if (index == Plaquettes.EMPTY_INDEX) {
                    continue;
                }
                Plaquette plaquette = plaquettes.get(index);
                Displacement offset = new Displacement(column * increments.x(), row * increments.y());
                placed.add(plaquette.circuit().mapToQubits(q -> q.plus(offset)));
                mergeable.addAll(plaquette.mergeableInstructions());
            }
        }
        return merge(relabelTogether(placed), mergeable);
    }

    /**
     * Gives every qubit used by {@code circuits} one index shared by all of them, assigned in
     * qubit order starting at 0.
     */
    public static List<ScheduledCircuit> relabelTogether(List<ScheduledCircuit> circuits) {
        Map<GridQubit, Integer> global = globalIndices(circuits);
        List<ScheduledCircuit> relabelled = new ArrayList<>(circuits.size());
        for (ScheduledCircuit circuit : circuits) {
            relabelled.add(circuit.relabel(global));
        }
        return relabelled;
    }

    public static SortedMap<Integer, GridQubit> globalQubitMap(List<ScheduledCircuit> circuits) {
        SortedMap<Integer, GridQubit> map = new TreeMap<>();
        globalIndices(circuits).forEach((qubit, index) -> map.put(index, qubit));
        return map;
    }

    private static Map<GridQubit, Integer> globalIndices(List<ScheduledCircuit> circuits) {
        SortedSet<GridQubit> qubits = new TreeSet<>();
        for (ScheduledCircuit circuit : circuits) {
            qubits.addAll(circuit.qubits());
        }
        Map<GridQubit, Integer> indices = new HashMap<>();
        for (GridQubit qubit : qubits) {
            indices.put(qubit, indices.size());
        }
        return indices;
    }

    /**
     * Merges circuits that already share their qubit indices.
     */
    public static ScheduledCircuit merge(List<ScheduledCircuit> circuits, Set<String> mergeableInstructions) {
        SortedMap<Integer, List<Instruction>> bySlot = new TreeMap<>();
        Map<Integer, GridQubit> qubitMap = new TreeMap<>();
        for (ScheduledCircuit circuit : circuits) {
            qubitMap.putAll(circuit.qubitMap());
            for (int i = 0; i < circuit.moments().size(); i++) {
                bySlot.computeIfAbsent(circuit.schedule().get(i), s -> new ArrayList<>())
                        .addAll(circuit.moments().get(i).instructions());
            }
        }
        List<Moment> moments = new ArrayList<>(bySlot.size());
        bySlot.forEach((slot, instructions) -> moments.add(deduplicate(slot, instructions, mergeableInstructions)));
        return new ScheduledCircuit(moments, new ArrayList<>(bySlot.keySet()), qubitMap);
    }

    private static Moment deduplicate(int slot, List<Instruction> instructions, Set<String> mergeableInstructions) {
        List<Instruction> result = new ArrayList<>();
        Map<String, Instruction> mergeableTemplates = new LinkedHashMap<>();
        Map<String, SortedMap<Integer, Target>> mergeableTargets = new HashMap<>();
        for (Instruction instruction : instructions) {
            if (!mergeableInstructions.contains(instruction.name())) {
                result.add(instruction);
                continue;
            }
            String key = instruction.name() + instruction.args();
            mergeableTemplates.putIfAbsent(key, instruction);
            SortedMap<Integer, Target> targets = mergeableTargets.computeIfAbsent(key, k -> new TreeMap<>());
            for (Target target : instruction.targets()) {
                targets.put(target.value(), target);
            }
        }
        mergeableTemplates.forEach((key, template) -> result.add(new Instruction(template.name(),
                new ArrayList<>(mergeableTargets.get(key).values()), template.args())));

        Set<Integer> touched = new HashSet<>();
        for (Instruction instruction : result) {
            for (int q : instruction.qubits()) {
                if (!touched.add(q)) {
                    LOGGER.warn("Qubit {} is used several times in the merged moment at slot {}: {}",
                            q, slot, result);
                    return new Moment(result);
                }
            }
        }
        return new Moment(result);
    }
}
