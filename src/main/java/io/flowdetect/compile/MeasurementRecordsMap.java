package io.flowdetect.compile;

import io.flowdetect.circuit.*;
import io.flowdetect.exceptions.FlowDetectException;
import io.flowdetect.exceptions.MalformedInstructionException;

import java.util.*;

/**
 * Global record offsets of the measurements of each qubit, relative to the end of a circuit.
 * Offsets of one qubit are kept in increasing order.
 */
public final class MeasurementRecordsMap {

    private final Map<GridQubit, List<Integer>> offsets;

    public MeasurementRecordsMap(Map<GridQubit, List<Integer>> offsets) {
        Set<Integer> all = new HashSet<>();
        Map<GridQubit, List<Integer>> copy = new TreeMap<>();
        offsets.forEach((qubit, qubitOffsets) -> {
            for (int i = 0; i < qubitOffsets.size(); i++) {
                int offset = qubitOffsets.get(i);
                if (offset >= 0) {
                    throw new IllegalArgumentException("Found non-negative offset " + offset + " for qubit " + qubit);
                }
                if (i > 0 && offset <= qubitOffsets.get(i - 1)) {
                    throw new IllegalArgumentException("Offsets of qubit " + qubit + " are not sorted: " + qubitOffsets);
                }
                if (!all.add(offset)) {
                    throw new IllegalArgumentException("Measurement record offset " + offset + " appears twice");
                }
            }
            copy.put(qubit, List.copyOf(qubitOffsets));
        });
        this.offsets = Collections.unmodifiableMap(copy);
    }

    /**
     * Reads the measurements of {@code circuit}, whose qubit indices are resolved through
     * {@code qubitMap}.
     *
     * @throws MalformedInstructionException if the circuit has a {@code REPEAT} block or a
     *                                       measurement on several qubits
     */
    public static MeasurementRecordsMap fromCircuit(Circuit circuit, Map<Integer, GridQubit> qubitMap) {
        int total = circuit.numMeasurements();
        int record = -total;
        Map<GridQubit, List<Integer>> offsets = new TreeMap<>();
        for (CircuitItem item : circuit.items()) {
            if (item instanceof RepeatBlock) {
                throw new MalformedInstructionException("Found a REPEAT instruction. This is not supported for the moment.");
            }
            Instruction instruction = (Instruction) item;
            GateDefinition gate = instruction.definition();
            if (gate.category() == GateCategory.MULTI_QUBIT_MEASUREMENT) {
                throw new MalformedInstructionException("Found a non-supported measurement instruction: " + instruction);
            }
            if (!gate.isMeasurement()) {
                record += instruction.numMeasurements();
                continue;
            }
            for (Target target : instruction.targets()) {
                GridQubit qubit = qubitMap.get(target.value());
                if (qubit == null) {
                    throw new FlowDetectException("Qubit " + target.value() + " is measured but has no position");
                }
                offsets.computeIfAbsent(qubit, q -> new ArrayList<>()).add(record++);
            }
        }
        return new MeasurementRecordsMap(offsets);
    }

    public boolean contains(GridQubit qubit) {
        return offsets.containsKey(qubit);
    }

    /**
     * Global record offset of {@code measurement}.
     *
     * @throws FlowDetectException if the qubit is unknown or was not measured that many times
     */
    public int recordOf(Measurement measurement) {
        List<Integer> qubitOffsets = offsets.get(measurement.qubit());
        if (qubitOffsets == null) {
            throw new FlowDetectException("Trying to get measurement record for " + measurement.qubit()
                    + " but qubit is not in the measurement record map.");
        }
        int index = qubitOffsets.size() + measurement.offset();
        if (index < 0) {
            throw new FlowDetectException("Qubit " + measurement.qubit() + " is only measured "
                    + qubitOffsets.size() + " times, cannot resolve " + measurement);
        }
        return qubitOffsets.get(index);
    }

    public List<Integer> offsetsOf(GridQubit qubit) {
        return offsets.getOrDefault(qubit, List.of());
    }

    /**
     * Inverse view: the qubit-relative measurement behind each global record offset.
     */
    public Map<Integer, Measurement> measurementsByRecord() {
        Map<Integer, Measurement> byRecord = new HashMap<>();
        offsets.forEach((qubit, qubitOffsets) -> {
            for (int i = 0; i < qubitOffsets.size(); i++) {
                byRecord.put(qubitOffsets.get(i), new Measurement(qubit, i - qubitOffsets.size()));
            }
        });
        return byRecord;
    }
}
