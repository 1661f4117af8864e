package io.flowdetect.circuit;

import io.flowdetect.pauli.PauliString;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Instructions executed in parallel, up to and including the closing {@code TICK}
 * when there is one.
 */
public record Moment(List<Instruction> instructions) implements TimeSlice {

    public Moment {
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
    }

    public boolean hasReset() {
        return instructions.stream().anyMatch(i -> i.definition().isReset());
    }

    public boolean hasMeasurement() {
        return instructions.stream().anyMatch(i -> i.definition().isMeasurement());
    }

    /**
     * True if the moment contains resets and nothing else but virtual instructions.
     */
    public boolean hasOnlyReset() {
        return hasOnly(GateDefinition::isReset);
    }

    /**
     * True if the moment contains measurements and nothing else but virtual instructions.
     */
    public boolean hasOnlyMeasurement() {
        return hasOnly(GateDefinition::isMeasurement);
    }

    private boolean hasOnly(Predicate<GateDefinition> kind) {
        boolean found = false;
        for (Instruction instruction : instructions) {
            GateDefinition gate = instruction.definition();
            if (gate.isVirtual()) {
                continue;
            }
            if (!kind.test(gate)) {
                return false;
            }
            found = true;
        }
        return found;
    }

    /**
     * True if every instruction is an annotation or a noise channel.
     */
    public boolean isVirtual() {
        return instructions.stream().allMatch(i -> i.definition().isVirtual());
    }

    public boolean hasComputation() {
        return instructions.stream().anyMatch(i -> i.definition().isUnitary());
    }

    /**
     * Collapsing operations of the moment, one per reset or measurement target, in record order.
     */
    public List<PauliString> collapsingOperations() {
        List<PauliString> result = new ArrayList<>();
        for (Instruction instruction : instructions) {
            GateDefinition gate = instruction.definition();
            if (gate.isReset() || gate.isMeasurement()) {
                result.addAll(instruction.collapsingOperations());
            }
        }
        return result;
    }

    public int numMeasurements() {
        return instructions.stream().mapToInt(Instruction::numMeasurements).sum();
    }

    public Circuit toCircuit() {
        return Circuit.of(new ArrayList<CircuitItem>(instructions));
    }

    @Override
    public String toString() {
        return toCircuit().toString();
    }
}
