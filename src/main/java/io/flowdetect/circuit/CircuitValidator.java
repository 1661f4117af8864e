package io.flowdetect.circuit;

import io.flowdetect.exceptions.MalformedInstructionException;

import java.util.*;
import java.util.function.Predicate;

/**
 * Structural checks a circuit must pass before it can be split into fragments.
 * Checks run in a fixed order and the first failing one is reported.
 */
public final class CircuitValidator {

    static final String COMBINED_INSTRUCTION =
            "The provided quantum circuit should not contain any combined instruction (e.g., MR).";
    static final String MIXED_MOMENT =
            "The provided quantum circuit contains at least one moment that has two different "
                    + "operation types from {reset, measurement, computation}.";
    static final String MULTI_QUBIT_MEASUREMENT =
            "The provided quantum circuit contains a measurement on several qubits (e.g., MPP). "
                    + "Only single-qubit measurements are supported.";
    static final String NON_QUBIT_TARGET =
            "Found a stim instruction with non-qubit target. This is not supported.";
    static final String QUBIT_REUSED =
            "The provided quantum circuit contains at least one moment in which a qubit is used "
                    + "by more than one instruction.";

    private record Check(Predicate<Circuit> passes, String reason) {
    }

    private static final List<Check> CHECKS = List.of(
            new Check(c -> noInstruction(c, i -> i.definition().isCombinedMeasurementReset()), COMBINED_INSTRUCTION),
            new Check(c -> noInstruction(c, i -> i.definition().category() == GateCategory.MULTI_QUBIT_MEASUREMENT),
                    MULTI_QUBIT_MEASUREMENT),
            new Check(c -> noInstruction(c, CircuitValidator::collapsingWithNonQubitTarget), NON_QUBIT_TARGET),
            new Check(c -> allMoments(c, CircuitValidator::hasSingleOperationType), MIXED_MOMENT),
            new Check(c -> allMoments(c, CircuitValidator::usesEachQubitOnce), QUBIT_REUSED)
    );

    private CircuitValidator() {
    }

    /**
     * Returns the reason the circuit is rejected, or empty if it is valid.
     *
     * @throws MalformedInstructionException if an instruction is not in the gate vocabulary
     */
    public static Optional<String> check(Circuit circuit) {
        for (Check check : CHECKS) {
            if (!check.passes().test(circuit)) {
                return Optional.of(check.reason());
            }
        }
        return Optional.empty();
    }

    /**
     * @throws MalformedInstructionException if the circuit is rejected
     */
    public static void validate(Circuit circuit) {
        Optional<String> reason = check(circuit);
        if (reason.isPresent()) {
            throw new MalformedInstructionException(reason.get());
        }
    }

    private static boolean noInstruction(Circuit circuit, Predicate<Instruction> forbidden) {
        for (CircuitItem item : circuit.items()) {
            if (item instanceof RepeatBlock block) {
                if (!noInstruction(block.body(), forbidden)) {
                    return false;
                }
            } else if (item instanceof Instruction instruction && forbidden.test(instruction)) {
                return false;
            }
        }
        return true;
    }

    private static boolean allMoments(Circuit circuit, Predicate<Moment> condition) {
        for (TimeSlice slice : circuit.moments()) {
            if (slice instanceof RepeatBlock block) {
                if (!allMoments(block.body(), condition)) {
                    return false;
                }
            } else if (slice instanceof Moment moment && !condition.test(moment)) {
                return false;
            }
        }
        return true;
    }

    private static boolean collapsingWithNonQubitTarget(Instruction instruction) {
        GateDefinition gate = instruction.definition();
        if (!gate.isReset() && !gate.isMeasurement()) {
            return false;
        }
        return instruction.targets().stream().anyMatch(t -> !t.isQubit());
    }

    private static boolean hasSingleOperationType(Moment moment) {
        int kinds = (moment.hasReset() ? 1 : 0)
                + (moment.hasMeasurement() ? 1 : 0)
                + (moment.hasComputation() ? 1 : 0);
        return kinds <= 1;
    }

    private static boolean usesEachQubitOnce(Moment moment) {
        Set<Integer> used = new HashSet<>();
        for (Instruction instruction : moment.instructions()) {
            if (instruction.definition().isVirtual()) {
                continue;
            }
            for (Integer qubit : instruction.qubits()) {
                if (!used.add(qubit)) {
                    return false;
                }
            }
        }
        return true;
    }
}
