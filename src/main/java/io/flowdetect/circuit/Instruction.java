package io.flowdetect.circuit;

import io.flowdetect.exceptions.MalformedInstructionException;
import io.flowdetect.pauli.PauliString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.IntUnaryOperator;
import java.util.stream.Collectors;

/**
 * One circuit instruction: a gate name, its targets and its parenthesised arguments.
 *
 * @param name    upper-case instruction name
 * @param targets targets in order of appearance
 * @param args    numeric arguments (probabilities, coordinates, ...)
 */
public record Instruction(String name, List<Target> targets, List<Double> args) implements CircuitItem {

    public Instruction {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        name = name.toUpperCase(Locale.ROOT);
        targets = targets == null ? List.of() : List.copyOf(targets);
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static Instruction of(String name, int... qubits) {
        List<Target> targets = new ArrayList<>(qubits.length);
        for (int q : qubits) {
            targets.add(Target.qubit(q));
        }
        return new Instruction(name, targets, List.of());
    }

    public static Instruction tick() {
        return new Instruction("TICK", List.of(), List.of());
    }

    public static Instruction qubitCoords(int qubit, double... coords) {
        List<Double> args = new ArrayList<>(coords.length);
        for (double c : coords) {
            args.add(c);
        }
        return new Instruction("QUBIT_COORDS", List.of(Target.qubit(qubit)), args);
    }

    public static Instruction shiftCoords(List<Double> shifts) {
        return new Instruction("SHIFT_COORDS", List.of(), shifts);
    }

    /**
     * Resolves this instruction against the standard registry.
     *
     * @throws MalformedInstructionException if the name is unknown
     */
    public GateDefinition definition() {
        return GateRegistry.standard().require(name);
    }

    public boolean isTick() {
        return "TICK".equals(name);
    }

    /**
     * Qubits named by the targets, in order, repeated if named twice.
     */
    public List<Integer> qubits() {
        return targets.stream()
                .filter(Target::touchesQubit)
                .map(Target::value)
                .toList();
    }

    public Instruction mapQubits(IntUnaryOperator mapping) {
        List<Target> mapped = new ArrayList<>(targets.size());
        for (Target target : targets) {
            mapped.add(target.mapQubit(mapping));
        }
        return new Instruction(name, mapped, args);
    }

    /**
     * One Pauli string per target of a single-qubit reset or measurement,
     * in the basis of the instruction.
     *
     * @throws MalformedInstructionException if a target is not a qubit or the
     *                                       instruction is not a single-qubit collapsing gate
     */
    public List<PauliString> collapsingOperations() {
        GateDefinition gate = definition();
        if (gate.category() == GateCategory.MULTI_QUBIT_MEASUREMENT) {
            throw new MalformedInstructionException("Found a measurement applied on several qubits ("
                    + name + "). Only single-qubit measurements are supported.");
        }
        if (!gate.isReset() && !gate.isMeasurement()) {
            throw new MalformedInstructionException(name + " is not a collapsing operation.");
        }
        List<PauliString> result = new ArrayList<>(targets.size());
        for (Target target : targets) {
            if (!target.isQubit()) {
                throw new MalformedInstructionException(
                        "Found a stim instruction with non-qubit target. This is not supported.");
            }
            result.add(PauliString.single(target.value(), gate.basis()));
        }
        return result;
    }

    @Override
    public int numMeasurements() {
        GateDefinition gate = GateRegistry.standard().lookup(name).orElse(null);
        if (gate == null) {
            return 0;
        }
        if ("MPAD".equals(gate.name())) {
            return targets.size();
        }
        return switch (gate.category()) {
            case MEASUREMENT, MEASURE_RESET -> targets.size();
            case MULTI_QUBIT_MEASUREMENT -> countProducts();
            default -> 0;
        };
    }

    private int countProducts() {
        if ("MPP".equals(name)) {
            int combiners = (int) targets.stream().filter(t -> t.kind() == Target.Kind.COMBINER).count();
            return targets.size() - 2 * combiners;
        }
        return targets.size() / 2;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        if (!args.isEmpty()) {
            sb.append('(')
                    .append(args.stream().map(Instruction::formatNumber).collect(Collectors.joining(", ")))
                    .append(')');
        }
        Target previous = null;
        for (Target target : targets) {
            boolean glued = target.kind() == Target.Kind.COMBINER
                    || (previous != null && previous.kind() == Target.Kind.COMBINER);
            sb.append(glued ? "" : " ").append(target);
            previous = target;
        }
        return sb.toString();
    }

    /**
     * Formats a number the way stim prints arguments: integers without a decimal part.
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
