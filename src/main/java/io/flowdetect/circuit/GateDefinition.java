package io.flowdetect.circuit;

import io.flowdetect.pauli.Pauli;

import java.util.List;

/**
 * An instruction name known to the engine, with its category and, depending
 * on the category, its collapsing basis or its Clifford action.
 *
 * @param name     canonical upper-case name
 * @param aliases  alternative names resolving to the same gate
 * @param category how fragment decomposition treats the instruction
 * @param basis    basis of a reset or measurement, {@code null} otherwise
 * @param action   sign-free action of a unitary gate, {@code null} otherwise
 */
public record GateDefinition(
        String name,
        List<String> aliases,
        GateCategory category,
        Pauli basis,
        CliffordAction action
) {
    public GateDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        boolean collapsing = category == GateCategory.RESET
                || category == GateCategory.MEASUREMENT
                || category == GateCategory.MEASURE_RESET;
        if (collapsing && (basis == null || basis == Pauli.I)) {
            throw new IllegalArgumentException("Collapsing gate " + name + " needs a non-identity basis");
        }
        if (category == GateCategory.UNITARY && action == null) {
            throw new IllegalArgumentException("Unitary gate " + name + " needs a Clifford action");
        }
    }

    public static GateDefinition annotation(String name) {
        return new GateDefinition(name, List.of(), GateCategory.ANNOTATION, null, null);
    }

    public static GateDefinition noise(String name, String... aliases) {
        return new GateDefinition(name, List.of(aliases), GateCategory.NOISE, null, null);
    }

    public static GateDefinition collapsing(String name, GateCategory category, Pauli basis, String... aliases) {
        return new GateDefinition(name, List.of(aliases), category, basis, null);
    }

    public static GateDefinition unitary(String name, CliffordAction action, String... aliases) {
        return new GateDefinition(name, List.of(aliases), GateCategory.UNITARY, null, action);
    }

    /**
     * Annotations and noise channels: instructions that do not change the
     * stabilizers tracked by the engine.
     */
    public boolean isVirtual() {
        return category == GateCategory.ANNOTATION || category == GateCategory.NOISE;
    }

    public boolean isReset() {
        return category == GateCategory.RESET || category == GateCategory.MEASURE_RESET;
    }

    public boolean isMeasurement() {
        return category == GateCategory.MEASUREMENT
                || category == GateCategory.MEASURE_RESET
                || category == GateCategory.MULTI_QUBIT_MEASUREMENT;
    }

    public boolean isCombinedMeasurementReset() {
        return category == GateCategory.MEASURE_RESET;
    }

    public boolean isUnitary() {
        return category == GateCategory.UNITARY;
    }
}
