package io.flowdetect.plaquette;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A small circuit acting on a fixed set of qubits, meant to be tiled over a template.
 *
 * @param name                   human-readable name, not part of the plaquette identity
 * @param qubits                 qubits in the plaquette coordinate system
 * @param circuit                scheduled circuit over {@code qubits}
 * @param mergeableInstructions  instruction names that can be de-duplicated when two neighbouring
 *                               plaquettes apply them to the same qubit in the same time slot
 */
public record Plaquette(String name, PlaquetteQubits qubits, ScheduledCircuit circuit,
                        Set<String> mergeableInstructions) {

    public Plaquette {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        Objects.requireNonNull(qubits, "qubits");
        Objects.requireNonNull(circuit, "circuit");
        if (!qubits.all().containsAll(circuit.qubits())) {
            throw new IllegalArgumentException("The circuit of plaquette " + name
                    + " uses qubits that are not declared by the plaquette");
        }
        mergeableInstructions = mergeableInstructions == null ? Set.of() : Set.copyOf(mergeableInstructions);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Structural identity of the plaquette: two plaquettes with the same fingerprint generate
     * the same circuit wherever they are placed.
     */
    public String fingerprint() {
        return qubits.dataQubits() + "|" + qubits.syndromeQubits() + "|" + circuit.fingerprint()
                + "|" + new TreeSet<>(mergeableInstructions);
    }

    public static class Builder {
        private String name;
        private PlaquetteQubits qubits = PlaquetteQubits.square();
        private ScheduledCircuit circuit = ScheduledCircuit.empty();
        private Set<String> mergeableInstructions = Set.of();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder qubits(PlaquetteQubits qubits) {
            this.qubits = qubits;
            return this;
        }

        public Builder circuit(ScheduledCircuit circuit) {
            this.circuit = circuit;
            return this;
        }

        public Builder mergeableInstructions(Set<String> mergeableInstructions) {
            this.mergeableInstructions = mergeableInstructions;
            return this;
        }

        public Plaquette build() {
            return new Plaquette(name, qubits, circuit, mergeableInstructions);
        }
    }
}
