package io.flowdetect.fragment;

import io.flowdetect.circuit.*;
import io.flowdetect.exceptions.MalformedInstructionException;
import io.flowdetect.pauli.PauliString;
import io.flowdetect.tableau.CliffordTableau;

import java.util.*;

/**
 * A straight-line sub-circuit that starts with its reset moments and ends with its
 * measurement moments, with only unitary (or virtual) moments in between.
 * <p>
 * Resets and measurements are listed in order of appearance, which for measurements is
 * the order of their records.
 */
public final class Fragment implements FragmentNode {

    private final Circuit circuit;
    private final List<PauliString> resets;
    private final List<PauliString> measurements;
    private CliffordTableau tableau;

    public Fragment(Circuit circuit) {
        for (CircuitItem item : circuit.items()) {
            if (item instanceof RepeatBlock) {
                throw new MalformedInstructionException("Breaking invariant: Cannot initialise a Fragment with a "
                        + "REPEAT block but found one. Did you mean to use FragmentLoop?");
            }
        }
        this.circuit = circuit;

        List<Moment> moments = new ArrayList<>();
        for (TimeSlice slice : circuit.moments()) {
            moments.add((Moment) slice);
        }

        List<PauliString> foundResets = new ArrayList<>();
        for (Moment moment : moments) {
            if (moment.isVirtual()) {
                continue;
            }
            if (!moment.hasReset()) {
                break;
            }
            if (!moment.hasOnlyReset()) {
                throw new MalformedInstructionException("Breaking invariant: found a moment with at least one reset "
                        + "instruction and a non-reset instruction:\n" + moment);
            }
            foundResets.addAll(moment.collapsingOperations());
        }

        LinkedList<PauliString> foundMeasurements = new LinkedList<>();
        for (int i = moments.size() - 1; i >= 0; i--) {
            Moment moment = moments.get(i);
            if (moment.isVirtual()) {
                continue;
            }
            if (!moment.hasMeasurement()) {
                break;
            }
            if (!moment.hasOnlyMeasurement()) {
                throw new MalformedInstructionException("Breaking invariant: found a moment with at least one "
                        + "measurement instruction and a non-measurement instruction:\n" + moment);
            }
            List<PauliString> ops = moment.collapsingOperations();
            for (int k = ops.size() - 1; k >= 0; k--) {
                foundMeasurements.addFirst(ops.get(k));
            }
        }

        this.resets = List.copyOf(foundResets);
        this.measurements = List.copyOf(foundMeasurements);
    }

    public static Fragment parse(String text) {
        return new Fragment(Circuit.parse(text));
    }

    public Circuit circuit() {
        return circuit;
    }

    public List<PauliString> resets() {
        return resets;
    }

    public List<PauliString> measurements() {
        return measurements;
    }

    /**
     * Measured qubit of every measurement, in measurement order.
     */
    public List<Integer> measurementsQubits() {
        List<Integer> qubits = new ArrayList<>(measurements.size());
        for (PauliString measurement : measurements) {
            qubits.add(measurement.qubit());
        }
        return qubits;
    }

    @Override
    public int numMeasurements() {
        return measurements.size();
    }

    /**
     * Tableau of the unitary part, built on first use.
     */
    public synchronized CliffordTableau tableau() {
        if (tableau == null) {
            tableau = CliffordTableau.of(circuit);
        }
        return tableau;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fragment that)) return false;
        return circuit.equals(that.circuit);
    }

    @Override
    public int hashCode() {
        return circuit.hashCode();
    }

    @Override
    public String toString() {
        return "Fragment(\n" + circuit + "\n)";
    }
}
