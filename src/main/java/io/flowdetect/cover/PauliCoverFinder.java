package io.flowdetect.cover;

import io.flowdetect.pauli.Pauli;
import io.flowdetect.pauli.PauliString;

import java.util.*;

/**
 * Searches subsets of Pauli strings whose product has a required property.
 * Both searches are expressed as linear systems over GF(2), one variable per
 * candidate string, and return a subset of minimal size.
 */
public final class PauliCoverFinder {

    private PauliCoverFinder() {
    }

    /**
     * Finds a subset of {@code sources} whose product is exactly {@code target}, up to phase.
     *
     * @return sorted indices into {@code sources}, empty list for an identity target,
     * or empty if no subset works
     */
    public static Optional<List<Integer>> exactCover(PauliString target, List<PauliString> sources) {
        Gf2System system = new Gf2System(sources.size());
        SortedSet<Integer> qubits = new TreeSet<>(target.qubits());
        for (PauliString source : sources) {
            qubits.addAll(source.qubits());
        }
        for (int qubit : qubits) {
            BitSet xRow = new BitSet(sources.size());
            BitSet zRow = new BitSet(sources.size());
            for (int i = 0; i < sources.size(); i++) {
                Pauli p = sources.get(i).get(qubit);
                xRow.set(i, p.hasX());
                zRow.set(i, p.hasZ());
            }
            Pauli expected = target.get(qubit);
            system.addEquation(xRow, expected.hasX());
            system.addEquation(zRow, expected.hasZ());
        }
        return system.solve()
                .flatMap(solutions -> solutions.minimumWeight(false))
                .map(PauliCoverFinder::toIndices);
    }

    /**
     * Finds a non-empty subset of {@code sources} whose product commutes, qubit by qubit,
     * with every term of {@code target}. Qubits outside the support of {@code target}
     * are unconstrained.
     *
     * @return sorted indices into {@code sources}, or empty if no non-empty subset works
     */
    public static Optional<List<Integer>> commutingCover(PauliString target, List<PauliString> sources) {
        Gf2System system = new Gf2System(sources.size());
        for (Map.Entry<Integer, Pauli> term : target.asMap().entrySet()) {
            BitSet row = new BitSet(sources.size());
            for (int i = 0; i < sources.size(); i++) {
                row.set(i, term.getValue().anticommutesWith(sources.get(i).get(term.getKey())));
            }
            system.addEquation(row, false);
        }
        return system.solve()
                .flatMap(solutions -> solutions.minimumWeight(true))
                .map(PauliCoverFinder::toIndices);
    }

    private static List<Integer> toIndices(BitSet selection) {
        List<Integer> indices = new ArrayList<>(selection.cardinality());
        for (int i = selection.nextSetBit(0); i >= 0; i = selection.nextSetBit(i + 1)) {
            indices.add(i);
        }
        return indices;
    }
}
