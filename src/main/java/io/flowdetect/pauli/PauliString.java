package io.flowdetect.pauli;

import io.flowdetect.exceptions.UnresolvableAntiCommutationException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Immutable tensor product of single-qubit Pauli operators, indexed by qubit.
 * <p>
 * Identity terms are never stored: a qubit absent from the mapping carries I.
 * Multiplication ignores the global phase.
 */
public final class PauliString {

    private static final PauliString IDENTITY = new PauliString(new TreeMap<>());

    private final SortedMap<Integer, Pauli> paulis;
    private final int hash;

    private PauliString(TreeMap<Integer, Pauli> paulis) {
        this.paulis = Collections.unmodifiableSortedMap(paulis);
        this.hash = paulis.hashCode();
    }

    /**
     * Returns the identity string (weight 0).
     */
    public static PauliString identity() {
        return IDENTITY;
    }

    /**
     * Creates a Pauli string from an explicit qubit to Pauli mapping.
     *
     * @throws IllegalArgumentException if the mapping contains an identity term or a negative qubit
     */
    public static PauliString of(Map<Integer, Pauli> paulis) {
        TreeMap<Integer, Pauli> copy = new TreeMap<>();
        for (Map.Entry<Integer, Pauli> entry : paulis.entrySet()) {
            if (entry.getValue() == null || entry.getValue() == Pauli.I) {
                throw new IllegalArgumentException("Invalid Pauli operator " + entry.getValue()
                        + " for qubit " + entry.getKey() + ", expected X, Y, or Z.");
            }
            if (entry.getKey() < 0) {
                throw new IllegalArgumentException("Qubit indices must be non-negative, got " + entry.getKey());
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return copy.isEmpty() ? IDENTITY : new PauliString(copy);
    }

    public static PauliString single(int qubit, Pauli pauli) {
        if (pauli == Pauli.I) {
            return IDENTITY;
        }
        return of(Map.of(qubit, pauli));
    }

    /**
     * Parses the dense representation where the character at position {@code q}
     * is the Pauli on qubit {@code q}, e.g. {@code "_XYZ"} or {@code "IXYZ"}.
     */
    public static PauliString parse(String dense) {
        TreeMap<Integer, Pauli> paulis = new TreeMap<>();
        for (int q = 0; q < dense.length(); q++) {
            Pauli p = Pauli.fromChar(dense.charAt(q));
            if (p != Pauli.I) {
                paulis.put(q, p);
            }
        }
        return paulis.isEmpty() ? IDENTITY : new PauliString(paulis);
    }

    /**
     * Product of all the provided strings (identity for an empty input).
     */
    public static PauliString product(Iterable<PauliString> strings) {
        TreeMap<Integer, Pauli> result = new TreeMap<>();
        for (PauliString s : strings) {
            multiplyInto(result, s);
        }
        return result.isEmpty() ? IDENTITY : new PauliString(result);
    }

    private static void multiplyInto(TreeMap<Integer, Pauli> target, PauliString s) {
        for (Map.Entry<Integer, Pauli> entry : s.paulis.entrySet()) {
            Pauli current = target.getOrDefault(entry.getKey(), Pauli.I);
            Pauli next = current.times(entry.getValue());
            if (next == Pauli.I) {
                target.remove(entry.getKey());
            } else {
                target.put(entry.getKey(), next);
            }
        }
    }

    public PauliString times(PauliString other) {
        if (other.paulis.isEmpty()) {
            return this;
        }
        if (paulis.isEmpty()) {
            return other;
        }
        TreeMap<Integer, Pauli> result = new TreeMap<>(paulis);
        multiplyInto(result, other);
        return result.isEmpty() ? IDENTITY : new PauliString(result);
    }

    /**
     * Number of non-identity terms.
     */
    public int weight() {
        return paulis.size();
    }

    public boolean isIdentity() {
        return paulis.isEmpty();
    }

    /**
     * Qubits carrying a non-identity term, in increasing order.
     */
    public SortedSet<Integer> qubits() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(paulis.keySet()));
    }

    /**
     * The unique qubit of a weight-1 string.
     *
     * @throws IllegalStateException if the weight is not exactly 1
     */
    public int qubit() {
        if (paulis.size() != 1) {
            throw new IllegalStateException("Cannot retrieve only one qubit from a Pauli string with "
                    + paulis.size() + " qubits.");
        }
        return paulis.firstKey();
    }

    /**
     * Pauli acting on the given qubit, I if the qubit is not in the support.
     */
    public Pauli get(int qubit) {
        return paulis.getOrDefault(qubit, Pauli.I);
    }

    /**
     * Read-only view of the non-identity terms.
     */
    public SortedMap<Integer, Pauli> asMap() {
        return paulis;
    }

    public boolean anticommutes(PauliString other) {
        SortedMap<Integer, Pauli> small = paulis.size() <= other.paulis.size() ? paulis : other.paulis;
        SortedMap<Integer, Pauli> large = small == paulis ? other.paulis : paulis;
        int count = 0;
        for (Map.Entry<Integer, Pauli> entry : small.entrySet()) {
            Pauli p = large.get(entry.getKey());
            if (p != null && p != entry.getValue()) {
                count++;
            }
        }
        return (count & 1) == 1;
    }

    public boolean commutes(PauliString other) {
        return !anticommutes(other);
    }

    /**
     * Removes from this string every term cancelled by the given commuting operators,
     * by multiplying them in one after the other. Operators that share no qubit with
     * the string being collapsed are skipped.
     *
     * @throws UnresolvableAntiCommutationException if one operator does not commute
     */
    public PauliString collapseBy(Iterable<PauliString> operators) {
        PauliString result = this;
        for (PauliString op : operators) {
            if (!op.overlaps(this)) {
                continue;
            }
            if (!result.commutes(op)) {
                throw new UnresolvableAntiCommutationException(
                        "Cannot collapse " + result + " by a non-commuting operator " + op + ".");
            }
            result = result.times(op);
        }
        return result;
    }

    /**
     * True if both strings act non-trivially on at least one common qubit.
     */
    public boolean overlaps(PauliString other) {
        SortedMap<Integer, Pauli> small = paulis.size() <= other.paulis.size() ? paulis : other.paulis;
        SortedMap<Integer, Pauli> large = small == paulis ? other.paulis : paulis;
        for (Integer q : small.keySet()) {
            if (large.containsKey(q)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Same as {@link #overlaps(PauliString)}.
     */
    public boolean intersects(PauliString other) {
        return overlaps(other);
    }

    /**
     * True if every term of {@code other} appears identically in this string.
     */
    public boolean contains(PauliString other) {
        for (Map.Entry<Integer, Pauli> entry : other.paulis.entrySet()) {
            if (paulis.get(entry.getKey()) != entry.getValue()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PauliString that)) return false;
        return hash == that.hash && paulis.equals(that.paulis);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Renders as {@code X0*Z3}; the identity renders as an empty string.
     */
    @Override
    public String toString() {
        return paulis.entrySet().stream()
                .map(e -> e.getValue().name() + e.getKey())
                .collect(Collectors.joining("*"));
    }
}
