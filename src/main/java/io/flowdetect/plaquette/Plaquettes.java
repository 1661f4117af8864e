package io.flowdetect.plaquette;

import java.util.*;
import java.util.function.IntUnaryOperator;

/**
 * Plaquettes indexed by the integers a template instantiation is made of.
 * Index 0 is reserved and means "no plaquette".
 */
public final class Plaquettes {

    public static final int EMPTY_INDEX = 0;

    private final SortedMap<Integer, Plaquette> byIndex;

    private Plaquettes(SortedMap<Integer, Plaquette> byIndex) {
        this.byIndex = Collections.unmodifiableSortedMap(byIndex);
    }

    public static Plaquettes of(Map<Integer, Plaquette> byIndex) {
        SortedMap<Integer, Plaquette> copy = new TreeMap<>();
        byIndex.forEach((index, plaquette) -> {
            if (index == EMPTY_INDEX) {
                throw new IllegalArgumentException("Index " + EMPTY_INDEX + " is reserved for the absence of plaquette");
            }
            copy.put(index, Objects.requireNonNull(plaquette, "plaquette " + index));
        });
        return new Plaquettes(copy);
    }

    /**
     * @throws IllegalArgumentException if no plaquette is registered at {@code index}
     */
    public Plaquette get(int index) {
        Plaquette plaquette = byIndex.get(index);
        if (plaquette == null) {
            throw new IllegalArgumentException("No plaquette registered at index " + index
                    + ". Known indices: " + byIndex.keySet());
        }
        return plaquette;
    }

    public boolean contains(int index) {
        return byIndex.containsKey(index);
    }

    public SortedSet<Integer> indices() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(byIndex.keySet()));
    }

    /**
     * Same plaquettes registered under new indices.
     *
     * @throws IllegalArgumentException if two indices are mapped to the same new index or to 0
     */
    public Plaquettes mapIndices(IntUnaryOperator mapping) {
        Map<Integer, Plaquette> mapped = new HashMap<>();
        byIndex.forEach((index, plaquette) -> {
            int target = mapping.applyAsInt(index);
            if (mapped.put(target, plaquette) != null) {
                throw new IllegalArgumentException("Several indices are mapped to index " + target);
            }
        });
        return of(mapped);
    }

    /**
     * Content fingerprint of the plaquette at {@code index}, the empty string for index 0.
     */
    public String fingerprint(int index) {
        return index == EMPTY_INDEX ? "" : get(index).fingerprint();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Plaquettes that)) return false;
        return byIndex.equals(that.byIndex);
    }

    @Override
    public int hashCode() {
        return byIndex.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Plaquettes{");
        byIndex.forEach((index, plaquette) -> sb.append(index).append('=').append(plaquette.name()).append(", "));
        if (!byIndex.isEmpty()) {
            sb.setLength(sb.length() - 2);
        }
        return sb.append('}').toString();
    }
}
