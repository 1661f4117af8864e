package io.flowdetect.cover;

import java.util.*;

/**
 * Linear system over GF(2), one {@link BitSet} of coefficients per equation.
 * <p>
 * {@link #solve()} reduces the system to row echelon form and returns every solution as
 * one particular solution plus the span of a kernel basis.
 */
public final class Gf2System {

    /**
     * Kernel dimension up to which {@link Solutions#minimumWeight(boolean)} enumerates
     * every solution. Above it, a greedy reduction is used.
     */
    public static final int EXHAUSTIVE_SEARCH_LIMIT = 16;

    private final int numVariables;
    private final List<BitSet> rows = new ArrayList<>();
    private final List<Boolean> rightHandSides = new ArrayList<>();

    public Gf2System(int numVariables) {
        if (numVariables < 0) {
            throw new IllegalArgumentException("numVariables must be non-negative, got " + numVariables);
        }
        this.numVariables = numVariables;
    }

    public int numVariables() {
        return numVariables;
    }

    /**
     * Adds the equation {@code sum(coefficients[i] * x[i]) = rightHandSide}.
     */
    public Gf2System addEquation(BitSet coefficients, boolean rightHandSide) {
        if (coefficients.length() > numVariables) {
            throw new IllegalArgumentException("Equation uses variable " + (coefficients.length() - 1)
                    + " but the system only has " + numVariables + " variables");
        }
        rows.add((BitSet) coefficients.clone());
        rightHandSides.add(rightHandSide);
        return this;
    }

    /**
     * Solves the system.
     *
     * @return the solution set, or empty if the system is inconsistent
     */
    public Optional<Solutions> solve() {
        List<BitSet> matrix = new ArrayList<>(rows.size());
        for (BitSet row : rows) {
            matrix.add((BitSet) row.clone());
        }
        boolean[] rhs = new boolean[rows.size()];
        for (int i = 0; i < rhs.length; i++) {
            rhs[i] = rightHandSides.get(i);
        }

        int[] pivotOfRow = new int[rows.size()];
        int rank = 0;
        for (int column = 0; column < numVariables && rank < matrix.size(); column++) {
            int pivot = -1;
            for (int r = rank; r < matrix.size(); r++) {
                if (matrix.get(r).get(column)) {
                    pivot = r;
                    break;
                }
            }
            if (pivot < 0) {
                continue;
            }
            Collections.swap(matrix, rank, pivot);
            boolean tmp = rhs[rank];
            rhs[rank] = rhs[pivot];
            rhs[pivot] = tmp;
            for (int r = 0; r < matrix.size(); r++) {
                if (r != rank && matrix.get(r).get(column)) {
                    matrix.get(r).xor(matrix.get(rank));
                    rhs[r] ^= rhs[rank];
                }
            }
            pivotOfRow[rank] = column;
            rank++;
        }
        for (int r = rank; r < matrix.size(); r++) {
            if (rhs[r]) {
                return Optional.empty();
            }
        }

        BitSet pivotColumns = new BitSet(numVariables);
        BitSet particular = new BitSet(numVariables);
        for (int r = 0; r < rank; r++) {
            pivotColumns.set(pivotOfRow[r]);
            particular.set(pivotOfRow[r], rhs[r]);
        }
        List<BitSet> kernel = new ArrayList<>();
        for (int free = pivotColumns.nextClearBit(0); free < numVariables; free = pivotColumns.nextClearBit(free + 1)) {
            BitSet vector = new BitSet(numVariables);
            vector.set(free);
            for (int r = 0; r < rank; r++) {
                if (matrix.get(r).get(free)) {
                    vector.set(pivotOfRow[r]);
                }
            }
            kernel.add(vector);
        }
        return Optional.of(new Solutions(particular, kernel));
    }

    /**
     * Solution set of a consistent system: {@code particular + span(kernel)}.
     */
    public record Solutions(BitSet particular, List<BitSet> kernel) {

        public Solutions {
            particular = (BitSet) particular.clone();
            kernel = List.copyOf(kernel);
        }

        /**
         * A solution of minimal weight, searched exhaustively when the kernel is small
         * enough and greedily otherwise.
         *
         * @param nonZero exclude the all-zero vector
         * @return the solution, or empty if {@code nonZero} is set and zero is the only solution
         */
        public Optional<BitSet> minimumWeight(boolean nonZero) {
            if (kernel.size() <= EXHAUSTIVE_SEARCH_LIMIT) {
                return exhaustive(nonZero);
            }
            return greedy(nonZero);
        }

        private Optional<BitSet> exhaustive(boolean nonZero) {
            BitSet current = (BitSet) particular.clone();
            BitSet best = acceptable(current, nonZero) ? (BitSet) current.clone() : null;
            long combinations = 1L << kernel.size();
            // Gray code walk: each step flips exactly one kernel vector.
            for (long i = 1; i < combinations; i++) {
                int flipped = Long.numberOfTrailingZeros(i);
                current.xor(kernel.get(flipped));
                if (acceptable(current, nonZero) && (best == null || current.cardinality() < best.cardinality())) {
                    best = (BitSet) current.clone();
                }
            }
            return Optional.ofNullable(best);
        }

        private Optional<BitSet> greedy(boolean nonZero) {
            BitSet current = (BitSet) particular.clone();
            if (!acceptable(current, nonZero)) {
                if (kernel.isEmpty()) {
                    return Optional.empty();
                }
                current.xor(kernel.get(0));
            }
            boolean improved = true;
            while (improved) {
                improved = false;
                for (BitSet vector : kernel) {
                    BitSet candidate = (BitSet) current.clone();
                    candidate.xor(vector);
                    if (acceptable(candidate, nonZero) && candidate.cardinality() < current.cardinality()) {
                        current = candidate;
                        improved = true;
                    }
                }
            }
            return Optional.of(current);
        }

        private static boolean acceptable(BitSet vector, boolean nonZero) {
            return !nonZero || !vector.isEmpty();
        }
    }
}
