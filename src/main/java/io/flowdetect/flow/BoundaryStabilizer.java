package io.flowdetect.flow;

import io.flowdetect.exceptions.FlowDetectException;
import io.flowdetect.exceptions.IncompatibleBoundaryMergeException;
import io.flowdetect.exceptions.UnresolvableAntiCommutationException;
import io.flowdetect.pauli.PauliString;

import java.util.*;

/**
 * A stabilizer propagated up to one boundary of a fragment, together with the
 * collapsing operations it meets on that boundary.
 * <p>
 * Forward stabilizers start on resets (their sources) and end on measurements.
 * Backward stabilizers start on measurements and end on resets. Measurement offsets
 * are always relative to the end of the fragment, whatever the direction.
 */
public final class BoundaryStabilizer {

    private final PauliString stabilizer;
    private final Set<PauliString> collapsingOperations;
    private final List<RelativeMeasurementLocation> measurements;
    private final SortedSet<Integer> resetQubits;
    private final boolean forward;
    private final boolean hasAnticommutingOperations;

    public BoundaryStabilizer(PauliString stabilizer,
                              Collection<PauliString> collapsingOperations,
                              Collection<RelativeMeasurementLocation> measurements,
                              Collection<Integer> resetQubits,
                              boolean forward) {
        this.stabilizer = Objects.requireNonNull(stabilizer, "stabilizer");
        this.collapsingOperations = Collections.unmodifiableSet(new LinkedHashSet<>(collapsingOperations));
        this.measurements = List.copyOf(new TreeSet<>(measurements));
        this.resetQubits = Collections.unmodifiableSortedSet(new TreeSet<>(resetQubits));
        this.forward = forward;
        this.hasAnticommutingOperations = this.collapsingOperations.stream().anyMatch(stabilizer::anticommutes);
    }

    /**
     * The propagated operator, before any collapsing operation is applied.
     */
    public PauliString beforeCollapse() {
        return stabilizer;
    }

    /**
     * The operator leaving the fragment once every collapsing operation is applied.
     *
     * @throws UnresolvableAntiCommutationException if a collapsing operation anticommutes
     */
    public PauliString afterCollapse() {
        if (hasAnticommutingOperations) {
            throw new UnresolvableAntiCommutationException(
                    "Cannot collapse a BoundaryStabilizer if it has anticommuting operations.");
        }
        return stabilizer.collapseBy(collapsingOperations);
    }

    public boolean hasAnticommutingOperations() {
        return hasAnticommutingOperations;
    }

    /**
     * Collapsing operations that anticommute with the stabilizer.
     */
    public List<PauliString> anticommutingOperations() {
        return collapsingOperations.stream().filter(stabilizer::anticommutes).toList();
    }

    public Set<PauliString> collapsingOperations() {
        return collapsingOperations;
    }

    public List<RelativeMeasurementLocation> measurements() {
        return measurements;
    }

    public SortedSet<Integer> resetQubits() {
        return resetQubits;
    }

    /**
     * Sources of the flow: reset qubits for forward stabilizers, measured qubits otherwise.
     */
    public SortedSet<Integer> sourceQubits() {
        if (forward) {
            return resetQubits;
        }
        SortedSet<Integer> qubits = new TreeSet<>();
        for (RelativeMeasurementLocation m : measurements) {
            qubits.add(m.qubit());
        }
        return Collections.unmodifiableSortedSet(qubits);
    }

    /**
     * A flow leaving a single qubit that is entirely absorbed by the collapsing operations.
     */
    public boolean isTrivial() {
        return !hasAnticommutingOperations && afterCollapse().weight() == 0 && stabilizer.weight() == 1;
    }

    /**
     * Multiplies two stabilizers living on the same boundary.
     * <p>
     * Sources are united. Sinks are recomputed from the support of the product, since
     * some of them may cancel out.
     *
     * @throws IncompatibleBoundaryMergeException if the collapsing operations or the directions differ
     */
    public BoundaryStabilizer merge(BoundaryStabilizer other) {
        if (!collapsingOperations.equals(other.collapsingOperations)) {
            throw new IncompatibleBoundaryMergeException("Breaking pre-condition: trying to merge two "
                    + "BoundaryStabilizer instances that are not defined on the same boundary.\n"
                    + "Collapsing operations for left-hand side: " + collapsingOperations + ".\n"
                    + "Collapsing operations for right-hand side: " + other.collapsingOperations + ".");
        }
        if (forward != other.forward) {
            throw new IncompatibleBoundaryMergeException(
                    "Cannot merge a forward boundary stabilizer with a backward one.");
        }
        PauliString product = stabilizer.times(other.stabilizer);
        SortedSet<Integer> support = product.qubits();

        Set<RelativeMeasurementLocation> mergedMeasurements = new TreeSet<>(measurements);
        mergedMeasurements.addAll(other.measurements);
        Set<Integer> mergedResets = new TreeSet<>(resetQubits);
        mergedResets.addAll(other.resetQubits);
        if (forward) {
            mergedMeasurements.removeIf(m -> !support.contains(m.qubit()));
        } else {
            mergedResets.removeIf(q -> !support.contains(q));
        }
        return new BoundaryStabilizer(product, collapsingOperations, mergedMeasurements, mergedResets, forward);
    }

    /**
     * Copy with every measurement offset shifted by {@code offset}.
     */
    public BoundaryStabilizer withMeasurementOffset(int offset) {
        List<RelativeMeasurementLocation> shifted = new ArrayList<>(measurements.size());
        for (RelativeMeasurementLocation m : measurements) {
            shifted.add(m.offsetBy(offset));
        }
        return new BoundaryStabilizer(stabilizer, collapsingOperations, shifted, resetQubits, forward);
    }

    /**
     * Mean coordinates of the source qubits.
     *
     * @throws FlowDetectException if a source qubit has no coordinates
     */
    public List<Double> coordinates(Map<Integer, List<Double>> qubitCoordinates) {
        double[] sum = null;
        int count = 0;
        for (Integer qubit : sourceQubits()) {
            List<Double> coords = qubitCoordinates.get(qubit);
            if (coords == null) {
                throw new FlowDetectException("Qubit index " + qubit + " required for detector assignment, "
                        + "but it does not have a valid QUBIT_COORDS statement.");
            }
            if (sum == null) {
                sum = new double[coords.size()];
            }
            for (int i = 0; i < sum.length && i < coords.size(); i++) {
                sum[i] += coords.get(i);
            }
            count++;
        }
        if (sum == null) {
            return List.of();
        }
        List<Double> mean = new ArrayList<>(sum.length);
        for (double s : sum) {
            mean.add(s / count);
        }
        return mean;
    }

    @Override
    public String toString() {
        return "BoundaryStabilizer(stabilizer=" + stabilizer
                + ", collapsingOperations=" + collapsingOperations
                + ", measurements=" + measurements
                + ", resets=" + resetQubits
                + ", forward=" + forward + ")";
    }
}
