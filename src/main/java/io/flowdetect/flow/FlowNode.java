package io.flowdetect.flow;

import java.util.*;

/**
 * Flows of one node of the fragment tree, mirroring its shape.
 * <p>
 * The lists returned by {@link #creation()} and {@link #destruction()} are live: matching
 * removes the flows it consumes and merging replaces anticommuting flows in place.
 */
public sealed interface FlowNode permits FragmentFlows, FragmentLoopFlows {

    /**
     * Flows leaving the node through its end boundary.
     */
    List<BoundaryStabilizer> creation();

    /**
     * Flows entering the node through its start boundary.
     */
    List<BoundaryStabilizer> destruction();

    /**
     * Measurements of one run of the node: one iteration for a loop.
     */
    int totalMeasurements();

    /**
     * Measurements of the node with every loop repetition counted.
     */
    default int totalMeasurementsWithRepetitions() {
        return totalMeasurements();
    }

    /**
     * Deep copy; stabilizers are immutable and shared.
     */
    FlowNode copy();

    default void removeCreations(Collection<Integer> indices) {
        removeAll(creation(), indices);
    }

    default void removeDestructions(Collection<Integer> indices) {
        removeAll(destruction(), indices);
    }

    /**
     * Merges the anticommuting flows of both boundaries.
     */
    default void mergeAnticommutingFlows() {
        AnticommutingFlowMerger.mergeInPlace(creation());
        AnticommutingFlowMerger.mergeInPlace(destruction());
    }

    private static void removeAll(List<BoundaryStabilizer> flows, Collection<Integer> indices) {
        List<Integer> sorted = new ArrayList<>(new TreeSet<>(indices));
        Collections.reverse(sorted);
        for (int index : sorted) {
            flows.remove(index);
        }
    }
}
