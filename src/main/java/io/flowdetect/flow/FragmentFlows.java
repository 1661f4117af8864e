package io.flowdetect.flow;

import java.util.*;

/**
 * Flows of a single {@link io.flowdetect.fragment.Fragment}.
 */
public final class FragmentFlows implements FlowNode {

    private final List<BoundaryStabilizer> creation;
    private final List<BoundaryStabilizer> destruction;
    private final int totalMeasurements;

    public FragmentFlows(List<BoundaryStabilizer> creation, List<BoundaryStabilizer> destruction, int totalMeasurements) {
        if (totalMeasurements < 0) {
            throw new IllegalArgumentException("totalMeasurements must be non-negative, got " + totalMeasurements);
        }
        this.creation = new ArrayList<>(creation);
        this.destruction = new ArrayList<>(destruction);
        this.totalMeasurements = totalMeasurements;
    }

    @Override
    public List<BoundaryStabilizer> creation() {
        return creation;
    }

    @Override
    public List<BoundaryStabilizer> destruction() {
        return destruction;
    }

    @Override
    public int totalMeasurements() {
        return totalMeasurements;
    }

    @Override
    public FragmentFlows copy() {
        return new FragmentFlows(creation, destruction, totalMeasurements);
    }

    @Override
    public String toString() {
        return "FragmentFlows(creation=" + creation + ", destruction=" + destruction
                + ", totalMeasurements=" + totalMeasurements + ")";
    }
}
