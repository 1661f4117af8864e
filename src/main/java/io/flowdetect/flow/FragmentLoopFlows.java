package io.flowdetect.flow;

import java.util.*;

/**
 * Flows of a {@link io.flowdetect.fragment.FragmentLoop}.
 * <p>
 * Only the boundary children are exposed: creation flows come from the last child and
 * destruction flows from the first one. This is exact only when every iteration of the
 * loop body has the same flows, which callers must guarantee.
 */
public final class FragmentLoopFlows implements FlowNode {

    private final List<FlowNode> children;
    private final int repetitions;

    public FragmentLoopFlows(List<FlowNode> children, int repetitions) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("A loop needs at least one child");
        }
        if (repetitions < 1) {
            throw new IllegalArgumentException("repetitions must be at least 1, got " + repetitions);
        }
        this.children = List.copyOf(children);
        this.repetitions = repetitions;
    }

    public List<FlowNode> children() {
        return children;
    }

    public int repetitions() {
        return repetitions;
    }

    public FlowNode firstChild() {
        return children.get(0);
    }

    public FlowNode lastChild() {
        return children.get(children.size() - 1);
    }

    @Override
    public List<BoundaryStabilizer> creation() {
        return lastChild().creation();
    }

    @Override
    public List<BoundaryStabilizer> destruction() {
        return firstChild().destruction();
    }

    /**
     * Measurements of one iteration of the body.
     */
    @Override
    public int totalMeasurements() {
        return children.stream().mapToInt(FlowNode::totalMeasurementsWithRepetitions).sum();
    }

    @Override
    public int totalMeasurementsWithRepetitions() {
        return Math.multiplyExact(repetitions, totalMeasurements());
    }

    @Override
    public FragmentLoopFlows copy() {
        return new FragmentLoopFlows(children.stream().map(FlowNode::copy).toList(), repetitions);
    }

    @Override
    public String toString() {
        return "FragmentLoopFlows(repetitions=" + repetitions + ", children=" + children + ")";
    }
}
