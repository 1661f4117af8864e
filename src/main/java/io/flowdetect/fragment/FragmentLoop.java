package io.flowdetect.fragment;

import io.flowdetect.exceptions.MalformedInstructionException;

import java.util.List;

/**
 * A {@code REPEAT} block, already split into its own fragments.
 *
 * @param children    fragments of the loop body, in order
 * @param repetitions number of times the body runs
 */
public record FragmentLoop(List<FragmentNode> children, int repetitions) implements FragmentNode {

    public FragmentLoop {
        if (repetitions < 1) {
            throw new MalformedInstructionException("Cannot have a FragmentLoop with 0 or less repetitions.");
        }
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("A FragmentLoop needs at least one child");
        }
        children = List.copyOf(children);
    }

    public FragmentLoop withRepetitions(int repetitions) {
        return new FragmentLoop(children, repetitions);
    }

    /**
     * Measurements of a single run of the body.
     */
    public int bodyMeasurements() {
        return children.stream().mapToInt(FragmentNode::numMeasurements).sum();
    }

    @Override
    public int numMeasurements() {
        return Math.multiplyExact(repetitions, bodyMeasurements());
    }
}
