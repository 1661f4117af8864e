package io.flowdetect.match;

import io.flowdetect.cover.PauliCoverFinder;
import io.flowdetect.exceptions.FlowDetectException;
import io.flowdetect.flow.*;
import io.flowdetect.pauli.PauliString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns flows into detectors.
 * <p>
 * Flows are consumed as they are matched, so every method mutates the {@link FlowNode}
 * instances it receives. Detector measurement offsets are relative to the end of the node
 * the detector belongs to; for a loop, that is the end of one iteration of its body.
 */
public final class DetectorMatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(DetectorMatcher.class);

    private final boolean loopSanityCheck;

    public DetectorMatcher(boolean loopSanityCheck) {
        this.loopSanityCheck = loopSanityCheck;
    }

    public static DetectorMatcher withDefaults() {
        return new DetectorMatcher(true);
    }

    /**
     * Matches the detectors of a sequence of sibling nodes.
     * <p>
     * Runs, in order, the within-node matching of every node, the boundary matching of
     * every pair of neighbours and finally the single-measurement detectors left on each
     * node. Detectors matched inside a loop node are dropped here, since the loop body is
     * matched on its own. Every detector gets a time coordinate of 0.
     *
     * @param insideLoop true when the nodes form a loop body; the start boundary of the
     *                   first node then belongs to the enclosing loop
     * @return one detector list per node, in node order
     */
    public List<List<MatchedDetector>> matchShallow(List<FlowNode> nodes,
                                                    Map<Integer, List<Double>> qubitCoordinates,
                                                    boolean insideLoop) {
        List<List<MatchedDetector>> detectors = new ArrayList<>(nodes.size());
        for (FlowNode node : nodes) {
            List<MatchedDetector> within = matchWithinFragment(node, qubitCoordinates);
            detectors.add(new ArrayList<>(node instanceof FragmentLoopFlows ? List.of() : within));
        }
        for (int i = 1; i < nodes.size(); i++) {
            detectors.get(i).addAll(matchBoundary(nodes.get(i - 1), nodes.get(i), qubitCoordinates));
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (insideLoop && i == 0) {
                continue;
            }
            detectors.get(i).addAll(matchRemainingTrivialFlows(nodes.get(i), qubitCoordinates));
        }
        List<List<MatchedDetector>> timed = new ArrayList<>(detectors.size());
        for (List<MatchedDetector> nodeDetectors : detectors) {
            timed.add(nodeDetectors.stream().map(d -> d.withTimeCoordinate(0)).toList());
        }
        return timed;
    }

    /**
     * Detectors made of a single flow that is fully absorbed by the collapsing operations
     * of its own node. Trivial flows are left alone.
     */
    public List<MatchedDetector> matchWithinFragment(FlowNode node, Map<Integer, List<Double>> qubitCoordinates) {
        List<MatchedDetector> detectors = new ArrayList<>();
        detectors.addAll(popFullyCollapsed(node.creation(), 0, qubitCoordinates));
        detectors.addAll(popFullyCollapsed(node.destruction(), -emissionShift(node), qubitCoordinates));
        return detectors;
    }

    private static List<MatchedDetector> popFullyCollapsed(List<BoundaryStabilizer> flows, int shift,
                                                           Map<Integer, List<Double>> qubitCoordinates) {
        List<MatchedDetector> detectors = new ArrayList<>();
        for (int i = flows.size() - 1; i >= 0; i--) {
            BoundaryStabilizer flow = flows.get(i);
            if (!flow.isTrivial() && !flow.hasAnticommutingOperations() && flow.afterCollapse().isIdentity()) {
                flows.remove(i);
                detectors.add(MatchedDetector.of(flow.coordinates(qubitCoordinates),
                        flow.withMeasurementOffset(shift).measurements()));
            }
        }
        Collections.reverse(detectors);
        return detectors;
    }

    /**
     * Detectors made of a single trivial destruction flow still unmatched.
     */
    public List<MatchedDetector> matchRemainingTrivialFlows(FlowNode node, Map<Integer, List<Double>> qubitCoordinates) {
        List<BoundaryStabilizer> destruction = node.destruction();
        int shift = -emissionShift(node);
        List<MatchedDetector> detectors = new ArrayList<>();
        Iterator<BoundaryStabilizer> it = destruction.iterator();
        while (it.hasNext()) {
            BoundaryStabilizer flow = it.next();
            if (flow.isTrivial()) {
                it.remove();
                detectors.add(MatchedDetector.of(flow.coordinates(qubitCoordinates),
                        flow.withMeasurementOffset(shift).measurements()));
            }
        }
        return detectors;
    }

    /**
     * Detectors spanning the boundary between {@code left} and {@code right}, to be inserted
     * at the end of {@code right}.
     *
     * @throws FlowDetectException if {@code right} is a repeated loop and its boundary with
     *                             {@code left} does not yield the same detectors as the
     *                             boundary between two of its iterations
     */
    public List<MatchedDetector> matchBoundary(FlowNode left, FlowNode right,
                                               Map<Integer, List<Double>> qubitCoordinates) {
        Set<MatchedDetector> expected = null;
        if (loopSanityCheck && right instanceof FragmentLoopFlows loop && loop.repetitions() > 1) {
            expected = new HashSet<>(new DetectorMatcher(false)
                    .matchBoundary(loop.lastChild().copy(), loop.copy(), qubitCoordinates));
        }

        left.mergeAnticommutingFlows();
        right.mergeAnticommutingFlows();

        List<MatchedDetector> detectors = new ArrayList<>();
        detectors.addAll(matchCommuting(left, right, qubitCoordinates));
        detectors.addAll(matchByDisjointCover(left, right, qubitCoordinates));

        if (expected != null && !expected.equals(new HashSet<>(detectors))) {
            throw new FlowDetectException("The set of detectors computed from measurements in\n" + left
                    + "\nand\n" + right + "\nis not the same as the set of detectors computed from "
                    + "measurements between two loop body repetitions. Is your QEC circuit valid?");
        }
        LOGGER.debug("Matched {} detectors across a boundary", detectors.size());
        return detectors;
    }

    private static List<MatchedDetector> matchCommuting(FlowNode left, FlowNode right,
                                                        Map<Integer, List<Double>> qubitCoordinates) {
        int leftShift = -right.totalMeasurements();
        int rightShift = -emissionShift(right);
        List<MatchedDetector> detectors = new ArrayList<>();
        List<Integer> matchedCreations = new ArrayList<>();
        List<BoundaryStabilizer> destructions = right.destruction();
        List<BoundaryStabilizer> creations = left.creation();
        for (int l = 0; l < creations.size(); l++) {
            BoundaryStabilizer creation = creations.get(l);
            if (creation.hasAnticommutingOperations()) {
                continue;
            }
            PauliString crossing = creation.afterCollapse();
            for (int r = 0; r < destructions.size(); r++) {
                BoundaryStabilizer destruction = destructions.get(r);
                if (destruction.hasAnticommutingOperations() || !crossing.equals(destruction.afterCollapse())) {
                    continue;
                }
                if (crossing.isIdentity() && Collections.disjoint(creation.sourceQubits(), destruction.sourceQubits())) {
                    continue;
                }
                Set<RelativeMeasurementLocation> measurements =
                        new TreeSet<>(creation.withMeasurementOffset(leftShift).measurements());
                measurements.addAll(destruction.withMeasurementOffset(rightShift).measurements());
                detectors.add(MatchedDetector.of(destruction.coordinates(qubitCoordinates), measurements));
                matchedCreations.add(l);
                destructions.remove(r);
                break;
            }
        }
        left.removeCreations(matchedCreations);
        return detectors;
    }

    private static List<MatchedDetector> matchByDisjointCover(FlowNode left, FlowNode right,
                                                              Map<Integer, List<Double>> qubitCoordinates) {
        int leftShift = -right.totalMeasurements();
        int rightShift = -emissionShift(right);

        List<BoundaryStabilizer> leftFlows = new ArrayList<>();
        List<Integer> leftIndices = new ArrayList<>();
        List<BoundaryStabilizer> creations = left.creation();
        for (int i = 0; i < creations.size(); i++) {
            if (!creations.get(i).hasAnticommutingOperations()) {
                leftFlows.add(creations.get(i).withMeasurementOffset(leftShift));
                leftIndices.add(i);
            }
        }
        List<BoundaryStabilizer> rightFlows = new ArrayList<>();
        List<Integer> rightIndices = new ArrayList<>();
        List<BoundaryStabilizer> destructions = right.destruction();
        for (int i = 0; i < destructions.size(); i++) {
            if (!destructions.get(i).hasAnticommutingOperations()) {
                rightFlows.add(destructions.get(i).withMeasurementOffset(rightShift));
                rightIndices.add(i);
            }
        }
        if (leftFlows.isEmpty() || rightFlows.isEmpty() || (leftFlows.size() == 1 && rightFlows.size() == 1)) {
            return List.of();
        }

        List<MatchedDetector> detectors = new ArrayList<>();
        List<Integer> usedLeft = coverEach(leftFlows, rightFlows, qubitCoordinates, detectors);
        for (int i = usedLeft.size() - 1; i >= 0; i--) {
            int reduced = usedLeft.get(i);
            leftFlows.remove(reduced);
            creations.remove((int) leftIndices.remove(reduced));
        }
        List<Integer> usedRight = coverEach(rightFlows, leftFlows, qubitCoordinates, detectors);
        for (int i = usedRight.size() - 1; i >= 0; i--) {
            int reduced = usedRight.get(i);
            rightFlows.remove(reduced);
            destructions.remove((int) rightIndices.remove(reduced));
        }
        return detectors;
    }

    /**
     * For every target flow, looks for a set of covering flows whose product cancels it.
     *
     * @return indices of the matched targets, in increasing order
     */
    private static List<Integer> coverEach(List<BoundaryStabilizer> targets, List<BoundaryStabilizer> covering,
                                           Map<Integer, List<Double>> qubitCoordinates,
                                           List<MatchedDetector> detectors) {
        List<PauliString> coveringOperators = new ArrayList<>(covering.size());
        for (BoundaryStabilizer flow : covering) {
            coveringOperators.add(flow.afterCollapse());
        }
        List<Integer> used = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            BoundaryStabilizer target = targets.get(i);
            Optional<List<Integer>> cover = PauliCoverFinder.exactCover(target.afterCollapse(), coveringOperators);
            if (cover.isEmpty() || cover.get().isEmpty()) {
                continue;
            }
            // A measurement reached by an even number of covering flows cancels out.
            Set<RelativeMeasurementLocation> coverMeasurements = new TreeSet<>();
            for (int j : cover.get()) {
                for (RelativeMeasurementLocation m : covering.get(j).measurements()) {
                    if (!coverMeasurements.remove(m)) {
                        coverMeasurements.add(m);
                    }
                }
            }
            Set<RelativeMeasurementLocation> measurements = new TreeSet<>(target.measurements());
            measurements.addAll(coverMeasurements);
            if (measurements.isEmpty()) {
                continue;
            }
            detectors.add(MatchedDetector.of(target.coordinates(qubitCoordinates), measurements));
            used.add(i);
        }
        return used;
    }

    /**
     * Number of measurements between the end of the node's first fragment, where its
     * destruction offsets are anchored, and the end of the node.
     */
    static int emissionShift(FlowNode node) {
        if (node instanceof FragmentLoopFlows loop) {
            FlowNode first = loop.firstChild();
            return loop.totalMeasurements() - first.totalMeasurements() + emissionShift(first);
        }
        return 0;
    }
}
