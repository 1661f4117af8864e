package io.flowdetect.match;

import io.flowdetect.circuit.Circuit;
import io.flowdetect.flow.FlowBuilder;
import io.flowdetect.flow.FlowNode;
import io.flowdetect.flow.RelativeMeasurementLocation;
import io.flowdetect.fragment.Fragment;
import io.flowdetect.fragment.FragmentSplitter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DetectorMatcherTest {

    private static final Map<Integer, List<Double>> COORDS = Map.of(0, List.of(1.0, 2.0), 1, List.of(3.0, 2.0));

    private static List<FlowNode> flows(String circuit) {
        return FlowBuilder.build(FragmentSplitter.split(Circuit.parse(circuit)));
    }

    private static RelativeMeasurementLocation m(int offset, int qubit) {
        return new RelativeMeasurementLocation(offset, qubit);
    }

    @Test
    void matchShallow_singleRoundGivesOneDetector() {
        List<List<MatchedDetector>> detectors = DetectorMatcher.withDefaults()
                .matchShallow(flows("R 0\nTICK\nM 0"), COORDS, false);

        assertThat(detectors).containsExactly(List.of(MatchedDetector.of(List.of(1.0, 2.0, 0.0), List.of(m(-1, 0)))));
    }

    @Test
    void matchShallow_secondRoundComparesWithFirst() {
        List<List<MatchedDetector>> detectors = DetectorMatcher.withDefaults()
                .matchShallow(flows("R 0\nTICK\nM 0\nTICK\nR 0\nTICK\nM 0"), COORDS, false);

        assertThat(detectors).hasSize(2);
        assertThat(detectors.get(0)).containsExactly(MatchedDetector.of(List.of(1.0, 2.0, 0.0), List.of(m(-1, 0))));
        assertThat(detectors.get(1)).containsExactly(
                MatchedDetector.of(List.of(1.0, 2.0, 0.0), List.of(m(-2, 0), m(-1, 0))));
    }

    @Test
    void matchShallow_doesNotPairIdentityFlowsOnDisjointQubits() {
        List<List<MatchedDetector>> detectors = DetectorMatcher.withDefaults()
                .matchShallow(flows("R 0\nTICK\nM 0\nTICK\nR 1\nTICK\nM 1"), COORDS, false);

        assertThat(detectors.get(1)).containsExactly(MatchedDetector.of(List.of(3.0, 2.0, 0.0), List.of(m(-1, 1))));
    }

    @Test
    void matchShallow_firstChildOfLoopBodyKeepsItsTrivialFlows() {
        List<List<MatchedDetector>> detectors = DetectorMatcher.withDefaults()
                .matchShallow(flows("R 0\nTICK\nM 0"), COORDS, true);

        assertThat(detectors).containsExactly(List.of());
    }

    @Test
    void matchWithinFragment_findsFullyCollapsedFlows() {
        FlowNode node = FlowBuilder.build(Fragment.parse("R 0 1\nTICK\nCX 0 1\nTICK\nM 0 1"));

        List<MatchedDetector> detectors = DetectorMatcher.withDefaults().matchWithinFragment(node, COORDS);

        assertThat(detectors).containsExactly(
                MatchedDetector.of(List.of(3.0, 2.0), List.of(m(-2, 0), m(-1, 1))),
                MatchedDetector.of(List.of(3.0, 2.0), List.of(m(-1, 1))));
        assertThat(node.creation()).hasSize(1);
        assertThat(node.destruction()).hasSize(1);
    }

    @Test
    void matchWithinFragment_handlesDisjointParityChecks() {
        FlowNode node = FlowBuilder.build(Fragment.parse("R 0 1 2 3\nTICK\nCX 0 1\nCX 2 3\nTICK\nM 0 1 2 3"));
        Map<Integer, List<Double>> coords = Map.of(
                0, List.of(0.0, 0.0), 1, List.of(1.0, 0.0), 2, List.of(4.0, 0.0), 3, List.of(5.0, 0.0));

        List<MatchedDetector> detectors = DetectorMatcher.withDefaults().matchWithinFragment(node, coords);

        assertThat(detectors).extracting(d -> List.copyOf(d.measurements())).containsExactly(
                List.of(m(-4, 0), m(-3, 1)),
                List.of(m(-2, 2), m(-1, 3)),
                List.of(m(-3, 1)),
                List.of(m(-1, 3)));
        // Single-qubit flows stay behind for boundary matching.
        assertThat(node.creation()).hasSize(2);
        assertThat(node.destruction()).hasSize(2);
    }

    @Test
    void matchBoundary_offsetsLeftMeasurementsByRightNode() {
        List<FlowNode> nodes = flows("R 0\nTICK\nM 0\nTICK\nR 0 1\nTICK\nM 1 0");

        List<MatchedDetector> detectors = DetectorMatcher.withDefaults()
                .matchBoundary(nodes.get(0), nodes.get(1), COORDS);

        assertThat(detectors).containsExactly(MatchedDetector.of(List.of(1.0, 2.0), List.of(m(-3, 0), m(-1, 0))));
    }

    @Test
    void matchedDetector_toInstructionListsRecordsInOrder() {
        MatchedDetector detector = MatchedDetector.of(List.of(1.0, 0.5, 0.0), List.of(m(-1, 0), m(-4, 2)));

        assertThat(detector.toInstruction()).hasToString("DETECTOR(1, 0.5, 0) rec[-4] rec[-1]");
    }
}
