package io.flowdetect.construction;

import io.flowdetect.circuit.*;
import io.flowdetect.exceptions.MalformedInstructionException;
import io.flowdetect.flow.FlowBuilder;
import io.flowdetect.flow.FlowNode;
import io.flowdetect.fragment.Fragment;
import io.flowdetect.fragment.FragmentLoop;
import io.flowdetect.fragment.FragmentNode;
import io.flowdetect.fragment.FragmentSplitter;
import io.flowdetect.match.DetectorMatcher;
import io.flowdetect.match.MatchedDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Inserts automatically computed {@code DETECTOR} annotations into a circuit.
 * <p>
 * The detectors of each fragment go right before its closing {@code TICK}. Every node
 * but the first one advances the time coordinate with a {@code SHIFT_COORDS} placed
 * before its detectors, when it has any.
 */
public class DetectorAnnotator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DetectorAnnotator.class);

    private final DetectorMatcher matcher;

    public DetectorAnnotator(DetectorMatcher matcher) {
        this.matcher = matcher;
    }

    public DetectorAnnotator() {
        this(DetectorMatcher.withDefaults());
    }

    /**
     * Validates, splits and re-emits {@code circuit} with its detectors.
     *
     * @throws MalformedInstructionException if the circuit is not supported
     */
    public Circuit annotateDetectorsAutomatically(Circuit circuit) {
        CircuitValidator.validate(circuit);
        List<FragmentNode> fragments = FragmentSplitter.split(circuit);
        Map<Integer, List<Double>> qubitCoordinates = circuit.finalQubitCoordinates();
        LOGGER.debug("Annotating {} fragment nodes over {} qubits with coordinates",
                fragments.size(), qubitCoordinates.size());
        return compileFragmentsToCircuitWithDetectors(fragments, qubitCoordinates);
    }

    public Circuit compileFragmentsToCircuitWithDetectors(List<FragmentNode> fragments,
                                                          Map<Integer, List<Double>> qubitCoordinates) {
        return compile(fragments, qubitCoordinates, false);
    }

    private Circuit compile(List<FragmentNode> fragments, Map<Integer, List<Double>> qubitCoordinates,
                            boolean insideLoop) {
        List<FlowNode> flows = FlowBuilder.build(fragments);
        List<List<MatchedDetector>> detectors = matcher.matchShallow(flows, qubitCoordinates, insideLoop);

        int spatialDimensions = qubitCoordinates.values().stream().findFirst().map(List::size).orElse(0);
        List<Double> timeShift = new ArrayList<>(Collections.nCopies(spatialDimensions, 0.0));
        timeShift.add(1.0);

        Circuit result = Circuit.empty();
        for (int i = 0; i < fragments.size(); i++) {
            Circuit annotations = detectorsToCircuit(detectors.get(i), i == 0 ? List.of() : timeShift);
            FragmentNode node = fragments.get(i);
            if (node instanceof Fragment fragment) {
                result = result.concat(insertBeforeLastTick(fragment.circuit(), annotations));
            } else {
                FragmentLoop loop = (FragmentLoop) node;
                Circuit body = compile(loop.children(), qubitCoordinates, true);
                result = result.concat(insertBeforeLastTick(body, annotations).repeat(loop.repetitions()));
            }
        }
        return result;
    }

    /**
     * Re-emits the fragments without any detector.
     */
    public static Circuit compileFragmentsToCircuit(List<FragmentNode> fragments) {
        Circuit result = Circuit.empty();
        for (FragmentNode node : fragments) {
            if (node instanceof Fragment fragment) {
                result = result.concat(fragment.circuit());
            } else {
                FragmentLoop loop = (FragmentLoop) node;
                result = result.concat(compileFragmentsToCircuit(loop.children()).repeat(loop.repetitions()));
            }
        }
        return result;
    }

    private static Circuit detectorsToCircuit(List<MatchedDetector> detectors, List<Double> shift) {
        if (detectors.isEmpty()) {
            return Circuit.empty();
        }
        List<CircuitItem> items = new ArrayList<>(detectors.size() + 1);
        if (!shift.isEmpty()) {
            items.add(Instruction.shiftCoords(shift));
        }
        for (MatchedDetector detector : detectors) {
            items.add(detector.toInstruction());
        }
        return Circuit.of(items);
    }

    private static Circuit insertBeforeLastTick(Circuit circuit, Circuit added) {
        if (added.isEmpty()) {
            return circuit;
        }
        List<CircuitItem> items = circuit.items();
        if (!items.isEmpty() && items.get(items.size() - 1) instanceof Instruction last && last.isTick()) {
            return Circuit.of(items.subList(0, items.size() - 1)).concat(added).concat(Circuit.of(last));
        }
        return circuit.concat(added);
    }
}
