package io.flowdetect.flow;

import io.flowdetect.exceptions.MalformedInstructionException;
import io.flowdetect.fragment.Fragment;
import io.flowdetect.fragment.FragmentLoop;
import io.flowdetect.fragment.FragmentNode;
import io.flowdetect.pauli.PauliString;
import io.flowdetect.tableau.CliffordTableau;

import java.util.*;

/**
 * Computes the flows of a fragment tree. The result has the same shape as the input:
 * one {@link FragmentFlows} per {@link Fragment} and one {@link FragmentLoopFlows}
 * per {@link FragmentLoop}.
 */
public final class FlowBuilder {

    private FlowBuilder() {
    }

    public static List<FlowNode> build(List<FragmentNode> nodes) {
        List<FlowNode> flows = new ArrayList<>(nodes.size());
        for (FragmentNode node : nodes) {
            flows.add(build(node));
        }
        return flows;
    }

    public static FlowNode build(FragmentNode node) {
        if (node instanceof Fragment fragment) {
            return build(fragment);
        }
        FragmentLoop loop = (FragmentLoop) node;
        return new FragmentLoopFlows(build(loop.children()), loop.repetitions());
    }

    /**
     * Creation flows are reset operators pushed forward to the measurements; destruction
     * flows are measurement operators pulled back to the resets.
     *
     * @throws MalformedInstructionException if a measurement acts on several qubits
     */
    public static FragmentFlows build(Fragment fragment) {
        CliffordTableau tableau = fragment.tableau();
        List<PauliString> resets = fragment.resets();
        List<PauliString> measurements = fragment.measurements();
        int total = measurements.size();

        List<BoundaryStabilizer> creation = new ArrayList<>(resets.size());
        for (PauliString reset : resets) {
            PauliString propagated = tableau.forward(reset);
            List<RelativeMeasurementLocation> involved = new ArrayList<>();
            for (int i = 0; i < total; i++) {
                PauliString measurement = measurements.get(i);
                if (propagated.overlaps(measurement)) {
                    involved.add(new RelativeMeasurementLocation(i - total, measurement.qubit()));
                }
            }
            creation.add(new BoundaryStabilizer(propagated, measurements, involved, Set.of(reset.qubit()), true));
        }

        List<BoundaryStabilizer> destruction = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            PauliString measurement = measurements.get(i);
            if (measurement.weight() != 1) {
                throw new MalformedInstructionException(
                        "Found a measurement applied on several qubits. This is not supported.");
            }
            PauliString propagated = tableau.backward(measurement);
            Set<Integer> touchedResets = new TreeSet<>();
            for (PauliString reset : resets) {
                if (propagated.overlaps(reset)) {
                    touchedResets.add(reset.qubit());
                }
            }
            destruction.add(new BoundaryStabilizer(propagated, resets,
                    List.of(new RelativeMeasurementLocation(i - total, measurement.qubit())), touchedResets, false));
        }
        return new FragmentFlows(creation, destruction, total);
    }
}
