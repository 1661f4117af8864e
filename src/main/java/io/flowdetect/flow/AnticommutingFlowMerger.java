package io.flowdetect.flow;

import io.flowdetect.cover.PauliCoverFinder;
import io.flowdetect.exceptions.IncompatibleBoundaryMergeException;
import io.flowdetect.pauli.PauliString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Replaces groups of flows that anticommute with their collapsing operations by their
 * product, when that product commutes with every collapsing operation.
 */
public final class AnticommutingFlowMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnticommutingFlowMerger.class);

    private AnticommutingFlowMerger() {
    }

    /**
     * Merges as many anticommuting flows of {@code flows} as possible. Merged flows are
     * removed and their product is appended at the end of the list.
     *
     * @throws IncompatibleBoundaryMergeException if the anticommuting flows do not share
     *                                            the same collapsing operations
     */
    public static void mergeInPlace(List<BoundaryStabilizer> flows) {
        List<Integer> anticommuting = anticommutingIndices(flows);
        if (anticommuting.isEmpty()) {
            return;
        }
        Set<PauliString> collapsing = flows.get(anticommuting.get(0)).collapsingOperations();
        for (int i = 1; i < anticommuting.size(); i++) {
            Set<PauliString> other = flows.get(anticommuting.get(i)).collapsingOperations();
            if (!collapsing.equals(other)) {
                throw new IncompatibleBoundaryMergeException("Cannot merge anti-commuting flows defined on "
                        + "different collapsing operations. Found the following difference:\n"
                        + "Flow 0 has the collapsing operations: " + collapsing + "\n"
                        + "Flow " + i + " has the collapsing operations: " + other);
            }
        }
        PauliString boundary = PauliString.product(collapsing);

        Optional<List<Integer>> cover = findCover(boundary, flows, anticommuting);
        while (cover.isPresent()) {
            List<Integer> selected = new ArrayList<>();
            for (int index : cover.get()) {
                selected.add(anticommuting.get(index));
            }
            BoundaryStabilizer merged = null;
            for (int flowIndex : selected) {
                merged = merged == null ? flows.get(flowIndex) : merged.merge(flows.get(flowIndex));
            }
            if (merged.hasAnticommutingOperations()) {
                // Only happens when several collapsing operations share a qubit.
                LOGGER.warn("Merged flow {} still anticommutes with its boundary, keeping the flows unmerged",
                        merged.beforeCollapse());
                return;
            }
            selected.sort(Comparator.reverseOrder());
            for (int flowIndex : selected) {
                flows.remove(flowIndex);
            }
            flows.add(merged);
            LOGGER.debug("Merged {} anticommuting flows into {}", selected.size(), merged.beforeCollapse());

            anticommuting = anticommutingIndices(flows);
            cover = findCover(boundary, flows, anticommuting);
        }
    }

    private static Optional<List<Integer>> findCover(PauliString boundary, List<BoundaryStabilizer> flows,
                                                     List<Integer> anticommuting) {
        if (anticommuting.isEmpty()) {
            return Optional.empty();
        }
        List<PauliString> stabilizers = new ArrayList<>(anticommuting.size());
        for (int index : anticommuting) {
            stabilizers.add(flows.get(index).beforeCollapse());
        }
        return PauliCoverFinder.commutingCover(boundary, stabilizers);
    }

    private static List<Integer> anticommutingIndices(List<BoundaryStabilizer> flows) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < flows.size(); i++) {
            if (flows.get(i).hasAnticommutingOperations()) {
                indices.add(i);
            }
        }
        return indices;
    }
}
