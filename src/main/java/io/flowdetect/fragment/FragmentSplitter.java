package io.flowdetect.fragment;

import io.flowdetect.circuit.*;
import io.flowdetect.exceptions.MalformedInstructionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Splits a circuit into {@link Fragment} and {@link FragmentLoop} nodes.
 * <p>
 * A fragment is closed by every moment that only contains measurements. Each
 * {@code REPEAT} block closes the fragment in progress and becomes a loop whose body
 * is split recursively. The circuit must end on a measurement moment, possibly followed
 * by annotation-only moments which are kept in the last fragment.
 */
public final class FragmentSplitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(FragmentSplitter.class);

    private FragmentSplitter() {
    }

    /**
     * @throws MalformedInstructionException if the circuit cannot be split
     */
    public static List<FragmentNode> split(Circuit circuit) {
        List<FragmentNode> nodes = new ArrayList<>();
        List<Instruction> current = new ArrayList<>();

        for (TimeSlice slice : circuit.moments()) {
            if (slice instanceof RepeatBlock block) {
                if (!current.isEmpty()) {
                    nodes.add(new Fragment(Circuit.of(current)));
                    current = new ArrayList<>();
                }
                List<FragmentNode> body;
                try {
                    body = split(block.body());
                } catch (MalformedInstructionException e) {
                    throw new MalformedInstructionException(
                            "Error when splitting the following REPEAT block:\n" + block.body(), e);
                }
                if (body.isEmpty()) {
                    throw new MalformedInstructionException("Found an empty REPEAT block:\n" + block);
                }
                nodes.add(new FragmentLoop(body, block.repetitions()));
            } else if (slice instanceof Moment moment) {
                if (moment.instructions().stream().anyMatch(i -> i.definition().isCombinedMeasurementReset())) {
                    throw new MalformedInstructionException(
                            "The provided quantum circuit should not contain any combined instruction (e.g., MR).");
                }
                current.addAll(moment.instructions());
                if (moment.hasOnlyMeasurement()) {
                    nodes.add(new Fragment(Circuit.of(current)));
                    current = new ArrayList<>();
                }
            }
        }

        if (!current.isEmpty()) {
            Moment leftover = new Moment(current);
            if (leftover.isVirtual() && !nodes.isEmpty() && nodes.get(nodes.size() - 1) instanceof Fragment last) {
                nodes.set(nodes.size() - 1, new Fragment(last.circuit().concat(leftover.toCircuit())));
            } else if (leftover.hasOnlyReset()) {
                throw new MalformedInstructionException("Found left-over reset gates when splitting a circuit. Make "
                        + "sure that each reset is eventually followed by a measurement. Unprocessed fragment:\n"
                        + leftover);
            } else if (!leftover.isVirtual() || nodes.isEmpty()) {
                throw new MalformedInstructionException("Circuit splitting did not finish on a measurement. "
                        + "Unprocessed fragment:\n" + leftover);
            } else {
                throw new MalformedInstructionException("Found annotations after a REPEAT block that ends the "
                        + "circuit. Unprocessed fragment:\n" + leftover);
            }
        }
        LOGGER.debug("Split circuit into {} top-level nodes", nodes.size());
        return nodes;
    }
}
