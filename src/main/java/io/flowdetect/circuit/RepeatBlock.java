package io.flowdetect.circuit;

import io.flowdetect.exceptions.MalformedInstructionException;

/**
 * A {@code REPEAT n { ... }} construct.
 */
public record RepeatBlock(int repetitions, Circuit body) implements CircuitItem, TimeSlice {

    public RepeatBlock {
        if (repetitions < 1) {
            throw new MalformedInstructionException(
                    "REPEAT blocks need a repetition count of at least 1, got " + repetitions + ".");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
    }

    @Override
    public int numMeasurements() {
        return Math.multiplyExact(repetitions, body.numMeasurements());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("REPEAT ").append(repetitions).append(" {\n");
        for (String line : body.toString().split("\n")) {
            if (!line.isEmpty()) {
                sb.append("    ").append(line).append('\n');
            }
        }
        return sb.append('}').toString();
    }
}
