package io.flowdetect.circuit;

/**
 * Top-level element of a {@link Circuit}: a plain instruction or a REPEAT block.
 */
public sealed interface CircuitItem permits Instruction, RepeatBlock {

    /**
     * Number of measurement records this item appends when executed.
     */
    int numMeasurements();
}
