package io.flowdetect.circuit;

/**
 * Role an instruction plays when a circuit is cut into fragments.
 */
public enum GateCategory {
    /** Annotation with no effect on the quantum state (TICK, DETECTOR, QUBIT_COORDS, ...). */
    ANNOTATION,
    /** Noise channel; ignored by stabilizer propagation. */
    NOISE,
    RESET,
    MEASUREMENT,
    /** Combined measurement and reset (MR, MRX, ...). */
    MEASURE_RESET,
    /** Measurement of a multi-qubit Pauli product (MPP, MXX, ...). */
    MULTI_QUBIT_MEASUREMENT,
    /** Clifford unitary gate. */
    UNITARY
}
