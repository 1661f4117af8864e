package io.flowdetect.plaquette;

/**
 * Basis of a stabilizer, of a reset or of a measurement.
 */
public enum Basis {
    X,
    Z;

    public String resetInstruction() {
        return "R" + name();
    }

    public String measurementInstruction() {
        return "M" + name();
    }
}
