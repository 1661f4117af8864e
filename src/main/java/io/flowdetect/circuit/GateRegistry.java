package io.flowdetect.circuit;

import io.flowdetect.exceptions.MalformedInstructionException;
import io.flowdetect.pauli.Pauli;

import java.util.*;

import static io.flowdetect.circuit.CliffordAction.pair;
import static io.flowdetect.circuit.CliffordAction.single;

/**
 * Registry of every instruction the engine understands.
 * Names and aliases are case-insensitive.
 */
public class GateRegistry {

    private static final GateRegistry STANDARD = createDefault();

    private final Map<String, GateDefinition> byName;

    private GateRegistry(List<GateDefinition> gates) {
        Map<String, GateDefinition> index = new HashMap<>();
        for (GateDefinition gate : gates) {
            register(index, gate.name(), gate);
            for (String alias : gate.aliases()) {
                register(index, alias, gate);
            }
        }
        this.byName = Map.copyOf(index);
    }

    private static void register(Map<String, GateDefinition> index, String name, GateDefinition gate) {
        GateDefinition previous = index.put(name.toUpperCase(Locale.ROOT), gate);
        if (previous != null) {
            throw new IllegalArgumentException("Duplicate gate name " + name);
        }
    }

    /**
     * Shared instance of {@link #createDefault()}.
     */
    public static GateRegistry standard() {
        return STANDARD;
    }

    /**
     * Creates a registry with the full stim-compatible Clifford vocabulary.
     */
    public static GateRegistry createDefault() {
        List<GateDefinition> gates = new ArrayList<>();

        for (String name : List.of("DETECTOR", "MPAD", "OBSERVABLE_INCLUDE", "QUBIT_COORDS", "SHIFT_COORDS", "TICK")) {
            gates.add(GateDefinition.annotation(name));
        }

        gates.add(GateDefinition.noise("X_ERROR"));
        gates.add(GateDefinition.noise("Y_ERROR"));
        gates.add(GateDefinition.noise("Z_ERROR"));
        gates.add(GateDefinition.noise("DEPOLARIZE1"));
        gates.add(GateDefinition.noise("DEPOLARIZE2"));
        gates.add(GateDefinition.noise("PAULI_CHANNEL_1"));
        gates.add(GateDefinition.noise("PAULI_CHANNEL_2"));
        gates.add(GateDefinition.noise("CORRELATED_ERROR", "E"));
        gates.add(GateDefinition.noise("ELSE_CORRELATED_ERROR"));
        gates.add(GateDefinition.noise("HERALDED_ERASE"));

        gates.add(GateDefinition.collapsing("R", GateCategory.RESET, Pauli.Z, "RZ"));
        gates.add(GateDefinition.collapsing("RX", GateCategory.RESET, Pauli.X));
        gates.add(GateDefinition.collapsing("RY", GateCategory.RESET, Pauli.Y));
        gates.add(GateDefinition.collapsing("M", GateCategory.MEASUREMENT, Pauli.Z, "MZ"));
        gates.add(GateDefinition.collapsing("MX", GateCategory.MEASUREMENT, Pauli.X));
        gates.add(GateDefinition.collapsing("MY", GateCategory.MEASUREMENT, Pauli.Y));
        gates.add(GateDefinition.collapsing("MR", GateCategory.MEASURE_RESET, Pauli.Z, "MRZ"));
        gates.add(GateDefinition.collapsing("MRX", GateCategory.MEASURE_RESET, Pauli.X));
        gates.add(GateDefinition.collapsing("MRY", GateCategory.MEASURE_RESET, Pauli.Y));
        for (String name : List.of("MPP", "MXX", "MYY", "MZZ")) {
            gates.add(new GateDefinition(name, List.of(), GateCategory.MULTI_QUBIT_MEASUREMENT, null, null));
        }

        // Images of X then Z, signs dropped.
        gates.add(GateDefinition.unitary("I", single("X", "Z")));
        gates.add(GateDefinition.unitary("X", single("X", "Z")));
        gates.add(GateDefinition.unitary("Y", single("X", "Z")));
        gates.add(GateDefinition.unitary("Z", single("X", "Z")));
        gates.add(GateDefinition.unitary("H", single("Z", "X"), "H_XZ"));
        gates.add(GateDefinition.unitary("H_XY", single("Y", "Z")));
        gates.add(GateDefinition.unitary("H_YZ", single("X", "Y")));
        gates.add(GateDefinition.unitary("S", single("Y", "Z"), "SQRT_Z"));
        gates.add(GateDefinition.unitary("S_DAG", single("Y", "Z"), "SQRT_Z_DAG"));
        gates.add(GateDefinition.unitary("SQRT_X", single("X", "Y")));
        gates.add(GateDefinition.unitary("SQRT_X_DAG", single("X", "Y")));
        gates.add(GateDefinition.unitary("SQRT_Y", single("Z", "X")));
        gates.add(GateDefinition.unitary("SQRT_Y_DAG", single("Z", "X")));
        gates.add(GateDefinition.unitary("C_XYZ", single("Y", "X")));
        gates.add(GateDefinition.unitary("C_ZYX", single("Z", "Y")));

        // Images of XI, ZI, IX then IZ, signs dropped.
        gates.add(GateDefinition.unitary("CX", pair("XX", "ZI", "IX", "ZZ"), "CNOT", "ZCX"));
        gates.add(GateDefinition.unitary("CY", pair("XY", "ZI", "ZX", "ZZ"), "ZCY"));
        gates.add(GateDefinition.unitary("CZ", pair("XZ", "ZI", "ZX", "IZ"), "ZCZ"));
        gates.add(GateDefinition.unitary("XCX", pair("XI", "ZX", "IX", "XZ")));
        gates.add(GateDefinition.unitary("XCY", pair("XI", "ZY", "XX", "XZ")));
        gates.add(GateDefinition.unitary("XCZ", pair("XI", "ZZ", "XX", "IZ")));
        gates.add(GateDefinition.unitary("YCX", pair("XX", "ZX", "IX", "YZ")));
        gates.add(GateDefinition.unitary("YCY", pair("XY", "ZY", "YX", "YZ")));
        gates.add(GateDefinition.unitary("YCZ", pair("XZ", "ZZ", "YX", "IZ")));
        gates.add(GateDefinition.unitary("SWAP", pair("IX", "IZ", "XI", "ZI")));
        gates.add(GateDefinition.unitary("ISWAP", pair("ZY", "IZ", "YZ", "ZI")));
        gates.add(GateDefinition.unitary("ISWAP_DAG", pair("ZY", "IZ", "YZ", "ZI")));
        gates.add(GateDefinition.unitary("CXSWAP", pair("XX", "IZ", "XI", "ZZ")));
        gates.add(GateDefinition.unitary("SWAPCX", pair("IX", "ZZ", "XX", "ZI")));

        return new GateRegistry(gates);
    }

    /**
     * Creates a registry with specific gates.
     */
    public static GateRegistry of(GateDefinition... gates) {
        return new GateRegistry(Arrays.asList(gates));
    }

    /**
     * Returns a gate by name or alias, if present.
     */
    public Optional<GateDefinition> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(name.toUpperCase(Locale.ROOT)));
    }

    /**
     * Returns a gate by name or alias.
     *
     * @throws MalformedInstructionException if the name is unknown
     */
    public GateDefinition require(String name) {
        return lookup(name).orElseThrow(() -> new MalformedInstructionException(
                "Unsupported instruction '" + name + "'. Only Clifford gates, single-qubit resets and "
                        + "measurements, noise channels and annotations are supported."));
    }
}
