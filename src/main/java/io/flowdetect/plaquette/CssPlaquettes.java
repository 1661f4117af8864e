package io.flowdetect.plaquette;

import io.flowdetect.circuit.GridQubit;
import io.flowdetect.circuit.Instruction;
import io.flowdetect.circuit.Moment;

import java.util.*;

/**
 * CSS surface-code plaquettes: one syndrome qubit measuring the X or Z parity of the four
 * data qubits around it.
 * <p>
 * Local qubit 0 is the syndrome qubit and 1 to 4 are the data qubits, in the order of
 * {@link PlaquetteQubits#square()}. The CNOT order makes hook errors perpendicular to a
 * vertical X boundary.
 */
public final class CssPlaquettes {

    public static final Set<String> MERGEABLE_INSTRUCTIONS = Set.of("M", "MZ", "MX", "R", "RZ", "RX");

    /** Template index of the Z-basis plaquette in {@link #forAlternatingTemplate}. */
    public static final int Z_INDEX = 1;
    /** Template index of the X-basis plaquette in {@link #forAlternatingTemplate}. */
    public static final int X_INDEX = 2;

    private static final int[] Z_CNOT_ORDER = {1, 2, 3, 4};
    private static final int[] X_CNOT_ORDER = {1, 3, 2, 4};
    private static final int[] DATA_QUBITS = {1, 2, 3, 4};

    private CssPlaquettes() {
    }

    /**
     * @param basis              stabilizer basis
     * @param dataInitialization basis the data qubits are reset in during the first slot, or null
     * @param dataMeasurement    basis the data qubits are measured in during the last slot, or null
     */
    public static Plaquette make(Basis basis, Basis dataInitialization, Basis dataMeasurement) {
        List<List<Instruction>> moments = new ArrayList<>();
        moments.add(new ArrayList<>(List.of(Instruction.of(basis.resetInstruction(), 0))));
        for (int data : basis == Basis.Z ? Z_CNOT_ORDER : X_CNOT_ORDER) {
            Instruction cx = basis == Basis.Z ? Instruction.of("CX", data, 0) : Instruction.of("CX", 0, data);
            moments.add(new ArrayList<>(List.of(cx)));
        }
        moments.add(new ArrayList<>(List.of(Instruction.of(basis.measurementInstruction(), 0))));

        StringBuilder name = new StringBuilder("CSS_basis(").append(basis).append(")_VERTICAL");
        if (dataInitialization != null) {
            moments.get(0).add(Instruction.of(dataInitialization.resetInstruction(), DATA_QUBITS));
            name.append("_datainit(").append(dataInitialization).append(')');
        }
        if (dataMeasurement != null) {
            moments.get(moments.size() - 1).add(Instruction.of(dataMeasurement.measurementInstruction(), DATA_QUBITS));
            name.append("_datameas(").append(dataMeasurement).append(')');
        }

        PlaquetteQubits qubits = PlaquetteQubits.square();
        Map<Integer, GridQubit> qubitMap = new TreeMap<>();
        qubitMap.put(0, qubits.syndromeQubits().get(0));
        for (int i = 0; i < qubits.dataQubits().size(); i++) {
            qubitMap.put(i + 1, qubits.dataQubits().get(i));
        }
        List<Moment> scheduled = moments.stream().map(Moment::new).toList();
        return Plaquette.builder()
                .name(name.toString())
                .qubits(qubits)
                .circuit(ScheduledCircuit.consecutive(scheduled, qubitMap))
                .mergeableInstructions(MERGEABLE_INSTRUCTIONS)
                .build();
    }

    public static Plaquette memory(Basis basis) {
        return make(basis, null, null);
    }

    /**
     * Z plaquettes at {@link #Z_INDEX} and X plaquettes at {@link #X_INDEX}, with data qubits
     * reset in {@code dataInitialization} when it is not null.
     */
    public static Plaquettes forAlternatingTemplate(Basis dataInitialization) {
        return Plaquettes.of(Map.of(
                Z_INDEX, make(Basis.Z, dataInitialization, null),
                X_INDEX, make(Basis.X, dataInitialization, null)));
    }
}
