package io.flowdetect.tableau;

import io.flowdetect.circuit.*;
import io.flowdetect.exceptions.MalformedInstructionException;
import io.flowdetect.pauli.Pauli;
import io.flowdetect.pauli.PauliString;

import java.util.*;

/**
 * Sign-free Clifford tableau of the unitary part of a circuit.
 * <p>
 * Row {@code q} of the X (resp. Z) half holds the image of {@code X_q} (resp. {@code Z_q})
 * under conjugation by the circuit. Resets, measurements, noise channels and annotations
 * are ignored. Qubits beyond {@link #numQubits()} are left untouched by both directions.
 */
public final class CliffordTableau {

    private final int numQubits;
    private final BitSet[] xImageX;
    private final BitSet[] xImageZ;
    private final BitSet[] zImageX;
    private final BitSet[] zImageZ;

    private CliffordTableau(int numQubits) {
        this.numQubits = numQubits;
        this.xImageX = new BitSet[numQubits];
        this.xImageZ = new BitSet[numQubits];
        this.zImageX = new BitSet[numQubits];
        this.zImageZ = new BitSet[numQubits];
        for (int q = 0; q < numQubits; q++) {
            xImageX[q] = new BitSet(numQubits);
            xImageX[q].set(q);
            xImageZ[q] = new BitSet(numQubits);
            zImageX[q] = new BitSet(numQubits);
            zImageZ[q] = new BitSet(numQubits);
            zImageZ[q].set(q);
        }
    }

    public static CliffordTableau identity(int numQubits) {
        if (numQubits < 0) {
            throw new IllegalArgumentException("numQubits must be non-negative, got " + numQubits);
        }
        return new CliffordTableau(numQubits);
    }

    /**
     * Builds the tableau of every unitary instruction of a circuit without {@code REPEAT} blocks.
     *
     * @throws MalformedInstructionException if the circuit contains a {@code REPEAT} block
     *                                       or a unitary with a number of targets not multiple of its arity
     */
    public static CliffordTableau of(Circuit circuit) {
        int numQubits = 0;
        for (CircuitItem item : circuit.items()) {
            if (item instanceof RepeatBlock) {
                throw new MalformedInstructionException("Cannot build a tableau from a circuit with a REPEAT block.");
            }
            for (Integer q : ((Instruction) item).qubits()) {
                numQubits = Math.max(numQubits, q + 1);
            }
        }
        CliffordTableau tableau = new CliffordTableau(numQubits);
        for (CircuitItem item : circuit.items()) {
            Instruction instruction = (Instruction) item;
            GateDefinition gate = instruction.definition();
            if (gate.isUnitary()) {
                tableau.apply(gate.action(), instruction);
            }
        }
        return tableau;
    }

    public int numQubits() {
        return numQubits;
    }

    private void apply(CliffordAction action, Instruction instruction) {
        List<Integer> qubits = instruction.qubits();
        int arity = action.arity();
        if (qubits.size() % arity != 0) {
            throw new MalformedInstructionException("Instruction " + instruction + " expects a multiple of "
                    + arity + " targets.");
        }
        if (action.isIdentity()) {
            return;
        }
        for (int i = 0; i < qubits.size(); i += arity) {
            int[] gateQubits = arity == 1
                    ? new int[]{qubits.get(i)}
                    : new int[]{qubits.get(i), qubits.get(i + 1)};
            for (int row = 0; row < numQubits; row++) {
                conjugate(xImageX[row], xImageZ[row], action, gateQubits);
                conjugate(zImageX[row], zImageZ[row], action, gateQubits);
            }
        }
    }

    private static void conjugate(BitSet x, BitSet z, CliffordAction action, int[] qubits) {
        int mask = 0;
        for (int k = 0; k < qubits.length; k++) {
            int q = qubits[k];
            mask |= ((x.get(q) ? 1 : 0) | (z.get(q) ? 2 : 0)) << (2 * k);
        }
        if (mask == 0) {
            return;
        }
        int image = action.apply(mask);
        for (int k = 0; k < qubits.length; k++) {
            int q = qubits[k];
            x.set(q, (image & (1 << (2 * k))) != 0);
            z.set(q, (image & (2 << (2 * k))) != 0);
        }
    }

    /**
     * Conjugates {@code pauli} through the circuit, from its start to its end.
     */
    public PauliString forward(PauliString pauli) {
        BitSet x = new BitSet(numQubits);
        BitSet z = new BitSet(numQubits);
        Map<Integer, Pauli> outside = new TreeMap<>();
        for (Map.Entry<Integer, Pauli> term : pauli.asMap().entrySet()) {
            int q = term.getKey();
            if (q >= numQubits) {
                outside.put(q, term.getValue());
                continue;
            }
            if (term.getValue().hasX()) {
                x.xor(xImageX[q]);
                z.xor(xImageZ[q]);
            }
            if (term.getValue().hasZ()) {
                x.xor(zImageX[q]);
                z.xor(zImageZ[q]);
            }
        }
        return toPauliString(x, z, outside);
    }

    /**
     * Conjugates {@code pauli} through the inverse circuit, from its end back to its start.
     */
    public PauliString backward(PauliString pauli) {
        BitSet qx = new BitSet(numQubits);
        BitSet qz = new BitSet(numQubits);
        Map<Integer, Pauli> outside = new TreeMap<>();
        for (Map.Entry<Integer, Pauli> term : pauli.asMap().entrySet()) {
            int q = term.getKey();
            if (q >= numQubits) {
                outside.put(q, term.getValue());
                continue;
            }
            qx.set(q, term.getValue().hasX());
            qz.set(q, term.getValue().hasZ());
        }
        BitSet x = new BitSet(numQubits);
        BitSet z = new BitSet(numQubits);
        for (int q = 0; q < numQubits; q++) {
            // The symplectic form is preserved: the X part on q is read against the image of Z_q.
            x.set(q, anticommutes(qx, qz, zImageX[q], zImageZ[q]));
            z.set(q, anticommutes(qx, qz, xImageX[q], xImageZ[q]));
        }
        return toPauliString(x, z, outside);
    }

    private static boolean anticommutes(BitSet ax, BitSet az, BitSet bx, BitSet bz) {
        BitSet left = (BitSet) ax.clone();
        left.and(bz);
        BitSet right = (BitSet) az.clone();
        right.and(bx);
        return ((left.cardinality() + right.cardinality()) & 1) == 1;
    }

    private static PauliString toPauliString(BitSet x, BitSet z, Map<Integer, Pauli> outside) {
        Map<Integer, Pauli> terms = new TreeMap<>(outside);
        BitSet support = (BitSet) x.clone();
        support.or(z);
        for (int q = support.nextSetBit(0); q >= 0; q = support.nextSetBit(q + 1)) {
            terms.put(q, Pauli.fromBits(x.get(q), z.get(q)));
        }
        return PauliString.of(terms);
    }
}
