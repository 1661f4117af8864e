package io.flowdetect.compile;

import io.flowdetect.circuit.*;
import io.flowdetect.plaquette.Basis;
import io.flowdetect.plaquette.CssPlaquettes;
import io.flowdetect.plaquette.Plaquettes;
import io.flowdetect.plaquette.ScheduledCircuit;
import io.flowdetect.template.AlternatingSquareTemplate;
import io.flowdetect.template.Template;
import io.flowdetect.template.Templates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A templated experiment made of consecutive QEC rounds, compiled into a circuit whose rounds
 * are each followed by the detectors found at their end.
 */
public final class MemoryExperiment {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryExperiment.class);

    private final List<Template> templates;
    private final List<Plaquettes> plaquettes;
    private final int k;

    public MemoryExperiment(List<? extends Template> templates, List<Plaquettes> plaquettes, int k) {
        if (templates.isEmpty() || templates.size() != plaquettes.size()) {
            throw new IllegalArgumentException("Expecting the same non-zero number of templates and plaquettes, got "
                    + templates.size() + " and " + plaquettes.size());
        }
        if (k < 0) {
            throw new IllegalArgumentException("k must be non-negative, got " + k);
        }
        this.templates = List.copyOf(templates);
        this.plaquettes = List.copyOf(plaquettes);
        this.k = k;
    }

    /**
     * CSS surface-code memory over the alternating template: a first round resetting the data
     * qubits in the Z basis, then {@code rounds - 1} plain memory rounds.
     */
    public static MemoryExperiment css(int k, int rounds) {
        if (rounds < 1) {
            throw new IllegalArgumentException("At least one round is needed, got " + rounds);
        }
        List<Template> templates = new ArrayList<>();
        List<Plaquettes> plaquettes = new ArrayList<>();
        for (int round = 0; round < rounds; round++) {
            templates.add(new AlternatingSquareTemplate());
            plaquettes.add(CssPlaquettes.forAlternatingTemplate(round == 0 ? Basis.Z : null));
        }
        return new MemoryExperiment(templates, plaquettes, k);
    }

    public int rounds() {
        return templates.size();
    }

    public int k() {
        return k;
    }

    /**
     * Detectors at the end of each round. A round only looks back one round.
     */
    public List<List<Detector>> detectorsByRound(DetectorComputation computation, int radius, int maxRadius) {
        List<List<Detector>> byRound = new ArrayList<>(rounds());
        for (int round = 0; round < rounds(); round++) {
            int from = Math.max(0, round - 1);
            LOGGER.info("Computing detectors at the end of round {}", round);
            byRound.add(computation.computeDetectors(templates.subList(from, round + 1), k,
                    plaquettes.subList(from, round + 1), radius, maxRadius));
        }
        return byRound;
    }

    /**
     * The experiment circuit: {@code QUBIT_COORDS} for every qubit, then each round followed by its
     * detectors, with a {@code SHIFT_COORDS} advancing time before every round but the first.
     */
    public Circuit toCircuit(List<List<Detector>> detectorsByRound) {
        if (detectorsByRound.size() != rounds()) {
            throw new IllegalArgumentException("Expected detectors for " + rounds() + " rounds, got "
                    + detectorsByRound.size());
        }
        List<int[][]> instantiations = Templates.superimposedInstantiations(templates, k);
        Displacement increments = templates.get(templates.size() - 1).increments();
        List<ScheduledCircuit> roundCircuits = new ArrayList<>(rounds());
        for (int round = 0; round < rounds(); round++) {
            roundCircuits.add(SituationCircuitBuilder.generateCircuit(instantiations.get(round), plaquettes.get(round),
                    increments));
        }
        SortedMap<Integer, GridQubit> qubitMap = SituationCircuitBuilder.globalQubitMap(roundCircuits);
        roundCircuits = SituationCircuitBuilder.relabelTogether(roundCircuits);

        List<CircuitItem> preamble = new ArrayList<>(qubitMap.size());
        qubitMap.forEach((index, qubit) -> preamble.add(qubit.toQubitCoordsInstruction(index)));
        Circuit circuit = Circuit.of(preamble);
        for (int round = 0; round < rounds(); round++) {
            Circuit body = roundCircuits.get(round).toCircuit(false);
            if (round > 0) {
                circuit = circuit.concat(Circuit.of(Instruction.tick()));
            }
            circuit = circuit.concat(body);

            List<Detector> detectors = detectorsByRound.get(round);
            if (detectors.isEmpty()) {
                continue;
            }
            MeasurementRecordsMap records = MeasurementRecordsMap.fromCircuit(circuit, qubitMap);
            List<CircuitItem> annotations = new ArrayList<>(detectors.size() + 1);
            if (round > 0) {
                annotations.add(Instruction.shiftCoords(List.of(0.0, 0.0, 1.0)));
            }
            for (Detector detector : detectors) {
                annotations.add(detector.toInstruction(records));
            }
            circuit = circuit.concat(Circuit.of(annotations));
        }
        return circuit;
    }
}
