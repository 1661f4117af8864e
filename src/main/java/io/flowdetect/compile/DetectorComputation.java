package io.flowdetect.compile;

import io.flowdetect.circuit.*;
import io.flowdetect.database.DatabaseMode;
import io.flowdetect.database.DetectorDatabase;
import io.flowdetect.database.DetectorDatabaseKey;
import io.flowdetect.exceptions.FlowDetectException;
import io.flowdetect.exceptions.MissingSituationException;
import io.flowdetect.exceptions.NonMonotonicRadiusExpansionException;
import io.flowdetect.exceptions.RadiusLimitExceededException;
import io.flowdetect.flow.FlowBuilder;
import io.flowdetect.flow.FlowNode;
import io.flowdetect.flow.RelativeMeasurementLocation;
import io.flowdetect.fragment.Fragment;
import io.flowdetect.fragment.FragmentNode;
import io.flowdetect.match.DetectorMatcher;
import io.flowdetect.match.MatchedDetector;
import io.flowdetect.plaquette.Plaquette;
import io.flowdetect.plaquette.Plaquettes;
import io.flowdetect.plaquette.ScheduledCircuit;
import io.flowdetect.template.SubTemplate;
import io.flowdetect.template.Template;
import io.flowdetect.template.Templates;
import io.flowdetect.template.UniqueSubTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Computes the detectors found at the end of the last round of a templated QEC experiment.
 * <p>
 * The template is cut into small situations centred on each plaquette. Each distinct situation
 * is computed once, possibly in parallel and through the database, and its detectors are
 * translated to every plaquette sharing it.
 */
public class DetectorComputation {

    private static final Logger LOGGER = LoggerFactory.getLogger(DetectorComputation.class);

    private final DetectorMatcher matcher;
    private final DetectorDatabase database;
    private final DatabaseMode mode;
    private final int parallelism;

    /**
     * @param database    database to consult, ignored when {@code mode} is {@link DatabaseMode#DISABLED}
     * @param parallelism worker threads for distinct situations, 0 for one per available processor
     */
    public DetectorComputation(DetectorMatcher matcher, DetectorDatabase database, DatabaseMode mode, int parallelism) {
        if (parallelism < 0) {
            throw new IllegalArgumentException("parallelism must be non-negative, got " + parallelism);
        }
        if (mode != DatabaseMode.DISABLED && database == null) {
            throw new IllegalArgumentException("A database is required in mode " + mode);
        }
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.database = database;
        this.mode = Objects.requireNonNull(mode, "mode");
        this.parallelism = parallelism;
    }

    public static DetectorComputation withoutDatabase() {
        return new DetectorComputation(DetectorMatcher.withDefaults(), null, DatabaseMode.DISABLED, 1);
    }

    /**
     * Detectors at the end of {@code situation}, in coordinates where the central plaquette sits
     * at the origin. Only detectors involving the last measurement of a syndrome qubit of the
     * central plaquette are kept.
     *
     * @throws MissingSituationException if the mode is {@link DatabaseMode#STRICT} and the database
     *                                   does not know the situation
     */
    public Set<Detector> computeDetectorsAtEndOfSituation(Situation situation, Displacement increments) {
        Set<Detector> detectors = switch (mode) {
            case DISABLED -> computeSituation(situation, increments);
            case COMPUTE -> database.getOrCompute(DetectorDatabaseKey.of(situation),
                    () -> computeSituation(situation, increments));
            case STRICT -> {
                DetectorDatabaseKey key = DetectorDatabaseKey.of(situation);
                yield database.get(key).orElseThrow(() -> new MissingSituationException(
                        "No detectors stored for situation " + key + " and the database is used in strict mode."));
            }
        };
        int radius = situation.radius();
        int shiftX = -radius * increments.x();
        int shiftY = -radius * increments.y();
        Set<Detector> shifted = new LinkedHashSet<>();
        for (Detector detector : detectors) {
            shifted.add(detector.offsetSpatiallyBy(shiftX, shiftY));
        }
        return shifted;
    }

    private Set<Detector> computeSituation(Situation situation, Displacement increments) {
        if (situation.last().isEmpty()) {
            return Set.of();
        }
        List<TimestepLayout> layouts = situation.withoutLeadingEmptyTimestep().timesteps();
        List<ScheduledCircuit> subcircuits = new ArrayList<>(layouts.size());
        for (TimestepLayout layout : layouts) {
            subcircuits.add(SituationCircuitBuilder.generateCircuit(layout.subtemplate(), layout.plaquettes(), increments));
        }
        SortedMap<Integer, GridQubit> qubitMap = SituationCircuitBuilder.globalQubitMap(subcircuits);
        subcircuits = SituationCircuitBuilder.relabelTogether(subcircuits);

        Circuit complete = Circuit.empty();
        List<FragmentNode> fragments = new ArrayList<>(subcircuits.size());
        for (ScheduledCircuit subcircuit : subcircuits) {
            Circuit coordless = subcircuit.toCircuit(false);
            if (!complete.isEmpty()) {
                complete = complete.concat(Circuit.of(Instruction.tick()));
            }
            complete = complete.concat(coordless);
            fragments.add(new Fragment(coordless));
        }
        Map<Integer, List<Double>> coordinates = new HashMap<>();
        qubitMap.forEach((index, qubit) -> coordinates.put(index, List.of((double) qubit.x(), (double) qubit.y())));

        List<FlowNode> flows = FlowBuilder.build(fragments);
        FlowNode last = flows.get(flows.size() - 1);
        List<MatchedDetector> matched = new ArrayList<>(matcher.matchWithinFragment(last, coordinates));
        if (flows.size() == 2) {
            matched.addAll(matcher.matchBoundary(flows.get(0), last, coordinates));
        }
        matched.addAll(matcher.matchRemainingTrivialFlows(last, coordinates));

        Map<Integer, Measurement> byRecord = MeasurementRecordsMap.fromCircuit(complete, qubitMap).measurementsByRecord();
        List<Detector> detectors = new ArrayList<>(matched.size());
        for (MatchedDetector detector : matched) {
            detectors.add(toDetector(detector.withTimeCoordinate(0), byRecord, qubitMap));
        }
        Set<Detector> filtered = keepCentralDetectors(detectors, situation.last(), increments);
        LOGGER.debug("Situation of radius {} over {} qubits: {} matched detectors, {} kept",
                situation.radius(), qubitMap.size(), detectors.size(), filtered.size());
        return filtered;
    }

    private static Detector toDetector(MatchedDetector matched, Map<Integer, Measurement> byRecord,
                                       Map<Integer, GridQubit> qubitMap) {
        List<Measurement> measurements = new ArrayList<>(matched.measurements().size());
        for (RelativeMeasurementLocation location : matched.measurements()) {
            Measurement measurement = byRecord.get(location.offset());
            GridQubit expected = qubitMap.get(location.qubit());
            if (measurement == null || !measurement.qubit().equals(expected)) {
                throw new FlowDetectException("Expected qubit " + expected + " from index " + location.qubit()
                        + " but got " + (measurement == null ? "no measurement" : measurement.qubit()) + ".");
            }
            measurements.add(measurement);
        }
        return Detector.of(measurements, new StimCoordinates(matched.coordinates()));
    }

    private static Set<Detector> keepCentralDetectors(List<Detector> detectors, TimestepLayout last,
                                                      Displacement increments) {
        int centralIndex = last.centralIndex();
        if (centralIndex == Plaquettes.EMPTY_INDEX) {
            return Set.of();
        }
        Plaquette central = last.plaquettes().get(centralIndex);
        Displacement offset = increments.scaledBy(last.radius());
        Set<Measurement> centralMeasurements = new HashSet<>();
        for (GridQubit syndrome : central.qubits().syndromeQubits()) {
            centralMeasurements.add(new Measurement(syndrome.plus(offset), -1));
        }
        Set<Detector> kept = new LinkedHashSet<>();
        for (Detector detector : detectors) {
            if (!Collections.disjoint(detector.measurements(), centralMeasurements)) {
                kept.add(detector);
            }
        }
        return kept;
    }

    /**
     * Detectors at the end of the last round, for situations of the given Manhattan radius.
     * Detectors found from several situations are only returned once.
     *
     * @param templates  one template per round, all with the same increments
     * @param plaquettes one plaquette collection per round
     */
    public List<Detector> computeDetectorsForFixedRadius(List<? extends Template> templates, int k,
                                                         List<Plaquettes> plaquettes, int radius) {
        Set<Displacement> allIncrements = new LinkedHashSet<>();
        for (Template template : templates) {
            allIncrements.add(template.increments());
        }
        if (allIncrements.size() != 1) {
            throw new IllegalArgumentException("Expected all the provided templates to have the same increments. "
                    + "Found the following different increments: " + allIncrements + ".");
        }
        if (templates.size() != plaquettes.size()) {
            throw new IllegalArgumentException("Expecting the same number of entries in templates and plaquettes.");
        }
        Displacement increments = allIncrements.iterator().next();

        List<int[][]> instantiations = Templates.superimposedInstantiations(templates, k);
        UniqueSubTemplates unique = UniqueSubTemplates.spatiallyDistinct(instantiations, radius, true);
        LOGGER.info("Radius {}: {} distinct situations over a {}x{} template", radius,
                unique.subtemplates().size(), unique.rows(), unique.columns());
        Map<Integer, Set<Detector>> bySubtemplate = computeDistinctSituations(unique, plaquettes, increments);

        Displacement origin = templates.get(templates.size() - 1).instantiationOrigin(k);
        Set<Detector> detectors = new LinkedHashSet<>();
        for (int i = 0; i < unique.rows(); i++) {
            for (int j = 0; j < unique.columns(); j++) {
                int index = unique.subtemplateIndexAt(i, j);
                if (index == 0) {
                    continue;
                }
                int shiftX = (j + origin.x()) * increments.x();
                int shiftY = (i + origin.y()) * increments.y();
                for (Detector detector : bySubtemplate.get(index)) {
                    detectors.add(detector.offsetSpatiallyBy(shiftX, shiftY));
                }
            }
        }
        return List.copyOf(detectors);
    }

    private Map<Integer, Set<Detector>> computeDistinctSituations(UniqueSubTemplates unique, List<Plaquettes> plaquettes,
                                                                 Displacement increments) {
        int threads = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        threads = Math.max(1, Math.min(threads, unique.subtemplates().size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            Map<Integer, Future<Set<Detector>>> futures = new TreeMap<>();
            for (Map.Entry<Integer, SubTemplate> entry : unique.subtemplates().entrySet()) {
                Situation situation = Situation.of(entry.getValue(), plaquettes);
                futures.put(entry.getKey(), pool.submit(() -> computeDetectorsAtEndOfSituation(situation, increments)));
            }
            Map<Integer, Set<Detector>> results = new HashMap<>();
            for (Map.Entry<Integer, Future<Set<Detector>>> entry : futures.entrySet()) {
                results.put(entry.getKey(), await(entry.getValue()));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private static Set<Detector> await(Future<Set<Detector>> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new FlowDetectException("Detector computation failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlowDetectException("Interrupted while computing detectors", e);
        }
    }

    /**
     * Grows the situation radius from {@code radius} until two consecutive radii give the same
     * detectors, and returns them.
     *
     * @throws NonMonotonicRadiusExpansionException if a larger radius loses detectors
     * @throws RadiusLimitExceededException         if detectors still change at {@code maxRadius}
     */
    public List<Detector> computeDetectors(List<? extends Template> templates, int k, List<Plaquettes> plaquettes,
                                           int radius, int maxRadius) {
        if (maxRadius <= radius) {
            throw new IllegalArgumentException("maxRadius (" + maxRadius + ") must be greater than radius ("
                    + radius + ")");
        }
        List<Detector> previous = computeDetectorsForFixedRadius(templates, k, plaquettes, radius);
        for (int r = radius + 1; r <= maxRadius; r++) {
            List<Detector> current = computeDetectorsForFixedRadius(templates, k, plaquettes, r);
            Set<Detector> previousSet = new HashSet<>(previous);
            Set<Detector> currentSet = new HashSet<>(current);
            if (!currentSet.containsAll(previousSet)) {
                previousSet.removeAll(currentSet);
                throw new NonMonotonicRadiusExpansionException(r, "Detectors found with radius " + (r - 1)
                        + " are missing with radius " + r + ": " + previousSet);
            }
            if (currentSet.equals(previousSet)) {
                LOGGER.info("Detectors stable between radius {} and {}: {} detectors", r - 1, r, previous.size());
                return previous;
            }
            LOGGER.info("Radius {} found {} detectors, {} more than radius {}", r, current.size(),
                    current.size() - previous.size(), r - 1);
            previous = current;
        }
        throw new RadiusLimitExceededException("Detectors still change at the maximum radius " + maxRadius
                + ". Increase the maximum radius or check that the circuit is local.");
    }
}
