package io.flowdetect.compile;

import io.flowdetect.circuit.Displacement;
import io.flowdetect.circuit.GridQubit;
import io.flowdetect.database.DatabaseMode;
import io.flowdetect.database.DetectorDatabase;
import io.flowdetect.exceptions.MissingSituationException;
import io.flowdetect.match.DetectorMatcher;
import io.flowdetect.plaquette.Basis;
import io.flowdetect.plaquette.CssPlaquettes;
import io.flowdetect.plaquette.Plaquettes;
import io.flowdetect.template.AlternatingSquareTemplate;
import io.flowdetect.template.Template;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorComputationTest {

    private static final Displacement INCREMENTS = new Displacement(2, 2);
    private static final Plaquettes INITIALIZATION = CssPlaquettes.forAlternatingTemplate(Basis.Z);
    private static final Plaquettes MEMORY = CssPlaquettes.forAlternatingTemplate(null);

    private final AlternatingSquareTemplate template = new AlternatingSquareTemplate();

    @Test
    void computeDetectorsAtEndOfSituation_singleZPlaquetteAfterReset() {
        Situation situation = Situation.of(List.of(new TimestepLayout(new int[][]{{1}}, INITIALIZATION)));

        Set<Detector> detectors = DetectorComputation.withoutDatabase()
                .computeDetectorsAtEndOfSituation(situation, INCREMENTS);

        assertThat(detectors).containsExactly(
                Detector.of(List.of(new Measurement(new GridQubit(0, 0), -1)), StimCoordinates.of(0, 0, 0)));
    }

    @Test
    void computeDetectorsAtEndOfSituation_xPlaquetteAfterZResetIsRandom() {
        Situation situation = Situation.of(List.of(new TimestepLayout(new int[][]{{2}}, INITIALIZATION)));

        assertThat(DetectorComputation.withoutDatabase().computeDetectorsAtEndOfSituation(situation, INCREMENTS))
                .isEmpty();
    }

    @Test
    void computeDetectorsAtEndOfSituation_comparesWithPreviousRound() {
        Situation situation = Situation.of(List.of(
                new TimestepLayout(new int[][]{{2}}, INITIALIZATION),
                new TimestepLayout(new int[][]{{2}}, MEMORY)));

        Set<Detector> detectors = DetectorComputation.withoutDatabase()
                .computeDetectorsAtEndOfSituation(situation, INCREMENTS);

        GridQubit syndrome = new GridQubit(0, 0);
        assertThat(detectors).containsExactly(Detector.of(
                List.of(new Measurement(syndrome, -2), new Measurement(syndrome, -1)), StimCoordinates.of(0, 0, 0)));
    }

    @Test
    void computeDetectorsAtEndOfSituation_emptyCentreHasNoDetector() {
        Situation situation = Situation.of(List.of(new TimestepLayout(new int[][]{{0}}, MEMORY)));

        assertThat(DetectorComputation.withoutDatabase().computeDetectorsAtEndOfSituation(situation, INCREMENTS))
                .isEmpty();
    }

    @Test
    void computeDetectors_initialRoundFindsEveryZPlaquette() {
        List<Detector> detectors = DetectorComputation.withoutDatabase()
                .computeDetectors(List.of(template), 1, List.of(INITIALIZATION), 1, 3);

        // (k+1)^2 + k^2 Z plaquettes on a (2k+1)^2 checkerboard
        assertThat(detectors).hasSize(5);
        assertThat(detectors).allSatisfy(detector -> {
            assertThat(detector.measurements()).hasSize(1);
            Measurement measurement = detector.measurements().first();
            assertThat(measurement.offset()).isEqualTo(-1);
            assertThat((measurement.qubit().x() + measurement.qubit().y()) / 2 % 2).isZero();
        });
    }

    @Test
    void computeDetectors_memoryRoundFindsEveryPlaquette() {
        List<Detector> detectors = DetectorComputation.withoutDatabase()
                .computeDetectors(List.of(template, template), 1, List.of(INITIALIZATION, MEMORY), 1, 3);

        assertThat(detectors).hasSize(9);
        assertThat(detectors).allSatisfy(detector -> assertThat(detector.measurements())
                .extracting(Measurement::offset).contains(-1));
    }

    @Test
    void computeDetectorsForFixedRadius_isTranslationConsistent() {
        DetectorComputation computation = DetectorComputation.withoutDatabase();

        List<Detector> small = computation.computeDetectorsForFixedRadius(List.of(template), 1,
                List.of(INITIALIZATION), 1);
        List<Detector> larger = computation.computeDetectorsForFixedRadius(List.of(template), 2,
                List.of(INITIALIZATION), 1);

        assertThat(larger).hasSize(13).containsAll(small);
    }

    @Test
    void computeDetectors_databaseServesStrictRuns() {
        DetectorDatabase database = new DetectorDatabase();
        List<Detector> computed = new DetectorComputation(DetectorMatcher.withDefaults(), database,
                DatabaseMode.COMPUTE, 2).computeDetectors(List.of(template), 1, List.of(INITIALIZATION), 1, 2);
        assertThat(database.size()).isPositive();

        database.freeze();
        List<Detector> stored = new DetectorComputation(DetectorMatcher.withDefaults(), database,
                DatabaseMode.STRICT, 2).computeDetectors(List.of(template), 1, List.of(INITIALIZATION), 1, 2);

        assertThat(stored).containsExactlyInAnyOrderElementsOf(computed);
    }

    @Test
    void computeDetectors_strictModeFailsOnUnknownSituation() {
        DetectorComputation computation = new DetectorComputation(DetectorMatcher.withDefaults(),
                new DetectorDatabase(), DatabaseMode.STRICT, 1);

        assertThatThrownBy(() -> computation.computeDetectors(List.of(template), 1, List.of(INITIALIZATION), 1, 2))
                .isInstanceOf(MissingSituationException.class)
                .hasMessageContaining("strict mode");
    }

    @Test
    void computeDetectorsForFixedRadius_rejectsMismatchedIncrements() {
        Template wide = new Template() {
            @Override
            public int[][] instantiate(int k) {
                return template.instantiate(k);
            }

            @Override
            public Displacement increments() {
                return new Displacement(4, 2);
            }

            @Override
            public int expectedPlaquettesNumber() {
                return 2;
            }
        };

        assertThatThrownBy(() -> DetectorComputation.withoutDatabase()
                .computeDetectorsForFixedRadius(List.of(template, wide), 1, List.of(INITIALIZATION, MEMORY), 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("same increments");
    }

    @Test
    void constructor_validatesArguments() {
        assertThatThrownBy(() -> new DetectorComputation(DetectorMatcher.withDefaults(), null, DatabaseMode.COMPUTE, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DetectorComputation(DetectorMatcher.withDefaults(), null, DatabaseMode.DISABLED, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectorComputation.withoutDatabase()
                .computeDetectors(List.of(template), 1, List.of(INITIALIZATION), 2, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxRadius");
    }
}
