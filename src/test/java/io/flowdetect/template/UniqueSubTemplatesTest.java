package io.flowdetect.template;

import io.flowdetect.circuit.Displacement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UniqueSubTemplatesTest {

    private final AlternatingSquareTemplate template = new AlternatingSquareTemplate();

    @Test
    void spatiallyDistinct_smallTemplateHasOneSubTemplatePerCell() {
        UniqueSubTemplates unique = UniqueSubTemplates.spatiallyDistinct(List.<int[][]>of(template.instantiate(1)), 1, true);

        assertThat(unique.subtemplates()).hasSize(9);
        assertThat(unique.rows()).isEqualTo(3);
        assertThat(unique.columns()).isEqualTo(3);
    }

    @Test
    void spatiallyDistinct_sharesBulkSubTemplates() {
        UniqueSubTemplates unique = UniqueSubTemplates.spatiallyDistinct(List.<int[][]>of(template.instantiate(2)), 1, true);

        // 4 corners, 2 per side, 2 in the bulk
        assertThat(unique.subtemplates()).hasSize(14);
        assertThat(unique.subtemplateIndexAt(1, 1)).isEqualTo(unique.subtemplateIndexAt(3, 3));
        assertThat(unique.subtemplateIndexAt(1, 1)).isNotEqualTo(unique.subtemplateIndexAt(1, 2));
        assertThat(unique.subtemplateIndexAt(0, 1)).isEqualTo(unique.subtemplateIndexAt(0, 3));
    }

    @Test
    void spatiallyDistinct_windowsArePaddedWithZeros() {
        UniqueSubTemplates unique = UniqueSubTemplates.spatiallyDistinct(List.<int[][]>of(template.instantiate(1)), 1, true);

        SubTemplate corner = unique.subtemplates().get(unique.subtemplateIndexAt(0, 0));

        assertThat(corner.side()).isEqualTo(3);
        assertThat(corner.center(0)).isEqualTo(1);
        assertThat(corner.layer(0)).isDeepEqualTo(new int[][]{
                {0, 0, 0},
                {0, 1, 2},
                {0, 2, 1}
        });
    }

    @Test
    void spatiallyDistinct_canSkipEmptyCells() {
        int[][] instantiation = {{0, 1}, {0, 1}};

        UniqueSubTemplates avoiding = UniqueSubTemplates.spatiallyDistinct(List.<int[][]>of(instantiation), 0, true);
        UniqueSubTemplates keeping = UniqueSubTemplates.spatiallyDistinct(List.<int[][]>of(instantiation), 0, false);

        assertThat(avoiding.subtemplateIndices()).isDeepEqualTo(new int[][]{{0, 1}, {0, 1}});
        assertThat(avoiding.subtemplates()).hasSize(1);
        assertThat(keeping.subtemplates()).hasSize(2);
        assertThat(keeping.subtemplates().get(keeping.subtemplateIndexAt(0, 0)).isEmpty(0)).isTrue();
    }

    @Test
    void spatiallyDistinct_distinguishesTimesteps() {
        int[][] first = {{1, 1}};
        int[][] second = {{1, 2}};

        UniqueSubTemplates unique = UniqueSubTemplates.spatiallyDistinct(List.of(first, second), 0, true);

        assertThat(unique.subtemplates()).hasSize(2);
        assertThat(unique.subtemplates().get(1).timesteps()).isEqualTo(2);
    }

    @Test
    void spatiallyDistinct_rejectsShapeMismatch() {
        assertThatThrownBy(() -> UniqueSubTemplates.spatiallyDistinct(
                List.of(new int[][]{{1}}, new int[][]{{1, 2}}), 1, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("same shape");
        assertThatThrownBy(() -> UniqueSubTemplates.spatiallyDistinct(List.of(), 1, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void superimposedInstantiations_alignsOnLastTemplate() {
        Template shifted = new Template() {
            @Override
            public int[][] instantiate(int k) {
                return new int[][]{{3, 4}};
            }

            @Override
            public Displacement increments() {
                return new Displacement(2, 2);
            }

            @Override
            public int expectedPlaquettesNumber() {
                return 2;
            }

            @Override
            public Displacement instantiationOrigin(int k) {
                return new Displacement(1, 0);
            }
        };

        List<int[][]> instantiations = Templates.superimposedInstantiations(List.of(shifted, template), 1);

        assertThat(instantiations.get(0)).isDeepEqualTo(new int[][]{
                {0, 3, 4},
                {0, 0, 0},
                {0, 0, 0}
        });
        assertThat(instantiations.get(1)).isDeepEqualTo(template.instantiate(1));
    }
}
