package io.flowdetect.template;

import io.flowdetect.circuit.Displacement;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlternatingSquareTemplateTest {

    private final AlternatingSquareTemplate template = new AlternatingSquareTemplate();

    @Test
    void instantiate_checkerboard() {
        assertThat(template.instantiate(1)).isDeepEqualTo(new int[][]{
                {1, 2, 1},
                {2, 1, 2},
                {1, 2, 1}
        });
        assertThat(template.instantiate(0)).isDeepEqualTo(new int[][]{{1}});
        assertThat(template.instantiate(3)).hasNumberOfRows(7);
    }

    @Test
    void instantiate_rejectsNegativeScale() {
        assertThatThrownBy(() -> template.instantiate(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void increments_areTwoQubitsInBothDirections() {
        assertThat(template.increments()).isEqualTo(new Displacement(2, 2));
        assertThat(template.expectedPlaquettesNumber()).isEqualTo(2);
        assertThat(template.instantiationOrigin(4)).isEqualTo(new Displacement(0, 0));
    }
}
