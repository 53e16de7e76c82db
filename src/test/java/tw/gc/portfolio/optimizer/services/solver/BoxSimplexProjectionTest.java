package tw.gc.portfolio.optimizer.services.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BoxSimplexProjection")
class BoxSimplexProjectionTest {

    @Test
    @DisplayName("should leave feasible points unchanged")
    void shouldLeaveFeasiblePointsUnchanged() {
        BoxSimplexProjection projection = new BoxSimplexProjection(0.0, 1.0);

        double[] projected = projection.project(new double[]{0.5, 0.3, 0.2});

        assertThat(projected[0]).isCloseTo(0.5, within(1e-12));
        assertThat(projected[1]).isCloseTo(0.3, within(1e-12));
        assertThat(projected[2]).isCloseTo(0.2, within(1e-12));
    }

    @Test
    @DisplayName("should project onto the simplex corner")
    void shouldProjectOntoCorner() {
        BoxSimplexProjection projection = new BoxSimplexProjection(0.0, 1.0);

        double[] projected = projection.project(new double[]{2.0, 0.0, 0.0});

        assertThat(projected[0]).isCloseTo(1.0, within(1e-12));
        assertThat(projected[1]).isCloseTo(0.0, within(1e-12));
        assertThat(projected[2]).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("should respect both bounds and the unit sum")
    void shouldRespectBounds() {
        BoxSimplexProjection projection = new BoxSimplexProjection(0.1, 0.4);

        double[] projected = projection.project(new double[]{1.0, 0.0, 0.0});

        assertThat(projected[0]).isCloseTo(0.4, within(1e-9));
        assertThat(projected[1]).isCloseTo(0.3, within(1e-9));
        assertThat(projected[2]).isCloseTo(0.3, within(1e-9));
        assertThat(Arrays.stream(projected).sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("should reject bounds that cannot sum to one")
    void shouldRejectInfeasibleBounds() {
        BoxSimplexProjection projection = new BoxSimplexProjection(0.01, 0.20);

        assertThat(BoxSimplexProjection.isFeasible(3, 0.01, 0.20)).isFalse();
        assertThat(BoxSimplexProjection.isFeasible(5, 0.01, 0.20)).isTrue();
        assertThatThrownBy(() -> projection.project(new double[]{0.4, 0.3, 0.3}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("infeasible");
    }

    @Test
    @DisplayName("should reject lower bound above upper bound")
    void shouldRejectInvertedBounds() {
        assertThatThrownBy(() -> new BoxSimplexProjection(0.5, 0.4))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
