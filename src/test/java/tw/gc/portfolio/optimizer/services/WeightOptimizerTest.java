package tw.gc.portfolio.optimizer.services;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.portfolio.optimizer.config.OptimizerConfig;
import tw.gc.portfolio.optimizer.services.solver.BoxSimplexProjection;
import tw.gc.portfolio.optimizer.services.solver.SolverOutcome;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WeightOptimizer")
class WeightOptimizerTest {

    private static final double[] MU = {0.10, 0.12, 0.08};
    private static final RealMatrix COVARIANCE = MatrixUtils.createRealMatrix(new double[][]{
            {0.04, 0.02, 0.01},
            {0.02, 0.06, 0.02},
            {0.01, 0.02, 0.05}});
    private static final RealMatrix DIAGONAL = MatrixUtils.createRealDiagonalMatrix(new double[]{0.04, 0.09, 0.01});

    private final WeightOptimizer optimizer = new WeightOptimizer(
            OptimizerConfig.builder().maxPositionWeight(0.40).minPositionWeight(0.01).build());

    private final WeightOptimizer wideOptimizer = new WeightOptimizer(
            OptimizerConfig.builder().maxPositionWeight(0.60).minPositionWeight(0.01).build());

    @Nested
    @DisplayName("Max Sharpe")
    class MaxSharpe {

        @Test
        @DisplayName("should return weights that sum to one within bounds")
        void shouldRespectConstraints() {
            SolverOutcome outcome = optimizer.maxSharpe(MU, COVARIANCE);

            assertThat(outcome.converged()).isTrue();
            assertThat(Arrays.stream(outcome.weights()).sum()).isCloseTo(1.0, within(1e-6));
            assertThat(Arrays.stream(outcome.weights()).boxed().toList()).allSatisfy(w -> assertThat(w).isBetween(0.01 - 1e-9, 0.40 + 1e-9));
        }

        @Test
        @DisplayName("should beat the equal-weight Sharpe ratio")
        void shouldBeatEqualWeight() {
            SolverOutcome outcome = optimizer.maxSharpe(MU, COVARIANCE);
            double[] equal = {1.0 / 3, 1.0 / 3, 1.0 / 3};

            assertThat(sharpe(outcome.weights())).isGreaterThanOrEqualTo(sharpe(equal));
        }

        @Test
        @DisplayName("should be idempotent")
        void shouldBeIdempotent() {
            SolverOutcome first = optimizer.maxSharpe(MU, COVARIANCE);
            SolverOutcome second = optimizer.maxSharpe(MU, COVARIANCE);

            assertThat(second.weights()).containsExactly(first.weights());
        }

        @Test
        @DisplayName("should delegate Black-Litterman to max Sharpe on the posterior")
        void shouldDelegateBlackLitterman() {
            assertThat(optimizer.blackLitterman(MU, COVARIANCE).weights())
                    .containsExactly(optimizer.maxSharpe(MU, COVARIANCE).weights());
        }

        @Test
        @DisplayName("should score a zero-volatility portfolio as negative infinity and keep the start point")
        void shouldNotAcceptZeroVolatility() {
            RealMatrix riskless = MatrixUtils.createRealMatrix(3, 3);

            double score = optimizer.negativeSharpe(MU, riskless).value(new double[]{1.0 / 3, 1.0 / 3, 1.0 / 3});
            SolverOutcome outcome = optimizer.maxSharpe(MU, riskless);

            assertThat(score).isEqualTo(Double.NEGATIVE_INFINITY);
            assertThat(outcome.converged()).isFalse();
            assertThat(outcome.iterations()).isZero();
            assertThat(outcome.weights()).containsExactly(new double[]{1.0 / 3, 1.0 / 3, 1.0 / 3}, within(1e-12));
        }

        private double sharpe(double[] w) {
            double volatility = Math.sqrt(WeightOptimizer.quadraticForm(w, COVARIANCE));
            return (WeightOptimizer.dot(w, MU) - 0.02) / volatility;
        }
    }

    @Nested
    @DisplayName("Mean variance")
    class MeanVariance {

        @Test
        @DisplayName("should find the minimum-variance portfolio under the cap")
        void shouldMinimizeVariance() {
            SolverOutcome outcome = wideOptimizer.meanVariance(MU, DIAGONAL, null);

            // unconstrained optimum puts 73% in the lowest-variance asset, so the 60% cap binds
            assertThat(outcome.weights()[2]).isCloseTo(0.60, within(1e-3));
            assertThat(outcome.weights()[0]).isCloseTo(0.2769, within(5e-3));
            assertThat(Arrays.stream(outcome.weights()).sum()).isCloseTo(1.0, within(1e-6));
        }

        @Test
        @DisplayName("should approach a reachable target return")
        void shouldApproachTarget() {
            SolverOutcome outcome = optimizer.meanVariance(MU, COVARIANCE, 0.10);

            assertThat(WeightOptimizer.dot(outcome.weights(), MU)).isCloseTo(0.10, within(1e-3));
        }

        @Test
        @DisplayName("should flag an unreachable target as not converged")
        void shouldFlagUnreachableTarget() {
            SolverOutcome outcome = optimizer.meanVariance(MU, COVARIANCE, 0.50);

            assertThat(outcome.converged()).isFalse();
            assertThat(outcome.message()).contains("Target return");
            assertThat(Arrays.stream(outcome.weights()).sum()).isCloseTo(1.0, within(1e-6));
        }
    }

    @Nested
    @DisplayName("Risk budgeting")
    class RiskBudgeting {

        @Test
        @DisplayName("should weight by inverse volatility")
        void shouldWeightByInverseVolatility() {
            SolverOutcome outcome = optimizer.riskParity(DIAGONAL);

            assertThat(outcome.weights()[0]).isCloseTo(0.2727, within(1e-3));
            assertThat(outcome.weights()[1]).isCloseTo(0.1818, within(1e-3));
            assertThat(outcome.weights()[2]).isCloseTo(0.5455, within(1e-3));
            assertThat(outcome.iterations()).isEqualTo(1);
            assertThat(outcome.converged()).isTrue();
        }

        @Test
        @DisplayName("should equalize risk contributions")
        void shouldEqualizeRiskContributions() {
            SolverOutcome outcome = wideOptimizer.equalRiskContribution(DIAGONAL);

            // with uncorrelated assets equal contributions coincide with inverse-volatility weights
            assertThat(outcome.weights()[0]).isCloseTo(0.2727, within(1e-2));
            assertThat(outcome.weights()[1]).isCloseTo(0.1818, within(1e-2));
            assertThat(outcome.weights()[2]).isCloseTo(0.5455, within(1e-2));
        }
    }

    @Nested
    @DisplayName("Bounds")
    class Bounds {

        @Test
        @DisplayName("should widen infeasible bounds to include equal weight")
        void shouldWidenInfeasibleBounds() {
            WeightOptimizer defaults = new WeightOptimizer(OptimizerConfig.defaults());

            BoxSimplexProjection projection = defaults.feasibleBounds(3);

            assertThat(projection.lower()).isEqualTo(0.01);
            assertThat(projection.upper()).isCloseTo(1.0 / 3, within(1e-12));
        }

        @Test
        @DisplayName("should keep feasible bounds")
        void shouldKeepFeasibleBounds() {
            BoxSimplexProjection projection = optimizer.feasibleBounds(3);

            assertThat(projection.lower()).isEqualTo(0.01);
            assertThat(projection.upper()).isEqualTo(0.40);
        }

        @Test
        @DisplayName("should fall back to equal weights when the widened box is a single point")
        void shouldReturnEqualWeightsForDegenerateBox() {
            WeightOptimizer defaults = new WeightOptimizer(OptimizerConfig.defaults());

            SolverOutcome outcome = defaults.maxSharpe(MU, COVARIANCE);

            assertThat(Arrays.stream(outcome.weights()).boxed().toList()).allSatisfy(w -> assertThat(w).isCloseTo(1.0 / 3, within(1e-9)));
        }
    }
}
