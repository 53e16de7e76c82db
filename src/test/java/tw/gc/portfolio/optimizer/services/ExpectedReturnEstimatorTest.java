package tw.gc.portfolio.optimizer.services;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.portfolio.optimizer.model.AssetSeries;
import tw.gc.portfolio.optimizer.model.ReturnMatrix;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExpectedReturnEstimator")
class ExpectedReturnEstimatorTest {

    private ExpectedReturnEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new ExpectedReturnEstimator();
    }

    @Nested
    @DisplayName("Historical risk-adjusted")
    class HistoricalRiskAdjusted {

        @Test
        @DisplayName("should divide annualized mean by volatility")
        void shouldDivideByVolatility() {
            ReturnMatrix returns = ReturnMatrix.of(List.of("A"), new double[][]{{0.0001, 0.0003}});

            double[] expected = estimator.historicalRiskAdjusted(returns, new double[]{0.2});

            assertThat(expected[0]).isCloseTo(0.0002 * 252 / 0.2, within(1e-12));
        }

        @Test
        @DisplayName("should clip to plus or minus 0.5")
        void shouldClip() {
            ReturnMatrix returns = ReturnMatrix.of(List.of("UP", "DOWN"), new double[][]{
                    {0.01, 0.01}, {-0.01, -0.01}});

            double[] expected = estimator.historicalRiskAdjusted(returns, new double[]{0.1, 0.1});

            assertThat(expected).containsExactly(0.5, -0.5);
        }

        @Test
        @DisplayName("should floor zero volatility instead of dividing by zero")
        void shouldFloorZeroVolatility() {
            ReturnMatrix returns = ReturnMatrix.of(List.of("FLAT", "DRIFT"), new double[][]{
                    {0.0, 0.0}, {0.001, 0.001}});

            double[] expected = estimator.historicalRiskAdjusted(returns, new double[]{0.0, 0.0});

            assertThat(expected[0]).isZero();
            assertThat(expected[1]).isEqualTo(0.5);
        }

        @Test
        @DisplayName("should reject a volatility vector of the wrong size")
        void shouldRejectMismatchedVolatilities() {
            ReturnMatrix returns = ReturnMatrix.of(List.of("A"), new double[][]{{0.01, 0.02}});

            assertThatThrownBy(() -> estimator.historicalRiskAdjusted(returns, new double[]{0.1, 0.2}))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Black-Litterman")
    class BlackLitterman {

        @Test
        @DisplayName("should scale covariance times market weights by risk aversion")
        void shouldComputePosterior() {
            RealMatrix covariance = MatrixUtils.createRealMatrix(new double[][]{{0.04, 0.01}, {0.01, 0.09}});

            double[] posterior = estimator.blackLittermanPosterior(covariance, new double[]{0.5, 0.5}, 3.0);

            assertThat(posterior[0]).isCloseTo(3.0 * 0.025, within(1e-12));
            assertThat(posterior[1]).isCloseTo(3.0 * 0.05, within(1e-12));
        }

        @Test
        @DisplayName("should compute the market-implied return as a dot product")
        void shouldComputeMarketImplied() {
            assertThat(estimator.marketImplied(new double[]{0.25, 0.75}, new double[]{0.1, 0.2}))
                    .isCloseTo(0.175, within(1e-12));
        }

        @Test
        @DisplayName("should prefer supplied market weights")
        void shouldPreferSuppliedWeights() {
            List<AssetSeries> universe = List.of(series("A", 0.0), series("B", 0.0));

            double[] weights = estimator.marketWeights(universe, Map.of("A", 3.0, "B", 1.0));

            assertThat(weights).containsExactly(0.75, 0.25);
        }

        @Test
        @DisplayName("should use market caps when every asset has one")
        void shouldUseMarketCaps() {
            List<AssetSeries> universe = List.of(series("A", 600.0), series("B", 400.0));

            double[] weights = estimator.marketWeights(universe, Map.of());

            assertThat(weights[0]).isCloseTo(0.6, within(1e-12));
            assertThat(weights[1]).isCloseTo(0.4, within(1e-12));
        }

        @Test
        @DisplayName("should fall back to equal weights")
        void shouldFallBackToEqualWeights() {
            List<AssetSeries> universe = List.of(series("A", 600.0), series("B", 0.0));

            assertThat(estimator.marketWeights(universe, null)).containsExactly(0.5, 0.5);
        }

        private AssetSeries series(String symbol, double marketCap) {
            return new AssetSeries(symbol, new double[]{1, 2, 3}, new double[]{0.1, 0.1}, 0.2, 0.0, "Unknown", marketCap);
        }
    }
}
