package tw.gc.portfolio.optimizer.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.RealMatrix;
import org.springframework.stereotype.Service;
import tw.gc.portfolio.optimizer.AppConstants;
import tw.gc.portfolio.optimizer.config.OptimizerConfig;
import tw.gc.portfolio.optimizer.enums.BoundRepairMode;
import tw.gc.portfolio.optimizer.enums.OptimizationMethod;
import tw.gc.portfolio.optimizer.enums.RiskLevel;
import tw.gc.portfolio.optimizer.model.OptimizationResult;
import tw.gc.portfolio.optimizer.model.PortfolioWeights;
import tw.gc.portfolio.optimizer.services.solver.BoxSimplexProjection;
import tw.gc.portfolio.optimizer.services.solver.SolverOutcome;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * Turns raw solver weights into an {@link OptimizationResult}.
 *
 * Provides:
 * - Renormalization and bound enforcement
 * - Diversification score (normalized entropy x inverse correlation penalty)
 * - Risk-level classification
 * - Optimization confidence from convergence and iteration count
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResultPostProcessor {

    /**
     * Confidence reported for closed-form solutions, which have no iteration history.
     */
    static final double CLOSED_FORM_CONFIDENCE = 0.8;

    private final OptimizerConfig config;

    public OptimizationResult toResult(
            OptimizationMethod method,
            List<String> symbols,
            SolverOutcome outcome,
            double[] expectedReturns,
            RealMatrix covariance) {

        PortfolioWeights weights = enforceBounds(symbols, outcome.weights());
        double[] w = weights.toArray(symbols);

        double expectedReturn = WeightOptimizer.dot(w, expectedReturns);
        double volatility = Math.sqrt(Math.max(0.0, WeightOptimizer.quadraticForm(w, covariance)));
        double sharpe = volatility > 0.0 ? (expectedReturn - config.riskFreeRate()) / volatility : 0.0;
        double confidence = method.isClosedForm()
                ? CLOSED_FORM_CONFIDENCE
                : confidence(outcome.converged(), outcome.iterations());

        return OptimizationResult.builder()
                .weights(weights)
                .expectedReturn(expectedReturn)
                .volatility(volatility)
                .sharpeRatio(sharpe)
                .diversificationScore(diversificationScore(w, covariance))
                .riskLevel(classify(volatility))
                .confidence(confidence)
                .method(method)
                .iterations(outcome.iterations())
                .convergence(outcome.converged())
                .timestamp(OffsetDateTime.now())
                .build();
    }

    /**
     * Renormalize, then force weights into [minPositionWeight, maxPositionWeight] using the
     * configured repair mode.
     */
    public PortfolioWeights enforceBounds(List<String> symbols, double[] raw) {
        if (raw.length == 0) {
            return PortfolioWeights.empty();
        }
        double[] weights = renormalize(raw);
        if (config.boundRepair() == BoundRepairMode.PROJECTION) {
            if (BoxSimplexProjection.isFeasible(weights.length, config.minPositionWeight(), config.maxPositionWeight())) {
                BoxSimplexProjection projection =
                        new BoxSimplexProjection(config.minPositionWeight(), config.maxPositionWeight());
                return PortfolioWeights.of(symbols, projection.project(weights));
            }
            log.warn("Bounds infeasible for {} assets; falling back to two-pass clamping", weights.length);
        }
        return PortfolioWeights.of(symbols, twoPassClamp(weights));
    }

    /**
     * Min-clamp, renormalize, max-clamp, renormalize. There is no final check, so a weight can
     * end up slightly outside the bounds after the second renormalization.
     */
    double[] twoPassClamp(double[] normalized) {
        double[] weights = normalized.clone();
        double min = config.minPositionWeight();
        double max = config.maxPositionWeight();

        if (Arrays.stream(weights).anyMatch(w -> w < min)) {
            for (int i = 0; i < weights.length; i++) {
                weights[i] = Math.max(weights[i], min);
            }
            weights = renormalize(weights);
        }

        if (Arrays.stream(weights).anyMatch(w -> w > max)) {
            for (int i = 0; i < weights.length; i++) {
                weights[i] = Math.min(weights[i], max);
            }
            weights = renormalize(weights);
        }
        return weights;
    }

    /**
     * (entropy / log n) * (weighted average asset vol / portfolio vol), clamped to [0, 1].
     */
    public double diversificationScore(double[] weights, RealMatrix covariance) {
        int n = weights.length;
        if (n <= 1) {
            return 0.0;
        }

        double sum = Arrays.stream(weights).sum();
        if (!(sum > 0.0)) {
            return 0.0;
        }
        double entropy = 0.0;
        for (double weight : weights) {
            double p = weight / sum;
            entropy -= p * Math.log(p + AppConstants.ENTROPY_EPSILON);
        }
        double normalizedEntropy = entropy / Math.log(n);

        double portfolioVol = Math.sqrt(Math.max(0.0, WeightOptimizer.quadraticForm(weights, covariance)));
        double weightedVol = 0.0;
        for (int i = 0; i < n; i++) {
            weightedVol += weights[i] * Math.sqrt(Math.max(0.0, covariance.getEntry(i, i)));
        }
        double correlationPenalty = weightedVol > 0.0 ? portfolioVol / weightedVol : 1.0;
        if (!(correlationPenalty > 0.0)) {
            correlationPenalty = 1.0;
        }

        double score = normalizedEntropy * (1.0 / correlationPenalty);
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, score));
    }

    public RiskLevel classify(double volatility) {
        return RiskLevel.fromVolatility(volatility);
    }

    /**
     * (convergenceScore + iterationScore) / 2 where convergenceScore is 1.0 or 0.5 and
     * iterationScore = max(0.5, 1 - iterations / maxIterations).
     */
    public double confidence(boolean converged, int iterations) {
        double convergenceScore = converged ? 1.0 : 0.5;
        double iterationScore = Math.max(0.5, 1.0 - ((double) iterations / config.maxIterations()));
        double confidence = (convergenceScore + iterationScore) / 2.0;
        return Math.min(1.0, Math.max(0.0, confidence));
    }

    private static double[] renormalize(double[] weights) {
        double sum = Arrays.stream(weights).sum();
        double[] result = new double[weights.length];
        if (!(sum > 0.0) || !Double.isFinite(sum)) {
            Arrays.fill(result, 1.0 / weights.length);
            return result;
        }
        for (int i = 0; i < weights.length; i++) {
            result[i] = weights[i] / sum;
        }
        return result;
    }
}
