package tw.gc.portfolio.optimizer.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.MathArrays;
import org.springframework.stereotype.Service;
import tw.gc.portfolio.optimizer.config.OptimizerConfig;
import tw.gc.portfolio.optimizer.enums.OptimizationMethod;
import tw.gc.portfolio.optimizer.exceptions.InsufficientDataException;
import tw.gc.portfolio.optimizer.model.AssetSeries;
import tw.gc.portfolio.optimizer.model.OptimizationOutcome;
import tw.gc.portfolio.optimizer.model.OptimizationRequest;
import tw.gc.portfolio.optimizer.model.OptimizationResult;
import tw.gc.portfolio.optimizer.model.PortfolioWeights;
import tw.gc.portfolio.optimizer.model.ReturnMatrix;
import tw.gc.portfolio.optimizer.model.RiskMetrics;
import tw.gc.portfolio.optimizer.model.SharpeImprovement;
import tw.gc.portfolio.optimizer.services.solver.SolverOutcome;

import java.util.List;

/**
 * Entry point for portfolio optimization.
 *
 * Runs the pipeline price histories -> return series -> covariance -> expected returns ->
 * method-specific weights -> bounded result -> Sharpe improvement. Never throws: degraded
 * calls come back as an {@link OptimizationOutcome} carrying the neutral result.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortfolioOptimizationService {

    private final OptimizerConfig config;
    private final ReturnSeriesBuilder returnSeriesBuilder;
    private final CovarianceEstimator covarianceEstimator;
    private final ExpectedReturnEstimator expectedReturnEstimator;
    private final WeightOptimizer weightOptimizer;
    private final ResultPostProcessor resultPostProcessor;
    private final RiskMetricsCalculator riskMetricsCalculator;
    private final SharpeImprovementEvaluator sharpeImprovementEvaluator;

    public OptimizationOutcome optimize(OptimizationRequest request) {
        OptimizationMethod method = request.method();
        try {
            List<AssetSeries> universe = returnSeriesBuilder.build(request.assets());
            ReturnMatrix returns = returnSeriesBuilder.toReturnMatrix(universe);
            RealMatrix covariance = covarianceEstimator.estimate(returns);
            double[] expectedReturns = expectedReturnEstimator.historicalRiskAdjusted(returns, universe);

            if (method == OptimizationMethod.BLACK_LITTERMAN) {
                expectedReturns = blackLittermanReturns(universe, request, covariance, expectedReturns);
            }

            SolverOutcome solved = solve(method, expectedReturns, covariance, request.targetReturn());
            if (!solved.converged()) {
                log.warn("{} solver did not converge after {} iterations: {}",
                        method.getCode(), solved.iterations(), solved.message());
            }

            OptimizationResult result = resultPostProcessor.toResult(
                    method, returns.symbols(), solved, expectedReturns, covariance);

            double baseline = baselineSharpe(returns.symbols(), expectedReturns, covariance, request);
            SharpeImprovement improvement = sharpeImprovementEvaluator.evaluate(result.sharpeRatio(), baseline);

            log.info("Optimized {} assets with {}: sharpe={}, vol={}, risk={}, converged={}",
                    returns.assetCount(), method.getCode(),
                    String.format("%.3f", result.sharpeRatio()), String.format("%.4f", result.volatility()),
                    result.riskLevel(), result.convergence());
            return OptimizationOutcome.optimized(result, improvement);

        } catch (InsufficientDataException e) {
            log.warn("Insufficient data for {} optimization: {}", method.getCode(), e.getMessage());
            return OptimizationOutcome.insufficientData(method, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} optimization failed; returning neutral result", method.getCode(), e);
            return OptimizationOutcome.failed(method, e.getMessage());
        }
    }

    /**
     * Risk metrics of the given weights over the request's price histories.
     */
    public RiskMetrics riskMetrics(OptimizationRequest request, PortfolioWeights weights) {
        try {
            List<AssetSeries> universe = returnSeriesBuilder.build(request.assets());
            ReturnMatrix returns = returnSeriesBuilder.toReturnMatrix(universe);
            return riskMetricsCalculator.calculate(weights, returns, request.benchmarkArray());
        } catch (InsufficientDataException e) {
            log.warn("Insufficient data for risk metrics: {}", e.getMessage());
            return RiskMetrics.empty();
        } catch (RuntimeException e) {
            log.error("Risk metric calculation failed; returning empty metrics", e);
            return RiskMetrics.empty();
        }
    }

    private SolverOutcome solve(OptimizationMethod method, double[] expectedReturns,
                                RealMatrix covariance, Double targetReturn) {
        return switch (method) {
            case MAX_SHARPE -> weightOptimizer.maxSharpe(expectedReturns, covariance);
            case MEAN_VARIANCE -> weightOptimizer.meanVariance(expectedReturns, covariance, targetReturn);
            case BLACK_LITTERMAN -> weightOptimizer.blackLitterman(expectedReturns, covariance);
            case RISK_PARITY -> weightOptimizer.riskParity(covariance);
            case EQUAL_RISK_CONTRIBUTION -> weightOptimizer.equalRiskContribution(covariance);
        };
    }

    private double[] blackLittermanReturns(List<AssetSeries> universe, OptimizationRequest request,
                                           RealMatrix covariance, double[] historical) {
        double[] marketWeights = expectedReturnEstimator.marketWeights(universe, request.marketWeights());
        log.debug("Black-Litterman market-implied return: {}",
                expectedReturnEstimator.marketImplied(marketWeights, historical));
        return expectedReturnEstimator.blackLittermanPosterior(covariance, marketWeights, config.riskAversion());
    }

    /**
     * Sharpe ratio of the caller's current allocation, or of the equal-weight portfolio when none
     * is supplied. Falls back to the configured baseline when that ratio is not positive.
     */
    private double baselineSharpe(List<String> symbols, double[] expectedReturns, RealMatrix covariance,
                                  OptimizationRequest request) {
        double[] baseline = currentAllocation(symbols, request);
        if (baseline == null) {
            baseline = expectedReturnEstimator.equalWeights(symbols.size());
        }
        double volatility = Math.sqrt(Math.max(0.0, WeightOptimizer.quadraticForm(baseline, covariance)));
        double sharpe = volatility > 0.0
                ? (WeightOptimizer.dot(baseline, expectedReturns) - config.riskFreeRate()) / volatility
                : 0.0;
        if (!(sharpe > 0.0) || !Double.isFinite(sharpe)) {
            log.debug("Baseline Sharpe {} not positive; using configured baseline {}",
                    sharpe, config.baselineSharpe());
            return config.baselineSharpe();
        }
        return sharpe;
    }

    /**
     * Current weights aligned to the universe and scaled to sum to one. Symbols outside the
     * universe and negative or non-finite weights are ignored.
     *
     * @return the aligned weights, or null when the request carries no usable allocation
     */
    private double[] currentAllocation(List<String> symbols, OptimizationRequest request) {
        if (!request.hasCurrentWeights()) {
            return null;
        }
        double[] weights = new double[symbols.size()];
        double sum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            double weight = request.currentWeights().getOrDefault(symbols.get(i), 0.0);
            weights[i] = Double.isFinite(weight) && weight > 0.0 ? weight : 0.0;
            sum += weights[i];
        }
        if (!(sum > 0.0)) {
            log.warn("Current weights do not cover the optimized universe; using the equal-weight baseline");
            return null;
        }
        return MathArrays.scale(1.0 / sum, weights);
    }
}
