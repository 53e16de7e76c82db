package tw.gc.portfolio.optimizer.model;

import lombok.Builder;
import tw.gc.portfolio.optimizer.enums.OptimizationMethod;
import tw.gc.portfolio.optimizer.enums.RiskLevel;

import java.time.OffsetDateTime;

/**
 * Immutable outcome of one optimization call.
 */
@Builder(toBuilder = true)
public record OptimizationResult(
        PortfolioWeights weights,
        double expectedReturn,
        double volatility,
        double sharpeRatio,
        double diversificationScore,
        RiskLevel riskLevel,
        double confidence,
        OptimizationMethod method,
        int iterations,
        boolean convergence,
        OffsetDateTime timestamp
) {

    public OptimizationResult {
        weights = weights != null ? weights : PortfolioWeights.empty();
        riskLevel = riskLevel != null ? riskLevel : RiskLevel.LOW;
        method = method != null ? method : OptimizationMethod.MAX_SHARPE;
        timestamp = timestamp != null ? timestamp : OffsetDateTime.now();
    }

    /**
     * Structurally valid placeholder returned for degraded calls: empty weights,
     * zero statistics, LOW risk, not converged.
     */
    public static OptimizationResult neutral(OptimizationMethod method) {
        return OptimizationResult.builder()
                .weights(PortfolioWeights.empty())
                .expectedReturn(0.0)
                .volatility(0.0)
                .sharpeRatio(0.0)
                .diversificationScore(0.0)
                .riskLevel(RiskLevel.LOW)
                .confidence(0.0)
                .method(method)
                .iterations(0)
                .convergence(false)
                .timestamp(OffsetDateTime.now())
                .build();
    }
}
