package tw.gc.portfolio.optimizer.model;

import tw.gc.portfolio.optimizer.enums.ActionPriority;
import tw.gc.portfolio.optimizer.enums.ActionType;
import tw.gc.portfolio.optimizer.enums.OptimizationMethod;
import tw.gc.portfolio.optimizer.enums.RiskLevel;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Human-facing summary of an optimization: target allocation, what to expect, and what to watch.
 */
public record PortfolioRecommendation(
        PortfolioWeights allocation,
        ExpectedPerformance expectedPerformance,
        RiskAssessment riskAssessment,
        OptimizationQuality optimizationQuality,
        List<ActionItem> actionItems,
        List<ActionItem> warnings,
        OffsetDateTime timestamp
) {

    public PortfolioRecommendation {
        actionItems = actionItems != null ? List.copyOf(actionItems) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public record ExpectedPerformance(
            double expectedReturn,
            double expectedVolatility,
            double sharpeRatio,
            double diversificationScore
    ) {
    }

    public record RiskAssessment(
            RiskLevel riskLevel,
            double var95,
            double maxDrawdown,
            double volatility
    ) {
    }

    public record OptimizationQuality(
            double confidence,
            boolean convergence,
            OptimizationMethod method
    ) {
    }

    public record ActionItem(
            ActionType type,
            String message,
            ActionPriority priority
    ) {
    }
}
