package tw.gc.portfolio.optimizer.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.portfolio.optimizer.enums.ActionPriority;
import tw.gc.portfolio.optimizer.enums.ActionType;
import tw.gc.portfolio.optimizer.model.OptimizationResult;
import tw.gc.portfolio.optimizer.model.PortfolioRecommendation;
import tw.gc.portfolio.optimizer.model.PortfolioRecommendation.ActionItem;
import tw.gc.portfolio.optimizer.model.RiskMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds advisory recommendations from an optimization result and its risk metrics.
 *
 * Rules:
 * - Sharpe below 1.0: high-priority warning
 * - Diversification score below 0.7: medium-priority recommendation
 * - Max drawdown worse than -15%: high-priority risk warning
 * - Solver not converged: medium-priority warning
 */
@Service
@Slf4j
public class RecommendationService {

    static final double MIN_SHARPE = 1.0;
    static final double MIN_DIVERSIFICATION = 0.7;
    static final double MAX_DRAWDOWN_LIMIT = -0.15;

    public PortfolioRecommendation recommend(OptimizationResult result, RiskMetrics metrics) {
        RiskMetrics risk = metrics != null ? metrics : RiskMetrics.empty();

        List<ActionItem> actionItems = new ArrayList<>();
        List<ActionItem> warnings = new ArrayList<>();

        if (result.sharpeRatio() < MIN_SHARPE) {
            actionItems.add(new ActionItem(ActionType.WARNING,
                    "Sharpe ratio is low; review risk adjustment.", ActionPriority.HIGH));
        }
        if (result.diversificationScore() < MIN_DIVERSIFICATION) {
            actionItems.add(new ActionItem(ActionType.RECOMMENDATION,
                    "Diversification score is low; consider spreading across more assets.", ActionPriority.MEDIUM));
        }
        if (!result.convergence()) {
            actionItems.add(new ActionItem(ActionType.WARNING,
                    "Optimization solver did not converge; weights may be suboptimal.", ActionPriority.MEDIUM));
        }
        if (risk.maxDrawdown() < MAX_DRAWDOWN_LIMIT) {
            warnings.add(new ActionItem(ActionType.RISK_WARNING,
                    String.format("Max drawdown %.1f%% is too large; tighten risk management.", risk.maxDrawdown() * 100),
                    ActionPriority.HIGH));
        }

        log.debug("Recommendation for {}: {} action items, {} warnings",
                result.method().getCode(), actionItems.size(), warnings.size());

        return new PortfolioRecommendation(
                result.weights(),
                new PortfolioRecommendation.ExpectedPerformance(
                        result.expectedReturn(), result.volatility(),
                        result.sharpeRatio(), result.diversificationScore()),
                new PortfolioRecommendation.RiskAssessment(
                        result.riskLevel(), risk.var95(), risk.maxDrawdown(), risk.volatility()),
                new PortfolioRecommendation.OptimizationQuality(
                        result.confidence(), result.convergence(), result.method()),
                actionItems,
                warnings,
                result.timestamp());
    }
}
