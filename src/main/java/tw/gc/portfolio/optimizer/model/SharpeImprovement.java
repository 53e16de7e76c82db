package tw.gc.portfolio.optimizer.model;

/**
 * Comparison of an optimized Sharpe ratio against a baseline.
 */
public record SharpeImprovement(
        double baselineSharpe,
        double optimizedSharpe,
        double improvementRatio,
        double targetImprovement,
        boolean targetAchieved
) {
}
