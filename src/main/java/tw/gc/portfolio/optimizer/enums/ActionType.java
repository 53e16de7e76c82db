package tw.gc.portfolio.optimizer.enums;

/**
 * Kind of advisory item attached to a portfolio recommendation.
 */
public enum ActionType {
    WARNING,
    RECOMMENDATION,
    RISK_WARNING
}
