package tw.gc.portfolio.optimizer.enums;

public enum ActionPriority {
    HIGH,
    MEDIUM,
    LOW
}
