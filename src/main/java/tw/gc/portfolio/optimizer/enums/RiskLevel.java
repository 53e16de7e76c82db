package tw.gc.portfolio.optimizer.enums;

/**
 * Portfolio risk bucket derived from volatility.
 * Each bucket's upper bound is inclusive.
 */
public enum RiskLevel {
    LOW(0.10),
    MEDIUM(0.20),
    HIGH(0.30),
    VERY_HIGH(Double.POSITIVE_INFINITY);

    private final double upperBound;

    RiskLevel(double upperBound) {
        this.upperBound = upperBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public static RiskLevel fromVolatility(double volatility) {
        if (volatility <= LOW.upperBound) {
            return LOW;
        } else if (volatility <= MEDIUM.upperBound) {
            return MEDIUM;
        } else if (volatility <= HIGH.upperBound) {
            return HIGH;
        }
        return VERY_HIGH;
    }
}
