package tw.gc.portfolio.optimizer;

/**
 * Application-wide numeric constants
 */
public final class AppConstants {

    // Annualization
    public static final int TRADING_DAYS_PER_YEAR = 252;
    public static final double SQRT_TRADING_DAYS = Math.sqrt(TRADING_DAYS_PER_YEAR);

    // Universe filtering
    public static final int MIN_PRICE_POINTS = 3;

    // Numerical floors
    public static final double EIGENVALUE_FLOOR = 1e-8;
    public static final double VOLATILITY_FLOOR = 1e-8;
    public static final double ENTROPY_EPSILON = 1e-10;

    // Expected-return clipping for the historical risk-adjusted estimator
    public static final double EXPECTED_RETURN_CLIP = 0.5;

    private AppConstants() {
        // Utility class
    }
}
