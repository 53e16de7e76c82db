package tw.gc.portfolio.optimizer.model;

import lombok.Builder;

/**
 * Risk/performance statistics of a weighted portfolio over a historical return window.
 * Benchmark-relative fields hold neutral values (0, beta 1.0) when no benchmark was supplied.
 */
@Builder
public record RiskMetrics(
        double var95,
        double var99,
        double cvar95,
        double cvar99,
        double maxDrawdown,
        double sharpeRatio,
        double sortinoRatio,
        double calmarRatio,
        double informationRatio,
        double treynorRatio,
        double jensenAlpha,
        double beta,
        double volatility,
        double skewness,
        double kurtosis
) {

    public static final double NEUTRAL_BETA = 1.0;

    public static RiskMetrics empty() {
        return RiskMetrics.builder().beta(NEUTRAL_BETA).build();
    }
}
