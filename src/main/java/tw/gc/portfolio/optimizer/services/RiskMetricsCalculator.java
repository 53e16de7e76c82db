package tw.gc.portfolio.optimizer.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;
import tw.gc.portfolio.optimizer.AppConstants;
import tw.gc.portfolio.optimizer.config.OptimizerConfig;
import tw.gc.portfolio.optimizer.model.PortfolioWeights;
import tw.gc.portfolio.optimizer.model.ReturnMatrix;
import tw.gc.portfolio.optimizer.model.RiskMetrics;

import java.util.Arrays;

/**
 * Historical risk statistics of a weighted portfolio.
 *
 * All ratios work on the daily portfolio return series r_t = sum_i w_i * R_it. Only the
 * reported volatility is annualized.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskMetricsCalculator {

    private static final double VAR_95_PERCENTILE = 5.0;
    private static final double VAR_99_PERCENTILE = 1.0;
    private static final int MIN_BENCHMARK_SAMPLES = 2;

    private final OptimizerConfig config;

    public RiskMetrics calculate(PortfolioWeights weights, ReturnMatrix returns) {
        return calculate(weights, returns, new double[0]);
    }

    public RiskMetrics calculate(PortfolioWeights weights, ReturnMatrix returns, double[] benchmarkReturns) {
        if (weights == null || weights.isEmpty() || returns == null || returns.isEmpty()) {
            return RiskMetrics.empty();
        }

        double[] portfolio = returns.portfolioReturns(weights.toArray(returns.symbols()));

        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        double var95 = percentile.evaluate(portfolio, VAR_95_PERCENTILE);
        double var99 = percentile.evaluate(portfolio, VAR_99_PERCENTILE);

        double mean = new Mean().evaluate(portfolio);
        double std = new StandardDeviation(false).evaluate(portfolio);
        double maxDrawdown = maxDrawdown(portfolio);

        double[] downside = Arrays.stream(portfolio).filter(r -> r < 0.0).toArray();
        double downsideStd = downside.length > 0 ? new StandardDeviation(false).evaluate(downside) : 0.0;

        RiskMetrics.RiskMetricsBuilder builder = RiskMetrics.builder()
                .var95(var95)
                .var99(var99)
                .cvar95(conditionalValueAtRisk(portfolio, var95))
                .cvar99(conditionalValueAtRisk(portfolio, var99))
                .maxDrawdown(maxDrawdown)
                .sharpeRatio(std > 0.0 ? (mean - config.riskFreeRate()) / std : 0.0)
                .sortinoRatio(downsideStd > 0.0 ? (mean - config.riskFreeRate()) / downsideStd : 0.0)
                .calmarRatio(maxDrawdown != 0.0 ? mean / Math.abs(maxDrawdown) : 0.0)
                .volatility(std * AppConstants.SQRT_TRADING_DAYS)
                .skewness(skewness(portfolio))
                .kurtosis(excessKurtosis(portfolio))
                .beta(RiskMetrics.NEUTRAL_BETA);

        if (benchmarkReturns != null && benchmarkReturns.length > 0) {
            applyBenchmark(builder, portfolio, benchmarkReturns);
        }
        return builder.build();
    }

    /**
     * Beta, Jensen alpha, Treynor and information ratio over the most recent samples both series share.
     */
    private void applyBenchmark(RiskMetrics.RiskMetricsBuilder builder, double[] portfolio, double[] benchmark) {
        int overlap = Math.min(portfolio.length, benchmark.length);
        if (overlap < MIN_BENCHMARK_SAMPLES) {
            log.debug("Benchmark overlap of {} samples is too short; using neutral values", overlap);
            return;
        }
        double[] r = Arrays.copyOfRange(portfolio, portfolio.length - overlap, portfolio.length);
        double[] b = Arrays.copyOfRange(benchmark, benchmark.length - overlap, benchmark.length);
        double dailyRiskFree = config.riskFreeRate() / AppConstants.TRADING_DAYS_PER_YEAR;

        SimpleRegression market = new SimpleRegression();
        SimpleRegression excess = new SimpleRegression();
        double[] active = new double[overlap];
        for (int t = 0; t < overlap; t++) {
            market.addData(b[t], r[t]);
            excess.addData(b[t] - dailyRiskFree, r[t] - dailyRiskFree);
            active[t] = r[t] - b[t];
        }

        double beta = market.getSlope();
        if (!Double.isFinite(beta)) {
            beta = RiskMetrics.NEUTRAL_BETA;
        }
        double alpha = excess.getIntercept();

        double excessMean = new Mean().evaluate(r) - dailyRiskFree;
        double trackingError = new StandardDeviation(true).evaluate(active);

        builder.beta(beta)
                .jensenAlpha(Double.isFinite(alpha) ? alpha : 0.0)
                .treynorRatio(beta != 0.0 ? excessMean / beta : 0.0)
                .informationRatio(trackingError > 0.0 ? new Mean().evaluate(active) / trackingError : 0.0);
    }

    static double conditionalValueAtRisk(double[] returns, double threshold) {
        double[] tail = Arrays.stream(returns).filter(r -> r <= threshold).toArray();
        return tail.length > 0 ? new Mean().evaluate(tail) : threshold;
    }

    /**
     * Largest peak-to-trough loss of the compounded series, a non-positive number.
     */
    static double maxDrawdown(double[] returns) {
        double cumulative = 1.0;
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0.0;
        for (double r : returns) {
            cumulative *= 1.0 + r;
            peak = Math.max(peak, cumulative);
            if (peak > 0.0) {
                worst = Math.min(worst, (cumulative - peak) / peak);
            }
        }
        return worst;
    }

    static double skewness(double[] values) {
        double[] moments = centralMoments(values);
        double m2 = moments[0];
        if (!(m2 > 0.0) || !Double.isFinite(m2)) {
            return 0.0;
        }
        return moments[1] / Math.pow(m2, 1.5);
    }

    static double excessKurtosis(double[] values) {
        double[] moments = centralMoments(values);
        double m2 = moments[0];
        if (!(m2 > 0.0) || !Double.isFinite(m2)) {
            return 0.0;
        }
        return moments[2] / (m2 * m2) - 3.0;
    }

    // population 2nd, 3rd and 4th central moments
    private static double[] centralMoments(double[] values) {
        if (values.length == 0) {
            return new double[]{0.0, 0.0, 0.0};
        }
        double mean = new Mean().evaluate(values);
        double m2 = 0.0;
        double m3 = 0.0;
        double m4 = 0.0;
        for (double value : values) {
            double d = value - mean;
            double d2 = d * d;
            m2 += d2;
            m3 += d2 * d;
            m4 += d2 * d2;
        }
        int n = values.length;
        return new double[]{m2 / n, m3 / n, m4 / n};
    }
}
