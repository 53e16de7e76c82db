package tw.gc.portfolio.optimizer.services;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.util.MathArrays;
import org.springframework.stereotype.Service;
import tw.gc.portfolio.optimizer.AppConstants;
import tw.gc.portfolio.optimizer.model.AssetSeries;
import tw.gc.portfolio.optimizer.model.ReturnMatrix;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Per-asset expected-return policies.
 *
 * <ul>
 *   <li>historical risk-adjusted: annualized mean / annualized vol, clipped to [-0.5, 0.5]</li>
 *   <li>market-implied: equal-weight (or supplied) market portfolio return, seeds Black-Litterman</li>
 *   <li>Black-Litterman posterior: riskAversion * S * w_market, without an investor-views vector</li>
 * </ul>
 */
@Service
@Slf4j
public class ExpectedReturnEstimator {

    public double[] historicalRiskAdjusted(ReturnMatrix returns, double[] volatilities) {
        if (volatilities.length != returns.assetCount()) {
            throw new IllegalArgumentException(String.format(
                    "Volatility count %d does not match asset count %d", volatilities.length, returns.assetCount()));
        }

        Mean mean = new Mean();
        double[] expected = new double[returns.assetCount()];
        for (int i = 0; i < expected.length; i++) {
            double[] row = returns.row(i);
            double annualized = row.length == 0 ? 0.0 : mean.evaluate(row) * AppConstants.TRADING_DAYS_PER_YEAR;
            double volatility = volatilities[i] == 0.0 ? AppConstants.VOLATILITY_FLOOR : volatilities[i];
            expected[i] = clip(annualized / volatility);
        }
        return expected;
    }

    public double[] historicalRiskAdjusted(ReturnMatrix returns, List<AssetSeries> universe) {
        return historicalRiskAdjusted(returns, universe.stream().mapToDouble(AssetSeries::volatility).toArray());
    }

    /**
     * Return of the market portfolio, w_market . mu.
     */
    public double marketImplied(double[] marketWeights, double[] expectedReturns) {
        return WeightOptimizer.dot(marketWeights, expectedReturns);
    }

    /**
     * Simplified Black-Litterman posterior: riskAversion * S * w_market.
     * There is no views vector, so this is the covariance-weighted tilt of the market prior.
     */
    public double[] blackLittermanPosterior(RealMatrix covariance, double[] marketWeights, double riskAversion) {
        return MathArrays.scale(riskAversion, covariance.operate(marketWeights));
    }

    /**
     * Market weights for Black-Litterman. Preference order: supplied weights keyed by symbol,
     * market-cap weights when every asset reports a positive cap, otherwise equal weights.
     */
    public double[] marketWeights(List<AssetSeries> universe, Map<String, Double> supplied) {
        int n = universe.size();
        double[] weights = new double[n];

        if (supplied != null && !supplied.isEmpty()) {
            double sum = 0.0;
            for (int i = 0; i < n; i++) {
                Double weight = supplied.get(universe.get(i).symbol());
                weights[i] = weight != null && weight > 0.0 ? weight : 0.0;
                sum += weights[i];
            }
            if (sum > 0.0) {
                return MathArrays.scale(1.0 / sum, weights);
            }
            log.debug("Supplied market weights do not cover the universe; falling back");
        }

        double capSum = 0.0;
        boolean allCaps = true;
        for (int i = 0; i < n; i++) {
            double cap = universe.get(i).marketCap();
            allCaps &= cap > 0.0;
            weights[i] = cap;
            capSum += cap;
        }
        if (allCaps && capSum > 0.0) {
            return MathArrays.scale(1.0 / capSum, weights);
        }

        return equalWeights(n);
    }

    public double[] equalWeights(int n) {
        double[] weights = new double[n];
        Arrays.fill(weights, 1.0 / n);
        return weights;
    }

    private static double clip(double value) {
        return Math.max(-AppConstants.EXPECTED_RETURN_CLIP, Math.min(AppConstants.EXPECTED_RETURN_CLIP, value));
    }
}
