package tw.gc.portfolio.optimizer.services;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Service;
import tw.gc.portfolio.optimizer.AppConstants;
import tw.gc.portfolio.optimizer.exceptions.InsufficientDataException;
import tw.gc.portfolio.optimizer.model.AssetPriceHistory;
import tw.gc.portfolio.optimizer.model.AssetSeries;
import tw.gc.portfolio.optimizer.model.PriceSample;
import tw.gc.portfolio.optimizer.model.ReturnMatrix;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns raw per-asset price/volume samples into log-return series.
 *
 * <p>Assets with fewer than {@value AppConstants#MIN_PRICE_POINTS} valid closes are dropped
 * from the universe. Only an empty universe is an error.
 */
@Service
@Slf4j
public class ReturnSeriesBuilder {

    private static final String UNKNOWN_SECTOR = "Unknown";

    /**
     * Build the optimization universe.
     *
     * @param assets raw price histories, oldest sample first
     * @return one series per usable asset, in input order; the first usable entry wins for a repeated symbol
     * @throws InsufficientDataException when no asset survives filtering
     */
    public List<AssetSeries> build(List<AssetPriceHistory> assets) {
        List<AssetSeries> universe = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (assets != null) {
            for (AssetPriceHistory asset : assets) {
                AssetSeries series = toSeries(asset);
                if (series == null) {
                    continue;
                }
                if (!seen.add(series.symbol())) {
                    log.debug("Dropping duplicate entry for {}", series.symbol());
                    continue;
                }
                universe.add(series);
            }
        }

        if (universe.isEmpty()) {
            throw new InsufficientDataException(String.format(
                    "No asset has at least %d valid price points", AppConstants.MIN_PRICE_POINTS));
        }
        return universe;
    }

    /**
     * Stack the universe's return vectors into a matrix truncated to the shortest series.
     */
    public ReturnMatrix toReturnMatrix(List<AssetSeries> universe) {
        return ReturnMatrix.truncated(
                universe.stream().map(AssetSeries::symbol).toList(),
                universe.stream().map(AssetSeries::returns).toList());
    }

    /**
     * Log-returns: ln(p[t]) - ln(p[t-1]).
     */
    public double[] logReturns(double[] closes) {
        if (closes.length < 2) {
            return new double[0];
        }
        double[] returns = new double[closes.length - 1];
        for (int i = 1; i < closes.length; i++) {
            returns[i - 1] = Math.log(closes[i]) - Math.log(closes[i - 1]);
        }
        return returns;
    }

    /**
     * Population standard deviation of the returns scaled by sqrt(252).
     */
    public double annualizedVolatility(double[] returns) {
        if (returns.length == 0) {
            return 0.0;
        }
        return new StandardDeviation(false).evaluate(returns) * AppConstants.SQRT_TRADING_DAYS;
    }

    private AssetSeries toSeries(AssetPriceHistory asset) {
        if (asset == null || asset.symbol() == null || asset.symbol().isBlank()) {
            log.debug("Skipping asset without symbol");
            return null;
        }

        double[] closes = asset.samples().stream()
                .filter(PriceSample::hasValidClose)
                .mapToDouble(PriceSample::close)
                .toArray();
        if (closes.length < AppConstants.MIN_PRICE_POINTS) {
            log.debug("Dropping {}: only {} valid closes (need {})",
                    asset.symbol(), closes.length, AppConstants.MIN_PRICE_POINTS);
            return null;
        }

        double[] returns = logReturns(closes);
        double volatility = annualizedVolatility(returns);

        return new AssetSeries(
                asset.symbol(),
                closes,
                returns,
                volatility,
                liquidityScore(asset),
                asset.sector() != null ? asset.sector() : UNKNOWN_SECTOR,
                asset.marketCap() != null ? asset.marketCap() : 0.0
        );
    }

    private double liquidityScore(AssetPriceHistory asset) {
        if (asset.liquidityScore() != null && Double.isFinite(asset.liquidityScore())) {
            return asset.liquidityScore();
        }
        double[] volumes = asset.samples().stream()
                .filter(PriceSample::hasValidVolume)
                .mapToDouble(PriceSample::volume)
                .toArray();
        if (volumes.length < AppConstants.MIN_PRICE_POINTS) {
            return 0.0;
        }
        double sum = 0.0;
        for (double volume : volumes) {
            sum += volume;
        }
        return sum / volumes.length;
    }
}
