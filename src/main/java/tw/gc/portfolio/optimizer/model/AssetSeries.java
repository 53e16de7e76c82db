package tw.gc.portfolio.optimizer.model;

/**
 * Cleaned per-asset series that made it into the optimization universe.
 *
 * @param symbol         asset identifier
 * @param closes         valid closes in chronological order
 * @param returns        log-returns, length = closes - 1
 * @param volatility     annualized volatility of the log-returns
 * @param liquidityScore mean volume or the supplied precomputed score
 * @param sector         sector label, "Unknown" when absent
 * @param marketCap      market capitalization, 0 when absent
 */
public record AssetSeries(
        String symbol,
        double[] closes,
        double[] returns,
        double volatility,
        double liquidityScore,
        String sector,
        double marketCap
) {
}
