package tw.gc.portfolio.optimizer.model;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw per-asset input supplied by the data-ingestion side.
 *
 * @param symbol         asset identifier
 * @param samples        chronological (oldest first) close/volume samples
 * @param sector         optional sector label
 * @param marketCap      optional market capitalization, used for Black-Litterman market weights
 * @param liquidityScore optional precomputed liquidity score; overrides the mean-volume proxy
 */
@Builder
public record AssetPriceHistory(
        String symbol,
        List<PriceSample> samples,
        String sector,
        Double marketCap,
        Double liquidityScore
) {

    public AssetPriceHistory {
        samples = samples != null ? List.copyOf(samples) : List.of();
    }

    public static AssetPriceHistory ofCloses(String symbol, double... closes) {
        List<PriceSample> samples = new ArrayList<>(closes.length);
        for (double close : closes) {
            samples.add(new PriceSample(close, null));
        }
        return AssetPriceHistory.builder().symbol(symbol).samples(samples).build();
    }
}
