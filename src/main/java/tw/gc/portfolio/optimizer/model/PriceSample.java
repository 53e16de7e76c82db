package tw.gc.portfolio.optimizer.model;

/**
 * One chronological close/volume observation. Either field may be missing.
 */
public record PriceSample(Double close, Double volume) {

    public static PriceSample of(double close, double volume) {
        return new PriceSample(close, volume);
    }

    public boolean hasValidClose() {
        return close != null && Double.isFinite(close) && close > 0.0;
    }

    public boolean hasValidVolume() {
        return volume != null && Double.isFinite(volume) && volume > 0.0;
    }
}
