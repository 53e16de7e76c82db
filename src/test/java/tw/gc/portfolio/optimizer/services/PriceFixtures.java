package tw.gc.portfolio.optimizer.services;

import tw.gc.portfolio.optimizer.model.AssetPriceHistory;
import tw.gc.portfolio.optimizer.model.PriceSample;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic price histories for service tests.
 */
final class PriceFixtures {

    private PriceFixtures() {
    }

    /**
     * Closes compounding a log-return of drift + amplitude * sin(frequency * t + phase).
     */
    static AssetPriceHistory wave(String symbol, int points, double drift, double amplitude,
                                  double frequency, double phase) {
        List<PriceSample> samples = new ArrayList<>(points);
        double price = 100.0;
        for (int t = 0; t < points; t++) {
            samples.add(PriceSample.of(price, 1_000 + 10 * t));
            price *= Math.exp(drift + amplitude * Math.sin(frequency * t + phase));
        }
        return AssetPriceHistory.builder().symbol(symbol).samples(samples).build();
    }

    /**
     * Five assets with distinct drift and volatility, 120 closes each.
     */
    static List<AssetPriceHistory> fiveAssetUniverse() {
        return List.of(
                wave("2330.TW", 120, 0.0012, 0.015, 0.7, 0.0),
                wave("2454.TW", 120, 0.0008, 0.022, 1.3, 0.5),
                wave("2317.TW", 120, 0.0004, 0.010, 0.4, 1.1),
                wave("2882.TW", 120, 0.0002, 0.008, 2.1, 2.0),
                wave("1301.TW", 120, -0.0003, 0.018, 0.9, 2.7));
    }

    /**
     * Three assets, the size at which the default 20% cap is infeasible.
     */
    static List<AssetPriceHistory> threeAssetUniverse() {
        return fiveAssetUniverse().subList(0, 3);
    }
}
