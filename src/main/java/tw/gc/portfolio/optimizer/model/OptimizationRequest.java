package tw.gc.portfolio.optimizer.model;

import lombok.Builder;
import tw.gc.portfolio.optimizer.enums.OptimizationMethod;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input of one optimization call.
 *
 * <p>Null list elements and map entries with a null key or value are dropped.
 *
 * @param assets           per-asset price histories
 * @param method           objective profile, defaults to max-Sharpe
 * @param targetReturn     optional target return for mean-variance
 * @param marketWeights    optional market weights for Black-Litterman, keyed by symbol
 * @param benchmarkReturns optional benchmark return series (oldest first) for benchmark-relative metrics
 * @param currentWeights   optional current allocation, keyed by symbol, used as the Sharpe baseline
 */
@Builder
public record OptimizationRequest(
        List<AssetPriceHistory> assets,
        OptimizationMethod method,
        Double targetReturn,
        Map<String, Double> marketWeights,
        List<Double> benchmarkReturns,
        Map<String, Double> currentWeights
) {

    public OptimizationRequest {
        assets = withoutNulls(assets);
        method = method != null ? method : OptimizationMethod.MAX_SHARPE;
        marketWeights = withoutNulls(marketWeights);
        benchmarkReturns = withoutNulls(benchmarkReturns);
        currentWeights = withoutNulls(currentWeights);
    }

    public static OptimizationRequest of(List<AssetPriceHistory> assets, OptimizationMethod method) {
        return OptimizationRequest.builder().assets(assets).method(method).build();
    }

    public double[] benchmarkArray() {
        return benchmarkReturns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public boolean hasCurrentWeights() {
        return !currentWeights.isEmpty();
    }

    private static <T> List<T> withoutNulls(List<T> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    private static Map<String, Double> withoutNulls(Map<String, Double> values) {
        if (values == null) {
            return Map.of();
        }
        Map<String, Double> copy = new LinkedHashMap<>();
        values.forEach((symbol, weight) -> {
            if (symbol != null && weight != null) {
                copy.put(symbol, weight);
            }
        });
        return Map.copyOf(copy);
    }
}
