package tw.gc.portfolio.optimizer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered symbol -> weight mapping.
 *
 * <p>Every instance holds finite, non-negative weights. Use {@link #normalized} to also
 * force the weights to sum to one.
 */
public final class PortfolioWeights {

    private static final double NEGATIVE_TOLERANCE = 1e-12;
    private static final PortfolioWeights EMPTY = new PortfolioWeights(Map.of());

    private final Map<String, Double> weights;

    private PortfolioWeights(Map<String, Double> weights) {
        this.weights = weights;
    }

    public static PortfolioWeights empty() {
        return EMPTY;
    }

    @JsonCreator
    public static PortfolioWeights of(Map<String, Double> weights) {
        if (weights == null || weights.isEmpty()) {
            return EMPTY;
        }
        Map<String, Double> validated = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            validated.put(Objects.requireNonNull(entry.getKey(), "symbol"), validate(entry.getKey(), entry.getValue()));
        }
        return new PortfolioWeights(Collections.unmodifiableMap(validated));
    }

    public static PortfolioWeights of(List<String> symbols, double[] weights) {
        if (symbols.size() != weights.length) {
            throw new IllegalArgumentException(String.format(
                    "Symbol count %d does not match weight count %d", symbols.size(), weights.length));
        }
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < weights.length; i++) {
            if (map.put(symbols.get(i), weights[i]) != null) {
                throw new IllegalArgumentException("Duplicate symbol: " + symbols.get(i));
            }
        }
        return of(map);
    }

    /**
     * Divide by the sum so the weights total 1.0.
     */
    public static PortfolioWeights normalized(List<String> symbols, double[] weights) {
        double sum = 0.0;
        for (double w : weights) {
            sum += w;
        }
        if (!(sum > 0.0) || !Double.isFinite(sum)) {
            throw new IllegalArgumentException("Cannot normalize weights with non-positive sum: " + sum);
        }
        double[] scaled = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            scaled[i] = weights[i] / sum;
        }
        return of(symbols, scaled);
    }

    public static PortfolioWeights equal(List<String> symbols) {
        double[] weights = new double[symbols.size()];
        Arrays.fill(weights, 1.0 / symbols.size());
        return of(symbols, weights);
    }

    private static double validate(String symbol, Double weight) {
        if (weight == null || !Double.isFinite(weight)) {
            throw new IllegalArgumentException("Weight for " + symbol + " must be finite: " + weight);
        }
        if (weight < -NEGATIVE_TOLERANCE) {
            throw new IllegalArgumentException("Weight for " + symbol + " must be non-negative: " + weight);
        }
        return Math.max(0.0, weight);
    }

    @JsonValue
    public Map<String, Double> asMap() {
        return weights;
    }

    public double get(String symbol) {
        return weights.getOrDefault(symbol, 0.0);
    }

    public List<String> symbols() {
        return List.copyOf(weights.keySet());
    }

    /**
     * Weights in the given symbol order; symbols not held count as zero.
     */
    public double[] toArray(List<String> order) {
        double[] result = new double[order.size()];
        for (int i = 0; i < order.size(); i++) {
            result[i] = get(order.get(i));
        }
        return result;
    }

    public double[] toArray() {
        return weights.values().stream().mapToDouble(Double::doubleValue).toArray();
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public int size() {
        return weights.size();
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PortfolioWeights that)) return false;
        return weights.equals(that.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return weights.toString();
    }
}
