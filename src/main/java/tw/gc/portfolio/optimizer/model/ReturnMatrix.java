package tw.gc.portfolio.optimizer.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Rectangular asset x time matrix of log-returns. Every row has the same length,
 * the shortest series in the universe.
 */
public final class ReturnMatrix {

    private final List<String> symbols;
    private final double[][] data;

    private ReturnMatrix(List<String> symbols, double[][] data) {
        this.symbols = symbols;
        this.data = data;
    }

    /**
     * Build a matrix by truncating every series to the shortest one, keeping the leading samples.
     */
    public static ReturnMatrix truncated(List<String> symbols, List<double[]> series) {
        Objects.requireNonNull(symbols, "symbols");
        Objects.requireNonNull(series, "series");
        if (symbols.size() != series.size()) {
            throw new IllegalArgumentException(String.format(
                    "Symbol count %d does not match series count %d", symbols.size(), series.size()));
        }

        int minLength = series.stream().mapToInt(s -> s.length).min().orElse(0);
        double[][] data = new double[series.size()][];
        for (int i = 0; i < series.size(); i++) {
            data[i] = Arrays.copyOf(series.get(i), minLength);
        }
        return new ReturnMatrix(List.copyOf(symbols), data);
    }

    public static ReturnMatrix of(List<String> symbols, double[][] rows) {
        List<double[]> series = Arrays.stream(rows).map(double[]::clone).toList();
        int expected = rows.length == 0 ? 0 : rows[0].length;
        for (double[] row : rows) {
            if (row.length != expected) {
                throw new IllegalArgumentException("Return matrix rows must all have the same length");
            }
        }
        return truncated(symbols, series);
    }

    public List<String> symbols() {
        return symbols;
    }

    public int assetCount() {
        return data.length;
    }

    /**
     * Number of time samples per asset.
     */
    public int length() {
        return data.length == 0 ? 0 : data[0].length;
    }

    public boolean isEmpty() {
        return assetCount() == 0 || length() == 0;
    }

    public double[] row(int asset) {
        return data[asset].clone();
    }

    /**
     * Copy of the raw data, rows are assets.
     */
    public double[][] toArray() {
        double[][] copy = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            copy[i] = data[i].clone();
        }
        return copy;
    }

    /**
     * Copy in time x asset orientation, the layout commons-math expects for covariance.
     */
    public double[][] toObservations() {
        int n = assetCount();
        int t = length();
        double[][] observations = new double[t][n];
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < t; k++) {
                observations[k][i] = data[i][k];
            }
        }
        return observations;
    }

    /**
     * r_t = sum_i w_i * R_it
     */
    public double[] portfolioReturns(double[] weights) {
        if (weights.length != assetCount()) {
            throw new IllegalArgumentException(String.format(
                    "Weight count %d does not match asset count %d", weights.length, assetCount()));
        }
        double[] result = new double[length()];
        for (int i = 0; i < data.length; i++) {
            for (int k = 0; k < result.length; k++) {
                result[k] += weights[i] * data[i][k];
            }
        }
        return result;
    }
}
