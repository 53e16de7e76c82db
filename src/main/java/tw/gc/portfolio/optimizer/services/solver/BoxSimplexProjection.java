package tw.gc.portfolio.optimizer.services.solver;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.analysis.solvers.UnivariateSolver;

/**
 * Euclidean projection onto {w : sum(w) = 1, lower <= w_i <= upper}.
 *
 * <p>The projection is w_i = clip(v_i - tau, lower, upper) where the shift tau
 * (the water level) is the root of sum_i clip(v_i - tau) - 1, found with Brent's method.
 */
public final class BoxSimplexProjection {

    private static final int MAX_EVALUATIONS = 200;
    private static final double ABSOLUTE_ACCURACY = 1e-14;
    private static final double RELATIVE_ACCURACY = 1e-14;
    private static final double FEASIBILITY_SLACK = 1e-12;

    private final double lower;
    private final double upper;
    private final UnivariateSolver rootSolver = new BrentSolver(RELATIVE_ACCURACY, ABSOLUTE_ACCURACY);

    public BoxSimplexProjection(double lower, double upper) {
        if (lower > upper) {
            throw new IllegalArgumentException(String.format("lower %.6f exceeds upper %.6f", lower, upper));
        }
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * True when the bounded simplex is non-empty for n assets.
     */
    public static boolean isFeasible(int n, double lower, double upper) {
        return n > 0 && n * lower <= 1.0 + FEASIBILITY_SLACK && n * upper >= 1.0 - FEASIBILITY_SLACK;
    }

    public double lower() {
        return lower;
    }

    public double upper() {
        return upper;
    }

    public double[] project(double[] v) {
        int n = v.length;
        if (n == 0) {
            return new double[0];
        }
        if (!isFeasible(n, lower, upper)) {
            throw new IllegalArgumentException(String.format(
                    "Bounds [%.4f, %.4f] are infeasible for %d assets", lower, upper, n));
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : v) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        UnivariateFunction excess = tau -> clippedSum(v, tau) - 1.0;
        double left = min - upper;
        double right = max - lower;

        double tau;
        if (right - left <= ABSOLUTE_ACCURACY || excess.value(left) <= 0.0) {
            tau = left;
        } else if (excess.value(right) >= 0.0) {
            tau = right;
        } else {
            tau = rootSolver.solve(MAX_EVALUATIONS, excess, left, right);
        }

        double[] projected = new double[n];
        for (int i = 0; i < n; i++) {
            projected[i] = clip(v[i] - tau);
        }
        return projected;
    }

    private double clippedSum(double[] v, double tau) {
        double sum = 0.0;
        for (double value : v) {
            sum += clip(value - tau);
        }
        return sum;
    }

    private double clip(double value) {
        return Math.min(upper, Math.max(lower, value));
    }
}
