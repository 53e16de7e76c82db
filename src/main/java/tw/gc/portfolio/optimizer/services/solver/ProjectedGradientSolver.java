package tw.gc.portfolio.optimizer.services.solver;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.util.MathArrays;

/**
 * Deterministic projected-gradient minimizer over the bounded simplex.
 *
 * <p>Gradients are central finite differences. Each iteration tries a step that moves the
 * largest gradient coordinate by {@value #INITIAL_STEP} in weight units, projects it back onto
 * the feasible set and backtracks (Armijo) until the objective decreases. Candidates with a
 * non-finite objective value are rejected.
 *
 * <p>Termination:
 * <ul>
 *   <li>weights move less than the tolerance, or the objective changes by less than the
 *       tolerance relative to its magnitude: converged</li>
 *   <li>no descent step exists within the backtracking budget: converged when the point is
 *       stationary, otherwise not converged</li>
 *   <li>the iteration cap is reached: not converged, last iterate returned</li>
 * </ul>
 */
@Slf4j
public class ProjectedGradientSolver {

    private static final double INITIAL_STEP = 0.1;
    private static final double BACKTRACK_FACTOR = 0.5;
    private static final int MAX_BACKTRACKS = 60;
    private static final double ARMIJO_SIGMA = 1e-4;
    private static final double GRADIENT_STEP = 1e-7;
    private static final double STATIONARITY_TOLERANCE = 1e-4;
    private static final double MAGNITUDE_FLOOR = 1e-12;

    private final int maxIterations;
    private final double tolerance;

    public ProjectedGradientSolver(int maxIterations, double tolerance) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("tolerance must be positive: " + tolerance);
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public SolverOutcome minimize(MultivariateFunction objective, double[] start, BoxSimplexProjection projection) {
        double[] x = projection.project(start);
        double fx = objective.value(x);
        if (!Double.isFinite(fx)) {
            return new SolverOutcome(x, 0, false, "Objective is not finite at the starting point");
        }

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            double[] gradient = gradient(objective, x);
            double gradientNorm = maxAbs(gradient);
            if (!Double.isFinite(gradientNorm)) {
                return new SolverOutcome(x, iteration - 1, false, "Gradient is not finite");
            }
            if (gradientNorm == 0.0) {
                return new SolverOutcome(x, iteration - 1, true, "Gradient vanished");
            }

            double step = INITIAL_STEP / gradientNorm;
            double[] candidate = null;
            double fCandidate = Double.NaN;
            for (int backtrack = 0; backtrack < MAX_BACKTRACKS; backtrack++) {
                double[] trial = projection.project(MathArrays.ebeAdd(x, MathArrays.scale(-step, gradient)));
                double fTrial = objective.value(trial);
                double expectedDecrease = MathArrays.linearCombination(gradient, MathArrays.ebeSubtract(x, trial));
                if (Double.isFinite(fTrial) && expectedDecrease > 0.0
                        && fTrial <= fx - ARMIJO_SIGMA * expectedDecrease) {
                    candidate = trial;
                    fCandidate = fTrial;
                    break;
                }
                step *= BACKTRACK_FACTOR;
            }

            if (candidate == null) {
                double stationarity = maxAbs(MathArrays.ebeSubtract(x, projection.project(MathArrays.ebeAdd(x, MathArrays.scale(-1.0 / gradientNorm, gradient)))));
                boolean stationary = stationarity < STATIONARITY_TOLERANCE;
                log.debug("Line search exhausted at iteration {} (stationarity {})", iteration, stationarity);
                return new SolverOutcome(x, iteration - 1, stationary,
                        stationary ? "No further descent; point is stationary" : "Line search failed");
            }

            double moved = maxAbs(MathArrays.ebeSubtract(candidate, x));
            double improvement = Math.abs(fx - fCandidate);
            x = candidate;
            fx = fCandidate;

            if (moved < tolerance || improvement <= tolerance * Math.max(Math.abs(fx), MAGNITUDE_FLOOR)) {
                return new SolverOutcome(x, iteration, true, "Optimization terminated successfully");
            }
        }

        return new SolverOutcome(x, maxIterations, false, "Iteration limit reached");
    }

    private double[] gradient(MultivariateFunction objective, double[] x) {
        double[] gradient = new double[x.length];
        double[] probe = x.clone();
        for (int i = 0; i < x.length; i++) {
            double original = probe[i];
            probe[i] = original + GRADIENT_STEP;
            double forward = objective.value(probe);
            probe[i] = original - GRADIENT_STEP;
            double backward = objective.value(probe);
            probe[i] = original;
            gradient[i] = (forward - backward) / (2.0 * GRADIENT_STEP);
        }
        return gradient;
    }

    private static double maxAbs(double[] values) {
        double max = 0.0;
        for (double value : values) {
            max = Math.max(max, Math.abs(value));
        }
        return max;
    }
}
