package tw.gc.portfolio.optimizer.services;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.MathArrays;
import org.springframework.stereotype.Service;
import tw.gc.portfolio.optimizer.AppConstants;
import tw.gc.portfolio.optimizer.config.OptimizerConfig;
import tw.gc.portfolio.optimizer.services.solver.BoxSimplexProjection;
import tw.gc.portfolio.optimizer.services.solver.ProjectedGradientSolver;
import tw.gc.portfolio.optimizer.services.solver.SolverOutcome;

import java.util.Arrays;

/**
 * Constrained weight solver for every supported objective profile.
 *
 * <p>All profiles share the constraint shape sum(w) = 1 and
 * minPositionWeight &lt;= w_i &lt;= maxPositionWeight. Iterative profiles start from the
 * equal-weight vector. When the bounds cannot hold for the universe size (for example three
 * assets with a 20% cap) the box is widened to include 1/n for the solve and post-processing
 * shows the clamp-and-renormalize result.
 */
@Service
@Slf4j
public class WeightOptimizer {

    /**
     * Penalty weight for the mean-variance target-return equality.
     */
    static final double TARGET_RETURN_PENALTY = 1e4;

    /**
     * Allowed |w'mu - target| for a converged mean-variance solve.
     */
    static final double TARGET_RETURN_TOLERANCE = 1e-4;

    private final OptimizerConfig config;
    private final ProjectedGradientSolver solver;

    public WeightOptimizer(OptimizerConfig config) {
        this.config = config;
        this.solver = new ProjectedGradientSolver(config.maxIterations(), config.tolerance());
    }

    /**
     * Minimize -(w'mu - rf) / sqrt(w'Sw).
     */
    public SolverOutcome maxSharpe(double[] expectedReturns, RealMatrix covariance) {
        return solve("max_sharpe", negativeSharpe(expectedReturns, covariance), expectedReturns.length);
    }

    /**
     * Negative Sharpe ratio, -infinity at zero volatility.
     */
    MultivariateFunction negativeSharpe(double[] expectedReturns, RealMatrix covariance) {
        double riskFreeRate = config.riskFreeRate();
        return w -> {
            double volatility = Math.sqrt(quadraticForm(w, covariance));
            if (volatility == 0.0) {
                return Double.NEGATIVE_INFINITY;
            }
            return -(dot(w, expectedReturns) - riskFreeRate) / volatility;
        };
    }

    /**
     * Minimize w'Sw, optionally with w'mu = targetReturn.
     */
    public SolverOutcome meanVariance(double[] expectedReturns, RealMatrix covariance, Double targetReturn) {
        if (targetReturn == null) {
            return solve("mean_variance", w -> quadraticForm(w, covariance), expectedReturns.length);
        }

        double target = targetReturn;
        MultivariateFunction penalized = w -> {
            double gap = dot(w, expectedReturns) - target;
            return quadraticForm(w, covariance) + TARGET_RETURN_PENALTY * gap * gap;
        };
        SolverOutcome outcome = solve("mean_variance", penalized, expectedReturns.length);

        double gap = Math.abs(dot(outcome.weights(), expectedReturns) - target);
        if (gap > TARGET_RETURN_TOLERANCE) {
            log.warn("Target return {} not reachable within bounds (gap {})", target, gap);
            return new SolverOutcome(outcome.weights(), outcome.iterations(), false,
                    String.format("Target return constraint violated by %.6f", gap));
        }
        return outcome;
    }

    /**
     * Max-Sharpe with the Black-Litterman posterior substituted for mu.
     */
    public SolverOutcome blackLitterman(double[] posteriorReturns, RealMatrix covariance) {
        return maxSharpe(posteriorReturns, covariance);
    }

    /**
     * Closed form w_i proportional to 1 / sigma_i.
     */
    public SolverOutcome riskParity(RealMatrix covariance) {
        int n = covariance.getRowDimension();
        double[] inverseVol = new double[n];
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            double volatility = Math.sqrt(Math.max(covariance.getEntry(i, i), 0.0));
            inverseVol[i] = 1.0 / Math.max(volatility, AppConstants.VOLATILITY_FLOOR);
            sum += inverseVol[i];
        }
        for (int i = 0; i < n; i++) {
            inverseVol[i] /= sum;
        }
        return SolverOutcome.closedForm(inverseVol);
    }

    /**
     * Minimize the variance of the risk contributions w_i * (Sw)_i / sigma_p.
     */
    public SolverOutcome equalRiskContribution(RealMatrix covariance) {
        MultivariateFunction contributionVariance = w -> {
            double[] marginal = covariance.operate(w);
            double volatility = Math.sqrt(dot(w, marginal));
            if (volatility == 0.0) {
                return 0.0;
            }
            double[] contributions = new double[w.length];
            double mean = 0.0;
            for (int i = 0; i < w.length; i++) {
                contributions[i] = w[i] * marginal[i] / volatility;
                mean += contributions[i];
            }
            mean /= w.length;
            double variance = 0.0;
            for (double contribution : contributions) {
                variance += (contribution - mean) * (contribution - mean);
            }
            return variance / w.length;
        };
        return solve("equal_risk_contribution", contributionVariance, covariance.getRowDimension());
    }

    /**
     * Projection onto the configured bounds, widened to include 1/n when they are infeasible.
     */
    BoxSimplexProjection feasibleBounds(int n) {
        double lower = config.minPositionWeight();
        double upper = config.maxPositionWeight();
        if (!BoxSimplexProjection.isFeasible(n, lower, upper)) {
            double equal = 1.0 / n;
            log.warn("Bounds [{}, {}] infeasible for {} assets; solving with [{}, {}]",
                    lower, upper, n, Math.min(lower, equal), Math.max(upper, equal));
            lower = Math.min(lower, equal);
            upper = Math.max(upper, equal);
        }
        return new BoxSimplexProjection(lower, upper);
    }

    private SolverOutcome solve(String method, MultivariateFunction objective, int n) {
        if (n == 0) {
            return new SolverOutcome(new double[0], 0, false, "Empty universe");
        }
        double[] start = new double[n];
        Arrays.fill(start, 1.0 / n);

        SolverOutcome outcome = solver.minimize(objective, start, feasibleBounds(n));
        if (!outcome.converged()) {
            log.warn("{} optimization did not converge: {}", method, outcome.message());
        } else {
            log.debug("{} converged after {} iterations", method, outcome.iterations());
        }
        return outcome;
    }

    static double quadraticForm(double[] w, RealMatrix covariance) {
        return dot(w, covariance.operate(w));
    }

    /**
     * Compensated dot product; zero for empty vectors.
     */
    static double dot(double[] a, double[] b) {
        return a.length == 0 ? 0.0 : MathArrays.linearCombination(a, b);
    }
}
