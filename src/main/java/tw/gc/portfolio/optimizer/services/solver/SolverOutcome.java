package tw.gc.portfolio.optimizer.services.solver;

/**
 * Raw solver output before post-processing.
 *
 * @param weights    last iterate (or the starting point when nothing improved)
 * @param iterations accepted iterations, 1 for closed-form solutions
 * @param converged  whether a stopping criterion other than the iteration cap was met
 * @param message    human-readable termination reason
 */
public record SolverOutcome(double[] weights, int iterations, boolean converged, String message) {

    public static SolverOutcome closedForm(double[] weights) {
        return new SolverOutcome(weights, 1, true, "Closed-form solution");
    }
}
