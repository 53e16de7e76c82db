package tw.gc.portfolio.optimizer.enums;

/**
 * Outcome status of an optimization call.
 */
public enum OptimizationStatus {
    /**
     * The solver ran; the result may still carry convergence=false.
     */
    OPTIMIZED,

    /**
     * No asset had enough price history; the result is neutral.
     */
    INSUFFICIENT_DATA,

    /**
     * An unexpected error occurred; the result is neutral.
     */
    FAILED
}
