package tw.gc.portfolio.optimizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import tw.gc.portfolio.optimizer.enums.OptimizationMethod;
import tw.gc.portfolio.optimizer.enums.OptimizationStatus;

/**
 * Result of the public optimization entry point. Always carries a structurally valid
 * {@link OptimizationResult}; degraded calls are marked by their status instead of an exception.
 *
 * @param status           how the call ended
 * @param result           optimized result, or the neutral result for degraded calls
 * @param sharpeImprovement improvement versus the baseline, null for degraded calls
 * @param reason           explanation for degraded calls, null otherwise
 */
public record OptimizationOutcome(
        OptimizationStatus status,
        OptimizationResult result,
        SharpeImprovement sharpeImprovement,
        String reason
) {

    public static OptimizationOutcome optimized(OptimizationResult result, SharpeImprovement improvement) {
        return new OptimizationOutcome(OptimizationStatus.OPTIMIZED, result, improvement, null);
    }

    public static OptimizationOutcome insufficientData(OptimizationMethod method, String reason) {
        return new OptimizationOutcome(OptimizationStatus.INSUFFICIENT_DATA,
                OptimizationResult.neutral(method), null, reason);
    }

    public static OptimizationOutcome failed(OptimizationMethod method, String reason) {
        return new OptimizationOutcome(OptimizationStatus.FAILED,
                OptimizationResult.neutral(method), null, reason);
    }

    @JsonIgnore
    public boolean isDegraded() {
        return status != OptimizationStatus.OPTIMIZED;
    }
}
