package tw.gc.portfolio.optimizer.config;

import lombok.Builder;
import tw.gc.portfolio.optimizer.enums.BoundRepairMode;

/**
 * Immutable, validated optimizer configuration shared by all services.
 *
 * <p>Validated once on construction; services never re-read properties per call.
 */
@Builder(toBuilder = true)
public record OptimizerConfig(
        int maxIterations,
        double tolerance,
        double riskFreeRate,
        double maxPositionWeight,
        double minPositionWeight,
        double sharpeImprovementTarget,
        double riskAversion,
        double baselineSharpe,
        BoundRepairMode boundRepair
) {

    public OptimizerConfig {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("tolerance must be positive: " + tolerance);
        }
        if (!Double.isFinite(riskFreeRate)) {
            throw new IllegalArgumentException("riskFreeRate must be finite");
        }
        if (minPositionWeight < 0.0 || maxPositionWeight > 1.0 || minPositionWeight > maxPositionWeight) {
            throw new IllegalArgumentException(String.format(
                    "Position bounds must satisfy 0 <= min <= max <= 1 (min=%.4f, max=%.4f)",
                    minPositionWeight, maxPositionWeight));
        }
        if (!(riskAversion > 0.0)) {
            throw new IllegalArgumentException("riskAversion must be positive: " + riskAversion);
        }
        if (!(baselineSharpe > 0.0)) {
            throw new IllegalArgumentException("baselineSharpe must be positive: " + baselineSharpe);
        }
        if (boundRepair == null) {
            boundRepair = BoundRepairMode.TWO_PASS;
        }
    }

    /**
     * Builder pre-populated with the documented defaults.
     */
    public static OptimizerConfigBuilder builder() {
        return new OptimizerConfigBuilder()
                .maxIterations(1000)
                .tolerance(1e-6)
                .riskFreeRate(0.02)
                .maxPositionWeight(0.20)
                .minPositionWeight(0.01)
                .sharpeImprovementTarget(0.20)
                .riskAversion(3.0)
                .baselineSharpe(0.5)
                .boundRepair(BoundRepairMode.TWO_PASS);
    }

    public static OptimizerConfig defaults() {
        return builder().build();
    }

    public static OptimizerConfig from(OptimizerProperties properties) {
        return builder()
                .maxIterations(properties.getMaxIterations())
                .tolerance(properties.getTolerance())
                .riskFreeRate(properties.getRiskFreeRate())
                .maxPositionWeight(properties.getMaxPositionWeight())
                .minPositionWeight(properties.getMinPositionWeight())
                .sharpeImprovementTarget(properties.getSharpeImprovementTarget())
                .riskAversion(properties.getRiskAversion())
                .baselineSharpe(properties.getBaselineSharpe())
                .boundRepair(properties.getBoundRepair())
                .build();
    }
}
