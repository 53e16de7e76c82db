package tw.gc.portfolio.optimizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import tw.gc.portfolio.optimizer.enums.BoundRepairMode;

/**
 * Externalized optimizer tunables bound from {@code optimizer.*}.
 * Converted once into an immutable {@link OptimizerConfig} at startup.
 */
@Data
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    private int maxIterations = 1000;
    private double tolerance = 1e-6;
    private double riskFreeRate = 0.02;
    private double maxPositionWeight = 0.20;
    private double minPositionWeight = 0.01;
    private double sharpeImprovementTarget = 0.20;

    /**
     * Risk aversion coefficient used for the Black-Litterman posterior.
     */
    private double riskAversion = 3.0;

    /**
     * Fallback baseline Sharpe when the equal-weight baseline is not positive.
     */
    private double baselineSharpe = 0.5;

    private BoundRepairMode boundRepair = BoundRepairMode.TWO_PASS;
}
