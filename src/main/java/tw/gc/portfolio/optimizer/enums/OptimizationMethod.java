package tw.gc.portfolio.optimizer.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Objective profiles supported by the weight optimizer.
 * All share the sum-to-one and per-asset bound constraints.
 */
public enum OptimizationMethod {
    /**
     * Maximize (w'mu - rf) / sqrt(w'Sw)
     */
    MAX_SHARPE("max_sharpe", false),

    /**
     * Minimize w'Sw, optionally pinned to a target return
     */
    MEAN_VARIANCE("mean_variance", false),

    /**
     * Max-Sharpe on the simplified Black-Litterman posterior (no views vector)
     */
    BLACK_LITTERMAN("black_litterman", false),

    /**
     * Inverse-volatility weights, no iterative solve
     */
    RISK_PARITY("risk_parity", true),

    /**
     * Minimize the variance of per-asset risk contributions
     */
    EQUAL_RISK_CONTRIBUTION("equal_risk_contribution", false);

    private final String code;
    private final boolean closedForm;

    OptimizationMethod(String code, boolean closedForm) {
        this.code = code;
        this.closedForm = closedForm;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isClosedForm() {
        return closedForm;
    }

    /**
     * Parse from code or enum name (case-insensitive). Unknown or null values map to MAX_SHARPE.
     */
    @JsonCreator
    public static OptimizationMethod fromCode(String value) {
        if (value == null) {
            return MAX_SHARPE;
        }
        for (OptimizationMethod method : values()) {
            if (method.code.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value)) {
                return method;
            }
        }
        return MAX_SHARPE;
    }
}
