package tw.gc.portfolio.optimizer.enums;

/**
 * How post-processing forces weights back into [minPositionWeight, maxPositionWeight].
 */
public enum BoundRepairMode {
    /**
     * Min-clamp, renormalize, max-clamp, renormalize. Bounds may be missed by a small
     * margin after the second renormalization.
     */
    TWO_PASS,

    /**
     * Euclidean projection onto the bounded simplex (water-filling). Exact whenever
     * the bounds are feasible.
     */
    PROJECTION
}
