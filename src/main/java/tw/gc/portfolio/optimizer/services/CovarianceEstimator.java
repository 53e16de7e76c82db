package tw.gc.portfolio.optimizer.services;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.springframework.stereotype.Service;
import tw.gc.portfolio.optimizer.AppConstants;
import tw.gc.portfolio.optimizer.model.ReturnMatrix;

/**
 * Sample covariance of the return matrix, repaired to be positive definite.
 *
 * <p>Short or noisy windows routinely yield near-singular sample covariances, and rounding
 * can push eigenvalues below zero. Every eigenvalue is floored at
 * {@value AppConstants#EIGENVALUE_FLOOR} so sqrt(w'Sw) is always defined downstream.
 */
@Service
@Slf4j
public class CovarianceEstimator {

    /**
     * Sample covariance (n - 1 denominator) of the rows of the matrix, then {@link #repair}.
     */
    public RealMatrix estimate(ReturnMatrix returns) {
        int n = returns.assetCount();
        if (n == 0) {
            return new Array2DRowRealMatrix();
        }

        RealMatrix sample;
        if (returns.length() < 2) {
            log.debug("Only {} return samples; using a zero covariance before repair", returns.length());
            sample = MatrixUtils.createRealMatrix(n, n);
        } else {
            sample = new Covariance(returns.toObservations(), true).getCovarianceMatrix();
        }
        return repair(sample);
    }

    /**
     * Floor every eigenvalue at {@value AppConstants#EIGENVALUE_FLOOR} and rebuild V * diag(l) * V'.
     * Returns the input unchanged when it has non-finite entries or the decomposition fails.
     */
    public RealMatrix repair(RealMatrix matrix) {
        if (matrix.getRowDimension() == 0) {
            return matrix;
        }
        if (!isFinite(matrix)) {
            log.error("Covariance matrix has non-finite entries; using the unrepaired matrix");
            return matrix;
        }
        try {
            RealMatrix symmetric = symmetrize(matrix);
            EigenDecomposition eigen = new EigenDecomposition(symmetric);
            double[] eigenvalues = eigen.getRealEigenvalues();

            int floored = 0;
            double[] repaired = new double[eigenvalues.length];
            for (int i = 0; i < eigenvalues.length; i++) {
                if (!(eigenvalues[i] >= AppConstants.EIGENVALUE_FLOOR)) {
                    floored++;
                }
                repaired[i] = Math.max(eigenvalues[i], AppConstants.EIGENVALUE_FLOOR);
            }
            if (floored > 0) {
                log.debug("Covariance repair floored {} of {} eigenvalues", floored, eigenvalues.length);
            }

            RealMatrix rebuilt = eigen.getV()
                    .multiply(MatrixUtils.createRealDiagonalMatrix(repaired))
                    .multiply(eigen.getVT());
            return symmetrize(rebuilt);
        } catch (RuntimeException e) {
            log.error("Covariance eigen-decomposition failed; using the unrepaired matrix: {}", e.getMessage());
            return matrix;
        }
    }

    private static boolean isFinite(RealMatrix matrix) {
        for (double[] row : matrix.getData()) {
            for (double value : row) {
                if (!Double.isFinite(value)) {
                    return false;
                }
            }
        }
        return true;
    }

    private RealMatrix symmetrize(RealMatrix matrix) {
        return matrix.add(matrix.transpose()).scalarMultiply(0.5);
    }
}
