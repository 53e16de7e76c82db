package tw.gc.portfolio.optimizer.exceptions;

/**
 * Raised when no asset in the input has enough valid price points to form a return series.
 */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
