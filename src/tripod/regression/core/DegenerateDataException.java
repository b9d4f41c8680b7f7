package tripod.regression.core;

/**
 * Thrown when a statistic is undefined for the given data, e.g.,
 * R^2 over y values that are all identical.
 */
public class DegenerateDataException extends RuntimeException {
    private static final long serialVersionUID = 0x1c84e2d95a07b3e9l;

    public DegenerateDataException (String message) {
        super (message);
    }
}
