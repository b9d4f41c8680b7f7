package tripod.regression.core;

/**
 * Thrown by {@link LinearSolver} when no pivot can be found for a
 * column of the system being solved, and by
 * {@link GaussNewtonEstimator} when the normal equations are so
 * ill-conditioned that the step for a coefficient isn't finite.
 */
public class SingularMatrixException extends RuntimeException {
    private static final long serialVersionUID = 0x5e3a91c07b2d4f61l;

    private final int column;

    public SingularMatrixException (int column) {
        super ("Matrix is singular; no pivot for column "+column);
        this.column = column;
    }

    public SingularMatrixException (int column, String message) {
        super (message);
        this.column = column;
    }

    public int getColumn () { return column; }
}
