package tripod.regression.core;

/**
 * An iterative least squares estimator over a fixed model. Each call
 * to refine performs exactly one step; it's up to the caller to
 * decide how many steps to run and when to stop.
 */
public interface Estimator {
    RegressionModel getModel ();

    /**
     * One refinement step from the given coefficients; the returned
     * array is new and the arguments are left untouched.
     */
    double[] refine (double[] x, double[] y, double[] coefficients);

    /**
     * Coefficient of determination of the model with the given
     * coefficients over (x, y)
     */
    double rSquared (double[] x, double[] y, double[] coefficients);
}
