package tripod.regression.core;

import java.util.Arrays;
import java.util.logging.Logger;
import java.util.logging.Level;

/**
 * Gauss-Newton non-linear least squares. Each call to refine
 * linearizes the model around the current coefficients c and
 * computes
 *
 *    c' = c + (J^T J)^-1 J^T r(c)
 *
 * where J is the n x m Jacobian with J_ik = df(x_i; c)/dc_k and r is
 * the n x 1 residual with r_i = y_i - f(x_i; c). The normal equations
 * are solved with {@link LinearSolver}, so a rank deficient J^T J
 * (too few, duplicate or linearly dependent points, or coefficients
 * that zero out a derivative) results in SingularMatrixException,
 * as does a step that overflows to a non-finite coefficient.
 *
 * This class has no mutable state; instances can be shared across
 * threads as long as the model is immutable.
 */
public class GaussNewtonEstimator implements Estimator {
    private static final Logger logger =
        Logger.getLogger(GaussNewtonEstimator.class.getName());

    static int DEBUG = 0;
    static {
        try {
            DEBUG = Integer.getInteger("regression.debug", 0);
        }
        catch (SecurityException ex) {
            logger.log(Level.WARNING,
                       "Can't read regression.debug; debugging is off", ex);
        }
    }

    private final RegressionModel model;
    private final FitScore scorer;

    public GaussNewtonEstimator (RegressionModel model) {
        this (model, new RSquaredFitScore ());
    }

    public GaussNewtonEstimator (RegressionModel model, FitScore scorer) {
        if (model == null) {
            throw new IllegalArgumentException ("Model is null");
        }
        if (scorer == null) {
            throw new IllegalArgumentException ("Scorer is null");
        }
        this.model = model;
        this.scorer = scorer;
    }

    public RegressionModel getModel () { return model; }
    public FitScore getScorer () { return scorer; }

    public double[] refine (double[] x, double[] y, double[] coefficients) {
        checkArguments (model, x, y, coefficients);

        double[][] jacobian = jacobian (model, x, coefficients);
        double[][] residual = Matrices.column
            (residuals (model, x, y, coefficients));

        double[][] jt = Matrices.transpose(jacobian);
        double[][] delta = LinearSolver.solve
            (Matrices.multiply(jt, jacobian), Matrices.multiply(jt, residual));

        double[] refined = coefficients.clone();
        for (int k = 0; k < refined.length; ++k) {
            refined[k] += delta[k][0];
            if (Double.isNaN(refined[k]) || Double.isInfinite(refined[k])) {
                throw new SingularMatrixException
                    (k, "Step for coefficient "+k+" is "+delta[k][0]
                     +"; normal equations are ill-conditioned");
            }
        }

        if (DEBUG > 0) {
            logger.info(model.getClass().getSimpleName()+": "+x.length
                        +" point(s) "+Arrays.toString(coefficients)
                        +" => "+Arrays.toString(refined));
        }
        else if (logger.isLoggable(Level.FINE)) {
            logger.fine(model.getClass().getSimpleName()+": "+x.length
                        +" point(s) delta="+Arrays.toString
                        (Matrices.transpose(delta)[0]));
        }

        return refined;
    }

    public double[] refine (Sample sample, double[] coefficients) {
        return refine (sample.getX(), sample.getY(), coefficients);
    }

    public double rSquared (double[] x, double[] y, double[] coefficients) {
        return scorer.eval(model, x, y, coefficients);
    }

    public double rSquared (Sample sample, double[] coefficients) {
        return rSquared (sample.getX(), sample.getY(), coefficients);
    }

    /*
     * n x m matrix of partial derivatives
     */
    static double[][] jacobian (RegressionModel model, double[] x,
                                double[] coefficients) {
        int m = model.getNumCoefficients();
        double[][] jacobian = new double[x.length][m];
        for (int i = 0; i < x.length; ++i) {
            for (int k = 0; k < m; ++k) {
                double d = model.partialDerivative(x[i], k, coefficients);
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new IllegalArgumentException
                        ("Partial derivative "+k+" at point "+i+" (x="
                         +x[i]+") is "+d);
                }
                jacobian[i][k] = d;
            }
        }
        return jacobian;
    }

    /*
     * y_i - f(x_i; c)
     */
    static double[] residuals (RegressionModel model, double[] x,
                               double[] y, double[] coefficients) {
        double[] r = new double[x.length];
        for (int i = 0; i < x.length; ++i) {
            r[i] = y[i] - model.evaluate(x[i], coefficients);
            if (Double.isNaN(r[i]) || Double.isInfinite(r[i])) {
                throw new IllegalArgumentException
                    ("Residual at point "+i+" (x="+x[i]+") is "+r[i]);
            }
        }
        return r;
    }

    static void checkArguments (RegressionModel model, double[] x,
                                double[] y, double[] coefficients) {
        if (x == null || y == null || coefficients == null) {
            throw new IllegalArgumentException
                ("Data and coefficients must not be null");
        }
        if (x.length != y.length) {
            throw new IllegalArgumentException
                ("Sample has "+x.length+" x value(s) but "
                 +y.length+" y value(s)");
        }
        if (x.length == 0) {
            throw new IllegalArgumentException ("Sample is empty");
        }
        if (coefficients.length != model.getNumCoefficients()) {
            throw new IllegalArgumentException
                ("Model "+model.getClass().getSimpleName()+" has "
                 +model.getNumCoefficients()+" coefficient(s); got "
                 +coefficients.length);
        }
    }
}
