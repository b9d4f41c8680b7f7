package tripod.regression.core;

/**
 * An interface for scoring a model fit
 */
public interface FitScore {
    double eval (RegressionModel model, double[] x, double[] y,
                 double[] coefficients);
}
