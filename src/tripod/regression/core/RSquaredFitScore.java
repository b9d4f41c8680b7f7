package tripod.regression.core;

import org.apache.commons.math.stat.StatUtils;

/**
 * Coefficient of determination
 *
 *    R^2 = 1 - RSS/TSS
 *
 * where RSS = sum_{i} (y_i - f(x_i; c))^2 is the residual sum of
 * squares and TSS = sum_{i} (y_i - mean(y))^2 is the total sum of
 * squares. The score is typically within [0, 1] but is negative for
 * fits that do worse than the mean of y. It is undefined when all y
 * values are the same, in which case DegenerateDataException is
 * thrown.
 */
public class RSquaredFitScore implements FitScore {

    public RSquaredFitScore () {
    }

    public double eval (RegressionModel model, double[] x, double[] y,
                        double[] coefficients) {
        GaussNewtonEstimator.checkArguments (model, x, y, coefficients);
        if (StatUtils.min(y) == StatUtils.max(y)) {
            throw new DegenerateDataException
                ("R^2 is undefined; all "+y.length
                 +" y value(s) are "+y[0]);
        }

        double[] residuals = GaussNewtonEstimator.residuals
            (model, x, y, coefficients);
        double mean = StatUtils.mean(y);
        double tss = 0., rss = 0.;
        for (int i = 0; i < y.length; ++i) {
            double d = y[i] - mean;
            tss += d * d;
            rss += residuals[i] * residuals[i];
        }

        if (tss == 0.) {
            throw new DegenerateDataException
                ("R^2 is undefined; total sum of squares is zero");
        }

        return 1. - rss / tss;
    }
}
