package tripod.regression.model;

import tripod.regression.core.RegressionModel;
import static java.lang.Math.cos;
import static java.lang.Math.exp;
import static java.lang.Math.sin;

/**
 * Exponentially damped (or growing) oscillations. These converge
 * only from an initial guess whose frequency c is already close; a
 * guess off by more than a fraction of a period usually lands on a
 * local minimum.
 */
public class SineModels {
    private SineModels () {}

    /**
     * f(x) = a * exp(b * x) * sin(c * x + d)
     */
    static public class DampedSine implements RegressionModel {
        public DampedSine () {}

        public double evaluate (double x, double[] c) {
            return c[0] * exp (c[1] * x) * sin (c[2] * x + c[3]);
        }

        public double partialDerivative (double x, int k, double[] c) {
            double e = exp (c[1] * x);
            double t = c[2] * x + c[3];
            switch (k) {
            case 0: return e * sin (t);
            case 1: return c[0] * x * e * sin (t);
            case 2: return c[0] * x * e * cos (t);
            case 3: return c[0] * e * cos (t);
            }
            throw Models.badIndex(this, k, 4);
        }

        public int getNumCoefficients () { return 4; }
    }

    /**
     * f(x) = a * exp(b * x) * (cos(c * x) + sin(c * x))
     */
    static public class DampedSineCosine implements RegressionModel {
        public DampedSineCosine () {}

        public double evaluate (double x, double[] c) {
            return c[0] * exp (c[1] * x) * (cos (c[2] * x) + sin (c[2] * x));
        }

        public double partialDerivative (double x, int k, double[] c) {
            double e = exp (c[1] * x);
            double t = c[2] * x;
            switch (k) {
            case 0: return e * (cos (t) + sin (t));
            case 1: return c[0] * x * e * (cos (t) + sin (t));
            case 2: return c[0] * x * e * (cos (t) - sin (t));
            }
            throw Models.badIndex(this, k, 3);
        }

        public int getNumCoefficients () { return 3; }
    }

    /**
     * f(x) = a * exp(b * x) * (cos(c * x + d) + sin(c * x + d))
     */
    static public class ShiftedDampedSineCosine implements RegressionModel {
        public ShiftedDampedSineCosine () {}

        public double evaluate (double x, double[] c) {
            double t = c[2] * x + c[3];
            return c[0] * exp (c[1] * x) * (cos (t) + sin (t));
        }

        public double partialDerivative (double x, int k, double[] c) {
            double e = exp (c[1] * x);
            double t = c[2] * x + c[3];
            switch (k) {
            case 0: return e * (cos (t) + sin (t));
            case 1: return c[0] * x * e * (cos (t) + sin (t));
            case 2: return c[0] * x * e * (cos (t) - sin (t));
            case 3: return c[0] * e * (cos (t) - sin (t));
            }
            throw Models.badIndex(this, k, 4);
        }

        public int getNumCoefficients () { return 4; }
    }
}
