package tripod.regression.model;

import tripod.regression.core.RegressionModel;
import static java.lang.Math.exp;

/**
 * Exponential growth and decay models. The forms with a coefficient
 * inside the exponent (a*exp(b*x + c) + d and its decay counterpart)
 * are over-parameterized: a and c scale the curve the same way, so
 * J^T J is (nearly) singular and Gauss-Newton generally fails to
 * converge on them.
 */
public class ExponentialModels {
    private ExponentialModels () {}

    /**
     * f(x) = a * exp(b * x)
     */
    static public class Exponential implements RegressionModel {
        public Exponential () {}

        public double evaluate (double x, double[] c) {
            return c[0] * exp (c[1] * x);
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0: return exp (c[1] * x);
            case 1: return c[0] * x * exp (c[1] * x);
            }
            throw Models.badIndex(this, k, 2);
        }

        public int getNumCoefficients () { return 2; }
    }

    /**
     * f(x) = a * exp(b * x) + c
     */
    static public class ExponentialOffset implements RegressionModel {
        public ExponentialOffset () {}

        public double evaluate (double x, double[] c) {
            return c[0] * exp (c[1] * x) + c[2];
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0: return exp (c[1] * x);
            case 1: return c[0] * x * exp (c[1] * x);
            case 2: return 1.;
            }
            throw Models.badIndex(this, k, 3);
        }

        public int getNumCoefficients () { return 3; }
    }

    /**
     * f(x) = a * exp(b * x + c) + d; doesn't converge in practice
     */
    static public class ShiftedExponentialOffset implements RegressionModel {
        public ShiftedExponentialOffset () {}

        public double evaluate (double x, double[] c) {
            return c[0] * exp (c[1] * x + c[2]) + c[3];
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0: return exp (c[1] * x + c[2]);
            case 1: return c[0] * x * exp (c[1] * x + c[2]);
            case 2: return c[0] * exp (c[1] * x + c[2]);
            case 3: return 1.;
            }
            throw Models.badIndex(this, k, 4);
        }

        public int getNumCoefficients () { return 4; }
    }

    /**
     * f(x) = a * (1 - exp(b * x))
     */
    static public class ExponentialDecay implements RegressionModel {
        public ExponentialDecay () {}

        public double evaluate (double x, double[] c) {
            return c[0] * (1. - exp (c[1] * x));
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0: return 1. - exp (c[1] * x);
            case 1: return -c[0] * x * exp (c[1] * x);
            }
            throw Models.badIndex(this, k, 2);
        }

        public int getNumCoefficients () { return 2; }
    }

    /**
     * f(x) = a * (1 - exp(b * x)) + c
     */
    static public class ExponentialDecayOffset implements RegressionModel {
        public ExponentialDecayOffset () {}

        public double evaluate (double x, double[] c) {
            return c[0] * (1. - exp (c[1] * x)) + c[2];
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0: return 1. - exp (c[1] * x);
            case 1: return -c[0] * x * exp (c[1] * x);
            case 2: return 1.;
            }
            throw Models.badIndex(this, k, 3);
        }

        public int getNumCoefficients () { return 3; }
    }

    /**
     * f(x) = a * (1 - exp(b * x + c)) + d; doesn't converge in practice
     */
    static public class ShiftedExponentialDecayOffset
        implements RegressionModel {
        public ShiftedExponentialDecayOffset () {}

        public double evaluate (double x, double[] c) {
            return c[0] * (1. - exp (c[1] * x + c[2])) + c[3];
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0: return 1. - exp (c[1] * x + c[2]);
            case 1: return -c[0] * x * exp (c[1] * x + c[2]);
            case 2: return -c[0] * exp (c[1] * x + c[2]);
            case 3: return 1.;
            }
            throw Models.badIndex(this, k, 4);
        }

        public int getNumCoefficients () { return 4; }
    }
}
