package tripod.regression.model;

import tripod.regression.core.RegressionModel;
import static java.lang.Math.log;
import static java.lang.Math.pow;

/**
 * Power law and exponentiation models. The power law forms a*x^b
 * are only defined for x > 0; a negative b gives the inverse form
 * a/x^|b|.
 *
 * The forms a*b^(c*x), a*b^(c*x + d) and a*b^(c*x + d) + g are
 * over-parameterized (b and c only ever appear as c*ln(b)) and
 * Gauss-Newton generally fails to converge on them.
 */
public class ExponentiationModels {
    private ExponentiationModels () {}

    /**
     * f(x) = a * x^b
     */
    static public class PowerLaw implements RegressionModel {
        public PowerLaw () {}

        public double evaluate (double x, double[] c) {
            return c[0] * pow (x, c[1]);
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0: return pow (x, c[1]);
            case 1: return c[0] * pow (x, c[1]) * log (x);
            }
            throw Models.badIndex(this, k, 2);
        }

        public int getNumCoefficients () { return 2; }
    }

    /**
     * f(x) = a * x^b + c
     */
    static public class PowerLawOffset implements RegressionModel {
        public PowerLawOffset () {}

        public double evaluate (double x, double[] c) {
            return c[0] * pow (x, c[1]) + c[2];
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0: return pow (x, c[1]);
            case 1: return c[0] * pow (x, c[1]) * log (x);
            case 2: return 1.;
            }
            throw Models.badIndex(this, k, 3);
        }

        public int getNumCoefficients () { return 3; }
    }

    /**
     * f(x) = a * n^(b * x) for a fixed base n > 0
     */
    static public class FixedBase implements RegressionModel {
        final double base;
        final double lnBase;

        public FixedBase (double base) {
            if (!(base > 0.) || Double.isInfinite(base)) {
                throw new IllegalArgumentException
                    ("Base must be positive and finite: "+base);
            }
            this.base = base;
            this.lnBase = log (base);
        }

        public double getBase () { return base; }

        public double evaluate (double x, double[] c) {
            return c[0] * pow (base, c[1] * x);
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0: return pow (base, c[1] * x);
            case 1: return c[0] * pow (base, c[1] * x) * x * lnBase;
            }
            throw Models.badIndex(this, k, 2);
        }

        public int getNumCoefficients () { return 2; }

        public String toString () {
            return "FixedBase{base="+base+"}";
        }
    }

    /**
     * f(x) = a * n^(b * x) + c for a fixed base n > 0
     */
    static public class FixedBaseOffset implements RegressionModel {
        final FixedBase fixed;

        public FixedBaseOffset (double base) {
            fixed = new FixedBase (base);
        }

        public double getBase () { return fixed.getBase(); }

        public double evaluate (double x, double[] c) {
            return fixed.evaluate(x, c) + c[2];
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0:
            case 1: return fixed.partialDerivative(x, k, c);
            case 2: return 1.;
            }
            throw Models.badIndex(this, k, 3);
        }

        public int getNumCoefficients () { return 3; }

        public String toString () {
            return "FixedBaseOffset{base="+getBase()+"}";
        }
    }

    /**
     * f(x) = a * b^x
     */
    static public class Power implements RegressionModel {
        public Power () {}

        public double evaluate (double x, double[] c) {
            return c[0] * pow (c[1], x);
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0: return pow (c[1], x);
            case 1: return c[0] * pow (c[1], x - 1.) * x;
            }
            throw Models.badIndex(this, k, 2);
        }

        public int getNumCoefficients () { return 2; }
    }

    /**
     * f(x) = a * b^(c * x); doesn't converge in practice
     */
    static public class ScaledPower implements RegressionModel {
        public ScaledPower () {}

        public double evaluate (double x, double[] c) {
            return c[0] * pow (c[1], c[2] * x);
        }

        public double partialDerivative (double x, int k, double[] c) {
            switch (k) {
            case 0: return pow (c[1], c[2] * x);
            case 1: return c[0] * pow (c[1], c[2] * x - 1.) * c[2] * x;
            case 2: return c[0] * pow (c[1], c[2] * x) * x * log (c[1]);
            }
            throw Models.badIndex(this, k, 3);
        }

        public int getNumCoefficients () { return 3; }
    }

    /**
     * f(x) = a * b^(c * x + d); doesn't converge in practice
     */
    static public class ShiftedPower implements RegressionModel {
        public ShiftedPower () {}

        public double evaluate (double x, double[] c) {
            return c[0] * pow (c[1], c[2] * x + c[3]);
        }

        public double partialDerivative (double x, int k, double[] c) {
            return shiftedPowerDerivative (this, x, k, c, 4);
        }

        public int getNumCoefficients () { return 4; }
    }

    /**
     * f(x) = a * b^(c * x + d) + g; doesn't converge in practice
     */
    static public class ShiftedPowerOffset implements RegressionModel {
        public ShiftedPowerOffset () {}

        public double evaluate (double x, double[] c) {
            return c[0] * pow (c[1], c[2] * x + c[3]) + c[4];
        }

        public double partialDerivative (double x, int k, double[] c) {
            if (k == 4) {
                return 1.;
            }
            return shiftedPowerDerivative (this, x, k, c, 5);
        }

        public int getNumCoefficients () { return 5; }
    }

    static double shiftedPowerDerivative (RegressionModel model, double x,
                                          int k, double[] c, int size) {
        double e = c[2] * x + c[3];
        switch (k) {
        case 0: return pow (c[1], e);
        case 1: return c[0] * pow (c[1], e - 1.) * e;
        case 2: return c[0] * pow (c[1], e) * x * log (c[1]);
        case 3: return c[0] * pow (c[1], e) * log (c[1]);
        }
        throw Models.badIndex(model, k, size);
    }
}
