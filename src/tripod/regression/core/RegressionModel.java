package tripod.regression.core;

/**
 * A closed-form function f(x; c) with analytic partial derivatives
 * with respect to each of its coefficients. Implementations must be
 * immutable; any constant (e.g., a fixed base) is set at construction.
 */
public interface RegressionModel {
    /**
     * f(x; c)
     */
    double evaluate (double x, double[] coefficients);

    /**
     * df(x; c)/dc_k for 0 <= k < getNumCoefficients(); any other k
     * throws IllegalArgumentException.
     */
    double partialDerivative (double x, int coefficientIndex,
                              double[] coefficients);

    int getNumCoefficients (); // number of coefficients c
}
