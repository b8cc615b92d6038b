package org.lsst.curves.interp;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunctionLagrangeForm;

/**
 * The single polynomial of degree n-1 through all n control points. Evaluation
 * uses Neville's algorithm, O(n^2) per call, and returns the control point's y
 * exactly when x hits one of the control points. Far outside the control
 * points the polynomial can grow very quickly.
 */
public class LagrangeInterpolator implements Interpolator {

    private final PolynomialFunctionLagrangeForm polynomial;
    private final double constant;

    LagrangeInterpolator(double[] x, double[] y) {
        // commons-math needs at least two points
        if (x.length == 1) {
            polynomial = null;
            constant = y[0];
        } else {
            polynomial = new PolynomialFunctionLagrangeForm(x, y);
            constant = Double.NaN;
        }
    }

    @Override
    public double evaluate(double value) {
        if (Double.isNaN(value)) {
            return Double.NaN;
        }
        return polynomial == null ? constant : polynomial.value(value);
    }

    /**
     * The polynomial coefficients, lowest order first.
     *
     * @return The coefficients
     */
    public double[] getCoefficients() {
        return polynomial == null ? new double[]{constant} : polynomial.getCoefficients();
    }

    @Override
    public String toString() {
        return "LagrangeInterpolator{" + "degree=" + (polynomial == null ? 0 : polynomial.degree()) + '}';
    }
}
