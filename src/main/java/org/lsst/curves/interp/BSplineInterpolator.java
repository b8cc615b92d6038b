package org.lsst.curves.interp;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.lsst.curves.InvalidCurveException;

/**
 * Interpolating B-spline of degree 1, 2 or 3 passing through every control
 * point.
 *
 * The knot vector repeats the end points degree+1 times. For odd degrees the
 * interior knots are the control point x values with the points next to each
 * end dropped ("not-a-knot"). For degree 2 the interior knots are the
 * midpoints between control points, again dropping the first and last
 * midpoint. The coefficients come from solving the collocation system
 * {@code B(x[i]) . c = y[i]}.
 *
 * Outside the control points the polynomial of the first or last knot span is
 * continued, so for degrees 2 and 3 the curve is not clamped.
 */
public class BSplineInterpolator implements Interpolator {

    private final int degree;
    private final double[] knots;
    private final double[] coefficients;

    BSplineInterpolator(double[] x, double[] y, int degree) {
        if (degree < 1 || degree > 3) {
            throw new IllegalArgumentException("Unsupported spline degree: " + degree);
        }
        if (x.length < degree + 1) {
            throw new InvalidCurveException("Spline of degree " + degree + " needs at least " + (degree + 1) + " points, got " + x.length);
        }
        this.degree = degree;
        this.knots = computeKnots(x, degree);
        this.coefficients = solve(x, y);
    }

    private static double[] computeKnots(double[] x, int k) {
        int n = x.length;
        double[] t = new double[n + k + 1];
        for (int i = 0; i <= k; i++) {
            t[i] = x[0];
            t[n + i] = x[n - 1];
        }
        if (k % 2 == 1) {
            int m = (k - 1) / 2;
            // n - k - 1 interior knots x[m+1] .. x[n-m-2]
            System.arraycopy(x, m + 1, t, k + 1, n - k - 1);
        } else {
            // midpoints between neighbours, without the first and last one
            for (int i = 1; i < n - 2; i++) {
                t[k + i] = (x[i] + x[i + 1]) / 2;
            }
        }
        return t;
    }

    private double[] solve(double[] x, double[] y) {
        int n = x.length;
        double[][] collocation = new double[n][n];
        double[] basis = new double[degree + 1];
        for (int i = 0; i < n; i++) {
            int span = findSpan(x[i], n);
            basisFunctions(span, x[i], basis);
            System.arraycopy(basis, 0, collocation[i], span - degree, degree + 1);
        }
        try {
            LUDecomposition lu = new LUDecomposition(new Array2DRowRealMatrix(collocation, false));
            return lu.getSolver().solve(new ArrayRealVector(y, false)).toArray();
        } catch (SingularMatrixException ex) {
            throw new InvalidCurveException("Control points do not define a spline of degree " + degree, ex);
        }
    }

    /**
     * Find the knot span used to evaluate at value. Values outside the
     * control points use the first or last span.
     */
    private int findSpan(double value, int n) {
        if (value >= knots[n]) {
            return n - 1;
        } else if (value <= knots[degree]) {
            return degree;
        }
        int low = degree;
        int high = n;
        while (high - low > 1) {
            int mid = (low + high) >>> 1;
            if (value < knots[mid]) {
                high = mid;
            } else {
                low = mid;
            }
        }
        return low;
    }

    /**
     * Cox-de Boor recursion for the degree+1 basis functions which are
     * non-zero on the given span. basis[r] belongs to coefficient span-degree+r.
     */
    private void basisFunctions(int span, double value, double[] basis) {
        double[] left = new double[degree + 1];
        double[] right = new double[degree + 1];
        basis[0] = 1.0;
        for (int j = 1; j <= degree; j++) {
            left[j] = value - knots[span + 1 - j];
            right[j] = knots[span + j] - value;
            double saved = 0.0;
            for (int r = 0; r < j; r++) {
                double temp = basis[r] / (right[r + 1] + left[j - r]);
                basis[r] = saved + right[r + 1] * temp;
                saved = left[j - r] * temp;
            }
            basis[j] = saved;
        }
    }

    @Override
    public double evaluate(double value) {
        if (Double.isNaN(value)) {
            return Double.NaN;
        }
        int span = findSpan(value, coefficients.length);
        double[] basis = new double[degree + 1];
        basisFunctions(span, value, basis);
        double result = 0;
        for (int r = 0; r <= degree; r++) {
            result += coefficients[span - degree + r] * basis[r];
        }
        return result;
    }

    public int getDegree() {
        return degree;
    }

    @Override
    public String toString() {
        return "BSplineInterpolator{" + "degree=" + degree + ", points=" + coefficients.length + '}';
    }
}
