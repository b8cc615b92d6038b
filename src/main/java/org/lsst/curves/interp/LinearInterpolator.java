package org.lsst.curves.interp;

import java.util.Arrays;

/**
 * Piecewise linear interpolation. Outside the control points the first or last
 * segment is extended.
 */
public class LinearInterpolator implements Interpolator {

    private final double[] x;
    private final double[] y;

    LinearInterpolator(double[] x, double[] y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public double evaluate(double value) {
        if (Double.isNaN(value)) {
            return Double.NaN;
        }
        if (x.length == 1) {
            return y[0];
        }
        int binarySearch = Arrays.binarySearch(x, value);
        if (binarySearch >= 0) {
            return y[binarySearch];
        }
        int upper = Math.max(1, Math.min(x.length - 1, -binarySearch - 1));
        int lower = upper - 1;
        double x1 = x[lower];
        double x2 = x[upper];
        double y1 = y[lower];
        double y2 = y[upper];
        return y1 + (y2 - y1) * (value - x1) / (x2 - x1);
    }

    @Override
    public String toString() {
        return "LinearInterpolator{" + "points=" + x.length + '}';
    }
}
