package org.lsst.curves.interp;

/**
 * A function built from a fixed set of control points. Once built an
 * interpolator never changes, so it may be evaluated from several threads.
 */
public interface Interpolator {

    /**
     * Evaluate the function. Values outside the range of the control points
     * are extrapolated according to the interpolation mode, this method never
     * throws.
     *
     * @param x The domain value
     * @return The interpolated value, or NaN if x is NaN
     */
    double evaluate(double x);
}
