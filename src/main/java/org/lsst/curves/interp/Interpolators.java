package org.lsst.curves.interp;

import java.util.List;
import java.util.logging.Logger;
import org.lsst.curves.ControlPoint;
import org.lsst.curves.InterpolationMode;
import org.lsst.curves.InvalidCurveException;

/**
 * Builds interpolators from control points.
 */
public class Interpolators {

    private static final Logger LOG = Logger.getLogger(Interpolators.class.getName());

    private Interpolators() {
    }

    /**
     * Build an interpolator for the given points.
     *
     * @param points The control points, x values must be strictly increasing
     * @param mode The interpolation mode
     * @return The interpolator
     * @throws InvalidCurveException If there are too few points for the mode,
     * or the x values are not strictly increasing
     */
    public static Interpolator build(List<ControlPoint> points, InterpolationMode mode) {
        int n = points.size();
        if (n < mode.getMinimumPoints()) {
            throw new InvalidCurveException(String.format("Interpolation mode %s needs at least %d points, got %d", mode, mode.getMinimumPoints(), n));
        }
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            ControlPoint point = points.get(i);
            x[i] = point.getX();
            y[i] = point.getY();
            if (i > 0 && !(x[i] > x[i - 1])) {
                throw new InvalidCurveException("Control point x values must be strictly increasing, got " + points.get(i - 1) + " then " + point);
            }
        }
        LOG.fine(() -> String.format("Building %s interpolator for %d points", mode, n));
        return switch (mode) {
            case LINEAR ->
                new LinearInterpolator(x, y);
            case NEAREST ->
                new StepInterpolator(x, y, StepInterpolator.Step.NEAREST);
            case ZERO_ORDER_HOLD, PREVIOUS_VALUE ->
                new StepInterpolator(x, y, StepInterpolator.Step.PREVIOUS);
            case NEXT_VALUE ->
                new StepInterpolator(x, y, StepInterpolator.Step.NEXT);
            case SPLINE1, SPLINE2, SPLINE3 ->
                new BSplineInterpolator(x, y, mode.getSplineDegree());
            case LAGRANGE ->
                new LagrangeInterpolator(x, y);
        };
    }
}
