package org.lsst.curves.interp;

import java.util.Arrays;

/**
 * Step functions which take the value of one of the control points. Outside
 * the control points the value of the first or last point is used.
 */
public class StepInterpolator implements Interpolator {

    public enum Step {
        /**
         * The closest point, ties go to the lower point.
         */
        NEAREST,
        /**
         * The last point at or below x. Also serves as the zero order hold.
         */
        PREVIOUS,
        /**
         * The first point at or above x.
         */
        NEXT
    }

    private final double[] x;
    private final double[] y;
    private final Step step;

    StepInterpolator(double[] x, double[] y, Step step) {
        this.x = x;
        this.y = y;
        this.step = step;
    }

    @Override
    public double evaluate(double value) {
        if (Double.isNaN(value)) {
            return Double.NaN;
        }
        int last = x.length - 1;
        if (value <= x[0]) {
            return y[0];
        } else if (value >= x[last]) {
            return y[last];
        }
        int binarySearch = Arrays.binarySearch(x, value);
        if (binarySearch >= 0) {
            return y[binarySearch];
        }
        // x[upper - 1] < value < x[upper]
        int upper = -binarySearch - 1;
        return switch (step) {
            case PREVIOUS ->
                y[upper - 1];
            case NEXT ->
                y[upper];
            default ->
                value - x[upper - 1] <= x[upper] - value ? y[upper - 1] : y[upper];
        };
    }

    public Step getStep() {
        return step;
    }

    @Override
    public String toString() {
        return "StepInterpolator{" + "step=" + step + ", points=" + x.length + '}';
    }
}
