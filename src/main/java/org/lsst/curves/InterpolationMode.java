package org.lsst.curves;

/**
 * The ways a curve can fill in values between its control points. A curve set
 * uses a single mode for all of its curves.
 */
public enum InterpolationMode {

    LINEAR("linear"),
    NEAREST("nearest"),
    ZERO_ORDER_HOLD("zero"),
    SPLINE1("slinear"),
    SPLINE2("quadratic"),
    SPLINE3("cubic"),
    PREVIOUS_VALUE("previous"),
    NEXT_VALUE("next"),
    LAGRANGE("lagrange");

    /**
     * System property used to choose the mode when none is given explicitly.
     */
    public static final String DEFAULT_MODE_PROPERTY = "org.lsst.curves.interpolationMode";

    private final String label;

    InterpolationMode(String label) {
        this.label = label;
    }

    /**
     * The polynomial degree of the spline modes, or -1 for the other modes.
     *
     * @return The spline degree
     */
    public int getSplineDegree() {
        return switch (this) {
            case SPLINE1 ->
                1;
            case SPLINE2 ->
                2;
            case SPLINE3 ->
                3;
            default ->
                -1;
        };
    }

    /**
     * The fewest control points a curve needs before it can be evaluated in
     * this mode.
     *
     * @return The minimum number of points
     */
    public int getMinimumPoints() {
        int degree = getSplineDegree();
        return degree < 0 ? 1 : degree + 1;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Look up a mode by its enum name or its short label (e.g. "cubic").
     *
     * @param name The name to look up
     * @return The corresponding mode
     */
    public static InterpolationMode forName(String name) {
        for (InterpolationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name) || mode.label.equalsIgnoreCase(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown interpolation mode: " + name);
    }

    /**
     * The mode used when a curve set is created without one, LAGRANGE unless
     * overridden with the {@value #DEFAULT_MODE_PROPERTY} system property.
     *
     * @return The default mode
     */
    public static InterpolationMode getDefault() {
        return forName(System.getProperty(DEFAULT_MODE_PROPERTY, LAGRANGE.name()));
    }

    @Override
    public String toString() {
        return label;
    }
}
