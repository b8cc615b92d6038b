package org.lsst.curves;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;
import org.lsst.curves.interp.Interpolator;
import org.lsst.curves.interp.Interpolators;

/**
 * A named, ordered list of control points which can be evaluated as a
 * function. The interpolator is built on first use and discarded whenever the
 * points or the interpolation mode change.
 *
 * Curves are not thread safe. Concurrent evaluation is fine once the
 * interpolator has been built (see {@link #rebuild()}), but mutation must be
 * synchronized externally, or done on a copy.
 */
public class Curve implements DoubleUnaryOperator {

    private final String name;
    private final List<ControlPoint> points;
    private InterpolationMode interpolationMode;
    private Interpolator interpolator;

    public Curve(String name) {
        this(name, Collections.emptyList());
    }

    public Curve(String name, List<ControlPoint> points) {
        this(name, points, InterpolationMode.getDefault());
    }

    public Curve(String name, List<ControlPoint> points, InterpolationMode interpolationMode) {
        this.name = Objects.requireNonNull(name, "name");
        this.points = new ArrayList<>(points);
        this.interpolationMode = Objects.requireNonNull(interpolationMode, "interpolationMode");
    }

    /**
     * Copy constructor. The copy shares nothing mutable with the original.
     *
     * @param other The curve to copy
     */
    public Curve(Curve other) {
        this(other.name, other.points, other.interpolationMode);
    }

    public String getName() {
        return name;
    }

    public int size() {
        return points.size();
    }

    public ControlPoint getPoint(int index) {
        return points.get(index);
    }

    /**
     * @return A read-only view of the control points
     */
    public List<ControlPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public void append(ControlPoint point) {
        points.add(Objects.requireNonNull(point, "point"));
        invalidate();
    }

    public void append(int x, int y) {
        append(new ControlPoint(x, y));
    }

    public void insert(int index, ControlPoint point) {
        points.add(index, Objects.requireNonNull(point, "point"));
        invalidate();
    }

    public ControlPoint remove(int index) {
        ControlPoint removed = points.remove(index);
        invalidate();
        return removed;
    }

    public InterpolationMode getInterpolationMode() {
        return interpolationMode;
    }

    public void setInterpolationMode(InterpolationMode interpolationMode) {
        if (this.interpolationMode != Objects.requireNonNull(interpolationMode, "interpolationMode")) {
            this.interpolationMode = interpolationMode;
            invalidate();
        }
    }

    private void invalidate() {
        interpolator = null;
    }

    /**
     * Build the interpolator now rather than on the next evaluation.
     *
     * @return The freshly built interpolator
     * @throws InvalidCurveException If the points do not suit the mode
     */
    public Interpolator rebuild() {
        interpolator = Interpolators.build(points, interpolationMode);
        return interpolator;
    }

    /**
     * Evaluate the curve at x, building the interpolator if needed.
     *
     * @param x The domain value
     * @return The interpolated value
     * @throws InvalidCurveException If the points do not suit the mode
     */
    public double evaluate(double x) {
        Interpolator current = interpolator;
        if (current == null) {
            current = rebuild();
        }
        return current.evaluate(x);
    }

    @Override
    public double applyAsDouble(double operand) {
        return evaluate(operand);
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 29 * hash + Objects.hashCode(this.name);
        hash = 29 * hash + Objects.hashCode(this.points);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Curve other = (Curve) obj;
        return Objects.equals(this.name, other.name) && Objects.equals(this.points, other.points);
    }

    @Override
    public String toString() {
        return "Curve{" + "name=" + name + ", mode=" + interpolationMode + ", points=" + points + '}';
    }
}
