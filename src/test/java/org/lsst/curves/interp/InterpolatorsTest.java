package org.lsst.curves.interp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import org.lsst.curves.ControlPoint;
import org.lsst.curves.InterpolationMode;
import org.lsst.curves.InvalidCurveException;

/**
 *
 */
public class InterpolatorsTest {

    private static final double TOLERANCE = 1e-6;

    private static final List<ControlPoint> TONE = Arrays.asList(
            new ControlPoint(0, 0),
            new ControlPoint(64, 40),
            new ControlPoint(128, 150),
            new ControlPoint(192, 210),
            new ControlPoint(255, 255));

    private static List<ControlPoint> polynomial(int n, int power) {
        List<ControlPoint> points = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            points.add(new ControlPoint(i, (int) Math.pow(i, power)));
        }
        return points;
    }

    @Test
    public void testExactFitAtControlPoints() {
        for (InterpolationMode mode : InterpolationMode.values()) {
            Interpolator interpolator = Interpolators.build(TONE, mode);
            for (ControlPoint point : TONE) {
                assertEquals(mode + " at " + point, point.getY(), interpolator.evaluate(point.getX()), TOLERANCE);
            }
        }
    }

    @Test
    public void testLinear() {
        Interpolator linear = Interpolators.build(TONE, InterpolationMode.LINEAR);
        assertEquals(20, linear.evaluate(32), TOLERANCE);
        assertEquals(95, linear.evaluate(96), TOLERANCE);
        // end segments are extended
        assertEquals(-20, linear.evaluate(-32), TOLERANCE);
        assertEquals(255 + 45.0 / 63, linear.evaluate(256), TOLERANCE);
    }

    @Test
    public void testLinearSinglePointIsConstant() {
        Interpolator linear = Interpolators.build(Arrays.asList(new ControlPoint(5, 7)), InterpolationMode.LINEAR);
        assertEquals(7, linear.evaluate(-100), TOLERANCE);
        assertEquals(7, linear.evaluate(100), TOLERANCE);
    }

    @Test
    public void testSteps() {
        Interpolator nearest = Interpolators.build(TONE, InterpolationMode.NEAREST);
        Interpolator previous = Interpolators.build(TONE, InterpolationMode.PREVIOUS_VALUE);
        Interpolator hold = Interpolators.build(TONE, InterpolationMode.ZERO_ORDER_HOLD);
        Interpolator next = Interpolators.build(TONE, InterpolationMode.NEXT_VALUE);
        assertEquals(StepInterpolator.Step.PREVIOUS, ((StepInterpolator) hold).getStep());
        assertEquals(StepInterpolator.Step.PREVIOUS, ((StepInterpolator) previous).getStep());

        assertEquals(40, nearest.evaluate(95), TOLERANCE);
        assertEquals(40, nearest.evaluate(96), TOLERANCE); // tie goes to the lower point
        assertEquals(150, nearest.evaluate(97), TOLERANCE);

        assertEquals(40, previous.evaluate(127), TOLERANCE);
        assertEquals(40, hold.evaluate(127), TOLERANCE);
        assertEquals(150, next.evaluate(65), TOLERANCE);
    }

    @Test
    public void testStepsClampOutsideDomain() {
        for (InterpolationMode mode : new InterpolationMode[]{InterpolationMode.NEAREST, InterpolationMode.ZERO_ORDER_HOLD,
            InterpolationMode.PREVIOUS_VALUE, InterpolationMode.NEXT_VALUE}) {
            Interpolator interpolator = Interpolators.build(TONE, mode);
            assertEquals(mode.toString(), 0, interpolator.evaluate(-50), TOLERANCE);
            assertEquals(mode.toString(), 255, interpolator.evaluate(1000), TOLERANCE);
        }
    }

    @Test
    public void testSpline1MatchesLinear() {
        Interpolator spline = Interpolators.build(TONE, InterpolationMode.SPLINE1);
        Interpolator linear = Interpolators.build(TONE, InterpolationMode.LINEAR);
        for (int x = -20; x < 280; x += 7) {
            assertEquals(linear.evaluate(x), spline.evaluate(x), TOLERANCE);
        }
    }

    @Test
    public void testQuadraticSplineReproducesQuadratic() {
        Interpolator spline = Interpolators.build(polynomial(6, 2), InterpolationMode.SPLINE2);
        assertEquals(2, ((BSplineInterpolator) spline).getDegree());
        assertEquals(1.69, spline.evaluate(1.3), TOLERANCE);
        assertEquals(20.25, spline.evaluate(4.5), TOLERANCE);
        // extrapolation continues the end polynomial
        assertEquals(1, spline.evaluate(-1), TOLERANCE);
        assertEquals(49, spline.evaluate(7), TOLERANCE);
    }

    @Test
    public void testCubicSplineReproducesCubic() {
        Interpolator spline = Interpolators.build(polynomial(7, 3), InterpolationMode.SPLINE3);
        assertEquals(15.625, spline.evaluate(2.5), TOLERANCE);
        assertEquals(-8, spline.evaluate(-2), 1e-5);
        assertEquals(343, spline.evaluate(7), 1e-5);
    }

    @Test
    public void testCubicSplineWithMinimumPoints() {
        Interpolator spline = Interpolators.build(polynomial(4, 3), InterpolationMode.SPLINE3);
        assertEquals(3.375, spline.evaluate(1.5), TOLERANCE);
    }

    @Test
    public void testSplineMinimumPoints() {
        List<ControlPoint> three = polynomial(3, 1);
        try {
            Interpolators.build(three, InterpolationMode.SPLINE3);
            fail("Cubic spline should need four points");
        } catch (InvalidCurveException x) {
            assertTrue(x.getMessage().contains("at least 4"));
        }
        Interpolators.build(three, InterpolationMode.SPLINE2);
        try {
            Interpolators.build(polynomial(1, 1), InterpolationMode.SPLINE1);
            fail("Linear spline should need two points");
        } catch (InvalidCurveException x) {
            // expected
        }
    }

    @Test(expected = InvalidCurveException.class)
    public void testNoPoints() {
        Interpolators.build(new ArrayList<>(), InterpolationMode.NEAREST);
    }

    @Test
    public void testNonIncreasingPointsRejected() {
        List<ControlPoint> unsorted = Arrays.asList(new ControlPoint(0, 0), new ControlPoint(20, 5), new ControlPoint(10, 9));
        List<ControlPoint> duplicate = Arrays.asList(new ControlPoint(0, 0), new ControlPoint(10, 5), new ControlPoint(10, 9));
        for (InterpolationMode mode : InterpolationMode.values()) {
            for (List<ControlPoint> points : Arrays.asList(unsorted, duplicate)) {
                try {
                    Interpolators.build(points, mode);
                    fail(mode + " accepted " + points);
                } catch (InvalidCurveException x) {
                    // expected
                }
            }
        }
    }

    @Test
    public void testLagrange() {
        Interpolator lagrange = Interpolators.build(polynomial(5, 2), InterpolationMode.LAGRANGE);
        assertEquals(6.25, lagrange.evaluate(2.5), TOLERANCE);
        assertEquals(100, lagrange.evaluate(10), 1e-4);
    }

    @Test
    public void testLagrangeDivergesOutsideDomain() {
        Interpolator lagrange = Interpolators.build(TONE, InterpolationMode.LAGRANGE);
        double inside = lagrange.evaluate(255);
        double outside = lagrange.evaluate(1000);
        assertEquals(255, inside, TOLERANCE);
        assertTrue(Math.abs(outside) > 1000);
    }

    @Test
    public void testNaNAndInfinityDoNotThrow() {
        for (InterpolationMode mode : InterpolationMode.values()) {
            Interpolator interpolator = Interpolators.build(TONE, mode);
            assertTrue(mode.toString(), Double.isNaN(interpolator.evaluate(Double.NaN)));
            interpolator.evaluate(Double.POSITIVE_INFINITY);
            interpolator.evaluate(-1e9);
        }
    }
}
