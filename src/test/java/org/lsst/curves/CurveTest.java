package org.lsst.curves;

import java.util.Arrays;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import org.junit.Test;
import org.lsst.curves.interp.Interpolator;

/**
 *
 */
public class CurveTest {

    private static Curve line() {
        return new Curve("composite", Arrays.asList(new ControlPoint(0, 0), new ControlPoint(100, 100)), InterpolationMode.LINEAR);
    }

    @Test
    public void testEvaluate() {
        Curve curve = line();
        assertEquals(50, curve.evaluate(50), 1e-9);
        assertEquals(50, curve.applyAsDouble(50), 1e-9);
        assertEquals(2, curve.size());
        assertEquals("composite", curve.getName());
    }

    @Test
    public void testAppendInvalidatesInterpolator() {
        Curve curve = line();
        assertEquals(150, curve.evaluate(150), 1e-9);
        curve.append(200, 100);
        assertEquals(100, curve.evaluate(150), 1e-9);
    }

    @Test
    public void testInsertAndRemoveInvalidateInterpolator() {
        Curve curve = line();
        assertEquals(50, curve.evaluate(50), 1e-9);
        curve.insert(1, new ControlPoint(50, 80));
        assertEquals(80, curve.evaluate(50), 1e-9);
        assertEquals(new ControlPoint(50, 80), curve.remove(1));
        assertEquals(50, curve.evaluate(50), 1e-9);
    }

    @Test
    public void testModeChangeInvalidatesInterpolator() {
        Curve curve = new Curve("red", Arrays.asList(new ControlPoint(0, 0), new ControlPoint(10, 10), new ControlPoint(20, 0)), InterpolationMode.LINEAR);
        assertEquals(5, curve.evaluate(5), 1e-9);
        curve.setInterpolationMode(InterpolationMode.NEXT_VALUE);
        assertEquals(10, curve.evaluate(5), 1e-9);
    }

    @Test
    public void testRebuild() {
        Curve curve = line();
        Interpolator first = curve.rebuild();
        Interpolator second = curve.rebuild();
        assertNotSame(first, second);
        assertEquals(25, second.evaluate(25), 1e-9);
    }

    @Test(expected = InvalidCurveException.class)
    public void testInvalidPointsFailOnEvaluate() {
        Curve curve = new Curve("blue", Arrays.asList(new ControlPoint(0, 0), new ControlPoint(10, 10)), InterpolationMode.SPLINE3);
        curve.evaluate(5);
    }

    @Test
    public void testCopyIsIndependent() {
        Curve curve = line();
        Curve copy = new Curve(curve);
        assertEquals(curve, copy);
        copy.append(200, 0);
        assertEquals(2, curve.size());
        assertEquals(3, copy.size());
        assertSame(curve.getInterpolationMode(), copy.getInterpolationMode());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testPointsAreReadOnly() {
        line().getPoints().add(new ControlPoint(1, 1));
    }

    @Test
    public void testControlPointRange() {
        new ControlPoint(Short.MIN_VALUE, Short.MAX_VALUE);
        try {
            new ControlPoint(40000, 0);
            fail("x beyond 16 bits should be rejected");
        } catch (IllegalArgumentException x) {
            // expected
        }
    }
}
