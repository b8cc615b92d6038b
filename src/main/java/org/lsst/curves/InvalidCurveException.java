package org.lsst.curves;

/**
 * Thrown when a curve's control points cannot support the requested
 * interpolation mode (too few points, or x values not strictly increasing).
 */
public class InvalidCurveException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidCurveException(String message) {
        super(message);
    }

    public InvalidCurveException(String message, Throwable cause) {
        super(message, cause);
    }
}
