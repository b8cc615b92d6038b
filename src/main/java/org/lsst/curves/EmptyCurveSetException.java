package org.lsst.curves;

/**
 * Thrown when a curve set with no curves is written.
 */
public class EmptyCurveSetException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public EmptyCurveSetException(String message) {
        super(message);
    }
}
