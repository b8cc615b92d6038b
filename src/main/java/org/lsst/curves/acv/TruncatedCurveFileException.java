package org.lsst.curves.acv;

import java.io.EOFException;

/**
 * Thrown when ACV data ends before all the curves and points announced in its
 * counts have been read.
 */
public class TruncatedCurveFileException extends EOFException {

    private static final long serialVersionUID = 1L;

    public TruncatedCurveFileException(String message, EOFException cause) {
        super(message);
        initCause(cause);
    }
}
