package org.lsst.curves.image;

/**
 * Thrown when an image's colour mode cannot be determined or is not one of the
 * {@link ImageMode}s.
 */
public class UnknownModeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public UnknownModeException(String message) {
        super(message);
    }
}
