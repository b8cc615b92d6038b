package org.lsst.curves.image;

import java.awt.image.BufferedImage;

/**
 * A step in an image processing pipeline.
 */
@FunctionalInterface
public interface ImageProcessor {

    /**
     * Process an image. The input image is not modified.
     *
     * @param image The image to process
     * @return The processed image
     */
    BufferedImage process(BufferedImage image);
}
