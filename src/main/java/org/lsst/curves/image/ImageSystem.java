package org.lsst.curves.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * The image operations needed to apply tone curves. Channels are single band,
 * 8 bit images.
 */
public interface ImageSystem {

    /**
     * @param image The image
     * @return The colour mode of the image
     * @throws UnknownModeException If the mode cannot be determined
     */
    ImageMode detectMode(BufferedImage image);

    BufferedImage convert(BufferedImage image, ImageMode target);

    /**
     * Split an image into one image per band, in band order.
     *
     * @param image The image to split
     * @return The channels
     */
    List<BufferedImage> split(BufferedImage image);

    BufferedImage merge(ImageMode mode, List<BufferedImage> channels);

    /**
     * Map every pixel of a channel through a function. Results are rounded and
     * clamped to 0..255.
     *
     * @param channel The channel
     * @param function The function to apply to each pixel value
     * @return A new channel holding the mapped values
     */
    BufferedImage eval(BufferedImage channel, DoubleUnaryOperator function);

    BufferedImage open(Path path) throws IOException;
}
