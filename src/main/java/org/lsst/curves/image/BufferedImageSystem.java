package org.lsst.curves.image;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ByteLookupTable;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.LookupOp;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.imageio.ImageIO;

/**
 * {@link ImageSystem} for AWT buffered images. Channels are
 * {@link BufferedImage#TYPE_BYTE_GRAY} images. Grey pixel values are read
 * from the raster rather than through {@code getRGB}, which would apply the
 * grey colour space's gamma conversion.
 */
public class BufferedImageSystem implements ImageSystem {

    private static final Logger LOG = Logger.getLogger(BufferedImageSystem.class.getName());
    private static final int LEVELS = 256;

    @Override
    public ImageMode detectMode(BufferedImage image) {
        return switch (image.getType()) {
            case BufferedImage.TYPE_BYTE_BINARY ->
                image.getColorModel().getPixelSize() == 1 ? ImageMode.MONO : ImageMode.P;
            case BufferedImage.TYPE_BYTE_GRAY ->
                ImageMode.L;
            case BufferedImage.TYPE_USHORT_GRAY ->
                ImageMode.I16;
            case BufferedImage.TYPE_BYTE_INDEXED ->
                ImageMode.P;
            case BufferedImage.TYPE_INT_RGB, BufferedImage.TYPE_INT_BGR, BufferedImage.TYPE_3BYTE_BGR,
                    BufferedImage.TYPE_USHORT_565_RGB, BufferedImage.TYPE_USHORT_555_RGB ->
                ImageMode.RGB;
            case BufferedImage.TYPE_INT_ARGB, BufferedImage.TYPE_INT_ARGB_PRE,
                    BufferedImage.TYPE_4BYTE_ABGR, BufferedImage.TYPE_4BYTE_ABGR_PRE ->
                ImageMode.RGBA;
            default ->
                detectFromColorModel(image.getColorModel());
        };
    }

    private static ImageMode detectFromColorModel(ColorModel cm) {
        if (cm instanceof IndexColorModel) {
            return ImageMode.P;
        }
        ColorSpace cs = cm.getColorSpace();
        return switch (cs.getType()) {
            case ColorSpace.TYPE_GRAY ->
                cm.hasAlpha() ? ImageMode.LA : cm.getComponentSize(0) > 8 ? ImageMode.I16 : ImageMode.L;
            case ColorSpace.TYPE_RGB ->
                cm.hasAlpha() ? ImageMode.RGBA : ImageMode.RGB;
            case ColorSpace.TYPE_CMYK ->
                ImageMode.CMYK;
            default ->
                throw new UnknownModeException("Image has unknown mode, color space type " + cs.getType());
        };
    }

    /**
     * Convert an image to L, RGB or RGBA. An image already in the target mode
     * is returned as is.
     */
    @Override
    public BufferedImage convert(BufferedImage image, ImageMode target) {
        ImageMode source = detectMode(image);
        if (source == target) {
            return image;
        }
        LOG.log(Level.FINE, "Converting image from {0} to {1}", new Object[]{source, target});
        return switch (target) {
            case L ->
                toGrey(image, source);
            case RGB ->
                toRGB(image, source, BufferedImage.TYPE_INT_RGB);
            case RGBA ->
                toRGB(image, source, BufferedImage.TYPE_INT_ARGB);
            default ->
                throw new IllegalArgumentException("Conversion to mode " + target + " is not supported");
        };
    }

    private static boolean isGreyFamily(ImageMode mode) {
        return mode.isSingleChannel() || mode == ImageMode.LA;
    }

    private BufferedImage toGrey(BufferedImage image, ImageMode source) {
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster out = result.getRaster();
        Raster in = image.getRaster();
        boolean grey = isGreyFamily(source);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                out.setSample(x, y, 0, grey ? sample8(in, x, y, 0) : luma(image.getRGB(x, y)));
            }
        }
        return result;
    }

    private BufferedImage toRGB(BufferedImage image, ImageMode source, int type) {
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage result = new BufferedImage(width, height, type);
        Raster in = image.getRaster();
        boolean grey = isGreyFamily(source);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb;
                if (grey) {
                    int v = sample8(in, x, y, 0);
                    int alpha = source == ImageMode.LA ? sample8(in, x, y, 1) : 0xff;
                    argb = alpha << 24 | v << 16 | v << 8 | v;
                } else {
                    argb = image.getRGB(x, y);
                }
                result.setRGB(x, y, argb);
            }
        }
        return result;
    }

    @Override
    public List<BufferedImage> split(BufferedImage image) {
        ImageMode mode = detectMode(image);
        int width = image.getWidth();
        int height = image.getHeight();
        int bands = mode.getBands();
        List<BufferedImage> channels = new ArrayList<>(bands);
        WritableRaster[] out = new WritableRaster[bands];
        for (int b = 0; b < bands; b++) {
            BufferedImage channel = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            channels.add(channel);
            out[b] = channel.getRaster();
        }
        if (mode == ImageMode.RGB || mode == ImageMode.RGBA) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    int argb = image.getRGB(x, y);
                    out[0].setSample(x, y, 0, (argb >> 16) & 0xff);
                    out[1].setSample(x, y, 0, (argb >> 8) & 0xff);
                    out[2].setSample(x, y, 0, argb & 0xff);
                    if (bands == 4) {
                        out[3].setSample(x, y, 0, (argb >>> 24) & 0xff);
                    }
                }
            }
        } else {
            Raster in = image.getRaster();
            for (int b = 0; b < bands; b++) {
                for (int y = 0; y < height; y++) {
                    for (int x = 0; x < width; x++) {
                        out[b].setSample(x, y, 0, sample8(in, x, y, b));
                    }
                }
            }
        }
        return channels;
    }

    /**
     * Merge channels into an L, RGB or RGBA image.
     */
    @Override
    public BufferedImage merge(ImageMode mode, List<BufferedImage> channels) {
        if (channels.size() != mode.getBands()) {
            throw new IllegalArgumentException(String.format("Mode %s needs %d channels, got %d", mode, mode.getBands(), channels.size()));
        }
        int type = switch (mode) {
            case L ->
                BufferedImage.TYPE_BYTE_GRAY;
            case RGB ->
                BufferedImage.TYPE_INT_RGB;
            case RGBA ->
                BufferedImage.TYPE_INT_ARGB;
            default ->
                throw new IllegalArgumentException("Merging into mode " + mode + " is not supported");
        };
        int width = channels.get(0).getWidth();
        int height = channels.get(0).getHeight();
        BufferedImage result = new BufferedImage(width, height, type);
        WritableRaster out = result.getRaster();
        for (int b = 0; b < channels.size(); b++) {
            BufferedImage channel = channels.get(b);
            if (channel.getWidth() != width || channel.getHeight() != height) {
                throw new IllegalArgumentException("Channel " + b + " size does not match channel 0");
            }
            Raster in = channel.getRaster();
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    out.setSample(x, y, b, sample8(in, x, y, 0));
                }
            }
        }
        return result;
    }

    @Override
    public BufferedImage eval(BufferedImage channel, DoubleUnaryOperator function) {
        BufferedImage source = channel.getType() == BufferedImage.TYPE_BYTE_GRAY ? channel : convert(channel, ImageMode.L);
        LookupOp op = new LookupOp(new ByteLookupTable(0, lookupTable(function)), null);
        BufferedImage result = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        op.filter(source.getRaster(), result.getRaster());
        return result;
    }

    static byte[] lookupTable(DoubleUnaryOperator function) {
        byte[] table = new byte[LEVELS];
        for (int i = 0; i < LEVELS; i++) {
            table[i] = (byte) clamp(function.applyAsDouble(i));
        }
        return table;
    }

    static int clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return (int) Math.max(0, Math.min(LEVELS - 1, Math.round(value)));
    }

    @Override
    public BufferedImage open(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("No image reader for " + path);
        }
        return image;
    }

    /**
     * Read a sample scaled to 8 bits.
     */
    private static int sample8(Raster raster, int x, int y, int band) {
        int bits = raster.getSampleModel().getSampleSize(band);
        int value = raster.getSample(x, y, band);
        if (bits == 8) {
            return value;
        }
        int max = (1 << bits) - 1;
        return Math.round(value * 255f / max);
    }

    /**
     * ITU-R 601-2 luma, 16 bit fixed point.
     */
    private static int luma(int rgb) {
        int r = (rgb >> 16) & 0xff;
        int g = (rgb >> 8) & 0xff;
        int b = rgb & 0xff;
        return (r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16;
    }
}
