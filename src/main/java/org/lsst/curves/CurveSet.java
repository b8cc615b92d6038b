package org.lsst.curves;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.curves.acv.AcvCodec;
import org.lsst.curves.image.BufferedImageSystem;
import org.lsst.curves.image.ImageMode;
import org.lsst.curves.image.ImageProcessor;
import org.lsst.curves.image.ImageSystem;

/**
 * A set of tone curves, one per channel, as stored in an ACV file. Curve 0 is
 * the composite curve, used for grey images. Curves 1, 2 and 3 are used for
 * the red, green and blue channels of colour images.
 *
 * Curve sets are read from ACV data with one of the {@code read} methods, or
 * built up with {@link #add(Curve)}, and can then be applied to images or
 * written back out.
 */
public class CurveSet implements ImageProcessor {

    private static final Logger LOG = Logger.getLogger(CurveSet.class.getName());
    private static final String[] CHANNELS = {"composite", "red", "green", "blue"};
    private static final AcvCodec CODEC = new AcvCodec();
    private static final ImageSystem DEFAULT_IMAGE_SYSTEM = new BufferedImageSystem();

    private final List<Curve> curves = new ArrayList<>();
    private final String name;
    private final Path path;
    private final InterpolationMode interpolationMode;
    private ImageSystem imageSystem = DEFAULT_IMAGE_SYSTEM;
    private boolean builtin;

    /**
     * Create an empty curve set using the default interpolation mode.
     *
     * @param name The name of the curve set
     */
    public CurveSet(String name) {
        this(name, InterpolationMode.getDefault());
    }

    public CurveSet(String name, InterpolationMode interpolationMode) {
        this(name, null, interpolationMode);
    }

    /**
     * Create an empty curve set associated with a file, which need not exist
     * yet. Use {@link #read(Path, InterpolationMode)} to read an existing
     * file.
     *
     * @param path The file
     * @param interpolationMode The interpolation mode for all curves
     */
    public CurveSet(Path path, InterpolationMode interpolationMode) {
        this(path.getFileName().toString(), path.toAbsolutePath(), interpolationMode);
    }

    private CurveSet(String name, Path path, InterpolationMode interpolationMode) {
        this.name = Objects.requireNonNull(name, "name");
        this.path = path;
        this.interpolationMode = Objects.requireNonNull(interpolationMode, "interpolationMode");
    }

    public static CurveSet read(Path path) throws IOException {
        return read(path, InterpolationMode.getDefault());
    }

    /**
     * Read a curve set from an ACV file.
     *
     * @param path The file to read
     * @param interpolationMode The interpolation mode for all curves
     * @return The curve set
     * @throws java.nio.file.NoSuchFileException If the file does not exist
     * @throws org.lsst.curves.acv.TruncatedCurveFileException If the file is
     * shorter than its counts say
     * @throws IOException For other read errors
     */
    public static CurveSet read(Path path, InterpolationMode interpolationMode) throws IOException {
        CurveSet result = new CurveSet(path, interpolationMode);
        result.curves.addAll(CODEC.decode(result.path, interpolationMode));
        return result;
    }

    /**
     * Read a curve set from a stream of ACV data. The stream is not closed.
     *
     * @param input The stream to read
     * @param name The name to give the curve set
     * @param interpolationMode The interpolation mode for all curves
     * @return The curve set
     * @throws IOException If the data cannot be read or is truncated
     */
    public static CurveSet read(InputStream input, String name, InterpolationMode interpolationMode) throws IOException {
        CurveSet result = new CurveSet(name, interpolationMode);
        result.curves.addAll(CODEC.decode(input, interpolationMode));
        return result;
    }

    /**
     * The conventional name of a channel: composite, red, green, blue, and
     * channelN after that.
     *
     * @param index The channel index
     * @return The channel name
     */
    public static String channelName(int index) {
        return index >= 0 && index < CHANNELS.length ? CHANNELS[index] : "channel" + index;
    }

    /**
     * Add a copy of a curve to the end of the set. The copy takes on the
     * set's interpolation mode; the caller's curve is left as it was.
     *
     * @param curve The curve to add
     * @return The copy now held by this set
     */
    public Curve add(Curve curve) {
        Curve copy = new Curve(curve);
        copy.setInterpolationMode(interpolationMode);
        curves.add(copy);
        return copy;
    }

    public Curve getCurve(int index) {
        return curves.get(index);
    }

    /**
     * @return A read-only view of the curves
     */
    public List<Curve> getCurves() {
        return Collections.unmodifiableList(curves);
    }

    public int getCount() {
        return curves.size();
    }

    public boolean isEmpty() {
        return curves.isEmpty();
    }

    public void write(Path target) throws IOException {
        CODEC.encode(curves, target);
    }

    public void write(OutputStream output) throws IOException {
        CODEC.encode(curves, output);
    }

    /**
     * Apply the curves to an image. Grey images are mapped through the
     * composite curve and come back as 8 bit grey. RGB images have each
     * channel mapped through its own curve. Images in any other mode are
     * converted to RGB first.
     *
     * @param image The image, which is not modified
     * @return The adjusted image
     * @throws EmptyCurveSetException If there are no curves
     * @throws InvalidCurveException If a needed curve is missing or cannot be
     * interpolated
     * @throws org.lsst.curves.image.UnknownModeException If the image's mode
     * is not recognized
     */
    public BufferedImage apply(BufferedImage image) {
        ImageMode mode = imageSystem.detectMode(image);
        if (curves.isEmpty()) {
            throw new EmptyCurveSetException("Can't apply empty curve set " + name);
        }
        if (mode.isSingleChannel()) {
            LOG.log(Level.FINE, "Applying composite curve of {0} to {1} image", new Object[]{name, mode});
            return imageSystem.eval(imageSystem.convert(image, ImageMode.L), curves.get(0));
        } else if (mode != ImageMode.RGB) {
            image = imageSystem.convert(image, ImageMode.RGB);
        }
        List<BufferedImage> channels = imageSystem.split(image);
        if (curves.size() <= channels.size()) {
            throw new InvalidCurveException(String.format("Curve set %s has %d curves, %d needed for RGB images", name, curves.size(), channels.size() + 1));
        }
        List<BufferedImage> adjusted = new ArrayList<>(channels.size());
        for (int i = 0; i < channels.size(); i++) {
            adjusted.add(imageSystem.eval(channels.get(i), curves.get(i + 1)));
        }
        return imageSystem.merge(ImageMode.RGB, adjusted);
    }

    @Override
    public BufferedImage process(BufferedImage image) {
        return apply(image);
    }

    public String getName() {
        return name;
    }

    /**
     * @return The absolute path of the file this set belongs to, or its name
     * if it has no file
     */
    public String getSource() {
        return path == null ? name : path.toString();
    }

    public Path getPath() {
        return path;
    }

    public boolean fileExists() {
        return path != null && Files.isRegularFile(path);
    }

    public InterpolationMode getInterpolationMode() {
        return interpolationMode;
    }

    /**
     * @return true if this set came from a catalog of preset curves rather
     * than from the user
     */
    public boolean isBuiltin() {
        return builtin;
    }

    public void setBuiltin(boolean builtin) {
        this.builtin = builtin;
    }

    public ImageSystem getImageSystem() {
        return imageSystem;
    }

    public void setImageSystem(ImageSystem imageSystem) {
        this.imageSystem = Objects.requireNonNull(imageSystem, "imageSystem");
    }

    @Override
    public String toString() {
        return "CurveSet{" + (builtin ? "[builtin] " : "") + name + ", " + curves.size() + ", " + interpolationMode + '}';
    }
}
