package org.lsst.curves.acv;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.util.ArrayDataInput;
import nom.tam.util.ArrayDataOutput;
import nom.tam.util.BufferedDataInputStream;
import nom.tam.util.BufferedDataOutputStream;
import org.lsst.curves.ControlPoint;
import org.lsst.curves.Curve;
import org.lsst.curves.CurveSet;
import org.lsst.curves.EmptyCurveSetException;
import org.lsst.curves.InterpolationMode;

/**
 * Reads and writes ACV curve files. The layout, all big endian 16 bit signed
 * integers, is:
 * <pre>
 * short reserved (always 0)
 * short curveCount
 * curveCount times:
 *     short pointCount
 *     pointCount times: short y, short x
 * </pre>
 * Note that points are stored y first, while {@link ControlPoint} is x first.
 */
public class AcvCodec {

    private static final Logger LOG = Logger.getLogger(AcvCodec.class.getName());
    public static final String SUFFIX = ".acv";
    private static final int RESERVED = 0;

    /**
     * Read curves from an input stream. The stream is not closed, but may
     * have been read beyond the end of the curve data.
     *
     * @param input The stream to read
     * @param mode The interpolation mode given to each curve
     * @return The curves, named by channel
     * @throws TruncatedCurveFileException If the stream ends early
     * @throws IOException For other read errors or invalid counts
     */
    public List<Curve> decode(InputStream input, InterpolationMode mode) throws IOException {
        return readCurves(new BufferedDataInputStream(input), mode);
    }

    /**
     * Read curves from a file.
     *
     * @param path The file to read
     * @param mode The interpolation mode given to each curve
     * @return The curves, named by channel
     * @throws NoSuchFileException If the file does not exist
     * @throws TruncatedCurveFileException If the file ends early
     * @throws IOException For other read errors or invalid counts
     */
    public List<Curve> decode(Path path, InterpolationMode mode) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "Can't read nonexistent ACV file");
        }
        try (BufferedDataInputStream input = new BufferedDataInputStream(Files.newInputStream(path))) {
            List<Curve> curves = readCurves(input, mode);
            LOG.log(Level.INFO, "Read {0} curves from {1}", new Object[]{curves.size(), path});
            return curves;
        }
    }

    private List<Curve> readCurves(ArrayDataInput input, InterpolationMode mode) throws IOException {
        int curveCount;
        try {
            input.readShort(); // reserved
            curveCount = input.readShort();
        } catch (EOFException x) {
            throw new TruncatedCurveFileException("ACV data ends inside the header", x);
        }
        if (curveCount < 0) {
            throw new IOException("Invalid ACV curve count: " + curveCount);
        }
        List<Curve> curves = new ArrayList<>(curveCount);
        for (int c = 0; c < curveCount; c++) {
            curves.add(readCurve(input, c, curveCount, mode));
        }
        return curves;
    }

    private Curve readCurve(ArrayDataInput input, int index, int curveCount, InterpolationMode mode) throws IOException {
        int pointCount;
        try {
            pointCount = input.readShort();
        } catch (EOFException x) {
            throw new TruncatedCurveFileException(String.format("ACV data ends before curve %d of %d", index + 1, curveCount), x);
        }
        if (pointCount < 0) {
            throw new IOException("Invalid ACV point count " + pointCount + " for curve " + index);
        }
        List<ControlPoint> points = new ArrayList<>(pointCount);
        for (int p = 0; p < pointCount; p++) {
            try {
                short y = input.readShort();
                short x = input.readShort();
                points.add(new ControlPoint(x, y));
            } catch (EOFException eof) {
                throw new TruncatedCurveFileException(String.format("ACV data ends at point %d of %d in curve %d", p, pointCount, index), eof);
            }
        }
        return new Curve(CurveSet.channelName(index), points, mode);
    }

    /**
     * Write curves to an output stream. The stream is flushed but not closed.
     *
     * @param curves The curves to write
     * @param output The stream to write to
     * @throws EmptyCurveSetException If there are no curves, nothing is written
     * @throws IOException If the write fails
     */
    public void encode(List<Curve> curves, OutputStream output) throws IOException {
        checkWritable(curves);
        BufferedDataOutputStream out = new BufferedDataOutputStream(output);
        writeCurves(curves, out);
        out.flush();
    }

    /**
     * Write curves to a file. The data is first written to a temporary file
     * in the same directory which then replaces the target, so a failed write
     * leaves any existing file untouched.
     *
     * @param curves The curves to write
     * @param path The file to write
     * @throws EmptyCurveSetException If there are no curves, nothing is written
     * @throws IOException If the write fails
     */
    public void encode(List<Curve> curves, Path path) throws IOException {
        checkWritable(curves);
        Path target = path.toAbsolutePath();
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        boolean success = false;
        try {
            try (BufferedDataOutputStream out = new BufferedDataOutputStream(Files.newOutputStream(temp))) {
                writeCurves(curves, out);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException x) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            success = true;
            LOG.log(Level.INFO, "Wrote {0} curves to {1}", new Object[]{curves.size(), target});
        } finally {
            if (!success) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException x) {
                    LOG.log(Level.WARNING, "Unable to delete temporary file " + temp, x);
                }
            }
        }
    }

    private void writeCurves(List<Curve> curves, ArrayDataOutput out) throws IOException {
        out.writeShort(RESERVED);
        out.writeShort(curves.size());
        for (Curve curve : curves) {
            out.writeShort(curve.size());
            for (ControlPoint point : curve.getPoints()) {
                out.writeShort(point.getY());
                out.writeShort(point.getX());
            }
        }
    }

    private static void checkWritable(List<Curve> curves) {
        if (curves.isEmpty()) {
            throw new EmptyCurveSetException("Can't write empty curve set as ACV data");
        }
        if (curves.size() > Short.MAX_VALUE) {
            throw new IllegalArgumentException("Too many curves for ACV data: " + curves.size());
        }
        for (Curve curve : curves) {
            if (curve.size() > Short.MAX_VALUE) {
                throw new IllegalArgumentException("Too many points for ACV data in curve " + curve.getName() + ": " + curve.size());
            }
        }
    }
}
