package org.lsst.curves.catalog;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.lsst.curves.Curve;
import org.lsst.curves.CurveSet;
import org.lsst.curves.InterpolationMode;
import org.lsst.curves.acv.AcvCodec;

/**
 * A catalog of the ACV files in one directory. Decoded curves are cached, so
 * repeated loads of the same name only read the file once. Every load still
 * returns a fresh copy, flagged as builtin.
 */
public class DirectoryCatalog implements CurveCatalog {

    private static final Logger LOG = Logger.getLogger(DirectoryCatalog.class.getName());
    public static final String CACHE_SIZE_PROPERTY = "org.lsst.curves.catalogCacheSize";

    private final Path directory;
    private final InterpolationMode interpolationMode;
    private final AcvCodec codec = new AcvCodec();
    private final LoadingCache<String, List<Curve>> curveCache;

    public DirectoryCatalog(Path directory) {
        this(directory, InterpolationMode.getDefault());
    }

    public DirectoryCatalog(Path directory, InterpolationMode interpolationMode) {
        this.directory = directory.toAbsolutePath();
        this.interpolationMode = interpolationMode;
        curveCache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger(CACHE_SIZE_PROPERTY, 100))
                .recordStats()
                .build((String name) -> {
                    LOG.log(Level.INFO, "Reading curves [builtin] {0}{1}", new Object[]{name, AcvCodec.SUFFIX});
                    return codec.decode(pathFor(name), interpolationMode);
                });
    }

    @Override
    public List<String> listNames() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(f -> f.toLowerCase(Locale.ROOT).endsWith(AcvCodec.SUFFIX))
                    .map(f -> f.substring(0, f.length() - AcvCodec.SUFFIX.length()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    public CurveSet load(String name) throws IOException {
        List<Curve> curves;
        try {
            curves = curveCache.get(name);
        } catch (CompletionException | UncheckedIOException x) {
            if (x.getCause() instanceof IOException io) {
                throw io;
            }
            throw x;
        }
        CurveSet result = new CurveSet(pathFor(name), interpolationMode);
        for (Curve curve : curves) {
            result.add(curve);
        }
        result.setBuiltin(true);
        LOG.fine(() -> "Curve cache " + curveCache.stats());
        return result;
    }

    /**
     * Find the file for a name. Names listed from the directory keep the case
     * of their suffix, otherwise the lower case suffix is assumed.
     */
    private Path pathFor(String name) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> {
                String fileName = p.getFileName().toString();
                return fileName.length() == name.length() + AcvCodec.SUFFIX.length()
                        && fileName.startsWith(name)
                        && fileName.toLowerCase(Locale.ROOT).endsWith(AcvCodec.SUFFIX);
            }).findFirst().orElse(directory.resolve(name + AcvCodec.SUFFIX));
        }
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public String toString() {
        return "DirectoryCatalog{" + "directory=" + directory + ", mode=" + interpolationMode + '}';
    }
}
