package org.lsst.curves.catalog;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.lsst.curves.CurveSet;

/**
 * A source of named, preset curve sets.
 */
public interface CurveCatalog {

    List<String> listNames() throws IOException;

    /**
     * Load a curve set by name. Each call returns a new curve set which the
     * caller is free to modify.
     *
     * @param name The name, as returned by {@link #listNames()}
     * @return The curve set
     * @throws IOException If the curve set cannot be found or read
     */
    CurveSet load(String name) throws IOException;

    default List<CurveSet> loadAll() throws IOException {
        List<CurveSet> result = new ArrayList<>();
        for (String name : listNames()) {
            result.add(load(name));
        }
        return result;
    }
}
