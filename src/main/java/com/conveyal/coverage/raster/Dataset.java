package com.conveyal.coverage.raster;

import com.conveyal.coverage.CoverageProcessException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An ordered set of uniquely labelled bands on one shared grid. The shared grid is checked every time a band is added,
 * so a Dataset that exists is always consistent. Iteration order is insertion order, which becomes band order in
 * serialized output.
 */
public class Dataset {

    private final Map<String, RasterArray> bands = new LinkedHashMap<>();

    private GridExtents extents;

    /**
     * Append a band. Fails with GRID_MISMATCH if the array does not lie on the grid of the bands already present,
     * and with IllegalArgumentException if the label is already taken.
     */
    public Dataset add (RasterArray array) {
        checkArgument(!bands.containsKey(array.band), "Dataset already contains a band labelled %s.", array.band);
        if (extents == null) {
            extents = array.extents;
        } else if (!extents.sameGrid(array.extents)) {
            throw CoverageProcessException.gridMismatch(String.format(
                    "Band %s lies on grid %s but the dataset grid is %s.", array.band, array.extents, extents));
        }
        bands.put(array.band, array);
        return this;
    }

    public RasterArray get (String band) {
        return bands.get(band);
    }

    public boolean contains (String band) {
        return bands.containsKey(band);
    }

    public List<String> labels () {
        return new ArrayList<>(bands.keySet());
    }

    public int size () {
        return bands.size();
    }

    public boolean isEmpty () {
        return bands.isEmpty();
    }

    /** The shared grid, or null while the dataset is still empty. */
    public GridExtents extents () {
        return extents;
    }

    public Map<String, RasterArray> asMap () {
        return Collections.unmodifiableMap(bands);
    }

    /** Same labels in the same order, on the same grid, with identical samples. */
    public boolean sameContent (Dataset other) {
        if (!labels().equals(other.labels())) return false;
        for (String band : bands.keySet()) {
            if (!bands.get(band).sameContent(other.get(band))) return false;
        }
        return true;
    }

    @Override
    public String toString () {
        return String.format("Dataset %s on %s", bands.keySet(), extents);
    }

}
