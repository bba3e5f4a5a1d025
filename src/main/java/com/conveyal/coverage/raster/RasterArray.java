package com.conveyal.coverage.raster;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One band of samples on a georeferenced grid. Samples are doubles in row-major order (column changes fastest), with
 * NaN standing for missing data. The optional time axis of a coverage is always collapsed to a single slice before
 * samples reach this class.
 *
 * Ownership is linear: the pipeline stage that creates an array may fill it in, then hands it to the next stage and
 * stops touching it. Nothing here is synchronized, and arrays are never shared between invocations.
 */
public class RasterArray {

    /** The band label, e.g. B04 or ndvi. */
    public final String band;

    public final GridExtents extents;

    private final double[] values;

    /** A new array with every sample set to NaN. */
    public RasterArray (String band, GridExtents extents) {
        this(band, extents, nanFilled(extents.nCells()));
    }

    /** Wrap existing samples without copying them. The caller gives up ownership of the values array. */
    public RasterArray (String band, GridExtents extents, double[] values) {
        this.band = checkNotNull(band);
        this.extents = checkNotNull(extents);
        this.values = checkNotNull(values);
        checkArgument(values.length == extents.nCells(),
                "Band %s has %s samples but its grid has %s cells.", band, values.length, extents.nCells());
    }

    /** Build an array from rows of samples, mostly for tests and small literal rasters. */
    public static RasterArray fromRows (String band, GridExtents extents, double[][] rows) {
        checkArgument(rows.length == extents.height, "Expected %s rows, got %s.", extents.height, rows.length);
        double[] values = new double[extents.width * extents.height];
        for (int row = 0; row < rows.length; row++) {
            checkArgument(rows[row].length == extents.width, "Row %s should have %s samples.", row, extents.width);
            System.arraycopy(rows[row], 0, values, row * extents.width, extents.width);
        }
        return new RasterArray(band, extents, values);
    }

    private static double[] nanFilled (long nCells) {
        double[] values = new double[Math.toIntExact(nCells)];
        Arrays.fill(values, Double.NaN);
        return values;
    }

    public int width () {
        return extents.width;
    }

    public int height () {
        return extents.height;
    }

    public double get (int row, int column) {
        return values[index(row, column)];
    }

    public void set (int row, int column, double value) {
        values[index(row, column)] = value;
    }

    private int index (int row, int column) {
        checkElementIndex(row, extents.height, "row");
        checkElementIndex(column, extents.width, "column");
        return row * extents.width + column;
    }

    /**
     * Direct access to the samples in row-major order. This is not a copy, it is how the evaluator and serializer
     * read and write samples in bulk.
     */
    public double[] values () {
        return values;
    }

    /**
     * The same samples under another band label, used when an evaluated result becomes a named output band.
     * The receiver should not be used after this call.
     */
    public RasterArray relabel (String newBand) {
        return new RasterArray(newBand, extents, values);
    }

    /** True if both arrays hold exactly the same label, grid and samples, treating NaN as equal to NaN. */
    public boolean sameContent (RasterArray other) {
        return band.equals(other.band) && extents.sameGrid(other.extents) && Arrays.equals(values, other.values);
    }

    @Override
    public String toString () {
        return String.format("RasterArray %s %s", band, extents);
    }

}
