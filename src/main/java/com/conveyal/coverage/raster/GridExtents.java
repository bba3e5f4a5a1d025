package com.conveyal.coverage.raster;

import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The georeferencing of a north-up raster: a coordinate reference system, the envelope covered by the outer edges of
 * the pixels, and the number of pixel columns and rows. Row 0 is the northernmost row, column 0 the westernmost.
 * Instances are immutable. Equals and hashcode are exact; use sameGrid() to compare grids derived through floating
 * point arithmetic.
 */
public class GridExtents {

    /**
     * Hard ceiling protecting the JVM heap regardless of configuration. A few bands of this many doubles already take
     * gigabytes, and every evaluated output band adds another.
     */
    public static final long MAX_GRID_CELLS = 100_000_000L;

    /** Relative tolerance (in pixels) when deciding whether two grids line up. */
    private static final double ALIGNMENT_TOLERANCE_PIXELS = 1e-6;

    /** Normalized CRS identifier, always of the form EPSG:nnnn. */
    public final String crs;

    public final Envelope envelope;

    public final int width;

    public final int height;

    public GridExtents (String crs, Envelope envelope, int width, int height) {
        this.crs = CrsTransforms.normalize(checkNotNull(crs));
        this.envelope = new Envelope(checkNotNull(envelope));
        this.width = width;
        this.height = height;
        checkGridSize();
    }

    /**
     * Build the grid covering the given envelope with square-ish pixels of the given size, rounding the pixel count
     * up so the whole envelope is covered. The envelope is expanded east and south to a whole number of pixels.
     */
    public static GridExtents forResolution (String crs, Envelope envelope, double pixelSize) {
        checkArgument(pixelSize > 0, "Pixel size must be positive.");
        int width = Math.max(1, (int) Math.ceil(envelope.getWidth() / pixelSize - ALIGNMENT_TOLERANCE_PIXELS));
        int height = Math.max(1, (int) Math.ceil(envelope.getHeight() / pixelSize - ALIGNMENT_TOLERANCE_PIXELS));
        Envelope snapped = new Envelope(
                envelope.getMinX(), envelope.getMinX() + width * pixelSize,
                envelope.getMaxY() - height * pixelSize, envelope.getMaxY()
        );
        return new GridExtents(crs, snapped, width, height);
    }

    private void checkGridSize () {
        checkArgument(width > 0 && height > 0, "Grid must have at least one pixel, got %s x %s.", width, height);
        checkArgument(envelope.getWidth() > 0 && envelope.getHeight() > 0, "Grid envelope must have a nonzero area.");
        checkArgument(nCells() <= MAX_GRID_CELLS, "Grid of %s x %s pixels is too large.", width, height);
    }

    public long nCells () {
        return (long) width * height;
    }

    public double pixelWidth () {
        return envelope.getWidth() / width;
    }

    public double pixelHeight () {
        return envelope.getHeight() / height;
    }

    /** X coordinate of the center of pixels in the given column. */
    public double columnCenterX (int column) {
        return envelope.getMinX() + (column + 0.5) * pixelWidth();
    }

    /** Y coordinate of the center of pixels in the given row. Y decreases as the row number increases. */
    public double rowCenterY (int row) {
        return envelope.getMaxY() - (row + 0.5) * pixelHeight();
    }

    /** Continuous column coordinate of x, where pixel centers fall on whole numbers. */
    public double fractionalColumn (double x) {
        return (x - envelope.getMinX()) / pixelWidth() - 0.5;
    }

    /** Continuous row coordinate of y, where pixel centers fall on whole numbers. */
    public double fractionalRow (double y) {
        return (envelope.getMaxY() - y) / pixelHeight() - 0.5;
    }

    /**
     * The sub-grid of this grid made of all whole pixels touching the given envelope (expressed in this grid's CRS).
     * Returns null when the envelope does not overlap this grid at all. The result lies exactly on this grid's pixels.
     */
    public GridExtents clip (Envelope subset) {
        Envelope overlap = envelope.intersection(subset);
        if (overlap.isNull() || overlap.getWidth() <= 0 || overlap.getHeight() <= 0) {
            return null;
        }
        int west = clamp((int) Math.floor(fractionalColumn(overlap.getMinX()) + 0.5 + ALIGNMENT_TOLERANCE_PIXELS), width);
        int east = clamp((int) Math.ceil(fractionalColumn(overlap.getMaxX()) + 0.5 - ALIGNMENT_TOLERANCE_PIXELS), width);
        int north = clamp((int) Math.floor(fractionalRow(overlap.getMaxY()) + 0.5 + ALIGNMENT_TOLERANCE_PIXELS), height);
        int south = clamp((int) Math.ceil(fractionalRow(overlap.getMinY()) + 0.5 - ALIGNMENT_TOLERANCE_PIXELS), height);
        if (east <= west) east = west + 1;
        if (south <= north) south = north + 1;
        Envelope clipped = new Envelope(
                envelope.getMinX() + west * pixelWidth(),
                envelope.getMinX() + east * pixelWidth(),
                envelope.getMaxY() - south * pixelHeight(),
                envelope.getMaxY() - north * pixelHeight()
        );
        return new GridExtents(crs, clipped, east - west, south - north);
    }

    /** Column of this grid holding the western edge of the other grid, which must lie on this grid's pixels. */
    public int columnOffset (GridExtents inner) {
        return (int) Math.round((inner.envelope.getMinX() - envelope.getMinX()) / pixelWidth());
    }

    /** Row of this grid holding the northern edge of the other grid, which must lie on this grid's pixels. */
    public int rowOffset (GridExtents inner) {
        return (int) Math.round((envelope.getMaxY() - inner.envelope.getMaxY()) / pixelHeight());
    }

    private static int clamp (int value, int limit) {
        return Math.max(0, Math.min(limit, value));
    }

    /**
     * True if the two grids have the same CRS and dimensions and their edges coincide to within a tiny fraction of a
     * pixel. This is the shared-grid invariant of a Dataset.
     */
    public boolean sameGrid (GridExtents other) {
        if (this == other) return true;
        if (other == null) return false;
        if (!crs.equals(other.crs) || width != other.width || height != other.height) return false;
        double toleranceX = pixelWidth() * ALIGNMENT_TOLERANCE_PIXELS;
        double toleranceY = pixelHeight() * ALIGNMENT_TOLERANCE_PIXELS;
        return Math.abs(envelope.getMinX() - other.envelope.getMinX()) <= toleranceX
            && Math.abs(envelope.getMaxX() - other.envelope.getMaxX()) <= toleranceX
            && Math.abs(envelope.getMinY() - other.envelope.getMinY()) <= toleranceY
            && Math.abs(envelope.getMaxY() - other.envelope.getMaxY()) <= toleranceY;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GridExtents that = (GridExtents) o;
        return width == that.width && height == that.height && crs.equals(that.crs) && envelope.equals(that.envelope);
    }

    @Override
    public int hashCode () {
        return Objects.hash(crs, envelope, width, height);
    }

    @Override
    public String toString () {
        return String.format("[%s %dx%d over %s]", crs, width, height, envelope);
    }

}
