package com.conveyal.coverage.raster;

import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves band samples from the grid they were delivered on to the common grid of an invocation. Target pixel centers
 * are projected into the source CRS and sampled there, so source and target may differ in CRS, resolution and origin.
 * Target pixels falling outside the source grid become NaN.
 *
 * A Resampler has no mutable state and may be shared, but each call builds its own coordinate transform.
 */
public class Resampler {

    private static final Logger LOG = LoggerFactory.getLogger(Resampler.class);

    private final Interpolation interpolation;

    public Resampler (Interpolation interpolation) {
        this.interpolation = interpolation;
    }

    public Interpolation interpolation () {
        return interpolation;
    }

    /**
     * Return an array on the target grid holding the samples of the source array. If the source already lies on the
     * target grid it is returned unchanged.
     */
    public RasterArray resample (RasterArray source, GridExtents target) {
        if (source.extents.sameGrid(target)) {
            return source;
        }
        if (isSubGrid(source.extents, target)) {
            return crop(source, target);
        }
        LOG.debug("Resampling band {} from {} to {} ({})", source.band, source.extents, target, interpolation);
        boolean sameCrs = source.extents.crs.equals(target.crs);
        return resample(source, target, sameCrs ? null : CrsTransforms.transform(target.crs, source.extents.crs));
    }

    /** Resample through the given transform from target to source coordinates, or none if the CRS is shared. */
    RasterArray resample (RasterArray source, GridExtents target, CoordinateTransform transform) {
        RasterArray result = new RasterArray(source.band, target);
        double[] out = result.values();
        ProjCoordinate targetPoint = new ProjCoordinate();
        ProjCoordinate sourcePoint = new ProjCoordinate();
        int unprojectable = 0;
        for (int row = 0; row < target.height; row++) {
            for (int col = 0; col < target.width; col++) {
                double x = target.columnCenterX(col);
                double y = target.rowCenterY(row);
                if (transform != null) {
                    targetPoint.x = x;
                    targetPoint.y = y;
                    try {
                        transform.transform(targetPoint, sourcePoint);
                        x = sourcePoint.x;
                        y = sourcePoint.y;
                    } catch (Proj4jException e) {
                        // Outside the domain of one of the projections.
                        unprojectable++;
                        x = Double.NaN;
                        y = Double.NaN;
                    }
                }
                out[row * target.width + col] = sample(source, x, y);
            }
        }
        if (unprojectable > 0) {
            LOG.debug("{} pixels of band {} could not be projected and are NaN.", unprojectable, source.band);
        }
        return result;
    }

    /** True if the target has the source's CRS and pixel size and its edges fall on source pixel edges. */
    private static boolean isSubGrid (GridExtents source, GridExtents target) {
        if (!source.crs.equals(target.crs)) return false;
        if (!source.envelope.contains(target.envelope)) return false;
        double tolerance = 1e-6;
        if (Math.abs(source.pixelWidth() - target.pixelWidth()) > source.pixelWidth() * tolerance) return false;
        if (Math.abs(source.pixelHeight() - target.pixelHeight()) > source.pixelHeight() * tolerance) return false;
        double columnOffset = (target.envelope.getMinX() - source.envelope.getMinX()) / source.pixelWidth();
        double rowOffset = (source.envelope.getMaxY() - target.envelope.getMaxY()) / source.pixelHeight();
        return Math.abs(columnOffset - Math.rint(columnOffset)) < tolerance
            && Math.abs(rowOffset - Math.rint(rowOffset)) < tolerance;
    }

    private static RasterArray crop (RasterArray source, GridExtents target) {
        int west = source.extents.columnOffset(target);
        int north = source.extents.rowOffset(target);
        double[] values = new double[target.width * target.height];
        for (int row = 0; row < target.height; row++) {
            System.arraycopy(
                source.values(), (north + row) * source.width() + west, values, row * target.width, target.width
            );
        }
        return new RasterArray(source.band, target, values);
    }

    private double sample (RasterArray source, double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            return Double.NaN;
        }
        double column = source.extents.fractionalColumn(x);
        double row = source.extents.fractionalRow(y);
        // Outside the outer pixel edges of the source.
        if (column < -0.5 || row < -0.5 || column >= source.width() - 0.5 || row >= source.height() - 0.5) {
            return Double.NaN;
        }
        if (interpolation == Interpolation.NEAREST) {
            return source.get(clampIndex(Math.round(row), source.height()), clampIndex(Math.round(column), source.width()));
        }
        return bilinear(source, row, column);
    }

    /**
     * Weighted mean of the four surrounding pixel centers. Missing neighbours are dropped and the remaining weights
     * renormalized, so a single NaN does not blank out its whole neighbourhood.
     */
    private static double bilinear (RasterArray source, double row, double column) {
        int row0 = (int) Math.floor(row);
        int col0 = (int) Math.floor(column);
        double fy = row - row0;
        double fx = column - col0;
        double sum = 0;
        double weightSum = 0;
        for (int dy = 0; dy <= 1; dy++) {
            for (int dx = 0; dx <= 1; dx++) {
                double weight = (dy == 0 ? 1 - fy : fy) * (dx == 0 ? 1 - fx : fx);
                if (weight == 0) continue;
                int r = clampIndex(row0 + dy, source.height());
                int c = clampIndex(col0 + dx, source.width());
                double value = source.get(r, c);
                if (Double.isNaN(value)) continue;
                sum += weight * value;
                weightSum += weight;
            }
        }
        return weightSum > 0 ? sum / weightSum : Double.NaN;
    }

    private static int clampIndex (long index, int size) {
        return (int) Math.max(0, Math.min(size - 1, index));
    }

}
