package com.conveyal.coverage.fetch;

import com.conveyal.coverage.raster.CrsTransforms;
import com.conveyal.coverage.raster.GridExtents;
import com.google.common.collect.ImmutableList;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * What one invocation asks of the coverage source: which collections to read from, the area and optional time span
 * to cover, which source bands are needed and optionally the size of the output grid. Built once through a Builder and
 * immutable afterward.
 */
public class CoverageRequest {

    /** Collection ids in order of preference. A band is read from the first collection that declares it. */
    public final List<String> collections;

    public final Envelope subset;

    /** CRS in which the subset is expressed, normalized. */
    public final String subsetCrs;

    /** Optional time slice or interval, null when the whole temporal extent may be used. */
    public final TemporalSubset temporal;

    /** Source bands to fetch, distinct, in order. */
    public final List<String> bands;

    /** Explicit output grid size, or null to adopt the grid of the first fetched band. */
    public final Integer width;
    public final Integer height;

    private CoverageRequest (Builder builder) {
        this.collections = ImmutableList.copyOf(builder.collections);
        this.subset = new Envelope(builder.subset);
        this.subsetCrs = CrsTransforms.normalize(builder.subsetCrs);
        this.temporal = builder.temporal;
        this.bands = ImmutableList.copyOf(new LinkedHashSet<>(builder.bands));
        this.width = builder.width;
        this.height = builder.height;
    }

    /** Copy of this request naming other collections, used when a process supplies default collections. */
    public CoverageRequest withCollections (List<String> collections) {
        return toBuilder().collections(collections).build();
    }

    /** Copy of this request fetching exactly the given bands. */
    public CoverageRequest withBands (Collection<String> bands) {
        Builder builder = toBuilder();
        builder.bands.clear();
        builder.bands.addAll(bands);
        return builder.build();
    }

    /** The output grid requested explicitly by the caller, or null if the caller left it to the data. */
    public GridExtents outputGrid () {
        if (width == null || height == null) return null;
        return new GridExtents(subsetCrs, subset, width, height);
    }

    public Builder toBuilder () {
        Builder builder = new Builder()
                .collections(collections)
                .subset(subset, subsetCrs)
                .temporal(temporal)
                .bands(bands);
        if (width != null && height != null) builder.size(width, height);
        return builder;
    }

    @Override
    public String toString () {
        return String.format("CoverageRequest collections=%s subset=%s (%s) time=%s bands=%s size=%sx%s",
                collections, subset, subsetCrs, temporal, bands, width, height);
    }

    public static Builder builder () {
        return new Builder();
    }

    public static class Builder {

        private final List<String> collections = new ArrayList<>();
        private Envelope subset;
        private String subsetCrs = CrsTransforms.WGS84;
        private TemporalSubset temporal;
        private final List<String> bands = new ArrayList<>();
        private Integer width;
        private Integer height;

        public Builder collection (String collectionId) {
            collections.add(collectionId);
            return this;
        }

        public Builder collections (Collection<String> collectionIds) {
            collections.clear();
            collections.addAll(collectionIds);
            return this;
        }

        public Builder subset (Envelope envelope, String crs) {
            this.subset = new Envelope(envelope);
            this.subsetCrs = crs;
            return this;
        }

        /** Longitude/latitude subset in WGS84. */
        public Builder subset (double west, double south, double east, double north) {
            return subset(new Envelope(west, east, south, north), CrsTransforms.WGS84);
        }

        public Builder temporal (TemporalSubset temporal) {
            this.temporal = temporal;
            return this;
        }

        public Builder band (String band) {
            bands.add(band);
            return this;
        }

        public Builder bands (Collection<String> bands) {
            this.bands.addAll(bands);
            return this;
        }

        public Builder size (int width, int height) {
            checkArgument(width > 0 && height > 0, "Output size must be positive.");
            this.width = width;
            this.height = height;
            return this;
        }

        public CoverageRequest build () {
            checkState(subset != null, "A coverage request needs a spatial subset.");
            checkArgument(subset.getWidth() > 0 && subset.getHeight() > 0, "Spatial subset must have a nonzero area.");
            return new CoverageRequest(this);
        }
    }

}
