package com.conveyal.coverage.catalog;

import com.conveyal.coverage.raster.CrsTransforms;
import com.google.common.collect.ImmutableSet;
import org.locationtech.jts.geom.Envelope;

import java.time.Instant;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Reference data describing one source of raster data. Collections are created and updated by an external catalog;
 * this service only reads them.
 */
public class Collection {

    public final String id;

    public final String title;

    /** Spatial extent, expressed in the collection's own CRS. */
    public final Envelope bbox;

    /** Normalized CRS identifier of the bbox and of delivered data. */
    public final String crs;

    /** Start of the temporal extent, or null if unknown. */
    public final Instant temporalBegin;

    /** End of the temporal extent, or null if the collection is still being updated. */
    public final Instant temporalEnd;

    public final Set<String> bands;

    public Collection (String id, String title, Envelope bbox, String crs, Instant temporalBegin,
                       Instant temporalEnd, Iterable<String> bands) {
        this.id = checkNotNull(id);
        this.title = title == null ? id : title;
        this.bbox = new Envelope(checkNotNull(bbox));
        this.crs = CrsTransforms.normalize(crs);
        this.temporalBegin = temporalBegin;
        this.temporalEnd = temporalEnd;
        this.bands = ImmutableSet.copyOf(bands);
        checkArgument(temporalBegin == null || temporalEnd == null || !temporalEnd.isBefore(temporalBegin),
                "Collection %s ends before it begins.", id);
    }

    public boolean hasBand (String band) {
        return bands.contains(band);
    }

    /** True if the given envelope, expressed in the given CRS, overlaps the collection's bbox with nonzero area. */
    public boolean intersects (Envelope subset, String subsetCrs) {
        Envelope projected = CrsTransforms.transformEnvelope(subset, subsetCrs, crs);
        Envelope overlap = bbox.intersection(projected);
        return !overlap.isNull() && overlap.getArea() > 0;
    }

    /** True if the instant interval [begin, end] overlaps the temporal extent. Null bounds are open. */
    public boolean overlapsTime (Instant begin, Instant end) {
        if (temporalEnd != null && begin != null && begin.isAfter(temporalEnd)) return false;
        if (temporalBegin != null && end != null && end.isBefore(temporalBegin)) return false;
        return true;
    }

    @Override
    public String toString () {
        return String.format("Collection %s (%s) %s bands %s", id, crs, bbox, bands);
    }

}
