package com.conveyal.coverage.fetch;

import com.conveyal.coverage.catalog.Collection;
import com.conveyal.coverage.raster.RasterArray;

/**
 * The outbound boundary to whatever serves raw coverage data. An implementation fetches a single band of a single
 * collection, clipped to the request's spatial subset and reduced to one time slice, on whatever grid the source
 * delivers it. Alignment onto a common grid happens in the CoverageFetcher, not here.
 *
 * Implementations must be threadsafe: the fetcher calls them concurrently for different bands of one request.
 * Failures are reported as CoverageProcessException with type DATA_UNAVAILABLE (nothing to return for this subset)
 * or UPSTREAM_FETCH_ERROR (the source could not be reached or sent something unreadable).
 */
public interface CoverageProvider {

    RasterArray fetch (Collection collection, String band, CoverageRequest request);

}
