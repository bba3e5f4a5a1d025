package com.conveyal.coverage.fetch;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.catalog.Collection;
import com.conveyal.coverage.catalog.CollectionCatalog;
import com.conveyal.coverage.components.Component;
import com.conveyal.coverage.progress.ProgressListener;
import com.conveyal.coverage.raster.Dataset;
import com.conveyal.coverage.raster.GridExtents;
import com.conveyal.coverage.raster.Interpolation;
import com.conveyal.coverage.raster.RasterArray;
import com.conveyal.coverage.raster.Resampler;
import com.conveyal.coverage.util.ExceptionUtils;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Retrieves every source band of a CoverageRequest and aligns them onto one grid. Bands are fetched concurrently on a
 * shared bounded pool; nothing here depends on the order in which those fetches complete. The first failure cancels
 * the remaining fetches of the same request and fails the whole request.
 *
 * Before any network traffic, each band is matched to the first requested collection declaring it (BAND_NOT_FOUND if
 * none does) and that collection is checked to intersect the requested area and time (DATA_UNAVAILABLE otherwise).
 */
public class CoverageFetcher implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(CoverageFetcher.class);

    public interface Config {
        int fetchThreads ();
        long maxGridCells ();
        String resampling ();
    }

    private final CollectionCatalog catalog;

    private final CoverageProvider provider;

    private final Resampler resampler;

    private final long maxGridCells;

    private final ExecutorService fetchExecutor;

    public CoverageFetcher (Config config, CollectionCatalog catalog, CoverageProvider provider) {
        this.catalog = catalog;
        this.provider = provider;
        this.resampler = new Resampler(Interpolation.fromKey(config.resampling()));
        this.maxGridCells = Math.min(config.maxGridCells(), GridExtents.MAX_GRID_CELLS);
        this.fetchExecutor = Executors.newFixedThreadPool(
                config.fetchThreads(),
                new ThreadFactoryBuilder().setNameFormat("coverage-fetch-%d").setDaemon(true).build()
        );
    }

    /**
     * Fetch all bands of the request and return them as a Dataset on the common grid, in request band order.
     * The target grid is the explicit output grid of the request if it has one, else the grid of the first band.
     */
    public Dataset fetch (CoverageRequest request, ProgressListener progressListener) {
        GridExtents requestedGrid = request.outputGrid();
        if (requestedGrid != null) checkSize(requestedGrid);
        List<Collection> collections = resolveCollections(request);
        List<Collection> sources = new ArrayList<>();
        for (String band : request.bands) {
            Collection source = sourceOf(band, collections);
            checkCoverage(source, request);
            sources.add(source);
        }
        progressListener.beginTask("Fetching " + request.bands.size() + " source bands", request.bands.size());

        List<Future<RasterArray>> futures = new ArrayList<>();
        for (int i = 0; i < request.bands.size(); i++) {
            String band = request.bands.get(i);
            Collection source = sources.get(i);
            futures.add(fetchExecutor.submit(() -> {
                LOG.debug("Fetching band {} of collection {}.", band, source.id);
                RasterArray array = provider.fetch(source, band, request);
                LOG.debug("Fetched band {} of collection {} on grid {}.", band, source.id, array.extents);
                return array.band.equals(band) ? array : array.relabel(band);
            }));
        }
        List<RasterArray> fetched = new ArrayList<>();
        try {
            for (Future<RasterArray> future : futures) {
                fetched.add(future.get());
                progressListener.increment();
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw CoverageProcessException.upstreamFetchError("Interrupted while fetching source bands.", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = ExceptionUtils.unwrapExecution(e);
            throw CoverageProcessException.wrap(cause, CoverageProcessException.Type.UPSTREAM_FETCH_ERROR);
        }

        Dataset dataset = new Dataset();
        if (fetched.isEmpty()) {
            return dataset;
        }
        GridExtents target = requestedGrid != null ? requestedGrid : fetched.get(0).extents;
        checkSize(target);
        for (RasterArray array : fetched) {
            dataset.add(resampler.resample(array, target));
        }
        return dataset;
    }

    private List<Collection> resolveCollections (CoverageRequest request) {
        if (request.collections.isEmpty()) {
            throw CoverageProcessException.dataUnavailable("The request names no source collection.");
        }
        List<Collection> collections = new ArrayList<>();
        for (String collectionId : request.collections) {
            collections.add(catalog.get(collectionId));
        }
        return collections;
    }

    private static Collection sourceOf (String band, List<Collection> collections) {
        for (Collection collection : collections) {
            if (collection.hasBand(band)) return collection;
        }
        List<String> ids = new ArrayList<>();
        for (Collection collection : collections) ids.add(collection.id);
        throw CoverageProcessException.bandNotFound(
                String.format("Band %s is not declared by any of the collections %s.", band, ids));
    }

    private static void checkCoverage (Collection collection, CoverageRequest request) {
        if (!collection.intersects(request.subset, request.subsetCrs)) {
            throw CoverageProcessException.dataUnavailable(String.format(
                    "Subset %s does not intersect collection %s.", request.subset, collection.id));
        }
        if (request.temporal != null && !collection.overlapsTime(request.temporal.begin, request.temporal.end)) {
            throw CoverageProcessException.dataUnavailable(String.format(
                    "Time %s is outside the temporal extent of collection %s.", request.temporal, collection.id));
        }
    }

    private void checkSize (GridExtents grid) {
        if (grid.nCells() > maxGridCells) {
            throw CoverageProcessException.dataUnavailable(String.format(
                    "Output grid of %d cells exceeds the limit of %d cells.", grid.nCells(), maxGridCells));
        }
    }

    private static void cancelAll (List<Future<RasterArray>> futures) {
        for (Future<RasterArray> future : futures) {
            future.cancel(true);
        }
    }

    public void shutdown () {
        fetchExecutor.shutdownNow();
    }

}
