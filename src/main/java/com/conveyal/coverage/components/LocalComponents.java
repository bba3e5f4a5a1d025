package com.conveyal.coverage.components;

import com.conveyal.coverage.CoverageConfig;
import com.conveyal.coverage.catalog.JsonCollectionCatalog;
import com.conveyal.coverage.expression.BandEvaluator;
import com.conveyal.coverage.fetch.CoverageFetcher;
import com.conveyal.coverage.fetch.OgcApiCoverageProvider;
import com.conveyal.coverage.jobs.LocalJobRunner;
import com.conveyal.coverage.pipeline.CoveragePipeline;
import com.conveyal.coverage.pipeline.RasterAssembler;
import com.conveyal.coverage.process.ExpressionRegistry;
import com.conveyal.coverage.process.FileProcessDefinitionStore;
import com.conveyal.file.LocalFileStorage;

/**
 * Wires up the components for a single-machine deployment: files on local disk, collections listed in a JSON file,
 * coverages fetched from an OGC API server and jobs run in this JVM.
 */
public class LocalComponents extends Components {

    public LocalComponents (CoverageConfig config) {
        this.config = config;
        taskScheduler = new TaskScheduler(config);
        fileStorage = new LocalFileStorage(config);
        catalog = new JsonCollectionCatalog(config);
        coverageProvider = new OgcApiCoverageProvider(config);
        fetcher = new CoverageFetcher(config, catalog, coverageProvider);
        evaluator = new BandEvaluator(config);
        registry = new ExpressionRegistry(new FileProcessDefinitionStore(fileStorage));
        registry.loadStored();
        assembler = new RasterAssembler(fileStorage);
        pipeline = new CoveragePipeline(registry, fetcher, evaluator, assembler);
        jobRunner = new LocalJobRunner(config, taskScheduler, pipeline);
    }

}
