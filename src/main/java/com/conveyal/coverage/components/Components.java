package com.conveyal.coverage.components;

import com.conveyal.coverage.CoverageConfig;
import com.conveyal.coverage.catalog.CollectionCatalog;
import com.conveyal.coverage.expression.BandEvaluator;
import com.conveyal.coverage.fetch.CoverageFetcher;
import com.conveyal.coverage.fetch.CoverageProvider;
import com.conveyal.coverage.jobs.JobRunner;
import com.conveyal.coverage.pipeline.CoveragePipeline;
import com.conveyal.coverage.pipeline.RasterAssembler;
import com.conveyal.coverage.process.ExpressionRegistry;
import com.conveyal.file.FileStorage;

/**
 * We wire up our components by hand instead of relying on a dependency injection framework. This amounts to a manual
 * depth-first traversal of the dependency graph, which is not prohibitive for a limited number of components.
 *
 * This class keeps references to all components of the system in one place. Making the components instances allows
 * them to be replaced with other implementations, e.g. to switch between coverage sources or storage systems.
 * Outside code should not reference these fields after construction: each component holds final references to the
 * other components it needs, passed into its constructor by the wiring-up code in a subclass.
 */
public abstract class Components {

    public CoverageConfig config;
    public TaskScheduler taskScheduler;
    public FileStorage fileStorage;
    public CollectionCatalog catalog;
    /** The outbound transport to the coverage source. */
    public CoverageProvider coverageProvider;
    public CoverageFetcher fetcher;
    public BandEvaluator evaluator;
    public ExpressionRegistry registry;
    public RasterAssembler assembler;
    public CoveragePipeline pipeline;
    public JobRunner jobRunner;

    /** Stop all background threads. */
    public void shutdown () {
        taskScheduler.shutdown();
        fetcher.shutdown();
        evaluator.shutdown();
    }

}
