package com.conveyal.coverage;

import com.conveyal.coverage.catalog.JsonCollectionCatalog;
import com.conveyal.coverage.components.TaskScheduler;
import com.conveyal.coverage.expression.BandEvaluator;
import com.conveyal.coverage.fetch.CoverageFetcher;
import com.conveyal.coverage.fetch.OgcApiCoverageProvider;
import com.conveyal.coverage.jobs.LocalJobRunner;
import com.conveyal.coverage.raster.Interpolation;
import com.conveyal.file.LocalFileStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Properties;

/** Loads config information for the coverage processor and exposes it to the Components. */
public class CoverageConfig extends ConfigBase implements
        TaskScheduler.Config,
        LocalFileStorage.Config,
        JsonCollectionCatalog.Config,
        OgcApiCoverageProvider.Config,
        CoverageFetcher.Config,
        BandEvaluator.Config,
        LocalJobRunner.Config
{

    private static final Logger LOG = LoggerFactory.getLogger(CoverageConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "coverage.properties";

    private final String localCacheDirectory;
    private final String serverUrl;
    private final String collectionsFile;
    private final String upstreamUrl;
    private final int upstreamTimeoutSeconds;
    private final int fetchThreads;
    private final int evaluationThreads;
    private final int pipelineThreads;
    private final long evaluationTimeoutMillis;
    private final long evaluationMaxCells;
    private final long maxGridCells;
    private final String resampling;
    private final int jobRetentionSeconds;

    protected CoverageConfig (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        super(properties, environment, systemProperties);
        // No defaults are supplied here. Any defaults should be shipped in an example config file.
        localCacheDirectory = strProp("local-cache");
        serverUrl = strProp("server-url");
        collectionsFile = strProp("collections-file");
        upstreamUrl = strProp("upstream-url");
        upstreamTimeoutSeconds = positiveIntProp("upstream-timeout-seconds");
        fetchThreads = positiveIntProp("fetch-threads");
        evaluationThreads = positiveIntProp("evaluation-threads");
        pipelineThreads = positiveIntProp("pipeline-threads");
        evaluationTimeoutMillis = longProp("evaluation-timeout-millis");
        evaluationMaxCells = longProp("evaluation-max-cells");
        maxGridCells = longProp("max-grid-cells");
        resampling = strProp("resampling");
        jobRetentionSeconds = positiveIntProp("job-retention-seconds");
        if (resampling != null) {
            try {
                Interpolation.fromKey(resampling);
            } catch (IllegalArgumentException e) {
                LOG.error("Value of configuration option 'resampling' is not a known method: {}", resampling);
                keysWithErrors.add("resampling");
            }
        }
    }

    @Override public String localCacheDirectory ()     { return localCacheDirectory; }
    @Override public String serverUrl ()               { return serverUrl; }
    @Override public String collectionsFile ()         { return collectionsFile; }
    @Override public String upstreamUrl ()             { return upstreamUrl; }
    @Override public int    upstreamTimeoutSeconds ()  { return upstreamTimeoutSeconds; }
    @Override public int    fetchThreads ()            { return fetchThreads; }
    @Override public int    evaluationThreads ()       { return evaluationThreads; }
    @Override public int    pipelineThreads ()         { return pipelineThreads; }
    @Override public long   evaluationTimeoutMillis () { return evaluationTimeoutMillis; }
    @Override public long   evaluationMaxCells ()      { return evaluationMaxCells; }
    @Override public long   maxGridCells ()            { return maxGridCells; }
    @Override public String resampling ()              { return resampling; }
    @Override public int    jobRetentionSeconds ()     { return jobRetentionSeconds; }

    // Static factory methods. Always use these to construct CoverageConfig objects for readability.

    /** Load a config file, applying environment and system property overrides. Exits the JVM if anything is wrong. */
    public static CoverageConfig fromFile (String filename) {
        CoverageConfig config = new CoverageConfig(propsFromFile(filename), System.getenv(), System.getProperties());
        config.exitIfErrors();
        return config;
    }

    public static CoverageConfig fromDefaultFile () {
        return fromFile(DEFAULT_CONFIG_FILE);
    }

    /**
     * Build a config from properties alone, ignoring the environment. Throws IllegalArgumentException naming every
     * missing or invalid key.
     */
    public static CoverageConfig fromProperties (Properties properties) {
        return fromProperties(properties, Map.of());
    }

    public static CoverageConfig fromProperties (Properties properties, Map<String, String> overrides) {
        CoverageConfig config = new CoverageConfig(properties, overrides, Map.of());
        config.throwIfErrors();
        return config;
    }

}
