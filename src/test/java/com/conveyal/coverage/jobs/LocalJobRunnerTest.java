package com.conveyal.coverage.jobs;

import com.conveyal.coverage.catalog.Collection;
import com.conveyal.coverage.components.TaskScheduler;
import com.conveyal.coverage.expression.BandEvaluator;
import com.conveyal.coverage.fetch.CoverageFetcher;
import com.conveyal.coverage.fetch.CoverageRequest;
import com.conveyal.coverage.fetch.FakeCollectionCatalog;
import com.conveyal.coverage.fetch.FakeCoverageProvider;
import com.conveyal.coverage.pipeline.CoveragePipeline;
import com.conveyal.coverage.pipeline.RasterAssembler;
import com.conveyal.coverage.process.ExpressionRegistry;
import com.conveyal.coverage.process.FileProcessDefinitionStore;
import com.conveyal.coverage.raster.GridExtents;
import com.conveyal.coverage.util.JsonUtil;
import com.conveyal.file.LocalFileStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalJobRunnerTest {

    private static final GridExtents GRID = new GridExtents("EPSG:4326", new Envelope(16, 16.2, 48, 48.2), 2, 2);

    private static final Collection SENTINEL = new Collection("sentinel-2-l2a", null, new Envelope(10, 20, 40, 50),
            "EPSG:4326", null, null, List.of("B04", "B08"));

    private static final Duration WAIT = Duration.ofSeconds(20);

    @TempDir
    Path tempDir;

    private FakeCoverageProvider provider;

    private ExpressionRegistry registry;

    private CoverageFetcher fetcher;

    private BandEvaluator evaluator;

    private TaskScheduler taskScheduler;

    private CoveragePipeline pipeline;

    @BeforeEach
    void setUp () {
        LocalFileStorage fileStorage = new LocalFileStorage(tempDir.toString(), "http://localhost:7070/files");
        provider = new FakeCoverageProvider(GRID).withBand("B04", 1, 1, 1, 1).withBand("B08", 3, 3, 3, 3);
        registry = new ExpressionRegistry(new FileProcessDefinitionStore(fileStorage));
        registry.register("ndvi", List.of("B04", "B08"), Map.of("ndvi", "(B08 - B04) / (B08 + B04)"),
                List.of("sentinel-2-l2a"));
        fetcher = new CoverageFetcher(new CoverageFetcher.Config() {
            @Override public int fetchThreads () { return 2; }
            @Override public long maxGridCells () { return 10_000; }
            @Override public String resampling () { return "nearest"; }
        }, new FakeCollectionCatalog(SENTINEL), provider);
        evaluator = new BandEvaluator(new BandEvaluator.Config() {
            @Override public int evaluationThreads () { return 2; }
            @Override public long evaluationTimeoutMillis () { return 300; }
            @Override public long evaluationMaxCells () { return 1_000_000; }
        });
        taskScheduler = new TaskScheduler(() -> 2);
        pipeline = new CoveragePipeline(registry, fetcher, evaluator, new RasterAssembler(fileStorage));
    }

    @AfterEach
    void tearDown () {
        taskScheduler.shutdown();
        fetcher.shutdown();
        evaluator.shutdown();
    }

    private LocalJobRunner runner (int retentionSeconds) {
        return new LocalJobRunner(() -> retentionSeconds, taskScheduler, pipeline);
    }

    private static JobDefinition job (String processId, String format) {
        CoverageRequest request = CoverageRequest.builder().subset(16, 48, 16.2, 48.2).build();
        return new JobDefinition(processId, request, null, format);
    }

    @Test
    void successfulJobReportsLocation () throws Exception {
        LocalJobRunner runner = runner(3600);
        String jobId = runner.submit(job("ndvi", "GeoTIFF"));
        JobStatus status = runner.awaitCompletion(jobId, WAIT);

        assertNotNull(status);
        assertEquals(JobStatus.Status.SUCCESSFUL, status.status);
        assertEquals(jobId, status.jobId);
        assertEquals("ndvi", status.processId);
        assertEquals(100, status.progress);
        assertEquals("http://localhost:7070/files/results/ndvi/" + jobId + ".tif", status.location);
        assertTrue(status.mediaType.startsWith("image/tiff"));
        assertNull(status.errorType);
        assertNotNull(status.started);
        assertFalse(status.finished.isBefore(status.started));
        assertFalse(status.log.isEmpty());
        assertEquals(Duration.between(status.created, status.started).toMillis(), status.queuedMillis);
        assertEquals(Duration.between(status.started, status.finished).toMillis(), status.executingMillis);
    }

    @Test
    void failedJobReportsErrorKind () throws Exception {
        LocalJobRunner runner = runner(3600);
        provider.failing("B08", new IllegalStateException("connection reset"));
        JobStatus upstream = runner.awaitCompletion(runner.submit(job("ndvi", "GeoTIFF")), WAIT);
        assertEquals(JobStatus.Status.FAILED, upstream.status);
        assertEquals("UPSTREAM_FETCH_ERROR", upstream.errorType);
        assertTrue(upstream.retryable);
        assertNull(upstream.location);

        JobStatus unknown = runner.awaitCompletion(runner.submit(job("nope", "GeoTIFF")), WAIT);
        assertEquals(JobStatus.Status.FAILED, unknown.status);
        assertEquals("UNKNOWN_PROCESS", unknown.errorType);
        assertFalse(unknown.retryable);
    }

    @Test
    void jobsAreIndependent () throws Exception {
        LocalJobRunner runner = runner(3600);
        String bad = runner.submit(job("ndvi", "png"));
        String good = runner.submit(job("ndvi", "GeoTIFF"));
        assertNotEquals(bad, good);
        assertEquals(JobStatus.Status.FAILED, runner.awaitCompletion(bad, WAIT).status);
        assertEquals("UNSUPPORTED_FORMAT", runner.status(bad).errorType);
        assertEquals(JobStatus.Status.SUCCESSFUL, runner.awaitCompletion(good, WAIT).status);
    }

    @Test
    void unknownJobHasNoStatus () throws Exception {
        LocalJobRunner runner = runner(3600);
        assertNull(runner.status("no-such-job"));
        assertNull(runner.awaitCompletion("no-such-job", Duration.ofMillis(50)));
    }

    @Test
    void finishedJobsArePurgedAfterRetention () throws Exception {
        LocalJobRunner runner = runner(0);
        String jobId = runner.submit(job("ndvi", "GeoTIFF"));
        runner.awaitCompletion(jobId, WAIT);
        Thread.sleep(20);
        runner.purgeFinishedJobs();
        assertEquals(0, runner.size());
        assertNull(runner.status(jobId));
    }

    @Test
    void statusSerializesWithoutAbsentFields () throws Exception {
        JobStatus status = new JobStatus();
        status.jobId = "j";
        status.status = JobStatus.Status.ACCEPTED;
        status.created = Instant.parse("2024-01-01T00:00:00Z");
        String json = JsonUtil.objectMapper.writeValueAsString(status);
        assertTrue(json.contains("\"status\" : \"ACCEPTED\""));
        assertTrue(json.contains("2024-01-01T00:00:00Z"));
        assertFalse(json.contains("location"));
    }

}
