package com.conveyal.coverage.expression;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.raster.GridExtents;
import com.conveyal.coverage.raster.RasterArray;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BandEvaluatorTest {

    private static final GridExtents GRID = new GridExtents("EPSG:4326", new Envelope(0, 2, 0, 2), 2, 2);

    private BandEvaluator evaluator;

    private Map<String, RasterArray> bands;

    private static BandEvaluator.Config config (long timeoutMillis, long maxCells) {
        return new BandEvaluator.Config() {
            @Override public int evaluationThreads () { return 2; }
            @Override public long evaluationTimeoutMillis () { return timeoutMillis; }
            @Override public long evaluationMaxCells () { return maxCells; }
        };
    }

    @BeforeEach
    void setUp () {
        evaluator = new BandEvaluator(config(300, 1_000_000));
        bands = Map.of(
                "B04", RasterArray.fromRows("B04", GRID, new double[][] {{1, 1}, {1, 1}}),
                "B08", RasterArray.fromRows("B08", GRID, new double[][] {{3, 3}, {3, 3}})
        );
    }

    @AfterEach
    void tearDown () {
        evaluator.shutdown();
    }

    @Test
    void normalizedDifference () {
        RasterArray ndvi = evaluator.evaluate("(B08 - B04) / (B04 + B08)", bands);
        assertEquals("result", ndvi.band);
        assertTrue(ndvi.extents.sameGrid(GRID));
        assertArrayEquals(new double[] {0.5, 0.5, 0.5, 0.5}, ndvi.values());
    }

    @Test
    void resultTakesScriptBandName () {
        RasterArray ndvi = evaluator.evaluate(BandScript.compile("ndvi", "(B08 - B04) / (B04 + B08)"), bands);
        assertEquals("ndvi", ndvi.band);
    }

    @Test
    void inputsAreNotModifiedOrShared () {
        RasterArray copy = evaluator.evaluate("B04", bands);
        assertNotSame(bands.get("B04").values(), copy.values());
        copy.set(0, 0, 42);
        assertEquals(1, bands.get("B04").get(0, 0));
        evaluator.evaluate("B04 = B04 * 10\nB04", bands);
        assertEquals(1, bands.get("B04").get(0, 0));
    }

    @Test
    void unknownBandIsRuntimeError () {
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> evaluator.evaluate("B04 + B99", bands));
        assertEquals(CoverageProcessException.Type.EXPRESSION_RUNTIME_ERROR, e.type);
        assertTrue(e.getMessage().contains("B99"));
    }

    @Test
    void endlessLoopTimesOut () {
        long start = System.currentTimeMillis();
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> evaluator.evaluate("while (1) {}", bands));
        assertEquals(CoverageProcessException.Type.EVALUATION_TIMEOUT, e.type);
        assertTrue(e.isRetryable());
        assertTrue(System.currentTimeMillis() - start < 5_000);
        // The evaluator stays usable afterward.
        assertEquals(4, evaluator.evaluate("B04 + B08", bands).get(1, 1));
    }

    @Test
    void mismatchedShapesAreRuntimeErrors () {
        GridExtents wide = new GridExtents("EPSG:4326", new Envelope(0, 3, 0, 2), 3, 2);
        Map<String, RasterArray> mixed = Map.of(
                "B04", bands.get("B04"),
                "B8A", new RasterArray("B8A", wide, new double[6])
        );
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> evaluator.evaluate("B04 + B8A", mixed));
        assertEquals(CoverageProcessException.Type.EXPRESSION_RUNTIME_ERROR, e.type);
    }

    @Test
    void whereChoosesPerCell () {
        RasterArray b04 = RasterArray.fromRows("B04", GRID, new double[][] {{1, 3}, {5, Double.NaN}});
        RasterArray result = evaluator.evaluate("where(B04 > 2, B04, 0)", Map.of("B04", b04));
        assertArrayEquals(new double[] {0, 3, 5, 0}, result.values());
    }

    @Test
    void scalarResultsAreExpandedOverTheGrid () {
        RasterArray b04 = RasterArray.fromRows("B04", GRID, new double[][] {{1, 3}, {5, 7}});
        Map<String, RasterArray> input = Map.of("B04", b04);
        assertArrayEquals(new double[] {5, 5, 5, 5}, evaluator.evaluate("B04[1, 0]", input).values());
        assertArrayEquals(new double[] {4, 4, 4, 4}, evaluator.evaluate("mean(B04)", input).values());
        assertArrayEquals(new double[] {2, 2, 2, 2}, evaluator.evaluate("1 + 1", input).values());
    }

    @Test
    void scalarWithoutAnyGridIsRuntimeError () {
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> evaluator.evaluate("1 + 1", Map.of()));
        assertEquals(CoverageProcessException.Type.EXPRESSION_RUNTIME_ERROR, e.type);
    }

    @Test
    void indexOutOfRangeIsRuntimeError () {
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> evaluator.evaluate("B04[2, 0]", bands));
        assertEquals(CoverageProcessException.Type.EXPRESSION_RUNTIME_ERROR, e.type);
    }

    @Test
    void arrayConditionInIfIsRuntimeError () {
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> evaluator.evaluate("if (B04 > 0) { 1 } else { 2 }", bands));
        assertEquals(CoverageProcessException.Type.EXPRESSION_RUNTIME_ERROR, e.type);
    }

    @Test
    void divisionByZeroFollowsFloatingPointRules () {
        RasterArray result = evaluator.evaluate("(B04 - 1) / (B04 - 1) + B08 / 0", bands);
        assertTrue(Double.isNaN(result.get(0, 0)));
        assertEquals(Double.POSITIVE_INFINITY, evaluator.evaluate("B08 / 0", bands).get(0, 0));
    }

    @Test
    void allocationLimitIsEnforced () {
        BandEvaluator small = new BandEvaluator(config(300, 10));
        try {
            assertEquals(3, small.evaluate("B04 + 1 + 1", bands).get(0, 0));
            CoverageProcessException e = assertThrows(CoverageProcessException.class,
                    () -> small.evaluate("B04 + 1 + 1 + 1", bands));
            assertEquals(CoverageProcessException.Type.EXPRESSION_RUNTIME_ERROR, e.type);
        } finally {
            small.shutdown();
        }
    }

}
