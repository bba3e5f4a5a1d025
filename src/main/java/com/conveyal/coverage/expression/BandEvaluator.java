package com.conveyal.coverage.expression;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.components.Component;
import com.conveyal.coverage.expression.Value.ArrayValue;
import com.conveyal.coverage.expression.Value.Scalar;
import com.conveyal.coverage.raster.GridExtents;
import com.conveyal.coverage.raster.RasterArray;
import com.conveyal.coverage.util.ExceptionUtils;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Evaluates band scripts against named arrays. Each evaluation runs on a small dedicated pool, so a runaway script
 * occupies one of those threads rather than a pipeline thread, and under a wall-clock budget counted from the moment
 * it starts running. The interpreter stops itself when the budget is spent. If it somehow does not, the waiting
 * caller gives up shortly after, interrupts it and reports EVALUATION_TIMEOUT all the same.
 *
 * Scripts only see the arrays passed in and their own local variables. The language has no way to reach files,
 * the network, or any object of the host process.
 */
public class BandEvaluator implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(BandEvaluator.class);

    /** Extra wait beyond the budget before the caller stops waiting for the interpreter to notice on its own. */
    private static final long GRACE_MILLIS = 250;

    public interface Config {
        int evaluationThreads ();
        long evaluationTimeoutMillis ();
        long evaluationMaxCells ();
    }

    private final ExecutorService evaluationExecutor;

    private final long timeoutMillis;

    private final long maxCells;

    public BandEvaluator (Config config) {
        this.timeoutMillis = config.evaluationTimeoutMillis();
        this.maxCells = config.evaluationMaxCells();
        this.evaluationExecutor = Executors.newFixedThreadPool(
                config.evaluationThreads(),
                new ThreadFactoryBuilder().setNameFormat("band-evaluator-%d").setDaemon(true).build()
        );
    }

    /** Compile and evaluate a one-off expression. The result is labelled "result". */
    public RasterArray evaluate (String expression, Map<String, RasterArray> availableArrays) {
        return evaluate(BandScript.compile("result", expression), availableArrays);
    }

    /**
     * Evaluate a compiled script. Every free identifier of the script must be a key of availableArrays, otherwise the
     * evaluation fails with EXPRESSION_RUNTIME_ERROR. The result is a new array labelled with the script's band name,
     * on the grid of the arrays it was computed from. The input arrays are not modified.
     */
    public RasterArray evaluate (BandScript script, Map<String, RasterArray> availableArrays) {
        for (String identifier : script.freeIdentifiers()) {
            if (!availableArrays.containsKey(identifier)) {
                throw CoverageProcessException.runtimeError(String.format(
                        "Script for band %s refers to %s, which is not an available band.", script.band, identifier));
            }
        }
        // Bind only what the script reads.
        Map<String, RasterArray> bindings = new HashMap<>();
        for (String identifier : script.freeIdentifiers()) {
            bindings.put(identifier, availableArrays.get(identifier));
        }
        GridExtents fallbackGrid = availableArrays.isEmpty() ? null : availableArrays.values().iterator().next().extents;
        return execute(script, Collections.unmodifiableMap(bindings), fallbackGrid);
    }

    private RasterArray execute (BandScript script, Map<String, RasterArray> bindings, GridExtents fallbackGrid) {
        CountDownLatch started = new CountDownLatch(1);
        AtomicLong startNanos = new AtomicLong();
        Future<Value> future = evaluationExecutor.submit(() -> {
            long now = System.nanoTime();
            startNanos.set(now);
            started.countDown();
            EvaluationScope scope = new EvaluationScope(
                    bindings, now + TimeUnit.MILLISECONDS.toNanos(timeoutMillis), maxCells);
            return script.run(scope);
        });
        Value value;
        try {
            started.await();
            long waitNanos = startNanos.get() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis + GRACE_MILLIS)
                    - System.nanoTime();
            value = future.get(Math.max(0, waitNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Script for band {} did not stop at its deadline and was interrupted.", script.band);
            throw CoverageProcessException.evaluationTimeout(String.format(
                    "Script for band %s exceeded %d ms.", script.band, timeoutMillis));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw CoverageProcessException.evaluationTimeout("Interrupted while evaluating band " + script.band);
        } catch (ExecutionException e) {
            throw classify(script, ExceptionUtils.unwrapExecution(e));
        }
        return toRasterArray(script.band, value, bindings, fallbackGrid);
    }

    private static CoverageProcessException classify (BandScript script, Throwable cause) {
        if (cause instanceof CoverageProcessException) {
            CoverageProcessException e = (CoverageProcessException) cause;
            return new CoverageProcessException(e.type, "Band " + script.band + ": " + e.message, e);
        }
        if (cause instanceof StackOverflowError || cause instanceof OutOfMemoryError) {
            return CoverageProcessException.runtimeError(
                    "Band " + script.band + " exhausted resources: " + cause.getClass().getSimpleName());
        }
        return CoverageProcessException.wrap(cause, CoverageProcessException.Type.EXPRESSION_RUNTIME_ERROR);
    }

    /**
     * Turn the script's value into an independent band. Scalars are expanded over the grid of the inputs. A result
     * that is one of the input arrays themselves is copied, so output and input never share samples.
     */
    private static RasterArray toRasterArray (String band, Value value, Map<String, RasterArray> bindings,
                                              GridExtents fallbackGrid) {
        if (value.isScalar()) {
            GridExtents grid = bindings.isEmpty() ? fallbackGrid : bindings.values().iterator().next().extents;
            if (grid == null) {
                throw CoverageProcessException.runtimeError(
                        "Band " + band + " evaluated to a scalar and there is no grid to expand it onto.");
            }
            double[] values = new double[Math.toIntExact(grid.nCells())];
            Arrays.fill(values, ((Scalar) value).value);
            return new RasterArray(band, grid, values);
        }
        ArrayValue array = (ArrayValue) value;
        for (RasterArray input : bindings.values()) {
            if (input.values() == array.values) {
                return new RasterArray(band, array.extents, array.values.clone());
            }
        }
        return new RasterArray(band, array.extents, array.values);
    }

    public void shutdown () {
        evaluationExecutor.shutdownNow();
    }

}
