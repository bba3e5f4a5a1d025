package com.conveyal.coverage.expression;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.raster.GridExtents;
import com.conveyal.coverage.raster.RasterArray;

import java.util.HashMap;
import java.util.Map;

/**
 * Everything a running band script can see: the bands bound to it by name, its own local variables, and nothing else.
 * The scope also enforces the limits of one evaluation. Interpreted code calls checkLimits() on every loop iteration
 * and every array operation, and every array allocation goes through allocate(), so a script can neither outlive its
 * deadline nor allocate unbounded memory.
 */
class EvaluationScope {

    private final Map<String, Value> variables = new HashMap<>();

    private final long deadlineNanos;

    private final long maxCells;

    private long allocatedCells = 0;

    /** Grid used to expand a scalar result into a band, null when no arrays are bound. */
    private final GridExtents defaultGrid;

    Value returnValue;

    Value lastValue;

    EvaluationScope (Map<String, RasterArray> bindings, long deadlineNanos, long maxCells) {
        GridExtents grid = null;
        for (Map.Entry<String, RasterArray> entry : bindings.entrySet()) {
            RasterArray array = entry.getValue();
            variables.put(entry.getKey(), new Value.ArrayValue(array.extents, array.values()));
            if (grid == null) grid = array.extents;
        }
        this.defaultGrid = grid;
        this.deadlineNanos = deadlineNanos;
        this.maxCells = maxCells;
    }

    Value lookup (String name) {
        Value value = variables.get(name);
        if (value == null) {
            throw CoverageProcessException.runtimeError("Undefined identifier: " + name);
        }
        return value;
    }

    void assign (String name, Value value) {
        variables.put(name, value);
    }

    GridExtents defaultGrid () {
        return defaultGrid;
    }

    /** Fail if the evaluation has run past its deadline or its thread has been asked to stop. */
    void checkLimits () {
        if (Thread.currentThread().isInterrupted()) {
            throw CoverageProcessException.evaluationTimeout("Evaluation was cancelled.");
        }
        if (System.nanoTime() - deadlineNanos > 0) {
            throw CoverageProcessException.evaluationTimeout("Evaluation exceeded its time limit.");
        }
    }

    /** A new sample array for the given grid, counted against the allocation limit. */
    double[] allocate (GridExtents extents) {
        checkLimits();
        allocatedCells += extents.nCells();
        if (allocatedCells > maxCells) {
            throw CoverageProcessException.runtimeError(String.format(
                    "Evaluation allocated more than %d array cells.", maxCells));
        }
        return new double[Math.toIntExact(extents.nCells())];
    }

}
