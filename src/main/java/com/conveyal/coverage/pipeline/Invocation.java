package com.conveyal.coverage.pipeline;

import com.conveyal.coverage.CoverageProcessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkState;

/**
 * One run of the pipeline for one process. Tracks the stage the run is in and, once it has failed, the kind of
 * error that ended it. The state only moves forward through PENDING, FETCHING, EVALUATING, ASSEMBLING and COMPLETED,
 * or to FAILED from any stage before COMPLETED. Terminal states are final.
 */
public class Invocation {

    private static final Logger LOG = LoggerFactory.getLogger(Invocation.class);

    public final String id;

    public final String processId;

    private volatile PipelineState state = PipelineState.PENDING;

    private volatile CoverageProcessException failure;

    private final List<PipelineState> history = new ArrayList<>();

    public Invocation (String processId) {
        this(UUID.randomUUID().toString(), processId);
    }

    public Invocation (String id, String processId) {
        this.id = id;
        this.processId = processId;
        history.add(state);
    }

    synchronized void advanceTo (PipelineState next) {
        checkState(!state.isTerminal(), "Invocation %s is already %s.", id, state);
        checkState(next != PipelineState.FAILED, "Use fail() to fail an invocation.");
        checkState(next.ordinal() > state.ordinal(), "Invocation %s cannot go from %s to %s.", id, state, next);
        LOG.info("Invocation {} of process {}: {} -> {}", id, processId, state, next);
        state = next;
        history.add(next);
    }

    /** Move to FAILED, recording the error. Returns the exception to be rethrown. */
    synchronized CoverageProcessException fail (Throwable throwable) {
        checkState(!state.isTerminal(), "Invocation %s is already %s.", id, state);
        CoverageProcessException exception = CoverageProcessException.wrap(throwable, state.unexpectedFailureType);
        LOG.info("Invocation {} of process {}: {} -> FAILED ({})", id, processId, state, exception);
        failure = exception;
        state = PipelineState.FAILED;
        history.add(PipelineState.FAILED);
        return exception;
    }

    public PipelineState getState () {
        return state;
    }

    /** The error that ended this invocation, or null if it has not failed. */
    public CoverageProcessException getFailure () {
        return failure;
    }

    /** Every state this invocation has been in, in order. */
    public synchronized List<PipelineState> getHistory () {
        return new ArrayList<>(history);
    }

}
