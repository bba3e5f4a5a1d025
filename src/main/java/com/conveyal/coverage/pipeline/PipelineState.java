package com.conveyal.coverage.pipeline;

import com.conveyal.coverage.CoverageProcessException;

/**
 * Stages of one invocation. Each non-terminal stage names the error kind an unexpected exception escaping it is
 * reported as.
 */
public enum PipelineState {

    PENDING(CoverageProcessException.Type.INVALID_DEFINITION),
    FETCHING(CoverageProcessException.Type.UPSTREAM_FETCH_ERROR),
    EVALUATING(CoverageProcessException.Type.EXPRESSION_RUNTIME_ERROR),
    ASSEMBLING(CoverageProcessException.Type.SERIALIZATION_ERROR),
    COMPLETED(null),
    FAILED(null);

    final CoverageProcessException.Type unexpectedFailureType;

    PipelineState (CoverageProcessException.Type unexpectedFailureType) {
        this.unexpectedFailureType = unexpectedFailureType;
    }

    public boolean isTerminal () {
        return this == COMPLETED || this == FAILED;
    }

}
