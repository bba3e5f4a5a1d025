package com.conveyal.coverage;

import com.conveyal.coverage.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single failure type of the coverage pipeline and its registration step. The Type tells the caller (the request
 * front-end or the job runner) what went wrong, which HTTP status to report, and whether retrying the same invocation
 * verbatim could possibly succeed. No partial output ever accompanies one of these.
 */
public class CoverageProcessException extends RuntimeException {

    private static final Logger LOG = LoggerFactory.getLogger(CoverageProcessException.class);

    public final Type type;
    public final String message;

    public enum Type {
        // Registration time.
        UNKNOWN_PROCESS(404, false),
        CYCLIC_DEFINITION(400, false),
        INVALID_DEFINITION(400, false),
        // Fetching.
        BAND_NOT_FOUND(400, false),
        DATA_UNAVAILABLE(404, false),
        UPSTREAM_FETCH_ERROR(502, true),
        // Evaluation and assembly.
        GRID_MISMATCH(500, false),
        EXPRESSION_SYNTAX_ERROR(400, false),
        EXPRESSION_RUNTIME_ERROR(400, false),
        EVALUATION_TIMEOUT(504, true),
        UNSUPPORTED_FORMAT(400, false),
        SERIALIZATION_ERROR(500, false);

        public final int httpCode;

        /** Only transient upstream trouble and timeouts are worth retrying without changing the request. */
        public final boolean retryable;

        Type (int httpCode, boolean retryable) {
            this.httpCode = httpCode;
            this.retryable = retryable;
        }
    }

    public static CoverageProcessException unknownProcess (String processId) {
        return new CoverageProcessException(Type.UNKNOWN_PROCESS, "No process is registered with id " + processId);
    }

    public static CoverageProcessException cyclicDefinition (String message) {
        return new CoverageProcessException(Type.CYCLIC_DEFINITION, message);
    }

    public static CoverageProcessException invalidDefinition (String message) {
        return new CoverageProcessException(Type.INVALID_DEFINITION, message);
    }

    public static CoverageProcessException bandNotFound (String message) {
        return new CoverageProcessException(Type.BAND_NOT_FOUND, message);
    }

    public static CoverageProcessException dataUnavailable (String message) {
        return new CoverageProcessException(Type.DATA_UNAVAILABLE, message);
    }

    public static CoverageProcessException upstreamFetchError (String message, Throwable cause) {
        return new CoverageProcessException(Type.UPSTREAM_FETCH_ERROR, message, cause);
    }

    public static CoverageProcessException gridMismatch (String message) {
        return new CoverageProcessException(Type.GRID_MISMATCH, message);
    }

    public static CoverageProcessException syntaxError (String message) {
        return new CoverageProcessException(Type.EXPRESSION_SYNTAX_ERROR, message);
    }

    public static CoverageProcessException runtimeError (String message) {
        return new CoverageProcessException(Type.EXPRESSION_RUNTIME_ERROR, message);
    }

    public static CoverageProcessException evaluationTimeout (String message) {
        return new CoverageProcessException(Type.EVALUATION_TIMEOUT, message);
    }

    public static CoverageProcessException unsupportedFormat (String format) {
        return new CoverageProcessException(Type.UNSUPPORTED_FORMAT, "Unsupported output format: " + format);
    }

    public static CoverageProcessException serializationError (String message, Throwable cause) {
        return new CoverageProcessException(Type.SERIALIZATION_ERROR, message, cause);
    }

    /**
     * Wrap anything unexpected that escapes a pipeline stage. Such throwables indicate bugs rather than bad input, but
     * the invocation must still fail with one of the known kinds, so they are reported against the stage's own type.
     */
    public static CoverageProcessException wrap (Throwable throwable, Type type) {
        if (throwable instanceof CoverageProcessException) {
            return (CoverageProcessException) throwable;
        }
        LOG.error("Unexpected exception classified as {}: {}", type, ExceptionUtils.stackTraceString(throwable));
        return new CoverageProcessException(type, ExceptionUtils.shortCauseString(throwable), throwable);
    }

    public CoverageProcessException (Type type, String message) {
        this(type, message, null);
    }

    public CoverageProcessException (Type type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.message = message;
    }

    public boolean isRetryable () {
        return type.retryable;
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public String toString () {
        return type + ": " + message;
    }
}
