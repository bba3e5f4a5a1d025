package com.conveyal.coverage.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Convenience functions for reporting throwables in logs and job status messages.
 */
public abstract class ExceptionUtils {

    /** The usual multi-line Java stack trace including the chain of causes, as a String. */
    public static String stackTraceString (Throwable throwable) {
        StringWriter sw = new StringWriter();
        throwable.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /**
     * One-line summary of a throwable and its causes, root cause first, e.g.
     * "SocketTimeoutException: Read timed out, caused IOException: fetch failed".
     */
    public static String shortCauseString (Throwable throwable) {
        List<String> items = new ArrayList<>();
        Set<Throwable> seen = new HashSet<>(); // Bail out if there are cycles in the cause chain
        while (throwable != null && !seen.contains(throwable)) {
            String item = throwable.getClass().getSimpleName();
            if (throwable.getMessage() != null) {
                item += ": " + throwable.getMessage();
            }
            items.add(item);
            seen.add(throwable);
            throwable = throwable.getCause();
        }
        Collections.reverse(items);
        return String.join(", caused ", items);
    }

    /**
     * Strip the wrappers that executors and futures put around the exception actually thrown by a task, so callers
     * can react to the task's own failure type.
     */
    public static Throwable unwrapExecution (Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

}
