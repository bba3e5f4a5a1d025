package com.conveyal.file;

import java.util.Locale;

/**
 * Each file put into storage has a category, corresponding to the subdirectory where it is kept. Results are the
 * rasters produced by process invocations. Processes are the persisted process definitions.
 */
public enum FileCategory {

    RESULTS, PROCESSES;

    /** @return the name of the directory holding all files in this category. */
    public String directoryName () {
        return this.name().toLowerCase(Locale.ROOT);
    }

}
