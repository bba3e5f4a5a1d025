package com.conveyal.coverage.progress;

/**
 * For code that supports progress listeners but may not always be given one, this avoids littering it with null
 * checks.
 */
public class NoopProgressListener implements ProgressListener {

    @Override
    public void beginTask (String description, int totalElements) { }

    @Override
    public void increment () { }

    @Override
    public void increment (int n) { }

}
