package io.cadence.core;

/**
 * The job exists but is disabled, typically a one-off job that already fired.
 */
public class JobNotRunnableException extends IllegalStateException {

    public JobNotRunnableException(String jobId) {
        super("Job is disabled: " + jobId);
    }
}
