package io.cadence.core;

public class JobAlreadyRunningException extends IllegalStateException {

    public JobAlreadyRunningException(String jobId) {
        super("Job is already running: " + jobId);
    }
}
