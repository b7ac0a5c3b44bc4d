package io.cadence.core;

import java.util.NoSuchElementException;

public class JobNotFoundException extends NoSuchElementException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
