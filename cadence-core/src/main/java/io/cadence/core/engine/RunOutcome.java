package io.cadence.core.engine;

import io.cadence.core.dispatch.ExitStatus;
import io.cadence.core.job.Job;

/**
 * Result of one dispatch. {@code job} is the persisted state after the run, or the pre-run snapshot
 * when nothing was written (failed dispatch, job removed while running).
 * {@code state} is {@link JobState#SCHEDULED} after a completed recurring run,
 * {@link JobState#RETIRED} after a completed one-off run, {@link JobState#COMPLETED} when the job
 * was removed while it ran and {@link JobState#FAILED} when the dispatch failed.
 */
public record RunOutcome(Job job, JobState state, ExitStatus status) {

    public boolean success() {
        return status.success();
    }
}
