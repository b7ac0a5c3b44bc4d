package io.cadence.core.engine;

public enum JobState {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    RETIRED
}
