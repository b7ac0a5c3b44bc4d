package io.cadence.core.engine;

import io.cadence.core.JobAlreadyRunningException;
import io.cadence.core.JobNotFoundException;
import io.cadence.core.JobNotRunnableException;
import io.cadence.core.ValidationException;
import io.cadence.core.dispatch.Dispatcher;
import io.cadence.core.dispatch.ExitStatus;
import io.cadence.core.job.ContextValue;
import io.cadence.core.job.Job;
import io.cadence.core.job.JobStore;
import io.cadence.core.schedule.Cadence;
import io.cadence.core.schedule.OccurrenceCalculator;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives persisted jobs through schedule, dispatch and reschedule. Runs are triggered externally
 * through {@link #run(String)} or {@link #runDue()}; nothing here fires on a timer.
 *
 * <p>At most one dispatch per job id is in flight within this engine. The store is only touched
 * before and after the command runs, never while it runs.
 */
public final class SchedulerEngine {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerEngine.class);

    private final JobStore store;
    private final OccurrenceCalculator calculator;
    private final Dispatcher dispatcher;
    private final Clock clock;
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public SchedulerEngine(JobStore store, OccurrenceCalculator calculator, Dispatcher dispatcher, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Job schedule(ScheduleRequest request) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        if (request.command() == null || request.command().isBlank()) {
            throw new ValidationException("command is required");
        }
        if (request.cadence() == null) {
            throw new ValidationException("frequency is required");
        }
        Cadence cadence = request.cadence().validate();
        validateContext(request.context());

        Instant now = clock.instant();
        Job job = Job.create(
            UUID.randomUUID().toString(),
            request.name().trim(),
            request.command(),
            cadence,
            request.context(),
            now,
            calculator.nextOccurrence(cadence, now)
        );
        store.add(job);
        LOG.info("Scheduled job {} ({}) {}, next run {}", job.id(), job.name(), cadence.describe(), job.nextRun());
        return job;
    }

    public List<Job> list() throws IOException {
        return store.list();
    }

    public Optional<Job> find(String id) throws IOException {
        return store.findById(id);
    }

    public Job remove(String id) throws IOException {
        Job removed = store.remove(id);
        LOG.info("Removed job {} ({})", removed.id(), removed.name());
        return removed;
    }

    public void clear() throws IOException {
        store.clear();
        LOG.info("Cleared all jobs");
    }

    public JobState state(Job job) {
        if (running.contains(job.id())) {
            return JobState.RUNNING;
        }
        return job.enabled() ? JobState.SCHEDULED : JobState.RETIRED;
    }

    /**
     * Dispatches one job now, regardless of its due time, and persists the result.
     *
     * @throws JobNotFoundException if no job has this id
     * @throws JobNotRunnableException if the job is disabled
     * @throws JobAlreadyRunningException if the job is already being dispatched
     */
    public RunOutcome run(String id) throws IOException {
        if (!running.add(id)) {
            throw new JobAlreadyRunningException(id);
        }
        try {
            // read under the slot so a run that just retired the job is seen
            Job job = store.findById(id).orElseThrow(() -> new JobNotFoundException(id));
            if (!job.enabled()) {
                throw new JobNotRunnableException(id);
            }
            return dispatch(job);
        } finally {
            running.remove(id);
        }
    }

    /**
     * Runs every enabled job whose next run is not after now. A failing job does not stop the
     * others; jobs already in flight are skipped.
     */
    public List<RunOutcome> runDue() throws IOException {
        Instant now = clock.instant();
        List<RunOutcome> outcomes = new ArrayList<>();
        for (Job job : store.list()) {
            if (!job.enabled() || job.nextRun() == null || job.nextRun().isAfter(now)) {
                continue;
            }
            try {
                outcomes.add(run(job.id()));
            } catch (JobAlreadyRunningException | JobNotFoundException | JobNotRunnableException e) {
                LOG.debug("Skipping job {}: {}", job.id(), e.getMessage());
            }
        }
        return outcomes;
    }

    private RunOutcome dispatch(Job job) throws IOException {
        LOG.info("Running job {} ({})", job.id(), job.name());
        ExitStatus status = dispatcher.execute(job.command(), job.context());
        if (!status.success()) {
            LOG.warn("Job {} ({}) failed: {}", job.id(), job.name(), status.error());
            return new RunOutcome(job, JobState.FAILED, status);
        }

        Instant finishedAt = clock.instant();
        Job updated;
        try {
            updated = store.update(job.id(), current -> current.cadence().recurring()
                ? current.withCompletedRun(finishedAt, calculator.nextOccurrence(current.cadence(), finishedAt))
                : current.retired(finishedAt));
        } catch (JobNotFoundException e) {
            LOG.info("Job {} was removed while running, nothing to reschedule", job.id());
            return new RunOutcome(job, JobState.COMPLETED, status);
        }

        if (updated.enabled()) {
            LOG.info("Job {} ({}) completed, next run {}", updated.id(), updated.name(), updated.nextRun());
            return new RunOutcome(updated, JobState.SCHEDULED, status);
        }
        LOG.info("Job {} ({}) completed and retired", updated.id(), updated.name());
        return new RunOutcome(updated, JobState.RETIRED, status);
    }

    private static void validateContext(Map<String, ContextValue> context) {
        if (context == null) {
            return;
        }
        context.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                throw new ValidationException("context keys must not be blank");
            }
            if (value == null) {
                throw new ValidationException("context value for " + key + " must not be null");
            }
        });
    }
}
