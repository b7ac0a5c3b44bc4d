package io.cadence.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cadence.core.JobNotFoundException;
import io.cadence.core.PersistenceException;
import io.cadence.core.ValidationException;
import io.cadence.core.schedule.Cadence;
import io.cadence.core.schedule.Frequency;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileJobStoreTest {

    private static final Instant CREATED = Instant.parse("2024-01-15T15:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldRoundTripJobsFieldForField() throws Exception {
        Path path = tempDir.resolve("store/jobs.json");
        Map<String, ContextValue> context = new LinkedHashMap<>();
        context.put("region", ContextValue.of("eu-west"));
        context.put("retries", ContextValue.of(3));
        context.put("ratio", ContextValue.of(0.25));
        context.put("dryRun", ContextValue.of(true));

        Job weekly = new Job(
            UUID.randomUUID().toString(), "weekly-sync", "sync --all", Frequency.WEEKLY,
            LocalTime.of(9, 0), null, DayOfWeek.MONDAY, null, context,
            CREATED, Instant.parse("2024-01-15T09:00:05Z"), Instant.parse("2024-01-22T09:00:00Z"), true
        );
        Job once = Job.create(
            UUID.randomUUID().toString(), "launch", "deploy", Cadence.once(LocalDate.of(2024, 2, 1), LocalTime.of(8, 30)),
            Map.of(), CREATED, Instant.parse("2024-02-01T08:30:00Z")
        );
        Job monthly = Job.create(
            UUID.randomUUID().toString(), "invoice", "bill", Cadence.monthly(31, LocalTime.of(6, 0)),
            null, CREATED, Instant.parse("2024-01-31T06:00:00Z")
        );

        FileJobStore store = new FileJobStore(path);
        store.add(weekly);
        store.add(once);
        store.add(monthly);

        List<Job> reloaded = new FileJobStore(path).list();

        assertThat(reloaded).containsExactly(weekly, once, monthly);
        assertThat(reloaded.get(0).context()).containsExactlyEntriesOf(context);
    }

    @Test
    void shouldWriteDocumentedFieldNames() throws Exception {
        Path path = tempDir.resolve("jobs.json");
        FileJobStore store = new FileJobStore(path);
        store.add(job("report", Cadence.monthly(15, LocalTime.of(14, 30))));

        String json = Files.readString(path);

        assertThat(json)
            .contains("\"id\"", "\"name\"", "\"command\"", "\"time\"", "\"date\"", "\"weekday\"", "\"dayOfMonth\" : 15")
            .contains("\"context\"", "\"createdAt\"", "\"lastRun\"", "\"nextRun\"", "\"enabled\" : true")
            .contains("\"frequency\" : \"monthly\"", "\"14:30\"", "\"2024-01-15T15:00:00Z\"");
    }

    @Test
    void shouldFindUpdateAndRemoveById() throws Exception {
        FileJobStore store = new FileJobStore(tempDir.resolve("jobs.json"));
        Job first = job("first", Cadence.hourly());
        Job second = job("second", Cadence.daily(LocalTime.NOON));
        store.add(first);
        store.add(second);

        Job disabled = first.retired(CREATED.plusSeconds(60));
        store.update(disabled);

        assertThat(store.findById(first.id())).contains(disabled);
        assertThat(store.remove(second.id())).isEqualTo(second);
        assertThat(store.list()).containsExactly(disabled);
        assertThat(store.findById(second.id())).isEmpty();
    }

    @Test
    void shouldReportUnknownIds() throws Exception {
        FileJobStore store = new FileJobStore(tempDir.resolve("jobs.json"));
        store.add(job("only", Cadence.hourly()));

        assertThatThrownBy(() -> store.remove("missing")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> store.update(job("ghost", Cadence.hourly()))).isInstanceOf(JobNotFoundException.class);
        assertThat(store.list()).hasSize(1);
    }

    @Test
    void shouldRejectDuplicateIds() throws Exception {
        FileJobStore store = new FileJobStore(tempDir.resolve("jobs.json"));
        Job job = job("dup", Cadence.hourly());
        store.add(job);

        assertThatThrownBy(() -> store.add(job)).isInstanceOf(ValidationException.class);
        assertThat(store.list()).hasSize(1);
    }

    @Test
    void shouldApplyUpdatesToLatestSnapshotAcrossInstances() throws Exception {
        Path path = tempDir.resolve("jobs.json");
        FileJobStore first = new FileJobStore(path);
        FileJobStore second = new FileJobStore(path);
        Job a = job("a", Cadence.hourly());
        Job b = job("b", Cadence.hourly());
        first.add(a);
        second.add(b);

        first.update(a.id(), current -> current.retired(CREATED));
        second.update(b.id(), current -> current.withCompletedRun(CREATED, CREATED.plusSeconds(3600)));

        List<Job> jobs = new FileJobStore(path).list();
        assertThat(jobs).extracting(Job::name).containsExactly("a", "b");
        assertThat(jobs.get(0).enabled()).isFalse();
        assertThat(jobs.get(1).lastRun()).isEqualTo(CREATED);
    }

    @Test
    void shouldNotLoseConcurrentWrites() throws Exception {
        Path path = tempDir.resolve("jobs.json");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                FileJobStore store = new FileJobStore(path);
                int id = worker;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 10; i++) {
                        store.add(job("w" + id + "-" + i, Cadence.hourly()));
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(new FileJobStore(path).list()).hasSize(40);
    }

    @Test
    void corruptFileReadsAsEmptyButIsNotOverwritten() throws Exception {
        Path path = tempDir.resolve("jobs.json");
        Files.writeString(path, "{not json");
        FileJobStore store = new FileJobStore(path);

        assertThat(store.list()).isEmpty();
        assertThatThrownBy(() -> store.add(job("new", Cadence.hourly()))).isInstanceOf(PersistenceException.class);
        assertThat(Files.readString(path)).isEqualTo("{not json");

        store.clear();
        assertThat(Files.readString(path)).doesNotContain("not json");
        assertThat(store.list()).isEmpty();
    }

    @Test
    void failedWriteLeavesPreviousStateIntact() throws Exception {
        Path path = tempDir.resolve("jobs.json");
        FileJobStore store = new FileJobStore(path);
        Job kept = job("kept", Cadence.hourly());
        store.add(kept);
        String before = Files.readString(path);

        // a directory where the temp file should go makes the write fail
        Files.createDirectories(tempDir.resolve("jobs.json.tmp").resolve("blocker"));

        assertThatThrownBy(() -> store.add(job("lost", Cadence.hourly()))).isInstanceOf(PersistenceException.class);
        assertThat(Files.readString(path)).isEqualTo(before);
        assertThat(store.list()).containsExactly(kept);
    }

    @Test
    void clearRemovesEverything() throws Exception {
        FileJobStore store = new FileJobStore(tempDir.resolve("jobs.json"));
        store.add(job("one", Cadence.hourly()));
        store.add(job("two", Cadence.hourly()));

        store.clear();

        assertThat(store.list()).isEmpty();
    }

    @Test
    void missingFileReadsAsEmpty() {
        assertThat(new FileJobStore(tempDir.resolve("absent/jobs.json")).list()).isEmpty();
    }

    private static Job job(String name, Cadence cadence) {
        return Job.create(UUID.randomUUID().toString(), name, "echo " + name, cadence, Map.of(), CREATED, CREATED.plusSeconds(3600));
    }
}
