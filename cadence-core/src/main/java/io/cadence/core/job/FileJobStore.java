package io.cadence.core.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cadence.core.JobNotFoundException;
import io.cadence.core.PersistenceException;
import io.cadence.core.ValidationException;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON file backed {@link JobStore}.
 *
 * <p>Mutations hold a monitor shared by every store on the same path and an OS lock on {@code <file>.lock}, re-read the
 * file, apply the change and replace the file through an atomic rename. Two processes updating
 * different jobs therefore never overwrite each other. Reads take no lock; the rename guarantees
 * they see a complete file.
 *
 * <p>An unreadable file reads as an empty list with a warning. Mutations other than {@link #clear()}
 * refuse to run against it so its contents are not lost.
 */
public final class FileJobStore implements JobStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileJobStore.class);
    private static final TypeReference<List<Job>> JOB_LIST = new TypeReference<>() {
    };
    // file locks are held per JVM, so stores sharing a path also share a monitor
    private static final ConcurrentMap<Path, Object> PATH_MONITORS = new ConcurrentHashMap<>();

    private final Path path;
    private final Path lockPath;
    private final Object monitor;
    private final ObjectMapper mapper;

    public FileJobStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath();
        this.lockPath = this.path.resolveSibling(this.path.getFileName() + ".lock");
        this.monitor = PATH_MONITORS.computeIfAbsent(this.path.normalize(), key -> new Object());
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized void add(Job job) throws IOException {
        Objects.requireNonNull(job, "job must not be null");
        mutate(jobs -> {
            if (indexOf(jobs, job.id()) >= 0) {
                throw new ValidationException("duplicate job id: " + job.id());
            }
            jobs.add(job);
            return null;
        });
        LOG.debug("Added job {} ({})", job.id(), job.name());
    }

    @Override
    public synchronized List<Job> list() {
        try {
            return readStrict();
        } catch (IOException e) {
            LOG.warn("Job store {} is unreadable, treating it as empty: {}", path, e.getMessage());
            return List.of();
        }
    }

    @Override
    public synchronized Optional<Job> findById(String id) {
        return list().stream().filter(job -> job.id().equals(id)).findFirst();
    }

    @Override
    public synchronized Job remove(String id) throws IOException {
        Job removed = mutate(jobs -> {
            int index = indexOf(jobs, id);
            if (index < 0) {
                throw new JobNotFoundException(id);
            }
            return jobs.remove(index);
        });
        LOG.debug("Removed job {}", id);
        return removed;
    }

    @Override
    public synchronized void update(Job job) throws IOException {
        Objects.requireNonNull(job, "job must not be null");
        update(job.id(), current -> job);
    }

    @Override
    public synchronized Job update(String id, UnaryOperator<Job> change) throws IOException {
        return mutate(jobs -> {
            int index = indexOf(jobs, id);
            if (index < 0) {
                throw new JobNotFoundException(id);
            }
            Job updated = change.apply(jobs.get(index));
            if (!updated.id().equals(id)) {
                throw new ValidationException("job id cannot change: " + id + " -> " + updated.id());
            }
            jobs.set(index, updated);
            return updated;
        });
    }

    @Override
    public synchronized void clear() throws IOException {
        withFileLock(() -> {
            write(List.of());
            return null;
        });
        LOG.debug("Cleared job store {}", path);
    }

    private <T> T mutate(Function<List<Job>, T> change) throws IOException {
        return withFileLock(() -> {
            List<Job> jobs = new ArrayList<>(readStrict());
            T result = change.apply(jobs);
            write(jobs);
            return result;
        });
    }

    private <T> T withFileLock(LockedAction<T> action) throws IOException {
        try {
            Files.createDirectories(path.getParent());
        } catch (IOException e) {
            throw new PersistenceException("Failed to create job store directory " + path.getParent(), e);
        }
        synchronized (monitor) {
            try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.run();
            } catch (PersistenceException e) {
                throw e;
            } catch (IOException e) {
                throw new PersistenceException("Failed to lock job store " + lockPath, e);
            }
        }
    }

    private List<Job> readStrict() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            String json = Files.readString(path);
            if (json.isBlank()) {
                return List.of();
            }
            List<Job> jobs = mapper.readValue(json, JOB_LIST);
            return jobs == null ? List.of() : jobs;
        } catch (IOException | RuntimeException e) {
            throw new PersistenceException("Job store " + path + " is unreadable", e);
        }
    }

    private void write(List<Job> jobs) throws PersistenceException {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(jobs);
            Files.writeString(tmp, json + System.lineSeparator());
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            discard(tmp);
            throw new PersistenceException("Failed to write job store " + path, e);
        }
    }

    private static void discard(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Failed to delete temporary file {}: {}", tmp, e.getMessage());
        }
    }

    private static int indexOf(List<Job> jobs, String id) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    @FunctionalInterface
    private interface LockedAction<T> {
        T run() throws IOException;
    }
}
