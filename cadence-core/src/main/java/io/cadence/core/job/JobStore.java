package io.cadence.core.job;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Authoritative list of jobs. Every mutating call is durable once it returns.
 */
public interface JobStore {
    void add(Job job) throws IOException;

    List<Job> list() throws IOException;

    Optional<Job> findById(String id) throws IOException;

    Job remove(String id) throws IOException;

    void update(Job job) throws IOException;

    /**
     * Applies {@code change} to the latest persisted version of the job and stores the result.
     */
    Job update(String id, UnaryOperator<Job> change) throws IOException;

    void clear() throws IOException;
}
