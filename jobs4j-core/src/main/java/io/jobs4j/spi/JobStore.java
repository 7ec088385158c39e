package io.jobs4j.spi;

import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobExecution;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.PersistResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of job definitions and job executions, shared by every worker process.
 *
 * <p>Execution status is observability only; nothing reads it to decide whether a singleton
 * job may run.
 */
public interface JobStore {

    /**
     * Create or update a definition by name.
     *
     * <p>On insert the stored version is 1 and {@code createdAt} is set. An update only happens
     * when a definition field (queue, schedule, timezone, options, flags) differs from the stored
     * one; it writes those fields and increments the version in the same atomic step, so processes
     * applying the same change concurrently bump the version once. {@code enabled},
     * {@code createdAt} and {@code lastScheduledAt} are left untouched.
     *
     * @return created, updated (fields changed and version incremented) or noop
     */
    PersistResult upsertJob(JobDefinition definition);

    Optional<JobDefinition> loadJob(String name);

    List<JobDefinition> listJobs();

    /**
     * Atomically increment the version.
     *
     * @return the new version
     * @throws io.jobs4j.core.JobNotFoundException if no definition exists
     */
    int bumpVersion(String name);

    /**
     * @return true if the definition exists and its flag changed
     */
    boolean setEnabled(String name, boolean enabled);

    /**
     * Compare-and-set of the last enqueued due boundary.
     *
     * @param expected value read before computing {@code boundary} (nullable)
     * @return true if the stored value still equalled {@code expected} and was replaced
     */
    boolean advanceLastScheduled(String name, Instant expected, Instant boundary);

    /**
     * Insert if absent.
     *
     * @return false when an execution with the same id already exists
     */
    boolean createExecution(JobExecution execution);

    /**
     * Replace the execution keyed by its id (last write wins).
     */
    void saveExecution(JobExecution execution);

    /**
     * @return true if the execution exists
     */
    boolean updateExecutionStatus(String id, JobStatus status, String error);

    Optional<JobExecution> findExecution(String id);

    /**
     * Executions of a job, newest first.
     *
     * @param status filter, or null for all
     */
    List<JobExecution> listExecutions(String jobName, JobStatus status);
}
