package io.jobs4j.service;

import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobNotFoundException;
import io.jobs4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Monotonic version per job definition. Queue items carry the version they were
 * scheduled against; an item older than the current version is stale.
 */
public class JobVersionService {
    private static final Logger log = LoggerFactory.getLogger(JobVersionService.class);

    private final JobStore store;

    public JobVersionService(JobStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public int getVersion(String jobName) {
        return store.loadJob(jobName)
                .map(JobDefinition::version)
                .orElseThrow(() -> new JobNotFoundException(jobName));
    }

    /**
     * Atomically increment the version.
     *
     * @return the new version
     */
    public int bumpVersion(String jobName) {
        int version = store.bumpVersion(jobName);
        log.info("Job version bumped name={} version={}", jobName, version);
        return version;
    }

    /**
     * True if {@code version} is the current version. Versions ahead of the store (an item
     * enqueued by a newer deployment before this store view caught up) are not stale.
     */
    public boolean isCurrent(String jobName, int version) {
        return version >= getVersion(jobName);
    }
}
