package io.jobs4j.service;

import io.jobs4j.JobDescriptor;
import io.jobs4j.JobsContext;
import io.jobs4j.core.InitializationReport;
import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobRegistry;
import io.jobs4j.core.PersistResult;
import io.jobs4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reconciles the configured jobs with the persisted definitions at process start.
 *
 * <ul>
 *   <li>missing definition: created with version 1</li>
 *   <li>changed queue, schedule, timezone, options or flags: updated and version bumped by the
 *   store in the same write, so replicas starting together bump once</li>
 *   <li>soft-disabled definition that is configured again: re-enabled</li>
 *   <li>persisted definition no longer configured: soft-disabled, never deleted</li>
 * </ul>
 */
public class JobInitializationService {
    private static final Logger log = LoggerFactory.getLogger(JobInitializationService.class);

    private final JobsContext ctx;
    private final JobRegistry registry;
    private final JobVersionService versions;

    public JobInitializationService(JobsContext ctx, JobRegistry registry, JobVersionService versions) {
        this.ctx = Objects.requireNonNull(ctx, "ctx must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.versions = Objects.requireNonNull(versions, "versions must not be null");
    }

    public InitializationReport initialize() {
        JobStore store = ctx.store();
        Instant now = ctx.clock().instant();

        List<String> created = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> reenabled = new ArrayList<>();
        List<String> disabled = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();

        for (JobDescriptor<?> descriptor : registry.descriptors()) {
            PersistResult result = store.upsertJob(toDefinition(descriptor, now));

            if (result.created()) {
                created.add(descriptor.name());
                log.info("Job registered name={} queue={} schedule={}", descriptor.name(), descriptor.queue(), descriptor.schedule());
                continue;
            }

            if (result.updated()) {
                updated.add(descriptor.name());
                log.info("Job definition changed name={} version={}", descriptor.name(), versions.getVersion(descriptor.name()));
            }
            boolean wasDisabled = store.setEnabled(descriptor.name(), true);
            if (wasDisabled) {
                reenabled.add(descriptor.name());
                log.info("Job re-enabled name={}", descriptor.name());
            }
            if (!result.updated() && !wasDisabled) {
                unchanged.add(descriptor.name());
            }
        }

        for (JobDefinition persisted : store.listJobs()) {
            if (persisted.enabled() && !registry.jobNames().contains(persisted.name())) {
                store.setEnabled(persisted.name(), false);
                disabled.add(persisted.name());
                log.warn("Job no longer configured, disabling name={}", persisted.name());
            }
        }

        InitializationReport report = new InitializationReport(created, updated, reenabled, disabled, unchanged);
        log.info("Jobs initialized created={} updated={} reenabled={} disabled={} unchanged={}",
                created.size(), updated.size(), reenabled.size(), disabled.size(), unchanged.size());
        return report;
    }

    private static JobDefinition toDefinition(JobDescriptor<?> d, Instant now) {
        return new JobDefinition(
                d.name(),
                d.queue(),
                d.schedule(),
                d.timezone(),
                null,
                d.options(),
                d.singleRunningJobGlobally(),
                d.system(),
                1,
                true,
                now,
                now
        );
    }
}
