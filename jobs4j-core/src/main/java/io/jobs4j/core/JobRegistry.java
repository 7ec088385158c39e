package io.jobs4j.core;

import io.jobs4j.JobDescriptor;
import io.jobs4j.utils.Schedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Validated, immutable view of the job configuration.
 *
 * <p>Built only through {@link #registerQueues(JobsConfiguration)}, which fails fast with
 * {@link JobsConfigurationException} on:
 * <ul>
 *   <li>an empty queue-name list, a blank queue name or a duplicate queue name</li>
 *   <li>a declared queue without any job descriptor</li>
 *   <li>a job descriptor referencing an undeclared queue</li>
 *   <li>a duplicate job name</li>
 *   <li>a system job without schedule, or an invalid schedule / timezone</li>
 * </ul>
 */
public final class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final List<String> queueNames;
    private final Map<String, JobDescriptor<?>> descriptorsByName;
    private final Map<String, List<JobDescriptor<?>>> descriptorsByQueue;
    private final List<JobDescriptor<?>> systemJobs;

    private JobRegistry(List<String> queueNames, List<JobDescriptor<?>> descriptors) {
        this.queueNames = List.copyOf(queueNames);
        this.descriptorsByName = descriptors.stream()
                .collect(Collectors.toMap(
                        JobDescriptor::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new JobsConfigurationException("Duplicate job name: " + a.name());
                        },
                        LinkedHashMap::new
                ));

        Map<String, List<JobDescriptor<?>>> byQueue = new LinkedHashMap<>();
        for (String queue : queueNames) {
            byQueue.put(queue, new ArrayList<>());
        }
        for (JobDescriptor<?> d : descriptors) {
            byQueue.get(d.queue()).add(d);
        }
        byQueue.replaceAll((q, list) -> List.copyOf(list));
        this.descriptorsByQueue = Collections.unmodifiableMap(byQueue);

        this.systemJobs = descriptors.stream()
                .filter(JobDescriptor::system)
                .toList();
    }

    /**
     * Validate the static configuration and build the registry. Pure function over the
     * configuration; calling it twice with the same input yields equal registries.
     */
    public static JobRegistry registerQueues(JobsConfiguration config) {
        Objects.requireNonNull(config, "config must not be null");

        List<String> queueNames = validateAndSanitizeQueueNames(config.queueNames());
        List<JobDescriptor<?>> all = config.allJobs();

        Set<String> configuredQueues = new LinkedHashSet<>();
        for (JobDescriptor<?> d : all) {
            configuredQueues.add(d.queue());
        }

        List<String> undeclared = configuredQueues.stream()
                .filter(q -> !queueNames.contains(q))
                .toList();
        if (!undeclared.isEmpty()) {
            throw fail("There are jobs configured for queues that were not declared. Undeclared queues: "
                    + undeclared + ". Add them to the declared queue list or remove the jobs");
        }

        for (String queue : queueNames) {
            if (!configuredQueues.contains(queue)) {
                throw fail("There is a missing config for the queue: " + queue
                        + ", configured queues are: " + configuredQueues + ". It may be a typo or a missing job");
            }
        }

        for (JobDescriptor<?> d : all) {
            validateDescriptor(d);
        }

        return new JobRegistry(queueNames, all);
    }

    private static List<String> validateAndSanitizeQueueNames(List<String> queueNames) {
        List<String> original = queueNames == null ? List.of() : queueNames;
        List<String> sanitized = new ArrayList<>(new LinkedHashSet<>(
                original.stream()
                        .filter(q -> q != null && !q.isBlank())
                        .toList()
        ));

        if (sanitized.size() != original.size() || sanitized.isEmpty()) {
            throw fail("You provided an empty queue name in a list or the list is empty, or a duplicate appears. "
                    + "Original list: " + original + ", sanitized list: " + sanitized);
        }
        return sanitized;
    }

    private static void validateDescriptor(JobDescriptor<?> d) {
        if (d.name().isBlank()) {
            throw fail("Job name must not be blank (queue: " + d.queue() + ")");
        }
        if (d.system() && !d.isScheduled()) {
            throw fail("System job has no schedule: " + d.name());
        }
        if (d.isScheduled()) {
            try {
                Schedules.validate(d.schedule(), d.timezone());
            } catch (IllegalArgumentException e) {
                throw new JobsConfigurationException(
                        "Invalid schedule for job " + d.name() + ": " + e.getMessage(), e);
            }
        }
    }

    private static JobsConfigurationException fail(String message) {
        log.error(message);
        return new JobsConfigurationException(message);
    }

    public List<String> queueNames() {
        return queueNames;
    }

    public Optional<JobDescriptor<?>> find(String name) {
        return Optional.ofNullable(descriptorsByName.get(name));
    }

    public JobDescriptor<?> getRequired(String name) {
        JobDescriptor<?> descriptor = descriptorsByName.get(name);
        if (descriptor == null) {
            throw new JobNotFoundException(name);
        }
        return descriptor;
    }

    public List<JobDescriptor<?>> descriptorsForQueue(String queue) {
        return descriptorsByQueue.getOrDefault(queue, List.of());
    }

    public List<JobDescriptor<?>> descriptors() {
        return List.copyOf(descriptorsByName.values());
    }

    public Set<String> jobNames() {
        return Collections.unmodifiableSet(descriptorsByName.keySet());
    }

    public List<JobDescriptor<?>> systemJobs() {
        return systemJobs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobRegistry other)) return false;
        return queueNames.equals(other.queueNames) && descriptorsByName.equals(other.descriptorsByName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queueNames, descriptorsByName);
    }
}
