package io.jobs4j.core;

import io.jobs4j.JobDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Static job configuration: the declared queue names, user-triggered jobs and system jobs.
 *
 * <p>Pure data; validated by {@link JobRegistry#registerQueues(JobsConfiguration)}.
 */
public final class JobsConfiguration {

    private final List<String> queueNames;
    private final List<JobDescriptor<?>> jobs;
    private final List<JobDescriptor<?>> systemJobs;

    private JobsConfiguration(List<String> queueNames, List<JobDescriptor<?>> jobs, List<JobDescriptor<?>> systemJobs) {
        // nulls are kept so the registry can report them
        this.queueNames = Collections.unmodifiableList(new ArrayList<>(queueNames));
        this.jobs = List.copyOf(jobs);
        this.systemJobs = List.copyOf(systemJobs);
    }

    public List<String> queueNames() {
        return queueNames;
    }

    public List<JobDescriptor<?>> jobs() {
        return jobs;
    }

    public List<JobDescriptor<?>> systemJobs() {
        return systemJobs;
    }

    /**
     * User-triggered jobs followed by system jobs.
     */
    public List<JobDescriptor<?>> allJobs() {
        List<JobDescriptor<?>> all = new ArrayList<>(jobs.size() + systemJobs.size());
        all.addAll(jobs);
        all.addAll(systemJobs);
        return all;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> queueNames = new ArrayList<>();
        private final List<JobDescriptor<?>> jobs = new ArrayList<>();
        private final List<JobDescriptor<?>> systemJobs = new ArrayList<>();

        public Builder queues(List<String> queueNames) {
            if (queueNames != null) {
                this.queueNames.addAll(queueNames);
            }
            return this;
        }

        public Builder queue(String queueName) {
            this.queueNames.add(queueName);
            return this;
        }

        /**
         * Add a descriptor; system descriptors go to the system job list.
         */
        public Builder job(JobDescriptor<?> descriptor) {
            if (descriptor.system()) {
                systemJobs.add(descriptor);
            } else {
                jobs.add(descriptor);
            }
            return this;
        }

        public Builder jobs(List<? extends JobDescriptor<?>> descriptors) {
            if (descriptors != null) {
                descriptors.forEach(this::job);
            }
            return this;
        }

        public JobsConfiguration build() {
            return new JobsConfiguration(queueNames, jobs, systemJobs);
        }
    }
}
