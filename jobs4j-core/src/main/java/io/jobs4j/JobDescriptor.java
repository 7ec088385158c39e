package io.jobs4j;

import io.jobs4j.core.Backoff;
import io.jobs4j.core.JobOptions;

import java.time.Duration;
import java.util.Objects;

/**
 * Static registry entry of a job: where it is queued, when it runs, how it is executed and
 * which handler does the work.
 *
 * <p>Typical usage:
 * <pre>{@code
 * JobDescriptor<Void> cleanup = JobDescriptor.builder(new CleanupHandler())
 *         .queue("maintenance")
 *         .system("1 hour")
 *         .singleRunningJobGlobally()
 *         .timeout(Duration.ofMinutes(2))
 *         .build();
 * }</pre>
 */
public record JobDescriptor<T>(
        String name,
        String queue,
        String schedule,
        String timezone,
        JobOptions options,
        boolean singleRunningJobGlobally,
        boolean system,
        JobHandler<T> handler
) {

    public JobDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
    }

    public static <T> Builder<T> builder(JobHandler<T> handler) {
        return new Builder<>(handler);
    }

    public boolean isScheduled() {
        return schedule != null && !schedule.isBlank();
    }

    public static final class Builder<T> {
        private final JobHandler<T> handler;
        private String queue;
        private String schedule;
        private String timezone;
        private JobOptions options = JobOptions.defaults();
        private boolean singleRunningJobGlobally;
        private boolean system;

        private Builder(JobHandler<T> handler) {
            this.handler = Objects.requireNonNull(handler, "handler must not be null");
        }

        public Builder<T> queue(String queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Mark as a system job: scheduled automatically on the given spec
         * (interval, cron or "AT HH:mm").
         */
        public Builder<T> system(String schedule) {
            Objects.requireNonNull(schedule, "schedule must not be null");
            this.schedule = schedule;
            this.system = true;
            return this;
        }

        /**
         * Timezone used by cron and "AT" schedules. Null means UTC.
         */
        public Builder<T> timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        /**
         * Never run concurrently across all worker processes.
         */
        public Builder<T> singleRunningJobGlobally() {
            this.singleRunningJobGlobally = true;
            return this;
        }

        public Builder<T> options(JobOptions options) {
            this.options = Objects.requireNonNull(options, "options must not be null");
            return this;
        }

        public Builder<T> timeout(Duration timeout) {
            this.options = options.withTimeout(timeout);
            return this;
        }

        public Builder<T> maxAttempts(int maxAttempts) {
            this.options = options.withMaxAttempts(maxAttempts);
            return this;
        }

        public Builder<T> backoff(Backoff backoff) {
            this.options = options.withBackoff(backoff);
            return this;
        }

        public Builder<T> concurrency(int concurrency) {
            this.options = options.withConcurrency(concurrency);
            return this;
        }

        public Builder<T> removeOnComplete(boolean removeOnComplete) {
            this.options = options.withRemoveOnComplete(removeOnComplete);
            return this;
        }

        public JobDescriptor<T> build() {
            return new JobDescriptor<>(
                    handler.name(),
                    queue,
                    schedule,
                    timezone,
                    options,
                    singleRunningJobGlobally,
                    system,
                    handler
            );
        }
    }
}
