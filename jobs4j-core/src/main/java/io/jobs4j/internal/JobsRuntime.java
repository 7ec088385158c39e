package io.jobs4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.Jobs;
import io.jobs4j.JobsContext;
import io.jobs4j.config.JobsProperties;
import io.jobs4j.core.EnqueueResult;
import io.jobs4j.core.InitializationReport;
import io.jobs4j.core.JobExecution;
import io.jobs4j.core.JobRegistry;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.JobsConfiguration;
import io.jobs4j.core.TickResult;
import io.jobs4j.service.JobExecutionService;
import io.jobs4j.service.JobInitializationService;
import io.jobs4j.service.JobVersionService;
import io.jobs4j.service.SchedulingJobService;
import io.jobs4j.spi.JobQueue;
import io.jobs4j.spi.JobStore;
import io.jobs4j.spi.LockProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link Jobs} implementation; owns the scheduler thread and the processor.
 *
 * <p>Typical usage:
 * <pre>{@code
 * Jobs jobs = JobsRuntime.builder()
 *         .properties(props)
 *         .configuration(JobsConfiguration.builder()
 *                 .queue("maintenance")
 *                 .job(cleanupDescriptor)
 *                 .build())
 *         .store(store)
 *         .queue(queue)
 *         .locks(locks)
 *         .build();
 *
 * jobs.start();
 * jobs.trigger("send-report", data);
 * jobs.stop();
 * }</pre>
 */
public class JobsRuntime implements Jobs {
    private static final Logger log = LoggerFactory.getLogger(JobsRuntime.class);

    private final JobsContext ctx;
    private final JobRegistry registry;
    private final JobVersionService versions;
    private final JobExecutionService executions;
    private final SchedulingJobService scheduling;
    private final JobInitializationService initialization;
    private final JobProcessor processor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Thread schedulerThread;

    private JobsRuntime(JobsContext ctx,
                        JobRegistry registry,
                        JobVersionService versions,
                        JobExecutionService executions,
                        SchedulingJobService scheduling,
                        JobInitializationService initialization,
                        JobProcessor processor) {
        this.ctx = ctx;
        this.registry = registry;
        this.versions = versions;
        this.executions = executions;
        this.scheduling = scheduling;
        this.initialization = initialization;
        this.processor = processor;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            ctx.properties().validate();
            log.info("Jobs starting workerId={} queues={} jobs={}", ctx.workerId(), registry.queueNames(), registry.jobNames());

            initialization.initialize();
            processor.start();

            if (ctx.properties().isSchedulerEnabled() && !registry.systemJobs().isEmpty()) {
                schedulerThread = new Thread(this::schedulerLoop);
                schedulerThread.setName("jobs.scheduler");
                schedulerThread.setDaemon(true);
                schedulerThread.start();
            }
        } catch (RuntimeException e) {
            started.set(false);
            processor.stop();
            throw e;
        }
        log.info("Jobs started successfully.");
    }

    @Override
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Jobs stopping...");
        if (schedulerThread != null) {
            schedulerThread.interrupt();
            schedulerThread = null;
        }
        processor.stop();
        log.info("Jobs stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    private void schedulerLoop() {
        while (started.get()) {
            try {
                scheduling.tick();
            } catch (Exception e) {
                log.error("jobs scheduler tick failed msg={}", e.getMessage(), e);
            }
            try {
                Thread.sleep(ctx.properties().getSchedulerTickInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    @Override
    public InitializationReport initialize() {
        return initialization.initialize();
    }

    @Override
    public EnqueueResult trigger(String name, Object data) {
        return trigger(name, data, TriggerOptions.defaults());
    }

    @Override
    public EnqueueResult trigger(String name, Object data, TriggerOptions options) {
        Objects.requireNonNull(name, "name must not be null");
        if (options == null) {
            options = TriggerOptions.defaults();
        }
        return scheduling.trigger(name, data, options.dedupKey(), options.delay());
    }

    @Override
    public TickResult tick() {
        return scheduling.tick();
    }

    @Override
    public Optional<JobExecution> execution(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return executions.find(executionId);
    }

    @Override
    public List<JobExecution> executions(String name, JobStatus status) {
        return executions.listExecutions(name, status);
    }

    @Override
    public boolean disable(String name) {
        registry.getRequired(name);
        boolean changed = ctx.store().setEnabled(name, false);
        if (changed) {
            log.info("Job disabled name={}", name);
        }
        return changed;
    }

    @Override
    public boolean enable(String name) {
        registry.getRequired(name);
        boolean changed = ctx.store().setEnabled(name, true);
        if (changed) {
            log.info("Job enabled name={} version={}", name, versions.getVersion(name));
        }
        return changed;
    }

    public JobProcessor processor() {
        return processor;
    }

    public JobsContext context() {
        return ctx;
    }

    /**
     * Explicit wiring in dependency order: registry, version service, lock provider,
     * execution service, scheduling service, processor.
     */
    public static final class Builder {
        private JobsProperties properties = new JobsProperties();
        private JobsConfiguration configuration;
        private Clock clock = Clock.systemUTC();
        private String workerId;
        private JobStore store;
        private JobQueue queue;
        private LockProvider locks;
        private ObjectMapper objectMapper;

        private Builder() {
        }

        public Builder properties(JobsProperties properties) {
            this.properties = Objects.requireNonNull(properties, "properties must not be null");
            return this;
        }

        public Builder configuration(JobsConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder store(JobStore store) {
            this.store = store;
            return this;
        }

        public Builder queue(JobQueue queue) {
            this.queue = queue;
            return this;
        }

        public Builder locks(LockProvider locks) {
            this.locks = locks;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * @throws io.jobs4j.core.JobsConfigurationException on invalid queue or job declarations
         */
        public JobsRuntime build() {
            Objects.requireNonNull(configuration, "configuration must not be null");

            JobRegistry registry = JobRegistry.registerQueues(configuration);
            JobsContext ctx = new JobsContext(
                    properties,
                    clock,
                    workerId,
                    store,
                    queue,
                    locks,
                    objectMapper != null ? objectMapper : new ObjectMapper()
            );

            JobVersionService versions = new JobVersionService(ctx.store());
            JobExecutionService executions = new JobExecutionService(ctx.store(), ctx.clock());
            SchedulingJobService scheduling = new SchedulingJobService(ctx, registry, executions);
            JobInitializationService initialization = new JobInitializationService(ctx, registry, versions);
            JobProcessor processor = new JobProcessor(ctx, registry, versions, executions);

            return new JobsRuntime(ctx, registry, versions, executions, scheduling, initialization, processor);
        }
    }
}
