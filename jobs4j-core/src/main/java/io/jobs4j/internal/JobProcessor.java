package io.jobs4j.internal;

import io.jobs4j.JobDescriptor;
import io.jobs4j.JobHandler;
import io.jobs4j.JobsContext;
import io.jobs4j.config.JobsProperties;
import io.jobs4j.core.JobOptions;
import io.jobs4j.core.JobRegistry;
import io.jobs4j.core.LockHandle;
import io.jobs4j.core.QueueItem;
import io.jobs4j.core.StalledItem;
import io.jobs4j.service.JobExecutionService;
import io.jobs4j.service.JobVersionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Generic worker loop: one poller per queue feeding a shared worker pool.
 *
 * <p>Per claimed item:
 * <ol>
 *   <li>resolve the job descriptor</li>
 *   <li>validate the item version; stale items are discarded without running</li>
 *   <li>singleton jobs acquire the global lock; contention puts the item back</li>
 *   <li>record start, run the handler under a heartbeat, record the outcome</li>
 *   <li>release the lock on every exit path</li>
 * </ol>
 *
 * <p>Concurrency is bounded three ways: the global pool ({@code jobs.max-concurrency}), per
 * queue ({@code jobs.queue-concurrency}) and per job ({@link JobOptions#concurrency()}).
 */
public class JobProcessor {
    private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

    private static final int MAX_SYSTEM_ERRORS = 30;

    private final JobsContext ctx;
    private final JobsProperties props;
    private final JobRegistry registry;
    private final JobVersionService versions;
    private final JobExecutionService executions;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile ExecutorService workerPool;
    private ScheduledExecutorService heartbeats;
    private final List<Thread> pollerThreads = new ArrayList<>();
    private Thread stallSweeperThread;

    private final Semaphore globalSem;
    private final Map<String, Semaphore> perQueueSem = new ConcurrentHashMap<>();
    private final Map<String, Semaphore> perJobSem = new ConcurrentHashMap<>();
    private final Semaphore refillSignal = new Semaphore(0);

    public JobProcessor(JobsContext ctx, JobRegistry registry, JobVersionService versions, JobExecutionService executions) {
        this.ctx = Objects.requireNonNull(ctx, "ctx must not be null");
        this.props = ctx.properties();
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.versions = Objects.requireNonNull(versions, "versions must not be null");
        this.executions = Objects.requireNonNull(executions, "executions must not be null");
        this.globalSem = new Semaphore(props.getMaxConcurrency());
        this.heartbeats = newHeartbeatScheduler();
    }

    /**
     * Start polling every declared queue. Idempotent.
     */
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Job processor starting with queues={}, pollInterval={}, visibilityTimeout={}, workerId={}, maxConcurrency={}, queueConcurrency={}, batchSize={}",
                registry.queueNames(),
                props.getPollInterval(),
                props.getVisibilityTimeout(),
                ctx.workerId(),
                props.getMaxConcurrency(),
                props.getQueueConcurrency(),
                props.getBatchSize());

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("jobs.workerPool");
                t.setDaemon(true);
                return t;
            });
        }
        if (heartbeats.isShutdown()) {
            heartbeats = newHeartbeatScheduler();
        }

        for (String queue : registry.queueNames()) {
            Thread poller = new Thread(() -> pollerLoop(queue));
            poller.setName("jobs.poller." + queue);
            poller.setDaemon(true);
            poller.start();
            pollerThreads.add(poller);
        }

        stallSweeperThread = new Thread(this::stallSweeperLoop);
        stallSweeperThread.setName("jobs.stallSweeper");
        stallSweeperThread.setDaemon(true);
        stallSweeperThread.start();

        log.info("Job processor started successfully.");
    }

    /**
     * Stop polling and wait for running handlers up to the visibility timeout. Idempotent.
     */
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Job processor stopping...");

        pollerThreads.forEach(Thread::interrupt);
        if (stallSweeperThread != null) {
            stallSweeperThread.interrupt();
        }
        // Pollers hand claimed items to the worker pool, so they must be gone before it shuts down.
        awaitExit(pollerThreads);
        pollerThreads.clear();
        if (stallSweeperThread != null) {
            awaitExit(List.of(stallSweeperThread));
            stallSweeperThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getVisibilityTimeout().toSeconds(), TimeUnit.SECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        heartbeats.shutdownNow();
        refillSignal.drainPermits();
        log.info("Job processor stopped successfully.");
    }

    public boolean isRunning() {
        return started.get();
    }

    private void awaitExit(List<Thread> threads) {
        long deadline = System.nanoTime() + props.getVisibilityTimeout().toNanos();
        for (Thread thread : threads) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            try {
                thread.join(Math.max(1, remainingMillis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (thread.isAlive()) {
                log.warn("Job processor thread did not exit in time thread={}", thread.getName());
            }
        }
    }

    private void pollerLoop(String queue) {
        int systemErrorCount = 0;
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce(queue);
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("jobs poll failed queue={} msg={}", queue, e.getMessage(), e);
                if (systemErrorCount >= MAX_SYSTEM_ERRORS) {
                    log.error("Job poller stopped due to repeated system failures queue={}", queue);
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);

                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (backlog) {
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } else {
                    Thread.sleep(props.getPollInterval().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * Claim as many items as the queue has free slots for and hand them to the worker pool.
     *
     * @return true if the queue is saturated and more items may be waiting
     */
    private boolean pollOnce(String queue) {
        Semaphore queueSem = semForQueue(queue);
        int free = Math.min(queueSem.availablePermits(), globalSem.availablePermits());
        if (free == 0) {
            return true;
        }

        int take = Math.min(free, props.getBatchSize());
        List<QueueItem> items = ctx.queue().claim(queue, take, props.getVisibilityTimeout(), ctx.workerId());
        log.debug("Job poller claimed items count={} queue={} take={}", items.size(), queue, take);

        for (QueueItem item : items) {
            submitToWorker(queue, item);
        }
        return items.size() == take;
    }

    private void submitToWorker(String queue, QueueItem item) {
        Semaphore queueSem = semForQueue(queue);
        Semaphore jobSem = semForJob(item.jobName());

        if (!jobSem.tryAcquire()) {
            log.debug("Job concurrency reached, returning item name={} id={}", item.jobName(), item.id());
            ctx.queue().postpone(item.id(), ctx.workerId(), ctx.clock().instant().plus(props.getPollInterval()));
            return;
        }
        globalSem.acquireUninterruptibly();
        queueSem.acquireUninterruptibly();

        ExecutorService pool = workerPool;
        try {
            if (pool == null) {
                throw new RejectedExecutionException("worker pool is stopped");
            }
            pool.submit(() -> {
                try {
                    process(item);
                } catch (Exception e) {
                    log.error("jobs worker failed name={} id={} msg={}", item.jobName(), item.id(), e.getMessage(), e);
                } finally {
                    jobSem.release();
                    queueSem.release();
                    globalSem.release();
                    refillSignal.release();
                }
            });
        } catch (RejectedExecutionException e) {
            jobSem.release();
            queueSem.release();
            globalSem.release();
            log.warn("Worker pool rejected item, returning it to the queue name={} id={}", item.jobName(), item.id());
            ctx.queue().postpone(item.id(), ctx.workerId(), ctx.clock().instant());
        }
    }

    /**
     * Run one claimed item to completion on the calling thread.
     */
    public void process(QueueItem item) {
        Objects.requireNonNull(item, "item must not be null");
        String workerId = ctx.workerId();

        JobDescriptor<?> descriptor = registry.find(item.jobName()).orElse(null);
        if (descriptor == null) {
            String error = "No job registered for name: " + item.jobName();
            log.error("jobs item has unknown job name={} id={}", item.jobName(), item.id());
            ctx.queue().fail(item.id(), workerId, error);
            executions.recordDiscarded(item, error);
            return;
        }

        if (!versions.isCurrent(item.jobName(), item.version())) {
            int current = versions.getVersion(item.jobName());
            String error = "stale job version " + item.version() + " < " + current;
            log.warn("Discarding stale job item name={} id={} version={} currentVersion={}",
                    item.jobName(), item.id(), item.version(), current);
            ctx.queue().complete(item.id(), workerId, false);
            executions.recordDiscarded(item, error);
            return;
        }

        JobOptions options = descriptor.options();
        LockHandle lock = null;
        if (descriptor.singleRunningJobGlobally()) {
            lock = ctx.locks().acquire(lockKey(descriptor), lockHolder(item), lockTtl(options));
            if (lock == null) {
                Instant retryAt = ctx.clock().instant().plus(props.getLockContentionDelay());
                log.info("Singleton job already running elsewhere, postponing name={} id={} until={}",
                        item.jobName(), item.id(), retryAt);
                ctx.queue().postpone(item.id(), workerId, retryAt);
                return;
            }
        }

        try {
            runLocked(item, descriptor, lock);
        } finally {
            if (lock != null) {
                try {
                    ctx.locks().release(lock);
                } catch (Exception e) {
                    log.error("jobs lock release failed name={} key={} msg={}", item.jobName(), lock.key(), e.getMessage(), e);
                }
            }
        }
    }

    private void runLocked(QueueItem item, JobDescriptor<?> descriptor, LockHandle lock) {
        String workerId = ctx.workerId();
        JobOptions options = descriptor.options();

        try {
            executions.recordStart(item, workerId);

            ScheduledFuture<?> heartbeat = startHeartbeat(item, lock, options);
            try {
                executeHandler(descriptor.handler(), item.data());
            } finally {
                heartbeat.cancel(false);
            }

            log.debug("Job succeeded name={} id={} attempt={}", item.jobName(), item.id(), item.attempts());
            executions.recordSuccess(item.id());
            if (!ctx.queue().complete(item.id(), workerId, options.removeOnComplete())) {
                log.warn("Job item was taken over before completion name={} id={}", item.jobName(), item.id());
            }
        } catch (Exception e) {
            log.error("Job failed name={} id={} attempt={} msg={}", item.jobName(), item.id(), item.attempts(), e.getMessage(), e);
            handleFailure(item, options, describe(e));
        }
    }

    private void handleFailure(QueueItem item, JobOptions options, String error) {
        String workerId = ctx.workerId();
        boolean terminal = item.attemptsExhausted();
        try {
            executions.recordFailure(item.id(), error, terminal);
        } catch (Exception storeEx) {
            log.error("jobs execution write-back failed name={} id={} msg={}", item.jobName(), item.id(), storeEx.getMessage(), storeEx);
        }

        try {
            if (terminal) {
                log.warn("Job reached max attempts; failing name={} id={} attempts={} maxAttempts={}",
                        item.jobName(), item.id(), item.attempts(), item.maxAttempts());
                ctx.queue().fail(item.id(), workerId, error);
            } else {
                Instant retryAt = executions.nextRetryAt(options, item.attempts());
                ctx.queue().retry(item.id(), workerId, retryAt, error);
            }
        } catch (Exception queueEx) {
            log.error("jobs queue write-back failed name={} id={} msg={}", item.jobName(), item.id(), queueEx.getMessage(), queueEx);
        }
    }

    /**
     * Keeps the item invisible to other workers while the handler runs, up to the job timeout.
     * Past the timeout the beats stop and the item is left to stall.
     */
    private ScheduledFuture<?> startHeartbeat(QueueItem item, LockHandle lock, JobOptions options) {
        Duration visibility = props.getVisibilityTimeout();
        Instant deadline = ctx.clock().instant().plus(options.timeout());
        long periodMs = Math.max(100, visibility.toMillis() / 2);

        return heartbeats.scheduleAtFixedRate(() -> {
            try {
                Instant now = ctx.clock().instant();
                if (now.isAfter(deadline)) {
                    log.warn("Job exceeded its timeout, no longer extending name={} id={} timeout={}",
                            item.jobName(), item.id(), options.timeout());
                    throw new CancellationException("timeout");
                }
                if (!ctx.queue().extend(item.id(), ctx.workerId(), visibility)) {
                    log.warn("Job item visibility lost name={} id={}", item.jobName(), item.id());
                }
                if (lock != null && !ctx.locks().extend(lock, Duration.between(now, deadline).plus(props.getLockSafetyMargin()))) {
                    log.warn("Singleton job lock lost while running name={} key={}", item.jobName(), lock.key());
                }
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                log.error("jobs heartbeat failed name={} id={} msg={}", item.jobName(), item.id(), e.getMessage(), e);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Redeliver stalled items of every queue and record the stalls.
     *
     * @return number of stalled items found
     */
    public int sweepStalled() {
        int found = 0;
        for (String queue : registry.queueNames()) {
            List<StalledItem> stalled = ctx.queue().recoverStalled(queue, props.getMaxStalledCount());
            for (StalledItem s : stalled) {
                QueueItem item = s.item();
                log.warn("Job stalled name={} id={} stalledCount={} terminal={}",
                        item.jobName(), item.id(), item.stalledCount(), s.terminal());
                executions.recordStalled(item.id(), s.terminal());
            }
            found += stalled.size();
        }
        return found;
    }

    private void stallSweeperLoop() {
        while (started.get()) {
            try {
                Thread.sleep(props.getStalledInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                sweepStalled();
            } catch (Exception e) {
                log.error("jobs stall sweep failed msg={}", e.getMessage(), e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void executeHandler(JobHandler<?> handler, Map<String, Object> rawData) throws Exception {
        var h = (JobHandler<T>) handler;
        T data = (rawData == null) ? null : ctx.objectMapper().convertValue(rawData, h.dataClass());
        h.execute(data);
    }

    // unique per attempt, so a redelivered run never matches its predecessor's lock
    private String lockHolder(QueueItem item) {
        return ctx.workerId() + ":" + item.id() + ":" + item.attempts();
    }

    private Duration lockTtl(JobOptions options) {
        return options.timeout().plus(props.getLockSafetyMargin());
    }

    static String lockKey(JobDescriptor<?> descriptor) {
        return "job:" + descriptor.queue() + ":" + descriptor.name();
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getName() : e.getClass().getSimpleName() + ": " + message;
    }

    private Semaphore semForQueue(String queue) {
        return perQueueSem.computeIfAbsent(queue, q -> new Semaphore(props.getQueueConcurrency()));
    }

    private Semaphore semForJob(String name) {
        return perJobSem.computeIfAbsent(name, n -> new Semaphore(
                registry.find(n).map(d -> d.options().concurrency()).orElse(1)));
    }

    private static ScheduledExecutorService newHeartbeatScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("jobs.heartbeat");
            t.setDaemon(true);
            return t;
        });
    }
}
