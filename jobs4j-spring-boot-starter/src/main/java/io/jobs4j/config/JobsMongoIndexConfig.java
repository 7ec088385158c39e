package io.jobs4j.config;

import io.jobs4j.internal.mongo.DedupKeyDocument;
import io.jobs4j.internal.mongo.JobExecutionDocument;
import io.jobs4j.internal.mongo.QueueItemDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the jobs module.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code jobs.ensure-indexes-on-startup=true}. In production they are usually managed by DB
 * migrations / ops scripts.
 *
 * <p>Job definitions ({@code jobs}) and locks ({@code job_locks}) are keyed by {@code _id} and
 * need no secondary index. Dedup-key and lock uniqueness rely on {@code _id} as well.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_queue_claim</b> on {@code job_queue_items}: { queue: 1, state: 1, runAt: 1 }
 *       <br/>Used by workers claiming due items.</li>
 *   <li><b>idx_queue_stalled</b> on {@code job_queue_items}: { queue: 1, state: 1, lockUntil: 1 }
 *       <br/>Used by the stall sweeper.</li>
 *   <li><b>idx_execution_job</b> on {@code job_executions}: { jobName: 1, createdAt: -1 }
 *       <br/>Used by execution listings.</li>
 *   <li><b>ttl_dedup_expires</b> on {@code job_dedup_keys}: { expiresAt: 1 }, expireAfterSeconds 0
 *       <br/>Removes expired dedup reservations.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.job_queue_items.createIndex({ queue: 1, state: 1, runAt: 1 }, { name: "idx_queue_claim" });
 * db.job_queue_items.createIndex({ queue: 1, state: 1, lockUntil: 1 }, { name: "idx_queue_stalled" });
 * db.job_executions.createIndex({ jobName: 1, createdAt: -1 }, { name: "idx_execution_job" });
 * db.job_dedup_keys.createIndex({ expiresAt: 1 }, { name: "ttl_dedup_expires", expireAfterSeconds: 0 });
 * </pre>
 */
public class JobsMongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(JobsMongoIndexConfig.class);

    public static final String IDX_QUEUE_CLAIM = "idx_queue_claim";
    public static final String IDX_QUEUE_STALLED = "idx_queue_stalled";
    public static final String IDX_EXECUTION_JOB = "idx_execution_job";
    public static final String TTL_DEDUP_EXPIRES = "ttl_dedup_expires";

    private final MongoTemplate mongoTemplate;

    public JobsMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Manually ensure required indexes.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(QueueItemDocument.class).ensureIndex(queueClaimIndex());
        mongoTemplate.indexOps(QueueItemDocument.class).ensureIndex(queueStalledIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(executionJobIndex());
        mongoTemplate.indexOps(DedupKeyDocument.class).ensureIndex(dedupExpiresIndex());
        log.info("Jobs indexes ensured");
    }

    public static Index queueClaimIndex() {
        return new Index()
                .on("queue", Sort.Direction.ASC)
                .on("state", Sort.Direction.ASC)
                .on("runAt", Sort.Direction.ASC)
                .named(IDX_QUEUE_CLAIM);
    }

    public static Index queueStalledIndex() {
        return new Index()
                .on("queue", Sort.Direction.ASC)
                .on("state", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_QUEUE_STALLED);
    }

    public static Index executionJobIndex() {
        return new Index()
                .on("jobName", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_EXECUTION_JOB);
    }

    /**
     * TTL index: Mongo drops a reservation once {@code expiresAt} has passed.
     */
    public static Index dedupExpiresIndex() {
        return new Index()
                .on("expiresAt", Sort.Direction.ASC)
                .expire(0)
                .named(TTL_DEDUP_EXPIRES);
    }
}
