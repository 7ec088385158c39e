package io.jobs4j.internal.mongo;

import io.jobs4j.core.Backoff;
import io.jobs4j.core.JobDefinition;
import io.jobs4j.core.JobExecution;
import io.jobs4j.core.JobNotFoundException;
import io.jobs4j.core.JobOptions;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.PersistResult;
import io.jobs4j.spi.JobStore;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence of job definitions ({@code jobs}) and executions ({@code job_executions}).
 *
 * <p>Version bumps and the last-scheduled compare-and-set are single-document atomic updates,
 * so concurrent processes never lose an increment or enqueue the same boundary twice.
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public PersistResult upsertJob(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        if (updateIfChanged(definition)) {
            return PersistResult.updatedResult();
        }
        if (mongoTemplate.exists(byId(definition.name()), JobDocument.class)) {
            return PersistResult.noop();
        }
        try {
            mongoTemplate.insert(newDocument(definition, clock.instant()));
            return PersistResult.createdResult();
        } catch (DuplicateKeyException e) {
            // created by another process between the two calls above
            return updateIfChanged(definition) ? PersistResult.updatedResult() : PersistResult.noop();
        }
    }

    /**
     * Writes the definition and increments the version in one update, matching only a stored
     * document that differs in at least one definition field.
     */
    private boolean updateIfChanged(JobDefinition definition) {
        JobOptions options = definition.options();
        String schedule = blankToNull(definition.schedule());
        String timezone = blankToNull(definition.timezone());

        Query differs = new Query(Criteria.where("_id").is(definition.name()).orOperator(
                Criteria.where("queue").ne(definition.queue()),
                Criteria.where("schedule").ne(schedule),
                Criteria.where("timezone").ne(timezone),
                Criteria.where("timeoutMillis").ne(options.timeout().toMillis()),
                Criteria.where("maxAttempts").ne(options.maxAttempts()),
                Criteria.where("backoffType").ne(options.backoff().type().name()),
                Criteria.where("backoffDelayMillis").ne(options.backoff().delay().toMillis()),
                Criteria.where("backoffMaxDelayMillis").ne(options.backoff().maxDelay().toMillis()),
                Criteria.where("concurrency").ne(options.concurrency()),
                Criteria.where("removeOnComplete").ne(options.removeOnComplete()),
                Criteria.where("singleRunningJobGlobally").ne(definition.singleRunningJobGlobally()),
                Criteria.where("system").ne(definition.system())
        ));

        Update u = new Update()
                .set("queue", definition.queue())
                .set("timeoutMillis", options.timeout().toMillis())
                .set("maxAttempts", options.maxAttempts())
                .set("backoffType", options.backoff().type().name())
                .set("backoffDelayMillis", options.backoff().delay().toMillis())
                .set("backoffMaxDelayMillis", options.backoff().maxDelay().toMillis())
                .set("concurrency", options.concurrency())
                .set("removeOnComplete", options.removeOnComplete())
                .set("singleRunningJobGlobally", definition.singleRunningJobGlobally())
                .set("system", definition.system())
                .set("updatedAt", clock.instant())
                .inc("version", 1);

        if (schedule != null) {
            u.set("schedule", schedule);
        } else {
            u.unset("schedule");
        }
        if (timezone != null) {
            u.set("timezone", timezone);
        } else {
            u.unset("timezone");
        }

        return mongoTemplate.updateFirst(differs, u, JobDocument.class).getModifiedCount() > 0;
    }

    private static JobDocument newDocument(JobDefinition definition, Instant now) {
        JobOptions options = definition.options();
        JobDocument doc = new JobDocument();
        doc.setName(definition.name());
        doc.setQueue(definition.queue());
        doc.setSchedule(blankToNull(definition.schedule()));
        doc.setTimezone(blankToNull(definition.timezone()));
        doc.setLastScheduledAt(null);
        doc.setTimeoutMillis(options.timeout().toMillis());
        doc.setMaxAttempts(options.maxAttempts());
        doc.setBackoffType(options.backoff().type().name());
        doc.setBackoffDelayMillis(options.backoff().delay().toMillis());
        doc.setBackoffMaxDelayMillis(options.backoff().maxDelay().toMillis());
        doc.setConcurrency(options.concurrency());
        doc.setRemoveOnComplete(options.removeOnComplete());
        doc.setSingleRunningJobGlobally(definition.singleRunningJobGlobally());
        doc.setSystem(definition.system());
        doc.setVersion(1);
        doc.setEnabled(true);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }

    @Override
    public Optional<JobDefinition> loadJob(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(mongoTemplate.findById(name, JobDocument.class))
                .map(MongoJobStore::toDefinition);
    }

    @Override
    public List<JobDefinition> listJobs() {
        return mongoTemplate.findAll(JobDocument.class).stream()
                .map(MongoJobStore::toDefinition)
                .toList();
    }

    @Override
    public int bumpVersion(String name) {
        Objects.requireNonNull(name, "name must not be null");
        JobDocument doc = mongoTemplate.findAndModify(
                byId(name),
                new Update().inc("version", 1).set("updatedAt", clock.instant()),
                FindAndModifyOptions.options().returnNew(true),
                JobDocument.class
        );
        if (doc == null) {
            throw new JobNotFoundException(name);
        }
        return doc.getVersion();
    }

    @Override
    public boolean setEnabled(String name, boolean enabled) {
        Query q = new Query(Criteria.where("_id").is(name).and("enabled").ne(enabled));
        Update u = new Update()
                .set("enabled", enabled)
                .set("updatedAt", clock.instant());
        return mongoTemplate.updateFirst(q, u, JobDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean advanceLastScheduled(String name, Instant expected, Instant boundary) {
        Objects.requireNonNull(boundary, "boundary must not be null");
        Query q = new Query(Criteria.where("_id").is(name).and("lastScheduledAt").is(expected));
        Update u = new Update().set("lastScheduledAt", boundary);
        return mongoTemplate.updateFirst(q, u, JobDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean createExecution(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        try {
            mongoTemplate.insert(toDocument(execution));
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    @Override
    public void saveExecution(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        mongoTemplate.save(toDocument(execution));
    }

    @Override
    public boolean updateExecutionStatus(String id, JobStatus status, String error) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Update u = new Update().set("status", status);
        if (error != null) {
            u.set("error", error);
        } else {
            u.unset("error");
        }
        return mongoTemplate.updateFirst(byId(id), u, JobExecutionDocument.class).getMatchedCount() > 0;
    }

    @Override
    public Optional<JobExecution> findExecution(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, JobExecutionDocument.class))
                .map(MongoJobStore::toExecution);
    }

    @Override
    public List<JobExecution> listExecutions(String jobName, JobStatus status) {
        Criteria c = Criteria.where("jobName").is(jobName);
        if (status != null) {
            c = c.and("status").is(status);
        }
        Query q = new Query(c).with(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("_id")));
        return mongoTemplate.find(q, JobExecutionDocument.class).stream()
                .map(MongoJobStore::toExecution)
                .toList();
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static JobDefinition toDefinition(JobDocument doc) {
        Backoff backoff = new Backoff(
                Backoff.Type.valueOf(doc.getBackoffType()),
                Duration.ofMillis(doc.getBackoffDelayMillis()),
                Duration.ofMillis(doc.getBackoffMaxDelayMillis())
        );
        JobOptions options = new JobOptions(
                Duration.ofMillis(doc.getTimeoutMillis()),
                doc.getMaxAttempts(),
                backoff,
                doc.getConcurrency(),
                doc.isRemoveOnComplete()
        );
        return new JobDefinition(
                doc.getName(),
                doc.getQueue(),
                doc.getSchedule(),
                doc.getTimezone(),
                doc.getLastScheduledAt(),
                options,
                doc.isSingleRunningJobGlobally(),
                doc.isSystem(),
                doc.getVersion(),
                doc.isEnabled(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    private static JobExecutionDocument toDocument(JobExecution e) {
        JobExecutionDocument doc = new JobExecutionDocument();
        doc.setId(e.id());
        doc.setJobName(e.jobName());
        doc.setQueue(e.queue());
        doc.setJobVersion(e.jobVersion());
        doc.setStatus(e.status());
        doc.setAttempts(e.attempts());
        doc.setDedupKey(e.dedupKey());
        doc.setWorkerId(e.workerId());
        doc.setError(e.error());
        doc.setCreatedAt(e.createdAt());
        doc.setStartedAt(e.startedAt());
        doc.setFinishedAt(e.finishedAt());
        return doc;
    }

    private static JobExecution toExecution(JobExecutionDocument doc) {
        return new JobExecution(
                doc.getId(),
                doc.getJobName(),
                doc.getQueue(),
                doc.getJobVersion(),
                doc.getStatus(),
                doc.getAttempts(),
                doc.getDedupKey(),
                doc.getWorkerId(),
                doc.getError(),
                doc.getCreatedAt(),
                doc.getStartedAt(),
                doc.getFinishedAt()
        );
    }

    private static String blankToNull(String s) {
        return s == null || s.trim().isEmpty() ? null : s;
    }
}
