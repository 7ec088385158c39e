package io.jobs4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for persisted job definitions, keyed by job name.
 */
@Document(collection = "jobs")
public class JobDocument {

    @Id
    private String name;

    private String queue;
    private String schedule;
    private String timezone;

    @Field(write = Field.Write.ALWAYS)
    private Instant lastScheduledAt;

    private long timeoutMillis;
    private int maxAttempts;
    private String backoffType;
    private long backoffDelayMillis;
    private long backoffMaxDelayMillis;
    private int concurrency;
    private boolean removeOnComplete;
    private boolean singleRunningJobGlobally;
    private boolean system;
    private int version;
    private boolean enabled;
    private Instant createdAt;
    private Instant updatedAt;

    public JobDocument() {
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public String getSchedule() {
        return schedule;
    }

    public void setSchedule(String schedule) {
        this.schedule = schedule;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Instant getLastScheduledAt() {
        return lastScheduledAt;
    }

    public void setLastScheduledAt(Instant lastScheduledAt) {
        this.lastScheduledAt = lastScheduledAt;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public void setTimeoutMillis(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public String getBackoffType() {
        return backoffType;
    }

    public void setBackoffType(String backoffType) {
        this.backoffType = backoffType;
    }

    public long getBackoffDelayMillis() {
        return backoffDelayMillis;
    }

    public void setBackoffDelayMillis(long backoffDelayMillis) {
        this.backoffDelayMillis = backoffDelayMillis;
    }

    public long getBackoffMaxDelayMillis() {
        return backoffMaxDelayMillis;
    }

    public void setBackoffMaxDelayMillis(long backoffMaxDelayMillis) {
        this.backoffMaxDelayMillis = backoffMaxDelayMillis;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public boolean isRemoveOnComplete() {
        return removeOnComplete;
    }

    public void setRemoveOnComplete(boolean removeOnComplete) {
        this.removeOnComplete = removeOnComplete;
    }

    public boolean isSingleRunningJobGlobally() {
        return singleRunningJobGlobally;
    }

    public void setSingleRunningJobGlobally(boolean singleRunningJobGlobally) {
        this.singleRunningJobGlobally = singleRunningJobGlobally;
    }

    public boolean isSystem() {
        return system;
    }

    public void setSystem(boolean system) {
        this.system = system;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
