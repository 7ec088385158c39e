package io.jobs4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Reservation of a dedup key for the item that first used it.
 */
@Document(collection = "job_dedup_keys")
public class DedupKeyDocument {

    @Id
    private String key;

    private String itemId;
    private Instant expiresAt;

    public DedupKeyDocument() {
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }
}
