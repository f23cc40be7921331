package dev.taskgate.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * External id of a comment/message the system posted itself. Only the loop guard reads it.
 */
@Entity
@Table(name = "self_posted_messages", indexes = {
        @Index(name = "idx_self_posted_inserted", columnList = "inserted_at")
})
public class SelfPostedMessage {

    @Id
    @Column(name = "external_id", length = 255)
    private String externalId;

    @Column(name = "inserted_at", nullable = false)
    private Instant insertedAt;

    protected SelfPostedMessage() {
    }

    public SelfPostedMessage(String externalId, Instant insertedAt) {
        this.externalId = externalId;
        this.insertedAt = insertedAt;
    }

    public String getExternalId() {
        return externalId;
    }

    public Instant getInsertedAt() {
        return insertedAt;
    }
}
