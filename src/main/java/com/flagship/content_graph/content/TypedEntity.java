package com.flagship.content_graph.content;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Columns shared by every typed row.
 *
 * {@code id} equals the id of the row's {@code ClassEntity}. {@code version}
 * is the block height of the last successful mutation and never decreases.
 * Reference-valued properties are stored as the target entity id.
 */
@MappedSuperclass
@Getter
@Setter
@ToString
public abstract class TypedEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private String id;

    @Column(nullable = false)
    private long version;

    @Column(name = "happened_in", nullable = false)
    private long happenedIn;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Records a mutation made in the given block.
     */
    public void touch(long blockHeight) {
        this.version = Math.max(this.version, blockHeight);
        this.happenedIn = blockHeight;
    }
}
