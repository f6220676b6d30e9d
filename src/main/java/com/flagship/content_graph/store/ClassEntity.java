package com.flagship.content_graph.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Generic index row tracking the existence of every ledger entity,
 * whether or not it has acquired a typed row.
 *
 * Owned by the dispatcher: created on EntityCreated, deleted on EntityRemoved.
 */
@Entity
@Table(
    name = "class_entities",
    indexes = @Index(name = "idx_class_entities_class_id", columnList = "class_id")
)
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClassEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private String id;

    @Column(name = "class_id", nullable = false, updatable = false)
    private int classId;

    /**
     * Block height of the creation event.
     */
    @Column(nullable = false)
    private long version;

    @Column(name = "happened_in", nullable = false)
    private long happenedIn;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public static ClassEntity created(String id, int classId, long blockHeight) {
        return new ClassEntity(id, classId, blockHeight, blockHeight, Instant.now());
    }
}
