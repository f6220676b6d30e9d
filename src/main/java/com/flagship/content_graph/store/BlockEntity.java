package com.flagship.content_graph.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * A ledger block that produced at least one materialized mutation.
 * Rows point at it through their {@code happened_in} column.
 */
@Entity
@Table(name = "blocks")
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BlockEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private Long height;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    private BlockEntity(long height) {
        this.height = height;
        this.recordedAt = Instant.now();
    }

    @PrePersist
    void onCreate() {
        if (recordedAt == null) {
            recordedAt = Instant.now();
        }
    }

    public static BlockEntity at(long height) {
        return new BlockEntity(height);
    }
}
