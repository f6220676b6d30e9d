package com.flagship.content_graph.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Single-row counter holding the next entity id the ledger will assign.
 */
@Entity
@Table(name = "next_entity_id")
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NextEntityIdEntity {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(nullable = false, updatable = false)
    private Integer id;

    @Column(name = "next_id", nullable = false)
    private long nextId;

    private NextEntityIdEntity(long nextId) {
        this.id = SINGLETON_ID;
        this.nextId = nextId;
    }

    public static NextEntityIdEntity startingAt(long nextId) {
        return new NextEntityIdEntity(nextId);
    }

    /**
     * Moves the counter forward; never moves it back.
     *
     * @return true if the counter changed
     */
    public boolean advanceTo(long candidate) {
        if (candidate <= nextId) {
            return false;
        }
        this.nextId = candidate;
        return true;
    }
}
