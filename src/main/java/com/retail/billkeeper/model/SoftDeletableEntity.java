package com.retail.billkeeper.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Common columns for records that are never hard-deleted.
 * <p>
 * An inactive row is kept for history only: every aggregation, list and
 * balance query filters on {@code active = true}. Deactivation is one-way.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class SoftDeletableEntity {

    @Column(nullable = false)
    private boolean active = true;

    private LocalDateTime deletedAt;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * Marks the record inactive.
     *
     * @return false if the record was already inactive
     */
    public boolean softDelete() {
        if (!active) {
            return false;
        }
        active = false;
        deletedAt = LocalDateTime.now();
        return true;
    }

    @PrePersist
    protected void onCreateTimestamps() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdateTimestamps() {
        updatedAt = LocalDateTime.now();
    }
}
