package com.retail.billkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Append-only record of one change to a stock item's on-hand quantity. The
 * movements of an item always add up to its current quantity.
 */
@Entity
@Table(name = "stock_movements")
@Data
public class StockMovement {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "stock_item_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private StockItem stockItem;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MovementType movementType;

    // Negative when stock leaves
    @Column(nullable = false)
    private Integer quantityChange;

    @Column(nullable = false)
    private Integer balanceAfter;

    private String reference; // e.g. "INV-000042", "RET-202610-000003"

    @Column(length = 1000)
    private String notes;

    private LocalDateTime movedAt;

    @PrePersist
    protected void onCreate() {
        movedAt = LocalDateTime.now();
    }
}
