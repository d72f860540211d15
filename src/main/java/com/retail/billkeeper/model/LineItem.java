package com.retail.billkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "line_items")
@Data
@EqualsAndHashCode(callSuper = false)
public class LineItem extends SoftDeletableEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Document document;

    // Null for free-text lines that do not move stock. Fixed once the line exists.
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "stock_item_id", updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private StockItem stockItem;

    private String description;

    @Column(nullable = false)
    private Integer quantity;

    @Column(nullable = false, precision = 14, scale = 4)
    private BigDecimal rate;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal taxPercent = BigDecimal.ZERO;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercent = BigDecimal.ZERO;

    // Derived by LedgerAggregator.computeLineTotal
    @Column(precision = 14, scale = 2)
    private BigDecimal baseAmount;

    @Column(precision = 14, scale = 2)
    private BigDecimal taxAmount;

    @Column(precision = 14, scale = 2)
    private BigDecimal discountAmount;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal lineTotal = BigDecimal.ZERO.setScale(2);

    @Version
    private Long version;
}
