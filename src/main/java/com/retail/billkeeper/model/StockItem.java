package com.retail.billkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;

/**
 * A sellable article whose on-hand quantity is tracked. The quantity only
 * changes together with a {@link StockMovement} row, under a row lock.
 */
@Entity
@Table(name = StockItem.TABLE, uniqueConstraints = {
        @UniqueConstraint(name = StockItem.CODE_CONSTRAINT, columnNames = "item_code"),
        @UniqueConstraint(name = StockItem.SERIES_CONSTRAINT, columnNames = { "series_prefix", "sequence_no" })
})
@Data
@EqualsAndHashCode(callSuper = false)
public class StockItem extends SoftDeletableEntity {

    public static final String TABLE = "stock_items";
    public static final String CODE_CONSTRAINT = "uk_stock_items_code";
    public static final String SERIES_CONSTRAINT = "uk_stock_items_series_sequence";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "item_code", nullable = false, updatable = false)
    private String code;

    @Column(name = "series_prefix", nullable = false, updatable = false)
    private String seriesPrefix;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private Long sequence;

    @Column(nullable = false)
    private String name;

    @Column(precision = 14, scale = 4)
    private BigDecimal retailPrice;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal taxPercent = BigDecimal.ZERO;

    @Column(nullable = false)
    private Integer quantityOnHand = 0;

    @Column(nullable = false)
    private Integer lowStockThreshold = 10;

    @Version
    private Long version;

    public boolean isLowStock() {
        return quantityOnHand <= lowStockThreshold;
    }
}
