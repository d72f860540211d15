package com.retail.billkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Goods returned against a document. Either linked to a line item, in which
 * case the amount is derived from the item's per-unit value, or manual with a
 * user supplied amount.
 */
@Entity
@Table(name = SalesReturn.TABLE, uniqueConstraints = {
        @UniqueConstraint(name = SalesReturn.NUMBER_CONSTRAINT, columnNames = "return_number"),
        @UniqueConstraint(name = SalesReturn.SERIES_CONSTRAINT, columnNames = { "series_prefix", "sequence_no" })
})
@Data
@EqualsAndHashCode(callSuper = false)
public class SalesReturn extends SoftDeletableEntity {

    public static final String TABLE = "sales_returns";
    public static final String NUMBER_CONSTRAINT = "uk_sales_returns_number";
    public static final String SERIES_CONSTRAINT = "uk_sales_returns_series_sequence";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "return_number", nullable = false, updatable = false)
    private String returnNumber;

    @Column(name = "series_prefix", nullable = false, updatable = false)
    private String seriesPrefix;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private Long sequence;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Document document;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "party_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Party party;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "line_item_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private LineItem lineItem;

    @Column(nullable = false)
    private Integer quantity = 1;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(length = 1000)
    private String reason;

    @Column(nullable = false)
    private LocalDate returnDate;

    @Version
    private Long version;
}
