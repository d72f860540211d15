package com.retail.billkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * An invoice or a delivery challan. Both share the same shape and differ in
 * number series and in whether they count towards the party balance.
 * <p>
 * The monetary columns are derived and written only by
 * {@link com.retail.billkeeper.service.LedgerAggregator}.
 */
@Entity
@Table(name = Document.TABLE, uniqueConstraints = {
        @UniqueConstraint(name = Document.NUMBER_CONSTRAINT, columnNames = "document_number"),
        @UniqueConstraint(name = Document.SERIES_CONSTRAINT, columnNames = { "series_prefix", "sequence_no" })
})
@Data
@EqualsAndHashCode(callSuper = false)
public class Document extends SoftDeletableEntity {

    public static final String TABLE = "documents";
    public static final String NUMBER_CONSTRAINT = "uk_documents_number";
    public static final String SERIES_CONSTRAINT = "uk_documents_series_sequence";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DocumentType documentType;

    @Column(name = "series_prefix", nullable = false, updatable = false)
    private String seriesPrefix;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private Long sequence;

    @Column(name = "document_number", nullable = false, updatable = false)
    private String number;

    @Column(nullable = false)
    private LocalDate documentDate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "party_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Party party;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal baseAmount = BigDecimal.ZERO.setScale(2);

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal taxAmount = BigDecimal.ZERO.setScale(2);

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal discountAmount = BigDecimal.ZERO.setScale(2);

    // Per-line rounding difference: base + tax - discount + roundOff = gross
    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal roundOff = BigDecimal.ZERO.setScale(2);

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal returnAmount = BigDecimal.ZERO.setScale(2);

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal finalAmount = BigDecimal.ZERO.setScale(2);

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal paidAmount = BigDecimal.ZERO.setScale(2);

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal balanceDue = BigDecimal.ZERO.setScale(2);

    private boolean paid = false;

    @Column(length = 1000)
    private String notes;

    @Column(length = 1000)
    private String transportDetails;

    @Version
    private Long version;

    /**
     * Sum of active line totals before returns.
     */
    public BigDecimal getGrossAmount() {
        return finalAmount.add(returnAmount);
    }

    public DocumentStatus getStatus() {
        if (!isActive()) {
            return DocumentStatus.SOFT_DELETED;
        }
        return paid ? DocumentStatus.PAID : DocumentStatus.UNPAID;
    }
}
