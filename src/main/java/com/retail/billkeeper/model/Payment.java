package com.retail.billkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = Payment.TABLE, uniqueConstraints = {
        @UniqueConstraint(name = Payment.NUMBER_CONSTRAINT, columnNames = "payment_number"),
        @UniqueConstraint(name = Payment.SERIES_CONSTRAINT, columnNames = { "series_prefix", "sequence_no" })
})
@Data
@EqualsAndHashCode(callSuper = false)
public class Payment extends SoftDeletableEntity {

    public static final String TABLE = "payments";
    public static final String NUMBER_CONSTRAINT = "uk_payments_number";
    public static final String SERIES_CONSTRAINT = "uk_payments_series_sequence";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "payment_number", nullable = false, updatable = false)
    private String paymentNumber;

    @Column(name = "series_prefix", nullable = false, updatable = false)
    private String seriesPrefix;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private Long sequence;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "party_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Party party;

    // Null for a general payment against the party account
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Document document;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false)
    private LocalDate paymentDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentMode mode = PaymentMode.CASH;

    @Column(length = 1000)
    private String notes;

    @Version
    private Long version;
}
