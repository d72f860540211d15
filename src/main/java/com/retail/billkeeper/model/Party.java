package com.retail.billkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;

@Entity
@Table(name = "parties")
@Data
@EqualsAndHashCode(callSuper = false)
public class Party extends SoftDeletableEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    private String contactPerson;
    private String phone;
    private String email;
    private String address;

    // Positive means the party owes us. Written only by LedgerAggregator.
    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal runningBalance = BigDecimal.ZERO.setScale(2);
}
