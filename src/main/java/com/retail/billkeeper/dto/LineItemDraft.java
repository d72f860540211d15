package com.retail.billkeeper.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Input for one line. {@code stockItemId} links the line to a tracked stock
 * item whose quantity it draws down; null for free-text lines.
 */
public record LineItemDraft(
        String description,
        @NotNull @Positive Integer quantity,
        @NotNull @DecimalMin("0") BigDecimal rate,
        @DecimalMin("0") @DecimalMax("100") BigDecimal taxPercent,
        @DecimalMin("0") @DecimalMax("100") BigDecimal discountPercent,
        Long stockItemId) {

    public LineItemDraft(String description, Integer quantity, BigDecimal rate, BigDecimal taxPercent,
            BigDecimal discountPercent) {
        this(description, quantity, rate, taxPercent, discountPercent, null);
    }
}
