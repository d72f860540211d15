package com.retail.billkeeper.dto;

import jakarta.validation.constraints.NotNull;

/**
 * A manual stock change. Receipts take a positive quantity; adjustments are
 * signed.
 */
public record StockAdjustmentCommand(
        @NotNull Integer quantity,
        String notes) {
}
