package com.retail.billkeeper.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Goods coming back against a document. With a {@code lineItemId} the amount
 * is derived from the item and {@code amount} is ignored; without one it is a
 * manual return and {@code amount} is required.
 */
public record CreateReturnCommand(
        @NotNull Long documentId,
        Long lineItemId,
        Integer quantity,
        BigDecimal amount,
        String reason,
        LocalDate date) {
}
