package com.retail.billkeeper.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record CreateStockItemCommand(
        @NotBlank @Size(max = 255) String name,
        @DecimalMin("0") BigDecimal retailPrice,
        @DecimalMin("0") @DecimalMax("100") BigDecimal taxPercent,
        @PositiveOrZero Integer openingQuantity,
        @PositiveOrZero Integer lowStockThreshold) {
}
