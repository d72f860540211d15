package com.retail.billkeeper.dto;

import com.retail.billkeeper.model.LineItem;

import java.math.BigDecimal;

public record LineItemResponse(
        Long id,
        Long documentId,
        String description,
        int quantity,
        BigDecimal rate,
        BigDecimal taxPercent,
        BigDecimal discountPercent,
        BigDecimal lineTotal) {

    public static LineItemResponse from(LineItem item) {
        return new LineItemResponse(
                item.getId(),
                item.getDocument().getId(),
                item.getDescription(),
                item.getQuantity(),
                item.getRate(),
                item.getTaxPercent(),
                item.getDiscountPercent(),
                item.getLineTotal());
    }
}
