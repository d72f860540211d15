package com.retail.billkeeper.dto;

import com.retail.billkeeper.model.StockItem;

import java.math.BigDecimal;

public record StockItemResponse(
        Long id,
        String code,
        String name,
        BigDecimal retailPrice,
        BigDecimal taxPercent,
        int quantityOnHand,
        int lowStockThreshold,
        boolean lowStock) {

    public static StockItemResponse from(StockItem item) {
        return new StockItemResponse(
                item.getId(),
                item.getCode(),
                item.getName(),
                item.getRetailPrice(),
                item.getTaxPercent(),
                item.getQuantityOnHand(),
                item.getLowStockThreshold(),
                item.isLowStock());
    }
}
