package com.retail.billkeeper.dto;

import com.retail.billkeeper.model.MovementType;
import com.retail.billkeeper.model.StockMovement;

import java.time.LocalDateTime;

public record StockMovementResponse(
        Long id,
        MovementType type,
        int quantityChange,
        int balanceAfter,
        String reference,
        String notes,
        LocalDateTime movedAt) {

    public static StockMovementResponse from(StockMovement movement) {
        return new StockMovementResponse(
                movement.getId(),
                movement.getMovementType(),
                movement.getQuantityChange(),
                movement.getBalanceAfter(),
                movement.getReference(),
                movement.getNotes(),
                movement.getMovedAt());
    }
}
