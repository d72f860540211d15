package com.retail.billkeeper.dto;

import com.retail.billkeeper.model.SalesReturn;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ReturnResponse(
        Long id,
        String number,
        Long documentId,
        Long lineItemId,
        int quantity,
        BigDecimal amount,
        LocalDate date) {

    public static ReturnResponse from(SalesReturn salesReturn) {
        return new ReturnResponse(
                salesReturn.getId(),
                salesReturn.getReturnNumber(),
                salesReturn.getDocument().getId(),
                salesReturn.getLineItem() != null ? salesReturn.getLineItem().getId() : null,
                salesReturn.getQuantity(),
                salesReturn.getAmount(),
                salesReturn.getReturnDate());
    }
}
