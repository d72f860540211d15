package com.retail.billkeeper.dto;

import com.retail.billkeeper.model.DocumentStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DocumentSummaryRow(
        Long id,
        String number,
        LocalDate date,
        String partyName,
        BigDecimal finalAmount,
        BigDecimal balanceDue,
        DocumentStatus status) {
}
