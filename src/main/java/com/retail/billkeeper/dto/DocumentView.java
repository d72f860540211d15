package com.retail.billkeeper.dto;

import com.retail.billkeeper.model.DocumentStatus;
import com.retail.billkeeper.model.DocumentType;
import com.retail.billkeeper.model.PaymentMode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only snapshot of a document and its aggregated totals, handed to the
 * print/PDF layer. Missing or soft-deleted related records render as "N/A".
 */
public record DocumentView(
        Long id,
        String number,
        DocumentType type,
        LocalDate date,
        String partyName,
        DocumentStatus status,
        List<Line> lineItems,
        Totals totals,
        List<PaymentRow> payments,
        List<ReturnRow> returns,
        String companyName,
        String companyPhone) {

    public static final String NOT_AVAILABLE = "N/A";

    public record Line(
            Long id,
            String description,
            int quantity,
            BigDecimal rate,
            BigDecimal taxPercent,
            BigDecimal discountPercent,
            BigDecimal lineTotal) {
    }

    public record Totals(
            BigDecimal baseAmount,
            BigDecimal taxAmount,
            BigDecimal discountAmount,
            BigDecimal roundOff,
            BigDecimal returnAmount,
            BigDecimal finalAmount,
            BigDecimal paidAmount,
            BigDecimal balanceDue,
            boolean paid) {
    }

    public record PaymentRow(
            Long id,
            String number,
            LocalDate date,
            PaymentMode mode,
            BigDecimal amount) {
    }

    public record ReturnRow(
            Long id,
            String number,
            LocalDate date,
            String itemDescription,
            int quantity,
            BigDecimal amount) {
    }
}
