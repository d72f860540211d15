package com.retail.billkeeper.dto;

import com.retail.billkeeper.model.PaymentMode;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A payment from a party, either against one of its invoices or, with no
 * {@code documentId}, against its account in general.
 */
public record RecordPaymentCommand(
        @NotNull Long partyId,
        Long documentId,
        BigDecimal amount,
        LocalDate date,
        PaymentMode mode,
        String notes) {
}
