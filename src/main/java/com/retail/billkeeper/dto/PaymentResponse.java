package com.retail.billkeeper.dto;

import com.retail.billkeeper.model.Payment;
import com.retail.billkeeper.model.PaymentMode;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PaymentResponse(
        Long id,
        String number,
        Long partyId,
        Long documentId,
        BigDecimal amount,
        LocalDate date,
        PaymentMode mode,
        boolean active) {

    public static PaymentResponse from(Payment payment) {
        return new PaymentResponse(
                payment.getId(),
                payment.getPaymentNumber(),
                payment.getParty().getId(),
                payment.getDocument() != null ? payment.getDocument().getId() : null,
                payment.getAmount(),
                payment.getPaymentDate(),
                payment.getMode(),
                payment.isActive());
    }
}
