package com.retail.billkeeper.dto;

import com.retail.billkeeper.model.PaymentMode;

import java.math.BigDecimal;
import java.time.LocalDate;

public record UpdatePaymentCommand(
        BigDecimal amount,
        LocalDate date,
        PaymentMode mode,
        String notes) {
}
