package com.retail.billkeeper.dto;

import java.math.BigDecimal;

public record PartyStatement(
        Long partyId,
        String partyName,
        BigDecimal runningBalance,
        long unpaidInvoices,
        long paidInvoices,
        BigDecimal generalPayments) {
}
