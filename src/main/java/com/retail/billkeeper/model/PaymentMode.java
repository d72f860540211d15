package com.retail.billkeeper.model;

public enum PaymentMode {
    CASH,
    UPI,
    BANK,
    CHEQUE
}
