package com.retail.billkeeper.model;

public enum MovementType {
    OPENING,
    RECEIPT,
    ADJUSTMENT,
    SALE,
    // Sold quantity given back: line reduced or removed, document deleted
    SALE_REVERSAL,
    RETURN,
    RETURN_REVERSAL
}
