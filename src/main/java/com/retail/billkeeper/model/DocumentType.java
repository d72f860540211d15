package com.retail.billkeeper.model;

public enum DocumentType {
    INVOICE(true),
    CHALLAN(false);

    private final boolean billable;

    DocumentType(boolean billable) {
        this.billable = billable;
    }

    /**
     * Whether documents of this type count towards the party running balance
     * and may receive payments. Challans are delivery notes and only carry
     * their totals for printing.
     */
    public boolean isBillable() {
        return billable;
    }
}
