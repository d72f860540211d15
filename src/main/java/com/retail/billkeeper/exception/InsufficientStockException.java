package com.retail.billkeeper.exception;

/**
 * Thrown when a sale or adjustment would take a stock item below zero. Nothing
 * is deducted when this is raised.
 */
public class InsufficientStockException extends BillingException {

    private final String itemCode;
    private final int available;
    private final int requested;

    public InsufficientStockException(String itemCode, int available, int requested) {
        super("Insufficient stock for " + itemCode + ": available " + available + ", requested " + requested);
        this.itemCode = itemCode;
        this.available = available;
        this.requested = requested;
    }

    public String getItemCode() {
        return itemCode;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequested() {
        return requested;
    }
}
