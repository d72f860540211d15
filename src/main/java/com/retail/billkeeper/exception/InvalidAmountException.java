package com.retail.billkeeper.exception;

/**
 * Thrown when a monetary input is missing, negative, or zero where a positive
 * value is required, or when a return would exceed what can be returned.
 */
public class InvalidAmountException extends BillingException {

    public InvalidAmountException(String message) {
        super(message);
    }
}
