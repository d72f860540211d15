package com.retail.billkeeper.exception;

/**
 * Thrown when a document would end up without any active line item, either at
 * creation or when its last line item is removed.
 */
public class EmptyDocumentException extends BillingException {

    public EmptyDocumentException(String message) {
        super(message);
    }
}
