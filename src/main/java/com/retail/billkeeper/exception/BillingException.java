package com.retail.billkeeper.exception;

/**
 * Base type of every business failure raised by the billing services.
 * <p>
 * Unchecked, so that a failure inside a {@code @Transactional} service method
 * rolls the whole unit of work back.
 */
public abstract class BillingException extends RuntimeException {

    protected BillingException(String message) {
        super(message);
    }

    protected BillingException(String message, Throwable cause) {
        super(message, cause);
    }
}
