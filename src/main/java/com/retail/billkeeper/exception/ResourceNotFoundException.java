package com.retail.billkeeper.exception;

/**
 * Thrown when a requested record does not exist or has been soft-deleted.
 */
public class ResourceNotFoundException extends BillingException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException of(String entity, Long id) {
        return new ResourceNotFoundException(entity + " not found: " + id);
    }
}
