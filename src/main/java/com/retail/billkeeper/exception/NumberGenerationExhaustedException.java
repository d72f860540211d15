package com.retail.billkeeper.exception;

/**
 * Thrown when every attempt to claim the next number in a series lost the
 * race against a concurrent writer.
 */
public class NumberGenerationExhaustedException extends BillingException {

    private final String prefix;
    private final int attempts;

    public NumberGenerationExhaustedException(String prefix, int attempts) {
        super("Unable to generate a unique number in series " + prefix + " after " + attempts
                + " attempts. Please try again.");
        this.prefix = prefix;
        this.attempts = attempts;
    }

    public String getPrefix() {
        return prefix;
    }

    public int getAttempts() {
        return attempts;
    }
}
