package com.retail.billkeeper.exception;

import com.retail.billkeeper.dto.LedgerChange;

/**
 * Unexpected failure while recomputing derived totals. Always logged with the
 * entity ids and the triggering change before being thrown, and always rolls
 * back the mutation that triggered it.
 */
public class AggregationFailureException extends BillingException {

    private final String entity;
    private final Long entityId;
    private final transient LedgerChange trigger;

    public AggregationFailureException(String entity, Long entityId, LedgerChange trigger, Throwable cause) {
        super("Failed to recompute totals for " + entity + " " + entityId + " after " + trigger, cause);
        this.entity = entity;
        this.entityId = entityId;
        this.trigger = trigger;
    }

    public String getEntity() {
        return entity;
    }

    public Long getEntityId() {
        return entityId;
    }

    public LedgerChange getTrigger() {
        return trigger;
    }
}
