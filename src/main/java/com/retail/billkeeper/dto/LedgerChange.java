package com.retail.billkeeper.dto;

/**
 * The child-record mutation that caused a recomputation. Carried into log
 * lines and failures so a drifted total can be traced back to its cause.
 */
public record LedgerChange(String entity, Long entityId, Action action) {

    public enum Action {
        CREATED,
        UPDATED,
        SOFT_DELETED
    }

    public static LedgerChange of(String entity, Long entityId, Action action) {
        return new LedgerChange(entity, entityId, action);
    }

    @Override
    public String toString() {
        return entity + " " + entityId + " " + action;
    }
}
