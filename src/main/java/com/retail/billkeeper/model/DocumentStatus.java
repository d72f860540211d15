package com.retail.billkeeper.model;

/**
 * Derived label, never persisted. Recomputed from the stored totals on every read.
 */
public enum DocumentStatus {
    PAID,
    UNPAID,
    SOFT_DELETED
}
