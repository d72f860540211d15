package com.retail.billkeeper.model;

/**
 * Business details printed on every document. Stored one row per key so they
 * can be changed without a restart.
 */
public enum SettingKey {
    COMPANY_NAME(255),
    COMPANY_PHONE(32),
    COMPANY_ADDRESS(500),
    COMPANY_TAX_ID(32);

    private final int maxLength;

    SettingKey(int maxLength) {
        this.maxLength = maxLength;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
