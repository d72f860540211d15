package com.retail.billkeeper.dto;

import jakarta.validation.constraints.Size;

/**
 * The business details shown on printed documents. Null fields are not set.
 */
public record CompanyProfile(
        @Size(max = 255) String name,
        @Size(max = 32) String phone,
        @Size(max = 500) String address,
        @Size(max = 32) String taxId) {
}
