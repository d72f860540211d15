package com.retail.billkeeper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "billkeeper.returns")
public class ReturnPolicyProperties {

    /**
     * When true, a return against a line item whose per-unit value works out
     * to zero is refused instead of being recorded at 0.00.
     */
    private boolean rejectZeroValueReturns = false;
}
