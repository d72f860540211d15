package com.retail.billkeeper.dto;

import java.math.BigDecimal;

public record LineAmounts(
        BigDecimal base,
        BigDecimal tax,
        BigDecimal discount,
        BigDecimal total) {
}
