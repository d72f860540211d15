package com.retail.billkeeper.dto;

/**
 * A number claimed for one persistence attempt: {@code number} is
 * {@code prefix + "-" + zero-padded sequence}.
 */
public record AssignedNumber(String prefix, long sequence, String number) {
}
