package com.retail.billkeeper.dto;

import com.retail.billkeeper.model.Party;

import java.math.BigDecimal;

public record PartyResponse(
        Long id,
        String name,
        String contactPerson,
        String phone,
        String email,
        String address,
        BigDecimal runningBalance) {

    public static PartyResponse from(Party party) {
        return new PartyResponse(
                party.getId(),
                party.getName(),
                party.getContactPerson(),
                party.getPhone(),
                party.getEmail(),
                party.getAddress(),
                party.getRunningBalance());
    }
}
