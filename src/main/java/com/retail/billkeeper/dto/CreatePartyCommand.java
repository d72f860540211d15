package com.retail.billkeeper.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePartyCommand(
        @NotBlank @Size(max = 255) String name,
        String contactPerson,
        String phone,
        @Email String email,
        String address) {
}
