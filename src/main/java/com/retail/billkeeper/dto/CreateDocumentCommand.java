package com.retail.billkeeper.dto;

import com.retail.billkeeper.model.DocumentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything needed to create an invoice or challan. An empty item list is
 * accepted here and refused by the service, so the caller gets a dedicated
 * error instead of a generic validation failure.
 */
public record CreateDocumentCommand(
        @NotNull DocumentType type,
        @NotNull Long partyId,
        LocalDate date,
        List<@Valid LineItemDraft> items,
        String notes,
        String transportDetails) {
}
