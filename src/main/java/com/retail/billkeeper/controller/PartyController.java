package com.retail.billkeeper.controller;

import com.retail.billkeeper.dto.CreatePartyCommand;
import com.retail.billkeeper.dto.PartyResponse;
import com.retail.billkeeper.dto.PartyStatement;
import com.retail.billkeeper.service.PartyService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/parties")
public class PartyController {

    private final PartyService partyService;

    public PartyController(PartyService partyService) {
        this.partyService = partyService;
    }

    @PostMapping
    public ResponseEntity<PartyResponse> create(@Valid @RequestBody CreatePartyCommand command) {
        return ResponseEntity.status(HttpStatus.CREATED).body(PartyResponse.from(partyService.createParty(command)));
    }

    @GetMapping
    public List<PartyResponse> list() {
        return partyService.listActive().stream().map(PartyResponse::from).toList();
    }

    @GetMapping("/{id}/statement")
    public PartyStatement statement(@PathVariable Long id) {
        return partyService.getStatement(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        partyService.softDeleteParty(id);
        return ResponseEntity.noContent().build();
    }
}
