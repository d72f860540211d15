package com.retail.billkeeper.controller;

import com.retail.billkeeper.dto.CreateReturnCommand;
import com.retail.billkeeper.dto.ReturnResponse;
import com.retail.billkeeper.service.ReturnsService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/returns")
public class ReturnsController {

    private final ReturnsService returnsService;

    public ReturnsController(ReturnsService returnsService) {
        this.returnsService = returnsService;
    }

    @PostMapping
    public ResponseEntity<ReturnResponse> create(@Valid @RequestBody CreateReturnCommand command) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ReturnResponse.from(returnsService.createReturn(command)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        returnsService.softDeleteReturn(id);
        return ResponseEntity.noContent().build();
    }
}
