package com.retail.billkeeper.controller;

import com.retail.billkeeper.dto.CreateStockItemCommand;
import com.retail.billkeeper.dto.StockAdjustmentCommand;
import com.retail.billkeeper.dto.StockItemResponse;
import com.retail.billkeeper.dto.StockMovementResponse;
import com.retail.billkeeper.service.InventoryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/stock-items")
public class StockItemController {

    private final InventoryService inventoryService;

    public StockItemController(InventoryService inventoryService) {
        this.inventoryService = inventoryService;
    }

    @PostMapping
    public ResponseEntity<StockItemResponse> create(@Valid @RequestBody CreateStockItemCommand command) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(StockItemResponse.from(inventoryService.createItem(command)));
    }

    @GetMapping
    public List<StockItemResponse> list() {
        return inventoryService.listActive().stream().map(StockItemResponse::from).toList();
    }

    @GetMapping("/{id}")
    public StockItemResponse get(@PathVariable Long id) {
        return StockItemResponse.from(inventoryService.getItem(id));
    }

    @GetMapping("/{id}/movements")
    public List<StockMovementResponse> movements(@PathVariable Long id) {
        return inventoryService.getMovements(id).stream().map(StockMovementResponse::from).toList();
    }

    @PostMapping("/{id}/receipts")
    public StockItemResponse receive(@PathVariable Long id, @Valid @RequestBody StockAdjustmentCommand command) {
        return StockItemResponse.from(inventoryService.receiveStock(id, command));
    }

    @PostMapping("/{id}/adjustments")
    public StockItemResponse adjust(@PathVariable Long id, @Valid @RequestBody StockAdjustmentCommand command) {
        return StockItemResponse.from(inventoryService.adjustStock(id, command));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        inventoryService.softDeleteItem(id);
        return ResponseEntity.noContent().build();
    }
}
