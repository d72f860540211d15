package com.retail.billkeeper.service;

import com.retail.billkeeper.config.NumberingProperties;
import com.retail.billkeeper.dto.StockAdjustmentCommand;
import com.retail.billkeeper.exception.InsufficientStockException;
import com.retail.billkeeper.exception.InvalidAmountException;
import com.retail.billkeeper.exception.ResourceNotFoundException;
import com.retail.billkeeper.model.MovementType;
import com.retail.billkeeper.model.StockItem;
import com.retail.billkeeper.model.StockMovement;
import com.retail.billkeeper.repository.StockItemRepository;
import com.retail.billkeeper.repository.StockMovementRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InventoryServiceTest {

    @Mock
    private StockItemRepository stockItemRepository;
    @Mock
    private StockMovementRepository movementRepository;
    @Mock
    private DocumentNumberGenerator numberGenerator;
    @Mock
    private NumberingProperties numberingProperties;
    @Mock
    private AuditService auditService;

    @InjectMocks
    private InventoryService inventoryService;

    private StockItem stubItem(long id, int onHand) {
        StockItem item = new StockItem();
        item.setId(id);
        item.setCode(String.format("ITM-%06d", id));
        item.setName("Item " + id);
        item.setQuantityOnHand(onHand);
        when(stockItemRepository.findByIdForUpdate(id)).thenReturn(Optional.of(item));
        return item;
    }

    @Test
    void applyMovements_ShouldLockItemsInAscendingIdOrder() {
        stubItem(3L, 10);
        stubItem(5L, 10);
        stubItem(9L, 10);

        inventoryService.applyMovements(Map.of(9L, -1, 3L, -2, 5L, -3), MovementType.SALE, "INV-000001");

        InOrder inOrder = inOrder(stockItemRepository);
        inOrder.verify(stockItemRepository).findByIdForUpdate(3L);
        inOrder.verify(stockItemRepository).findByIdForUpdate(5L);
        inOrder.verify(stockItemRepository).findByIdForUpdate(9L);
    }

    @Test
    void applyMovements_ShouldChangeNothing_WhenAnyItemIsShort() {
        StockItem first = stubItem(3L, 10);
        StockItem second = stubItem(5L, 1);

        InsufficientStockException e = assertThrows(InsufficientStockException.class,
                () -> inventoryService.applyMovements(Map.of(3L, -4, 5L, -2), MovementType.SALE, "INV-000002"));

        assertEquals("ITM-000005", e.getItemCode());
        assertEquals(1, e.getAvailable());
        assertEquals(2, e.getRequested());
        assertEquals(10, first.getQuantityOnHand());
        assertEquals(1, second.getQuantityOnHand());
        verify(stockItemRepository, never()).save(any());
        verify(movementRepository, never()).save(any());
    }

    @Test
    void applyMovements_ShouldRecordBalanceAfterEachChange() {
        StockItem item = stubItem(4L, 6);
        ArgumentCaptor<StockMovement> captor = ArgumentCaptor.forClass(StockMovement.class);

        inventoryService.applyMovements(Map.of(4L, 2), MovementType.RETURN, "RET-202610-000001");

        verify(movementRepository).save(captor.capture());
        StockMovement movement = captor.getValue();
        assertEquals(MovementType.RETURN, movement.getMovementType());
        assertEquals(2, movement.getQuantityChange());
        assertEquals(8, movement.getBalanceAfter());
        assertEquals("RET-202610-000001", movement.getReference());
        assertSame(item, movement.getStockItem());
        assertEquals(8, item.getQuantityOnHand());
    }

    @Test
    void applyMovements_ShouldRefuseSaleOfDeletedItem_ButRestockIt() {
        StockItem item = stubItem(7L, 2);
        item.softDelete();

        assertThrows(ResourceNotFoundException.class,
                () -> inventoryService.applyMovements(Map.of(7L, -1), MovementType.SALE, "INV-000003"));

        inventoryService.applyMovements(Map.of(7L, 1), MovementType.SALE_REVERSAL, "INV-000003");
        assertEquals(3, item.getQuantityOnHand());
    }

    @Test
    void applyMovements_ShouldSkipZeroChanges() {
        inventoryService.applyMovements(Map.of(2L, 0), MovementType.SALE, "INV-000004");

        verifyNoInteractions(stockItemRepository, movementRepository);
    }

    @Test
    void receiveStock_ShouldRejectNonPositiveQuantity() {
        assertThrows(InvalidAmountException.class,
                () -> inventoryService.receiveStock(1L, new StockAdjustmentCommand(0, null)));
        verifyNoInteractions(stockItemRepository);
    }

    @Test
    void adjustStock_ShouldAuditTheCorrection() {
        StockItem item = stubItem(8L, 5);

        inventoryService.adjustStock(8L, new StockAdjustmentCommand(-2, "Count"));

        assertEquals(3, item.getQuantityOnHand());
        verify(auditService).log(eq(AuditService.STOCK_ADJUSTED), contains("ITM-000008"));
    }
}
