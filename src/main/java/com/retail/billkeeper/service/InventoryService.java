package com.retail.billkeeper.service;

import com.retail.billkeeper.config.NumberingProperties;
import com.retail.billkeeper.dto.AssignedNumber;
import com.retail.billkeeper.dto.CreateStockItemCommand;
import com.retail.billkeeper.dto.StockAdjustmentCommand;
import com.retail.billkeeper.exception.InsufficientStockException;
import com.retail.billkeeper.exception.InvalidAmountException;
import com.retail.billkeeper.exception.ResourceNotFoundException;
import com.retail.billkeeper.model.MovementType;
import com.retail.billkeeper.model.StockItem;
import com.retail.billkeeper.model.StockMovement;
import com.retail.billkeeper.repository.SequenceSource;
import com.retail.billkeeper.repository.StockItemRepository;
import com.retail.billkeeper.repository.StockMovementRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Keeps stock item quantities and their movement history in step.
 * <p>
 * Every change goes through {@link #applyMovements}: the affected items are
 * locked in ascending id order, the whole batch is validated, and only then
 * are quantities changed. A batch that would take any item below zero leaves
 * every item untouched.
 */
@Service
public class InventoryService {

    private static final Logger logger = LoggerFactory.getLogger(InventoryService.class);

    private final StockItemRepository stockItemRepository;
    private final StockMovementRepository movementRepository;
    private final DocumentNumberGenerator numberGenerator;
    private final NumberingProperties numberingProperties;
    private final AuditService auditService;
    private final SequenceSource itemSequence;

    public InventoryService(StockItemRepository stockItemRepository, StockMovementRepository movementRepository,
            DocumentNumberGenerator numberGenerator, NumberingProperties numberingProperties,
            AuditService auditService) {
        this.stockItemRepository = stockItemRepository;
        this.movementRepository = movementRepository;
        this.numberGenerator = numberGenerator;
        this.numberingProperties = numberingProperties;
        this.auditService = auditService;
        this.itemSequence = SequenceSource.of(stockItemRepository::findMaxSequence, StockItem.TABLE,
                StockItem.CODE_CONSTRAINT, StockItem.SERIES_CONSTRAINT);
    }

    /**
     * Registers a stock item under the next free item code. An opening
     * quantity is booked as an OPENING movement.
     */
    public StockItem createItem(CreateStockItemCommand command) {
        int opening = command.openingQuantity() != null ? command.openingQuantity() : 0;
        if (opening < 0) {
            throw new InvalidAmountException("Opening quantity cannot be negative");
        }
        StockItem item = numberGenerator.generate(itemSequence, numberingProperties.getItemPrefix(),
                assigned -> persistNewItem(command, opening, assigned));
        logger.info("Created stock item {} ({}) with {} on hand", item.getCode(), item.getName(), opening);
        return item;
    }

    private StockItem persistNewItem(CreateStockItemCommand command, int opening, AssignedNumber assigned) {
        StockItem item = new StockItem();
        item.setCode(assigned.number());
        item.setSeriesPrefix(assigned.prefix());
        item.setSequence(assigned.sequence());
        item.setName(command.name().trim());
        item.setRetailPrice(command.retailPrice());
        item.setTaxPercent(command.taxPercent() != null ? command.taxPercent() : BigDecimal.ZERO);
        if (command.lowStockThreshold() != null) {
            item.setLowStockThreshold(command.lowStockThreshold());
        }
        item.setQuantityOnHand(opening);
        item = stockItemRepository.saveAndFlush(item);
        if (opening > 0) {
            recordMovement(item, MovementType.OPENING, opening, assigned.number(), null);
        }
        return item;
    }

    @Transactional
    public StockItem receiveStock(Long itemId, StockAdjustmentCommand command) {
        if (command.quantity() == null || command.quantity() <= 0) {
            throw new InvalidAmountException("Received quantity must be positive");
        }
        return applyManualChange(itemId, MovementType.RECEIPT, command);
    }

    /**
     * Books a signed correction, e.g. after a stock count. The result may not
     * fall below zero.
     */
    @Transactional
    public StockItem adjustStock(Long itemId, StockAdjustmentCommand command) {
        if (command.quantity() == null || command.quantity() == 0) {
            throw new InvalidAmountException("Adjustment quantity must not be zero");
        }
        StockItem item = applyManualChange(itemId, MovementType.ADJUSTMENT, command);
        auditService.log(AuditService.STOCK_ADJUSTED, "Stock item " + item.getCode() + " adjusted by "
                + command.quantity() + " to " + item.getQuantityOnHand());
        return item;
    }

    private StockItem applyManualChange(Long itemId, MovementType type, StockAdjustmentCommand command) {
        StockItem item = stockItemRepository.findByIdForUpdate(itemId)
                .filter(StockItem::isActive)
                .orElseThrow(() -> ResourceNotFoundException.of("Stock item", itemId));
        int change = command.quantity();
        if (item.getQuantityOnHand() + change < 0) {
            throw new InsufficientStockException(item.getCode(), item.getQuantityOnHand(), -change);
        }
        item.setQuantityOnHand(item.getQuantityOnHand() + change);
        stockItemRepository.save(item);
        recordMovement(item, type, change, item.getCode(), command.notes());
        logger.info("{} of {} on {}; now {}", type, change, item.getCode(), item.getQuantityOnHand());
        return item;
    }

    /**
     * Applies signed quantity changes to several items as one batch, inside the
     * caller's transaction. Negative values take stock out.
     *
     * @param changes   quantity change per stock item id; zero entries are skipped and not locked
     * @param type      movement type recorded for every change
     * @param reference number of the document or return behind the change
     * @return the locked items, by id
     * @throws ResourceNotFoundException  when an item is missing, or deleted and being sold
     * @throws InsufficientStockException when any item would go below zero
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<Long, StockItem> applyMovements(Map<Long, Integer> changes, MovementType type, String reference) {
        Map<Long, StockItem> locked = new TreeMap<>();
        for (Map.Entry<Long, Integer> change : new TreeMap<>(changes).entrySet()) {
            if (change.getValue() == 0) {
                continue;
            }
            Long itemId = change.getKey();
            StockItem item = stockItemRepository.findByIdForUpdate(itemId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Stock item", itemId));
            if (type == MovementType.SALE && !item.isActive()) {
                throw ResourceNotFoundException.of("Stock item", itemId);
            }
            int quantity = change.getValue();
            if (item.getQuantityOnHand() + quantity < 0) {
                throw new InsufficientStockException(item.getCode(), item.getQuantityOnHand(), -quantity);
            }
            locked.put(itemId, item);
        }

        for (Map.Entry<Long, StockItem> entry : locked.entrySet()) {
            int quantity = changes.get(entry.getKey());
            StockItem item = entry.getValue();
            item.setQuantityOnHand(item.getQuantityOnHand() + quantity);
            stockItemRepository.save(item);
            recordMovement(item, type, quantity, reference, null);
            if (item.isLowStock()) {
                logger.info("Stock item {} is low: {} left", item.getCode(), item.getQuantityOnHand());
            }
        }
        return locked;
    }

    private void recordMovement(StockItem item, MovementType type, int quantity, String reference, String notes) {
        StockMovement movement = new StockMovement();
        movement.setStockItem(item);
        movement.setMovementType(type);
        movement.setQuantityChange(quantity);
        movement.setBalanceAfter(item.getQuantityOnHand());
        movement.setReference(reference);
        movement.setNotes(notes);
        movementRepository.save(movement);
        logger.debug("{} {} on {} ({}), balance {}", type, quantity, item.getCode(), reference,
                item.getQuantityOnHand());
    }

    @Transactional(readOnly = true)
    public List<StockItem> listActive() {
        return stockItemRepository.findByActiveTrueOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public StockItem getItem(Long itemId) {
        return stockItemRepository.findById(itemId)
                .filter(StockItem::isActive)
                .orElseThrow(() -> ResourceNotFoundException.of("Stock item", itemId));
    }

    @Transactional(readOnly = true)
    public List<StockMovement> getMovements(Long itemId) {
        getItem(itemId);
        return movementRepository.findByStockItemIdOrderByMovedAtAscIdAsc(itemId);
    }

    /**
     * Hides the item from lists and blocks new sales of it. Lines that already
     * reference it keep working, so their reversals still restock it.
     */
    @Transactional
    public void softDeleteItem(Long itemId) {
        StockItem item = stockItemRepository.findByIdForUpdate(itemId)
                .orElseThrow(() -> ResourceNotFoundException.of("Stock item", itemId));
        if (!item.softDelete()) {
            return;
        }
        stockItemRepository.save(item);
        auditService.log(AuditService.STOCK_ITEM_DELETED, "Stock item " + item.getCode() + " (" + item.getName()
                + ", id " + itemId + ") with " + item.getQuantityOnHand() + " on hand");
    }
}
