package com.retail.billkeeper.service;

import com.retail.billkeeper.config.ReturnPolicyProperties;
import com.retail.billkeeper.dto.AssignedNumber;
import com.retail.billkeeper.dto.CreateReturnCommand;
import com.retail.billkeeper.dto.LedgerChange;
import com.retail.billkeeper.dto.LedgerChange.Action;
import com.retail.billkeeper.exception.InvalidAmountException;
import com.retail.billkeeper.exception.ResourceNotFoundException;
import com.retail.billkeeper.model.Document;
import com.retail.billkeeper.model.LineItem;
import com.retail.billkeeper.model.MovementType;
import com.retail.billkeeper.model.SalesReturn;
import com.retail.billkeeper.repository.DocumentRepository;
import com.retail.billkeeper.repository.LineItemRepository;
import com.retail.billkeeper.repository.SalesReturnRepository;
import com.retail.billkeeper.repository.SequenceSource;
import com.retail.billkeeper.util.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

@Service
public class ReturnsService {

    private static final Logger logger = LoggerFactory.getLogger(ReturnsService.class);

    private final SalesReturnRepository returnRepository;
    private final DocumentRepository documentRepository;
    private final LineItemRepository lineItemRepository;
    private final DocumentNumberGenerator numberGenerator;
    private final SeriesPrefixResolver prefixResolver;
    private final LedgerAggregator ledgerAggregator;
    private final AuditService auditService;
    private final ReturnPolicyProperties policy;
    private final InventoryService inventoryService;
    private final SequenceSource returnSequence;

    public ReturnsService(SalesReturnRepository returnRepository, DocumentRepository documentRepository,
            LineItemRepository lineItemRepository, DocumentNumberGenerator numberGenerator,
            SeriesPrefixResolver prefixResolver, LedgerAggregator ledgerAggregator, AuditService auditService,
            ReturnPolicyProperties policy, InventoryService inventoryService) {
        this.returnRepository = returnRepository;
        this.documentRepository = documentRepository;
        this.lineItemRepository = lineItemRepository;
        this.numberGenerator = numberGenerator;
        this.prefixResolver = prefixResolver;
        this.ledgerAggregator = ledgerAggregator;
        this.auditService = auditService;
        this.policy = policy;
        this.inventoryService = inventoryService;
        this.returnSequence = SequenceSource.of(returnRepository::findMaxSequence, SalesReturn.TABLE,
                SalesReturn.NUMBER_CONSTRAINT, SalesReturn.SERIES_CONSTRAINT);
    }

    /**
     * Records a return under the next {@code RET-yyyyMM} number. The document's
     * final amount and balance due drop by the returned value, and goods of a
     * stocked line go back on hand.
     */
    public SalesReturn createReturn(CreateReturnCommand command) {
        int quantity = command.quantity() != null ? command.quantity() : 1;
        if (quantity <= 0) {
            throw new IllegalArgumentException("Returned quantity must be at least 1");
        }
        if (command.lineItemId() == null && !Money.isPositive(Money.round(command.amount()))) {
            throw new InvalidAmountException("A return without a line item needs an amount greater than zero");
        }
        LocalDate date = command.date() != null ? command.date() : LocalDate.now();

        SalesReturn salesReturn = numberGenerator.generate(returnSequence, prefixResolver.returnPrefix(date),
                assigned -> persistNewReturn(command, quantity, date, assigned));
        logger.info("Recorded return {} of {} against document {}", salesReturn.getReturnNumber(),
                salesReturn.getAmount(), command.documentId());
        return salesReturn;
    }

    private SalesReturn persistNewReturn(CreateReturnCommand command, int quantity, LocalDate date,
            AssignedNumber assigned) {
        Document document = lockActiveDocument(command.documentId());

        LineItem item = null;
        BigDecimal amount;
        if (command.lineItemId() != null) {
            item = lineItemRepository.findById(command.lineItemId())
                    .orElseThrow(() -> ResourceNotFoundException.of("Line item", command.lineItemId()));
            if (!item.getDocument().getId().equals(document.getId())) {
                throw new IllegalArgumentException("Line item " + item.getId() + " is not on " + document.getNumber());
            }
            if (!item.isActive()) {
                throw new IllegalStateException("Line item " + item.getId() + " has been deleted");
            }
            long alreadyReturned = returnRepository.sumActiveReturnedQuantity(item.getId());
            long returnable = item.getQuantity() - alreadyReturned;
            if (quantity > returnable) {
                throw new IllegalArgumentException("Only " + returnable + " of " + item.getQuantity() + " x "
                        + item.getDescription() + " can still be returned");
            }
            amount = ledgerAggregator.returnAmountFor(item, quantity);
            if (amount.signum() == 0 && policy.isRejectZeroValueReturns()) {
                throw new InvalidAmountException("Line item " + item.getId() + " has no refundable value");
            }
        } else {
            amount = Money.round(command.amount());
        }

        BigDecimal returnedAfter = document.getReturnAmount().add(amount);
        if (returnedAfter.compareTo(document.getGrossAmount()) > 0) {
            throw new InvalidAmountException("Returns of " + returnedAfter + " would exceed the "
                    + document.getGrossAmount() + " billed on " + document.getNumber());
        }

        SalesReturn salesReturn = new SalesReturn();
        salesReturn.setReturnNumber(assigned.number());
        salesReturn.setSeriesPrefix(assigned.prefix());
        salesReturn.setSequence(assigned.sequence());
        salesReturn.setDocument(document);
        salesReturn.setParty(document.getParty());
        salesReturn.setLineItem(item);
        salesReturn.setQuantity(quantity);
        salesReturn.setAmount(amount);
        salesReturn.setReason(command.reason());
        salesReturn.setReturnDate(date);
        salesReturn = returnRepository.saveAndFlush(salesReturn);

        if (item != null && item.getStockItem() != null) {
            inventoryService.applyMovements(Map.of(item.getStockItem().getId(), quantity), MovementType.RETURN,
                    assigned.number());
        }
        ledgerAggregator.recomputeDocumentAndParty(document.getId(),
                LedgerChange.of("return", salesReturn.getId(), Action.CREATED));
        return salesReturn;
    }

    /**
     * Soft-deletes a return, restoring the returned value to the document.
     * Deleting twice is a no-op. Restocked goods are taken back out only while
     * the document and its line are still active; otherwise their reversal
     * already skipped the returned quantity.
     */
    @Transactional
    public void softDeleteReturn(Long returnId) {
        Long documentId = returnRepository.findDocumentIdById(returnId)
                .orElseThrow(() -> ResourceNotFoundException.of("Return", returnId));
        Document document = documentRepository.findByIdForUpdate(documentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Document", documentId));
        // Loaded after the lock so a delete committed while we waited is seen
        SalesReturn salesReturn = returnRepository.findById(returnId)
                .orElseThrow(() -> ResourceNotFoundException.of("Return", returnId));
        if (!salesReturn.softDelete()) {
            return;
        }
        LineItem item = salesReturn.getLineItem();
        if (document.isActive() && item != null && item.isActive() && item.getStockItem() != null) {
            inventoryService.applyMovements(Map.of(item.getStockItem().getId(), -salesReturn.getQuantity()),
                    MovementType.RETURN_REVERSAL, salesReturn.getReturnNumber());
        }
        returnRepository.save(salesReturn);
        auditService.log(AuditService.RETURN_DELETED, "Return " + salesReturn.getReturnNumber() + " of "
                + salesReturn.getAmount() + " (id " + returnId + ")");

        ledgerAggregator.recomputeDocumentAndParty(documentId,
                LedgerChange.of("return", returnId, Action.SOFT_DELETED));
    }

    private Document lockActiveDocument(Long documentId) {
        Document document = documentRepository.findByIdForUpdate(documentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Document", documentId));
        if (!document.isActive()) {
            throw new IllegalStateException("Document " + document.getNumber() + " has been deleted");
        }
        return document;
    }
}
