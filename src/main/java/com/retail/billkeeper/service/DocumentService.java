package com.retail.billkeeper.service;

import com.retail.billkeeper.dto.AssignedNumber;
import com.retail.billkeeper.dto.CreateDocumentCommand;
import com.retail.billkeeper.dto.LedgerChange;
import com.retail.billkeeper.dto.LedgerChange.Action;
import com.retail.billkeeper.dto.LineItemDraft;
import com.retail.billkeeper.exception.EmptyDocumentException;
import com.retail.billkeeper.exception.InvalidAmountException;
import com.retail.billkeeper.exception.ResourceNotFoundException;
import com.retail.billkeeper.model.Document;
import com.retail.billkeeper.model.DocumentType;
import com.retail.billkeeper.model.LineItem;
import com.retail.billkeeper.model.MovementType;
import com.retail.billkeeper.model.Party;
import com.retail.billkeeper.model.StockItem;
import com.retail.billkeeper.repository.DocumentRepository;
import com.retail.billkeeper.repository.LineItemRepository;
import com.retail.billkeeper.repository.PartyRepository;
import com.retail.billkeeper.repository.SalesReturnRepository;
import com.retail.billkeeper.repository.SequenceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class DocumentService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

    private final DocumentRepository documentRepository;
    private final LineItemRepository lineItemRepository;
    private final PartyRepository partyRepository;
    private final SalesReturnRepository returnRepository;
    private final DocumentNumberGenerator numberGenerator;
    private final SeriesPrefixResolver prefixResolver;
    private final LedgerAggregator ledgerAggregator;
    private final AuditService auditService;
    private final InventoryService inventoryService;
    private final SequenceSource documentSequence;

    public DocumentService(DocumentRepository documentRepository, LineItemRepository lineItemRepository,
            PartyRepository partyRepository, SalesReturnRepository returnRepository,
            DocumentNumberGenerator numberGenerator, SeriesPrefixResolver prefixResolver,
            LedgerAggregator ledgerAggregator, AuditService auditService, InventoryService inventoryService) {
        this.documentRepository = documentRepository;
        this.lineItemRepository = lineItemRepository;
        this.partyRepository = partyRepository;
        this.returnRepository = returnRepository;
        this.numberGenerator = numberGenerator;
        this.prefixResolver = prefixResolver;
        this.ledgerAggregator = ledgerAggregator;
        this.auditService = auditService;
        this.inventoryService = inventoryService;
        this.documentSequence = SequenceSource.of(documentRepository::findMaxSequence, Document.TABLE,
                Document.NUMBER_CONSTRAINT, Document.SERIES_CONSTRAINT);
    }

    /**
     * Creates an invoice or challan with its line items under the next free
     * number of its series.
     * <p>
     * Not transactional: each numbering attempt runs in its own
     * transaction, and a document without items or without enough stock is
     * refused inside that transaction so no row and no number survive.
     */
    public Document createDocument(CreateDocumentCommand command) {
        List<LineItemDraft> drafts = command.items() != null ? command.items() : List.of();
        drafts.forEach(this::validateDraft);

        LocalDate date = command.date() != null ? command.date() : LocalDate.now();
        String prefix = prefixResolver.documentPrefix(command.type(), date);

        Document document = numberGenerator.generate(documentSequence, prefix,
                assigned -> persistNewDocument(command, drafts, date, assigned));
        logger.info("Created {} {} for party {} with {} line items", command.type(), document.getNumber(),
                command.partyId(), drafts.size());
        return document;
    }

    private Document persistNewDocument(CreateDocumentCommand command, List<LineItemDraft> drafts, LocalDate date,
            AssignedNumber assigned) {
        if (drafts.isEmpty()) {
            throw new EmptyDocumentException("A " + command.type().name().toLowerCase()
                    + " needs at least one line item");
        }
        Party party = partyRepository.findById(command.partyId())
                .filter(Party::isActive)
                .orElseThrow(() -> ResourceNotFoundException.of("Party", command.partyId()));

        Document document = new Document();
        document.setDocumentType(command.type());
        document.setSeriesPrefix(assigned.prefix());
        document.setSequence(assigned.sequence());
        document.setNumber(assigned.number());
        document.setDocumentDate(date);
        document.setParty(party);
        document.setNotes(command.notes());
        if (command.type() == DocumentType.CHALLAN) {
            document.setTransportDetails(command.transportDetails());
        }
        // Flush now: a number taken by a concurrent writer must fail this attempt, not the commit
        document = documentRepository.saveAndFlush(document);

        Map<Long, Integer> demand = new HashMap<>();
        for (LineItemDraft draft : drafts) {
            if (draft.stockItemId() != null) {
                demand.merge(draft.stockItemId(), -draft.quantity(), Integer::sum);
            }
        }
        Map<Long, StockItem> stock = demand.isEmpty() ? Map.of()
                : inventoryService.applyMovements(demand, MovementType.SALE, assigned.number());

        for (LineItemDraft draft : drafts) {
            LineItem item = new LineItem();
            item.setDocument(document);
            item.setStockItem(draft.stockItemId() != null ? stock.get(draft.stockItemId()) : null);
            applyDraft(item, draft);
            lineItemRepository.save(item);
        }

        ledgerAggregator.recomputeDocumentAndParty(document.getId(),
                LedgerChange.of("document", document.getId(), Action.CREATED));
        auditService.log(AuditService.NUMBER_ASSIGNED,
                "Assigned " + assigned.number() + " to " + command.type() + " id " + document.getId());
        return document;
    }

    @Transactional
    public LineItem addLineItem(Long documentId, LineItemDraft draft) {
        validateDraft(draft);
        Document document = lockActiveDocument(documentId);

        LineItem item = new LineItem();
        item.setDocument(document);
        if (draft.stockItemId() != null) {
            Map<Long, StockItem> stock = inventoryService.applyMovements(
                    Map.of(draft.stockItemId(), -draft.quantity()), MovementType.SALE, document.getNumber());
            item.setStockItem(stock.get(draft.stockItemId()));
        }
        applyDraft(item, draft);
        item = lineItemRepository.save(item);

        ledgerAggregator.recomputeDocumentAndParty(documentId,
                LedgerChange.of("lineItem", item.getId(), Action.CREATED));
        return item;
    }

    /**
     * Replaces the quantity, rate and percentages of a line. The quantity may
     * not drop below what has already been returned, and a linked stock item
     * moves by the difference.
     */
    @Transactional
    public LineItem updateLineItem(Long lineItemId, LineItemDraft draft) {
        validateDraft(draft);
        Long documentId = lineItemRepository.findDocumentIdById(lineItemId)
                .orElseThrow(() -> ResourceNotFoundException.of("Line item", lineItemId));
        Document document = lockActiveDocument(documentId);
        // Loaded only now, so a concurrent delete that committed while we waited is visible
        LineItem item = lineItemRepository.findById(lineItemId)
                .orElseThrow(() -> ResourceNotFoundException.of("Line item", lineItemId));
        if (!item.isActive()) {
            throw new IllegalStateException("Line item " + lineItemId + " has been deleted");
        }

        Long stockItemId = item.getStockItem() != null ? item.getStockItem().getId() : null;
        if (draft.stockItemId() != null && !draft.stockItemId().equals(stockItemId)) {
            throw new IllegalArgumentException("The stock item of line item " + lineItemId + " cannot be changed");
        }
        long returned = returnRepository.sumActiveReturnedQuantity(lineItemId);
        if (draft.quantity() < returned) {
            throw new IllegalArgumentException("Quantity of line item " + lineItemId + " cannot go below the "
                    + returned + " already returned");
        }
        int delta = draft.quantity() - item.getQuantity();
        if (stockItemId != null && delta != 0) {
            inventoryService.applyMovements(Map.of(stockItemId, -delta),
                    delta > 0 ? MovementType.SALE : MovementType.SALE_REVERSAL, document.getNumber());
        }

        applyDraft(item, draft);
        lineItemRepository.save(item);

        Document updated = ledgerAggregator.recomputeDocumentAndParty(documentId,
                LedgerChange.of("lineItem", lineItemId, Action.UPDATED));
        requireReturnsWithinGross(updated);
        return item;
    }

    /**
     * Soft-deletes a line item. Deleting an already deleted item is a no-op;
     * deleting the last active item of a document is refused.
     */
    @Transactional
    public void softDeleteLineItem(Long lineItemId) {
        Long documentId = lineItemRepository.findDocumentIdById(lineItemId)
                .orElseThrow(() -> ResourceNotFoundException.of("Line item", lineItemId));
        Document document = lockActiveDocument(documentId);
        LineItem item = lineItemRepository.findById(lineItemId)
                .orElseThrow(() -> ResourceNotFoundException.of("Line item", lineItemId));
        if (!item.isActive()) {
            return;
        }
        if (lineItemRepository.countByDocumentIdAndActiveTrue(documentId) <= 1) {
            throw new EmptyDocumentException("Cannot delete the last line item of " + document.getNumber());
        }

        restock(List.of(item), document);
        item.softDelete();
        lineItemRepository.save(item);
        auditService.log(AuditService.LINE_ITEM_DELETED,
                "Line item " + lineItemId + " (" + item.getDescription() + ") of " + document.getNumber());

        Document updated = ledgerAggregator.recomputeDocumentAndParty(documentId,
                LedgerChange.of("lineItem", lineItemId, Action.SOFT_DELETED));
        requireReturnsWithinGross(updated);
    }

    /**
     * Soft-deletes a document. Its number stays taken; its children drop out of
     * every total because the document itself no longer counts. Stock sold on
     * its active lines and not yet returned goes back on hand.
     */
    @Transactional
    public void softDeleteDocument(Long documentId) {
        Document document = documentRepository.findByIdForUpdate(documentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Document", documentId));
        if (!document.isActive()) {
            return;
        }
        restock(lineItemRepository.findByDocumentIdAndActiveTrueOrderByIdAsc(documentId), document);
        document.softDelete();
        documentRepository.save(document);
        auditService.log(AuditService.DOCUMENT_DELETED, document.getDocumentType() + " " + document.getNumber()
                + " (id " + documentId + ")");
        logger.info("Soft-deleted {} {}", document.getDocumentType(), document.getNumber());

        ledgerAggregator.recomputePartyBalance(document.getParty().getId(),
                LedgerChange.of("document", documentId, Action.SOFT_DELETED));
    }

    // Puts back what the lines took out, less what returns already restocked
    private void restock(List<LineItem> items, Document document) {
        Map<Long, Integer> restored = new HashMap<>();
        for (LineItem item : items) {
            if (item.getStockItem() == null) {
                continue;
            }
            long returned = returnRepository.sumActiveReturnedQuantity(item.getId());
            restored.merge(item.getStockItem().getId(), item.getQuantity() - (int) returned, Integer::sum);
        }
        if (!restored.isEmpty()) {
            inventoryService.applyMovements(restored, MovementType.SALE_REVERSAL, document.getNumber());
        }
    }

    /**
     * Fails the current change when the document's returns are now worth more
     * than what is left on it. Thrown after the recompute so that the whole
     * unit of work rolls back.
     */
    private void requireReturnsWithinGross(Document document) {
        if (document.getReturnAmount().compareTo(document.getGrossAmount()) > 0) {
            throw new InvalidAmountException("Returns of " + document.getReturnAmount() + " would exceed the "
                    + document.getGrossAmount() + " billed on " + document.getNumber());
        }
    }

    private Document lockActiveDocument(Long documentId) {
        Document document = documentRepository.findByIdForUpdate(documentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Document", documentId));
        if (!document.isActive()) {
            throw new IllegalStateException("Document " + document.getNumber() + " has been deleted");
        }
        return document;
    }

    private void applyDraft(LineItem item, LineItemDraft draft) {
        String description = draft.description();
        if ((description == null || description.isBlank()) && item.getStockItem() != null) {
            description = item.getStockItem().getName();
        }
        item.setDescription(description);
        item.setQuantity(draft.quantity());
        item.setRate(draft.rate());
        item.setTaxPercent(draft.taxPercent() != null ? draft.taxPercent() : BigDecimal.ZERO);
        item.setDiscountPercent(draft.discountPercent() != null ? draft.discountPercent() : BigDecimal.ZERO);
        ledgerAggregator.applyLineTotal(item);
    }

    private void validateDraft(LineItemDraft draft) {
        if (draft == null) {
            throw new InvalidAmountException("Line item is missing");
        }
        if (draft.quantity() == null || draft.quantity() <= 0) {
            throw new InvalidAmountException("Quantity must be a positive whole number");
        }
        if (draft.rate() == null || draft.rate().signum() < 0) {
            throw new InvalidAmountException("Rate must be zero or more");
        }
        checkPercent("Tax", draft.taxPercent());
        checkPercent("Discount", draft.discountPercent());
    }

    private void checkPercent(String label, BigDecimal percent) {
        if (percent != null && (percent.signum() < 0 || percent.compareTo(BigDecimal.valueOf(100)) > 0)) {
            throw new InvalidAmountException(label + " percent must be between 0 and 100");
        }
    }
}
