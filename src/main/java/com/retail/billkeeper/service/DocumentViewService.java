package com.retail.billkeeper.service;

import com.retail.billkeeper.dto.CompanyProfile;
import com.retail.billkeeper.dto.DocumentSummaryRow;
import com.retail.billkeeper.dto.DocumentView;
import com.retail.billkeeper.exception.ResourceNotFoundException;
import com.retail.billkeeper.model.*;
import com.retail.billkeeper.repository.DocumentRepository;
import com.retail.billkeeper.repository.LineItemRepository;
import com.retail.billkeeper.repository.PaymentRepository;
import com.retail.billkeeper.repository.SalesReturnRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Builds print-ready snapshots of documents. Reads stored totals only; nothing
 * here recomputes or writes.
 */
@Service
public class DocumentViewService {

    private final DocumentRepository documentRepository;
    private final LineItemRepository lineItemRepository;
    private final PaymentRepository paymentRepository;
    private final SalesReturnRepository returnRepository;
    private final SettingsService settingsService;

    public DocumentViewService(DocumentRepository documentRepository, LineItemRepository lineItemRepository,
            PaymentRepository paymentRepository, SalesReturnRepository returnRepository,
            SettingsService settingsService) {
        this.documentRepository = documentRepository;
        this.lineItemRepository = lineItemRepository;
        this.paymentRepository = paymentRepository;
        this.returnRepository = returnRepository;
        this.settingsService = settingsService;
    }

    @Transactional(readOnly = true)
    public DocumentView getView(Long documentId) {
        Document document = documentRepository.findById(documentId)
                .filter(Document::isActive)
                .orElseThrow(() -> ResourceNotFoundException.of("Document", documentId));

        List<DocumentView.Line> lines = lineItemRepository.findByDocumentIdAndActiveTrueOrderByIdAsc(documentId)
                .stream()
                .map(item -> new DocumentView.Line(item.getId(), item.getDescription(), item.getQuantity(),
                        item.getRate(), item.getTaxPercent(), item.getDiscountPercent(), item.getLineTotal()))
                .toList();

        List<DocumentView.PaymentRow> payments = paymentRepository
                .findByDocumentIdAndActiveTrueOrderByPaymentDateAscIdAsc(documentId)
                .stream()
                .map(p -> new DocumentView.PaymentRow(p.getId(), p.getPaymentNumber(), p.getPaymentDate(),
                        p.getMode(), p.getAmount()))
                .toList();

        List<DocumentView.ReturnRow> returns = returnRepository.findByDocumentIdAndActiveTrueOrderByIdAsc(documentId)
                .stream()
                .map(r -> new DocumentView.ReturnRow(r.getId(), r.getReturnNumber(), r.getReturnDate(),
                        itemDescription(r), r.getQuantity(), r.getAmount()))
                .toList();

        DocumentView.Totals totals = new DocumentView.Totals(document.getBaseAmount(), document.getTaxAmount(),
                document.getDiscountAmount(), document.getRoundOff(), document.getReturnAmount(), document.getFinalAmount(),
                document.getPaidAmount(), document.getBalanceDue(), document.isPaid());

        CompanyProfile company = settingsService.getCompanyProfile();
        return new DocumentView(
                document.getId(),
                document.getNumber(),
                document.getDocumentType(),
                document.getDocumentDate(),
                partyName(document.getParty()),
                document.getStatus(),
                lines,
                totals,
                payments,
                returns,
                orNotAvailable(company.name()),
                orNotAvailable(company.phone()));
    }

    @Transactional(readOnly = true)
    public List<DocumentSummaryRow> listActive(DocumentType type) {
        return documentRepository.findByDocumentTypeAndActiveTrueOrderByDocumentDateDescNumberDesc(type)
                .stream()
                .map(d -> new DocumentSummaryRow(d.getId(), d.getNumber(), d.getDocumentDate(),
                        partyName(d.getParty()), d.getFinalAmount(), d.getBalanceDue(), d.getStatus()))
                .toList();
    }

    private String partyName(Party party) {
        if (party == null || !party.isActive()) {
            return DocumentView.NOT_AVAILABLE;
        }
        return orNotAvailable(party.getName());
    }

    // The linked item may have been deleted after the return was recorded
    private String itemDescription(SalesReturn salesReturn) {
        LineItem item = salesReturn.getLineItem();
        if (item == null || !item.isActive()) {
            return DocumentView.NOT_AVAILABLE;
        }
        return orNotAvailable(item.getDescription());
    }

    private String orNotAvailable(String value) {
        return value == null || value.isBlank() ? DocumentView.NOT_AVAILABLE : value;
    }
}
