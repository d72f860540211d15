package com.retail.billkeeper.service;

import com.retail.billkeeper.dto.*;
import com.retail.billkeeper.exception.EmptyDocumentException;
import com.retail.billkeeper.exception.InvalidAmountException;
import com.retail.billkeeper.model.*;
import com.retail.billkeeper.repository.AuditLogRepository;
import com.retail.billkeeper.repository.DocumentRepository;
import com.retail.billkeeper.repository.PartyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the services against the embedded database with real transactions, so
 * every call commits like it would in production.
 */
@SpringBootTest
class LedgerIntegrationTest {

    @Autowired
    private DocumentService documentService;
    @Autowired
    private PaymentService paymentService;
    @Autowired
    private ReturnsService returnsService;
    @Autowired
    private PartyService partyService;
    @Autowired
    private DocumentViewService viewService;
    @Autowired
    private DocumentRepository documentRepository;
    @Autowired
    private PartyRepository partyRepository;
    @Autowired
    private AuditLogRepository auditLogRepository;

    private Party party;

    @BeforeEach
    void setUp() {
        party = partyService.createParty(new CreatePartyCommand("Party " + UUID.randomUUID(), "Ravi", "9800000000",
                null, "Main Road"));
    }

    private static LineItemDraft line(String description, int quantity, String rate, String tax, String discount) {
        return new LineItemDraft(description, quantity, new BigDecimal(rate), new BigDecimal(tax),
                new BigDecimal(discount));
    }

    private Document invoice(LineItemDraft... items) {
        return documentService.createDocument(new CreateDocumentCommand(DocumentType.INVOICE, party.getId(),
                LocalDate.of(2026, 10, 16), List.of(items), null, null));
    }

    private Document reload(Document document) {
        return documentRepository.findById(document.getId()).orElseThrow();
    }

    private BigDecimal partyBalance() {
        return partyRepository.findById(party.getId()).orElseThrow().getRunningBalance();
    }

    private Payment pay(Document document, String amount) {
        return paymentService.recordPayment(new RecordPaymentCommand(party.getId(),
                document != null ? document.getId() : null, new BigDecimal(amount), LocalDate.of(2026, 10, 16),
                PaymentMode.UPI, null));
    }

    @Test
    void invoiceWithPartialPayment_ShouldLeaveBalanceDue() {
        Document created = invoice(line("Boots", 1, "100", "10", "0"), line("Sandals", 1, "100", "0", "10"));
        assertTrue(created.getNumber().startsWith("INV-"));
        assertEquals(new BigDecimal("200.00"), reload(created).getFinalAmount());

        Payment payment = pay(created, "110");
        assertTrue(payment.getPaymentNumber().startsWith("PAY-202610-"));

        Document after = reload(created);
        assertEquals(new BigDecimal("110.00"), after.getPaidAmount());
        assertEquals(new BigDecimal("90.00"), after.getBalanceDue());
        assertFalse(after.isPaid());
        assertEquals(new BigDecimal("90.00"), partyBalance());

        DocumentView view = viewService.getView(created.getId());
        assertEquals(party.getName(), view.partyName());
        assertEquals("Test Traders", view.companyName());
        assertEquals(2, view.lineItems().size());
        assertEquals(1, view.payments().size());
        assertEquals(DocumentStatus.UNPAID, view.status());
    }

    @Test
    void fullPaymentThenDeletion_ShouldToggleStatus() {
        Document created = invoice(line("Boots", 10, "100", "0", "0"));
        Payment first = pay(created, "400");
        assertEquals(new BigDecimal("600.00"), reload(created).getBalanceDue());

        Payment second = pay(created, "600");
        assertTrue(reload(created).isPaid());
        assertEquals(new BigDecimal("0.00"), partyBalance());

        paymentService.softDeletePayment(second.getId());
        paymentService.softDeletePayment(second.getId());
        Document after = reload(created);
        assertEquals(new BigDecimal("600.00"), after.getBalanceDue());
        assertFalse(after.isPaid());
        assertEquals(new BigDecimal("600.00"), partyBalance());

        paymentService.updatePayment(first.getId(),
                new UpdatePaymentCommand(new BigDecimal("500"), null, PaymentMode.CASH, "corrected"));
        assertEquals(new BigDecimal("500.00"), reload(created).getBalanceDue());
    }

    @Test
    void deletedNumbers_ShouldNeverBeReused() {
        Document first = invoice(line("Boots", 1, "100", "0", "0"));
        documentService.softDeleteDocument(first.getId());
        Document second = invoice(line("Boots", 1, "100", "0", "0"));

        assertTrue(second.getSequence() > first.getSequence());
        assertNotEquals(first.getNumber(), second.getNumber());
        assertTrue(documentRepository.findByNumber(first.getNumber()).isPresent());
    }

    @Test
    void emptyDocument_ShouldPersistNothing() {
        Long maxBefore = documentRepository.findMaxSequence("INV");
        long countBefore = documentRepository.count();

        assertThrows(EmptyDocumentException.class,
                () -> documentService.createDocument(new CreateDocumentCommand(DocumentType.INVOICE, party.getId(),
                        null, List.of(), null, null)));

        assertEquals(countBefore, documentRepository.count());
        assertEquals(maxBefore, documentRepository.findMaxSequence("INV"));
    }

    @Test
    void lineItemChanges_ShouldRecomputeTotals() {
        Document created = invoice(line("Boots", 2, "150", "0", "0"), line("Laces", 5, "10", "0", "0"));
        Long lacesId = viewService.getView(created.getId()).lineItems().get(1).id();

        LineItem added = documentService.addLineItem(created.getId(), line("Polish", 1, "49.99", "18", "0"));
        assertEquals(new BigDecimal("58.99"), added.getLineTotal());
        assertEquals(new BigDecimal("408.99"), reload(created).getFinalAmount());

        documentService.updateLineItem(lacesId, line("Laces", 2, "10", "0", "0"));
        assertEquals(new BigDecimal("378.99"), reload(created).getFinalAmount());

        documentService.softDeleteLineItem(added.getId());
        documentService.softDeleteLineItem(added.getId());
        assertEquals(new BigDecimal("320.00"), reload(created).getFinalAmount());
        assertEquals(new BigDecimal("320.00"), partyBalance());
        assertEquals(2, viewService.getView(created.getId()).lineItems().size());
    }

    @Test
    void lastLineItem_ShouldNotBeDeletable() {
        Document created = invoice(line("Boots", 1, "100", "0", "0"));
        Long onlyItem = viewService.getView(created.getId()).lineItems().get(0).id();

        assertThrows(EmptyDocumentException.class, () -> documentService.softDeleteLineItem(onlyItem));
        assertEquals(new BigDecimal("100.00"), reload(created).getFinalAmount());
    }

    @Test
    void returns_ShouldReduceFinalAmountWithinPurchasedQuantity() {
        Document created = invoice(line("Boots", 3, "100", "0", "0"), line("Socks", 2, "25", "0", "0"));
        Long bootsId = viewService.getView(created.getId()).lineItems().get(0).id();

        SalesReturn salesReturn = returnsService.createReturn(
                new CreateReturnCommand(created.getId(), bootsId, 1, null, "Size issue", LocalDate.of(2026, 10, 16)));
        assertTrue(salesReturn.getReturnNumber().startsWith("RET-202610-"));
        assertEquals(new BigDecimal("100.00"), salesReturn.getAmount());

        Document after = reload(created);
        assertEquals(new BigDecimal("100.00"), after.getReturnAmount());
        assertEquals(new BigDecimal("250.00"), after.getFinalAmount());
        assertEquals(new BigDecimal("250.00"), partyBalance());

        assertThrows(IllegalArgumentException.class, () -> returnsService.createReturn(
                new CreateReturnCommand(created.getId(), bootsId, 3, null, null, null)));

        returnsService.softDeleteReturn(salesReturn.getId());
        assertEquals(new BigDecimal("350.00"), reload(created).getFinalAmount());
    }

    @Test
    void lineQuantity_ShouldNotDropBelowReturnedQuantity() {
        Document created = invoice(line("Boots", 3, "100", "0", "0"), line("Socks", 1, "50", "0", "0"));
        Long bootsId = viewService.getView(created.getId()).lineItems().get(0).id();
        returnsService.createReturn(new CreateReturnCommand(created.getId(), bootsId, 3, null, "Wrong colour",
                null));
        assertEquals(new BigDecimal("50.00"), reload(created).getFinalAmount());

        assertThrows(IllegalArgumentException.class,
                () -> documentService.updateLineItem(bootsId, line("Boots", 1, "100", "0", "0")));

        Document after = reload(created);
        assertEquals(new BigDecimal("300.00"), after.getReturnAmount());
        assertEquals(new BigDecimal("50.00"), after.getFinalAmount());
        assertEquals(3, viewService.getView(created.getId()).lineItems().get(0).quantity());

        documentService.updateLineItem(bootsId, line("Boots", 4, "100", "0", "0"));
        assertEquals(new BigDecimal("150.00"), reload(created).getFinalAmount());
    }

    @Test
    void lineChanges_ShouldBeRejected_WhenReturnsWouldExceedWhatIsLeft() {
        Document created = invoice(line("Boots", 3, "100", "0", "0"), line("Socks", 1, "50", "0", "0"));
        List<DocumentView.Line> lines = viewService.getView(created.getId()).lineItems();
        returnsService.createReturn(new CreateReturnCommand(created.getId(), null, 1, new BigDecimal("250"),
                "Goodwill", null));

        assertThrows(InvalidAmountException.class,
                () -> documentService.updateLineItem(lines.get(0).id(), line("Boots", 3, "60", "0", "0")));
        assertThrows(InvalidAmountException.class,
                () -> documentService.softDeleteLineItem(lines.get(0).id()));

        Document after = reload(created);
        assertEquals(new BigDecimal("100.00"), after.getFinalAmount());
        assertEquals(new BigDecimal("350.00"), after.getGrossAmount());
        DocumentView.Line boots = viewService.getView(created.getId()).lineItems().get(0);
        assertEquals(0, new BigDecimal("100").compareTo(boots.rate()));
        assertTrue(after.getBalanceDue().signum() >= 0);
    }

    @Test
    void manualReturns_ShouldNotExceedBilledAmount() {
        Document created = invoice(line("Boots", 1, "100", "0", "0"));

        assertThrows(InvalidAmountException.class, () -> returnsService.createReturn(
                new CreateReturnCommand(created.getId(), null, 1, new BigDecimal("100.01"), null, null)));
        assertThrows(InvalidAmountException.class, () -> returnsService.createReturn(
                new CreateReturnCommand(created.getId(), null, 1, BigDecimal.ZERO, null, null)));

        returnsService.createReturn(new CreateReturnCommand(created.getId(), null, 1, new BigDecimal("100"),
                "Damaged", null));
        Document after = reload(created);
        assertEquals(new BigDecimal("0.00"), after.getFinalAmount());
        assertTrue(after.isPaid());
    }

    @Test
    void view_ShouldShowNotAvailable_ForRemovedRelations() {
        Document created = invoice(line("Boots", 2, "100", "0", "0"), line("Socks", 1, "20", "0", "0"));
        Long socksId = viewService.getView(created.getId()).lineItems().get(1).id();
        returnsService.createReturn(new CreateReturnCommand(created.getId(), socksId, 1, null, null, null));

        documentService.softDeleteLineItem(socksId);
        partyService.softDeleteParty(party.getId());

        DocumentView view = viewService.getView(created.getId());
        assertEquals(DocumentView.NOT_AVAILABLE, view.partyName());
        assertEquals(DocumentView.NOT_AVAILABLE, view.returns().get(0).itemDescription());
        // The return recorded against the deleted item keeps its stored amount
        assertEquals(new BigDecimal("20.00"), view.totals().returnAmount());
        assertEquals(new BigDecimal("180.00"), view.totals().finalAmount());
    }

    @Test
    void challans_ShouldNotAffectPartyBalance() {
        Document challan = documentService.createDocument(new CreateDocumentCommand(DocumentType.CHALLAN,
                party.getId(), null, List.of(line("Cartons", 4, "250", "0", "0")), null, "Truck MH12"));

        assertTrue(challan.getNumber().startsWith("CHN-"));
        assertEquals(new BigDecimal("1000.00"), reload(challan).getFinalAmount());
        assertEquals(new BigDecimal("0.00"), partyBalance());
        assertThrows(IllegalArgumentException.class, () -> pay(challan, "100"));
    }

    @Test
    void generalPaymentsAndDeletedInvoices_ShouldDriveRunningBalance() {
        Document first = invoice(line("Boots", 1, "500", "0", "0"));
        invoice(line("Boots", 1, "300", "0", "0"));
        assertEquals(new BigDecimal("800.00"), partyBalance());

        Payment onAccount = pay(null, "200");
        assertNull(onAccount.getDocument());
        assertEquals(new BigDecimal("600.00"), partyBalance());

        documentService.softDeleteDocument(first.getId());
        assertEquals(new BigDecimal("100.00"), partyBalance());

        PartyStatement statement = partyService.getStatement(party.getId());
        assertEquals(1, statement.unpaidInvoices());
        assertEquals(0, statement.paidInvoices());
        assertEquals(new BigDecimal("200.00"), statement.generalPayments());

        paymentService.softDeletePayment(onAccount.getId());
        assertEquals(new BigDecimal("300.00"), partyBalance());
        assertFalse(auditLogRepository.findByActionOrderByLoggedAtDesc(AuditService.PAYMENT_DELETED).isEmpty());
    }

    @Test
    void paymentsAgainstAnotherPartysInvoice_ShouldBeRejected() {
        Document created = invoice(line("Boots", 1, "100", "0", "0"));
        Party other = partyService.createParty(new CreatePartyCommand("Other " + UUID.randomUUID(), null, null,
                null, null));

        assertThrows(IllegalArgumentException.class, () -> paymentService.recordPayment(new RecordPaymentCommand(
                other.getId(), created.getId(), new BigDecimal("10"), null, null, null)));
        assertThrows(InvalidAmountException.class, () -> pay(created, "0"));
        assertEquals(new BigDecimal("100.00"), reload(created).getBalanceDue());
    }

    @Test
    void duplicatePartyName_ShouldBeRejected() {
        assertThrows(IllegalStateException.class, () -> partyService.createParty(
                new CreatePartyCommand(party.getName(), null, null, null, null)));
    }
}
