package com.retail.billkeeper.repository;

import com.retail.billkeeper.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class DocumentRepositoryTest {

    @Autowired
    private DocumentRepository documentRepository;

    @Autowired
    private PartyRepository partyRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    private Party party;

    @BeforeEach
    void setUp() {
        party = new Party();
        party.setName("Gupta Traders");
        party = partyRepository.save(party);
    }

    private Document document(DocumentType type, String prefix, long sequence, String balanceDue) {
        Document d = new Document();
        d.setDocumentType(type);
        d.setSeriesPrefix(prefix);
        d.setSequence(sequence);
        d.setNumber(prefix + "-" + String.format("%06d", sequence));
        d.setDocumentDate(LocalDate.of(2026, 10, 1));
        d.setParty(party);
        d.setBalanceDue(new BigDecimal(balanceDue));
        return d;
    }

    @Test
    void findMaxSequence_ShouldIncludeSoftDeletedRows() {
        documentRepository.save(document(DocumentType.INVOICE, "INV", 1, "0"));
        Document deleted = document(DocumentType.INVOICE, "INV", 2, "0");
        deleted.softDelete();
        documentRepository.save(deleted);

        assertEquals(2L, documentRepository.findMaxSequence("INV"));
    }

    @Test
    void findMaxSequence_ShouldOrderByValueNotInsertion() {
        documentRepository.save(document(DocumentType.INVOICE, "INV", 10, "0"));
        documentRepository.save(document(DocumentType.INVOICE, "INV", 9, "0"));
        documentRepository.save(document(DocumentType.CHALLAN, "CHN", 99, "0"));

        assertEquals(10L, documentRepository.findMaxSequence("INV"));
        assertEquals(99L, documentRepository.findMaxSequence("CHN"));
        assertNull(documentRepository.findMaxSequence("INV-2026"));
    }

    @Test
    void saveAndFlush_ShouldRejectDuplicateSequenceInSeries() {
        documentRepository.saveAndFlush(document(DocumentType.INVOICE, "INV", 1, "0"));

        assertThrows(DataIntegrityViolationException.class,
                () -> documentRepository.saveAndFlush(document(DocumentType.INVOICE, "INV", 1, "0")));
    }

    @Test
    void findByIdForUpdate_ShouldReturnDocument() {
        Document saved = documentRepository.save(document(DocumentType.INVOICE, "INV", 3, "0"));

        Optional<Document> result = documentRepository.findByIdForUpdate(saved.getId());

        assertTrue(result.isPresent());
        assertEquals("INV-000003", result.get().getNumber());
    }

    @Test
    void sumActiveBalanceDue_ShouldSkipDeletedDocumentsAndChallans() {
        documentRepository.save(document(DocumentType.INVOICE, "INV", 1, "600.00"));
        documentRepository.save(document(DocumentType.INVOICE, "INV", 2, "150.50"));
        Document deleted = document(DocumentType.INVOICE, "INV", 3, "1000.00");
        deleted.softDelete();
        documentRepository.save(deleted);
        documentRepository.save(document(DocumentType.CHALLAN, "CHN", 1, "400.00"));

        BigDecimal due = documentRepository.sumActiveBalanceDue(party.getId(), DocumentType.INVOICE);

        assertEquals(0, new BigDecimal("750.50").compareTo(due));
    }

    @Test
    void sumActiveBalanceDue_ShouldBeZero_WhenPartyHasNoDocuments() {
        BigDecimal due = documentRepository.sumActiveBalanceDue(party.getId(), DocumentType.INVOICE);

        assertEquals(0, BigDecimal.ZERO.compareTo(due));
    }

    @Test
    void listQueries_ShouldHideSoftDeletedDocuments() {
        documentRepository.save(document(DocumentType.INVOICE, "INV", 1, "0"));
        Document deleted = document(DocumentType.INVOICE, "INV", 2, "0");
        deleted.softDelete();
        documentRepository.save(deleted);

        List<Document> active = documentRepository
                .findByDocumentTypeAndActiveTrueOrderByDocumentDateDescNumberDesc(DocumentType.INVOICE);

        assertEquals(1, active.size());
        assertEquals("INV-000001", active.get(0).getNumber());
    }

    @Test
    void sumActiveGeneralByParty_ShouldOnlyCountPaymentsWithoutDocument() {
        Document invoice = documentRepository.save(document(DocumentType.INVOICE, "INV", 1, "0"));
        paymentRepository.save(payment(1, null, "100.00"));
        paymentRepository.save(payment(2, invoice, "70.00"));
        Payment deleted = payment(3, null, "40.00");
        deleted.softDelete();
        paymentRepository.save(deleted);

        assertEquals(0, new BigDecimal("100.00").compareTo(paymentRepository.sumActiveGeneralByParty(party.getId())));
        assertEquals(0, new BigDecimal("70.00").compareTo(paymentRepository.sumActiveByDocument(invoice.getId())));
        assertEquals(3L, paymentRepository.findMaxSequence("PAY-202610"));
    }

    private Payment payment(long sequence, Document invoice, String amount) {
        Payment p = new Payment();
        p.setSeriesPrefix("PAY-202610");
        p.setSequence(sequence);
        p.setPaymentNumber("PAY-202610-" + String.format("%06d", sequence));
        p.setParty(party);
        p.setDocument(invoice);
        p.setAmount(new BigDecimal(amount));
        p.setPaymentDate(LocalDate.of(2026, 10, 2));
        return p;
    }
}
