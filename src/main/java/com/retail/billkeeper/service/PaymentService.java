package com.retail.billkeeper.service;

import com.retail.billkeeper.dto.AssignedNumber;
import com.retail.billkeeper.dto.LedgerChange;
import com.retail.billkeeper.dto.LedgerChange.Action;
import com.retail.billkeeper.dto.RecordPaymentCommand;
import com.retail.billkeeper.dto.UpdatePaymentCommand;
import com.retail.billkeeper.exception.InvalidAmountException;
import com.retail.billkeeper.exception.ResourceNotFoundException;
import com.retail.billkeeper.model.*;
import com.retail.billkeeper.repository.DocumentRepository;
import com.retail.billkeeper.repository.PartyRepository;
import com.retail.billkeeper.repository.PaymentRepository;
import com.retail.billkeeper.repository.SequenceSource;
import com.retail.billkeeper.util.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

@Service
public class PaymentService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentService.class);

    private final PaymentRepository paymentRepository;
    private final DocumentRepository documentRepository;
    private final PartyRepository partyRepository;
    private final DocumentNumberGenerator numberGenerator;
    private final SeriesPrefixResolver prefixResolver;
    private final LedgerAggregator ledgerAggregator;
    private final AuditService auditService;
    private final SequenceSource paymentSequence;

    public PaymentService(PaymentRepository paymentRepository, DocumentRepository documentRepository,
            PartyRepository partyRepository, DocumentNumberGenerator numberGenerator,
            SeriesPrefixResolver prefixResolver, LedgerAggregator ledgerAggregator, AuditService auditService) {
        this.paymentRepository = paymentRepository;
        this.documentRepository = documentRepository;
        this.partyRepository = partyRepository;
        this.numberGenerator = numberGenerator;
        this.prefixResolver = prefixResolver;
        this.ledgerAggregator = ledgerAggregator;
        this.auditService = auditService;
        this.paymentSequence = SequenceSource.of(paymentRepository::findMaxSequence, Payment.TABLE,
                Payment.NUMBER_CONSTRAINT, Payment.SERIES_CONSTRAINT);
    }

    /**
     * Records a payment under the next {@code PAY-yyyyMM} number and refreshes
     * the affected totals in the same transaction.
     */
    public Payment recordPayment(RecordPaymentCommand command) {
        requirePositive(command.amount());
        LocalDate date = command.date() != null ? command.date() : LocalDate.now();

        Payment payment = numberGenerator.generate(paymentSequence, prefixResolver.paymentPrefix(date),
                assigned -> persistNewPayment(command, date, assigned));
        logger.info("Recorded payment {} of {} from party {}{}", payment.getPaymentNumber(), payment.getAmount(),
                command.partyId(), command.documentId() != null ? " against document " + command.documentId() : "");
        return payment;
    }

    private Payment persistNewPayment(RecordPaymentCommand command, LocalDate date, AssignedNumber assigned) {
        Document document = null;
        if (command.documentId() != null) {
            document = lockPayableDocument(command.documentId());
            if (!document.getParty().getId().equals(command.partyId())) {
                throw new IllegalArgumentException("Document " + document.getNumber()
                        + " does not belong to party " + command.partyId());
            }
        }
        Party party = partyRepository.findById(command.partyId())
                .filter(Party::isActive)
                .orElseThrow(() -> ResourceNotFoundException.of("Party", command.partyId()));

        Payment payment = new Payment();
        payment.setPaymentNumber(assigned.number());
        payment.setSeriesPrefix(assigned.prefix());
        payment.setSequence(assigned.sequence());
        payment.setParty(party);
        payment.setDocument(document);
        payment.setAmount(Money.round(command.amount()));
        payment.setPaymentDate(date);
        payment.setMode(command.mode() != null ? command.mode() : PaymentMode.CASH);
        payment.setNotes(command.notes());
        payment = paymentRepository.saveAndFlush(payment);

        recompute(payment, Action.CREATED);
        return payment;
    }

    @Transactional
    public Payment updatePayment(Long paymentId, UpdatePaymentCommand command) {
        requirePositive(command.amount());
        Payment payment = lockAndLoad(paymentId);
        if (payment.getDocument() != null) {
            lockPayableDocument(payment.getDocument().getId());
        }
        if (!payment.isActive()) {
            throw new IllegalStateException("Payment " + payment.getPaymentNumber() + " has been deleted");
        }

        payment.setAmount(Money.round(command.amount()));
        if (command.date() != null) {
            payment.setPaymentDate(command.date());
        }
        if (command.mode() != null) {
            payment.setMode(command.mode());
        }
        payment.setNotes(command.notes());
        paymentRepository.save(payment);

        recompute(payment, Action.UPDATED);
        return payment;
    }

    /**
     * Soft-deletes a payment and puts its amount back on the document and the
     * party balance. Deleting twice is a no-op.
     */
    @Transactional
    public void softDeletePayment(Long paymentId) {
        Payment payment = lockAndLoad(paymentId);
        if (!payment.softDelete()) {
            return;
        }
        paymentRepository.save(payment);
        auditService.log(AuditService.PAYMENT_DELETED, "Payment " + payment.getPaymentNumber() + " of "
                + payment.getAmount() + " (id " + paymentId + ")");

        recompute(payment, Action.SOFT_DELETED);
    }

    /**
     * Locks whatever owns the payment's totals, the document or for a general
     * payment the party, and only then reads the payment itself.
     */
    private Payment lockAndLoad(Long paymentId) {
        Optional<Long> documentId = paymentRepository.findDocumentIdById(paymentId);
        if (documentId.isPresent()) {
            documentRepository.findByIdForUpdate(documentId.get());
        } else {
            Long partyId = paymentRepository.findPartyIdById(paymentId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Payment", paymentId));
            partyRepository.findByIdForUpdate(partyId);
        }
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Payment", paymentId));
    }

    private void recompute(Payment payment, Action action) {
        LedgerChange change = LedgerChange.of("payment", payment.getId(), action);
        if (payment.getDocument() != null) {
            ledgerAggregator.recomputeDocumentAndParty(payment.getDocument().getId(), change);
        } else {
            ledgerAggregator.recomputePartyBalance(payment.getParty().getId(), change);
        }
    }

    private Document lockPayableDocument(Long documentId) {
        Document document = documentRepository.findByIdForUpdate(documentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Document", documentId));
        if (!document.isActive()) {
            throw new IllegalStateException("Document " + document.getNumber() + " has been deleted");
        }
        if (!document.getDocumentType().isBillable()) {
            throw new IllegalArgumentException("Payments cannot be recorded against challan " + document.getNumber());
        }
        return document;
    }

    private void requirePositive(BigDecimal amount) {
        if (amount == null) {
            throw new InvalidAmountException("Payment amount is required");
        }
        if (!Money.isPositive(Money.round(amount))) {
            throw new InvalidAmountException("Payment amount must be greater than zero");
        }
    }
}
