package com.retail.billkeeper.service;

import com.retail.billkeeper.dto.LedgerChange;
import com.retail.billkeeper.dto.LineAmounts;
import com.retail.billkeeper.exception.AggregationFailureException;
import com.retail.billkeeper.exception.ResourceNotFoundException;
import com.retail.billkeeper.model.*;
import com.retail.billkeeper.repository.*;
import com.retail.billkeeper.util.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Owns every derived monetary figure: line totals, document totals, balance
 * due and the party running balance.
 * <p>
 * Totals are always rebuilt from the active child records, never adjusted
 * incrementally, so a recomputation can run any number of times with the same
 * result. The recompute methods join the caller's transaction and refuse to
 * run without one: totals are written in the same unit of work as the change
 * that made them stale.
 */
@Service
public class LedgerAggregator {

    private static final Logger logger = LoggerFactory.getLogger(LedgerAggregator.class);

    private final DocumentRepository documentRepository;
    private final LineItemRepository lineItemRepository;
    private final PaymentRepository paymentRepository;
    private final SalesReturnRepository returnRepository;
    private final PartyRepository partyRepository;

    public LedgerAggregator(DocumentRepository documentRepository, LineItemRepository lineItemRepository,
            PaymentRepository paymentRepository, SalesReturnRepository returnRepository,
            PartyRepository partyRepository) {
        this.documentRepository = documentRepository;
        this.lineItemRepository = lineItemRepository;
        this.paymentRepository = paymentRepository;
        this.returnRepository = returnRepository;
        this.partyRepository = partyRepository;
    }

    /**
     * {@code base = quantity * rate}, {@code tax = base * tax% / 100},
     * {@code discount = base * discount% / 100}, {@code total = base + tax - discount}.
     * <p>
     * The total is computed from the unrounded parts and rounded once, half-up to
     * two decimals: 3 x 10.005 gives 30.02. The parts are rounded separately for
     * display only.
     */
    public LineAmounts computeLineTotal(int quantity, BigDecimal rate, BigDecimal taxPercent,
            BigDecimal discountPercent) {
        BigDecimal base = BigDecimal.valueOf(quantity).multiply(Money.orZero(rate));
        BigDecimal tax = Money.percentOf(base, taxPercent);
        BigDecimal discount = Money.percentOf(base, discountPercent);
        BigDecimal total = base.add(tax).subtract(discount);
        return new LineAmounts(Money.round(base), Money.round(tax), Money.round(discount), Money.round(total));
    }

    public LineAmounts computeLineTotal(LineItem item) {
        int quantity = item.getQuantity() != null ? item.getQuantity() : 0;
        return computeLineTotal(quantity, item.getRate(), item.getTaxPercent(), item.getDiscountPercent());
    }

    /**
     * Writes the derived amounts onto the item.
     */
    public LineItem applyLineTotal(LineItem item) {
        LineAmounts amounts = computeLineTotal(item);
        item.setBaseAmount(amounts.base());
        item.setTaxAmount(amounts.tax());
        item.setDiscountAmount(amounts.discount());
        item.setLineTotal(amounts.total());
        return item;
    }

    /**
     * Refund value of one unit of a line item.
     * <p>
     * Normally {@code lineTotal / quantity}. When either is zero (a fully
     * discounted item, or degenerate data) the value is rebuilt from
     * {@code rate + tax% - discount%} instead of dividing.
     */
    public BigDecimal perUnitReturnValue(LineItem item) {
        BigDecimal lineTotal = Money.orZero(item.getLineTotal());
        int quantity = item.getQuantity() != null ? item.getQuantity() : 0;
        if (lineTotal.signum() > 0 && quantity > 0) {
            return lineTotal.divide(BigDecimal.valueOf(quantity), Money.SCALE, RoundingMode.HALF_UP);
        }
        BigDecimal rate = Money.orZero(item.getRate());
        BigDecimal perUnit = rate
                .add(Money.percentOf(rate, item.getTaxPercent()))
                .subtract(Money.percentOf(rate, item.getDiscountPercent()));
        logger.debug("Line item {} has total {} and quantity {}; per-unit return value rebuilt from rate: {}",
                item.getId(), lineTotal, quantity, perUnit);
        return Money.round(perUnit);
    }

    public BigDecimal returnAmountFor(LineItem item, int quantity) {
        return Money.round(perUnitReturnValue(item).multiply(BigDecimal.valueOf(quantity)));
    }

    /**
     * Rebuilds the stored totals of a document from its active line items,
     * returns and payments.
     *
     * @throws AggregationFailureException on any unexpected error; the caller's
     *                                     transaction is rolled back
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Document recomputeDocumentTotals(Long documentId, LedgerChange trigger) {
        try {
            Document document = documentRepository.findById(documentId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Document", documentId));
            return recompute(document, trigger);
        } catch (RuntimeException e) {
            logger.error("Failed to recompute totals of document {} after {}", documentId, trigger, e);
            throw new AggregationFailureException("document", documentId, trigger, e);
        }
    }

    /**
     * Recomputes the party's outstanding balance: balance due of its active
     * invoices minus its active general payments. Positive means the party owes
     * the business.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Party recomputePartyBalance(Long partyId, LedgerChange trigger) {
        try {
            // Lock first so that the sums below see every committed change of concurrent writers
            Party party = partyRepository.findByIdForUpdate(partyId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Party", partyId));

            BigDecimal invoicesDue = Money.orZero(documentRepository.sumActiveBalanceDue(partyId, DocumentType.INVOICE));
            BigDecimal generalPayments = Money.orZero(paymentRepository.sumActiveGeneralByParty(partyId));
            BigDecimal balance = Money.round(invoicesDue.subtract(generalPayments));

            party.setRunningBalance(balance);
            partyRepository.save(party);
            logger.debug("Party {} running balance {} (invoices due {}, general payments {}) after {}", partyId,
                    balance, invoicesDue, generalPayments, trigger);
            return party;
        } catch (RuntimeException e) {
            logger.error("Failed to recompute running balance of party {} after {}", partyId, trigger, e);
            throw new AggregationFailureException("party", partyId, trigger, e);
        }
    }

    /**
     * Document totals followed by the owning party's balance; the usual hook
     * after any child mutation.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Document recomputeDocumentAndParty(Long documentId, LedgerChange trigger) {
        Document document = recomputeDocumentTotals(documentId, trigger);
        recomputePartyBalance(document.getParty().getId(), trigger);
        return document;
    }

    private Document recompute(Document document, LedgerChange trigger) {
        Long documentId = document.getId();

        BigDecimal base = BigDecimal.ZERO;
        BigDecimal tax = BigDecimal.ZERO;
        BigDecimal discount = BigDecimal.ZERO;
        BigDecimal lineTotal = BigDecimal.ZERO;
        List<LineItem> items = lineItemRepository.findByDocumentIdAndActiveTrueOrderByIdAsc(documentId);
        for (LineItem item : items) {
            applyLineTotal(item);
            base = base.add(item.getBaseAmount());
            tax = tax.add(item.getTaxAmount());
            discount = discount.add(item.getDiscountAmount());
            lineTotal = lineTotal.add(item.getLineTotal());
        }

        BigDecimal returned = BigDecimal.ZERO;
        for (SalesReturn salesReturn : returnRepository.findByDocumentIdAndActiveTrueOrderByIdAsc(documentId)) {
            LineItem item = salesReturn.getLineItem();
            if (item != null && item.isActive()) {
                salesReturn.setAmount(returnAmountFor(item, salesReturn.getQuantity()));
            }
            returned = returned.add(Money.orZero(salesReturn.getAmount()));
        }

        BigDecimal finalAmount = Money.round(lineTotal.subtract(returned));
        BigDecimal paidAmount = Money.round(paymentRepository.sumActiveByDocument(documentId));
        BigDecimal balanceDue = Money.round(finalAmount.subtract(paidAmount));

        // Each line total is rounded once from unrounded parts, so the rounded parts can miss it by a cent
        BigDecimal roundOff = Money.round(lineTotal.subtract(base.add(tax).subtract(discount)));

        document.setBaseAmount(Money.round(base));
        document.setTaxAmount(Money.round(tax));
        document.setDiscountAmount(Money.round(discount));
        document.setRoundOff(roundOff);
        document.setReturnAmount(Money.round(returned));
        document.setFinalAmount(finalAmount);
        document.setPaidAmount(paidAmount);
        document.setBalanceDue(balanceDue);
        document.setPaid(balanceDue.signum() <= 0);
        Document saved = documentRepository.save(document);

        logger.info("Document {} totals: final {}, paid {}, balance due {} ({} active items) after {}",
                document.getNumber(), finalAmount, paidAmount, balanceDue, items.size(), trigger);
        return saved;
    }
}
