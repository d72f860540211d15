package com.retail.billkeeper.repository;

import com.retail.billkeeper.model.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface PaymentRepository extends JpaRepository<Payment, Long> {

    @Query("SELECT MAX(p.sequence) FROM Payment p WHERE p.seriesPrefix = :prefix")
    Long findMaxSequence(@Param("prefix") String prefix);

    List<Payment> findByDocumentIdAndActiveTrueOrderByPaymentDateAscIdAsc(Long documentId);

    List<Payment> findByPartyIdAndDocumentIsNullAndActiveTrue(Long partyId);

    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payment p WHERE p.document.id = :documentId AND p.active = true")
    BigDecimal sumActiveByDocument(@Param("documentId") Long documentId);

    // General payments only; payments tied to a document are already netted into its balance due
    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payment p WHERE p.party.id = :partyId AND p.document IS NULL AND p.active = true")
    BigDecimal sumActiveGeneralByParty(@Param("partyId") Long partyId);

    // Empty for general payments; the inner join drops rows without a document
    @Query("SELECT p.document.id FROM Payment p WHERE p.id = :id")
    Optional<Long> findDocumentIdById(@Param("id") Long id);

    @Query("SELECT p.party.id FROM Payment p WHERE p.id = :id")
    Optional<Long> findPartyIdById(@Param("id") Long id);
}
