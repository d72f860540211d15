package com.retail.billkeeper.repository;

import com.retail.billkeeper.model.Document;
import com.retail.billkeeper.model.DocumentType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface DocumentRepository extends JpaRepository<Document, Long> {

    // Ordered by sequence value, not by id: ids follow insertion order, which
    // diverges from numeric order once attempts start retrying.
    @Query("SELECT MAX(d.sequence) FROM Document d WHERE d.seriesPrefix = :prefix")
    Long findMaxSequence(@Param("prefix") String prefix);

    Optional<Document> findByNumber(String number);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Document d WHERE d.id = :id")
    Optional<Document> findByIdForUpdate(@Param("id") Long id);

    List<Document> findByDocumentTypeAndActiveTrueOrderByDocumentDateDescNumberDesc(DocumentType documentType);

    List<Document> findByPartyIdAndActiveTrueOrderByDocumentDateAsc(Long partyId);

    @Query("SELECT COALESCE(SUM(d.balanceDue), 0) FROM Document d WHERE d.party.id = :partyId AND d.active = true AND d.documentType = :type")
    BigDecimal sumActiveBalanceDue(@Param("partyId") Long partyId, @Param("type") DocumentType type);

    long countByPartyIdAndDocumentTypeAndActiveTrueAndPaid(Long partyId, DocumentType documentType, boolean paid);
}
