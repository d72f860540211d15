package com.retail.billkeeper.repository;

import com.retail.billkeeper.model.LineItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface LineItemRepository extends JpaRepository<LineItem, Long> {
    List<LineItem> findByDocumentIdAndActiveTrueOrderByIdAsc(Long documentId);

    long countByDocumentIdAndActiveTrue(Long documentId);

    // Scalar lookup so the document can be locked before the item enters the persistence context
    @Query("SELECT li.document.id FROM LineItem li WHERE li.id = :id")
    Optional<Long> findDocumentIdById(@Param("id") Long id);
}
