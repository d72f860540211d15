package com.retail.billkeeper.repository;

import com.retail.billkeeper.model.SalesReturn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface SalesReturnRepository extends JpaRepository<SalesReturn, Long> {

    @Query("SELECT MAX(r.sequence) FROM SalesReturn r WHERE r.seriesPrefix = :prefix")
    Long findMaxSequence(@Param("prefix") String prefix);

    List<SalesReturn> findByDocumentIdAndActiveTrueOrderByIdAsc(Long documentId);

    @Query("SELECT COALESCE(SUM(r.quantity), 0) FROM SalesReturn r WHERE r.lineItem.id = :lineItemId AND r.active = true")
    Long sumActiveReturnedQuantity(@Param("lineItemId") Long lineItemId);

    @Query("SELECT r.document.id FROM SalesReturn r WHERE r.id = :id")
    Optional<Long> findDocumentIdById(@Param("id") Long id);
}
