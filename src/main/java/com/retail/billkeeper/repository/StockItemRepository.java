package com.retail.billkeeper.repository;

import com.retail.billkeeper.model.StockItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface StockItemRepository extends JpaRepository<StockItem, Long> {

    @Query("SELECT MAX(s.sequence) FROM StockItem s WHERE s.seriesPrefix = :prefix")
    Long findMaxSequence(@Param("prefix") String prefix);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StockItem s WHERE s.id = :id")
    Optional<StockItem> findByIdForUpdate(@Param("id") Long id);

    Optional<StockItem> findByCode(String code);

    List<StockItem> findByActiveTrueOrderByNameAsc();
}
