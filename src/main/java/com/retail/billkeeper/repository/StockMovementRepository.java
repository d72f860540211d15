package com.retail.billkeeper.repository;

import com.retail.billkeeper.model.StockMovement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface StockMovementRepository extends JpaRepository<StockMovement, Long> {

    List<StockMovement> findByStockItemIdOrderByMovedAtAscIdAsc(Long stockItemId);

    @Query("SELECT COALESCE(SUM(m.quantityChange), 0) FROM StockMovement m WHERE m.stockItem.id = :stockItemId")
    Long sumQuantityChange(@Param("stockItemId") Long stockItemId);
}
