package com.whisk.shopkeeper.repository;

import com.whisk.shopkeeper.model.StockItem;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

public interface StockItemRepository extends JpaRepository<StockItem, Long> {

    Page<StockItem> findByNameContainingIgnoreCase(String name, Pageable pageable);

    Page<StockItem> findByNameContainingIgnoreCaseAndCategory(String name, String category, Pageable pageable);

    /**
     * Overwrites quantity and cost of a single row without looking at the
     * values currently stored. Returns the number of matched rows.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE StockItem s SET s.quantity = :quantity, s.costPerUnit = :costPerUnit WHERE s.id = :id")
    int updateQuantityAndCost(@Param("id") Long id,
            @Param("quantity") BigDecimal quantity,
            @Param("costPerUnit") BigDecimal costPerUnit);
}
