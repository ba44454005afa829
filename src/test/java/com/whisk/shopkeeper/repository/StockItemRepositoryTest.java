package com.whisk.shopkeeper.repository;

import com.whisk.shopkeeper.model.StockItem;
import com.whisk.shopkeeper.util.PageParams;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class StockItemRepositoryTest {

    @Autowired
    private StockItemRepository stockItemRepository;

    private StockItem saveItem(String name, String category, String quantity, String cost) {
        StockItem item = new StockItem();
        item.setName(name);
        item.setCategory(category);
        item.setUnit("kg");
        item.setQuantity(new BigDecimal(quantity));
        item.setCostPerUnit(new BigDecimal(cost));
        item.setLowStockThreshold(BigDecimal.ONE);
        return stockItemRepository.save(item);
    }

    @Test
    void updateQuantityAndCost_ShouldOverwriteOnlyThoseColumns() {
        StockItem flour = saveItem("Flour", StockItem.CATEGORY_INGREDIENT, "50", "40");

        int matched = stockItemRepository.updateQuantityAndCost(flour.getId(), new BigDecimal("100"),
                new BigDecimal("50"));

        assertEquals(1, matched);
        StockItem reloaded = stockItemRepository.findById(flour.getId()).orElseThrow();
        assertEquals(0, new BigDecimal("100").compareTo(reloaded.getQuantity()));
        assertEquals(0, new BigDecimal("50").compareTo(reloaded.getCostPerUnit()));
        assertEquals("Flour", reloaded.getName());
    }

    @Test
    void updateQuantityAndCost_ShouldMatchNothing_ForUnknownId() {
        assertEquals(0, stockItemRepository.updateQuantityAndCost(12345L, BigDecimal.ONE, BigDecimal.ONE));
    }

    @Test
    void search_ShouldMatchNameCaseInsensitivelyAndFilterCategory() {
        saveItem("Chocolate Cake (1kg)", StockItem.CATEGORY_FINISHED_PRODUCT, "10", "400");
        saveItem("Cake Box (1kg)", StockItem.CATEGORY_PACKAGING, "100", "15");
        saveItem("Sugar", StockItem.CATEGORY_INGREDIENT, "40", "55");

        Page<StockItem> cakes = stockItemRepository.findByNameContainingIgnoreCase("CAKE", PageRequest.of(0, 10));
        Page<StockItem> packaging = stockItemRepository.findByNameContainingIgnoreCaseAndCategory("cake",
                StockItem.CATEGORY_PACKAGING, PageRequest.of(0, 10));

        assertEquals(2, cakes.getTotalElements());
        assertEquals(1, packaging.getTotalElements());
        assertEquals("Cake Box (1kg)", packaging.getContent().get(0).getName());
    }

    @Test
    void findByName_ShouldSkipExactRowCount_WhenSkipIsNotAMultipleOfLimit() {
        for (int i = 0; i < 20; i++) {
            saveItem("Item" + i, StockItem.CATEGORY_INGREDIENT, "1", "1");
        }

        Page<StockItem> page = stockItemRepository.findByNameContainingIgnoreCase("item",
                PageParams.of(5, 10, Sort.by("id")));

        assertEquals(10, page.getContent().size());
        assertEquals("Item5", page.getContent().get(0).getName());
        assertEquals("Item14", page.getContent().get(9).getName());
        assertEquals(20, page.getTotalElements());
    }

    @Test
    void findByName_ShouldReturnTail_WhenSkipRunsPastLastFullPage() {
        for (int i = 0; i < 20; i++) {
            saveItem("Item" + i, StockItem.CATEGORY_INGREDIENT, "1", "1");
        }

        Page<StockItem> page = stockItemRepository.findByNameContainingIgnoreCase("item",
                PageParams.of(17, 10, Sort.by("id")));

        assertEquals(3, page.getContent().size());
        assertEquals("Item17", page.getContent().get(0).getName());
        assertEquals(20, page.getTotalElements());
    }
}
