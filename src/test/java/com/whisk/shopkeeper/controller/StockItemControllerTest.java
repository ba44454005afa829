package com.whisk.shopkeeper.controller;

import com.whisk.shopkeeper.model.StockItem;
import com.whisk.shopkeeper.repository.StockItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class StockItemControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private StockItemRepository stockItemRepository;

    private StockItem flour;

    @BeforeEach
    void setUp() {
        StockItem item = new StockItem();
        item.setName("Test Flour");
        item.setCategory(StockItem.CATEGORY_INGREDIENT);
        item.setUnit("kg");
        item.setQuantity(new BigDecimal("50"));
        item.setCostPerUnit(new BigDecimal("40"));
        item.setLowStockThreshold(BigDecimal.TEN);
        flour = stockItemRepository.save(item);
    }

    @Test
    @WithMockUser
    void recordPurchase_ShouldReturnAveragedItem() throws Exception {
        mockMvc.perform(post("/api/stock_items/" + flour.getId() + "/purchases")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"quantity_added\":50,\"cost_per_unit_of_purchase\":60}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(flour.getId()))
                .andExpect(jsonPath("$.quantity").value(100.0))
                .andExpect(jsonPath("$.costPerUnit").value(50.0));

        StockItem stored = stockItemRepository.findById(flour.getId()).orElseThrow();
        assertEquals(0, new BigDecimal("100").compareTo(stored.getQuantity()));
        assertEquals(0, new BigDecimal("50").compareTo(stored.getCostPerUnit()));
    }

    @Test
    @WithMockUser
    void recordPurchase_ShouldAcceptZeroQuantityAsNoOp() throws Exception {
        mockMvc.perform(post("/api/stock_items/" + flour.getId() + "/purchases")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"quantity_added\":0,\"cost_per_unit_of_purchase\":999}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quantity").value(50.0))
                .andExpect(jsonPath("$.costPerUnit").value(40.0));
    }

    @Test
    @WithMockUser
    void recordPurchase_ShouldReturnNotFound_ForUnknownItem() throws Exception {
        mockMvc.perform(post("/api/stock_items/987654/purchases")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"quantity_added\":5,\"cost_per_unit_of_purchase\":10}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Stock item not found"))
                .andExpect(jsonPath("$.details").doesNotExist());
    }

    @Test
    @WithMockUser
    void recordPurchase_ShouldRejectMissingCost() throws Exception {
        mockMvc.perform(post("/api/stock_items/" + flour.getId() + "/purchases")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"quantity_added\":5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.details", hasKey("costPerUnitOfPurchase")));
    }

    @Test
    void recordPurchase_ShouldNotRunWithoutPrincipal() throws Exception {
        mockMvc.perform(post("/api/stock_items/" + flour.getId() + "/purchases")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"quantity_added\":50,\"cost_per_unit_of_purchase\":60}"))
                .andExpect(status().isUnauthorized());

        StockItem stored = stockItemRepository.findById(flour.getId()).orElseThrow();
        assertEquals(0, new BigDecimal("50").compareTo(stored.getQuantity()));
    }

    @Test
    @WithMockUser
    void createAndUpdate_ShouldKeepSellingPriceWhenOmitted() throws Exception {
        String created = mockMvc.perform(post("/api/stock_items")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Eclair\",\"category\":\"Finished Product\",\"quantity\":12,\"unit\":\"pcs\","
                        + "\"costPerUnit\":20,\"lowStockThreshold\":4,\"sellingPrice\":60}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sellingPrice").value(60))
                .andReturn().getResponse().getContentAsString();
        String id = created.replaceAll(".*\"id\":(\\d+).*", "$1");

        mockMvc.perform(put("/api/stock_items/" + id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Eclair\",\"category\":\"Finished Product\",\"quantity\":10,\"unit\":\"pcs\","
                        + "\"costPerUnit\":20,\"lowStockThreshold\":4}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quantity").value(10))
                .andExpect(jsonPath("$.sellingPrice").value(60));
    }

    @Test
    @WithMockUser
    void create_ShouldRejectNegativeQuantity() throws Exception {
        mockMvc.perform(post("/api/stock_items")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Salt\",\"category\":\"Ingredient\",\"quantity\":-1,\"unit\":\"kg\","
                        + "\"costPerUnit\":20,\"lowStockThreshold\":4}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details", hasKey("quantity")));
    }

    @Test
    @WithMockUser
    void list_ShouldFilterBySearchAndCategory() throws Exception {
        mockMvc.perform(get("/api/stock_items")
                .param("search", "test fl")
                .param("category", StockItem.CATEGORY_INGREDIENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.results[0].name").value("Test Flour"));
    }

    @Test
    @WithMockUser
    void list_ShouldSkipExactRowCount() throws Exception {
        // Six seeded items come before the one added in setUp
        mockMvc.perform(get("/api/stock_items").param("skip", "5").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results", hasSize(2)))
                .andExpect(jsonPath("$.results[0].name").value("Cake Box (1kg)"))
                .andExpect(jsonPath("$.results[1].name").value("Test Flour"));
    }

    @Test
    @WithMockUser
    void delete_ShouldRemoveItemAndThenReportNotFound() throws Exception {
        mockMvc.perform(delete("/api/stock_items/" + flour.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.detail").value("Stock item deleted"));

        mockMvc.perform(delete("/api/stock_items/" + flour.getId()))
                .andExpect(status().isNotFound());
    }
}
