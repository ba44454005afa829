package com.whisk.shopkeeper.controller;

import com.whisk.shopkeeper.dto.PageResponse;
import com.whisk.shopkeeper.dto.StockItemRequest;
import com.whisk.shopkeeper.dto.StockPurchaseRequest;
import com.whisk.shopkeeper.model.StockItem;
import com.whisk.shopkeeper.service.StockLedgerService;
import com.whisk.shopkeeper.util.PageParams;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/stock_items")
public class StockItemController {

    private static final int MAX_PAGE_SIZE = 1000;

    private final StockLedgerService stockLedgerService;

    public StockItemController(StockLedgerService stockLedgerService) {
        this.stockLedgerService = stockLedgerService;
    }

    // "status" is accepted for older clients and ignored
    @GetMapping
    public PageResponse<StockItem> list(@RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "") String search,
            @RequestParam(defaultValue = "") String category,
            @RequestParam(defaultValue = "") String status) {
        PageParams.check(skip, limit, MAX_PAGE_SIZE);
        return stockLedgerService.search(skip, limit, search, category);
    }

    @PostMapping
    public ResponseEntity<StockItem> create(@Valid @RequestBody StockItemRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(stockLedgerService.create(request));
    }

    @PutMapping("/{itemId}")
    public StockItem update(@PathVariable Long itemId, @Valid @RequestBody StockItemRequest request) {
        return stockLedgerService.update(itemId, request);
    }

    @DeleteMapping("/{itemId}")
    public Map<String, String> delete(@PathVariable Long itemId) {
        stockLedgerService.delete(itemId);
        return Map.of("detail", "Stock item deleted");
    }

    @PostMapping("/{itemId}/purchases")
    public StockItem recordPurchase(@PathVariable Long itemId, @Valid @RequestBody StockPurchaseRequest purchase) {
        return stockLedgerService.applyPurchase(itemId, purchase.getQuantityAdded(),
                purchase.getCostPerUnitOfPurchase());
    }
}
