package com.whisk.shopkeeper.service;

import com.whisk.shopkeeper.dto.PageResponse;
import com.whisk.shopkeeper.dto.StockItemRequest;
import com.whisk.shopkeeper.exception.NotFoundException;
import com.whisk.shopkeeper.model.StockItem;
import com.whisk.shopkeeper.repository.StockItemRepository;
import com.whisk.shopkeeper.util.PageParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Owns stock item records and keeps their cost at the weighted average of
 * everything bought so far.
 * <p>
 * {@link #applyPurchase} is a plain read followed by an unconditional write.
 * Two purchases on the same item that overlap can both start from the same
 * quantity and cost, in which case the later write wins and the earlier
 * purchase is lost. Callers that need exact totals must serialize purchases
 * themselves.
 */
@Service
@Slf4j
public class StockLedgerService {

    static final int COST_SCALE = 6;
    static final int QUANTITY_SCALE = 4;

    private final StockItemRepository stockItemRepository;
    private final AuditService auditService;

    public StockLedgerService(StockItemRepository stockItemRepository, AuditService auditService) {
        this.stockItemRepository = stockItemRepository;
        this.auditService = auditService;
    }

    public StockItem applyPurchase(Long itemId, BigDecimal quantityAdded, BigDecimal purchaseCost) {
        StockItem item = stockItemRepository.findById(itemId)
                .orElseThrow(() -> new NotFoundException("Stock item not found"));

        BigDecimal oldQty = item.getQuantity() != null ? item.getQuantity() : BigDecimal.ZERO;
        BigDecimal oldCost = item.getCostPerUnit() != null ? item.getCostPerUnit() : BigDecimal.ZERO;

        BigDecimal totalQty;
        BigDecimal avgCost;
        if (quantityAdded.signum() > 0) {
            totalQty = oldQty.add(quantityAdded);
            if (totalQty.signum() > 0) {
                BigDecimal totalValue = oldQty.multiply(oldCost).add(quantityAdded.multiply(purchaseCost));
                avgCost = totalValue.divide(totalQty, MathContext.DECIMAL64);
            } else {
                avgCost = purchaseCost;
            }
        } else {
            // Nothing delivered: keep the ledger as it is
            totalQty = oldQty;
            avgCost = oldCost;
        }

        totalQty = totalQty.setScale(QUANTITY_SCALE, RoundingMode.HALF_UP);
        avgCost = avgCost.setScale(COST_SCALE, RoundingMode.HALF_UP);

        int matched = stockItemRepository.updateQuantityAndCost(itemId, totalQty, avgCost);
        if (matched == 0) {
            // Deleted between the read and the write
            throw new NotFoundException("Stock item not found");
        }
        log.info("Purchase recorded: item={}, added={}, cost={}, quantity {} -> {}, costPerUnit {} -> {}",
                itemId, quantityAdded, purchaseCost, oldQty, totalQty, oldCost, avgCost);
        auditService.log("RECORD_PURCHASE",
                "Item: " + itemId + ", Added: " + quantityAdded + " @ " + purchaseCost
                        + ", New Qty: " + totalQty + ", New Cost: " + avgCost);

        return stockItemRepository.findById(itemId)
                .orElseThrow(() -> new NotFoundException("Stock item not found"));
    }

    public StockItem create(StockItemRequest request) {
        StockItem item = new StockItem();
        copy(request, item);
        StockItem saved = stockItemRepository.save(item);
        log.info("Stock item created: id={}, name={}", saved.getId(), saved.getName());
        return saved;
    }

    public StockItem update(Long itemId, StockItemRequest request) {
        StockItem item = stockItemRepository.findById(itemId)
                .orElseThrow(() -> new NotFoundException("Stock item not found"));
        copy(request, item);
        return stockItemRepository.save(item);
    }

    public void delete(Long itemId) {
        if (!stockItemRepository.existsById(itemId)) {
            throw new NotFoundException("Stock item not found");
        }
        stockItemRepository.deleteById(itemId);
        auditService.log("DELETE_STOCK_ITEM", "Item: " + itemId);
    }

    public PageResponse<StockItem> search(int skip, int limit, String search, String category) {
        Pageable pageable = PageParams.of(skip, limit, Sort.by("id"));
        String name = search != null ? search.trim() : "";
        Page<StockItem> page = category == null || category.isBlank()
                ? stockItemRepository.findByNameContainingIgnoreCase(name, pageable)
                : stockItemRepository.findByNameContainingIgnoreCaseAndCategory(name, category, pageable);
        return PageResponse.from(page);
    }

    private void copy(StockItemRequest request, StockItem item) {
        item.setName(request.getName());
        item.setCategory(request.getCategory());
        item.setQuantity(request.getQuantity());
        item.setUnit(request.getUnit());
        item.setCostPerUnit(request.getCostPerUnit());
        item.setLowStockThreshold(request.getLowStockThreshold());
        // Left alone when the client does not send it
        if (request.getSellingPrice() != null) {
            item.setSellingPrice(request.getSellingPrice());
        }
    }
}
