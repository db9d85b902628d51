package com.shoptalk.assistant.lookup;

import com.shoptalk.assistant.config.AssistantProperties;
import com.shoptalk.catalog.model.Product;
import com.shoptalk.catalog.service.ProductSearcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Answers "is it in stock" for products the shopper points at. Stock is read from the
 * current catalog snapshot, not from the copy shown earlier in the conversation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityChecker {

    private final ProductSearcher productSearcher;
    private final AssistantProperties assistantProperties;

    public List<ProductAvailability> check(List<Product> products) {
        return products.stream().map(this::check).toList();
    }

    public ProductAvailability check(Product shown) {
        Optional<Product> current = productSearcher.findById(shown.getId());
        if (current.isEmpty()) {
            log.info("Availability requested for unlisted product: productId={}", shown.getId());
            return new ProductAvailability(shown, false, false, 0, false, null);
        }
        Product product = current.get();
        AssistantProperties.Availability settings = assistantProperties.getAvailability();
        int quantity = Math.max(product.getInventoryQuantity(), 0);
        boolean inStock = product.isInStock();
        boolean lowStock = inStock && quantity > 0 && quantity <= settings.getLowStockThreshold();
        return new ProductAvailability(product, true, inStock, quantity, lowStock,
                inStock ? settings.getDeliveryEstimate() : null);
    }
}
