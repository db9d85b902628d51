package com.shoptalk.assistant.lookup;

import com.shoptalk.catalog.model.Product;

/**
 * Stock status of one product as the catalog has it now.
 *
 * @param product the current catalog record, or the shown copy when the product is no longer listed
 * @param listed whether the current catalog still has the product
 * @param inStock whether it can be ordered
 * @param quantityAvailable units on hand; zero for unmanaged inventory
 * @param lowStock in stock with few units left
 * @param estimatedDelivery delivery estimate, null when it cannot be ordered
 */
public record ProductAvailability(
        Product product,
        boolean listed,
        boolean inStock,
        int quantityAvailable,
        boolean lowStock,
        String estimatedDelivery) {
}
