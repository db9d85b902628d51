package com.shoptalk.catalog.provider;

import com.shoptalk.catalog.model.Product;

import java.util.List;

/**
 * Source of the full product catalog.
 * Implementations throw {@link com.shoptalk.catalog.exception.CatalogException} when the
 * source cannot be reached or read; that failure is fatal for the sync that triggered it.
 */
public interface CatalogDataProvider {

    List<Product> fetchAll();

    /**
     * Human-readable location, for logs.
     */
    String describe();
}
