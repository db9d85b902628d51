package com.shoptalk.catalog.service;

import com.shoptalk.catalog.model.Product;

import java.util.List;

/**
 * Result of a product search. Callers switch on the concrete type instead of
 * inspecting sentinel values.
 */
public sealed interface SearchOutcome
        permits SearchOutcome.Found, SearchOutcome.NoAttributeMatch, SearchOutcome.CatalogNotReady {

    /**
     * Matching products, empty for anything other than {@link Found}.
     */
    default List<Product> products() {
        return List.of();
    }

    /**
     * Short tag for logs and response metadata.
     */
    String tag();

    record Found(List<Product> products) implements SearchOutcome {
        public Found {
            products = List.copyOf(products);
        }

        @Override
        public String tag() {
            return "found";
        }
    }

    /**
     * Products matched everything except an attribute such as color or material.
     */
    record NoAttributeMatch(String attribute, String requestedValue, List<String> availableValues)
            implements SearchOutcome {
        public NoAttributeMatch {
            availableValues = List.copyOf(availableValues);
        }

        @Override
        public String tag() {
            return "no_attribute_match";
        }
    }

    /**
     * The catalog has not been built yet, or holds no products.
     */
    record CatalogNotReady() implements SearchOutcome {
        @Override
        public String tag() {
            return "catalog_not_ready";
        }
    }
}
