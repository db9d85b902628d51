package com.shoptalk.catalog.index;

/**
 * Occurrence of a token in one product.
 *
 * @param productId product identifier
 * @param ordinal catalog insertion position, used for stable ordering
 * @param termFrequency raw occurrences across all indexed fields
 * @param weightedFrequency occurrences scaled by field weight
 */
public record Posting(String productId, int ordinal, int termFrequency, double weightedFrequency) {}
