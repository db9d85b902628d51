package com.shoptalk.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A catalog product as held by the index.
 * Instances are immutable and replaced wholesale on every catalog sync.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@ToString(of = {"id", "title", "price"})
@EqualsAndHashCode(of = "id")
public class Product {

    private static final String COLOR_TAG_PREFIX = "color_";

    private final String id;
    private final String sku;
    private final String title;
    private final String description;
    private final String category;
    private final String subcategory;

    @Singular(ignoreNullCollections = true)
    private final Set<String> tags;

    private final BigDecimal price;
    private final int inventoryQuantity;
    private final boolean available;

    /**
     * Stock status used by search and bundle planning.
     * The {@code available} flag is authoritative; unmanaged inventory reports a zero quantity.
     */
    public boolean isInStock() {
        return available;
    }

    /**
     * Colors declared through {@code Color_<Name>} tags, lowercased.
     */
    public List<String> colorTags() {
        List<String> colors = new ArrayList<>();
        for (String tag : tags) {
            String lower = tag.toLowerCase(Locale.ROOT);
            if (lower.startsWith(COLOR_TAG_PREFIX) && lower.length() > COLOR_TAG_PREFIX.length()) {
                colors.add(lower.substring(COLOR_TAG_PREFIX.length()).replace('_', ' '));
            }
        }
        return colors;
    }

    public BigDecimal priceOrZero() {
        return price != null ? price : BigDecimal.ZERO;
    }
}
