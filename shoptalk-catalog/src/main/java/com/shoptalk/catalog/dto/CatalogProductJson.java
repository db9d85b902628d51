package com.shoptalk.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shoptalk.catalog.model.Product;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * DTO for parsing the catalog export consumed by the file provider.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogProductJson {

    @JsonProperty("id")
    private String id;

    @JsonProperty("sku")
    private String sku;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("category")
    private String category;

    @JsonProperty("subcategory")
    private String subcategory;

    @JsonProperty("tags")
    private List<String> tags;

    @JsonProperty("price")
    private BigDecimal price;

    @JsonProperty("inventory_quantity")
    private Integer inventoryQuantity;

    @JsonProperty("available")
    private Boolean available;

    /**
     * Check if this record can be imported into the index.
     */
    public boolean isValid() {
        return productId() != null
                && title != null && !title.isBlank()
                && price != null && price.compareTo(BigDecimal.ZERO) >= 0;
    }

    /**
     * The record's id, or its SKU for exports that carry only SKUs. Null when it has neither.
     */
    public String productId() {
        if (id != null && !id.isBlank()) {
            return id.trim();
        }
        return sku != null && !sku.isBlank() ? sku.trim() : null;
    }

    public Product toProduct() {
        int quantity = inventoryQuantity != null ? Math.max(0, inventoryQuantity) : 0;
        // Missing availability falls back to the stock count
        boolean isAvailable = available != null ? available : quantity > 0;
        return Product.builder()
                .id(productId())
                .sku(sku)
                .title(title.trim())
                .description(description)
                .category(category)
                .subcategory(subcategory)
                .tags(tags)
                .price(price)
                .inventoryQuantity(quantity)
                .available(isAvailable)
                .build();
    }
}
