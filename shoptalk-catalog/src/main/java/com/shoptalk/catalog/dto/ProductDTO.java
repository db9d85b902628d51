package com.shoptalk.catalog.dto;

import com.shoptalk.catalog.model.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductDTO {

    private String id;
    private String sku;
    private String name;
    private String description;
    private BigDecimal price;
    private String category;
    private String subcategory;
    private List<String> tags;
    private Integer stockQuantity;
    private Boolean inStock;

    public static ProductDTO fromEntity(Product product) {
        return ProductDTO.builder()
                .id(product.getId())
                .sku(product.getSku())
                .name(product.getTitle())
                .description(product.getDescription())
                .price(product.getPrice())
                .category(product.getCategory())
                .subcategory(product.getSubcategory())
                .tags(List.copyOf(product.getTags()))
                .stockQuantity(product.getInventoryQuantity())
                .inStock(product.isInStock())
                .build();
    }
}
