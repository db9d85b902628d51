package com.shoptalk.catalog.index;

import com.shoptalk.catalog.model.Product;

import java.util.function.Function;

/**
 * Product fields that feed the inverted index, with their ranking weights.
 */
public enum IndexField {
    TITLE(3.0, Product::getTitle),
    CATEGORY(2.5, Product::getCategory),
    SUBCATEGORY(2.0, Product::getSubcategory),
    TAGS(1.5, product -> String.join(" ", product.getTags())),
    DESCRIPTION(1.0, Product::getDescription);

    private final double weight;
    private final Function<Product, String> extractor;

    IndexField(double weight, Function<Product, String> extractor) {
        this.weight = weight;
        this.extractor = extractor;
    }

    public double getWeight() {
        return weight;
    }

    public String textOf(Product product) {
        return extractor.apply(product);
    }
}
